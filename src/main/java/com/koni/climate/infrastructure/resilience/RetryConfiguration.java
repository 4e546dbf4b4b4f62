package com.koni.climate.infrastructure.resilience;

import com.koni.climate.infrastructure.config.ClimateProperties;
import com.koni.climate.infrastructure.observability.IngestionMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the shared retry policy.
 * One policy instance serves the reading store, the device registry and vendor polling;
 * each call site supplies its own {@link ErrorClassifier}.
 */
@Slf4j
@Configuration
public class RetryConfiguration {

    /**
     * Creates the RetrySettings from {@code climate.retry.*}.
     *
     * Defaults:
     * - 3 attempts in total
     * - 1s base delay, doubled per attempt
     * - 30s cap on any single wait
     *
     * @param properties bound configuration
     * @return validated retry settings
     */
    @Bean
    public RetrySettings retrySettings(ClimateProperties properties) {
        ClimateProperties.Retry retry = properties.getRetry();
        RetrySettings settings = new RetrySettings(retry.getMaxAttempts(), retry.getBaseDelay(), retry.getMaxDelay());
        log.info("Retry policy: maxAttempts={}, baseDelay={}, maxDelay={}",
                settings.getMaxAttempts(), settings.getBaseDelay(), settings.getMaxDelay());
        return settings;
    }

    /**
     * Creates the RetryPolicy and registers the ingestion metrics as a listener,
     * so every retry and exhaustion is counted.
     *
     * @param settings the retry settings
     * @param metrics the ingestion metrics
     * @return RetryPolicy instance
     */
    @Bean
    public RetryPolicy retryPolicy(RetrySettings settings, IngestionMetrics metrics) {
        RetryPolicy policy = new RetryPolicy(settings);
        policy.addListener(metrics);
        return policy;
    }
}
