package com.koni.climate.infrastructure.observability;

import com.koni.climate.infrastructure.resilience.RetryListener;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Component for tracking ingestion metrics.
 * Provides counters per ingestion outcome and a timer around the whole pipeline.
 * Also listens to the retry policy so store and registry contention is visible.
 */
@Slf4j
@Component
public class IngestionMetrics implements RetryListener {

    private final Counter readingsReceived;
    private final Counter readingsInserted;
    private final Counter duplicatesSkipped;
    private final Counter anomaliesFlagged;
    private final Counter readingsRejected;
    private final Counter readingsFailed;
    private final Counter retries;
    private final Counter retriesExhausted;
    private final Timer ingestTime;

    public IngestionMetrics(MeterRegistry registry) {
        this.readingsReceived = Counter.builder("climate.readings.received.total")
                .description("Total readings handed to the ingestion pipeline")
                .register(registry);

        this.readingsInserted = Counter.builder("climate.readings.inserted.total")
                .description("Total readings committed to the store")
                .register(registry);

        this.duplicatesSkipped = Counter.builder("climate.readings.duplicates.total")
                .description("Total readings skipped because (device, timestamp) was already stored")
                .register(registry);

        this.anomaliesFlagged = Counter.builder("climate.readings.anomalies.total")
                .description("Total readings stored with an out-of-range temperature")
                .register(registry);

        this.readingsRejected = Counter.builder("climate.readings.rejected.total")
                .description("Total payloads rejected as malformed or invalid")
                .register(registry);

        this.readingsFailed = Counter.builder("climate.readings.failed.total")
                .description("Total readings that could not be stored")
                .register(registry);

        this.retries = Counter.builder("climate.store.retries.total")
                .description("Total retries after transient store or registry contention")
                .register(registry);

        this.retriesExhausted = Counter.builder("climate.store.retries.exhausted.total")
                .description("Total operations that stayed contended for every attempt")
                .register(registry);

        this.ingestTime = Timer.builder("climate.ingest.time")
                .description("Time to normalize, validate, name and store one reading")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }

    public void recordReceived() {
        readingsReceived.increment();
    }

    public void recordInserted() {
        readingsInserted.increment();
    }

    public void recordDuplicate() {
        duplicatesSkipped.increment();
        log.debug("Duplicate reading counter incremented");
    }

    public void recordAnomaly() {
        anomaliesFlagged.increment();
    }

    public void recordRejected() {
        readingsRejected.increment();
    }

    public void recordFailed() {
        readingsFailed.increment();
    }

    /**
     * Record the time taken by one ingestion.
     *
     * @param operation The operation to time
     * @param <T> The return type of the operation
     * @return The result of the operation
     */
    public <T> T recordIngestTime(Supplier<T> operation) {
        return ingestTime.record(operation);
    }

    @Override
    public void onRetry(String operation, int attempt, Duration wait, Throwable error) {
        retries.increment();
    }

    @Override
    public void onExhausted(String operation, int attempts, Throwable error) {
        retriesExhausted.increment();
    }
}
