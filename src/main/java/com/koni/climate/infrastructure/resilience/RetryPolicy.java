package com.koni.climate.infrastructure.resilience;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Supplier;

/**
 * Bounded exponential-backoff executor shared by the reading store, the device
 * registry and (outside this module) vendor network calls.
 *
 * Transient failures, as decided by the caller's {@link ErrorClassifier}, are retried
 * up to {@code maxAttempts} invocations in total. Permanent failures propagate at once.
 * When every attempt fails transiently the last failure propagates; it is never swallowed.
 *
 * Each execution builds a resilience4j {@link Retry} so the classifier can differ per call.
 */
@Slf4j
public class RetryPolicy {

    private static final double BACKOFF_MULTIPLIER = 2.0;

    private final RetrySettings settings;
    private final List<RetryListener> listeners = new CopyOnWriteArrayList<>();

    public RetryPolicy(RetrySettings settings) {
        this.settings = settings;
    }

    public RetrySettings getSettings() {
        return settings;
    }

    public void addListener(RetryListener listener) {
        listeners.add(listener);
    }

    /**
     * Runs the operation under this policy.
     *
     * @param operationName name used in logs and listener callbacks
     * @param operation the operation to run
     * @param classifier separates transient from permanent failures
     * @param <T> the result type
     * @return the operation's result
     * @throws RuntimeException the permanent failure, or the last transient failure after exhaustion
     */
    public <T> T execute(String operationName, Supplier<T> operation, ErrorClassifier classifier) {
        Retry retry = Retry.of(operationName, configFor(classifier));
        registerEventListeners(retry);
        T result = retry.executeSupplier(operation);
        // resilience4j publishes no event for a success without retries
        if (retry.getMetrics().getNumberOfSuccessfulCallsWithoutRetryAttempt() > 0) {
            log.debug("Operation '{}' succeeded on attempt 1/{}", operationName, settings.getMaxAttempts());
            listeners.forEach(l -> l.onSuccess(operationName, 1));
        }
        return result;
    }

    /**
     * Runs an operation without a result under this policy.
     */
    public void execute(String operationName, Runnable operation, ErrorClassifier classifier) {
        execute(operationName, () -> {
            operation.run();
            return null;
        }, classifier);
    }

    /**
     * Wait that follows failed attempt {@code attempt} (1-based).
     */
    public Duration delayAfterAttempt(int attempt) {
        long millis = IntervalFunction.ofExponentialBackoff(
                settings.getBaseDelay(), BACKOFF_MULTIPLIER, settings.getMaxDelay()).apply(attempt);
        return Duration.ofMillis(millis);
    }

    private RetryConfig configFor(ErrorClassifier classifier) {
        return RetryConfig.custom()
                .maxAttempts(settings.getMaxAttempts())
                .intervalFunction(IntervalFunction.ofExponentialBackoff(
                        settings.getBaseDelay(), BACKOFF_MULTIPLIER, settings.getMaxDelay()))
                .retryOnException(classifier::isTransient)
                .build();
    }

    private void registerEventListeners(Retry retry) {
        retry.getEventPublisher()
                .onRetry(event -> {
                    Duration wait = event.getWaitInterval();
                    log.warn("Retry attempt {}/{} for '{}' after {}: {}. Retrying in {}ms",
                            event.getNumberOfRetryAttempts(),
                            settings.getMaxAttempts(),
                            event.getName(),
                            errorName(event.getLastThrowable()),
                            errorMessage(event.getLastThrowable()),
                            wait.toMillis());
                    listeners.forEach(l -> l.onRetry(
                            event.getName(), event.getNumberOfRetryAttempts(), wait, event.getLastThrowable()));
                })
                .onSuccess(event -> {
                    log.info("Operation '{}' succeeded on attempt {}/{}",
                            event.getName(), event.getNumberOfRetryAttempts() + 1, settings.getMaxAttempts());
                    listeners.forEach(l -> {
                        l.onSuccessAfterRetry(event.getName(), event.getNumberOfRetryAttempts() + 1);
                        l.onSuccess(event.getName(), event.getNumberOfRetryAttempts() + 1);
                    });
                })
                .onError(event -> {
                    log.error("Retry exhausted for '{}' after {} attempts. Last error: {}: {}",
                            event.getName(),
                            event.getNumberOfRetryAttempts(),
                            errorName(event.getLastThrowable()),
                            errorMessage(event.getLastThrowable()));
                    listeners.forEach(l -> l.onExhausted(
                            event.getName(), event.getNumberOfRetryAttempts(), event.getLastThrowable()));
                })
                .onIgnoredError(event -> {
                    log.debug("Permanent error in '{}', not retrying: {}",
                            event.getName(), errorName(event.getLastThrowable()));
                    listeners.forEach(l -> l.onPermanentFailure(event.getName(), event.getLastThrowable()));
                });
    }

    private static String errorName(Throwable error) {
        return error == null ? "unknown" : error.getClass().getSimpleName();
    }

    private static String errorMessage(Throwable error) {
        return error == null ? "" : error.getMessage();
    }
}
