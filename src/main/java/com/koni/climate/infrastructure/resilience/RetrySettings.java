package com.koni.climate.infrastructure.resilience;

import lombok.Getter;

import java.time.Duration;

/**
 * Bounded exponential backoff parameters.
 * Attempt n (n >= 1) that fails transiently is followed by a wait of
 * {@code baseDelay * 2^(n-1)}, capped at {@code maxDelay}.
 */
@Getter
public class RetrySettings {

    private final int maxAttempts;
    private final Duration baseDelay;
    private final Duration maxDelay;

    public RetrySettings(int maxAttempts, Duration baseDelay, Duration maxDelay) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, was " + maxAttempts);
        }
        if (baseDelay == null || baseDelay.toMillis() < 1) {
            throw new IllegalArgumentException("baseDelay must be at least 1ms");
        }
        if (maxDelay == null || maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must not be shorter than baseDelay");
        }
        this.maxAttempts = maxAttempts;
        this.baseDelay = baseDelay;
        this.maxDelay = maxDelay;
    }

    /**
     * Three attempts, waiting 1s then 2s.
     */
    public static RetrySettings defaults() {
        return new RetrySettings(3, Duration.ofSeconds(1), Duration.ofSeconds(30));
    }
}
