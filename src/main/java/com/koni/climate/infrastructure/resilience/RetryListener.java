package com.koni.climate.infrastructure.resilience;

import java.time.Duration;

/**
 * Callback view of a {@link RetryPolicy} execution.
 * All methods default to no-ops so listeners implement only what they need.
 */
public interface RetryListener {

    /**
     * A transient failure occurred and another attempt follows after {@code wait}.
     *
     * @param operation the operation name
     * @param attempt the number of the attempt that failed, starting at 1
     * @param wait the delay before the next attempt
     * @param error the transient failure
     */
    default void onRetry(String operation, int attempt, Duration wait, Throwable error) {
    }

    /**
     * The operation succeeded, on the first attempt or after retries.
     *
     * @param operation the operation name
     * @param attempts the number of attempts made, 1 when nothing was retried
     */
    default void onSuccess(String operation, int attempts) {
    }

    /**
     * The operation succeeded after at least one retry.
     * Called before {@link #onSuccess(String, int)} for the same execution.
     */
    default void onSuccessAfterRetry(String operation, int attempts) {
    }

    /**
     * Every attempt failed transiently; {@code error} is propagated to the caller.
     */
    default void onExhausted(String operation, int attempts, Throwable error) {
    }

    /**
     * A permanent failure occurred and was propagated without retrying.
     */
    default void onPermanentFailure(String operation, Throwable error) {
    }
}
