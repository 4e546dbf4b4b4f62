package com.koni.climate.infrastructure.resilience;

import com.koni.climate.domain.exception.RegistryBusyException;
import com.koni.climate.domain.exception.StoreBusyException;

import java.io.UncheckedIOException;

/**
 * Decides whether a failure is worth retrying.
 */
@FunctionalInterface
public interface ErrorClassifier {

    enum ErrorClass {
        /** Contention that may clear on its own, e.g. a locked store. */
        TRANSIENT,
        /** Structural failure; retrying will not help. */
        PERMANENT
    }

    ErrorClass classify(Throwable error);

    default boolean isTransient(Throwable error) {
        return classify(error) == ErrorClass.TRANSIENT;
    }

    /**
     * Classifier for reading store operations: only a busy store is transient.
     */
    static ErrorClassifier storage() {
        return error -> error instanceof StoreBusyException ? ErrorClass.TRANSIENT : ErrorClass.PERMANENT;
    }

    /**
     * Classifier for registry operations: only a held registry lock is transient.
     */
    static ErrorClassifier registry() {
        return error -> error instanceof RegistryBusyException ? ErrorClass.TRANSIENT : ErrorClass.PERMANENT;
    }

    /**
     * Classifier for vendor polling: I/O failures (timeouts, resets) are transient.
     */
    static ErrorClassifier network() {
        return error -> error instanceof UncheckedIOException ? ErrorClass.TRANSIENT : ErrorClass.PERMANENT;
    }
}
