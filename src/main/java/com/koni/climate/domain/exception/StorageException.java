package com.koni.climate.domain.exception;

/**
 * Exception thrown when the reading store fails permanently for one operation,
 * e.g. a constraint other than the (device_id, timestamp) uniqueness is violated.
 * Retrying the same operation is not expected to help.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
