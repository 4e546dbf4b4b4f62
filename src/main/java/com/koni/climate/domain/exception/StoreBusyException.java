package com.koni.climate.domain.exception;

/**
 * Exception thrown when the store is temporarily locked by a concurrent writer.
 * This is the transient case of the storage taxonomy: the retry policy retries it
 * and it only reaches callers once every attempt is exhausted.
 */
public class StoreBusyException extends StorageException {

    public StoreBusyException(String message) {
        super(message);
    }

    public StoreBusyException(String message, Throwable cause) {
        super(message, cause);
    }
}
