package com.koni.climate.domain.exception;

/**
 * Exception thrown when the store schema cannot be created or brought up to date.
 * Fatal at start-up: the process must not proceed and risk writing inconsistent rows.
 */
public class SchemaMigrationException extends StorageException {

    public SchemaMigrationException(String message) {
        super(message);
    }

    public SchemaMigrationException(String message, Throwable cause) {
        super(message, cause);
    }
}
