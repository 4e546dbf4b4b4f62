package com.koni.climate.domain.exception;

/**
 * Exception thrown when a request to the read API or a command does not meet its rules.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
