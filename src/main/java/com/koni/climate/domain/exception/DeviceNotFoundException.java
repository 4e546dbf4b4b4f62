package com.koni.climate.domain.exception;

/**
 * Exception thrown when an operation names a device id that is not registered.
 */
public class DeviceNotFoundException extends RuntimeException {

    public DeviceNotFoundException(String message) {
        super(message);
    }

    public DeviceNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
