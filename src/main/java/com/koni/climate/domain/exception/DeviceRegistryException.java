package com.koni.climate.domain.exception;

/**
 * Exception thrown when the device registry document cannot be read or written.
 */
public class DeviceRegistryException extends RuntimeException {

    public DeviceRegistryException(String message) {
        super(message);
    }

    public DeviceRegistryException(String message, Throwable cause) {
        super(message, cause);
    }
}
