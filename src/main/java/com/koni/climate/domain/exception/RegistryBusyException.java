package com.koni.climate.domain.exception;

/**
 * Exception thrown when the registry lock is currently held by another collector.
 * Transient: resolved by retrying.
 */
public class RegistryBusyException extends DeviceRegistryException {

    public RegistryBusyException(String message) {
        super(message);
    }

    public RegistryBusyException(String message, Throwable cause) {
        super(message, cause);
    }
}
