package com.koni.climate.domain.exception;

/**
 * Exception thrown when a vendor payload lacks a usable primary temperature
 * (or the metadata needed to identify the device). The reading is rejected;
 * the collector logs it and continues with its other devices.
 */
public class MalformedPayloadException extends RuntimeException {

    public MalformedPayloadException(String message) {
        super(message);
    }

    public MalformedPayloadException(String message, Throwable cause) {
        super(message, cause);
    }
}
