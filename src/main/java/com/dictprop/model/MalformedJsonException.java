package com.dictprop.model;

/**
 * Raised when a stored {@link CompactJsonField} value is not valid JSON.
 */
public class MalformedJsonException extends RuntimeException {
    public MalformedJsonException(String message, Throwable cause) {
        super(message, cause);
    }
}
