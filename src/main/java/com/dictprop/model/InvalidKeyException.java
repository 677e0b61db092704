package com.dictprop.model;

/**
 * Raised when a dictionary key is not a non-empty string or starts with the
 * reserved metadata prefix.
 */
public class InvalidKeyException extends IllegalArgumentException {
    public InvalidKeyException(String message) {
        super(message);
    }
}
