package com.dictprop.query;

/**
 * Raised while a filter is being built when the requested comparison cannot
 * be expressed against the index. No query work has happened yet when this
 * is thrown.
 */
public class BadFilterException extends RuntimeException {
    public BadFilterException(String message) {
        super(message);
    }
}
