package com.dictprop.store;

/**
 * Raised by {@link Expando} when a dynamic property is read or deleted but
 * is not currently set.
 */
public class MissingPropertyException extends RuntimeException {
    private final String property;

    public MissingPropertyException(String property) {
        super("no dynamic property '" + property + "'");
        this.property = property;
    }

    public String getProperty() {
        return property;
    }
}
