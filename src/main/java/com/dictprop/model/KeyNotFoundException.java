package com.dictprop.model;

import java.util.NoSuchElementException;

/**
 * Raised when reading or deleting a dictionary key that is not present.
 */
public class KeyNotFoundException extends NoSuchElementException {
    private final String key;

    public KeyNotFoundException(String key) {
        super(key + " not found on DictionaryField value");
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
