package com.dictprop.model;

import com.dictprop.store.Entity;

/**
 * Checks dictionary keys before they reach the store. Keys share the
 * restrictions of property names: strings, non-empty, and not starting with
 * the prefix the store reserves for its own metadata. The store may still
 * reject a key that passes here.
 */
public final class KeyValidator {

    private KeyValidator() {
    }

    /**
     * @return the key as a string
     * @throws InvalidKeyException if the key is not acceptable
     */
    public static String validate(Object key) {
        if (!(key instanceof String name)) {
            throw new InvalidKeyException("DictionaryField keys must be strings, got: " + key);
        }
        if (name.isEmpty()) {
            throw new InvalidKeyException("DictionaryField keys must not be empty");
        }
        if (name.startsWith(Entity.RESERVED_PREFIX)) {
            throw new InvalidKeyException("DictionaryField keys must not start with '"
                    + Entity.RESERVED_PREFIX + "', got: " + name);
        }
        return name;
    }
}
