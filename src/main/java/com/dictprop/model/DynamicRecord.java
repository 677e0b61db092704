package com.dictprop.model;

import java.util.Map;
import java.util.Set;

/**
 * The value of a {@link DictionaryField}: a mapping from validated string
 * keys to stored values, where each key is a dynamic sub-field of the owning
 * entity. Iterating the record yields its keys. No ordering of keys is
 * guaranteed, in particular not across reloads.
 */
public interface DynamicRecord extends Iterable<String> {

    /**
     * @throws InvalidKeyException if the key is malformed
     * @throws KeyNotFoundException if the key is absent
     */
    Object get(String key);

    /** Like {@link #get(String)} but returns {@code defaultValue} for an absent key. */
    Object get(String key, Object defaultValue);

    /** Inserts or replaces the value stored at {@code key}. */
    void set(String key, Object value);

    /**
     * @throws KeyNotFoundException if the key is absent
     */
    void delete(String key);

    /** Membership test. Never throws, a malformed key is simply absent. */
    boolean contains(Object key);

    Set<String> keys();

    /** Key/value pairs, one per present key. Each call starts a fresh pass. */
    Iterable<Map.Entry<String, Object>> items();

    int size();

    boolean isEmpty();

    /** Plain copy of the entries, as used for export. */
    Map<String, Object> toMap();
}
