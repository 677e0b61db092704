package com.dictprop.model;

import com.dictprop.store.Expando;
import com.dictprop.store.MissingPropertyException;

import java.util.AbstractMap;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * {@link DynamicRecord} backed by the store's {@link Expando}: every entry
 * is a dynamic property of the expando.
 */
public class ExpandoRecord implements DynamicRecord {
    private final Expando expando;

    public ExpandoRecord() {
        this(new Expando());
    }

    private ExpandoRecord(Expando expando) {
        this.expando = expando;
    }

    /** Builds a record from a plain mapping, validating every key. */
    public static ExpandoRecord fromMap(Map<?, ?> entries) {
        ExpandoRecord record = new ExpandoRecord();
        for (var entry : entries.entrySet()) {
            record.set(KeyValidator.validate(entry.getKey()), entry.getValue());
        }
        return record;
    }

    /** Re-hydrates a record from the sub-fields loaded from storage. */
    static ExpandoRecord fromStorage(Map<?, ?> stored) {
        return new ExpandoRecord(Expando.fromStorage(stored));
    }

    @Override
    public Object get(String key) {
        String name = KeyValidator.validate(key);
        try {
            return expando.getProperty(name);
        } catch (MissingPropertyException e) {
            throw new KeyNotFoundException(name);
        }
    }

    @Override
    public Object get(String key, Object defaultValue) {
        String name = KeyValidator.validate(key);
        return expando.hasProperty(name) ? expando.getProperty(name) : defaultValue;
    }

    @Override
    public void set(String key, Object value) {
        expando.setProperty(KeyValidator.validate(key), value);
    }

    @Override
    public void delete(String key) {
        // lookup first so an absent key reports as KeyNotFoundException
        get(key);
        expando.deleteProperty(key);
    }

    @Override
    public boolean contains(Object key) {
        return key instanceof String name && expando.hasProperty(name);
    }

    @Override
    public Set<String> keys() {
        return new LinkedHashSet<>(expando.propertyNames());
    }

    @Override
    public Iterator<String> iterator() {
        return keys().iterator();
    }

    @Override
    public Iterable<Map.Entry<String, Object>> items() {
        return () -> keys().stream()
                .<Map.Entry<String, Object>>map(key -> new AbstractMap.SimpleImmutableEntry<>(key, get(key)))
                .iterator();
    }

    @Override
    public int size() {
        return expando.size();
    }

    @Override
    public boolean isEmpty() {
        return expando.size() == 0;
    }

    @Override
    public Map<String, Object> toMap() {
        return expando.toStorage();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DynamicRecord other)) return false;
        return toMap().equals(other.toMap());
    }

    @Override
    public int hashCode() {
        return toMap().hashCode();
    }

    @Override
    public String toString() {
        return toMap().toString();
    }
}
