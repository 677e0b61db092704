package com.dictprop.store;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * A record whose properties are declared at runtime. This is the store's
 * dynamic sub-field primitive: every property becomes a named child of the
 * owning field once persisted, indexed like any regular field.
 */
public class Expando {
    private final Map<String, Object> properties = new LinkedHashMap<>();

    public Expando() {
    }

    /** Rebuilds an expando from its stored representation. */
    public static Expando fromStorage(Map<?, ?> stored) {
        Expando expando = new Expando();
        for (var entry : stored.entrySet()) {
            expando.setProperty(String.valueOf(entry.getKey()), entry.getValue());
        }
        return expando;
    }

    public void setProperty(String name, Object value) {
        checkName(name);
        properties.put(name, StoredValues.normalize(value));
    }

    public Object getProperty(String name) {
        if (!properties.containsKey(name)) {
            throw new MissingPropertyException(name);
        }
        return properties.get(name);
    }

    public boolean hasProperty(String name) {
        return properties.containsKey(name);
    }

    public void deleteProperty(String name) {
        if (!properties.containsKey(name)) {
            throw new MissingPropertyException(name);
        }
        properties.remove(name);
    }

    public Set<String> propertyNames() {
        return Collections.unmodifiableSet(properties.keySet());
    }

    public int size() {
        return properties.size();
    }

    /** Copy of the properties, suitable for storing inside an {@link Entity}. */
    public Map<String, Object> toStorage() {
        Map<String, Object> copy = new LinkedHashMap<>();
        for (var entry : properties.entrySet()) {
            Object value = entry.getValue();
            copy.put(entry.getKey(), value instanceof Map<?, ?> record ? new LinkedHashMap<>(record) : value);
        }
        return copy;
    }

    /**
     * @throws IllegalArgumentException if the store cannot hold a property with this name
     */
    public static void checkName(String name) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("property name must be non-empty");
        }
        if (name.startsWith(Entity.RESERVED_PREFIX)) {
            throw new IllegalArgumentException("property name must not start with '" + Entity.RESERVED_PREFIX + "', got: " + name);
        }
        if (name.indexOf('.') >= 0) {
            throw new IllegalArgumentException("property name must not contain '.', got: " + name);
        }
    }
}
