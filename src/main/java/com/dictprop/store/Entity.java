package com.dictprop.store;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Represents a single schemaless entity stored in the database.
 * Top-level fields listed as unindexed are stored but never indexed.
 */
public class Entity {
    /** Prefix reserved for store metadata; no stored name may start with it. */
    public static final String RESERVED_PREFIX = "_";

    private final String id;
    private final Map<String, Object> fields;
    private final Set<String> unindexedFields;

    public Entity(String id, Map<String, Object> fields) {
        this(id, fields, Collections.emptySet());
    }

    public Entity(String id, Map<String, Object> fields, Set<String> unindexedFields) {
        if (id == null || id.isEmpty()) {
            throw new IllegalArgumentException("entity id must be non-empty");
        }
        this.id = id;
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        this.unindexedFields = Collections.unmodifiableSet(new LinkedHashSet<>(unindexedFields));
    }

    public String getId() {
        return id;
    }

    public Object get(String field) {
        return fields.get(field);
    }

    /**
     * Resolves a dotted path such as {@code clients.US} through nested maps.
     * Returns null when any segment is missing.
     */
    public Object resolve(String path) {
        Object current = fields;
        for (String part : path.split("\\.")) {
            if (current instanceof Map<?, ?> m) {
                current = m.get(part);
            } else {
                return null;
            }
        }
        return current;
    }

    public Map<String, Object> getFields() {
        return fields;
    }

    public Set<String> getUnindexedFields() {
        return unindexedFields;
    }

    public boolean isIndexed(String field) {
        return !unindexedFields.contains(field);
    }

    @Override
    public String toString() {
        return "Entity{" + id + ", " + fields + "}";
    }
}
