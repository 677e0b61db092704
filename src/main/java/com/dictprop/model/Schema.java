package com.dictprop.model;

import com.dictprop.store.Entity;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fixed set of named fields shared by all entities of one kind.
 */
public final class Schema {
    private final String kind;
    private final Map<String, Field<?>> fields;

    private Schema(String kind, Map<String, Field<?>> fields) {
        this.kind = kind;
        this.fields = Collections.unmodifiableMap(fields);
    }

    public static Schema of(String kind, Field<?>... fields) {
        if (kind == null || kind.isBlank()) {
            throw new IllegalArgumentException("kind must be non-blank");
        }
        Map<String, Field<?>> byName = new LinkedHashMap<>();
        for (Field<?> field : fields) {
            String name = field.getName();
            if (name.startsWith(Entity.RESERVED_PREFIX) || name.indexOf('.') >= 0) {
                throw new IllegalArgumentException("invalid field name for kind " + kind + ": " + name);
            }
            if (byName.putIfAbsent(name, field) != null) {
                throw new IllegalArgumentException("duplicate field " + name + " in kind " + kind);
            }
        }
        return new Schema(kind, byName);
    }

    public String getKind() {
        return kind;
    }

    public Collection<Field<?>> getFields() {
        return fields.values();
    }

    /**
     * @throws IllegalArgumentException if the kind has no such field
     */
    public Field<?> getField(String name) {
        Field<?> field = fields.get(name);
        if (field == null) {
            throw new IllegalArgumentException("kind " + kind + " has no field " + name);
        }
        return field;
    }

    boolean declares(Field<?> field) {
        return fields.get(field.getName()) == field;
    }

    @Override
    public String toString() {
        return "Schema{" + kind + ", " + fields.keySet() + "}";
    }
}
