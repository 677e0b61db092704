package com.dictprop.model;

import com.dictprop.store.Entity;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * One entity instance of a {@link Schema}. Fields start unset; values are
 * converted by their field on assignment. Two models are equal when they
 * have the same kind, id and field values.
 */
public class Model {
    private final Schema schema;
    private final Map<String, Object> values = new LinkedHashMap<>();
    private String id;

    public Model(Schema schema) {
        this.schema = Objects.requireNonNull(schema, "schema");
    }

    /** Creates a model with the given field values, keyed by field name. */
    public Model(Schema schema, Map<String, ?> initialValues) {
        this(schema);
        initialValues.forEach((name, value) -> set(schema.getField(name), value));
    }

    static Model fromEntity(Schema schema, Entity entity) {
        Model model = new Model(schema);
        model.id = entity.getId();
        for (Field<?> field : schema.getFields()) {
            Object value = field.fromStorage(entity.get(field.getName()));
            if (value != null) {
                model.values.put(field.getName(), value);
            }
        }
        return model;
    }

    public Schema getSchema() {
        return schema;
    }

    /** Id assigned by the datastore on first put, null before. */
    public String getId() {
        return id;
    }

    void setId(String id) {
        this.id = id;
    }

    /** Returns the live value, or null when the field is unset. */
    @SuppressWarnings("unchecked")
    public <T> T get(Field<T> field) {
        checkDeclared(field);
        return (T) values.get(field.getName());
    }

    public void set(Field<?> field, Object value) {
        checkDeclared(field);
        Object coerced = field.coerce(value);
        if (coerced == null) {
            values.remove(field.getName());
        } else {
            values.put(field.getName(), coerced);
        }
    }

    public void unset(Field<?> field) {
        checkDeclared(field);
        values.remove(field.getName());
    }

    public boolean isSet(Field<?> field) {
        checkDeclared(field);
        return values.containsKey(field.getName());
    }

    /**
     * Plain export of every field of the schema. Unset fields map to null and
     * a dictionary field exports as a plain map.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> export = new LinkedHashMap<>();
        for (Field<?> field : schema.getFields()) {
            export.put(field.getName(), exportValue(field, values.get(field.getName())));
        }
        return export;
    }

    Entity toEntity() {
        Map<String, Object> stored = new LinkedHashMap<>();
        Set<String> unindexed = new LinkedHashSet<>();
        for (Field<?> field : schema.getFields()) {
            stored.put(field.getName(), storeValue(field, values.get(field.getName())));
            if (!field.isIndexed()) {
                unindexed.add(field.getName());
            }
        }
        return new Entity(id, stored, unindexed);
    }

    @SuppressWarnings("unchecked")
    private static <T> Object storeValue(Field<T> field, Object value) {
        return value == null ? null : field.toStorage((T) value);
    }

    @SuppressWarnings("unchecked")
    private static <T> Object exportValue(Field<T> field, Object value) {
        return value == null ? null : field.export((T) value);
    }

    private void checkDeclared(Field<?> field) {
        if (!schema.declares(field)) {
            throw new IllegalArgumentException(field + " is not declared by kind " + schema.getKind());
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Model other)) return false;
        return schema.getKind().equals(other.schema.getKind())
                && Objects.equals(id, other.id)
                && toMap().equals(other.toMap());
    }

    @Override
    public int hashCode() {
        return Objects.hash(schema.getKind(), id, toMap());
    }

    @Override
    public String toString() {
        return schema.getKind() + "(" + id + ", " + toMap() + ")";
    }
}
