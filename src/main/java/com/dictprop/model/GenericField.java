package com.dictprop.model;

import com.dictprop.store.StoredValues;

/**
 * Untyped field: holds any value the store accepts.
 */
public class GenericField extends Field<Object> {

    public GenericField(String name) {
        this(name, true);
    }

    public GenericField(String name, boolean indexed) {
        super(name, indexed);
    }

    @Override
    public Object coerce(Object value) {
        return StoredValues.normalize(value);
    }

    @Override
    public Object toStorage(Object value) {
        return value;
    }

    @Override
    public Object fromStorage(Object stored) {
        return stored;
    }
}
