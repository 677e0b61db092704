package com.dictprop.model;

import com.dictprop.query.BadFilterException;
import com.dictprop.query.QueryExpression;
import com.dictprop.query.QueryExpression.Operator;
import com.dictprop.store.Expando;

import java.util.Map;

/**
 * A field storing pairs of (key, value). Each key becomes a sub-field of the
 * entity, stored and indexed like a regular field of its value's type.
 *
 * <p>Values can be numbers, text, timestamps, booleans, or a simple record
 * (a map of those), and may differ in type from key to key.
 *
 * <p>Each value is indexed separately: a value can only be queried after
 * naming its key, through {@link #atKey(String)}. Querying the set of keys
 * or filtering across several keys is not supported. The only filter
 * allowed on the field itself is {@code eq(null)}, which matches entities
 * where the field was never assigned. An assigned but empty dictionary does
 * not match it.
 *
 * <pre>{@code
 * DictionaryField clients = new DictionaryField("clients");
 * Schema brandStats = Schema.of("BrandStats", new GenericField("brandName"), clients);
 *
 * Model stats = new Model(brandStats, Map.of("clients", Map.of("US", 4)));
 * stats.get(clients).set("FR", 5);
 * long us = (Long) stats.get(clients).get("US");
 *
 * datastore.query(brandStats).filter(clients.atKey("FR").eq(0)).fetch(10);
 * datastore.query(brandStats).order(clients.atKey("US").desc()).get();
 * }</pre>
 */
public class DictionaryField extends Field<DynamicRecord> {

    public DictionaryField(String name) {
        this(name, true);
    }

    public DictionaryField(String name, boolean indexed) {
        super(name, indexed);
    }

    /**
     * Builds a field reference to filter or order on one key. Relies on the
     * store addressing dynamic sub-fields by the path {@code <name>.<key>},
     * so a key the store could not hold (one containing {@code .}) is
     * rejected rather than aliased onto a nested path.
     *
     * @throws InvalidKeyException if the key is malformed
     * @throws IllegalArgumentException if the store rejects the key
     */
    public GenericField atKey(String key) {
        String name = KeyValidator.validate(key);
        Expando.checkName(name);
        return new GenericField(getName() + "." + name, isIndexed());
    }

    @Override
    public QueryExpression filter(Operator op, Object value) {
        if (op == Operator.EQ && value == null) {
            return super.filter(op, null);
        }
        throw new BadFilterException("DictionaryField cannot be used directly as filter except with eq(null)");
    }

    @Override
    protected Order order(boolean descending) {
        throw new BadFilterException("DictionaryField cannot be used directly for ordering, order by atKey(key)");
    }

    /**
     * Accepts a {@link DynamicRecord}, adopted as is, or a plain map whose
     * entries are copied into a new record.
     */
    @Override
    public DynamicRecord coerce(Object value) {
        if (value == null || value instanceof DynamicRecord) {
            return (DynamicRecord) value;
        }
        if (value instanceof Map<?, ?> map) {
            return ExpandoRecord.fromMap(map);
        }
        throw new IllegalArgumentException("DictionaryField " + getName()
                + " expects a map or DynamicRecord, got: " + value.getClass().getName());
    }

    @Override
    public Object toStorage(DynamicRecord value) {
        return value == null ? null : value.toMap();
    }

    @Override
    public DynamicRecord fromStorage(Object stored) {
        if (stored == null) {
            return null;
        }
        if (stored instanceof Map<?, ?> map) {
            return ExpandoRecord.fromStorage(map);
        }
        throw new IllegalStateException("DictionaryField " + getName()
                + " holds a non-map stored value of type " + stored.getClass().getName());
    }

    @Override
    public Object export(DynamicRecord value) {
        return value == null ? null : value.toMap();
    }
}
