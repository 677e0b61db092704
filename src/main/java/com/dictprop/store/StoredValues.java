package com.dictprop.store;

import java.time.Instant;
import java.util.Collections;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Normalises values to the kinds the store can persist and index.
 */
public final class StoredValues {

    private StoredValues() {
    }

    /**
     * Converts {@code value} to its stored form. Integral numbers become
     * {@link Long}, floating point numbers {@link Double}, dates
     * {@link Instant}. A map is accepted as a simple structured record as long
     * as its own values are scalars.
     *
     * @throws IllegalArgumentException if the value cannot be stored
     */
    public static Object normalize(Object value) {
        return normalize(value, true);
    }

    /** Normalises a value that must not be a structured record. */
    public static Object normalizeScalar(Object value) {
        return normalize(value, false);
    }

    private static Object normalize(Object value, boolean allowStructured) {
        if (value == null || value instanceof String || value instanceof Boolean
                || value instanceof Long || value instanceof Double || value instanceof Instant) {
            return value;
        }
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof Float f) {
            return f.doubleValue();
        }
        if (value instanceof Date d) {
            return d.toInstant();
        }
        if (value instanceof Map<?, ?> map) {
            if (!allowStructured) {
                throw new IllegalArgumentException("nested structured values are not supported");
            }
            Map<String, Object> record = new LinkedHashMap<>();
            for (var entry : map.entrySet()) {
                if (!(entry.getKey() instanceof String name)) {
                    throw new IllegalArgumentException("structured value names must be strings, got: " + entry.getKey());
                }
                Expando.checkName(name);
                record.put(name, normalize(entry.getValue(), false));
            }
            return Collections.unmodifiableMap(record);
        }
        throw new IllegalArgumentException("unsupported value type: " + value.getClass().getName());
    }
}
