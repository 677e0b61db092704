package com.dictprop.store;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;

/**
 * Ordering classes of indexable values. Values of different kinds never
 * compare equal, and kinds sort in declaration order.
 */
public enum ValueKind {
    NUMBER,
    TIMESTAMP,
    BOOLEAN,
    TEXT;

    /** Returns the kind of {@code value}, or null if it cannot be indexed. */
    public static ValueKind of(Object value) {
        if (value instanceof Number) {
            return NUMBER;
        }
        if (value instanceof Instant) {
            return TIMESTAMP;
        }
        if (value instanceof Boolean) {
            return BOOLEAN;
        }
        if (value instanceof String) {
            return TEXT;
        }
        return null;
    }

    /**
     * Maps a value to the key stored in the index. Integral numbers become
     * {@link Long} and floating point numbers {@link Double}; the two are
     * compared exactly by {@link #compare(Object, Object)}.
     */
    public static Comparable indexKey(Object value) {
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof Float f) {
            return f.doubleValue();
        }
        return (Comparable) value;
    }

    /** Total order across kinds: kind first, then natural order inside the kind. */
    public static int compare(Object a, Object b) {
        ValueKind ka = of(a);
        ValueKind kb = of(b);
        if (ka != kb) {
            return Integer.compare(ka == null ? -1 : ka.ordinal(), kb == null ? -1 : kb.ordinal());
        }
        if (ka == null) {
            return 0;
        }
        if (ka == NUMBER) {
            return compareNumbers((Number) a, (Number) b);
        }
        Comparable ca = indexKey(a);
        Comparable cb = indexKey(b);
        return ca.compareTo(cb);
    }

    /**
     * Exact numeric order: 7 equals 7.0, and longs beyond 2^53 stay distinct.
     * NaN sorts above positive infinity.
     */
    static int compareNumbers(Number a, Number b) {
        if (isIntegral(a) && isIntegral(b)) {
            return Long.compare(a.longValue(), b.longValue());
        }
        BigDecimal x = exact(a);
        BigDecimal y = exact(b);
        if (x != null && y != null) {
            return x.compareTo(y);
        }
        return Double.compare(a.doubleValue(), b.doubleValue());
    }

    private static boolean isIntegral(Number n) {
        return n instanceof Long || n instanceof Integer || n instanceof Short || n instanceof Byte;
    }

    private static BigDecimal exact(Number n) {
        if (isIntegral(n)) {
            return BigDecimal.valueOf(n.longValue());
        }
        if (n instanceof BigDecimal d) {
            return d;
        }
        if (n instanceof BigInteger i) {
            return new BigDecimal(i);
        }
        double d = n.doubleValue();
        return Double.isFinite(d) ? new BigDecimal(d) : null;
    }
}
