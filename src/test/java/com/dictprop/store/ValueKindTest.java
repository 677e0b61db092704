package com.dictprop.store;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

public class ValueKindTest {

    @Test
    public void testKinds() {
        assertEquals(ValueKind.NUMBER, ValueKind.of(1));
        assertEquals(ValueKind.NUMBER, ValueKind.of(1.5));
        assertEquals(ValueKind.TIMESTAMP, ValueKind.of(Instant.EPOCH));
        assertEquals(ValueKind.BOOLEAN, ValueKind.of(true));
        assertEquals(ValueKind.TEXT, ValueKind.of("x"));
        assertNull(ValueKind.of(new Object()));
    }

    @Test
    public void testOrdering() {
        assertEquals(0, ValueKind.compare(7, 7.0));
        assertTrue(ValueKind.compare(2, 10L) < 0);
        assertTrue(ValueKind.compare(1000, Instant.EPOCH) < 0);
        assertTrue(ValueKind.compare(true, "a") < 0);
        assertTrue(ValueKind.compare("b", "a") > 0);
    }

    @Test
    public void testOrderingIsExactForLargeNumbers() {
        assertTrue(ValueKind.compare(9007199254740993L, 9007199254740992L) > 0);
        assertTrue(ValueKind.compare(9007199254740993L, 9007199254740992.0) > 0);
        assertEquals(0, ValueKind.compare(9007199254740992L, 9007199254740992.0));
        assertTrue(ValueKind.compare(Long.MAX_VALUE, Double.POSITIVE_INFINITY) < 0);
    }
}
