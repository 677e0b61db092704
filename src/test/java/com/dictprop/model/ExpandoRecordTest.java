package com.dictprop.model;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class ExpandoRecordTest {

    @Test
    public void testSetThenGet() {
        ExpandoRecord record = new ExpandoRecord();
        record.set("US", 7810);
        record.set("label", "top");
        assertEquals(7810L, record.get("US"));
        assertEquals("top", record.get("label"));
        record.set("US", 12.5);
        assertEquals(12.5, record.get("US"));
        assertEquals(2, record.size());
    }

    @Test
    public void testMissingKey() {
        ExpandoRecord record = new ExpandoRecord();
        KeyNotFoundException e = assertThrows(KeyNotFoundException.class, () -> record.get("BE"));
        assertEquals("BE", e.getKey());
        assertThrows(KeyNotFoundException.class, () -> record.delete("BE"));
        assertEquals("fallback", record.get("BE", "fallback"));
    }

    @Test
    public void testDelete() {
        ExpandoRecord record = ExpandoRecord.fromMap(Map.of("US", 1, "FR", 2));
        record.delete("US");
        assertFalse(record.contains("US"));
        assertThrows(KeyNotFoundException.class, () -> record.get("US"));
        assertEquals(Set.of("FR"), record.keys());
    }

    @Test
    public void testKeysReflectSetsAndDeletes() {
        ExpandoRecord record = new ExpandoRecord();
        record.set("a", 1);
        record.set("b", 2);
        record.set("c", 3);
        record.delete("b");
        record.set("d", 4);
        record.set("a", 5);
        assertEquals(Set.of("a", "c", "d"), record.keys());
    }

    @Test
    public void testContainsNeverThrows() {
        ExpandoRecord record = ExpandoRecord.fromMap(Map.of("FR", 7));
        assertTrue(record.contains("FR"));
        assertFalse(record.contains("_FR"));
        assertFalse(record.contains(""));
        assertFalse(record.contains(null));
        assertFalse(record.contains(7));
    }

    @Test
    public void testInvalidKeysRejectedBeforeMutation() {
        ExpandoRecord record = new ExpandoRecord();
        assertThrows(InvalidKeyException.class, () -> record.set("_meta", 1));
        assertThrows(InvalidKeyException.class, () -> record.set("", 1));
        assertThrows(InvalidKeyException.class, () -> record.delete("_meta"));
        assertThrows(InvalidKeyException.class, () -> record.get("_meta"));
        assertTrue(record.isEmpty());
    }

    @Test
    public void testStoreConstraintsPropagate() {
        ExpandoRecord record = new ExpandoRecord();
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> record.set("a.b", 1));
        assertFalse(e instanceof InvalidKeyException);
        assertThrows(IllegalArgumentException.class, () -> record.set("list", java.util.List.of(1, 2)));
        assertTrue(record.isEmpty());
    }

    @Test
    public void testItemsIsRestartable() {
        ExpandoRecord record = ExpandoRecord.fromMap(Map.of("FR", 5, "BE", 1));
        Iterable<Map.Entry<String, Object>> items = record.items();
        for (int pass = 0; pass < 2; pass++) {
            Map<String, Object> seen = new HashMap<>();
            for (Map.Entry<String, Object> item : items) {
                seen.put(item.getKey(), item.getValue());
            }
            assertEquals(Map.of("FR", 5L, "BE", 1L), seen);
        }
    }

    @Test
    public void testIteratorIsDetachedFromLaterMutations() {
        ExpandoRecord record = ExpandoRecord.fromMap(Map.of("FR", 5, "BE", 1));
        Iterator<String> keys = record.iterator();
        record.set("US", 3);
        int count = 0;
        while (keys.hasNext()) {
            keys.next();
            count++;
        }
        assertEquals(2, count);
    }

    @Test
    public void testEqualityFollowsEntries() {
        ExpandoRecord a = ExpandoRecord.fromMap(Map.of("FR", 5));
        ExpandoRecord b = new ExpandoRecord();
        b.set("FR", 5L);
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertEquals(Map.of("FR", 5L), a.toMap());
    }
}
