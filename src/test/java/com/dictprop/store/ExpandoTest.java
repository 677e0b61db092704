package com.dictprop.store;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class ExpandoTest {

    @Test
    public void testDynamicProperties() {
        Expando expando = new Expando();
        expando.setProperty("count", 3);
        expando.setProperty("when", new Date(0));
        assertEquals(3L, expando.getProperty("count"));
        assertEquals(Instant.EPOCH, expando.getProperty("when"));
        assertEquals(Set.of("count", "when"), expando.propertyNames());

        expando.deleteProperty("count");
        assertFalse(expando.hasProperty("count"));
        MissingPropertyException e = assertThrows(MissingPropertyException.class, () -> expando.getProperty("count"));
        assertEquals("count", e.getProperty());
        assertThrows(MissingPropertyException.class, () -> expando.deleteProperty("count"));
    }

    @Test
    public void testNameConstraints() {
        Expando expando = new Expando();
        assertThrows(IllegalArgumentException.class, () -> expando.setProperty("a.b", 1));
        assertThrows(IllegalArgumentException.class, () -> expando.setProperty("_a", 1));
        assertThrows(IllegalArgumentException.class, () -> expando.setProperty("", 1));
        assertEquals(0, expando.size());
    }

    @Test
    public void testStructuredValues() {
        Expando expando = new Expando();
        expando.setProperty("detail", Map.of("rank", 1, "score", 2.5f));
        assertEquals(Map.of("rank", 1L, "score", 2.5), expando.getProperty("detail"));
        assertThrows(IllegalArgumentException.class, () -> expando.setProperty("deep", Map.of("a", Map.of("b", 1))));
        assertThrows(IllegalArgumentException.class, () -> expando.setProperty("repeated", List.of(1)));
        assertThrows(IllegalArgumentException.class, () -> expando.setProperty("odd", new Object()));
    }

    @Test
    public void testStorageCopyIsDetached() {
        Expando expando = Expando.fromStorage(Map.of("US", 1L));
        Map<String, Object> stored = expando.toStorage();
        stored.put("FR", 2L);
        assertFalse(expando.hasProperty("FR"));
    }
}
