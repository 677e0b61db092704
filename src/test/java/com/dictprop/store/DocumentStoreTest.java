package com.dictprop.store;

import com.dictprop.query.QueryExpression;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

public class DocumentStoreTest {
    @Test
    public void testStoreQueryAndPersistence(@TempDir Path tempDir) {
        DocumentStore store = new DocumentStore(tempDir);
        store.put(new Entity("1", Map.of(
                "age", 30L,
                "name", "Alice",
                "address", Map.of("city", "Belgrade"))));
        store.put(new Entity("2", Map.of("age", 25L, "name", "Bob")));
        store.put(new Entity("3", Map.of("age", 40L, "name", "Carol")));

        List<Entity> olderThan29 = store.query(QueryExpression.field("age", QueryExpression.Operator.GT, 29));
        assertEquals(2, olderThan29.size());

        List<Entity> belgrade = store.query(QueryExpression.field("address.city", QueryExpression.Operator.EQ, "Belgrade"));
        assertEquals(1, belgrade.size());

        List<Entity> bob = store.query(QueryExpression.and(
                QueryExpression.field("age", QueryExpression.Operator.LTE, 35),
                QueryExpression.not(QueryExpression.field("name", QueryExpression.Operator.EQ, "Alice"))));
        assertEquals(1, bob.size());
        assertEquals("Bob", bob.get(0).get("name"));

        store.put(new Entity("1", Map.of("age", 31L, "name", "Alice")));
        assertTrue(store.query(QueryExpression.field("address.city", QueryExpression.Operator.EQ, "Belgrade")).isEmpty());
        assertEquals(List.of("2", "3"), ids(store.query(QueryExpression.isNull("address"))));

        store.delete("2");
        store.saveSnapshot();
        DocumentStore reloaded = new DocumentStore(tempDir);
        assertNull(reloaded.get("2"));
        assertEquals(2, reloaded.findAll().size());

        reloaded.put(new Entity("1", Map.of("age", 33L, "name", "Alice")));
        DocumentStore reloadedAgain = new DocumentStore(tempDir);
        assertEquals(33L, reloadedAgain.get("1").get("age"));
        assertEquals(1, reloadedAgain.query(QueryExpression.field("age", QueryExpression.Operator.EQ, 33)).size());
    }

    @Test
    public void testResultsAreOrderedById() {
        DocumentStore store = new DocumentStore();
        store.put(new Entity("b", Map.of("x", 1L)));
        store.put(new Entity("c", Map.of("x", 1L)));
        store.put(new Entity("a", Map.of("x", 1L)));
        assertEquals(List.of("a", "b", "c"), ids(store.query(QueryExpression.all())));
        assertEquals(3, store.size());
    }

    @Test
    public void testUnindexedFieldsAreNotSearchable() {
        DocumentStore store = new DocumentStore();
        store.put(new Entity("1", Map.of("blob", "{\"a\":1}", "name", "x"), Set.of("blob")));
        assertTrue(store.query(QueryExpression.field("blob", QueryExpression.Operator.EQ, "{\"a\":1}")).isEmpty());
        assertEquals(1, store.query(QueryExpression.field("name", QueryExpression.Operator.EQ, "x")).size());
        assertEquals("{\"a\":1}", store.get("1").get("blob"));
    }

    @Test
    public void testRejectsNullArguments() {
        DocumentStore store = new DocumentStore();
        assertThrows(IllegalArgumentException.class, () -> store.put(null));
        assertThrows(IllegalArgumentException.class, () -> store.delete(null));
        assertThrows(IllegalArgumentException.class, () -> store.query(null));
        assertNull(store.get(null));
    }

    private static List<String> ids(List<Entity> entities) {
        List<String> ids = new ArrayList<>();
        entities.forEach(e -> ids.add(e.getId()));
        return ids;
    }
}
