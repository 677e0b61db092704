package com.dictprop.persistence;

import com.dictprop.store.Entity;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class PersistenceManagerTest {

    @Test
    public void testWalReplayKeepsValueKinds(@TempDir Path tempDir) throws IOException {
        PersistenceManager persistence = new PersistenceManager(tempDir);
        Instant when = Instant.parse("2020-01-02T03:04:05Z");
        persistence.appendPut(new Entity("1", Map.of(
                "clients", Map.of("US", 7L, "ratio", 1.0, "when", when, "ok", true),
                "blob", "{\"a\":1}"), Set.of("blob")));
        persistence.appendPut(new Entity("2", Map.of("name", "gone")));
        persistence.appendDelete("2");

        Map<String, Entity> loaded = new PersistenceManager(tempDir).load();
        assertEquals(Set.of("1"), loaded.keySet());
        Entity entity = loaded.get("1");
        assertEquals(Map.of("US", 7L, "ratio", 1.0, "when", when, "ok", true), entity.get("clients"));
        assertEquals(Set.of("blob"), entity.getUnindexedFields());
    }

    @Test
    public void testSnapshotReplacesLog(@TempDir Path tempDir) throws IOException {
        PersistenceManager persistence = new PersistenceManager(tempDir);
        persistence.appendPut(new Entity("1", Map.of("clients", Map.of())));
        persistence.saveSnapshot(List.of(new Entity("1", Map.of("clients", Map.of("FR", 2L)))));
        assertFalse(Files.exists(tempDir.resolve("wal.log")));

        Map<String, Entity> loaded = persistence.load();
        assertEquals(Map.of("FR", 2L), loaded.get("1").get("clients"));
    }

    @Test
    public void testUnreadableLogLinesAreSkipped(@TempDir Path tempDir) throws IOException {
        PersistenceManager persistence = new PersistenceManager(tempDir);
        persistence.appendPut(new Entity("1", Map.of("x", 1L)));
        Files.writeString(tempDir.resolve("wal.log"), "{broken" + System.lineSeparator(),
                StandardCharsets.UTF_8, StandardOpenOption.APPEND);
        persistence.appendPut(new Entity("2", Map.of("x", 2L)));

        assertEquals(Set.of("1", "2"), persistence.load().keySet());
    }

    @Test
    public void testCodecRoundTrip() {
        Map<String, Object> value = Map.of("n", 3L, "d", 3.5, "t", Instant.EPOCH, "s", "x", "l", List.of(1L, "a"));
        assertEquals(value, StoredValueCodec.decode(StoredValueCodec.encode(value)));
        assertThrows(IllegalArgumentException.class, () -> StoredValueCodec.encode(new Object()));
    }
}
