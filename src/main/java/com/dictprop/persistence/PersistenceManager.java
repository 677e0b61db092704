package com.dictprop.persistence;

import com.dictprop.store.Entity;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Handles persistence of the in-memory store using snapshot and WAL files.
 */
public class PersistenceManager {
    private static final Logger LOGGER = Logger.getLogger(PersistenceManager.class.getName());

    private final Path baseDirectory;
    private final Path snapshotPath;
    private final Path walPath;
    private final Gson gson = new GsonBuilder().serializeSpecialFloatingPointValues().create();

    public PersistenceManager(Path baseDirectory) {
        this.baseDirectory = baseDirectory;
        this.snapshotPath = baseDirectory.resolve("snapshot.json");
        this.walPath = baseDirectory.resolve("wal.log");
        try {
            Files.createDirectories(baseDirectory);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to create persistence directory " + baseDirectory, e);
        }
    }

    /** Replays the snapshot and then the write-ahead log. */
    public Map<String, Entity> load() {
        Map<String, Entity> data = new LinkedHashMap<>();
        try {
            if (Files.exists(snapshotPath)) {
                try (Reader reader = Files.newBufferedReader(snapshotPath, StandardCharsets.UTF_8)) {
                    JsonElement snapshot = JsonParser.parseReader(reader);
                    if (snapshot.isJsonObject()) {
                        for (var entry : snapshot.getAsJsonObject().entrySet()) {
                            data.put(entry.getKey(), readEntity(entry.getKey(), entry.getValue().getAsJsonObject()));
                        }
                    }
                }
            }
            if (Files.exists(walPath)) {
                try (BufferedReader reader = Files.newBufferedReader(walPath, StandardCharsets.UTF_8)) {
                    String line;
                    while ((line = reader.readLine()) != null) {
                        if (line.isBlank()) {
                            continue;
                        }
                        replay(data, line);
                    }
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load persisted state from " + baseDirectory, e);
        }
        LOGGER.fine(() -> "Loaded " + data.size() + " entities from " + baseDirectory);
        return data;
    }

    public void appendPut(Entity entity) throws IOException {
        JsonObject record = new JsonObject();
        record.addProperty("operation", Operation.PUT.name());
        record.addProperty("id", entity.getId());
        record.add("entity", writeEntity(entity));
        record.addProperty("timestamp", System.currentTimeMillis());
        append(record);
    }

    public void appendDelete(String id) throws IOException {
        JsonObject record = new JsonObject();
        record.addProperty("operation", Operation.DELETE.name());
        record.addProperty("id", id);
        record.addProperty("timestamp", System.currentTimeMillis());
        append(record);
    }

    public void saveSnapshot(Collection<Entity> entities) throws IOException {
        JsonObject snapshot = new JsonObject();
        for (Entity entity : entities) {
            snapshot.add(entity.getId(), writeEntity(entity));
        }
        Files.createDirectories(baseDirectory);
        Path tmp = baseDirectory.resolve("snapshot.tmp");
        try (Writer writer = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING)) {
            gson.toJson(snapshot, writer);
        }
        try {
            Files.move(tmp, snapshotPath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException ex) {
            Files.move(tmp, snapshotPath, StandardCopyOption.REPLACE_EXISTING);
        }
        Files.deleteIfExists(walPath);
    }

    private void append(JsonObject record) throws IOException {
        Files.writeString(walPath, gson.toJson(record) + System.lineSeparator(), StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND);
    }

    private void replay(Map<String, Entity> data, String line) {
        JsonObject record;
        try {
            record = JsonParser.parseString(line).getAsJsonObject();
        } catch (JsonParseException | IllegalStateException e) {
            LOGGER.log(Level.WARNING, "Skipping unreadable WAL line in " + walPath, e);
            return;
        }
        if (!record.has("operation") || !record.has("id")) {
            LOGGER.warning("Skipping incomplete WAL record in " + walPath);
            return;
        }
        String id = record.get("id").getAsString();
        switch (Operation.valueOf(record.get("operation").getAsString())) {
            case PUT -> data.put(id, readEntity(id, record.getAsJsonObject("entity")));
            case DELETE -> data.remove(id);
        }
    }

    private JsonObject writeEntity(Entity entity) {
        JsonObject object = new JsonObject();
        object.add("fields", StoredValueCodec.encode(entity.getFields()));
        JsonArray unindexed = new JsonArray();
        entity.getUnindexedFields().forEach(unindexed::add);
        object.add("unindexed", unindexed);
        return object;
    }

    private Entity readEntity(String id, JsonObject object) {
        Map<String, Object> fields = StoredValueCodec.decodeObject(object.getAsJsonObject("fields"));
        Set<String> unindexed = new LinkedHashSet<>();
        JsonArray names = object.getAsJsonArray("unindexed");
        if (names != null) {
            names.forEach(name -> unindexed.add(name.getAsString()));
        }
        return new Entity(id, fields, unindexed);
    }

    public enum Operation { PUT, DELETE }
}
