package com.dictprop.store;

import com.dictprop.index.IndexManager;
import com.dictprop.persistence.PersistenceManager;
import com.dictprop.query.QueryExpression;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * In-memory store for schemaless entities with automatic indexing.
 * When created with a directory, every write is appended to a log there
 * and the state is restored on the next start.
 */
public class DocumentStore {
    private static final Logger LOGGER = Logger.getLogger(DocumentStore.class.getName());

    private final Map<String, Entity> data = new LinkedHashMap<>();
    private final IndexManager indexManager = new IndexManager();
    private final PersistenceManager persistenceManager;

    public DocumentStore() {
        this.persistenceManager = null;
    }

    public DocumentStore(Path baseDirectory) {
        this.persistenceManager = new PersistenceManager(baseDirectory);
        for (Entity entity : persistenceManager.load().values()) {
            data.put(entity.getId(), entity);
            indexManager.index(entity);
        }
        LOGGER.info(() -> "Opened store at " + baseDirectory + " with " + data.size() + " entities");
    }

    /** Inserts the entity or replaces the stored one with the same id. */
    public void put(Entity entity) {
        if (entity == null) {
            LOGGER.severe("Attempted to put null entity");
            throw new IllegalArgumentException("entity cannot be null");
        }
        try {
            if (persistenceManager != null) {
                persistenceManager.appendPut(entity);
            }
            Entity old = data.put(entity.getId(), entity);
            if (old != null) {
                indexManager.remove(old);
            }
            indexManager.index(entity);
        } catch (IOException e) {
            LOGGER.log(Level.SEVERE, "Failed to persist entity " + entity.getId(), e);
            throw new UncheckedIOException(e);
        } catch (RuntimeException e) {
            LOGGER.log(Level.SEVERE, "Failed to put entity " + entity.getId(), e);
            throw e;
        }
    }

    public void delete(String id) {
        if (id == null) {
            LOGGER.severe("delete called with null id");
            throw new IllegalArgumentException("id must be non-null");
        }
        if (!data.containsKey(id)) {
            return;
        }
        try {
            if (persistenceManager != null) {
                persistenceManager.appendDelete(id);
            }
            indexManager.remove(data.remove(id));
        } catch (IOException e) {
            LOGGER.log(Level.SEVERE, "Failed to persist delete of entity " + id, e);
            throw new UncheckedIOException(e);
        }
    }

    /** Returns the matching entities ordered by id. */
    public List<Entity> query(QueryExpression expr) {
        if (expr == null) {
            LOGGER.severe("query called with null expression");
            throw new IllegalArgumentException("expression must be non-null");
        }
        try {
            Set<String> ids = expr.evaluate(indexManager, this);
            return ids.stream().sorted().map(data::get).filter(Objects::nonNull).collect(Collectors.toList());
        } catch (RuntimeException e) {
            LOGGER.log(Level.SEVERE, "Query failed", e);
            throw e;
        }
    }

    public Collection<Entity> findAll() {
        return Collections.unmodifiableCollection(data.values());
    }

    public Set<String> getAllIds() {
        return Collections.unmodifiableSet(data.keySet());
    }

    public Entity get(String id) {
        if (id == null) {
            LOGGER.warning("get called with null id");
            return null;
        }
        return data.get(id);
    }

    public int size() {
        return data.size();
    }

    /** Writes a full snapshot and truncates the log. No-op for a memory-only store. */
    public void saveSnapshot() {
        if (persistenceManager == null) {
            LOGGER.fine("saveSnapshot called on a memory-only store");
            return;
        }
        try {
            persistenceManager.saveSnapshot(data.values());
        } catch (IOException e) {
            LOGGER.log(Level.SEVERE, "Failed to save snapshot", e);
            throw new UncheckedIOException(e);
        }
    }
}
