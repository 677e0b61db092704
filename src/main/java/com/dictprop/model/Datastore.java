package com.dictprop.model;

import com.dictprop.store.DocumentStore;
import com.dictprop.store.Entity;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;
import java.util.logging.Logger;

/**
 * Stores {@link Model}s, one {@link DocumentStore} per kind. Reads always
 * build a fresh model from the stored entity, so a {@code get} after a
 * {@code put} behaves like a reload.
 */
public class Datastore {
    private static final Logger LOGGER = Logger.getLogger(Datastore.class.getName());

    private final Path baseDirectory;
    private final Map<String, DocumentStore> stores = new HashMap<>();

    /** Memory-only datastore. */
    public Datastore() {
        this(null);
    }

    /** Datastore persisting each kind in its own sub-directory of {@code baseDirectory}. */
    public Datastore(Path baseDirectory) {
        this.baseDirectory = baseDirectory;
    }

    /**
     * Writes the model, assigning it a random id first if it has none.
     *
     * @return the model's id
     */
    public String put(Model model) {
        if (model == null) {
            LOGGER.severe("put called with null model");
            throw new IllegalArgumentException("model cannot be null");
        }
        boolean assigned = model.getId() == null;
        if (assigned) {
            model.setId(UUID.randomUUID().toString());
        }
        try {
            storeFor(model.getSchema()).put(model.toEntity());
        } catch (RuntimeException e) {
            if (assigned) {
                model.setId(null);
            }
            throw e;
        }
        LOGGER.fine(() -> "Put " + model.getSchema().getKind() + " " + model.getId());
        return model.getId();
    }

    /** Loads a fresh instance, or returns null when no entity has that id. */
    public Model get(Schema schema, String id) {
        Entity entity = storeFor(schema).get(id);
        return entity == null ? null : Model.fromEntity(schema, entity);
    }

    public void delete(Model model) {
        if (model == null || model.getId() == null) {
            LOGGER.warning("delete called with a model that was never stored");
            return;
        }
        storeFor(model.getSchema()).delete(model.getId());
    }

    public Query query(Schema schema) {
        return new Query(schema, storeFor(schema));
    }

    /** Snapshots every opened kind. */
    public void saveSnapshots() {
        stores.values().forEach(DocumentStore::saveSnapshot);
    }

    private DocumentStore storeFor(Schema schema) {
        return stores.computeIfAbsent(schema.getKind(), kind -> baseDirectory == null
                ? new DocumentStore()
                : new DocumentStore(baseDirectory.resolve(kind)));
    }
}
