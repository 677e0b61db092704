package com.dictprop.index;

import com.dictprop.store.Entity;
import com.dictprop.store.ValueKind;

import java.util.*;
import java.util.function.BiConsumer;
import java.util.logging.Logger;

/**
 * Maintains in-memory indexes for entity fields. Nested maps are indexed
 * under dotted paths ({@code clients.US}); list elements share the path of
 * their list. Each path keeps one sorted index per {@link ValueKind} and a
 * presence set of the entities holding a non-null value there. Numbers
 * are ordered exactly, see {@link ValueKind#compare(Object, Object)}.
 */
public class IndexManager {
    private static final Logger LOGGER = Logger.getLogger(IndexManager.class.getName());

    private final Map<String, Map<ValueKind, NavigableMap<Comparable, Set<String>>>> indexes = new HashMap<>();
    private final Map<String, Set<String>> presence = new HashMap<>();

    public void index(Entity entity) {
        if (entity == null) {
            LOGGER.severe("Attempted to index null entity");
            return;
        }
        String id = entity.getId();
        forEachIndexed(entity, (path, val) -> addValue(path, val, id));
    }

    public void remove(Entity entity) {
        if (entity == null) {
            LOGGER.severe("Attempted to remove null entity from index");
            return;
        }
        String id = entity.getId();
        forEachIndexed(entity, (path, val) -> removeValue(path, val, id));
    }

    public Set<String> searchEquals(String field, Object value) {
        NavigableMap<Comparable, Set<String>> map = indexFor(field, value, "searchEquals");
        if (map == null) {
            return Collections.emptySet();
        }
        return new HashSet<>(map.getOrDefault(ValueKind.indexKey(value), Collections.emptySet()));
    }

    public Set<String> searchGreaterThan(String field, Object value) {
        NavigableMap<Comparable, Set<String>> map = indexFor(field, value, "searchGreaterThan");
        if (map == null) {
            return Collections.emptySet();
        }
        return union(map.tailMap(ValueKind.indexKey(value), false).values());
    }

    public Set<String> searchLessThan(String field, Object value) {
        NavigableMap<Comparable, Set<String>> map = indexFor(field, value, "searchLessThan");
        if (map == null) {
            return Collections.emptySet();
        }
        return union(map.headMap(ValueKind.indexKey(value), false).values());
    }

    public Set<String> searchGreaterOrEquals(String field, Object value) {
        NavigableMap<Comparable, Set<String>> map = indexFor(field, value, "searchGreaterOrEquals");
        if (map == null) {
            return Collections.emptySet();
        }
        return union(map.tailMap(ValueKind.indexKey(value), true).values());
    }

    public Set<String> searchLessOrEquals(String field, Object value) {
        NavigableMap<Comparable, Set<String>> map = indexFor(field, value, "searchLessOrEquals");
        if (map == null) {
            return Collections.emptySet();
        }
        return union(map.headMap(ValueKind.indexKey(value), true).values());
    }

    /** Ids of entities holding a non-null value (an empty map counts) at {@code field}. */
    public Set<String> searchPresent(String field) {
        if (field == null) {
            LOGGER.warning("searchPresent called with null field");
            return Collections.emptySet();
        }
        return new HashSet<>(presence.getOrDefault(field, Collections.emptySet()));
    }

    private NavigableMap<Comparable, Set<String>> indexFor(String field, Object value, String operation) {
        if (field == null || value == null) {
            LOGGER.warning(operation + " called with null field or value");
            return null;
        }
        ValueKind kind = ValueKind.of(value);
        if (kind == null) {
            LOGGER.warning(operation + " called with unindexable value of type " + value.getClass().getName());
            return null;
        }
        Map<ValueKind, NavigableMap<Comparable, Set<String>>> byKind = indexes.get(field);
        return byKind == null ? null : byKind.get(kind);
    }

    private static Set<String> union(Collection<Set<String>> sets) {
        Set<String> result = new HashSet<>();
        for (Set<String> ids : sets) {
            result.addAll(ids);
        }
        return result;
    }

    private void addValue(String path, Object value, String id) {
        presence.computeIfAbsent(path, k -> new HashSet<>()).add(id);
        ValueKind kind = ValueKind.of(value);
        if (kind == null) {
            return;
        }
        indexes.computeIfAbsent(path, k -> new EnumMap<>(ValueKind.class))
                .computeIfAbsent(kind, k -> new TreeMap<Comparable, Set<String>>(ValueKind::compare))
                .computeIfAbsent(ValueKind.indexKey(value), v -> new HashSet<>())
                .add(id);
    }

    private void removeValue(String path, Object value, String id) {
        Set<String> present = presence.get(path);
        if (present != null) {
            present.remove(id);
            if (present.isEmpty()) {
                presence.remove(path);
            }
        }
        ValueKind kind = ValueKind.of(value);
        if (kind == null) {
            return;
        }
        Map<ValueKind, NavigableMap<Comparable, Set<String>>> byKind = indexes.get(path);
        if (byKind == null) {
            return;
        }
        NavigableMap<Comparable, Set<String>> map = byKind.get(kind);
        if (map != null) {
            Comparable key = ValueKind.indexKey(value);
            Set<String> ids = map.get(key);
            if (ids != null) {
                ids.remove(id);
                if (ids.isEmpty()) {
                    map.remove(key);
                }
            }
            if (map.isEmpty()) {
                byKind.remove(kind);
            }
        }
        if (byKind.isEmpty()) {
            indexes.remove(path);
        }
    }

    private void forEachIndexed(Entity entity, BiConsumer<String, Object> consumer) {
        entity.getFields().forEach((key, value) -> {
            if (entity.isIndexed(key)) {
                traverse(key, value, consumer);
            }
        });
    }

    private void traverse(String path, Object value, BiConsumer<String, Object> consumer) {
        if (value == null) {
            return;
        }
        if (value instanceof Map<?, ?> map) {
            consumer.accept(path, value);
            for (var entry : map.entrySet()) {
                Object key = entry.getKey();
                if (key == null) continue;
                traverse(path + "." + key, entry.getValue(), consumer);
            }
        } else if (value instanceof List<?> list) {
            for (Object element : list) {
                traverse(path, element, consumer);
            }
        } else {
            consumer.accept(path, value);
        }
    }
}
