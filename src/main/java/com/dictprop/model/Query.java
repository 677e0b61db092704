package com.dictprop.model;

import com.dictprop.query.QueryExpression;
import com.dictprop.store.DocumentStore;
import com.dictprop.store.Entity;
import com.dictprop.store.ValueKind;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Immutable query over the entities of one kind. Filters are combined with
 * AND. Ordering by a path leaves out entities without a value there.
 */
public class Query {
    private final Schema schema;
    private final DocumentStore store;
    private final List<QueryExpression> filters;
    private final List<Order> orders;

    Query(Schema schema, DocumentStore store) {
        this(schema, store, Collections.emptyList(), Collections.emptyList());
    }

    private Query(Schema schema, DocumentStore store, List<QueryExpression> filters, List<Order> orders) {
        this.schema = schema;
        this.store = store;
        this.filters = filters;
        this.orders = orders;
    }

    public Query filter(QueryExpression... expressions) {
        List<QueryExpression> combined = new ArrayList<>(filters);
        combined.addAll(Arrays.asList(expressions));
        return new Query(schema, store, Collections.unmodifiableList(combined), orders);
    }

    public Query order(Order... sortOrders) {
        List<Order> combined = new ArrayList<>(orders);
        combined.addAll(Arrays.asList(sortOrders));
        return new Query(schema, store, filters, Collections.unmodifiableList(combined));
    }

    public List<Model> fetch() {
        return fetch(Integer.MAX_VALUE);
    }

    public List<Model> fetch(int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit must be >= 0");
        }
        return entities().stream()
                .limit(limit)
                .map(entity -> Model.fromEntity(schema, entity))
                .collect(Collectors.toList());
    }

    /** First result, or null when nothing matches. */
    public Model get() {
        List<Model> first = fetch(1);
        return first.isEmpty() ? null : first.get(0);
    }

    public int count() {
        return entities().size();
    }

    private List<Entity> entities() {
        QueryExpression expression = filters.isEmpty()
                ? QueryExpression.all()
                : QueryExpression.and(filters.toArray(new QueryExpression[0]));
        List<Entity> matches = store.query(expression);
        if (orders.isEmpty()) {
            return matches;
        }
        List<Entity> sorted = new ArrayList<>();
        for (Entity entity : matches) {
            if (orders.stream().allMatch(order -> entity.resolve(order.path()) != null)) {
                sorted.add(entity);
            }
        }
        sorted.sort(comparator());
        return sorted;
    }

    private Comparator<Entity> comparator() {
        Comparator<Entity> comparator = null;
        for (Order order : orders) {
            Comparator<Entity> next = (a, b) -> ValueKind.compare(a.resolve(order.path()), b.resolve(order.path()));
            if (order.descending()) {
                next = next.reversed();
            }
            comparator = comparator == null ? next : comparator.thenComparing(next);
        }
        return comparator.thenComparing(Entity::getId);
    }
}
