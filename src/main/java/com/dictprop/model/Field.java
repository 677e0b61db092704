package com.dictprop.model;

import com.dictprop.query.BadFilterException;
import com.dictprop.query.QueryExpression;
import com.dictprop.query.QueryExpression.Operator;
import com.dictprop.store.StoredValues;

/**
 * Descriptor of a named field of a {@link Schema}. A field converts values
 * between their in-memory and stored forms and builds query predicates over
 * its stored path.
 *
 * @param <T> in-memory value type
 */
public abstract class Field<T> {
    private final String name;
    private final boolean indexed;

    protected Field(String name, boolean indexed) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("field name must be non-empty");
        }
        this.name = name;
        this.indexed = indexed;
    }

    public String getName() {
        return name;
    }

    public boolean isIndexed() {
        return indexed;
    }

    /**
     * Converts an assigned value to the in-memory form.
     *
     * @throws IllegalArgumentException if the value is not acceptable
     */
    public abstract T coerce(Object value);

    public abstract Object toStorage(T value);

    public abstract T fromStorage(Object stored);

    /** Representation used by {@link Model#toMap()}. */
    public Object export(T value) {
        return value;
    }

    public QueryExpression eq(Object value) {
        return filter(Operator.EQ, value);
    }

    public QueryExpression ne(Object value) {
        return filter(Operator.NE, value);
    }

    public QueryExpression lt(Object value) {
        return filter(Operator.LT, value);
    }

    public QueryExpression le(Object value) {
        return filter(Operator.LTE, value);
    }

    public QueryExpression gt(Object value) {
        return filter(Operator.GT, value);
    }

    public QueryExpression ge(Object value) {
        return filter(Operator.GTE, value);
    }

    /**
     * Builds the predicate {@code <name> <op> value}. A null value tests for
     * the absence of a value and only supports {@code EQ} and {@code NE}.
     *
     * @throws BadFilterException if the field is unindexed or the comparison
     *                            cannot be answered by the index
     */
    public QueryExpression filter(Operator op, Object value) {
        if (!indexed) {
            throw new BadFilterException("Cannot query for unindexed field " + name);
        }
        if (value == null) {
            return switch (op) {
                case EQ -> QueryExpression.isNull(name);
                case NE -> QueryExpression.not(QueryExpression.isNull(name));
                default -> throw new BadFilterException("Cannot compare " + name + " " + op.symbol() + " null");
            };
        }
        Object operand;
        try {
            operand = StoredValues.normalizeScalar(value);
        } catch (IllegalArgumentException e) {
            throw new BadFilterException("Cannot filter " + name + " on value " + value + ": " + e.getMessage());
        }
        return QueryExpression.field(name, op, operand);
    }

    public Order asc() {
        return order(false);
    }

    public Order desc() {
        return order(true);
    }

    protected Order order(boolean descending) {
        if (!indexed) {
            throw new BadFilterException("Cannot order by unindexed field " + name);
        }
        return new Order(name, descending);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + name + ")";
    }
}
