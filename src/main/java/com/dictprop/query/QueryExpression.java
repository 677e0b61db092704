package com.dictprop.query;

import com.dictprop.index.IndexManager;
import com.dictprop.store.DocumentStore;

import java.util.*;

/**
 * Functional interface representing a query expression that can
 * evaluate itself using indexes and the document store.
 */
public interface QueryExpression {
    Set<String> evaluate(IndexManager indexes, DocumentStore store);

    enum Operator {
        EQ("=="),
        NE("!="),
        GT(">"),
        GTE(">="),
        LT("<"),
        LTE("<=");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }
    }

    /**
     * Compares the value stored at {@code path} with {@code value}. Entities
     * without a value at the path never match, not even for {@code NE}.
     */
    static QueryExpression field(String path, Operator op, Object value) {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(op, "op");
        Objects.requireNonNull(value, "value");
        return (indexes, store) -> switch (op) {
            case EQ -> indexes.searchEquals(path, value);
            case GT -> indexes.searchGreaterThan(path, value);
            case GTE -> indexes.searchGreaterOrEquals(path, value);
            case LT -> indexes.searchLessThan(path, value);
            case LTE -> indexes.searchLessOrEquals(path, value);
            case NE -> {
                Set<String> present = indexes.searchPresent(path);
                present.removeAll(indexes.searchEquals(path, value));
                yield present;
            }
        };
    }

    /** Matches entities holding no value (or an explicit null) at {@code path}. */
    static QueryExpression isNull(String path) {
        Objects.requireNonNull(path, "path");
        return (indexes, store) -> {
            Set<String> all = new HashSet<>(store.getAllIds());
            all.removeAll(indexes.searchPresent(path));
            return all;
        };
    }

    static QueryExpression and(QueryExpression... exprs) {
        return (indexes, store) -> {
            if (exprs.length == 0) {
                return Collections.emptySet();
            }
            Set<String> result = null;
            for (QueryExpression e : exprs) {
                Set<String> set = e.evaluate(indexes, store);
                if (result == null) {
                    result = new HashSet<>(set);
                } else {
                    result.retainAll(set);
                }
            }
            return result == null ? Collections.emptySet() : result;
        };
    }

    static QueryExpression or(QueryExpression... exprs) {
        return (indexes, store) -> {
            Set<String> result = new HashSet<>();
            for (QueryExpression e : exprs) {
                result.addAll(e.evaluate(indexes, store));
            }
            return result;
        };
    }

    static QueryExpression not(QueryExpression expr) {
        return (indexes, store) -> {
            Set<String> all = new HashSet<>(store.getAllIds());
            all.removeAll(expr.evaluate(indexes, store));
            return all;
        };
    }

    /** Matches every entity of the store. */
    static QueryExpression all() {
        return (indexes, store) -> new HashSet<>(store.getAllIds());
    }
}
