package com.memos.plugin.chroma;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Evaluates Chroma {@code where} metadata filters against one record's metadata.
 * <p>
 * Supported: {@code {"field": value}} (equality), {@code {"field": {"$op": value}}} with
 * {@code $eq $ne $gt $gte $lt $lte $in $nin}, and {@code {"$and": [...]}} / {@code {"$or": [...]}}.
 * Several entries in one map must all match. A null or empty filter matches everything.
 */
final class WhereFilter {

    private WhereFilter() {
    }

    static boolean matches(Map<String, ?> where, Map<String, ?> metadata) {
        if (where == null || where.isEmpty()) {
            return true;
        }
        Map<String, ?> md = metadata != null ? metadata : Map.of();
        for (Map.Entry<String, ?> e : where.entrySet()) {
            if (!matchesEntry(e.getKey(), e.getValue(), md)) {
                return false;
            }
        }
        return true;
    }

    private static boolean matchesEntry(String key, Object condition, Map<String, ?> md) {
        switch (key) {
            case "$and":
                for (Map<String, ?> clause : clauses(key, condition)) {
                    if (!matches(clause, md)) return false;
                }
                return true;
            case "$or":
                for (Map<String, ?> clause : clauses(key, condition)) {
                    if (matches(clause, md)) return true;
                }
                return false;
            default:
                if (key.startsWith("$")) {
                    throw new IllegalArgumentException("Unsupported where operator: " + key);
                }
                return matchesField(md.get(key), md.containsKey(key), condition);
        }
    }

    @SuppressWarnings("unchecked")
    private static List<Map<String, ?>> clauses(String op, Object condition) {
        if (!(condition instanceof List)) {
            throw new IllegalArgumentException(op + " expects a list of filters, got " + condition);
        }
        for (Object c : (List<?>) condition) {
            if (!(c instanceof Map)) {
                throw new IllegalArgumentException(op + " expects a list of filters, got element " + c);
            }
        }
        return (List<Map<String, ?>>) condition;
    }

    private static boolean matchesField(Object actual, boolean present, Object condition) {
        if (!(condition instanceof Map)) {
            return present && valueEquals(actual, condition);
        }
        Map<?, ?> ops = (Map<?, ?>) condition;
        for (Map.Entry<?, ?> op : ops.entrySet()) {
            if (!matchesOperator(String.valueOf(op.getKey()), actual, present, op.getValue())) {
                return false;
            }
        }
        return true;
    }

    private static boolean matchesOperator(String op, Object actual, boolean present, Object operand) {
        switch (op) {
            case "$eq":
                return present && valueEquals(actual, operand);
            case "$ne":
                return !present || !valueEquals(actual, operand);
            case "$gt":
                return compare(actual, operand, op) > 0;
            case "$gte":
                return compare(actual, operand, op) >= 0;
            case "$lt":
                return compare(actual, operand, op) < 0;
            case "$lte":
                return compare(actual, operand, op) <= 0;
            case "$in":
                return present && containsValue(operand, actual, op);
            case "$nin":
                return !present || !containsValue(operand, actual, op);
            default:
                throw new IllegalArgumentException("Unsupported where operator: " + op);
        }
    }

    /** Comparison result, or a value that fails every comparison when {@code actual} is not a number. */
    private static int compare(Object actual, Object operand, String op) {
        if (!(operand instanceof Number)) {
            throw new IllegalArgumentException(op + " expects a number, got " + operand);
        }
        if (!(actual instanceof Number)) {
            return op.startsWith("$g") ? -1 : 1;
        }
        return Double.compare(((Number) actual).doubleValue(), ((Number) operand).doubleValue());
    }

    private static boolean containsValue(Object operand, Object actual, String op) {
        if (!(operand instanceof Collection)) {
            throw new IllegalArgumentException(op + " expects a list, got " + operand);
        }
        for (Object candidate : (Collection<?>) operand) {
            if (valueEquals(actual, candidate)) return true;
        }
        return false;
    }

    private static boolean valueEquals(Object a, Object b) {
        if (a instanceof Number && b instanceof Number) {
            return Double.compare(((Number) a).doubleValue(), ((Number) b).doubleValue()) == 0;
        }
        return Objects.equals(a, b);
    }
}
