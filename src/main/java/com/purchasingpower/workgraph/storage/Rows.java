package com.purchasingpower.workgraph.storage;

import java.util.List;
import java.util.Map;

/**
 * Typed accessors for rows returned by {@link CypherRunner}.
 *
 * <p>A null row reads as empty, so callers can chain {@link #first(List)}.
 */
public final class Rows {

    private Rows() {
    }

    public static String getString(Map<String, Object> row, String key) {
        Object value = row != null ? row.get(key) : null;
        return value != null ? value.toString() : null;
    }

    public static long getLong(Map<String, Object> row, String key) {
        Object value = row != null ? row.get(key) : null;
        return value instanceof Number number ? number.longValue() : 0L;
    }

    public static double getDouble(Map<String, Object> row, String key) {
        Object value = row != null ? row.get(key) : null;
        return value instanceof Number number ? number.doubleValue() : 0.0;
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Object> getMap(Map<String, Object> row, String key) {
        Object value = row != null ? row.get(key) : null;
        return value instanceof Map<?, ?> ? (Map<String, Object>) value : null;
    }

    @SuppressWarnings("unchecked")
    public static List<Object> getList(Map<String, Object> row, String key) {
        Object value = row != null ? row.get(key) : null;
        return value instanceof List<?> ? (List<Object>) value : List.of();
    }

    /**
     * First row of a result, or null when the result is empty.
     */
    public static Map<String, Object> first(List<Map<String, Object>> rows) {
        return rows.isEmpty() ? null : rows.get(0);
    }
}
