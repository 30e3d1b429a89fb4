package com.purchasingpower.workgraph.util;

import com.purchasingpower.workgraph.exception.GraphOperationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Typed view over the loosely-typed argument map of a tool call.
 *
 * <p>Numbers arrive from JSON as Integer, Long or Double; integer reads floor
 * them. Type mismatches throw VALIDATION errors naming the argument.
 */
public final class ToolArguments {

    private final Map<String, Object> values;

    private ToolArguments(Map<String, Object> values) {
        this.values = values != null ? values : Collections.emptyMap();
    }

    public static ToolArguments of(Map<String, Object> values) {
        return new ToolArguments(values);
    }

    public boolean has(String key) {
        return values.get(key) != null;
    }

    public Map<String, Object> asMap() {
        return values;
    }

    public Object getRaw(String key) {
        return values.get(key);
    }

    public String getString(String key) {
        Object value = values.get(key);
        return value != null ? value.toString() : null;
    }

    public String requireString(String key) {
        String value = getString(key);
        if (value == null || value.isBlank()) {
            throw GraphOperationException.validation(key + " is required");
        }
        return value;
    }

    public Integer getInteger(String key) {
        Object value = values.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            double d = number.doubleValue();
            if (!Double.isFinite(d)) {
                throw GraphOperationException.validation(key + " must be a finite number");
            }
            return (int) Math.floor(d);
        }
        try {
            return (int) Math.floor(Double.parseDouble(value.toString().trim()));
        } catch (NumberFormatException e) {
            throw GraphOperationException.validation(key + " must be a number, got: " + value);
        }
    }

    public int getInt(String key, int defaultValue) {
        Integer value = getInteger(key);
        return value != null ? value : defaultValue;
    }

    public Double getDouble(String key) {
        Object value = values.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        try {
            return Double.parseDouble(value.toString().trim());
        } catch (NumberFormatException e) {
            throw GraphOperationException.validation(key + " must be a number, got: " + value);
        }
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        Object value = values.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Boolean bool) {
            return bool;
        }
        return Boolean.parseBoolean(value.toString());
    }

    public Boolean getBooleanOrNull(String key) {
        return has(key) ? getBoolean(key, false) : null;
    }

    /**
     * List of strings, or null when the argument is absent.
     */
    public List<String> getStringList(String key) {
        Object value = values.get(key);
        if (value == null) {
            return null;
        }
        if (!(value instanceof List<?> list)) {
            throw GraphOperationException.validation(key + " must be an array");
        }
        List<String> out = new ArrayList<>(list.size());
        for (Object item : list) {
            if (item != null) {
                out.add(item.toString());
            }
        }
        return out;
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> getMap(String key) {
        Object value = values.get(key);
        if (value == null) {
            return null;
        }
        if (!(value instanceof Map<?, ?>)) {
            throw GraphOperationException.validation(key + " must be an object");
        }
        return (Map<String, Object>) value;
    }

    /**
     * Nested argument object; empty when absent.
     */
    public ToolArguments getNested(String key) {
        return new ToolArguments(getMap(key));
    }

    @SuppressWarnings("unchecked")
    public List<Map<String, Object>> getObjectList(String key) {
        Object value = values.get(key);
        if (value == null) {
            return null;
        }
        if (!(value instanceof List<?> list)) {
            throw GraphOperationException.validation(key + " must be an array");
        }
        List<Map<String, Object>> out = new ArrayList<>(list.size());
        for (Object item : list) {
            if (!(item instanceof Map<?, ?>)) {
                throw GraphOperationException.validation(key + " must contain only objects");
            }
            out.add((Map<String, Object>) item);
        }
        return out;
    }
}
