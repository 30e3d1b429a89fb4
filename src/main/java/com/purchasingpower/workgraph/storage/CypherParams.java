package com.purchasingpower.workgraph.storage;

import java.util.HashMap;
import java.util.Map;

/**
 * Builds Cypher parameter maps from alternating key/value arguments.
 *
 * <p>Null values are kept so statements can test {@code $param IS NULL}.
 */
public final class CypherParams {

    private CypherParams() {
    }

    public static Map<String, Object> of(Object... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("Expected key/value pairs, got " + keyValues.length + " arguments");
        }
        Map<String, Object> params = new HashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            params.put((String) keyValues[i], keyValues[i + 1]);
        }
        return params;
    }
}
