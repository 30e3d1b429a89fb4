package com.purchasingpower.workgraph.priority;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The three priority inputs with the composite and radius derived from them.
 */
public record PriorityScore(
    double executive,
    double individual,
    double community,
    double computed,
    double radius
) {

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("executive", executive);
        map.put("individual", individual);
        map.put("community", community);
        map.put("computed", computed);
        return map;
    }
}
