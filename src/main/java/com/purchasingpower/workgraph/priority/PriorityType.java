package com.purchasingpower.workgraph.priority;

import com.purchasingpower.workgraph.exception.GraphOperationException;

/**
 * Priority dimensions and the WorkItem property holding each.
 */
public enum PriorityType {
    EXECUTIVE("executive", "priorityExecutive"),
    INDIVIDUAL("individual", "priorityIndividual"),
    COMMUNITY("community", "priorityCommunity"),
    COMPUTED("computed", "priorityComputed");

    private final String value;
    private final String property;

    PriorityType(String value, String property) {
        this.value = value;
        this.property = property;
    }

    public String getValue() {
        return value;
    }

    /**
     * Node property name; safe to interpolate into Cypher.
     */
    public String getProperty() {
        return property;
    }

    /**
     * Resolve a wire name. Absent, "composite" and "all" mean {@link #COMPUTED}.
     */
    public static PriorityType fromValue(String value) {
        if (value == null || value.isBlank()
            || "composite".equalsIgnoreCase(value) || "all".equalsIgnoreCase(value)) {
            return COMPUTED;
        }
        for (PriorityType type : values()) {
            if (type.value.equalsIgnoreCase(value.trim())) {
                return type;
            }
        }
        throw GraphOperationException.validation(
            "Invalid priority_type. Must be one of: executive, individual, community, computed");
    }
}
