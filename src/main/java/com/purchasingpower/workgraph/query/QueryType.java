package com.purchasingpower.workgraph.query;

import com.purchasingpower.workgraph.exception.GraphOperationException;

/**
 * Selector for browse queries, with the wire name used by callers.
 */
public enum QueryType {
    ALL_NODES("all_nodes"),
    BY_TYPE("by_type"),
    BY_STATUS("by_status"),
    BY_CONTRIBUTOR("by_contributor"),
    BY_PRIORITY("by_priority"),
    DEPENDENCIES("dependencies"),
    SEARCH("search");

    private final String value;

    QueryType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Resolve a wire name; a missing selector means {@link #ALL_NODES}.
     */
    public static QueryType fromValue(String value) {
        if (value == null || value.isBlank()) {
            return ALL_NODES;
        }
        for (QueryType type : values()) {
            if (type.value.equalsIgnoreCase(value.trim())) {
                return type;
            }
        }
        throw GraphOperationException.validation("Unknown query_type: " + value);
    }
}
