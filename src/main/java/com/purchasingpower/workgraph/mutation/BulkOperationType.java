package com.purchasingpower.workgraph.mutation;

import com.purchasingpower.workgraph.exception.GraphOperationException;

/**
 * Operations accepted inside a bulk request.
 */
public enum BulkOperationType {
    CREATE_NODE("create_node"),
    UPDATE_NODE("update_node"),
    CREATE_EDGE("create_edge"),
    DELETE_EDGE("delete_edge");

    private final String value;

    BulkOperationType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static BulkOperationType fromValue(String value) {
        for (BulkOperationType type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw GraphOperationException.validation("Unknown bulk operation type: " + value);
    }
}
