package com.purchasingpower.workgraph.core;

/**
 * Lifecycle states of a work item.
 */
public enum WorkItemStatus {
    PROPOSED,
    PLANNED,
    IN_PROGRESS,
    BLOCKED,
    COMPLETED,
    ARCHIVED;

    /**
     * Statuses that still hold up items depending on them.
     */
    public boolean isOpen() {
        return this == PROPOSED || this == PLANNED || this == IN_PROGRESS;
    }
}
