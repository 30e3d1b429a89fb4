package com.purchasingpower.workgraph.core;

/**
 * Closed set of work item kinds stored in {@code WorkItem.type}.
 */
public enum WorkItemType {
    OUTCOME,
    EPIC,
    INITIATIVE,
    STORY,
    TASK,
    BUG,
    FEATURE,
    MILESTONE
}
