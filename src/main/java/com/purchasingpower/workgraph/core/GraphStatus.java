package com.purchasingpower.workgraph.core;

/**
 * Lifecycle states of a graph container.
 */
public enum GraphStatus {
    ACTIVE,
    ARCHIVED,
    DRAFT,
    LOCKED
}
