package com.purchasingpower.workgraph.analytics;

/**
 * Capacity classification of a contributor relative to the cohort average.
 */
public enum CapacityStatus {
    OVERLOADED,
    UNDERUTILIZED,
    BALANCED
}
