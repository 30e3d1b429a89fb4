package com.purchasingpower.workgraph.core;

/**
 * Kinds of graph containers.
 */
public enum GraphType {
    PROJECT,
    WORKSPACE,
    SUBGRAPH,
    TEMPLATE
}
