package com.purchasingpower.workgraph.core;

/**
 * Classification of failures reported by graph operations.
 *
 * <p>Callers branch on the kind instead of matching message text.
 *
 * @since 1.0.0
 */
public enum ErrorKind {

    /**
     * Missing required input, unknown enum value or out-of-range number.
     */
    VALIDATION,

    /**
     * Referenced node, edge, contributor or graph does not exist.
     */
    NOT_FOUND,

    /**
     * Request conflicts with existing state (duplicate IDs, non-empty graph, hierarchy cycle).
     */
    CONFLICT,

    /**
     * The graph database rejected or failed the statement.
     */
    STORAGE,

    /**
     * Anything else.
     */
    INTERNAL
}
