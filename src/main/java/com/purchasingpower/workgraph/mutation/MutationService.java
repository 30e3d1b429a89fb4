package com.purchasingpower.workgraph.mutation;

import java.util.Map;

/**
 * Single-entity create, update and delete for work items and edges.
 * Each call runs in its own write transaction.
 *
 * @since 1.0.0
 */
public interface MutationService {

    /**
     * Create a work item with zeroed priorities and radius 1.0.
     */
    Map<String, Object> createNode(CreateNodeCommand command);

    /**
     * Apply only the fields present in {@code update}; always refreshes {@code updatedAt}.
     */
    Map<String, Object> updateNode(String nodeId, NodeUpdate update);

    /**
     * Delete a node with all its relationships, reporting how many were removed.
     */
    Map<String, Object> deleteNode(String nodeId);

    /**
     * Upsert the edge keyed by (source, target, type).
     */
    Map<String, Object> createEdge(EdgeCommand command);

    Map<String, Object> deleteEdge(EdgeCommand command);
}
