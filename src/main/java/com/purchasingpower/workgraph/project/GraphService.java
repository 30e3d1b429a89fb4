package com.purchasingpower.workgraph.project;

import java.util.Map;

/**
 * Lifecycle of graph containers and the work items they own.
 *
 * @since 1.0.0
 */
public interface GraphService {

    // ================================================================
    // CREATE / READ
    // ================================================================

    Map<String, Object> createGraph(CreateGraphCommand command);

    /**
     * Graphs matching the filters, most recently updated first.
     */
    Map<String, Object> listGraphs(GraphListQuery query);

    /**
     * The graph with node and edge counts and type/status breakdowns of its items.
     */
    Map<String, Object> getGraphDetails(String graphId);

    // ================================================================
    // UPDATE / DELETE
    // ================================================================

    /**
     * Sets only the fields present; a new parent passes the hierarchy check first.
     */
    Map<String, Object> updateGraph(String graphId, GraphUpdate update);

    /**
     * Deletes the graph. A graph still owning work items is deleted only with
     * {@code force}, and then its items go with it.
     */
    Map<String, Object> deleteGraph(String graphId, boolean force);

    /**
     * Soft delete: status ARCHIVED with timestamp and reason.
     */
    Map<String, Object> archiveGraph(String graphId, String reason);

    /**
     * Copy a graph, optionally with its items and the edges between them, in one transaction.
     * Cloned items start over as PROPOSED.
     */
    Map<String, Object> cloneGraph(CloneGraphCommand command);
}
