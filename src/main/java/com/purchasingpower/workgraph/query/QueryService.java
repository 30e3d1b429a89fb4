package com.purchasingpower.workgraph.query;

import java.util.Map;

/**
 * Read-side operations over work items.
 *
 * <p>Every method returns a JSON-ready payload map and throws
 * {@code GraphOperationException} for validation and not-found failures.
 *
 * @since 1.0.0
 */
public interface QueryService {

    /**
     * Paginated listing for every query type except {@code dependencies},
     * which returns one node with its DEPENDS_ON neighbours.
     */
    Map<String, Object> browse(QueryType queryType, QueryFilters filters);

    /**
     * A node with contributors, dependencies, dependents and a page of relationships.
     */
    Map<String, Object> getNodeDetails(String nodeId, Integer relationshipLimit, Integer relationshipOffset);

    /**
     * All shortest paths between two nodes, any relationship type or direction.
     */
    Map<String, Object> findPath(String startId, String endId, Integer maxDepth, Integer limit, Integer offset);

    /**
     * DEPENDS_ON cycles of length 2 to 10.
     */
    Map<String, Object> detectCycles(Integer limit, Integer offset);
}
