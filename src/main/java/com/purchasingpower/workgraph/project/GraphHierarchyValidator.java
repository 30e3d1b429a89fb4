package com.purchasingpower.workgraph.project;

import com.purchasingpower.workgraph.exception.GraphOperationException;
import com.purchasingpower.workgraph.storage.CypherParams;
import com.purchasingpower.workgraph.storage.CypherRunner;
import com.purchasingpower.workgraph.storage.Rows;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Keeps the graph parent hierarchy acyclic.
 *
 * <p>Walks {@code parentGraphId} links upward from the proposed parent. The link
 * is rejected if the walk reaches the child, or revisits a graph (a cycle that
 * already exists).
 */
@Slf4j
@Component
public class GraphHierarchyValidator {

    private static final String PARENT_OF = """
        MATCH (g:Graph {id: $graphId})
        RETURN g.parentGraphId AS parentGraphId
        """;

    /**
     * @param graphId The child; null when the graph is being created
     * @param parentGraphId The proposed parent
     * @throws GraphOperationException VALIDATION for a self-parent, NOT_FOUND for
     *         an unknown parent, CONFLICT when the link would close a cycle
     */
    public void validateParent(CypherRunner tx, String graphId, String parentGraphId) {
        if (parentGraphId.equals(graphId)) {
            throw GraphOperationException.validation("A graph cannot be its own parent: " + graphId);
        }

        Set<String> visited = new LinkedHashSet<>();
        String current = parentGraphId;
        while (current != null) {
            if (!visited.add(current)) {
                log.warn("⚠️  Existing hierarchy cycle found through {}", visited);
                throw GraphOperationException.conflict("Graph hierarchy already contains a cycle: " + visited);
            }
            Map<String, Object> row = Rows.first(tx.run(PARENT_OF, CypherParams.of("graphId", current)));
            if (row == null) {
                if (current.equals(parentGraphId)) {
                    throw GraphOperationException.notFound("Parent graph not found: " + parentGraphId);
                }
                // dangling ancestor link ends the chain
                return;
            }
            current = Rows.getString(row, "parentGraphId");
            if (graphId != null && graphId.equals(current)) {
                throw GraphOperationException.conflict(
                    "Setting parent " + parentGraphId + " on " + graphId + " would create a cycle");
            }
        }
    }
}
