package com.purchasingpower.workgraph.query;

import com.purchasingpower.workgraph.configuration.WorkGraphProperties;
import com.purchasingpower.workgraph.core.WorkItemStatus;
import com.purchasingpower.workgraph.core.WorkItemType;
import com.purchasingpower.workgraph.exception.GraphOperationException;
import com.purchasingpower.workgraph.util.InputSanitizer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Translates a query type and filter bag into parameterized Cypher.
 *
 * <p>The main and count statements are generated from the same MATCH/WHERE
 * fragment so their predicates cannot drift apart.
 *
 * @since 1.0.0
 */
@Component
@RequiredArgsConstructor
public class BrowseQueryBuilder {

    private static final String DEFAULT_ORDER = "n.updatedAt DESC";
    private static final String PRIORITY_ORDER = "n.priorityComputed DESC, n.updatedAt DESC";

    private final WorkGraphProperties properties;

    public BrowseQuery build(QueryType queryType, QueryFilters filters) {
        QueryFilters f = filters != null ? filters : QueryFilters.builder().build();
        int limit = resolveLimit(f.getLimit());
        int offset = resolveOffset(f.getOffset());

        Map<String, Object> params = new HashMap<>();
        params.put("limit", (long) limit);
        params.put("offset", (long) offset);

        String match;
        String order = DEFAULT_ORDER;

        switch (queryType) {
            case ALL_NODES -> match = "MATCH (n:WorkItem)";
            case BY_TYPE -> {
                requireFilter(f.getNodeType(), "node_type", queryType);
                WorkItemType type = InputSanitizer.sanitizeNodeType(f.getNodeType(), null);
                params.put("nodeType", type.name());
                match = "MATCH (n:WorkItem) WHERE n.type = $nodeType";
            }
            case BY_STATUS -> {
                requireFilter(f.getStatus(), "status", queryType);
                WorkItemStatus status = InputSanitizer.sanitizeNodeStatus(f.getStatus(), null);
                params.put("status", status.name());
                match = "MATCH (n:WorkItem) WHERE n.status = $status";
            }
            case BY_CONTRIBUTOR -> {
                requireFilter(f.getContributorId(), "contributor_id", queryType);
                params.put("contributorId", InputSanitizer.sanitizeId(f.getContributorId(), "Contributor ID"));
                match = "MATCH (n:WorkItem)-[:WORKED_ON_BY]->(c:Contributor) WHERE c.id = $contributorId";
            }
            case BY_PRIORITY -> {
                double minPriority = f.getMinPriority() != null ? f.getMinPriority() : 0.0;
                params.put("minPriority", minPriority);
                match = "MATCH (n:WorkItem) WHERE coalesce(n.priorityComputed, 0.0) >= $minPriority";
                order = PRIORITY_ORDER;
            }
            case SEARCH -> {
                requireFilter(f.getSearchTerm(), "search_term", queryType);
                params.put("searchTerm", f.getSearchTerm().trim());
                match = """
                    MATCH (n:WorkItem)
                    WHERE toLower(coalesce(n.title, '')) CONTAINS toLower($searchTerm)
                       OR toLower(coalesce(n.description, '')) CONTAINS toLower($searchTerm)""";
            }
            case DEPENDENCIES -> {
                requireFilter(f.getNodeId(), "node_id", queryType);
                return buildDependencies(f.getNodeId(), limit, offset);
            }
            default -> throw GraphOperationException.validation("Unknown query_type: " + queryType);
        }

        String cypher = match + "\nRETURN n\nORDER BY " + order + "\nSKIP $offset\nLIMIT $limit";
        String countCypher = match + "\nRETURN count(n) AS total";

        return BrowseQuery.builder()
            .queryType(queryType)
            .cypher(cypher)
            .countCypher(countCypher)
            .parameters(params)
            .limit(limit)
            .offset(offset)
            .build();
    }

    private BrowseQuery buildDependencies(String nodeId, int limit, int offset) {
        Map<String, Object> params = new HashMap<>();
        params.put("nodeId", InputSanitizer.sanitizeNodeId(nodeId));

        String cypher = """
            MATCH (n:WorkItem {id: $nodeId})
            OPTIONAL MATCH (n)-[:DEPENDS_ON]->(dep:WorkItem)
            OPTIONAL MATCH (dependent:WorkItem)-[:DEPENDS_ON]->(n)
            RETURN n,
                   collect(DISTINCT dep) AS dependencies,
                   collect(DISTINCT dependent) AS dependents
            """;

        return BrowseQuery.builder()
            .queryType(QueryType.DEPENDENCIES)
            .cypher(cypher)
            .parameters(params)
            .limit(limit)
            .offset(offset)
            .build();
    }

    int resolveLimit(Integer requested) {
        if (requested == null) {
            return properties.getDefaultLimit();
        }
        if (requested <= 0) {
            throw GraphOperationException.validation("limit must be greater than 0, got " + requested);
        }
        return requested;
    }

    int resolveOffset(Integer requested) {
        if (requested == null) {
            return 0;
        }
        if (requested < 0) {
            throw GraphOperationException.validation("offset must not be negative, got " + requested);
        }
        return requested;
    }

    private void requireFilter(String value, String filterName, QueryType queryType) {
        if (value == null || value.isBlank()) {
            throw GraphOperationException.validation(
                filterName + " filter is required for " + queryType.getValue() + " query");
        }
    }
}
