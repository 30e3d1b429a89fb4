package com.purchasingpower.workgraph.query;

import com.purchasingpower.workgraph.util.ToolArguments;
import lombok.Builder;
import lombok.Data;

/**
 * Filter bag for browse queries. Every field is optional; each query type
 * decides which ones it requires.
 */
@Data
@Builder
public class QueryFilters {

    private String nodeType;
    private String status;
    private String contributorId;
    private Double minPriority;
    private String nodeId;
    private String searchTerm;
    private Integer limit;
    private Integer offset;

    public static QueryFilters from(ToolArguments filters) {
        return QueryFilters.builder()
            .nodeType(filters.getString("node_type"))
            .status(filters.getString("status"))
            .contributorId(filters.getString("contributor_id"))
            .minPriority(filters.getDouble("min_priority"))
            .nodeId(filters.getString("node_id"))
            .searchTerm(filters.getString("search_term"))
            .limit(filters.getInteger("limit"))
            .offset(filters.getInteger("offset"))
            .build();
    }
}
