package com.purchasingpower.workgraph.agent.tools;

import com.purchasingpower.workgraph.query.QueryFilters;
import com.purchasingpower.workgraph.query.QueryService;
import com.purchasingpower.workgraph.query.QueryType;
import com.purchasingpower.workgraph.util.ToolArguments;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Tool for browsing work items by type, status, contributor, priority or text.
 *
 * Every listing except {@code dependencies} is paginated.
 *
 * @since 1.0.0
 */
@Component
@RequiredArgsConstructor
public class BrowseGraphTool extends AbstractGraphTool {

    private final QueryService queryService;

    @Override
    public String getName() {
        return "browse_graph";
    }

    @Override
    public String getDescription() {
        return "Browse work items by type, status, contributor, priority or text, with pagination. The dependencies query returns one node with its DEPENDS_ON neighbors.";
    }

    @Override
    public String getParameterSchema() {
        return "{\"query_type\": \"string (all_nodes, by_type, by_status, by_contributor, by_priority, dependencies, search; default all_nodes)\", \"filters\": \"object (optional: node_type, status, contributor_id, min_priority, node_id, search_term, limit default 50, offset default 0)\"}";
    }

    @Override
    public ToolCategory getCategory() {
        return ToolCategory.QUERY;
    }

    @Override
    protected Map<String, Object> run(ToolArguments args) {
        return queryService.browse(
            QueryType.fromValue(args.getString("query_type")),
            QueryFilters.from(args.getNested("filters")));
    }
}
