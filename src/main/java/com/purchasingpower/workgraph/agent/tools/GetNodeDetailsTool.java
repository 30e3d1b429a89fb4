package com.purchasingpower.workgraph.agent.tools;

import com.purchasingpower.workgraph.query.QueryService;
import com.purchasingpower.workgraph.util.ToolArguments;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Tool for a work item with its contributors and paginated relationships.
 *
 * @since 1.0.0
 */
@Component
@RequiredArgsConstructor
public class GetNodeDetailsTool extends AbstractGraphTool {

    private final QueryService queryService;

    @Override
    public String getName() {
        return "get_node_details";
    }

    @Override
    public String getDescription() {
        return "Get a work item with its contributors, dependencies, dependents and paginated relationships.";
    }

    @Override
    public String getParameterSchema() {
        return "{\"node_id\": \"string (required)\", \"relationships_limit\": \"integer (optional, default 20, max 100)\", \"relationships_offset\": \"integer (optional, default 0)\"}";
    }

    @Override
    public ToolCategory getCategory() {
        return ToolCategory.QUERY;
    }

    @Override
    protected Map<String, Object> run(ToolArguments args) {
        return queryService.getNodeDetails(
            args.requireString("node_id"),
            args.getInteger("relationships_limit"),
            args.getInteger("relationships_offset"));
    }
}
