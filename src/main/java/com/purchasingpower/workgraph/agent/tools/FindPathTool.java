package com.purchasingpower.workgraph.agent.tools;

import com.purchasingpower.workgraph.query.QueryService;
import com.purchasingpower.workgraph.util.ToolArguments;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Tool for finding shortest paths between two work items.
 *
 * @since 1.0.0
 */
@Component
@RequiredArgsConstructor
public class FindPathTool extends AbstractGraphTool {

    private final QueryService queryService;

    @Override
    public String getName() {
        return "find_path";
    }

    @Override
    public String getDescription() {
        return "Find the shortest paths between two work items.";
    }

    @Override
    public String getParameterSchema() {
        return "{\"start_id\": \"string (required)\", \"end_id\": \"string (required)\", \"max_depth\": \"integer (optional, default 10)\", \"limit\": \"integer (optional, default 10)\", \"offset\": \"integer (optional, default 0)\"}";
    }

    @Override
    public ToolCategory getCategory() {
        return ToolCategory.QUERY;
    }

    @Override
    protected Map<String, Object> run(ToolArguments args) {
        return queryService.findPath(
            args.requireString("start_id"),
            args.requireString("end_id"),
            args.getInteger("max_depth"),
            args.getInteger("limit"),
            args.getInteger("offset"));
    }
}
