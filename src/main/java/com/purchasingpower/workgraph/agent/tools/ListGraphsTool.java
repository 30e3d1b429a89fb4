package com.purchasingpower.workgraph.agent.tools;

import com.purchasingpower.workgraph.project.GraphListQuery;
import com.purchasingpower.workgraph.project.GraphService;
import com.purchasingpower.workgraph.util.ToolArguments;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Tool for listing graph containers.
 *
 * @since 1.0.0
 */
@Component
@RequiredArgsConstructor
public class ListGraphsTool extends AbstractGraphTool {

    private final GraphService graphService;

    @Override
    public String getName() {
        return "list_graphs";
    }

    @Override
    public String getDescription() {
        return "List graphs, most recently updated first.";
    }

    @Override
    public String getParameterSchema() {
        return "{\"type\": \"string (optional)\", \"status\": \"string (optional)\", \"teamId\": \"string (optional)\", \"isShared\": \"boolean (optional)\", \"limit\": \"integer (optional, default 50)\", \"offset\": \"integer (optional, default 0)\"}";
    }

    @Override
    public ToolCategory getCategory() {
        return ToolCategory.GRAPH_MANAGEMENT;
    }

    @Override
    protected Map<String, Object> run(ToolArguments args) {
        return graphService.listGraphs(GraphListQuery.from(args));
    }
}
