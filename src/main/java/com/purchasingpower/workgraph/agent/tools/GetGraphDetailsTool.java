package com.purchasingpower.workgraph.agent.tools;

import com.purchasingpower.workgraph.project.GraphService;
import com.purchasingpower.workgraph.util.ToolArguments;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Tool for a graph container's properties, statistics and children.
 *
 * @since 1.0.0
 */
@Component
@RequiredArgsConstructor
public class GetGraphDetailsTool extends AbstractGraphTool {

    private final GraphService graphService;

    @Override
    public String getName() {
        return "get_graph_details";
    }

    @Override
    public String getDescription() {
        return "Get a graph with node and edge counts and its child graphs.";
    }

    @Override
    public String getParameterSchema() {
        return "{\"graphId\": \"string (required)\"}";
    }

    @Override
    public ToolCategory getCategory() {
        return ToolCategory.GRAPH_MANAGEMENT;
    }

    @Override
    protected Map<String, Object> run(ToolArguments args) {
        return graphService.getGraphDetails(args.requireString("graphId"));
    }
}
