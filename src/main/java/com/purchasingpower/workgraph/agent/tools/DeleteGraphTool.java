package com.purchasingpower.workgraph.agent.tools;

import com.purchasingpower.workgraph.project.GraphService;
import com.purchasingpower.workgraph.util.ToolArguments;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Tool for deleting a graph container.
 *
 * @since 1.0.0
 */
@Component
@RequiredArgsConstructor
public class DeleteGraphTool extends AbstractGraphTool {

    private final GraphService graphService;

    @Override
    public String getName() {
        return "delete_graph";
    }

    @Override
    public String getDescription() {
        return "Delete a graph. A graph that still owns work items needs force=true, and its items are deleted with it.";
    }

    @Override
    public String getParameterSchema() {
        return "{\"graphId\": \"string (required)\", \"force\": \"boolean (optional, default false)\"}";
    }

    @Override
    public ToolCategory getCategory() {
        return ToolCategory.GRAPH_MANAGEMENT;
    }

    @Override
    protected Map<String, Object> run(ToolArguments args) {
        return graphService.deleteGraph(args.requireString("graphId"), args.getBoolean("force", false));
    }
}
