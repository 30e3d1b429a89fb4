package com.purchasingpower.workgraph.agent.tools;

import com.purchasingpower.workgraph.project.GraphService;
import com.purchasingpower.workgraph.project.GraphUpdate;
import com.purchasingpower.workgraph.util.ToolArguments;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Tool for partially updating a graph container, including its parent.
 *
 * @since 1.0.0
 */
@Component
@RequiredArgsConstructor
public class UpdateGraphTool extends AbstractGraphTool {

    private final GraphService graphService;

    @Override
    public String getName() {
        return "update_graph";
    }

    @Override
    public String getDescription() {
        return "Update the given fields of a graph. A new parent must not create a cycle.";
    }

    @Override
    public String getParameterSchema() {
        return "{\"graphId\": \"string (required)\", \"name\": \"string (optional)\", \"description\": \"string (optional)\", \"type\": \"string (optional)\", \"status\": \"string (optional)\", \"teamId\": \"string (optional)\", \"parentGraphId\": \"string (optional)\", \"isShared\": \"boolean (optional)\", \"settings\": \"object (optional)\"}";
    }

    @Override
    public ToolCategory getCategory() {
        return ToolCategory.GRAPH_MANAGEMENT;
    }

    @Override
    protected Map<String, Object> run(ToolArguments args) {
        return graphService.updateGraph(args.requireString("graphId"), GraphUpdate.from(args));
    }
}
