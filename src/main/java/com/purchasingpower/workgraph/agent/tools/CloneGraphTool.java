package com.purchasingpower.workgraph.agent.tools;

import com.purchasingpower.workgraph.project.CloneGraphCommand;
import com.purchasingpower.workgraph.project.GraphService;
import com.purchasingpower.workgraph.util.ToolArguments;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Tool for copying a graph with its items and edges.
 *
 * @since 1.0.0
 */
@Component
@RequiredArgsConstructor
public class CloneGraphTool extends AbstractGraphTool {

    private final GraphService graphService;

    @Override
    public String getName() {
        return "clone_graph";
    }

    @Override
    public String getDescription() {
        return "Copy a graph with its work items and the edges between them. Cloned items start as PROPOSED.";
    }

    @Override
    public String getParameterSchema() {
        return "{\"sourceGraphId\": \"string (required)\", \"newName\": \"string (required)\", \"includeNodes\": \"boolean (optional, default true)\", \"includeEdges\": \"boolean (optional, default true)\", \"teamId\": \"string (optional)\"}";
    }

    @Override
    public ToolCategory getCategory() {
        return ToolCategory.GRAPH_MANAGEMENT;
    }

    @Override
    protected Map<String, Object> run(ToolArguments args) {
        return graphService.cloneGraph(CloneGraphCommand.from(args));
    }
}
