package com.purchasingpower.workgraph.agent.tools;

import com.purchasingpower.workgraph.project.CreateGraphCommand;
import com.purchasingpower.workgraph.project.GraphService;
import com.purchasingpower.workgraph.util.ToolArguments;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Tool for creating a graph container.
 *
 * @since 1.0.0
 */
@Component
@RequiredArgsConstructor
public class CreateGraphTool extends AbstractGraphTool {

    private final GraphService graphService;

    @Override
    public String getName() {
        return "create_graph";
    }

    @Override
    public String getDescription() {
        return "Create a graph container for work items.";
    }

    @Override
    public String getParameterSchema() {
        return "{\"name\": \"string (required)\", \"description\": \"string (optional)\", \"type\": \"string (PROJECT, WORKSPACE, SUBGRAPH, TEMPLATE; default PROJECT)\", \"status\": \"string (ACTIVE, ARCHIVED, DRAFT, LOCKED; default ACTIVE)\", \"teamId\": \"string (optional)\", \"parentGraphId\": \"string (optional)\", \"isShared\": \"boolean (optional, default false)\", \"settings\": \"object (optional)\"}";
    }

    @Override
    public ToolCategory getCategory() {
        return ToolCategory.GRAPH_MANAGEMENT;
    }

    @Override
    protected Map<String, Object> run(ToolArguments args) {
        return graphService.createGraph(CreateGraphCommand.from(args));
    }
}
