package com.purchasingpower.workgraph.agent.tools;

import com.purchasingpower.workgraph.project.GraphService;
import com.purchasingpower.workgraph.util.ToolArguments;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Tool for archiving a graph container.
 *
 * @since 1.0.0
 */
@Component
@RequiredArgsConstructor
public class ArchiveGraphTool extends AbstractGraphTool {

    private final GraphService graphService;

    @Override
    public String getName() {
        return "archive_graph";
    }

    @Override
    public String getDescription() {
        return "Archive a graph, keeping its work items.";
    }

    @Override
    public String getParameterSchema() {
        return "{\"graphId\": \"string (required)\", \"reason\": \"string (optional)\"}";
    }

    @Override
    public ToolCategory getCategory() {
        return ToolCategory.GRAPH_MANAGEMENT;
    }

    @Override
    protected Map<String, Object> run(ToolArguments args) {
        return graphService.archiveGraph(args.requireString("graphId"), args.getString("reason"));
    }
}
