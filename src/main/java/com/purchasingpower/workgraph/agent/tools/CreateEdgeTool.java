package com.purchasingpower.workgraph.agent.tools;

import com.purchasingpower.workgraph.mutation.EdgeCommand;
import com.purchasingpower.workgraph.mutation.MutationService;
import com.purchasingpower.workgraph.util.ToolArguments;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Tool for creating or updating a typed edge between two work items.
 *
 * @since 1.0.0
 */
@Component
@RequiredArgsConstructor
public class CreateEdgeTool extends AbstractGraphTool {

    private final MutationService mutationService;

    @Override
    public String getName() {
        return "create_edge";
    }

    @Override
    public String getDescription() {
        return "Create a typed edge between two existing work items. Repeating the call updates the same edge.";
    }

    @Override
    public String getParameterSchema() {
        return "{\"source_id\": \"string (required)\", \"target_id\": \"string (required)\", \"type\": \"string (DEPENDS_ON, BLOCKS, RELATES_TO, CONTAINS, PART_OF)\", \"weight\": \"number (optional, default 1.0)\", \"metadata\": \"object (optional)\"}";
    }

    @Override
    public ToolCategory getCategory() {
        return ToolCategory.MUTATION;
    }

    @Override
    protected Map<String, Object> run(ToolArguments args) {
        return mutationService.createEdge(EdgeCommand.from(args));
    }
}
