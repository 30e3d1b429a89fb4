package com.purchasingpower.workgraph.agent.tools;

import com.purchasingpower.workgraph.mutation.EdgeCommand;
import com.purchasingpower.workgraph.mutation.MutationService;
import com.purchasingpower.workgraph.util.ToolArguments;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Tool for removing a typed edge.
 *
 * @since 1.0.0
 */
@Component
@RequiredArgsConstructor
public class DeleteEdgeTool extends AbstractGraphTool {

    private final MutationService mutationService;

    @Override
    public String getName() {
        return "delete_edge";
    }

    @Override
    public String getDescription() {
        return "Delete the edge of the given type between two work items.";
    }

    @Override
    public String getParameterSchema() {
        return "{\"source_id\": \"string (required)\", \"target_id\": \"string (required)\", \"type\": \"string (required)\"}";
    }

    @Override
    public ToolCategory getCategory() {
        return ToolCategory.MUTATION;
    }

    @Override
    protected Map<String, Object> run(ToolArguments args) {
        return mutationService.deleteEdge(EdgeCommand.from(args));
    }
}
