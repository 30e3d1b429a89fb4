package com.purchasingpower.workgraph.agent.tools;

import com.purchasingpower.workgraph.mutation.MutationService;
import com.purchasingpower.workgraph.util.ToolArguments;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Tool for deleting a work item with its relationships.
 *
 * @since 1.0.0
 */
@Component
@RequiredArgsConstructor
public class DeleteNodeTool extends AbstractGraphTool {

    private final MutationService mutationService;

    @Override
    public String getName() {
        return "delete_node";
    }

    @Override
    public String getDescription() {
        return "Delete a work item and all of its relationships.";
    }

    @Override
    public String getParameterSchema() {
        return "{\"node_id\": \"string (required)\"}";
    }

    @Override
    public ToolCategory getCategory() {
        return ToolCategory.MUTATION;
    }

    @Override
    protected Map<String, Object> run(ToolArguments args) {
        return mutationService.deleteNode(args.requireString("node_id"));
    }
}
