package com.purchasingpower.workgraph.agent.tools;

import com.purchasingpower.workgraph.mutation.MutationService;
import com.purchasingpower.workgraph.mutation.NodeUpdate;
import com.purchasingpower.workgraph.util.ToolArguments;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Tool for partially updating a work item.
 *
 * @since 1.0.0
 */
@Component
@RequiredArgsConstructor
public class UpdateNodeTool extends AbstractGraphTool {

    private final MutationService mutationService;

    @Override
    public String getName() {
        return "update_node";
    }

    @Override
    public String getDescription() {
        return "Update only the given fields of a work item. contributor_ids replaces the whole contributor set.";
    }

    @Override
    public String getParameterSchema() {
        return "{\"node_id\": \"string (required)\", \"title\": \"string (optional)\", \"description\": \"string (optional)\", \"type\": \"string (optional)\", \"status\": \"string (optional)\", \"contributor_ids\": \"array of string (optional)\", \"metadata\": \"object (optional)\"}";
    }

    @Override
    public ToolCategory getCategory() {
        return ToolCategory.MUTATION;
    }

    @Override
    protected Map<String, Object> run(ToolArguments args) {
        return mutationService.updateNode(args.getString("node_id"), NodeUpdate.from(args));
    }
}
