package com.purchasingpower.workgraph.agent.tools;

import com.purchasingpower.workgraph.mutation.CreateNodeCommand;
import com.purchasingpower.workgraph.mutation.MutationService;
import com.purchasingpower.workgraph.util.ToolArguments;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Tool for creating a work item.
 *
 * @since 1.0.0
 */
@Component
@RequiredArgsConstructor
public class CreateNodeTool extends AbstractGraphTool {

    private final MutationService mutationService;

    @Override
    public String getName() {
        return "create_node";
    }

    @Override
    public String getDescription() {
        return "Create a work item. Priorities start at 0 and radius at 1.0; contributors are created on first reference.";
    }

    @Override
    public String getParameterSchema() {
        return "{\"title\": \"string (required)\", \"description\": \"string (optional)\", \"type\": \"string (OUTCOME, EPIC, INITIATIVE, STORY, TASK, BUG, FEATURE, MILESTONE; default TASK)\", \"status\": \"string (default PROPOSED)\", \"contributor_ids\": \"array of string (optional)\", \"metadata\": \"object (optional)\", \"graph_id\": \"string (optional) - owning graph\", \"id\": \"string (optional) - caller-chosen ID\"}";
    }

    @Override
    public ToolCategory getCategory() {
        return ToolCategory.MUTATION;
    }

    @Override
    protected Map<String, Object> run(ToolArguments args) {
        return mutationService.createNode(CreateNodeCommand.from(args));
    }
}
