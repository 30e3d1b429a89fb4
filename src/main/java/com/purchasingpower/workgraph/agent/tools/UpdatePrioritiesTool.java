package com.purchasingpower.workgraph.agent.tools;

import com.purchasingpower.workgraph.priority.PriorityService;
import com.purchasingpower.workgraph.priority.PriorityUpdate;
import com.purchasingpower.workgraph.util.ToolArguments;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Tool for updating a work item's priority inputs.
 *
 * @since 1.0.0
 */
@Component
@RequiredArgsConstructor
public class UpdatePrioritiesTool extends AbstractGraphTool {

    private final PriorityService priorityService;

    @Override
    public String getName() {
        return "update_priorities";
    }

    @Override
    public String getDescription() {
        return "Set the executive, individual and community priority of a work item and recompute its composite priority and radius.";
    }

    @Override
    public String getParameterSchema() {
        return "{\"node_id\": \"string (required)\", \"priority_executive\": \"number 0-1 (optional)\", \"priority_individual\": \"number 0-1 (optional)\", \"priority_community\": \"number 0-1 (optional)\", \"recalculate_computed\": \"boolean (optional, default true)\"}";
    }

    @Override
    public ToolCategory getCategory() {
        return ToolCategory.PRIORITY;
    }

    @Override
    protected Map<String, Object> run(ToolArguments args) {
        return priorityService.updatePriorities(
            PriorityUpdate.from(args, args.getBoolean("recalculate_computed", true)));
    }
}
