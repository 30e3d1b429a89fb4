package com.purchasingpower.workgraph.agent.tools;

import com.purchasingpower.workgraph.priority.PriorityService;
import com.purchasingpower.workgraph.util.ToolArguments;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Tool for updating priorities on several nodes; each item succeeds or fails on its own.
 *
 * @since 1.0.0
 */
@Component
@RequiredArgsConstructor
public class BulkUpdatePrioritiesTool extends AbstractGraphTool {

    private final PriorityService priorityService;

    @Override
    public String getName() {
        return "bulk_update_priorities";
    }

    @Override
    public String getDescription() {
        return "Update priorities of several work items. Each item succeeds or fails on its own.";
    }

    @Override
    public String getParameterSchema() {
        return "{\"updates\": \"array (required) of {node_id, priority_executive, priority_individual, priority_community}\", \"recalculate_all\": \"boolean (optional, default true)\"}";
    }

    @Override
    public ToolCategory getCategory() {
        return ToolCategory.PRIORITY;
    }

    @Override
    protected Map<String, Object> run(ToolArguments args) {
        return priorityService.bulkUpdatePriorities(
            args.getObjectList("updates"),
            args.getBoolean("recalculate_all", true));
    }
}
