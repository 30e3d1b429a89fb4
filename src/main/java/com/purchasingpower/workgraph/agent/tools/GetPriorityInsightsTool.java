package com.purchasingpower.workgraph.agent.tools;

import com.purchasingpower.workgraph.priority.PriorityInsightsQuery;
import com.purchasingpower.workgraph.priority.PriorityService;
import com.purchasingpower.workgraph.util.ToolArguments;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Tool for priority statistics and distributions.
 *
 * @since 1.0.0
 */
@Component
@RequiredArgsConstructor
public class GetPriorityInsightsTool extends AbstractGraphTool {

    private final PriorityService priorityService;

    @Override
    public String getName() {
        return "get_priority_insights";
    }

    @Override
    public String getDescription() {
        return "Priority statistics, type and status distributions and top items.";
    }

    @Override
    public String getParameterSchema() {
        return "{\"filters\": \"object (optional: min_priority, priority_type (computed, executive, individual, community), node_types, status, limit default 10)\"}";
    }

    @Override
    public ToolCategory getCategory() {
        return ToolCategory.PRIORITY;
    }

    @Override
    protected Map<String, Object> run(ToolArguments args) {
        return priorityService.getPriorityInsights(PriorityInsightsQuery.from(args));
    }
}
