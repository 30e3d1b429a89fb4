package com.purchasingpower.workgraph.agent.tools;

import com.purchasingpower.workgraph.analytics.AnalyticsService;
import com.purchasingpower.workgraph.analytics.BottleneckQuery;
import com.purchasingpower.workgraph.util.ToolArguments;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Tool for detecting bottlenecks.
 *
 * Reports heavily depended-on items and blocked items waiting on open work,
 * with optional resolution suggestions.
 *
 * @since 1.0.0
 */
@Component
@RequiredArgsConstructor
public class GetBottlenecksTool extends AbstractGraphTool {

    private final AnalyticsService analyticsService;

    @Override
    public String getName() {
        return "get_bottlenecks";
    }

    @Override
    public String getDescription() {
        return "Find work items with many dependents and blocked items waiting on open work, with severity and suggested resolutions.";
    }

    @Override
    public String getParameterSchema() {
        return "{\"analysis_depth\": \"integer (optional, default 5) - minimum dependents, exclusive\", \"limit\": \"integer (optional, default 10)\", \"include_suggested_resolutions\": \"boolean (optional, default true)\", \"team_id\": \"string (optional)\"}";
    }

    @Override
    public ToolCategory getCategory() {
        return ToolCategory.ANALYTICS;
    }

    @Override
    protected Map<String, Object> run(ToolArguments args) {
        return analyticsService.getBottlenecks(BottleneckQuery.from(args));
    }
}
