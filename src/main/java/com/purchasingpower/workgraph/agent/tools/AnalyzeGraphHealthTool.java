package com.purchasingpower.workgraph.agent.tools;

import com.purchasingpower.workgraph.analytics.AnalyticsService;
import com.purchasingpower.workgraph.analytics.HealthQuery;
import com.purchasingpower.workgraph.util.ToolArguments;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Tool for scoring overall graph health.
 *
 * Combines priority spread, dependency load and bottleneck count into a
 * score in [0,1] with recommendations.
 *
 * @since 1.0.0
 */
@Component
@RequiredArgsConstructor
public class AnalyzeGraphHealthTool extends AbstractGraphTool {

    private final AnalyticsService analyticsService;

    @Override
    public String getName() {
        return "analyze_graph_health";
    }

    @Override
    public String getDescription() {
        return "Score the health of the graph and suggest improvements.";
    }

    @Override
    public String getParameterSchema() {
        return "{\"include_metrics\": \"array of string (optional: node_distribution, priority_balance, dependency_health, bottlenecks; default all)\", \"team_id\": \"string (optional)\"}";
    }

    @Override
    public ToolCategory getCategory() {
        return ToolCategory.ANALYTICS;
    }

    @Override
    protected Map<String, Object> run(ToolArguments args) {
        return analyticsService.analyzeGraphHealth(HealthQuery.from(args));
    }
}
