package com.purchasingpower.workgraph.agent.tools;

import com.purchasingpower.workgraph.analytics.AnalyticsService;
import com.purchasingpower.workgraph.analytics.WorkloadQuery;
import com.purchasingpower.workgraph.util.ToolArguments;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Tool for team workload, capacity and prediction analysis.
 *
 * @since 1.0.0
 */
@Component
@RequiredArgsConstructor
public class GetWorkloadAnalysisTool extends AbstractGraphTool {

    private final AnalyticsService analyticsService;

    @Override
    public String getName() {
        return "get_workload_analysis";
    }

    @Override
    public String getDescription() {
        return "Per-contributor workload with capacity classification and predictions.";
    }

    @Override
    public String getParameterSchema() {
        return "{\"contributor_ids\": \"array of string (optional, default all)\", \"time_window\": \"object (optional: start, end as ISO-8601)\", \"include_capacity\": \"boolean (optional, default true)\", \"include_predictions\": \"boolean (optional, default true)\"}";
    }

    @Override
    public ToolCategory getCategory() {
        return ToolCategory.ANALYTICS;
    }

    @Override
    protected Map<String, Object> run(ToolArguments args) {
        return analyticsService.getWorkloadAnalysis(WorkloadQuery.from(args));
    }
}
