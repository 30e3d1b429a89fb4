package com.purchasingpower.workgraph.agent.tools;

import com.purchasingpower.workgraph.analytics.ContributorAnalyticsService;
import com.purchasingpower.workgraph.util.ToolArguments;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Tool for one contributor's workload breakdown.
 *
 * @since 1.0.0
 */
@Component
@RequiredArgsConstructor
public class GetContributorWorkloadTool extends AbstractGraphTool {

    private final ContributorAnalyticsService contributorAnalyticsService;

    @Override
    public String getName() {
        return "get_contributor_workload";
    }

    @Override
    public String getDescription() {
        return "Item counts by status, blocked ratio and average priority for one contributor.";
    }

    @Override
    public String getParameterSchema() {
        return "{\"contributor_id\": \"string (required)\"}";
    }

    @Override
    public ToolCategory getCategory() {
        return ToolCategory.ANALYTICS;
    }

    @Override
    protected Map<String, Object> run(ToolArguments args) {
        return contributorAnalyticsService.getContributorWorkload(args.requireString("contributor_id"));
    }
}
