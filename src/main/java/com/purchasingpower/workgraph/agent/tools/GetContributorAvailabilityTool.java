package com.purchasingpower.workgraph.agent.tools;

import com.purchasingpower.workgraph.analytics.AvailabilityQuery;
import com.purchasingpower.workgraph.analytics.ContributorAnalyticsService;
import com.purchasingpower.workgraph.util.ToolArguments;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Tool for contributor availability.
 *
 * @since 1.0.0
 */
@Component
@RequiredArgsConstructor
public class GetContributorAvailabilityTool extends AbstractGraphTool {

    private final ContributorAnalyticsService contributorAnalyticsService;

    @Override
    public String getName() {
        return "get_contributor_availability";
    }

    @Override
    public String getDescription() {
        return "Active load per contributor with availability class, overload risk and recommendations.";
    }

    @Override
    public String getParameterSchema() {
        return "{\"contributor_ids\": \"array of string (optional, default all)\", \"include_overload_risk\": \"boolean (optional, default true)\", \"include_recommendations\": \"boolean (optional, default true)\"}";
    }

    @Override
    public ToolCategory getCategory() {
        return ToolCategory.ANALYTICS;
    }

    @Override
    protected Map<String, Object> run(ToolArguments args) {
        return contributorAnalyticsService.getContributorAvailability(AvailabilityQuery.from(args));
    }
}
