package com.purchasingpower.workgraph.agent.tools;

import com.purchasingpower.workgraph.analytics.ContributorAnalyticsService;
import com.purchasingpower.workgraph.analytics.ContributorPriorityQuery;
import com.purchasingpower.workgraph.util.ToolArguments;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Tool for ranking one contributor's items by priority.
 *
 * @since 1.0.0
 */
@Component
@RequiredArgsConstructor
public class GetContributorPrioritiesTool extends AbstractGraphTool {

    private final ContributorAnalyticsService contributorAnalyticsService;

    @Override
    public String getName() {
        return "get_contributor_priorities";
    }

    @Override
    public String getDescription() {
        return "A contributor's open work items ranked by priority, with their top dependencies.";
    }

    @Override
    public String getParameterSchema() {
        return "{\"contributor_id\": \"string (required)\", \"limit\": \"integer (optional, default 10)\", \"priority_type\": \"string (optional: composite, executive, individual, community, all)\", \"status_filter\": \"array of string (optional, default open statuses)\"}";
    }

    @Override
    public ToolCategory getCategory() {
        return ToolCategory.ANALYTICS;
    }

    @Override
    protected Map<String, Object> run(ToolArguments args) {
        return contributorAnalyticsService.getContributorPriorities(ContributorPriorityQuery.from(args));
    }
}
