package com.purchasingpower.workgraph.agent.tools;

import com.purchasingpower.workgraph.analytics.ContributorAnalyticsService;
import com.purchasingpower.workgraph.analytics.ProjectContributorsQuery;
import com.purchasingpower.workgraph.util.ToolArguments;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Tool for finding contributors by the graphs their items belong to.
 *
 * @since 1.0.0
 */
@Component
@RequiredArgsConstructor
public class FindContributorsByProjectTool extends AbstractGraphTool {

    private final ContributorAnalyticsService contributorAnalyticsService;

    @Override
    public String getName() {
        return "find_contributors_by_project";
    }

    @Override
    public String getDescription() {
        return "Contributors with items in matching graphs, one row per contributor and graph, busiest first.";
    }

    @Override
    public String getParameterSchema() {
        return "{\"project_filter\": \"object (optional): graph_id, graph_name (substring, case-insensitive), node_types (array)\", \"active_only\": \"boolean (optional, default false) - only PLANNED and IN_PROGRESS items\", \"limit\": \"integer (optional, default 50)\"}";
    }

    @Override
    public ToolCategory getCategory() {
        return ToolCategory.ANALYTICS;
    }

    @Override
    protected Map<String, Object> run(ToolArguments args) {
        return contributorAnalyticsService.findContributorsByProject(ProjectContributorsQuery.from(args));
    }
}
