package com.purchasingpower.workgraph.agent.tools;

import com.purchasingpower.workgraph.analytics.ContributorAnalyticsService;
import com.purchasingpower.workgraph.util.ToolArguments;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Tool for listing the team behind one graph.
 *
 * @since 1.0.0
 */
@Component
@RequiredArgsConstructor
public class GetProjectTeamTool extends AbstractGraphTool {

    private final ContributorAnalyticsService contributorAnalyticsService;

    @Override
    public String getName() {
        return "get_project_team";
    }

    @Override
    public String getDescription() {
        return "Everyone working on items of a graph, with item counts per member and team totals.";
    }

    @Override
    public String getParameterSchema() {
        return "{\"graph_id\": \"string (required)\"}";
    }

    @Override
    public ToolCategory getCategory() {
        return ToolCategory.ANALYTICS;
    }

    @Override
    protected Map<String, Object> run(ToolArguments args) {
        return contributorAnalyticsService.getProjectTeam(args.requireString("graph_id"));
    }
}
