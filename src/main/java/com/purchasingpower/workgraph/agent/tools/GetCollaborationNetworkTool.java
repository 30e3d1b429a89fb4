package com.purchasingpower.workgraph.agent.tools;

import com.purchasingpower.workgraph.analytics.CollaborationQuery;
import com.purchasingpower.workgraph.analytics.ContributorAnalyticsService;
import com.purchasingpower.workgraph.util.ToolArguments;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Tool for the network of contributors who share work items.
 *
 * <p>Each unordered pair appears once. At most 100 pairs are read before the strength filter.
 *
 * @since 1.0.0
 */
@Component
@RequiredArgsConstructor
public class GetCollaborationNetworkTool extends AbstractGraphTool {

    private final ContributorAnalyticsService contributorAnalyticsService;

    @Override
    public String getName() {
        return "get_collaboration_network";
    }

    @Override
    public String getDescription() {
        return "Contributor pairs sharing work items, strongest first (strong >= 10 shared, moderate >= 5).";
    }

    @Override
    public String getParameterSchema() {
        return "{\"focus_contributor\": \"string (optional)\", \"project_scope\": \"string (optional) - graph ID\", \"collaboration_strength\": \"string (optional: all, strong, moderate, weak; default all)\", \"time_window_days\": \"integer (optional, default 60)\"}";
    }

    @Override
    public ToolCategory getCategory() {
        return ToolCategory.ANALYTICS;
    }

    @Override
    protected Map<String, Object> run(ToolArguments args) {
        return contributorAnalyticsService.getCollaborationNetwork(CollaborationQuery.from(args));
    }
}
