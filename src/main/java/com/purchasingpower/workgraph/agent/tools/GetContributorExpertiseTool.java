package com.purchasingpower.workgraph.agent.tools;

import com.purchasingpower.workgraph.analytics.ContributorAnalyticsService;
import com.purchasingpower.workgraph.analytics.ExpertiseQuery;
import com.purchasingpower.workgraph.util.ToolArguments;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Tool for a contributor's expertise profile.
 *
 * @since 1.0.0
 */
@Component
@RequiredArgsConstructor
public class GetContributorExpertiseTool extends AbstractGraphTool {

    private final ContributorAnalyticsService contributorAnalyticsService;

    @Override
    public String getName() {
        return "get_contributor_expertise";
    }

    @Override
    public String getDescription() {
        return "Completion rate and per work-type expertise (expert, proficient, beginner) over recently updated items.";
    }

    @Override
    public String getParameterSchema() {
        return "{\"contributor_id\": \"string (required)\", \"time_window_days\": \"integer (optional, default 90)\", \"min_items_threshold\": \"integer (optional, default 3) - items needed before a type counts beyond beginner\", \"include_work_types\": \"boolean (optional, default true)\", \"include_projects\": \"boolean (optional, default true)\"}";
    }

    @Override
    public ToolCategory getCategory() {
        return ToolCategory.ANALYTICS;
    }

    @Override
    protected Map<String, Object> run(ToolArguments args) {
        return contributorAnalyticsService.getContributorExpertise(ExpertiseQuery.from(args));
    }
}
