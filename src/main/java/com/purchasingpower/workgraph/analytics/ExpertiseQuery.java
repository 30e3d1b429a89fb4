package com.purchasingpower.workgraph.analytics;

import com.purchasingpower.workgraph.exception.GraphOperationException;
import com.purchasingpower.workgraph.util.InputSanitizer;
import com.purchasingpower.workgraph.util.ToolArguments;
import lombok.Builder;
import lombok.Getter;

/**
 * Arguments for a contributor's expertise profile over recently updated items.
 */
@Getter
@Builder
public class ExpertiseQuery {

    static final int DEFAULT_WINDOW_DAYS = 90;
    static final int DEFAULT_MIN_ITEMS = 3;

    private final String contributorId;

    @Builder.Default
    private final int timeWindowDays = DEFAULT_WINDOW_DAYS;

    @Builder.Default
    private final int minItemsThreshold = DEFAULT_MIN_ITEMS;

    @Builder.Default
    private final boolean includeWorkTypes = true;

    @Builder.Default
    private final boolean includeProjects = true;

    public static ExpertiseQuery from(ToolArguments args) {
        int window = args.getInt("time_window_days", DEFAULT_WINDOW_DAYS);
        if (window <= 0) {
            throw GraphOperationException.validation("time_window_days must be greater than zero");
        }
        int minItems = args.getInt("min_items_threshold", DEFAULT_MIN_ITEMS);
        if (minItems <= 0) {
            throw GraphOperationException.validation("min_items_threshold must be greater than zero");
        }
        return ExpertiseQuery.builder()
            .contributorId(InputSanitizer.sanitizeId(args.requireString("contributor_id"), "contributor_id"))
            .timeWindowDays(window)
            .minItemsThreshold(minItems)
            .includeWorkTypes(args.getBoolean("include_work_types", true))
            .includeProjects(args.getBoolean("include_projects", true))
            .build();
    }
}
