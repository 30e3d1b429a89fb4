package com.purchasingpower.workgraph.analytics;

import com.purchasingpower.workgraph.exception.GraphOperationException;
import com.purchasingpower.workgraph.util.InputSanitizer;
import com.purchasingpower.workgraph.util.ToolArguments;
import lombok.Builder;
import lombok.Getter;

/**
 * Scope of a collaboration network: an optional focus contributor and graph,
 * a strength filter and a window on item updates.
 */
@Getter
@Builder
public class CollaborationQuery {

    static final int DEFAULT_WINDOW_DAYS = 60;
    static final int MAX_PAIRS = 100;

    private final String focusContributor;

    private final String projectScope;

    /** Null keeps every strength. */
    private final CollaborationStrength strength;

    @Builder.Default
    private final int timeWindowDays = DEFAULT_WINDOW_DAYS;

    public static CollaborationQuery from(ToolArguments args) {
        int window = args.getInt("time_window_days", DEFAULT_WINDOW_DAYS);
        if (window <= 0) {
            throw GraphOperationException.validation("time_window_days must be greater than zero");
        }
        return CollaborationQuery.builder()
            .focusContributor(args.has("focus_contributor")
                ? InputSanitizer.sanitizeId(args.getString("focus_contributor"), "focus_contributor") : null)
            .projectScope(args.has("project_scope")
                ? InputSanitizer.sanitizeId(args.getString("project_scope"), "project_scope") : null)
            .strength(CollaborationStrength.filterOf(args.getString("collaboration_strength")))
            .timeWindowDays(window)
            .build();
    }
}
