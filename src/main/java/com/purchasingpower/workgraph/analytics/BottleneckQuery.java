package com.purchasingpower.workgraph.analytics;

import com.purchasingpower.workgraph.exception.GraphOperationException;
import com.purchasingpower.workgraph.util.InputSanitizer;
import com.purchasingpower.workgraph.util.ToolArguments;
import lombok.Builder;
import lombok.Getter;

/**
 * Arguments of bottleneck detection.
 */
@Getter
@Builder
public class BottleneckQuery {

    static final int DEFAULT_ANALYSIS_DEPTH = 5;
    static final int DEFAULT_LIMIT = 10;

    /** Minimum dependent count, exclusive. */
    @Builder.Default
    private final int analysisDepth = DEFAULT_ANALYSIS_DEPTH;

    @Builder.Default
    private final int limit = DEFAULT_LIMIT;

    @Builder.Default
    private final boolean includeResolutions = true;

    private final String teamId;

    public static BottleneckQuery from(ToolArguments args) {
        int depth = args.getInt("analysis_depth", DEFAULT_ANALYSIS_DEPTH);
        int limit = args.getInt("limit", DEFAULT_LIMIT);
        if (depth < 0) {
            throw GraphOperationException.validation("analysis_depth must be zero or greater");
        }
        if (limit <= 0) {
            throw GraphOperationException.validation("limit must be greater than zero");
        }
        return BottleneckQuery.builder()
            .analysisDepth(depth)
            .limit(limit)
            .includeResolutions(args.getBoolean("include_suggested_resolutions", true))
            .teamId(args.has("team_id") ? InputSanitizer.sanitizeId(args.getRaw("team_id"), "team_id") : null)
            .build();
    }
}
