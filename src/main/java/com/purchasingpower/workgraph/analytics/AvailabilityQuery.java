package com.purchasingpower.workgraph.analytics;

import com.purchasingpower.workgraph.util.InputSanitizer;
import com.purchasingpower.workgraph.util.ToolArguments;
import lombok.Builder;
import lombok.Getter;

import java.util.List;

@Getter
@Builder
public class AvailabilityQuery {

    /** Null means every contributor. */
    private final List<String> contributorIds;

    @Builder.Default
    private final boolean includeOverloadRisk = true;

    @Builder.Default
    private final boolean includeRecommendations = true;

    public static AvailabilityQuery from(ToolArguments args) {
        List<String> requested = args.getStringList("contributor_ids");
        List<String> ids = requested == null || requested.isEmpty() ? null : requested.stream()
            .map(id -> InputSanitizer.sanitizeId(id, "contributor_id"))
            .distinct()
            .toList();
        return AvailabilityQuery.builder()
            .contributorIds(ids)
            .includeOverloadRisk(args.getBoolean("include_overload_risk", true))
            .includeRecommendations(args.getBoolean("include_recommendations", true))
            .build();
    }
}
