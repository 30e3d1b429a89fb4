package com.purchasingpower.workgraph.analytics;

import com.purchasingpower.workgraph.exception.GraphOperationException;
import com.purchasingpower.workgraph.util.InputSanitizer;
import com.purchasingpower.workgraph.util.ToolArguments;
import lombok.Builder;
import lombok.Getter;

import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.List;

/**
 * Arguments of a workload analysis. A null contributor list means every contributor.
 */
@Getter
@Builder
public class WorkloadQuery {

    private final List<String> contributorIds;

    @Builder.Default
    private final boolean includeCapacity = true;

    @Builder.Default
    private final boolean includePredictions = true;

    /** ISO-8601 bounds on work item {@code createdAt}, inclusive. */
    private final String windowStart;
    private final String windowEnd;

    public static WorkloadQuery from(ToolArguments args) {
        List<String> ids = args.getStringList("contributor_ids");
        List<String> sanitized = null;
        if (ids != null && !ids.isEmpty()) {
            sanitized = ids.stream()
                .map(id -> InputSanitizer.sanitizeId(id, "contributor_id"))
                .distinct()
                .toList();
        }
        ToolArguments window = args.getNested("time_window");
        return WorkloadQuery.builder()
            .contributorIds(sanitized)
            .includeCapacity(args.getBoolean("include_capacity", true))
            .includePredictions(args.getBoolean("include_predictions", true))
            .windowStart(timestamp(window, "start"))
            .windowEnd(timestamp(window, "end"))
            .build();
    }

    private static String timestamp(ToolArguments window, String key) {
        String value = window.getString(key);
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value.trim()).toString();
        } catch (DateTimeParseException e) {
            throw GraphOperationException.validation(
                "time_window." + key + " must be an ISO-8601 timestamp with offset, got: " + value);
        }
    }
}
