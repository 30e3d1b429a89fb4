package com.purchasingpower.workgraph.analytics;

import com.purchasingpower.workgraph.core.WorkItemStatus;
import com.purchasingpower.workgraph.exception.GraphOperationException;
import com.purchasingpower.workgraph.priority.PriorityType;
import com.purchasingpower.workgraph.util.InputSanitizer;
import com.purchasingpower.workgraph.util.ToolArguments;
import lombok.Builder;
import lombok.Getter;

import java.util.Arrays;
import java.util.List;

/**
 * Arguments for ranking one contributor's items.
 *
 * <p>{@code priority_type=all} ranks by the sum of the three inputs instead of a single property.
 */
@Getter
@Builder
public class ContributorPriorityQuery {

    static final int DEFAULT_LIMIT = 10;

    private final String contributorId;

    @Builder.Default
    private final int limit = DEFAULT_LIMIT;

    @Builder.Default
    private final PriorityType priorityType = PriorityType.COMPUTED;

    private final boolean sumOfInputs;

    private final List<String> statuses;

    public String priorityLabel() {
        return sumOfInputs ? "all" : priorityType.getValue();
    }

    public static ContributorPriorityQuery from(ToolArguments args) {
        String contributorId = InputSanitizer.sanitizeId(args.requireString("contributor_id"), "contributor_id");
        int limit = args.getInt("limit", DEFAULT_LIMIT);
        if (limit <= 0) {
            throw GraphOperationException.validation("limit must be greater than zero");
        }
        String rawType = args.getString("priority_type");

        List<String> statuses;
        List<String> requested = args.getStringList("status_filter");
        if (requested == null || requested.isEmpty()) {
            statuses = Arrays.stream(WorkItemStatus.values())
                .filter(WorkItemStatus::isOpen)
                .map(Enum::name)
                .toList();
        } else {
            statuses = requested.stream()
                .map(status -> InputSanitizer.sanitizeNodeStatus(status, null).name())
                .distinct()
                .toList();
        }

        return ContributorPriorityQuery.builder()
            .contributorId(contributorId)
            .limit(limit)
            .priorityType(PriorityType.fromValue(rawType))
            .sumOfInputs("all".equalsIgnoreCase(rawType))
            .statuses(statuses)
            .build();
    }
}
