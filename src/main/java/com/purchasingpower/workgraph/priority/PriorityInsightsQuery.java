package com.purchasingpower.workgraph.priority;

import com.purchasingpower.workgraph.core.WorkItemStatus;
import com.purchasingpower.workgraph.core.WorkItemType;
import com.purchasingpower.workgraph.util.InputSanitizer;
import com.purchasingpower.workgraph.util.ToolArguments;
import lombok.Builder;
import lombok.Getter;

import java.util.List;

@Getter
@Builder
public class PriorityInsightsQuery {

    private final Double minPriority;

    @Builder.Default
    private final PriorityType priorityType = PriorityType.COMPUTED;

    private final List<String> nodeTypes;
    private final List<String> statuses;

    @Builder.Default
    private final int topLimit = 10;

    public static PriorityInsightsQuery from(ToolArguments args) {
        ToolArguments filters = args.getNested("filters");
        List<String> nodeTypes = filters.getStringList("node_types");
        List<String> statuses = filters.getStringList("status");
        return PriorityInsightsQuery.builder()
            .minPriority(InputSanitizer.sanitizePriority(filters.getRaw("min_priority"), "min_priority"))
            .priorityType(PriorityType.fromValue(filters.getString("priority_type")))
            .nodeTypes(nodeTypes == null || nodeTypes.isEmpty() ? null : nodeTypes.stream()
                .map(type -> InputSanitizer.sanitizeNodeType(type, null).name())
                .toList())
            .statuses(statuses == null || statuses.isEmpty() ? null : statuses.stream()
                .map(status -> InputSanitizer.sanitizeNodeStatus(status, null).name())
                .toList())
            .topLimit(args.getInt("limit", 10))
            .build();
    }
}
