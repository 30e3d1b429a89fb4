package com.purchasingpower.workgraph.analytics;

import lombok.Builder;
import lombok.Getter;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Item counts for one contributor.
 */
@Getter
@Builder
public class ContributorWorkload {

    private final String contributorId;
    private final String name;
    private final long totalItems;
    private final long inProgressItems;
    private final long completedItems;
    private final long blockedItems;
    private final double avgPriority;
    private final long highPriority;
    private final long mediumPriority;
    private final long lowPriority;
    private final List<String> workTypes;
    private final List<String> statuses;

    public double blockedRatio() {
        return totalItems > 0 ? (double) blockedItems / totalItems : 0.0;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> distribution = new LinkedHashMap<>();
        distribution.put("high_priority", highPriority);
        distribution.put("medium_priority", mediumPriority);
        distribution.put("low_priority", lowPriority);

        Map<String, Object> map = new LinkedHashMap<>();
        map.put("contributor_id", contributorId);
        map.put("name", name);
        map.put("total_items", totalItems);
        map.put("in_progress_items", inProgressItems);
        map.put("completed_items", completedItems);
        map.put("blocked_items", blockedItems);
        map.put("avg_priority", avgPriority);
        map.put("work_types", workTypes != null ? workTypes : List.of());
        map.put("statuses", statuses != null ? statuses : List.of());
        map.put("priority_distribution", distribution);
        return map;
    }
}
