package com.purchasingpower.workgraph.analytics;

import com.purchasingpower.workgraph.core.WorkItemStatus;
import com.purchasingpower.workgraph.exception.GraphOperationException;
import com.purchasingpower.workgraph.util.InputSanitizer;
import com.purchasingpower.workgraph.util.ToolArguments;
import lombok.Builder;
import lombok.Getter;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Filters for finding contributors by the graphs their items belong to.
 */
@Getter
@Builder
public class ProjectContributorsQuery {

    static final int DEFAULT_LIMIT = 50;

    static final List<String> ACTIVE_STATUSES = List.of(WorkItemStatus.PLANNED.name(), WorkItemStatus.IN_PROGRESS.name());

    private final String graphId;

    private final String graphName;

    private final List<String> nodeTypes;

    private final boolean activeOnly;

    @Builder.Default
    private final int limit = DEFAULT_LIMIT;

    public Map<String, Object> filtersApplied() {
        Map<String, Object> filters = new LinkedHashMap<>();
        filters.put("graph_id", graphId);
        filters.put("graph_name", graphName);
        filters.put("node_types", nodeTypes);
        filters.put("active_only", activeOnly);
        return filters;
    }

    public static ProjectContributorsQuery from(ToolArguments args) {
        ToolArguments filter = args.getNested("project_filter");
        int limit = args.getInt("limit", DEFAULT_LIMIT);
        if (limit <= 0) {
            throw GraphOperationException.validation("limit must be greater than zero");
        }

        List<String> rawTypes = filter.getStringList("node_types");
        List<String> nodeTypes = rawTypes == null || rawTypes.isEmpty() ? null : rawTypes.stream()
            .map(type -> InputSanitizer.sanitizeNodeType(type, null).name())
            .distinct()
            .toList();
        String graphName = filter.getString("graph_name");

        return ProjectContributorsQuery.builder()
            .graphId(filter.has("graph_id") ? InputSanitizer.sanitizeId(filter.getString("graph_id"), "graph_id") : null)
            .graphName(graphName == null || graphName.isBlank() ? null : InputSanitizer.sanitizeString(graphName.trim(), 200))
            .nodeTypes(nodeTypes)
            .activeOnly(args.getBoolean("active_only", false))
            .limit(limit)
            .build();
    }
}
