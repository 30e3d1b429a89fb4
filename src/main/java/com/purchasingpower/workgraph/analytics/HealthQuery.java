package com.purchasingpower.workgraph.analytics;

import com.purchasingpower.workgraph.exception.GraphOperationException;
import com.purchasingpower.workgraph.util.InputSanitizer;
import com.purchasingpower.workgraph.util.ToolArguments;
import lombok.Builder;
import lombok.Getter;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Arguments of a graph health analysis.
 */
@Getter
@Builder
public class HealthQuery {

    public static final String NODE_DISTRIBUTION = "node_distribution";
    public static final String PRIORITY_BALANCE = "priority_balance";
    public static final String DEPENDENCY_HEALTH = "dependency_health";
    public static final String BOTTLENECKS = "bottlenecks";

    static final List<String> ALL_METRICS = List.of(NODE_DISTRIBUTION, PRIORITY_BALANCE, DEPENDENCY_HEALTH, BOTTLENECKS);

    /** Output sections to include. The score always uses every signal. */
    private final Set<String> metrics;

    private final String teamId;

    public boolean includes(String metric) {
        return metrics.contains(metric);
    }

    public static HealthQuery from(ToolArguments args) {
        List<String> requested = args.getStringList("include_metrics");
        Set<String> metrics = new LinkedHashSet<>();
        if (requested == null || requested.isEmpty()) {
            metrics.addAll(ALL_METRICS);
        } else {
            for (String metric : requested) {
                if (!ALL_METRICS.contains(metric)) {
                    throw GraphOperationException.validation(
                        "Invalid metric: " + metric + ". Must be one of: " + String.join(", ", ALL_METRICS));
                }
                metrics.add(metric);
            }
        }
        String teamId = args.has("team_id") ? InputSanitizer.sanitizeId(args.getRaw("team_id"), "team_id") : null;
        return HealthQuery.builder().metrics(metrics).teamId(teamId).build();
    }
}
