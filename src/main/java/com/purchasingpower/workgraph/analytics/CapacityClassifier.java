package com.purchasingpower.workgraph.analytics;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Classifies contributors as overloaded, underutilized or balanced.
 *
 * <p>Load ratio is a contributor's item count over the cohort average.
 * Overloaded: load ratio above 1.5 or more than 30% of items blocked.
 * Underutilized: load ratio below 0.5. Everyone else is balanced.
 *
 * @since 1.0.0
 */
@Component
public class CapacityClassifier {

    static final String REDISTRIBUTE = "Consider redistributing work from overloaded to underutilized contributors";
    static final String UNBLOCK = "Focus on unblocking items for overloaded contributors to improve throughput";

    public CapacityStatus classify(double loadRatio, double blockedRatio) {
        if (loadRatio > 1.5 || blockedRatio > 0.3) {
            return CapacityStatus.OVERLOADED;
        }
        if (loadRatio < 0.5) {
            return CapacityStatus.UNDERUTILIZED;
        }
        return CapacityStatus.BALANCED;
    }

    public static double averageLoad(List<ContributorWorkload> workloads) {
        if (workloads.isEmpty()) {
            return 0.0;
        }
        long total = 0;
        for (ContributorWorkload workload : workloads) {
            total += workload.getTotalItems();
        }
        return (double) total / workloads.size();
    }

    public Map<String, Object> analyze(List<ContributorWorkload> workloads) {
        double average = averageLoad(workloads);
        List<Map<String, Object>> overloaded = new ArrayList<>();
        List<Map<String, Object>> underutilized = new ArrayList<>();
        List<Map<String, Object>> balanced = new ArrayList<>();
        boolean overloadedWithBlockers = false;

        for (ContributorWorkload workload : workloads) {
            double loadRatio = average > 0 ? workload.getTotalItems() / average : 0.0;
            double blockedRatio = workload.blockedRatio();

            Map<String, Object> entry = workload.toMap();
            entry.put("load_ratio", loadRatio);
            entry.put("blocked_ratio", blockedRatio);

            switch (classify(loadRatio, blockedRatio)) {
                case OVERLOADED -> {
                    overloaded.add(entry);
                    overloadedWithBlockers |= blockedRatio > 0.2;
                }
                case UNDERUTILIZED -> underutilized.add(entry);
                case BALANCED -> balanced.add(entry);
            }
        }

        List<String> recommendations = new ArrayList<>();
        if (!overloaded.isEmpty() && !underutilized.isEmpty()) {
            recommendations.add(REDISTRIBUTE);
        }
        if (overloadedWithBlockers) {
            recommendations.add(UNBLOCK);
        }

        int count = workloads.size();
        Map<String, Object> analysis = new LinkedHashMap<>();
        analysis.put("total_contributors", count);
        analysis.put("average_load", average);
        analysis.put("available_capacity", count > 0 ? (double) underutilized.size() / count : 0.0);
        analysis.put("utilization_rate", count > 0 ? (double) balanced.size() / count : 0.0);
        analysis.put("bottlenecks", overloaded.stream().map(entry -> entry.get("contributor_id")).toList());
        analysis.put("overloaded_contributors", overloaded);
        analysis.put("underutilized_contributors", underutilized);
        analysis.put("balanced_contributors", balanced);
        analysis.put("recommendations", recommendations);
        return analysis;
    }
}
