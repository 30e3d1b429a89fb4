package com.purchasingpower.workgraph.analytics;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Heuristic graph health score.
 *
 * <p>Starts at 1.0 and subtracts:
 * <ul>
 *   <li>0.10 when composite priority standard deviation exceeds 0.3
 *   <li>0.15 when more than 20% of items have over 5 dependencies
 *   <li>0.10 when more than 5 bottlenecks are detected
 * </ul>
 * The result is floored at 0 and rounded to two decimals.
 *
 * @since 1.0.0
 */
@Component
public class HealthScoreCalculator {

    static final double STDDEV_THRESHOLD = 0.3;
    static final double DEPENDENCY_RATIO_THRESHOLD = 0.2;
    static final long BOTTLENECK_THRESHOLD = 5;

    public HealthAssessment assess(HealthSignals signals) {
        double score = 1.0;
        List<String> factors = new ArrayList<>();

        if (signals.priorityStdDev() > STDDEV_THRESHOLD) {
            score -= 0.10;
            factors.add("High priority variance detected");
        }
        if (signals.dependencyRatio() > DEPENDENCY_RATIO_THRESHOLD) {
            score -= 0.15;
            factors.add("Too many heavily dependent nodes");
        }
        if (signals.bottleneckCount() > BOTTLENECK_THRESHOLD) {
            score -= 0.10;
            factors.add("Multiple potential bottlenecks detected");
        }

        double rounded = Math.round(Math.max(0.0, score) * 100.0) / 100.0;
        return new HealthAssessment(rounded, factors, recommendations(signals));
    }

    List<String> recommendations(HealthSignals signals) {
        List<String> recommendations = new ArrayList<>();

        if (signals.highPriorityRatio() > 0.3) {
            recommendations.add("High percentage of high-priority items - consider reviewing and re-prioritizing");
        }
        if (signals.lowPriorityRatio() > 0.5) {
            recommendations.add("Many low-priority items - consider archiving or re-evaluating their importance");
        }
        if (signals.averageDependencies() > 3) {
            recommendations.add("High average dependency count - consider simplifying dependencies");
        }
        if (signals.dependencyRatio() > 0.15) {
            recommendations.add("Significant portion of nodes have heavy dependencies - review for potential decoupling");
        }
        if (signals.bottleneckCount() > 0) {
            recommendations.add(signals.bottleneckCount()
                + " potential bottlenecks detected - focus on completing these high-dependency items");
        }
        if (recommendations.isEmpty()) {
            recommendations.add("Graph health looks good! Continue monitoring as the project grows");
        }
        return recommendations;
    }
}
