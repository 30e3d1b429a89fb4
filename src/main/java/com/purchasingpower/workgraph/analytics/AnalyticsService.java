package com.purchasingpower.workgraph.analytics;

import java.util.Map;

/**
 * Heuristic analytics over the work graph: health, bottlenecks and workload.
 *
 * <p>All operations are read-only.
 *
 * @since 1.0.0
 */
public interface AnalyticsService {

    /**
     * Health score with the penalties applied, selected metric sections and recommendations.
     */
    Map<String, Object> analyzeGraphHealth(HealthQuery query);

    /**
     * Items with more than {@code analysisDepth} dependents, scored by severity,
     * plus blocked items still waiting on open dependencies.
     */
    Map<String, Object> getBottlenecks(BottleneckQuery query);

    /**
     * Per-contributor load with optional capacity classification and predictions.
     */
    Map<String, Object> getWorkloadAnalysis(WorkloadQuery query);
}
