package com.purchasingpower.workgraph.analytics;

import java.util.List;

/**
 * Health score in [0,1] with the penalties applied and the advice derived from the signals.
 */
public record HealthAssessment(
    double score,
    List<String> factors,
    List<String> recommendations
) {
}
