package com.purchasingpower.workgraph.analytics;

/**
 * Raw measurements a health assessment is derived from.
 *
 * @param priorityStdDev Standard deviation of composite priority
 * @param highPriorityRatio Share of items with composite priority above 0.8
 * @param lowPriorityRatio Share of items with composite priority below 0.2
 * @param averageDependencies Mean outgoing DEPENDS_ON count per item
 * @param dependencyRatio Share of items with more than 5 dependencies
 * @param bottleneckCount Items with more than 3 dependents (at most 10 counted)
 */
public record HealthSignals(
    double priorityStdDev,
    double highPriorityRatio,
    double lowPriorityRatio,
    double averageDependencies,
    double dependencyRatio,
    long bottleneckCount
) {
}
