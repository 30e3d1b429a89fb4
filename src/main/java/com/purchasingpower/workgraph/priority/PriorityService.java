package com.purchasingpower.workgraph.priority;

import java.util.List;
import java.util.Map;

/**
 * Priority inputs, composite recalculation and priority analytics.
 *
 * <p>Single and bulk updates share one contract: every component must be a
 * number in [0,1] or the update is rejected. The composite is always computed
 * from the values actually stored after the update.
 *
 * @since 1.0.0
 */
public interface PriorityService {

    /**
     * Update one node's priority inputs.
     *
     * @throws com.purchasingpower.workgraph.exception.GraphOperationException
     *         VALIDATION when nothing is provided, NOT_FOUND when the node is absent
     */
    Map<String, Object> updatePriorities(PriorityUpdate update);

    /**
     * Update several nodes; each item succeeds or fails on its own.
     *
     * @param updates Raw items with {@code node_id} and optional {@code priority_*} values
     */
    Map<String, Object> bulkUpdatePriorities(List<Map<String, Object>> updates, boolean recalculateAll);

    /**
     * Statistics, type/status distributions and top items for one priority dimension.
     */
    Map<String, Object> getPriorityInsights(PriorityInsightsQuery query);
}
