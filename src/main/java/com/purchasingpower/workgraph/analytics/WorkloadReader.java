package com.purchasingpower.workgraph.analytics;

import com.purchasingpower.workgraph.storage.CypherParams;
import com.purchasingpower.workgraph.storage.CypherRunner;
import com.purchasingpower.workgraph.storage.Rows;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Loads per-contributor item counts over WORKED_ON_BY links.
 *
 * <p>Contributors without items are returned with zero counts so they take part
 * in the cohort average.
 */
@Component
class WorkloadReader {

    private static final String WORKLOAD_CYPHER = """
        MATCH (c:Contributor)
        WHERE $contributorIds IS NULL OR c.id IN $contributorIds
        OPTIONAL MATCH (n:WorkItem)-[:WORKED_ON_BY]->(c)
        WHERE ($windowStart IS NULL OR n.createdAt >= datetime($windowStart))
          AND ($windowEnd IS NULL OR n.createdAt <= datetime($windowEnd))
        WITH c, n, coalesce(n.priorityComputed, 0.0) AS p
        RETURN c.id AS contributorId,
               c.name AS name,
               count(n) AS total,
               count(CASE WHEN n.status = 'IN_PROGRESS' THEN 1 END) AS inProgress,
               count(CASE WHEN n.status = 'COMPLETED' THEN 1 END) AS completed,
               count(CASE WHEN n.status = 'BLOCKED' THEN 1 END) AS blocked,
               avg(CASE WHEN n IS NULL THEN null ELSE p END) AS avgPriority,
               count(CASE WHEN n IS NOT NULL AND p > 0.8 THEN 1 END) AS high,
               count(CASE WHEN n IS NOT NULL AND p >= 0.5 AND p <= 0.8 THEN 1 END) AS medium,
               count(CASE WHEN n IS NOT NULL AND p < 0.5 THEN 1 END) AS low,
               collect(DISTINCT n.type) AS workTypes,
               collect(DISTINCT n.status) AS statuses
        ORDER BY total DESC, contributorId
        """;

    List<ContributorWorkload> read(CypherRunner runner, List<String> contributorIds,
                                   String windowStart, String windowEnd) {
        List<Map<String, Object>> rows = runner.run(WORKLOAD_CYPHER, CypherParams.of(
            "contributorIds", contributorIds,
            "windowStart", windowStart,
            "windowEnd", windowEnd));

        List<ContributorWorkload> workloads = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            workloads.add(ContributorWorkload.builder()
                .contributorId(Rows.getString(row, "contributorId"))
                .name(Rows.getString(row, "name"))
                .totalItems(Rows.getLong(row, "total"))
                .inProgressItems(Rows.getLong(row, "inProgress"))
                .completedItems(Rows.getLong(row, "completed"))
                .blockedItems(Rows.getLong(row, "blocked"))
                .avgPriority(Rows.getDouble(row, "avgPriority"))
                .highPriority(Rows.getLong(row, "high"))
                .mediumPriority(Rows.getLong(row, "medium"))
                .lowPriority(Rows.getLong(row, "low"))
                .workTypes(strings(Rows.getList(row, "workTypes")))
                .statuses(strings(Rows.getList(row, "statuses")))
                .build());
        }
        return workloads;
    }

    private static List<String> strings(List<Object> values) {
        return values.stream().filter(v -> v != null).map(Object::toString).toList();
    }
}
