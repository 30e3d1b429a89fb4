package com.purchasingpower.workgraph.priority;

import com.purchasingpower.workgraph.configuration.WorkGraphProperties;
import com.purchasingpower.workgraph.exception.GraphOperationException;
import com.purchasingpower.workgraph.mutation.SetClause;
import com.purchasingpower.workgraph.storage.CypherParams;
import com.purchasingpower.workgraph.storage.CypherRunner;
import com.purchasingpower.workgraph.storage.GraphStore;
import com.purchasingpower.workgraph.storage.Rows;
import com.purchasingpower.workgraph.util.InputSanitizer;
import com.purchasingpower.workgraph.util.ToolArguments;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class PriorityServiceImpl implements PriorityService {

    private final GraphStore graphStore;
    private final PriorityCalculator calculator;
    private final WorkGraphProperties properties;

    @Override
    public Map<String, Object> updatePriorities(PriorityUpdate update) {
        if (!update.hasValues()) {
            throw GraphOperationException.validation("No priority values provided to update");
        }
        String nodeId = InputSanitizer.sanitizeNodeId(update.getNodeId());
        Map<String, Object> result = graphStore.writeTransaction(tx -> apply(tx, nodeId, update));
        log.info("Updated priorities for {}: {}", nodeId, result.get("updated_priorities"));
        return result;
    }

    private Map<String, Object> apply(CypherRunner tx, String nodeId, PriorityUpdate update) {
        Map<String, Object> current = Rows.first(tx.run("""
            MATCH (n:WorkItem {id: $nodeId})
            RETURN n.priorityExecutive AS executive,
                   n.priorityIndividual AS individual,
                   n.priorityCommunity AS community,
                   n.priorityComputed AS computed,
                   n.radius AS radius
            """, CypherParams.of("nodeId", nodeId)));
        if (current == null) {
            throw GraphOperationException.notFound("Node not found: " + nodeId);
        }

        double executive = update.getExecutive() != null ? update.getExecutive() : Rows.getDouble(current, "executive");
        double individual = update.getIndividual() != null ? update.getIndividual() : Rows.getDouble(current, "individual");
        double community = update.getCommunity() != null ? update.getCommunity() : Rows.getDouble(current, "community");

        SetClause clause = SetClause.forAlias("n")
            .set("priorityExecutive", update.getExecutive())
            .set("priorityIndividual", update.getIndividual())
            .set("priorityCommunity", update.getCommunity());

        PriorityScore score;
        if (update.isRecalculate()) {
            score = calculator.score(executive, individual, community);
            clause.set("priorityComputed", score.computed()).set("radius", score.radius());
        } else {
            score = new PriorityScore(executive, individual, community,
                Rows.getDouble(current, "computed"),
                current.get("radius") != null ? Rows.getDouble(current, "radius") : 1.0);
        }
        clause.setExpression("updatedAt", "datetime()");

        Map<String, Object> params = new HashMap<>(clause.getParameters());
        params.put("nodeId", nodeId);
        Map<String, Object> row = Rows.first(tx.run(
            "MATCH (n:WorkItem {id: $nodeId})\n" + clause.toCypher() + "\nRETURN toString(n.updatedAt) AS updatedAt",
            params));

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("message", "Priorities updated successfully");
        response.put("node_id", nodeId);
        response.put("updated_priorities", score.toMap());
        response.put("new_radius", score.radius());
        response.put("recalculated", update.isRecalculate());
        response.put("updated_at", Rows.getString(row, "updatedAt"));
        return response;
    }

    @Override
    public Map<String, Object> bulkUpdatePriorities(List<Map<String, Object>> updates, boolean recalculateAll) {
        if (updates == null || updates.isEmpty()) {
            throw GraphOperationException.validation("updates must contain at least one item");
        }
        InputSanitizer.validateBulkOperation(updates.size(), properties.getMaxBulkOperations());

        List<Map<String, Object>> results = new ArrayList<>();
        int succeeded = 0;
        for (Map<String, Object> raw : updates) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("node_id", raw != null ? raw.get("node_id") : null);
            try {
                PriorityUpdate update = PriorityUpdate.from(ToolArguments.of(raw), recalculateAll);
                Map<String, Object> result = updatePriorities(update);
                entry.put("success", true);
                entry.put("priorities", result.get("updated_priorities"));
                entry.put("new_radius", result.get("new_radius"));
                succeeded++;
            } catch (GraphOperationException e) {
                log.warn("Bulk priority update failed for {}: {}", entry.get("node_id"), e.getMessage());
                entry.put("success", false);
                entry.put("error", e.getMessage());
                entry.put("error_kind", e.getKind().name());
            }
            results.add(entry);
        }

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("message", "Bulk priority update completed");
        response.put("total_updates", updates.size());
        response.put("successful_updates", succeeded);
        response.put("failed_updates", updates.size() - succeeded);
        response.put("results", results);
        return response;
    }

    @Override
    public Map<String, Object> getPriorityInsights(PriorityInsightsQuery query) {
        String property = query.getPriorityType().getProperty();
        String match = """
            MATCH (n:WorkItem)
            WITH n, coalesce(n.%s, 0.0) AS p
            WHERE ($minPriority IS NULL OR p >= $minPriority)
              AND ($nodeTypes IS NULL OR n.type IN $nodeTypes)
              AND ($statuses IS NULL OR n.status IN $statuses)
            """.formatted(property);
        Map<String, Object> params = CypherParams.of(
            "minPriority", query.getMinPriority(),
            "nodeTypes", query.getNodeTypes(),
            "statuses", query.getStatuses(),
            "limit", (long) Math.max(1, query.getTopLimit()));

        return graphStore.readTransaction(tx -> {
            Map<String, Object> stats = Rows.first(tx.run(match + """
                RETURN count(n) AS total,
                       avg(p) AS average,
                       min(p) AS minimum,
                       max(p) AS maximum,
                       stDev(p) AS stdev,
                       avg(coalesce(n.priorityExecutive, 0.0)) AS avgExecutive,
                       avg(coalesce(n.priorityIndividual, 0.0)) AS avgIndividual,
                       avg(coalesce(n.priorityCommunity, 0.0)) AS avgCommunity,
                       avg(coalesce(n.priorityComputed, 0.0)) AS avgComputed,
                       sum(CASE WHEN p > 0.8 THEN 1 ELSE 0 END) AS high,
                       sum(CASE WHEN p >= 0.2 AND p <= 0.8 THEN 1 ELSE 0 END) AS medium,
                       sum(CASE WHEN p < 0.2 THEN 1 ELSE 0 END) AS low
                """, params));

            List<Map<String, Object>> typeDistribution = tx.run(match + """
                RETURN n.type AS node_type, count(n) AS count, avg(p) AS avg_priority,
                       max(p) AS max_priority, min(p) AS min_priority
                ORDER BY avg_priority DESC
                """, params);

            List<Map<String, Object>> statusDistribution = tx.run(match + """
                RETURN n.status AS status, count(n) AS count, avg(p) AS avg_priority
                ORDER BY avg_priority DESC
                """, params);

            List<Map<String, Object>> topItems = tx.run(match + """
                RETURN n.id AS id, n.title AS title, n.type AS type, n.status AS status, p AS priority
                ORDER BY p DESC, n.updatedAt DESC
                LIMIT $limit
                """, params);

            Map<String, Object> averages = new LinkedHashMap<>();
            averages.put("executive", Rows.getDouble(stats, "avgExecutive"));
            averages.put("individual", Rows.getDouble(stats, "avgIndividual"));
            averages.put("community", Rows.getDouble(stats, "avgCommunity"));
            averages.put("computed", Rows.getDouble(stats, "avgComputed"));

            Map<String, Object> buckets = new LinkedHashMap<>();
            buckets.put("high", Rows.getLong(stats, "high"));
            buckets.put("medium", Rows.getLong(stats, "medium"));
            buckets.put("low", Rows.getLong(stats, "low"));

            Map<String, Object> statistics = new LinkedHashMap<>();
            statistics.put("total_nodes", Rows.getLong(stats, "total"));
            statistics.put("average", Rows.getDouble(stats, "average"));
            statistics.put("min_priority", Rows.getDouble(stats, "minimum"));
            statistics.put("max_priority", Rows.getDouble(stats, "maximum"));
            statistics.put("std_deviation", Rows.getDouble(stats, "stdev"));
            statistics.put("averages", averages);
            statistics.put("distribution", buckets);

            Map<String, Object> response = new LinkedHashMap<>();
            response.put("priority_type", query.getPriorityType().getValue());
            response.put("statistics", statistics);
            response.put("type_distribution", typeDistribution);
            response.put("status_distribution", statusDistribution);
            response.put("top_items", topItems);
            return response;
        });
    }
}
