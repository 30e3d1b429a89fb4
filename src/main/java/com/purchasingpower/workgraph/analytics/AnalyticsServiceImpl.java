package com.purchasingpower.workgraph.analytics;

import com.purchasingpower.workgraph.storage.CypherParams;
import com.purchasingpower.workgraph.storage.CypherRunner;
import com.purchasingpower.workgraph.storage.GraphStore;
import com.purchasingpower.workgraph.storage.Rows;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class AnalyticsServiceImpl implements AnalyticsService {

    /** Restricts {@code n} to items owned by a graph of {@code $teamId}, when given. */
    private static final String TEAM_SCOPE =
        "($teamId IS NULL OR EXISTS { (n)-[:BELONGS_TO]->(:Graph {teamId: $teamId}) })";

    private static final int HEALTH_BOTTLENECK_DEPENDENTS = 3;
    private static final int HEALTH_BOTTLENECK_LIMIT = 10;
    private static final int HEAVY_DEPENDENCY_COUNT = 5;

    private final GraphStore graphStore;
    private final HealthScoreCalculator healthScoreCalculator;
    private final CapacityClassifier capacityClassifier;
    private final WorkloadReader workloadReader;

    // ================================================================
    // HEALTH
    // ================================================================

    @Override
    public Map<String, Object> analyzeGraphHealth(HealthQuery query) {
        log.info("📊 Analyzing graph health (metrics={}, team={})", query.getMetrics(), query.getTeamId());
        Map<String, Object> params = CypherParams.of(
            "teamId", query.getTeamId(),
            "heavy", (long) HEAVY_DEPENDENCY_COUNT,
            "minDependents", (long) HEALTH_BOTTLENECK_DEPENDENTS,
            "limit", (long) HEALTH_BOTTLENECK_LIMIT);

        return graphStore.readTransaction(tx -> {
            Map<String, Object> distribution = nodeDistribution(tx, params);
            Map<String, Object> priority = priorityBalance(tx, params);
            Map<String, Object> dependencies = dependencyHealth(tx, params);
            List<Map<String, Object>> bottlenecks = healthBottlenecks(tx, params);

            long total = Rows.getLong(priority, "total_nodes");
            HealthSignals signals = new HealthSignals(
                Rows.getDouble(priority, "std_deviation"),
                ratio(Rows.getLong(priority, "high_priority_count"), total),
                ratio(Rows.getLong(priority, "low_priority_count"), total),
                Rows.getDouble(dependencies, "avg_dependencies"),
                Rows.getDouble(dependencies, "dependency_ratio"),
                bottlenecks.size());
            HealthAssessment assessment = healthScoreCalculator.assess(signals);

            Map<String, Object> metrics = new LinkedHashMap<>();
            if (query.includes(HealthQuery.NODE_DISTRIBUTION)) {
                metrics.put(HealthQuery.NODE_DISTRIBUTION, distribution);
            }
            if (query.includes(HealthQuery.PRIORITY_BALANCE)) {
                metrics.put(HealthQuery.PRIORITY_BALANCE, priority);
            }
            if (query.includes(HealthQuery.DEPENDENCY_HEALTH)) {
                metrics.put(HealthQuery.DEPENDENCY_HEALTH, dependencies);
            }
            if (query.includes(HealthQuery.BOTTLENECKS)) {
                metrics.put(HealthQuery.BOTTLENECKS, bottlenecks);
            }

            Map<String, Object> response = new LinkedHashMap<>();
            response.put("message", "Graph health analysis completed");
            response.put("health_score", assessment.score());
            response.put("score_factors", assessment.factors());
            response.put("total_nodes", total);
            response.put("metrics", metrics);
            response.put("recommendations", assessment.recommendations());
            response.put("timestamp", Instant.now().toString());
            return response;
        });
    }

    private Map<String, Object> nodeDistribution(CypherRunner tx, Map<String, Object> params) {
        List<Map<String, Object>> rows = tx.run("""
            MATCH (n:WorkItem)
            WHERE %s
            RETURN n.type AS type, n.status AS status, count(n) AS count
            """.formatted(TEAM_SCOPE), params);

        Map<String, Long> byType = new LinkedHashMap<>();
        Map<String, Long> byStatus = new LinkedHashMap<>();
        long total = 0;
        for (Map<String, Object> row : rows) {
            long count = Rows.getLong(row, "count");
            byType.merge(String.valueOf(Rows.getString(row, "type")), count, Long::sum);
            byStatus.merge(String.valueOf(Rows.getString(row, "status")), count, Long::sum);
            total += count;
        }

        Map<String, Object> distribution = new LinkedHashMap<>();
        distribution.put("total_nodes", total);
        distribution.put("by_type", byType);
        distribution.put("by_status", byStatus);
        return distribution;
    }

    private Map<String, Object> priorityBalance(CypherRunner tx, Map<String, Object> params) {
        Map<String, Object> row = Rows.first(tx.run("""
            MATCH (n:WorkItem)
            WHERE %s
            WITH coalesce(n.priorityComputed, 0.0) AS p
            RETURN count(p) AS total,
                   avg(p) AS average,
                   stDev(p) AS stdev,
                   min(p) AS minimum,
                   max(p) AS maximum,
                   sum(CASE WHEN p > 0.8 THEN 1 ELSE 0 END) AS high,
                   sum(CASE WHEN p < 0.2 THEN 1 ELSE 0 END) AS low
            """.formatted(TEAM_SCOPE), params));

        Map<String, Object> balance = new LinkedHashMap<>();
        balance.put("total_nodes", Rows.getLong(row, "total"));
        balance.put("avg_priority", Rows.getDouble(row, "average"));
        balance.put("std_deviation", Rows.getDouble(row, "stdev"));
        balance.put("min_priority", Rows.getDouble(row, "minimum"));
        balance.put("max_priority", Rows.getDouble(row, "maximum"));
        balance.put("high_priority_count", Rows.getLong(row, "high"));
        balance.put("low_priority_count", Rows.getLong(row, "low"));
        return balance;
    }

    private Map<String, Object> dependencyHealth(CypherRunner tx, Map<String, Object> params) {
        Map<String, Object> row = Rows.first(tx.run("""
            MATCH (n:WorkItem)
            WHERE %s
            OPTIONAL MATCH (n)-[:DEPENDS_ON]->(d:WorkItem)
            WITH n, count(d) AS dependencies
            RETURN count(n) AS total,
                   sum(dependencies) AS totalDependencies,
                   avg(dependencies) AS average,
                   max(dependencies) AS maximum,
                   sum(CASE WHEN dependencies > $heavy THEN 1 ELSE 0 END) AS heavy
            """.formatted(TEAM_SCOPE), params));

        long total = Rows.getLong(row, "total");
        long heavy = Rows.getLong(row, "heavy");

        Map<String, Object> health = new LinkedHashMap<>();
        health.put("total_dependencies", Rows.getLong(row, "totalDependencies"));
        health.put("avg_dependencies", Rows.getDouble(row, "average"));
        health.put("max_dependencies", Rows.getLong(row, "maximum"));
        health.put("heavily_dependent_nodes", heavy);
        health.put("dependency_ratio", ratio(heavy, total));
        return health;
    }

    private List<Map<String, Object>> healthBottlenecks(CypherRunner tx, Map<String, Object> params) {
        List<Map<String, Object>> rows = tx.run("""
            MATCH (n:WorkItem)
            WHERE %s
            MATCH (dependent:WorkItem)-[:DEPENDS_ON]->(n)
            WITH n, count(dependent) AS dependentCount
            WHERE dependentCount > $minDependents
            RETURN n.id AS id, n.title AS title, n.status AS status,
                   coalesce(n.priorityComputed, 0.0) AS priority, dependentCount
            ORDER BY dependentCount DESC
            LIMIT $limit
            """.formatted(TEAM_SCOPE), params);

        List<Map<String, Object>> bottlenecks = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            long dependents = Rows.getLong(row, "dependentCount");
            String status = Rows.getString(row, "status");
            double priority = Rows.getDouble(row, "priority");

            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("id", Rows.getString(row, "id"));
            entry.put("title", Rows.getString(row, "title"));
            entry.put("status", status);
            entry.put("priority", priority);
            entry.put("dependent_count", dependents);
            entry.put("severity", BottleneckSeverity.assess(dependents, status, priority).getValue());
            bottlenecks.add(entry);
        }
        return bottlenecks;
    }

    // ================================================================
    // BOTTLENECKS
    // ================================================================

    @Override
    public Map<String, Object> getBottlenecks(BottleneckQuery query) {
        log.info("📊 Detecting bottlenecks (depth={}, limit={}, team={})",
            query.getAnalysisDepth(), query.getLimit(), query.getTeamId());
        Map<String, Object> params = CypherParams.of(
            "teamId", query.getTeamId(),
            "analysisDepth", (long) query.getAnalysisDepth(),
            "limit", (long) query.getLimit());

        return graphStore.readTransaction(tx -> {
            List<Map<String, Object>> bottlenecks = highDependencyBottlenecks(tx, params);
            List<Map<String, Object>> chains = blockedChains(tx, params);

            Map<String, Object> grouped = new LinkedHashMap<>();
            grouped.put("high_dependency_bottlenecks", bottlenecks);
            grouped.put("blocked_chains", chains);

            Map<String, Object> summary = new LinkedHashMap<>();
            summary.put("high_dependency_count", bottlenecks.size());
            summary.put("blocked_chains_count", chains.size());
            summary.put("total_bottlenecks", bottlenecks.size() + chains.size());

            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("analysis_depth", query.getAnalysisDepth());
            metadata.put("limit", query.getLimit());
            metadata.put("team_id", query.getTeamId());
            metadata.put("analyzed_at", Instant.now().toString());

            Map<String, Object> response = new LinkedHashMap<>();
            response.put("message", "Bottleneck analysis completed");
            response.put("bottlenecks", grouped);
            if (query.isIncludeResolutions()) {
                response.put("suggested_resolutions", resolutions(bottlenecks, chains));
            }
            response.put("summary", summary);
            response.put("metadata", metadata);
            return response;
        });
    }

    private List<Map<String, Object>> highDependencyBottlenecks(CypherRunner tx, Map<String, Object> params) {
        List<Map<String, Object>> rows = tx.run("""
            MATCH (n:WorkItem)
            WHERE %s
            MATCH (dependent:WorkItem)-[:DEPENDS_ON]->(n)
            WITH n, collect(dependent {.id, .title, .status}) AS dependents
            WITH n, dependents, size(dependents) AS dependentCount
            WHERE dependentCount > $analysisDepth
            RETURN n.id AS id, n.title AS title, n.type AS type, n.status AS status,
                   coalesce(n.priorityComputed, 0.0) AS priority, dependentCount, dependents
            ORDER BY dependentCount DESC, priority DESC
            LIMIT $limit
            """.formatted(TEAM_SCOPE), params);

        List<Map<String, Object>> bottlenecks = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            long dependents = Rows.getLong(row, "dependentCount");
            String status = Rows.getString(row, "status");
            double priority = Rows.getDouble(row, "priority");
            int points = BottleneckSeverity.points(dependents, status, priority);

            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("id", Rows.getString(row, "id"));
            entry.put("title", Rows.getString(row, "title"));
            entry.put("type", Rows.getString(row, "type"));
            entry.put("status", status);
            entry.put("priority", priority);
            entry.put("dependent_count", dependents);
            entry.put("dependent_nodes", Rows.getList(row, "dependents"));
            entry.put("severity", BottleneckSeverity.fromPoints(points).getValue());
            entry.put("severity_score", points);
            bottlenecks.add(entry);
        }
        return bottlenecks;
    }

    private List<Map<String, Object>> blockedChains(CypherRunner tx, Map<String, Object> params) {
        List<Map<String, Object>> rows = tx.run("""
            MATCH (n:WorkItem {status: 'BLOCKED'})
            WHERE %s
            OPTIONAL MATCH (n)-[:DEPENDS_ON]->(blocker:WorkItem)
            WHERE blocker.status IN ['PROPOSED', 'PLANNED', 'IN_PROGRESS']
            WITH n, collect(blocker {.id, .title, .status, priority: coalesce(blocker.priorityComputed, 0.0)}) AS blocking
            RETURN n.id AS blockedId, n.title AS blockedTitle, blocking
            ORDER BY size(blocking) DESC, blockedId
            LIMIT $limit
            """.formatted(TEAM_SCOPE), params);

        List<Map<String, Object>> chains = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            List<Object> blocking = Rows.getList(row, "blocking");
            Map<String, Object> chain = new LinkedHashMap<>();
            chain.put("blocked_id", Rows.getString(row, "blockedId"));
            chain.put("blocked_title", Rows.getString(row, "blockedTitle"));
            chain.put("blocking_items", blocking);
            chain.put("chain_length", blocking.size());
            chains.add(chain);
        }
        return chains;
    }

    static List<Map<String, Object>> resolutions(List<Map<String, Object>> bottlenecks,
                                                 List<Map<String, Object>> chains) {
        List<Map<String, Object>> resolutions = new ArrayList<>();

        for (Map<String, Object> bottleneck : bottlenecks) {
            String severity = Rows.getString(bottleneck, "severity");
            if (!BottleneckSeverity.HIGH.getValue().equals(severity)
                && !BottleneckSeverity.CRITICAL.getValue().equals(severity)) {
                continue;
            }
            String status = Rows.getString(bottleneck, "status");
            String title = Rows.getString(bottleneck, "title");
            long dependents = Rows.getLong(bottleneck, "dependent_count");

            if ("PROPOSED".equals(status)) {
                resolutions.add(resolution("priority_boost", bottleneck, severity,
                    "Increase priority of \"" + title + "\" to unblock " + dependents + " dependent items"));
            } else if ("BLOCKED".equals(status)) {
                resolutions.add(resolution("resolve_blocker", bottleneck, severity,
                    "Focus on resolving blockers for \"" + title + "\" as it affects " + dependents + " other items"));
            }
        }

        for (Map<String, Object> chain : chains) {
            long length = Rows.getLong(chain, "chain_length");
            if (length > 1) {
                Map<String, Object> entry = new LinkedHashMap<>();
                entry.put("type", "break_dependency_chain");
                entry.put("node_id", Rows.getString(chain, "blocked_id"));
                entry.put("description", "Consider breaking dependency chain for \""
                    + Rows.getString(chain, "blocked_title") + "\" - has " + length + " blocking items");
                entry.put("severity", BottleneckSeverity.MEDIUM.getValue());
                resolutions.add(entry);
            }
        }
        return resolutions;
    }

    private static Map<String, Object> resolution(String type, Map<String, Object> bottleneck,
                                                  String severity, String description) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("type", type);
        entry.put("node_id", Rows.getString(bottleneck, "id"));
        entry.put("description", description);
        entry.put("severity", severity);
        return entry;
    }

    // ================================================================
    // WORKLOAD
    // ================================================================

    @Override
    public Map<String, Object> getWorkloadAnalysis(WorkloadQuery query) {
        log.info("📊 Analyzing workload (contributors={}, capacity={}, predictions={})",
            query.getContributorIds() != null ? query.getContributorIds().size() : "all",
            query.isIncludeCapacity(), query.isIncludePredictions());

        List<ContributorWorkload> workloads = graphStore.readTransaction(tx -> workloadReader.read(
            tx, query.getContributorIds(), query.getWindowStart(), query.getWindowEnd()));

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("message", "Workload analysis completed");
        response.put("contributors", workloads.stream().map(ContributorWorkload::toMap).toList());
        response.put("summary", summarize(workloads));
        if (query.isIncludeCapacity()) {
            response.put("capacity_analysis", capacityClassifier.analyze(workloads));
        }
        if (query.isIncludePredictions()) {
            response.put("predictions", predictions(workloads));
        }
        return response;
    }

    static Map<String, Object> summarize(List<ContributorWorkload> workloads) {
        double average = CapacityClassifier.averageLoad(workloads);
        long totalItems = 0;
        long heavy = 0;
        long light = 0;
        ContributorWorkload mostLoaded = null;

        for (ContributorWorkload workload : workloads) {
            long items = workload.getTotalItems();
            totalItems += items;
            if (items > average * 1.5) {
                heavy++;
            } else if (items < average * 0.5) {
                light++;
            }
            if (mostLoaded == null || items > mostLoaded.getTotalItems()) {
                mostLoaded = workload;
            }
        }

        Map<String, Object> distribution = new LinkedHashMap<>();
        distribution.put("heavily_loaded", heavy);
        distribution.put("moderately_loaded", workloads.size() - heavy - light);
        distribution.put("lightly_loaded", light);

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("total_contributors", workloads.size());
        summary.put("total_items", totalItems);
        summary.put("avg_items_per_contributor", average);
        summary.put("most_loaded_contributor", mostLoaded != null ? mostLoaded.getContributorId() : null);
        summary.put("workload_distribution", distribution);
        return summary;
    }

    static Map<String, Object> predictions(List<ContributorWorkload> workloads) {
        List<Map<String, Object>> bottleneckPredictions = new ArrayList<>();
        List<Map<String, Object>> capacityRecommendations = new ArrayList<>();

        for (ContributorWorkload workload : workloads) {
            if (workload.blockedRatio() > 0.2) {
                Map<String, Object> prediction = new LinkedHashMap<>();
                prediction.put("contributor_id", workload.getContributorId());
                prediction.put("blocked_ratio", workload.blockedRatio());
                prediction.put("prediction", "High blocked item ratio may indicate future bottlenecks");
                bottleneckPredictions.add(prediction);
            }
            if (workload.getInProgressItems() > 5) {
                Map<String, Object> recommendation = new LinkedHashMap<>();
                recommendation.put("contributor_id", workload.getContributorId());
                recommendation.put("in_progress_items", workload.getInProgressItems());
                recommendation.put("recommendation", "Consider limiting work in progress to improve focus");
                capacityRecommendations.add(recommendation);
            }
        }

        List<String> actions = new ArrayList<>();
        if (!bottleneckPredictions.isEmpty()) {
            actions.add("Review blocked items for " + bottleneckPredictions.size() + " contributor(s)");
        }
        if (!capacityRecommendations.isEmpty()) {
            actions.add("Set work-in-progress limits for " + capacityRecommendations.size() + " contributor(s)");
        }

        Map<String, Object> predictions = new LinkedHashMap<>();
        predictions.put("bottleneck_predictions", bottleneckPredictions);
        predictions.put("capacity_recommendations", capacityRecommendations);
        predictions.put("recommended_actions", actions);
        return predictions;
    }

    private static double ratio(long part, long total) {
        return total > 0 ? (double) part / total : 0.0;
    }
}
