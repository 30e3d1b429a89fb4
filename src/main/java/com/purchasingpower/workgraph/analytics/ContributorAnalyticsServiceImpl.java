package com.purchasingpower.workgraph.analytics;

import com.purchasingpower.workgraph.core.WorkItemStatus;
import com.purchasingpower.workgraph.exception.GraphOperationException;
import com.purchasingpower.workgraph.storage.CypherParams;
import com.purchasingpower.workgraph.storage.CypherRunner;
import com.purchasingpower.workgraph.storage.GraphStore;
import com.purchasingpower.workgraph.storage.Rows;
import com.purchasingpower.workgraph.util.InputSanitizer;
import com.purchasingpower.workgraph.util.MetadataCodec;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

@Slf4j
@Service
@RequiredArgsConstructor
public class ContributorAnalyticsServiceImpl implements ContributorAnalyticsService {

    private static final String SUM_OF_INPUTS = "coalesce(n.priorityExecutive, 0.0) + "
        + "coalesce(n.priorityIndividual, 0.0) + coalesce(n.priorityCommunity, 0.0)";

    private final GraphStore graphStore;
    private final MetadataCodec metadataCodec;
    private final WorkloadReader workloadReader;

    @Override
    public Map<String, Object> getContributorPriorities(ContributorPriorityQuery query) {
        String scoreExpression = query.isSumOfInputs()
            ? SUM_OF_INPUTS
            : "coalesce(n.%s, 0.0)".formatted(query.getPriorityType().getProperty());
        Map<String, Object> params = CypherParams.of(
            "contributorId", query.getContributorId(),
            "statuses", query.getStatuses(),
            "limit", (long) query.getLimit());

        return graphStore.readTransaction(tx -> {
            Map<String, Object> contributor = requireContributor(tx, query.getContributorId());

            List<Map<String, Object>> rows = tx.run("""
                MATCH (n:WorkItem)-[:WORKED_ON_BY]->(:Contributor {id: $contributorId})
                WHERE n.status IN $statuses
                OPTIONAL MATCH (n)-[:DEPENDS_ON]->(d:WorkItem)
                WITH n, %s AS score, collect(d.title) AS dependencyTitles
                RETURN n AS node, score, size(dependencyTitles) AS dependencyCount,
                       dependencyTitles[0..3] AS topDependencies
                ORDER BY score DESC, n.updatedAt DESC
                LIMIT $limit
                """.formatted(scoreExpression), params);

            List<Map<String, Object>> items = new ArrayList<>(rows.size());
            double scoreSum = 0.0;
            for (Map<String, Object> row : rows) {
                double score = Rows.getDouble(row, "score");
                scoreSum += score;

                Map<String, Object> item = new LinkedHashMap<>();
                item.put("node", metadataCodec.withDecoded(Rows.getMap(row, "node"), "metadata"));
                item.put("score", score);
                item.put("dependency_count", Rows.getLong(row, "dependencyCount"));
                item.put("top_dependencies", Rows.getList(row, "topDependencies"));
                items.add(item);
            }

            Map<String, Object> response = new LinkedHashMap<>();
            response.put("contributor", contributor);
            response.put("priority_type", query.priorityLabel());
            response.put("status_filter", query.getStatuses());
            response.put("count", items.size());
            response.put("average_score", items.isEmpty() ? 0.0 : scoreSum / items.size());
            response.put("items", items);
            return response;
        });
    }

    @Override
    public Map<String, Object> getContributorWorkload(String rawContributorId) {
        String contributorId = InputSanitizer.sanitizeId(rawContributorId, "contributor_id");

        return graphStore.readTransaction(tx -> {
            Map<String, Object> contributor = requireContributor(tx, contributorId);
            List<ContributorWorkload> workloads = workloadReader.read(tx, List.of(contributorId), null, null);
            if (workloads.isEmpty()) {
                throw GraphOperationException.notFound("Contributor not found: " + contributorId);
            }
            ContributorWorkload workload = workloads.get(0);

            Map<String, Long> byStatus = new LinkedHashMap<>();
            for (Map<String, Object> row : tx.run("""
                MATCH (n:WorkItem)-[:WORKED_ON_BY]->(:Contributor {id: $contributorId})
                RETURN n.status AS status, count(n) AS count
                ORDER BY count DESC, status
                """, CypherParams.of("contributorId", contributorId))) {
                byStatus.put(String.valueOf(Rows.getString(row, "status")), Rows.getLong(row, "count"));
            }

            Map<String, Object> response = new LinkedHashMap<>();
            response.put("contributor", contributor);
            response.put("workload", workload.toMap());
            response.put("status_breakdown", byStatus);
            response.put("blocked_ratio", workload.blockedRatio());
            return response;
        });
    }

    @Override
    public Map<String, Object> findContributorsByProject(ProjectContributorsQuery query) {
        Map<String, Object> params = CypherParams.of(
            "graphId", query.getGraphId(),
            "graphName", query.getGraphName(),
            "nodeTypes", query.getNodeTypes(),
            "statuses", query.isActiveOnly() ? ProjectContributorsQuery.ACTIVE_STATUSES : null,
            "limit", (long) query.getLimit());

        List<Map<String, Object>> rows = graphStore.readTransaction(tx -> tx.run("""
            MATCH (n:WorkItem)-[:WORKED_ON_BY]->(c:Contributor)
            MATCH (n)-[:BELONGS_TO]->(g:Graph)
            WHERE ($graphId IS NULL OR g.id = $graphId)
              AND ($graphName IS NULL OR toLower(g.name) CONTAINS toLower($graphName))
              AND ($nodeTypes IS NULL OR n.type IN $nodeTypes)
              AND ($statuses IS NULL OR n.status IN $statuses)
            RETURN c.id AS contributorId, c.name AS contributorName, c.type AS contributorType,
                   g.id AS projectId, g.name AS projectName,
                   count(n) AS itemCount,
                   collect(DISTINCT n.status) AS statuses,
                   collect(DISTINCT n.type) AS workTypes,
                   avg(coalesce(n.priorityComputed, 0.0)) AS avgPriority
            ORDER BY itemCount DESC, contributorId, projectId
            LIMIT $limit
            """, params));

        List<Map<String, Object>> contributors = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            Map<String, Object> workload = new LinkedHashMap<>();
            workload.put("item_count", Rows.getLong(row, "itemCount"));
            workload.put("statuses", Rows.getList(row, "statuses"));
            workload.put("work_types", Rows.getList(row, "workTypes"));
            workload.put("avg_priority", Rows.getDouble(row, "avgPriority"));

            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("contributor", contributorRef(row, "contributorId", "contributorName", "contributorType"));
            entry.put("project", Map.of(
                "id", String.valueOf(Rows.getString(row, "projectId")),
                "name", String.valueOf(Rows.getString(row, "projectName"))));
            entry.put("workload", workload);
            contributors.add(entry);
        }

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("contributors", contributors);
        response.put("total_found", contributors.size());
        response.put("filters_applied", query.filtersApplied());
        return response;
    }

    @Override
    public Map<String, Object> getProjectTeam(String rawGraphId) {
        String graphId = InputSanitizer.sanitizeId(rawGraphId, "graph_id");

        return graphStore.readTransaction(tx -> {
            Map<String, Object> graph = Rows.first(tx.run("""
                MATCH (g:Graph {id: $graphId})
                RETURN g.id AS id, g.name AS name
                """, CypherParams.of("graphId", graphId)));
            if (graph == null) {
                throw GraphOperationException.notFound("Graph not found: " + graphId);
            }

            List<Map<String, Object>> members = new ArrayList<>();
            long totalItems = 0;
            long activeItems = 0;
            for (Map<String, Object> row : tx.run("""
                MATCH (n:WorkItem)-[:BELONGS_TO]->(:Graph {id: $graphId})
                MATCH (n)-[:WORKED_ON_BY]->(c:Contributor)
                RETURN c.id AS contributorId, c.name AS contributorName, c.type AS contributorType,
                       count(n) AS itemCount,
                       count(CASE WHEN n.status = 'IN_PROGRESS' THEN 1 END) AS activeItems,
                       collect(DISTINCT n.type) AS workTypes,
                       collect(DISTINCT n.status) AS statuses,
                       avg(coalesce(n.priorityComputed, 0.0)) AS avgPriority
                ORDER BY itemCount DESC, contributorId
                """, CypherParams.of("graphId", graphId))) {
                long items = Rows.getLong(row, "itemCount");
                long active = Rows.getLong(row, "activeItems");
                totalItems += items;
                activeItems += active;

                Map<String, Object> contribution = new LinkedHashMap<>();
                contribution.put("total_items", items);
                contribution.put("active_items", active);
                contribution.put("work_types", Rows.getList(row, "workTypes"));
                contribution.put("statuses", Rows.getList(row, "statuses"));
                contribution.put("avg_priority", Rows.getDouble(row, "avgPriority"));

                Map<String, Object> member = new LinkedHashMap<>();
                member.put("contributor", contributorRef(row, "contributorId", "contributorName", "contributorType"));
                member.put("contribution", contribution);
                members.add(member);
            }

            Map<String, Object> summary = new LinkedHashMap<>();
            summary.put("total_contributors", members.size());
            summary.put("total_items", totalItems);
            summary.put("active_items", activeItems);

            Map<String, Object> response = new LinkedHashMap<>();
            response.put("project_id", graphId);
            response.put("project_name", graph.get("name"));
            response.put("team_size", members.size());
            response.put("team_members", members);
            response.put("team_summary", summary);
            return response;
        });
    }

    @Override
    public Map<String, Object> getContributorExpertise(ExpertiseQuery query) {
        String contributorId = query.getContributorId();

        return graphStore.readTransaction(tx -> {
            requireContributor(tx, contributorId);
            List<Map<String, Object>> rows = tx.run("""
                MATCH (n:WorkItem)-[:WORKED_ON_BY]->(:Contributor {id: $contributorId})
                WHERE n.updatedAt > datetime() - duration({days: $days})
                OPTIONAL MATCH (n)-[:BELONGS_TO]->(g:Graph)
                RETURN n.type AS type, n.status AS status,
                       coalesce(n.priorityComputed, 0.0) AS priority, g.name AS project
                """, CypherParams.of("contributorId", contributorId, "days", (long) query.getTimeWindowDays()));

            long completed = 0;
            double prioritySum = 0.0;
            Map<String, long[]> countsByType = new TreeMap<>();
            Map<String, Double> priorityByType = new TreeMap<>();
            Set<String> projects = new TreeSet<>();
            for (Map<String, Object> row : rows) {
                String type = String.valueOf(Rows.getString(row, "type"));
                boolean done = WorkItemStatus.COMPLETED.name().equals(Rows.getString(row, "status"));
                double priority = Rows.getDouble(row, "priority");
                if (done) {
                    completed++;
                }
                prioritySum += priority;

                long[] counts = countsByType.computeIfAbsent(type, t -> new long[2]);
                counts[0]++;
                if (done) {
                    counts[1]++;
                }
                priorityByType.merge(type, priority, Double::sum);
                String project = Rows.getString(row, "project");
                if (project != null) {
                    projects.add(project);
                }
            }

            int total = rows.size();
            Map<String, Object> overall = new LinkedHashMap<>();
            overall.put("total_items", total);
            overall.put("completed_items", completed);
            overall.put("completion_rate", total > 0 ? (double) completed / total : 0.0);
            overall.put("avg_priority_level", total > 0 ? prioritySum / total : 0.0);

            Map<String, Object> response = new LinkedHashMap<>();
            response.put("contributor_id", contributorId);
            response.put("analysis_period_days", query.getTimeWindowDays());
            response.put("overall_stats", overall);
            if (query.isIncludeWorkTypes()) {
                Map<String, Object> byType = new LinkedHashMap<>();
                countsByType.forEach((type, counts) -> {
                    double completionRate = (double) counts[1] / counts[0];
                    Map<String, Object> expertise = new LinkedHashMap<>();
                    expertise.put("count", counts[0]);
                    expertise.put("completed", counts[1]);
                    expertise.put("avg_priority", priorityByType.get(type) / counts[0]);
                    expertise.put("completion_rate", completionRate);
                    expertise.put("expertise_level",
                        ExpertiseLevel.of(counts[0], completionRate, query.getMinItemsThreshold()).getValue());
                    byType.put(type, expertise);
                });
                response.put("work_type_expertise", byType);
            }
            if (query.isIncludeProjects()) {
                response.put("project_domains", new ArrayList<>(projects));
            }
            return response;
        });
    }

    @Override
    public Map<String, Object> getCollaborationNetwork(CollaborationQuery query) {
        Map<String, Object> params = CypherParams.of(
            "focusContributor", query.getFocusContributor(),
            "projectScope", query.getProjectScope(),
            "days", (long) query.getTimeWindowDays(),
            "limit", (long) CollaborationQuery.MAX_PAIRS);

        // c1.id < c2.id keeps one row per unordered pair
        List<Map<String, Object>> rows = graphStore.readTransaction(tx -> tx.run("""
            MATCH (c1:Contributor)<-[:WORKED_ON_BY]-(n:WorkItem)-[:WORKED_ON_BY]->(c2:Contributor)
            WHERE c1.id < c2.id
              AND ($focusContributor IS NULL OR c1.id = $focusContributor OR c2.id = $focusContributor)
              AND ($projectScope IS NULL OR EXISTS { MATCH (n)-[:BELONGS_TO]->(:Graph {id: $projectScope}) })
              AND n.updatedAt > datetime() - duration({days: $days})
            RETURN c1.id AS contributor1, c1.name AS name1,
                   c2.id AS contributor2, c2.name AS name2,
                   count(n) AS sharedItems,
                   collect(DISTINCT n.type) AS sharedWorkTypes,
                   avg(coalesce(n.priorityComputed, 0.0)) AS avgSharedPriority
            ORDER BY sharedItems DESC, contributor1, contributor2
            LIMIT $limit
            """, params));

        List<Map<String, Object>> network = new ArrayList<>();
        for (Map<String, Object> row : rows) {
            long shared = Rows.getLong(row, "sharedItems");
            CollaborationStrength strength = CollaborationStrength.fromSharedItems(shared);
            if (query.getStrength() != null && query.getStrength() != strength) {
                continue;
            }

            Map<String, Object> collaboration = new LinkedHashMap<>();
            collaboration.put("shared_items", shared);
            collaboration.put("strength", strength.getValue());
            collaboration.put("shared_work_types", Rows.getList(row, "sharedWorkTypes"));
            collaboration.put("avg_shared_priority", Rows.getDouble(row, "avgSharedPriority"));

            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("contributor1", contributorRef(row, "contributor1", "name1", null));
            entry.put("contributor2", contributorRef(row, "contributor2", "name2", null));
            entry.put("collaboration", collaboration);
            network.add(entry);
        }

        Map<String, Object> scope = new LinkedHashMap<>();
        scope.put("focus_contributor", query.getFocusContributor());
        scope.put("project_scope", query.getProjectScope());
        scope.put("collaboration_strength", query.getStrength() != null ? query.getStrength().getValue() : "all");
        scope.put("time_window_days", query.getTimeWindowDays());

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("total_collaborations", network.size());
        summary.put("strongest_collaboration", network.isEmpty() ? null : network.get(0));
        summary.put("analysis_scope", scope);

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("collaboration_network", network);
        response.put("network_summary", summary);
        return response;
    }

    @Override
    public Map<String, Object> getContributorAvailability(AvailabilityQuery query) {
        List<Map<String, Object>> rows = graphStore.readTransaction(tx -> tx.run("""
            MATCH (c:Contributor)
            WHERE $contributorIds IS NULL OR c.id IN $contributorIds
            OPTIONAL MATCH (n:WorkItem)-[:WORKED_ON_BY]->(c)
            WHERE n.status IN ['IN_PROGRESS', 'BLOCKED']
            RETURN c.id AS contributorId, c.name AS name,
                   count(n) AS activeItems,
                   count(CASE WHEN n.status = 'BLOCKED' THEN 1 END) AS blockedItems,
                   avg(n.priorityComputed) AS avgActivePriority,
                   collect(DISTINCT n.type) AS activeWorkTypes
            ORDER BY activeItems DESC, contributorId
            """, CypherParams.of("contributorIds", query.getContributorIds())));

        List<Map<String, Object>> analysis = new ArrayList<>(rows.size());
        long available = 0;
        long overloaded = 0;
        long totalActive = 0;
        for (Map<String, Object> row : rows) {
            long active = Rows.getLong(row, "activeItems");
            long blocked = Rows.getLong(row, "blockedItems");
            AvailabilityStatus status = AvailabilityStatus.fromActiveItems(active);
            totalActive += active;
            if (status == AvailabilityStatus.AVAILABLE) {
                available++;
            } else if (status == AvailabilityStatus.OVERLOADED) {
                overloaded++;
            }

            Map<String, Object> availability = new LinkedHashMap<>();
            availability.put("active_items", active);
            availability.put("blocked_items", blocked);
            availability.put("capacity_status", status.getValue());
            if (query.isIncludeOverloadRisk()) {
                availability.put("overload_risk", status.getOverloadRisk());
            }
            availability.put("avg_priority_working_on", Rows.getDouble(row, "avgActivePriority"));
            availability.put("active_work_types", Rows.getList(row, "activeWorkTypes"));

            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("contributor", contributorRef(row, "contributorId", "name", null));
            entry.put("availability", availability);
            if (query.isIncludeRecommendations()) {
                entry.put("recommendations", availabilityRecommendations(status, active, blocked));
            }
            analysis.add(entry);
        }

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("total_contributors", analysis.size());
        summary.put("available_contributors", available);
        summary.put("overloaded_contributors", overloaded);
        summary.put("total_active_items", totalActive);

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("availability_analysis", analysis);
        response.put("summary", summary);
        return response;
    }

    static List<String> availabilityRecommendations(AvailabilityStatus status, long activeItems, long blockedItems) {
        List<String> recommendations = new ArrayList<>();
        if (status == AvailabilityStatus.OVERLOADED) {
            recommendations.add("Consider redistributing some work items to other team members");
        }
        if (blockedItems > 0) {
            recommendations.add("Help unblock " + blockedItems + " blocked items to improve throughput");
        }
        if (activeItems == 0) {
            recommendations.add("Available for new assignments");
        }
        return recommendations;
    }

    private static Map<String, Object> contributorRef(Map<String, Object> row, String idKey, String nameKey, String typeKey) {
        Map<String, Object> ref = new LinkedHashMap<>();
        ref.put("id", Rows.getString(row, idKey));
        ref.put("name", Rows.getString(row, nameKey));
        if (typeKey != null) {
            ref.put("type", Rows.getString(row, typeKey));
        }
        return ref;
    }

    private Map<String, Object> requireContributor(CypherRunner tx, String contributorId) {
        Map<String, Object> row = Rows.first(tx.run("""
            MATCH (c:Contributor {id: $contributorId})
            RETURN c.id AS id, c.name AS name, c.type AS type
            """, CypherParams.of("contributorId", contributorId)));
        if (row == null) {
            throw GraphOperationException.notFound("Contributor not found: " + contributorId);
        }
        log.debug("Resolved contributor {}", contributorId);
        return new LinkedHashMap<>(row);
    }
}
