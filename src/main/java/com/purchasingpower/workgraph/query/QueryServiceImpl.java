package com.purchasingpower.workgraph.query;

import com.purchasingpower.workgraph.configuration.WorkGraphProperties;
import com.purchasingpower.workgraph.exception.GraphOperationException;
import com.purchasingpower.workgraph.storage.CypherParams;
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

@Slf4j
@Service
@RequiredArgsConstructor
public class QueryServiceImpl implements QueryService {

    private static final int DEFAULT_PATH_LIMIT = 10;
    private static final int DEFAULT_CYCLE_LIMIT = 10;

    private final GraphStore graphStore;
    private final BrowseQueryBuilder queryBuilder;
    private final MetadataCodec metadataCodec;
    private final WorkGraphProperties properties;

    @Override
    public Map<String, Object> browse(QueryType queryType, QueryFilters filters) {
        BrowseQuery query = queryBuilder.build(queryType, filters);
        log.info("Browsing graph: query_type={}, limit={}, offset={}",
            queryType.getValue(), query.getLimit(), query.getOffset());

        if (!query.isPaginated()) {
            return browseDependencies(query);
        }

        return graphStore.readTransaction(tx -> {
            long total = Rows.getLong(Rows.first(tx.run(query.getCountCypher(), query.getParameters())), "total");
            List<Map<String, Object>> nodes = new ArrayList<>();
            for (Map<String, Object> row : tx.run(query.getCypher(), query.getParameters())) {
                nodes.add(metadataCodec.withDecoded(Rows.getMap(row, "n"), "metadata"));
            }

            Map<String, Object> response = new LinkedHashMap<>();
            response.put("query_type", queryType.getValue());
            response.put("count", nodes.size());
            response.put("nodes", nodes);
            response.put("pagination", PageInfo.of(total, query.getLimit(), query.getOffset()).toMap());
            return response;
        });
    }

    private Map<String, Object> browseDependencies(BrowseQuery query) {
        Map<String, Object> row = Rows.first(graphStore.read(query.getCypher(), query.getParameters()));
        if (row == null) {
            throw GraphOperationException.notFound("Node not found: " + query.getParameters().get("nodeId"));
        }

        List<Object> dependencies = decodeAll(Rows.getList(row, "dependencies"));
        List<Object> dependents = decodeAll(Rows.getList(row, "dependents"));

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("query_type", QueryType.DEPENDENCIES.getValue());
        response.put("node", metadataCodec.withDecoded(Rows.getMap(row, "n"), "metadata"));
        response.put("dependencies", dependencies);
        response.put("dependents", dependents);
        response.put("dependencies_count", dependencies.size());
        response.put("dependents_count", dependents.size());
        return response;
    }

    @Override
    public Map<String, Object> getNodeDetails(String nodeId, Integer relationshipLimit, Integer relationshipOffset) {
        String id = InputSanitizer.sanitizeNodeId(nodeId);
        int limit = Math.min(Math.max(1, relationshipLimit != null ? relationshipLimit : properties.getDefaultRelationshipLimit()),
            properties.getMaxRelationshipLimit());
        int offset = Math.max(0, relationshipOffset != null ? relationshipOffset : 0);

        return graphStore.readTransaction(tx -> {
            Map<String, Object> nodeRow = Rows.first(tx.run("""
                MATCH (n:WorkItem {id: $nodeId})
                OPTIONAL MATCH (n)-[:WORKED_ON_BY]->(c:Contributor)
                RETURN n, collect(DISTINCT c) AS contributors
                """, CypherParams.of("nodeId", id)));
            if (nodeRow == null) {
                throw GraphOperationException.notFound("Node not found: " + id);
            }

            Map<String, Object> countRow = Rows.first(tx.run("""
                MATCH (n:WorkItem {id: $nodeId})
                OPTIONAL MATCH (n)-[rel]-(:WorkItem)
                OPTIONAL MATCH (n)-[dep:DEPENDS_ON]->(:WorkItem)
                OPTIONAL MATCH (n)<-[dependent:DEPENDS_ON]-(:WorkItem)
                RETURN count(DISTINCT rel) AS totalRelationships,
                       count(DISTINCT dep) AS dependencyCount,
                       count(DISTINCT dependent) AS dependentCount
                """, CypherParams.of("nodeId", id)));

            List<Map<String, Object>> relationshipRows = tx.run("""
                MATCH (n:WorkItem {id: $nodeId})-[rel]-(related:WorkItem)
                RETURN type(rel) AS type,
                       CASE WHEN startNode(rel) = n THEN 'outgoing' ELSE 'incoming' END AS direction,
                       related,
                       properties(rel) AS relationshipProperties
                ORDER BY type, related.title
                SKIP $offset
                LIMIT $limit
                """, CypherParams.of("nodeId", id, "offset", (long) offset, "limit", (long) limit));

            List<Map<String, Object>> relationships = new ArrayList<>();
            List<Map<String, Object>> dependencies = new ArrayList<>();
            List<Map<String, Object>> dependents = new ArrayList<>();
            for (Map<String, Object> row : relationshipRows) {
                Map<String, Object> relationship = new LinkedHashMap<>();
                relationship.put("type", row.get("type"));
                relationship.put("direction", row.get("direction"));
                relationship.put("target_node", Rows.getMap(row, "related"));
                relationship.put("relationship_properties", metadataCodec.withDecoded(
                    Rows.getMap(row, "relationshipProperties"), "metadata"));
                relationships.add(relationship);

                if ("DEPENDS_ON".equals(row.get("type"))) {
                    Map<String, Object> entry = new LinkedHashMap<>();
                    entry.put("node", Rows.getMap(row, "related"));
                    entry.put("relationship", relationship.get("relationship_properties"));
                    ("outgoing".equals(row.get("direction")) ? dependencies : dependents).add(entry);
                }
            }

            List<Object> contributors = Rows.getList(nodeRow, "contributors");
            long totalRelationships = Rows.getLong(countRow, "totalRelationships");

            Map<String, Object> stats = new LinkedHashMap<>();
            stats.put("contributor_count", contributors.size());
            stats.put("dependency_count", Rows.getLong(countRow, "dependencyCount"));
            stats.put("dependent_count", Rows.getLong(countRow, "dependentCount"));
            stats.put("total_relationships", totalRelationships);
            stats.put("relationships_shown", relationships.size());

            Map<String, Object> response = new LinkedHashMap<>();
            response.put("node", metadataCodec.withDecoded(Rows.getMap(nodeRow, "n"), "metadata"));
            response.put("contributors", contributors);
            response.put("dependencies", dependencies);
            response.put("dependents", dependents);
            response.put("relationships", relationships);
            response.put("relationships_pagination", PageInfo.of(totalRelationships, limit, offset).toMap());
            response.put("stats", stats);
            return response;
        });
    }

    @Override
    public Map<String, Object> findPath(String startId, String endId, Integer maxDepth, Integer limit, Integer offset) {
        String start = InputSanitizer.sanitizeNodeId(startId);
        String end = InputSanitizer.sanitizeNodeId(endId);
        int depth = Math.min(Math.max(1, maxDepth != null ? maxDepth : properties.getMaxPathDepth()),
            properties.getMaxPathDepth());
        int pageLimit = queryBuilder.resolveLimit(limit != null ? limit : DEFAULT_PATH_LIMIT);
        int pageOffset = queryBuilder.resolveOffset(offset);

        // Variable-length bounds cannot be parameters; depth is a clamped int.
        String pattern = "MATCH path = allShortestPaths((start:WorkItem {id: $startId})-[*1.." + depth
            + "]-(end:WorkItem {id: $endId}))";
        Map<String, Object> params = CypherParams.of("startId", start, "endId", end,
            "offset", (long) pageOffset, "limit", (long) pageLimit);

        return graphStore.readTransaction(tx -> {
            long endpoints = Rows.getLong(Rows.first(tx.run("""
                MATCH (n:WorkItem) WHERE n.id IN [$startId, $endId]
                RETURN count(DISTINCT n.id) AS found
                """, params)), "found");
            long expected = start.equals(end) ? 1 : 2;
            if (endpoints < expected) {
                throw GraphOperationException.notFound("Start or end node not found: " + start + ", " + end);
            }

            long total = start.equals(end) ? 0 : Rows.getLong(Rows.first(
                tx.run(pattern + "\nRETURN count(path) AS total", params)), "total");

            List<Object> paths = new ArrayList<>();
            if (total > 0) {
                for (Map<String, Object> row : tx.run(pattern
                    + "\nRETURN path, length(path) AS pathLength\nORDER BY pathLength ASC\nSKIP $offset\nLIMIT $limit",
                    params)) {
                    paths.add(row.get("path"));
                }
            }

            PageInfo page = PageInfo.of(total, pageLimit, pageOffset);
            Map<String, Object> response = new LinkedHashMap<>();
            response.put("message", total == 0
                ? "No path found between the specified nodes"
                : "Found " + total + " total path(s), showing " + paths.size() + " on page " + page.getCurrentPage());
            response.put("start_id", start);
            response.put("end_id", end);
            response.put("max_depth", depth);
            response.put("total_paths", total);
            response.put("count", paths.size());
            response.put("paths", paths);
            response.put("pagination", page.toMap());
            return response;
        });
    }

    @Override
    public Map<String, Object> detectCycles(Integer limit, Integer offset) {
        int pageLimit = queryBuilder.resolveLimit(limit != null ? limit : DEFAULT_CYCLE_LIMIT);
        int pageOffset = queryBuilder.resolveOffset(offset);
        Map<String, Object> params = CypherParams.of("offset", (long) pageOffset, "limit", (long) pageLimit);

        return graphStore.readTransaction(tx -> {
            long total = Rows.getLong(Rows.first(tx.run("""
                MATCH path = (n:WorkItem)-[:DEPENDS_ON*2..10]->(n)
                RETURN count(path) AS total
                """, params)), "total");

            List<Object> cycles = new ArrayList<>();
            for (Map<String, Object> row : tx.run("""
                MATCH path = (n:WorkItem)-[:DEPENDS_ON*2..10]->(n)
                RETURN path, length(path) AS cycleLength
                ORDER BY cycleLength ASC
                SKIP $offset
                LIMIT $limit
                """, params)) {
                Map<String, Object> path = Rows.getMap(row, "path");
                Map<String, Object> cycle = new LinkedHashMap<>();
                cycle.put("length", Rows.getLong(row, "cycleLength"));
                cycle.put("node_ids", path != null ? nodeIds(Rows.getList(path, "nodes")) : List.of());
                cycle.put("path", path);
                cycles.add(cycle);
            }

            Map<String, Object> response = new LinkedHashMap<>();
            response.put("message", total == 0 ? "No dependency cycles detected" : "Found " + total + " cycle path(s)");
            response.put("total_cycles", total);
            response.put("count", cycles.size());
            response.put("cycles", cycles);
            response.put("pagination", PageInfo.of(total, pageLimit, pageOffset).toMap());
            return response;
        });
    }

    private List<Object> decodeAll(List<Object> nodes) {
        List<Object> decoded = new ArrayList<>(nodes.size());
        for (Object node : nodes) {
            if (node instanceof Map<?, ?>) {
                @SuppressWarnings("unchecked")
                Map<String, Object> properties = (Map<String, Object>) node;
                decoded.add(metadataCodec.withDecoded(properties, "metadata"));
            }
        }
        return decoded;
    }

    private List<Object> nodeIds(List<Object> nodes) {
        List<Object> ids = new ArrayList<>();
        for (Object node : nodes) {
            if (node instanceof Map<?, ?> properties) {
                ids.add(properties.get("id"));
            }
        }
        return ids;
    }
}
