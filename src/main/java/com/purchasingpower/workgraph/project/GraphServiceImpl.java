package com.purchasingpower.workgraph.project;

import com.purchasingpower.workgraph.configuration.WorkGraphProperties;
import com.purchasingpower.workgraph.core.EdgeType;
import com.purchasingpower.workgraph.core.GraphStatus;
import com.purchasingpower.workgraph.core.WorkItemStatus;
import com.purchasingpower.workgraph.exception.GraphOperationException;
import com.purchasingpower.workgraph.mutation.SetClause;
import com.purchasingpower.workgraph.query.PageInfo;
import com.purchasingpower.workgraph.storage.CypherParams;
import com.purchasingpower.workgraph.storage.CypherRunner;
import com.purchasingpower.workgraph.storage.GraphStore;
import com.purchasingpower.workgraph.storage.Rows;
import com.purchasingpower.workgraph.util.IdGenerator;
import com.purchasingpower.workgraph.util.InputSanitizer;
import com.purchasingpower.workgraph.util.MetadataCodec;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class GraphServiceImpl implements GraphService {

    static final String DEFAULT_ARCHIVE_REASON = "Archived via API";

    private final GraphStore graphStore;
    private final GraphHierarchyValidator hierarchyValidator;
    private final IdGenerator idGenerator;
    private final MetadataCodec metadataCodec;
    private final WorkGraphProperties properties;

    @Override
    public Map<String, Object> createGraph(CreateGraphCommand command) {
        String graphId = idGenerator.generateGraphId();

        Map<String, Object> graph = graphStore.writeTransaction(tx -> {
            if (command.getParentGraphId() != null) {
                hierarchyValidator.validateParent(tx, null, command.getParentGraphId());
            }
            Map<String, Object> row = Rows.first(tx.run("""
                CREATE (g:Graph {
                    id: $id,
                    name: $name,
                    description: $description,
                    type: $type,
                    status: $status,
                    teamId: $teamId,
                    parentGraphId: $parentGraphId,
                    isShared: $isShared,
                    settings: $settings,
                    nodeCount: 0,
                    edgeCount: 0,
                    createdAt: datetime(),
                    updatedAt: datetime()
                })
                RETURN g
                """, CypherParams.of(
                "id", graphId,
                "name", command.getName(),
                "description", command.getDescription(),
                "type", command.getType().name(),
                "status", command.getStatus().name(),
                "teamId", command.getTeamId(),
                "parentGraphId", command.getParentGraphId(),
                "isShared", command.isShared(),
                "settings", metadataCodec.encode(command.getSettings()))));
            if (row == null) {
                throw GraphOperationException.storage("Graph creation returned no result", null);
            }
            return toGraph(Rows.getMap(row, "g"));
        });

        log.info("✅ Created graph {} ({})", graphId, command.getName());
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("message", "Graph created successfully");
        response.put("graph", graph);
        return response;
    }

    @Override
    public Map<String, Object> listGraphs(GraphListQuery query) {
        int limit = query.getLimit() != null ? query.getLimit() : properties.getDefaultLimit();
        int offset = query.getOffset() != null ? query.getOffset() : 0;
        if (limit <= 0) {
            throw GraphOperationException.validation("limit must be greater than zero");
        }
        if (offset < 0) {
            throw GraphOperationException.validation("offset must be zero or greater");
        }

        String match = """
            MATCH (g:Graph)
            WHERE ($type IS NULL OR g.type = $type)
              AND ($status IS NULL OR g.status = $status)
              AND ($teamId IS NULL OR g.teamId = $teamId)
              AND ($isShared IS NULL OR g.isShared = $isShared)
            """;
        Map<String, Object> params = CypherParams.of(
            "type", query.getType() != null ? query.getType().name() : null,
            "status", query.getStatus() != null ? query.getStatus().name() : null,
            "teamId", query.getTeamId(),
            "isShared", query.getShared(),
            "limit", (long) limit,
            "offset", (long) offset);

        return graphStore.readTransaction(tx -> {
            long total = Rows.getLong(Rows.first(tx.run(match + "RETURN count(g) AS total", params)), "total");
            List<Map<String, Object>> graphs = new ArrayList<>();
            for (Map<String, Object> row : tx.run(match + """
                RETURN g
                ORDER BY g.updatedAt DESC
                SKIP $offset
                LIMIT $limit
                """, params)) {
                graphs.add(toGraph(Rows.getMap(row, "g")));
            }

            Map<String, Object> response = new LinkedHashMap<>();
            response.put("graphs", graphs);
            response.put("count", graphs.size());
            response.put("pagination", PageInfo.of(total, limit, offset).toMap());
            return response;
        });
    }

    @Override
    public Map<String, Object> getGraphDetails(String rawGraphId) {
        String graphId = InputSanitizer.sanitizeId(rawGraphId, "graphId");
        Map<String, Object> params = CypherParams.of("graphId", graphId);

        return graphStore.readTransaction(tx -> {
            Map<String, Object> graph = requireGraph(tx, graphId);

            Map<String, Long> nodeTypes = new LinkedHashMap<>();
            Map<String, Long> nodeStatuses = new LinkedHashMap<>();
            long nodeCount = 0;
            for (Map<String, Object> row : tx.run("""
                MATCH (n:WorkItem)-[:BELONGS_TO]->(:Graph {id: $graphId})
                RETURN n.type AS type, n.status AS status, count(n) AS count
                """, params)) {
                long count = Rows.getLong(row, "count");
                nodeTypes.merge(String.valueOf(Rows.getString(row, "type")), count, Long::sum);
                nodeStatuses.merge(String.valueOf(Rows.getString(row, "status")), count, Long::sum);
                nodeCount += count;
            }

            long edgeCount = Rows.getLong(Rows.first(tx.run("""
                MATCH (a:WorkItem)-[:BELONGS_TO]->(g:Graph {id: $graphId})
                MATCH (a)-[r]->(b:WorkItem)-[:BELONGS_TO]->(g)
                RETURN count(r) AS edgeCount
                """, params)), "edgeCount");

            List<Map<String, Object>> children = tx.run("""
                MATCH (c:Graph {parentGraphId: $graphId})
                RETURN c.id AS id, c.name AS name, c.status AS status
                ORDER BY c.name
                """, params);

            Map<String, Object> statistics = new LinkedHashMap<>();
            statistics.put("nodeCount", nodeCount);
            statistics.put("edgeCount", edgeCount);
            statistics.put("nodeTypes", nodeTypes);
            statistics.put("nodeStatuses", nodeStatuses);

            Map<String, Object> response = new LinkedHashMap<>();
            response.put("graph", graph);
            response.put("statistics", statistics);
            response.put("childGraphs", children);
            return response;
        });
    }

    @Override
    public Map<String, Object> updateGraph(String rawGraphId, GraphUpdate update) {
        String graphId = InputSanitizer.sanitizeId(rawGraphId, "graphId");
        if (update.isEmpty()) {
            throw GraphOperationException.validation("No fields provided to update");
        }

        SetClause clause = SetClause.forAlias("g")
            .set("name", update.getName())
            .set("description", update.getDescription())
            .set("type", update.getType() != null ? update.getType().name() : null)
            .set("status", update.getStatus() != null ? update.getStatus().name() : null)
            .set("teamId", update.getTeamId())
            .set("parentGraphId", update.getParentGraphId())
            .set("isShared", update.getShared())
            .set("settings", update.getSettings() != null ? metadataCodec.encode(update.getSettings()) : null)
            .setExpression("updatedAt", "datetime()");

        Map<String, Object> graph = graphStore.writeTransaction(tx -> {
            requireGraph(tx, graphId);
            if (update.getParentGraphId() != null) {
                hierarchyValidator.validateParent(tx, graphId, update.getParentGraphId());
            }
            Map<String, Object> params = new HashMap<>(clause.getParameters());
            params.put("graphId", graphId);
            return toGraph(Rows.getMap(Rows.first(tx.run(
                "MATCH (g:Graph {id: $graphId})\n" + clause.toCypher() + "\nRETURN g", params)), "g"));
        });

        log.info("Updated graph {}: {}", graphId, clause.getAssignedProperties());
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("message", "Graph updated successfully");
        response.put("graph", graph);
        response.put("updatedFields", clause.getAssignedProperties());
        return response;
    }

    @Override
    public Map<String, Object> deleteGraph(String rawGraphId, boolean force) {
        String graphId = InputSanitizer.sanitizeId(rawGraphId, "graphId");
        Map<String, Object> params = CypherParams.of("graphId", graphId);

        Map<String, Object> response = graphStore.writeTransaction(tx -> {
            requireGraph(tx, graphId);
            long nodeCount = Rows.getLong(Rows.first(tx.run("""
                MATCH (n:WorkItem)-[:BELONGS_TO]->(:Graph {id: $graphId})
                RETURN count(n) AS nodeCount
                """, params)), "nodeCount");
            if (nodeCount > 0 && !force) {
                throw GraphOperationException.conflict(
                    "Graph contains " + nodeCount + " nodes. Use force=true to delete anyway.");
            }

            tx.run("""
                MATCH (n:WorkItem)-[:BELONGS_TO]->(:Graph {id: $graphId})
                DETACH DELETE n
                """, params);
            tx.run("""
                MATCH (c:Graph {parentGraphId: $graphId})
                REMOVE c.parentGraphId
                SET c.updatedAt = datetime()
                """, params);
            tx.run("""
                MATCH (g:Graph {id: $graphId})
                DETACH DELETE g
                """, params);

            Map<String, Object> result = new LinkedHashMap<>();
            result.put("message", "Graph deleted successfully");
            result.put("deletedGraphId", graphId);
            result.put("deletedNodes", nodeCount);
            return result;
        });

        log.info("🗑️ Deleted graph {} (force={}, nodes={})", graphId, force, response.get("deletedNodes"));
        return response;
    }

    @Override
    public Map<String, Object> archiveGraph(String rawGraphId, String reason) {
        String graphId = InputSanitizer.sanitizeId(rawGraphId, "graphId");
        String archiveReason = reason == null || reason.isBlank()
            ? DEFAULT_ARCHIVE_REASON
            : InputSanitizer.sanitizeString(reason, 500);

        Map<String, Object> graph = graphStore.writeTransaction(tx -> {
            requireGraph(tx, graphId);
            return toGraph(Rows.getMap(Rows.first(tx.run("""
                MATCH (g:Graph {id: $graphId})
                SET g.status = $status,
                    g.archivedAt = datetime(),
                    g.archiveReason = $reason,
                    g.updatedAt = datetime()
                RETURN g
                """, CypherParams.of(
                "graphId", graphId,
                "status", GraphStatus.ARCHIVED.name(),
                "reason", archiveReason))), "g"));
        });

        log.info("Archived graph {}: {}", graphId, archiveReason);
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("message", "Graph archived successfully");
        response.put("graph", graph);
        return response;
    }

    @Override
    public Map<String, Object> cloneGraph(CloneGraphCommand command) {
        String newGraphId = idGenerator.generateGraphId();

        Map<String, Object> response = graphStore.writeTransaction(tx -> {
            Map<String, Object> source = requireGraph(tx, command.getSourceGraphId(), "Source graph not found: ");

            Map<String, Object> cloned = Rows.getMap(Rows.first(tx.run("""
                MATCH (s:Graph {id: $sourceGraphId})
                CREATE (g:Graph {
                    id: $newGraphId,
                    name: $newName,
                    description: 'Cloned from: ' + s.name,
                    type: s.type,
                    status: $status,
                    teamId: coalesce($teamId, s.teamId),
                    isShared: coalesce(s.isShared, false),
                    settings: s.settings,
                    clonedFrom: s.id,
                    nodeCount: 0,
                    edgeCount: 0,
                    createdAt: datetime(),
                    updatedAt: datetime()
                })
                RETURN g
                """, CypherParams.of(
                "sourceGraphId", command.getSourceGraphId(),
                "newGraphId", newGraphId,
                "newName", command.getNewName(),
                "status", GraphStatus.ACTIVE.name(),
                "teamId", command.getTeamId()))), "g");

            long clonedNodes = 0;
            long clonedEdges = 0;
            if (command.isIncludeNodes()) {
                Map<String, String> idMap = cloneNodes(tx, command.getSourceGraphId(), newGraphId);
                clonedNodes = idMap.size();
                if (command.isIncludeEdges()) {
                    clonedEdges = cloneEdges(tx, command.getSourceGraphId(), idMap);
                }
                cloned = Rows.getMap(Rows.first(tx.run("""
                    MATCH (g:Graph {id: $newGraphId})
                    SET g.nodeCount = $nodeCount, g.edgeCount = $edgeCount
                    RETURN g
                    """, CypherParams.of(
                    "newGraphId", newGraphId,
                    "nodeCount", clonedNodes,
                    "edgeCount", clonedEdges))), "g");
            }

            Map<String, Object> result = new LinkedHashMap<>();
            result.put("message", "Graph cloned successfully");
            result.put("sourceGraph", source);
            result.put("clonedGraph", toGraph(cloned));
            result.put("clonedNodes", clonedNodes);
            result.put("clonedEdges", clonedEdges);
            return result;
        });

        log.info("✅ Cloned graph {} into {} ({} nodes, {} edges)", command.getSourceGraphId(), newGraphId,
            response.get("clonedNodes"), response.get("clonedEdges"));
        return response;
    }

    private Map<String, String> cloneNodes(CypherRunner tx, String sourceGraphId, String newGraphId) {
        List<Map<String, Object>> sourceNodes = tx.run("""
            MATCH (n:WorkItem)-[:BELONGS_TO]->(:Graph {id: $sourceGraphId})
            RETURN n.id AS id
            ORDER BY id
            """, CypherParams.of("sourceGraphId", sourceGraphId));

        Map<String, String> idMap = new LinkedHashMap<>();
        List<Map<String, Object>> mapping = new ArrayList<>(sourceNodes.size());
        for (Map<String, Object> row : sourceNodes) {
            String oldId = Rows.getString(row, "id");
            String newId = idGenerator.generateNodeId();
            idMap.put(oldId, newId);
            mapping.add(CypherParams.of("oldId", oldId, "newId", newId));
        }
        if (mapping.isEmpty()) {
            return idMap;
        }

        tx.run("""
            UNWIND $mapping AS m
            MATCH (src:WorkItem {id: m.oldId})
            MATCH (g:Graph {id: $newGraphId})
            CREATE (c:WorkItem)
            SET c = properties(src),
                c.id = m.newId,
                c.status = $status,
                c.clonedFrom = src.id,
                c.createdAt = datetime(),
                c.updatedAt = datetime()
            CREATE (c)-[:BELONGS_TO]->(g)
            """, CypherParams.of(
            "mapping", mapping,
            "newGraphId", newGraphId,
            "status", WorkItemStatus.PROPOSED.name()));
        return idMap;
    }

    private long cloneEdges(CypherRunner tx, String sourceGraphId, Map<String, String> idMap) {
        if (idMap.isEmpty()) {
            return 0;
        }
        List<Map<String, Object>> edges = tx.run("""
            MATCH (a:WorkItem)-[:BELONGS_TO]->(g:Graph {id: $sourceGraphId})
            MATCH (a)-[r]->(b:WorkItem)-[:BELONGS_TO]->(g)
            RETURN a.id AS sourceId, b.id AS targetId, type(r) AS type,
                   r.weight AS weight, r.metadata AS metadata
            """, CypherParams.of("sourceGraphId", sourceGraphId));

        Map<EdgeType, List<Map<String, Object>>> byType = new EnumMap<>(EdgeType.class);
        for (Map<String, Object> edge : edges) {
            EdgeType type;
            try {
                type = EdgeType.valueOf(Rows.getString(edge, "type"));
            } catch (IllegalArgumentException e) {
                log.warn("⚠️  Skipping edge of unknown type {} while cloning", edge.get("type"));
                continue;
            }
            byType.computeIfAbsent(type, k -> new ArrayList<>()).add(CypherParams.of(
                "id", idGenerator.generateEdgeId(),
                "sourceId", idMap.get(Rows.getString(edge, "sourceId")),
                "targetId", idMap.get(Rows.getString(edge, "targetId")),
                "weight", edge.get("weight") != null ? Rows.getDouble(edge, "weight") : 1.0,
                "metadata", edge.get("metadata")));
        }

        long created = 0;
        for (Map.Entry<EdgeType, List<Map<String, Object>>> entry : byType.entrySet()) {
            // relationship types cannot be parameterized; EdgeType names are a closed set
            created += Rows.getLong(Rows.first(tx.run("""
                UNWIND $edges AS e
                MATCH (a:WorkItem {id: e.sourceId})
                MATCH (b:WorkItem {id: e.targetId})
                CREATE (a)-[r:%s {id: e.id, weight: e.weight, metadata: e.metadata,
                                 createdAt: datetime(), updatedAt: datetime()}]->(b)
                RETURN count(r) AS created
                """.formatted(entry.getKey().name()), CypherParams.of("edges", entry.getValue()))), "created");
        }
        return created;
    }

    private Map<String, Object> requireGraph(CypherRunner tx, String graphId) {
        return requireGraph(tx, graphId, "Graph not found: ");
    }

    private Map<String, Object> requireGraph(CypherRunner tx, String graphId, String notFoundPrefix) {
        Map<String, Object> row = Rows.first(tx.run("""
            MATCH (g:Graph {id: $graphId})
            RETURN g
            """, CypherParams.of("graphId", graphId)));
        if (row == null) {
            throw GraphOperationException.notFound(notFoundPrefix + graphId);
        }
        return toGraph(Rows.getMap(row, "g"));
    }

    private Map<String, Object> toGraph(Map<String, Object> properties) {
        return metadataCodec.withDecoded(properties, "settings");
    }
}
