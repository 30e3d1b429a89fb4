package com.purchasingpower.workgraph.mutation;

import com.purchasingpower.workgraph.configuration.WorkGraphProperties;
import com.purchasingpower.workgraph.core.EdgeType;
import com.purchasingpower.workgraph.core.WorkItemStatus;
import com.purchasingpower.workgraph.core.WorkItemType;
import com.purchasingpower.workgraph.exception.GraphOperationException;
import com.purchasingpower.workgraph.storage.CypherParams;
import com.purchasingpower.workgraph.storage.CypherRunner;
import com.purchasingpower.workgraph.storage.Rows;
import com.purchasingpower.workgraph.util.IdGenerator;
import com.purchasingpower.workgraph.util.InputSanitizer;
import com.purchasingpower.workgraph.util.MetadataCodec;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Single-entity mutations written against a {@link CypherRunner}, so they can
 * run in their own transaction or as one step of a bulk transaction.
 *
 * <p>Every check that can fail (validation, missing endpoints, duplicate IDs)
 * runs as a read before the first write, so a failed step leaves the
 * surrounding transaction usable.
 *
 * @since 1.0.0
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WorkItemWriter {

    static final String UNTITLED = "Untitled Node";
    private static final String DEFAULT_CONTRIBUTOR_TYPE = "HUMAN";

    private final IdGenerator idGenerator;
    private final MetadataCodec metadataCodec;
    private final WorkGraphProperties properties;

    // ================================================================
    // NODES
    // ================================================================

    public Map<String, Object> createNode(CypherRunner tx, CreateNodeCommand command) {
        String title = command.getTitle() == null || command.getTitle().isBlank()
            ? UNTITLED
            : InputSanitizer.sanitizeString(command.getTitle(), properties.getMaxTitleLength());
        String description = InputSanitizer.sanitizeString(command.getDescription(), properties.getMaxDescriptionLength());
        WorkItemType type = InputSanitizer.sanitizeNodeType(command.getType(), WorkItemType.TASK);
        WorkItemStatus status = InputSanitizer.sanitizeNodeStatus(command.getStatus(), WorkItemStatus.PROPOSED);
        Map<String, Object> metadata = InputSanitizer.sanitizeMetadata(command.getMetadata());
        List<String> contributorIds = sanitizeContributorIds(command.getContributorIds());
        String graphId = command.getGraphId() != null ? InputSanitizer.sanitizeId(command.getGraphId(), "Graph ID") : null;

        String id;
        if (command.getId() != null) {
            id = InputSanitizer.sanitizeNodeId(command.getId());
            if (nodeExists(tx, id)) {
                throw GraphOperationException.conflict("Node with ID " + id + " already exists");
            }
        } else {
            id = idGenerator.generateNodeId();
        }

        if (graphId != null && tx.run("MATCH (g:Graph {id: $graphId}) RETURN g.id AS id",
                CypherParams.of("graphId", graphId)).isEmpty()) {
            throw GraphOperationException.notFound("Graph not found: " + graphId);
        }

        Map<String, Object> created = Rows.getMap(Rows.first(tx.run("""
            CREATE (n:WorkItem {
                id: $id,
                title: $title,
                description: $description,
                type: $type,
                status: $status,
                priorityExecutive: 0.0,
                priorityIndividual: 0.0,
                priorityCommunity: 0.0,
                priorityComputed: 0.0,
                radius: 1.0,
                theta: 0.0,
                phi: 0.0,
                metadata: $metadata,
                createdAt: datetime(),
                updatedAt: datetime()
            })
            RETURN n
            """, CypherParams.of(
                "id", id,
                "title", title,
                "description", description,
                "type", type.name(),
                "status", status.name(),
                "metadata", metadataCodec.encode(metadata)))), "n");

        if (created == null) {
            throw GraphOperationException.storage("Node creation returned no result for " + id, null);
        }

        linkContributors(tx, id, contributorIds);

        if (graphId != null) {
            tx.run("""
                MATCH (n:WorkItem {id: $id}), (g:Graph {id: $graphId})
                MERGE (n)-[:BELONGS_TO]->(g)
                SET g.nodeCount = coalesce(g.nodeCount, 0) + 1,
                    g.updatedAt = datetime()
                """, CypherParams.of("id", id, "graphId", graphId));
        }

        log.info("Created work item {} ({}, {}) with {} contributors", id, type, status, contributorIds.size());

        Map<String, Object> node = metadataCodec.withDecoded(created, "metadata");
        node.put("contributor_ids", contributorIds);
        if (graphId != null) {
            node.put("graph_id", graphId);
        }
        return node;
    }

    public Map<String, Object> updateNode(CypherRunner tx, String nodeId, NodeUpdate update) {
        String id = InputSanitizer.sanitizeNodeId(nodeId);

        String title = null;
        if (update.getTitle() != null) {
            if (update.getTitle().isBlank()) {
                throw GraphOperationException.validation("title cannot be blank");
            }
            title = InputSanitizer.sanitizeString(update.getTitle(), properties.getMaxTitleLength());
        }
        String description = update.getDescription() != null
            ? InputSanitizer.sanitizeString(update.getDescription(), properties.getMaxDescriptionLength())
            : null;
        String metadata = update.getMetadata() != null
            ? metadataCodec.encode(InputSanitizer.sanitizeMetadata(update.getMetadata()))
            : null;
        List<String> contributorIds = update.getContributorIds() != null
            ? sanitizeContributorIds(update.getContributorIds())
            : null;

        SetClause clause = SetClause.forAlias("n")
            .set("title", title)
            .set("description", description)
            .set("type", update.getType() != null ? update.getType().name() : null)
            .set("status", update.getStatus() != null ? update.getStatus().name() : null)
            .set("metadata", metadata)
            .setExpression("updatedAt", "datetime()");

        Map<String, Object> params = new HashMap<>(clause.getParameters());
        params.put("nodeId", id);

        Map<String, Object> row = Rows.first(tx.run(
            "MATCH (n:WorkItem {id: $nodeId})\n" + clause.toCypher() + "\nRETURN n", params));
        if (row == null) {
            throw GraphOperationException.notFound("Node not found: " + id);
        }

        List<String> updatedFields = new ArrayList<>(clause.getAssignedProperties());
        if (contributorIds != null) {
            tx.run("""
                MATCH (n:WorkItem {id: $nodeId})-[r:WORKED_ON_BY]->(:Contributor)
                DELETE r
                """, CypherParams.of("nodeId", id));
            linkContributors(tx, id, contributorIds);
            updatedFields.add("contributors");
        }

        log.info("Updated work item {}: {}", id, updatedFields);

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("node", metadataCodec.withDecoded(Rows.getMap(row, "n"), "metadata"));
        response.put("updated_fields", updatedFields);
        if (contributorIds != null) {
            response.put("contributor_ids", contributorIds);
        }
        return response;
    }

    public Map<String, Object> deleteNode(CypherRunner tx, String nodeId) {
        String id = InputSanitizer.sanitizeNodeId(nodeId);

        Map<String, Object> row = Rows.first(tx.run("""
            MATCH (n:WorkItem {id: $nodeId})
            OPTIONAL MATCH (n)-[r]-()
            RETURN count(r) AS relationshipCount
            """, CypherParams.of("nodeId", id)));
        if (row == null) {
            throw GraphOperationException.notFound("Node not found: " + id);
        }
        long relationshipCount = Rows.getLong(row, "relationshipCount");

        tx.run("""
            MATCH (n:WorkItem {id: $nodeId})
            OPTIONAL MATCH (n)-[:BELONGS_TO]->(g:Graph)
            SET g.nodeCount = CASE WHEN coalesce(g.nodeCount, 0) > 0 THEN g.nodeCount - 1 ELSE 0 END
            WITH DISTINCT n
            DETACH DELETE n
            """, CypherParams.of("nodeId", id));

        log.info("Deleted work item {} and {} relationships", id, relationshipCount);

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("message", "Node deleted successfully");
        response.put("deleted_id", id);
        response.put("removed_relationships", relationshipCount);
        return response;
    }

    // ================================================================
    // EDGES
    // ================================================================

    public Map<String, Object> createEdge(CypherRunner tx, EdgeCommand command) {
        String sourceId = InputSanitizer.sanitizeId(command.getSourceId(), "Source node ID");
        String targetId = InputSanitizer.sanitizeId(command.getTargetId(), "Target node ID");
        EdgeType type = InputSanitizer.sanitizeEnum(command.getType(), EdgeType.class, null, "edge type");
        double weight = command.getWeight() != null ? command.getWeight() : 1.0;
        if (!Double.isFinite(weight)) {
            throw GraphOperationException.validation("weight must be a finite number");
        }
        Map<String, Object> metadata = InputSanitizer.sanitizeMetadata(command.getMetadata());

        requireEndpoints(tx, sourceId, targetId);

        String edgeId = idGenerator.generateEdgeId();
        // Relationship types cannot be parameters; the type comes from EdgeType only.
        Map<String, Object> row = Rows.first(tx.run("""
            MATCH (s:WorkItem {id: $sourceId}), (t:WorkItem {id: $targetId})
            MERGE (s)-[r:%s]->(t)
              ON CREATE SET r.id = $edgeId, r.createdAt = datetime()
            SET r.weight = $weight,
                r.metadata = $metadata,
                r.updatedAt = datetime()
            RETURN r.id AS id, r.id = $edgeId AS created, toString(r.createdAt) AS createdAt
            """.formatted(type.name()), CypherParams.of(
                "sourceId", sourceId,
                "targetId", targetId,
                "edgeId", edgeId,
                "weight", weight,
                "metadata", metadataCodec.encode(metadata))));

        boolean created = row != null && Boolean.TRUE.equals(row.get("created"));
        log.info("{} edge {} -[{}]-> {}", created ? "Created" : "Updated", sourceId, type, targetId);

        Map<String, Object> edge = new LinkedHashMap<>();
        edge.put("id", Rows.getString(row, "id"));
        edge.put("source_id", sourceId);
        edge.put("target_id", targetId);
        edge.put("type", type.name());
        edge.put("weight", weight);
        edge.put("metadata", metadata);
        edge.put("created_at", Rows.getString(row, "createdAt"));

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("message", created ? "Edge created successfully" : "Edge already existed and was updated");
        response.put("created", created);
        response.put("edge", edge);
        return response;
    }

    public Map<String, Object> deleteEdge(CypherRunner tx, EdgeCommand command) {
        String sourceId = InputSanitizer.sanitizeId(command.getSourceId(), "Source node ID");
        String targetId = InputSanitizer.sanitizeId(command.getTargetId(), "Target node ID");
        EdgeType type = InputSanitizer.sanitizeEnum(command.getType(), EdgeType.class, null, "edge type");

        requireEndpoints(tx, sourceId, targetId);

        long existing = Rows.getLong(Rows.first(tx.run("""
            MATCH (:WorkItem {id: $sourceId})-[r:%s]->(:WorkItem {id: $targetId})
            RETURN count(r) AS edges
            """.formatted(type.name()), CypherParams.of("sourceId", sourceId, "targetId", targetId))), "edges");
        if (existing == 0) {
            throw GraphOperationException.notFound(
                "Edge not found: " + sourceId + " -[" + type.name() + "]-> " + targetId);
        }

        tx.run("""
            MATCH (:WorkItem {id: $sourceId})-[r:%s]->(:WorkItem {id: $targetId})
            DELETE r
            """.formatted(type.name()), CypherParams.of("sourceId", sourceId, "targetId", targetId));

        log.info("Deleted edge {} -[{}]-> {}", sourceId, type, targetId);

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("message", "Edge deleted successfully");
        response.put("source_id", sourceId);
        response.put("target_id", targetId);
        response.put("type", type.name());
        response.put("deleted_count", existing);
        return response;
    }

    // ================================================================
    // HELPERS
    // ================================================================

    private boolean nodeExists(CypherRunner tx, String id) {
        return !tx.run("MATCH (n:WorkItem {id: $id}) RETURN n.id AS id", CypherParams.of("id", id)).isEmpty();
    }

    private void requireEndpoints(CypherRunner tx, String sourceId, String targetId) {
        List<Object> found = Rows.getList(Rows.first(tx.run("""
            MATCH (n:WorkItem) WHERE n.id IN [$sourceId, $targetId]
            RETURN collect(n.id) AS ids
            """, CypherParams.of("sourceId", sourceId, "targetId", targetId))), "ids");
        if (!found.contains(sourceId)) {
            throw GraphOperationException.notFound("Source node not found: " + sourceId);
        }
        if (!found.contains(targetId)) {
            throw GraphOperationException.notFound("Target node not found: " + targetId);
        }
    }

    private List<String> sanitizeContributorIds(List<String> raw) {
        if (raw == null || raw.isEmpty()) {
            return new ArrayList<>();
        }
        int max = properties.getMaxContributors();
        if (raw.size() > max) {
            log.warn("Truncating contributor list from {} to {}", raw.size(), max);
        }
        LinkedHashSet<String> ids = new LinkedHashSet<>();
        for (String contributorId : raw.subList(0, Math.min(raw.size(), max))) {
            ids.add(InputSanitizer.sanitizeId(contributorId, "Contributor ID"));
        }
        return new ArrayList<>(ids);
    }

    private void linkContributors(CypherRunner tx, String nodeId, List<String> contributorIds) {
        if (contributorIds.isEmpty()) {
            return;
        }
        tx.run("""
            MATCH (n:WorkItem {id: $nodeId})
            UNWIND $contributorIds AS contributorId
            MERGE (c:Contributor {id: contributorId})
              ON CREATE SET c.name = contributorId, c.type = $contributorType, c.createdAt = datetime()
            MERGE (n)-[r:WORKED_ON_BY]->(c)
              ON CREATE SET r.createdAt = datetime()
            """, CypherParams.of(
                "nodeId", nodeId,
                "contributorIds", contributorIds,
                "contributorType", DEFAULT_CONTRIBUTOR_TYPE));
    }
}
