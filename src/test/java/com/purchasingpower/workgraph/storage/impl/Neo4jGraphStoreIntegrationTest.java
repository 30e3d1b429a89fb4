package com.purchasingpower.workgraph.storage.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.workgraph.configuration.WorkGraphProperties;
import com.purchasingpower.workgraph.core.ErrorKind;
import com.purchasingpower.workgraph.exception.GraphOperationException;
import com.purchasingpower.workgraph.mutation.BulkOperation;
import com.purchasingpower.workgraph.mutation.BulkOperationServiceImpl;
import com.purchasingpower.workgraph.mutation.CreateNodeCommand;
import com.purchasingpower.workgraph.mutation.EdgeCommand;
import com.purchasingpower.workgraph.mutation.MutationServiceImpl;
import com.purchasingpower.workgraph.mutation.WorkItemWriter;
import com.purchasingpower.workgraph.project.CreateGraphCommand;
import com.purchasingpower.workgraph.project.GraphHierarchyValidator;
import com.purchasingpower.workgraph.project.GraphServiceImpl;
import com.purchasingpower.workgraph.query.BrowseQueryBuilder;
import com.purchasingpower.workgraph.query.QueryFilters;
import com.purchasingpower.workgraph.query.QueryServiceImpl;
import com.purchasingpower.workgraph.query.QueryType;
import com.purchasingpower.workgraph.storage.CypherParams;
import com.purchasingpower.workgraph.storage.Rows;
import com.purchasingpower.workgraph.util.IdGenerator;
import com.purchasingpower.workgraph.util.MetadataCodec;
import com.purchasingpower.workgraph.util.ToolArguments;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.testcontainers.containers.Neo4jContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Runs the engine's Cypher against a real Neo4j.
 */
@Testcontainers(disabledWithoutDocker = true)
@DisplayName("Neo4j graph store (integration)")
class Neo4jGraphStoreIntegrationTest {

    @Container
    static Neo4jContainer<?> neo4j = new Neo4jContainer<>("neo4j:5.18").withAdminPassword("integration-test");

    private static Neo4jGraphStoreImpl store;

    private MutationServiceImpl mutationService;
    private BulkOperationServiceImpl bulkService;
    private QueryServiceImpl queryService;
    private GraphServiceImpl graphService;

    @BeforeAll
    static void connect() {
        store = new Neo4jGraphStoreImpl(neo4j.getBoltUrl(), "neo4j", "integration-test");
        store.init();
    }

    @AfterAll
    static void disconnect() {
        store.close();
    }

    @BeforeEach
    void setUp() {
        store.write("MATCH (n) DETACH DELETE n", Map.of());

        WorkGraphProperties properties = new WorkGraphProperties();
        IdGenerator idGenerator = new IdGenerator();
        MetadataCodec codec = new MetadataCodec(new ObjectMapper());
        WorkItemWriter writer = new WorkItemWriter(idGenerator, codec, properties);

        mutationService = new MutationServiceImpl(store, writer);
        bulkService = new BulkOperationServiceImpl(store, writer, properties);
        queryService = new QueryServiceImpl(store, new BrowseQueryBuilder(properties), codec, properties);
        graphService = new GraphServiceImpl(store, new GraphHierarchyValidator(), idGenerator, codec, properties);
    }

    @Test
    @DisplayName("A new node gets default type, status, zero priorities and radius 1")
    @SuppressWarnings("unchecked")
    void createNodeDefaults() {
        Map<String, Object> node = mutationService.createNode(CreateNodeCommand.builder().build());

        assertThat(node)
            .containsEntry("title", "Untitled Node")
            .containsEntry("type", "TASK")
            .containsEntry("status", "PROPOSED")
            .containsEntry("priorityComputed", 0.0)
            .containsEntry("radius", 1.0);
        assertThat((Map<String, Object>) node.get("metadata")).isEmpty();
    }

    @Test
    @DisplayName("by_priority pages through 23 items in descending priority")
    @SuppressWarnings("unchecked")
    void browseByPriorityPagination() {
        // Given: computed priorities i/22 for i in 0..22, so 12 items are >= 0.5
        for (int i = 0; i < 23; i++) {
            String id = "item-" + i;
            mutationService.createNode(CreateNodeCommand.builder().id(id).title("Item " + i).build());
            store.write("MATCH (n:WorkItem {id: $id}) SET n.priorityComputed = $p",
                CypherParams.of("id", id, "p", i / 22.0));
        }

        // When
        Map<String, Object> page = queryService.browse(QueryType.BY_PRIORITY,
            QueryFilters.builder().minPriority(0.5).limit(5).offset(5).build());

        // Then
        List<Map<String, Object>> nodes = (List<Map<String, Object>>) page.get("nodes");
        assertThat(nodes).extracting(n -> n.get("id"))
            .containsExactly("item-17", "item-16", "item-15", "item-14", "item-13");
        assertThat((Map<String, Object>) page.get("pagination"))
            .containsEntry("total_count", 12L)
            .containsEntry("current_page", 2L)
            .containsEntry("total_pages", 3L)
            .containsEntry("has_next_page", true);
    }

    @Test
    @DisplayName("Creating the same edge twice leaves one relationship")
    void idempotentEdge() {
        mutationService.createNode(CreateNodeCommand.builder().id("a").build());
        mutationService.createNode(CreateNodeCommand.builder().id("b").build());
        EdgeCommand edge = EdgeCommand.builder().sourceId("a").targetId("b").type("DEPENDS_ON").weight(0.5).build();

        Map<String, Object> first = mutationService.createEdge(edge);
        Map<String, Object> second = mutationService.createEdge(edge);

        assertThat(first).containsEntry("created", true);
        assertThat(second).containsEntry("created", false);
        long edges = Rows.getLong(store.read(
            "MATCH (:WorkItem {id: 'a'})-[r:DEPENDS_ON]->(:WorkItem {id: 'b'}) RETURN count(r) AS edges",
            Map.of()).get(0), "edges");
        assertThat(edges).isEqualTo(1);
    }

    @Test
    @DisplayName("A failing third operation rolls back the whole bulk transaction")
    void bulkRollback() {
        // Given
        List<BulkOperation> operations = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            Map<String, Object> params = i == 2
                ? Map.of("title", "Bulk " + i, "type", "SAGA")
                : Map.of("title", "Bulk " + i);
            operations.add(BulkOperation.from(Map.of("type", "create_node", "params", params)));
        }

        // When
        Map<String, Object> report = bulkService.execute(operations, true, true);

        // Then
        assertThat(report).containsEntry("rolled_back", true);
        long persisted = Rows.getLong(store.read(
            "MATCH (n:WorkItem) WHERE n.title STARTS WITH 'Bulk' RETURN count(n) AS total", Map.of()).get(0), "total");
        assertThat(persisted).isZero();
    }

    @Test
    @DisplayName("A graph with items is kept unless force is given")
    @SuppressWarnings("unchecked")
    void deleteGraphRequiresForce() {
        // Given
        Map<String, Object> created = graphService.createGraph(
            CreateGraphCommand.from(ToolArguments.of(Map.of("name", "Roadmap"))));
        String graphId = (String) ((Map<String, Object>) created.get("graph")).get("id");
        mutationService.createNode(CreateNodeCommand.builder().id("roadmap-item").graphId(graphId).build());

        // When / Then
        assertThatThrownBy(() -> graphService.deleteGraph(graphId, false))
            .isInstanceOf(GraphOperationException.class)
            .extracting("kind").isEqualTo(ErrorKind.CONFLICT);
        assertThat(store.read("MATCH (g:Graph {id: $id}) RETURN g.id AS id", Map.of("id", graphId))).hasSize(1);

        Map<String, Object> deleted = graphService.deleteGraph(graphId, true);
        assertThat(deleted).containsEntry("deletedNodes", 1L);
        assertThat(store.read("MATCH (n:WorkItem {id: 'roadmap-item'}) RETURN n.id AS id", Map.of())).isEmpty();
    }
}
