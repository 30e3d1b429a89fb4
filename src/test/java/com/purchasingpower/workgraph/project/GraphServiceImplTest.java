package com.purchasingpower.workgraph.project;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.workgraph.configuration.WorkGraphProperties;
import com.purchasingpower.workgraph.core.ErrorKind;
import com.purchasingpower.workgraph.exception.GraphOperationException;
import com.purchasingpower.workgraph.storage.CypherRunner;
import com.purchasingpower.workgraph.storage.GraphStore;
import com.purchasingpower.workgraph.util.IdGenerator;
import com.purchasingpower.workgraph.util.MetadataCodec;
import com.purchasingpower.workgraph.util.ToolArguments;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.util.List;
import java.util.Map;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("Graph service")
class GraphServiceImplTest {

    private static final String FIND_GRAPH = "MATCH (g:Graph {id: $graphId})\nRETURN g\n";

    @Mock
    private GraphStore graphStore;

    @Mock
    private CypherRunner tx;

    private GraphServiceImpl service;

    @BeforeEach
    void setUp() {
        service = new GraphServiceImpl(graphStore, new GraphHierarchyValidator(), new IdGenerator(),
            new MetadataCodec(new ObjectMapper()), new WorkGraphProperties());
        when(graphStore.writeTransaction(any())).thenAnswer(invocation -> {
            Function<CypherRunner, Object> work = invocation.getArgument(0);
            return work.apply(tx);
        });
        when(graphStore.readTransaction(any())).thenAnswer(invocation -> {
            Function<CypherRunner, Object> work = invocation.getArgument(0);
            return work.apply(tx);
        });
    }

    @Test
    @DisplayName("createGraph applies PROJECT/ACTIVE defaults and zero counts")
    @SuppressWarnings("unchecked")
    void createDefaults() {
        // Given
        when(tx.run(contains("CREATE (g:Graph"), anyMap()))
            .thenReturn(List.of(Map.of("g", Map.of("id", "graph_1", "name", "Roadmap", "settings", "{\"theme\":\"dark\"}"))));
        CreateGraphCommand command = CreateGraphCommand.from(ToolArguments.of(Map.of(
            "name", "  Roadmap ",
            "settings", Map.of("theme", "dark"))));

        // When
        Map<String, Object> result = service.createGraph(command);

        // Then
        ArgumentCaptor<Map<String, Object>> params = ArgumentCaptor.forClass(Map.class);
        verify(tx).run(contains("CREATE (g:Graph"), params.capture());
        assertThat(params.getValue())
            .containsEntry("name", "Roadmap")
            .containsEntry("type", "PROJECT")
            .containsEntry("status", "ACTIVE")
            .containsEntry("isShared", false)
            .containsEntry("settings", "{\"theme\":\"dark\"}");
        assertThat((String) params.getValue().get("id")).startsWith("graph_");
        Map<String, Object> graph = (Map<String, Object>) result.get("graph");
        assertThat(graph.get("settings")).isEqualTo(Map.of("theme", "dark"));
    }

    @Test
    @DisplayName("A blank graph name is rejected")
    void blankName() {
        assertThatThrownBy(() -> CreateGraphCommand.from(ToolArguments.of(Map.of("name", "   "))))
            .isInstanceOf(GraphOperationException.class)
            .hasMessage("Graph name is required and cannot be empty");
    }

    @Test
    @DisplayName("A graph with nodes is not deleted without force")
    void deleteWithoutForce() {
        // Given
        when(tx.run(startsWith(FIND_GRAPH), anyMap())).thenReturn(List.of(Map.of("g", Map.of("id", "graph-1"))));
        when(tx.run(contains("RETURN count(n) AS nodeCount"), anyMap())).thenReturn(List.of(Map.of("nodeCount", 3L)));

        // When / Then
        assertThatThrownBy(() -> service.deleteGraph("graph-1", false))
            .isInstanceOf(GraphOperationException.class)
            .hasMessage("Graph contains 3 nodes. Use force=true to delete anyway.")
            .extracting("kind").isEqualTo(ErrorKind.CONFLICT);
        verify(tx, never()).run(contains("DETACH DELETE"), anyMap());
    }

    @Test
    @DisplayName("Forced delete removes items, detaches children and deletes the graph")
    void deleteWithForce() {
        // Given
        when(tx.run(startsWith(FIND_GRAPH), anyMap())).thenReturn(List.of(Map.of("g", Map.of("id", "graph-1"))));
        when(tx.run(contains("RETURN count(n) AS nodeCount"), anyMap())).thenReturn(List.of(Map.of("nodeCount", 3L)));

        // When
        Map<String, Object> result = service.deleteGraph("graph-1", true);

        // Then
        assertThat(result).containsEntry("deletedGraphId", "graph-1").containsEntry("deletedNodes", 3L);
        verify(tx, times(2)).run(contains("DETACH DELETE"), anyMap());
        verify(tx).run(contains("REMOVE c.parentGraphId"), anyMap());
    }

    @Test
    @DisplayName("Deleting an unknown graph is NOT_FOUND")
    void deleteMissing() {
        assertThatThrownBy(() -> service.deleteGraph("graph-404", true))
            .isInstanceOf(GraphOperationException.class)
            .hasMessage("Graph not found: graph-404");
    }

    @Test
    @DisplayName("Archive without a reason uses the default reason")
    @SuppressWarnings("unchecked")
    void archiveDefaultReason() {
        when(tx.run(startsWith(FIND_GRAPH), anyMap())).thenReturn(List.of(Map.of("g", Map.of("id", "graph-1"))));
        when(tx.run(contains("g.archiveReason = $reason"), anyMap()))
            .thenReturn(List.of(Map.of("g", Map.of("id", "graph-1", "status", "ARCHIVED"))));

        service.archiveGraph("graph-1", null);

        ArgumentCaptor<Map<String, Object>> params = ArgumentCaptor.forClass(Map.class);
        verify(tx).run(contains("g.archiveReason = $reason"), params.capture());
        assertThat(params.getValue())
            .containsEntry("reason", GraphServiceImpl.DEFAULT_ARCHIVE_REASON)
            .containsEntry("status", "ARCHIVED");
    }

    @Test
    @DisplayName("An update with no fields is rejected")
    void emptyUpdate() {
        assertThatThrownBy(() -> service.updateGraph("graph-1", GraphUpdate.builder().build()))
            .isInstanceOf(GraphOperationException.class)
            .hasMessage("No fields provided to update");
        verify(graphStore, never()).writeTransaction(any());
    }

    @Test
    @DisplayName("An update making a graph its own parent is rejected")
    void selfParentUpdate() {
        when(tx.run(startsWith(FIND_GRAPH), anyMap())).thenReturn(List.of(Map.of("g", Map.of("id", "graph-1"))));

        assertThatThrownBy(() -> service.updateGraph("graph-1", GraphUpdate.builder().parentGraphId("graph-1").build()))
            .isInstanceOf(GraphOperationException.class)
            .extracting("kind").isEqualTo(ErrorKind.VALIDATION);
    }

    @Test
    @DisplayName("listGraphs paginates over the filtered count")
    @SuppressWarnings("unchecked")
    void listPagination() {
        // Given
        when(tx.run(contains("RETURN count(g) AS total"), anyMap())).thenReturn(List.of(Map.of("total", 5L)));
        when(tx.run(contains("SKIP $offset"), anyMap())).thenReturn(List.of(
            Map.of("g", Map.of("id", "graph-3")),
            Map.of("g", Map.of("id", "graph-4"))));

        // When
        Map<String, Object> result = service.listGraphs(GraphListQuery.builder().limit(2).offset(2).build());

        // Then
        assertThat(result).containsEntry("count", 2);
        assertThat((Map<String, Object>) result.get("pagination"))
            .containsEntry("current_page", 2L)
            .containsEntry("total_pages", 3L)
            .containsEntry("has_next_page", true)
            .containsEntry("has_previous_page", true);
    }

    @Test
    @DisplayName("listGraphs rejects a non-positive limit")
    void listRejectsZeroLimit() {
        assertThatThrownBy(() -> service.listGraphs(GraphListQuery.builder().limit(0).build()))
            .isInstanceOf(GraphOperationException.class)
            .hasMessage("limit must be greater than zero");
    }
}
