package com.purchasingpower.workgraph.mutation;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.workgraph.configuration.WorkGraphProperties;
import com.purchasingpower.workgraph.core.ErrorKind;
import com.purchasingpower.workgraph.exception.GraphOperationException;
import com.purchasingpower.workgraph.storage.CypherRunner;
import com.purchasingpower.workgraph.util.IdGenerator;
import com.purchasingpower.workgraph.util.MetadataCodec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("Work item writer")
class WorkItemWriterTest {

    @Mock
    private CypherRunner tx;

    private WorkItemWriter writer;

    @BeforeEach
    void setUp() {
        writer = new WorkItemWriter(new IdGenerator(), new MetadataCodec(new ObjectMapper()), new WorkGraphProperties());
    }

    @Nested
    @DisplayName("createNode")
    class CreateNode {

        @Test
        @DisplayName("Applies defaults for title, type and status")
        @SuppressWarnings("unchecked")
        void defaults() {
            // Given
            when(tx.run(contains("CREATE (n:WorkItem"), anyMap()))
                .thenReturn(List.of(Map.of("n", Map.of("id", "node_1", "title", "Untitled Node", "metadata", "{}"))));

            // When
            Map<String, Object> node = writer.createNode(tx, CreateNodeCommand.builder().build());

            // Then
            ArgumentCaptor<Map<String, Object>> params = ArgumentCaptor.forClass(Map.class);
            verify(tx).run(contains("CREATE (n:WorkItem"), params.capture());
            assertThat(params.getValue())
                .containsEntry("title", WorkItemWriter.UNTITLED)
                .containsEntry("type", "TASK")
                .containsEntry("status", "PROPOSED")
                .containsEntry("metadata", "{}");
            assertThat((String) params.getValue().get("id")).startsWith("node_");
            assertThat(node.get("metadata")).isEqualTo(Map.of());
            assertThat(node.get("contributor_ids")).isEqualTo(List.of());
        }

        @Test
        @DisplayName("Rejects a caller-chosen ID that already exists")
        void duplicateId() {
            // Given
            when(tx.run(contains("RETURN n.id AS id"), anyMap())).thenReturn(List.of(Map.of("id", "node-1")));

            // When / Then
            assertThatThrownBy(() -> writer.createNode(tx, CreateNodeCommand.builder().id("node-1").build()))
                .isInstanceOf(GraphOperationException.class)
                .hasMessage("Node with ID node-1 already exists")
                .extracting("kind").isEqualTo(ErrorKind.CONFLICT);
            verify(tx, never()).run(contains("CREATE (n:WorkItem"), anyMap());
        }

        @Test
        @DisplayName("Rejects an unknown type before writing")
        void unknownType() {
            assertThatThrownBy(() -> writer.createNode(tx, CreateNodeCommand.builder().type("SAGA").build()))
                .isInstanceOf(GraphOperationException.class)
                .extracting("kind").isEqualTo(ErrorKind.VALIDATION);
            verify(tx, never()).run(anyString(), anyMap());
        }

        @Test
        @DisplayName("Fails with NOT_FOUND when the target graph is missing")
        void missingGraph() {
            assertThatThrownBy(() -> writer.createNode(tx, CreateNodeCommand.builder().graphId("graph-9").build()))
                .isInstanceOf(GraphOperationException.class)
                .hasMessage("Graph not found: graph-9");
        }
    }

    @Nested
    @DisplayName("updateNode")
    class UpdateNode {

        @Test
        @DisplayName("Sets only the supplied fields plus updatedAt")
        @SuppressWarnings("unchecked")
        void partialUpdate() {
            // Given
            when(tx.run(contains("RETURN n"), anyMap()))
                .thenReturn(List.of(Map.of("n", Map.of("id", "node-1", "title", "New title"))));

            // When
            Map<String, Object> result = writer.updateNode(tx, "node-1", NodeUpdate.builder().title("New title").build());

            // Then
            ArgumentCaptor<String> cypher = ArgumentCaptor.forClass(String.class);
            ArgumentCaptor<Map<String, Object>> params = ArgumentCaptor.forClass(Map.class);
            verify(tx).run(cypher.capture(), params.capture());
            assertThat(cypher.getValue()).contains("SET n.title = $set_title, n.updatedAt = datetime()");
            assertThat(cypher.getValue()).doesNotContain("description").doesNotContain("status");
            assertThat(params.getValue()).containsEntry("nodeId", "node-1").containsEntry("set_title", "New title");
            assertThat(result.get("updated_fields")).isEqualTo(List.of("title", "updatedAt"));
        }

        @Test
        @DisplayName("Reports NOT_FOUND for a missing node")
        void missingNode() {
            assertThatThrownBy(() -> writer.updateNode(tx, "node-404", NodeUpdate.builder().title("x").build()))
                .isInstanceOf(GraphOperationException.class)
                .hasMessage("Node not found: node-404")
                .extracting("kind").isEqualTo(ErrorKind.NOT_FOUND);
        }

        @Test
        @DisplayName("Rejects a blank title")
        void blankTitle() {
            assertThatThrownBy(() -> writer.updateNode(tx, "node-1", NodeUpdate.builder().title("  ").build()))
                .isInstanceOf(GraphOperationException.class)
                .hasMessage("title cannot be blank");
        }

        @Test
        @DisplayName("Replaces contributor links when a list is given")
        void replacesContributors() {
            // Given
            when(tx.run(contains("RETURN n"), anyMap())).thenReturn(List.of(Map.of("n", Map.of("id", "node-1"))));

            // When
            Map<String, Object> result = writer.updateNode(tx, "node-1",
                NodeUpdate.builder().contributorIds(List.of("alice", "alice", "bob")).build());

            // Then
            verify(tx).run(contains("DELETE r"), eq(Map.of("nodeId", "node-1")));
            verify(tx).run(contains("MERGE (n)-[r:WORKED_ON_BY]->(c)"), anyMap());
            assertThat(result.get("contributor_ids")).isEqualTo(List.of("alice", "bob"));
        }
    }

    @Nested
    @DisplayName("edges")
    class Edges {

        @Test
        @DisplayName("A second create of the same edge reports an update")
        void idempotentCreate() {
            // Given
            when(tx.run(contains("collect(n.id) AS ids"), anyMap()))
                .thenReturn(List.of(Map.of("ids", List.of("a", "b"))));
            when(tx.run(contains("MERGE (s)-[r:DEPENDS_ON]->(t)"), anyMap()))
                .thenReturn(List.of(Map.of("id", "edge_1", "created", false, "createdAt", "2024-01-01T00:00:00Z")));

            // When
            Map<String, Object> result = writer.createEdge(tx,
                EdgeCommand.builder().sourceId("a").targetId("b").type("DEPENDS_ON").build());

            // Then
            assertThat(result).containsEntry("created", false)
                .containsEntry("message", "Edge already existed and was updated");
        }

        @Test
        @DisplayName("Reports a missing target endpoint")
        void missingTarget() {
            when(tx.run(contains("collect(n.id) AS ids"), anyMap()))
                .thenReturn(List.of(Map.of("ids", List.of("a"))));

            assertThatThrownBy(() -> writer.createEdge(tx,
                EdgeCommand.builder().sourceId("a").targetId("b").type("BLOCKS").build()))
                .isInstanceOf(GraphOperationException.class)
                .hasMessage("Target node not found: b");
        }

        @Test
        @DisplayName("Rejects an unknown edge type")
        void unknownType() {
            assertThatThrownBy(() -> writer.createEdge(tx,
                EdgeCommand.builder().sourceId("a").targetId("b").type("LIKES").build()))
                .isInstanceOf(GraphOperationException.class)
                .extracting("kind").isEqualTo(ErrorKind.VALIDATION);
        }

        @Test
        @DisplayName("Deleting an absent edge is NOT_FOUND")
        void deleteMissingEdge() {
            when(tx.run(contains("collect(n.id) AS ids"), anyMap()))
                .thenReturn(List.of(Map.of("ids", List.of("a", "b"))));
            when(tx.run(contains("RETURN count(r) AS edges"), anyMap()))
                .thenReturn(List.of(Map.of("edges", 0L)));

            assertThatThrownBy(() -> writer.deleteEdge(tx,
                EdgeCommand.builder().sourceId("a").targetId("b").type("BLOCKS").build()))
                .isInstanceOf(GraphOperationException.class)
                .hasMessage("Edge not found: a -[BLOCKS]-> b");
            verify(tx, never()).run(contains("DELETE r"), anyMap());
        }
    }
}
