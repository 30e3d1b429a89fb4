package com.purchasingpower.workgraph.analytics;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.workgraph.core.ErrorKind;
import com.purchasingpower.workgraph.exception.GraphOperationException;
import com.purchasingpower.workgraph.storage.CypherRunner;
import com.purchasingpower.workgraph.storage.GraphStore;
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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("Contributor analytics")
class ContributorAnalyticsServiceImplTest {

    @Mock
    private GraphStore graphStore;

    @Mock
    private CypherRunner tx;

    private ContributorAnalyticsServiceImpl service;

    @BeforeEach
    void setUp() {
        service = new ContributorAnalyticsServiceImpl(graphStore, new MetadataCodec(new ObjectMapper()), new WorkloadReader());
        when(graphStore.readTransaction(any())).thenAnswer(invocation -> {
            Function<CypherRunner, Object> work = invocation.getArgument(0);
            return work.apply(tx);
        });
    }

    @Test
    @DisplayName("An unknown contributor is NOT_FOUND")
    void unknownContributor() {
        assertThatThrownBy(() -> service.getContributorWorkload("ghost"))
            .isInstanceOf(GraphOperationException.class)
            .hasMessage("Contributor not found: ghost")
            .extracting("kind").isEqualTo(ErrorKind.NOT_FOUND);
    }

    @Test
    @DisplayName("priority_type=all ranks by the sum of the three inputs and averages the scores")
    @SuppressWarnings("unchecked")
    void sumOfInputsRanking() {
        // Given
        when(tx.run(contains("MATCH (c:Contributor {id: $contributorId})"), anyMap()))
            .thenReturn(List.of(Map.of("id", "alice", "name", "Alice", "type", "HUMAN")));
        when(tx.run(contains("AS score"), anyMap())).thenReturn(List.of(
            Map.of("node", Map.of("id", "n1"), "score", 2.4, "dependencyCount", 1L, "topDependencies", List.of("Auth")),
            Map.of("node", Map.of("id", "n2"), "score", 1.6, "dependencyCount", 0L, "topDependencies", List.of())));
        ContributorPriorityQuery query = ContributorPriorityQuery.from(
            ToolArguments.of(Map.of("contributor_id", "alice", "priority_type", "all")));

        // When
        Map<String, Object> result = service.getContributorPriorities(query);

        // Then
        ArgumentCaptor<String> cypher = ArgumentCaptor.forClass(String.class);
        verify(tx).run(cypher.capture(), argThat(p -> p.containsKey("limit")));
        assertThat(cypher.getValue()).contains("coalesce(n.priorityExecutive, 0.0) + coalesce(n.priorityIndividual, 0.0)");
        assertThat(result)
            .containsEntry("priority_type", "all")
            .containsEntry("count", 2);
        assertThat((double) result.get("average_score")).isCloseTo(2.0, within(1e-9));
        assertThat((List<Map<String, Object>>) result.get("items")).extracting(i -> i.get("score"))
            .containsExactly(2.4, 1.6);
    }

    @Test
    @DisplayName("find_contributors_by_project passes graph, type and active filters and shapes one row per contributor and graph")
    @SuppressWarnings("unchecked")
    void contributorsByProject() {
        // Given
        when(tx.run(contains("MATCH (n)-[:BELONGS_TO]->(g:Graph)"), anyMap())).thenReturn(List.of(Map.of(
            "contributorId", "alice", "contributorName", "Alice", "contributorType", "HUMAN",
            "projectId", "g1", "projectName", "Checkout", "itemCount", 4L,
            "statuses", List.of("IN_PROGRESS"), "workTypes", List.of("STORY"), "avgPriority", 0.6)));
        ProjectContributorsQuery query = ProjectContributorsQuery.from(ToolArguments.of(Map.of(
            "project_filter", Map.of("graph_id", "g1", "node_types", List.of("story")),
            "active_only", true)));

        // When
        Map<String, Object> result = service.findContributorsByProject(query);

        // Then
        verify(tx).run(contains("LIMIT $limit"), argThat(p -> List.of("STORY").equals(p.get("nodeTypes"))
            && List.of("PLANNED", "IN_PROGRESS").equals(p.get("statuses"))
            && "g1".equals(p.get("graphId"))
            && p.get("graphName") == null
            && Long.valueOf(50L).equals(p.get("limit"))));
        assertThat(result).containsEntry("total_found", 1);
        Map<String, Object> entry = ((List<Map<String, Object>>) result.get("contributors")).get(0);
        assertThat((Map<String, Object>) entry.get("project")).containsEntry("name", "Checkout");
        assertThat((Map<String, Object>) entry.get("workload")).containsEntry("item_count", 4L);
    }

    @Test
    @DisplayName("get_project_team on an unknown graph is NOT_FOUND")
    void projectTeamUnknownGraph() {
        assertThatThrownBy(() -> service.getProjectTeam("missing"))
            .isInstanceOf(GraphOperationException.class)
            .hasMessage("Graph not found: missing")
            .extracting("kind").isEqualTo(ErrorKind.NOT_FOUND);
    }

    @Test
    @DisplayName("get_project_team sums member items into team totals")
    void projectTeamTotals() {
        // Given
        when(tx.run(contains("RETURN g.id AS id, g.name AS name"), anyMap()))
            .thenReturn(List.of(Map.of("id", "g1", "name", "Checkout")));
        when(tx.run(contains("AS activeItems"), anyMap())).thenReturn(List.of(
            Map.of("contributorId", "alice", "contributorName", "Alice", "itemCount", 5L, "activeItems", 2L),
            Map.of("contributorId", "bob", "contributorName", "Bob", "itemCount", 3L, "activeItems", 1L)));

        // When
        Map<String, Object> result = service.getProjectTeam("g1");

        // Then
        assertThat(result)
            .containsEntry("project_name", "Checkout")
            .containsEntry("team_size", 2)
            .containsEntry("team_summary", Map.of("total_contributors", 2, "total_items", 8L, "active_items", 3L));
    }

    @Test
    @DisplayName("get_contributor_expertise grades each work type against the item threshold")
    @SuppressWarnings("unchecked")
    void expertiseByWorkType() {
        // Given
        when(tx.run(contains("MATCH (c:Contributor {id: $contributorId})"), anyMap()))
            .thenReturn(List.of(Map.of("id", "alice", "name", "Alice")));
        List<Map<String, Object>> items = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            items.add(item("STORY", "COMPLETED", 0.8, "Checkout"));
        }
        items.add(item("BUG", "IN_PROGRESS", 0.4, "Search"));
        items.add(item("TASK", "COMPLETED", 0.5, "Checkout"));
        items.add(item("TASK", "COMPLETED", 0.5, "Checkout"));
        items.add(item("TASK", "PLANNED", 0.5, "Checkout"));
        items.add(item("TASK", "PLANNED", 0.5, "Checkout"));
        when(tx.run(contains("duration({days: $days})"), anyMap())).thenReturn(items);
        ExpertiseQuery query = ExpertiseQuery.from(ToolArguments.of(Map.of("contributor_id", "alice")));

        // When
        Map<String, Object> result = service.getContributorExpertise(query);

        // Then
        verify(tx).run(contains("duration({days: $days})"), argThat(p -> Long.valueOf(90L).equals(p.get("days"))));
        Map<String, Object> overall = (Map<String, Object>) result.get("overall_stats");
        assertThat(overall).containsEntry("total_items", 8).containsEntry("completed_items", 5L);
        assertThat((double) overall.get("completion_rate")).isCloseTo(0.625, within(1e-9));

        Map<String, Map<String, Object>> byType = (Map<String, Map<String, Object>>) result.get("work_type_expertise");
        assertThat(byType.get("STORY")).containsEntry("expertise_level", "expert");
        assertThat(byType.get("TASK")).containsEntry("expertise_level", "proficient");
        assertThat(byType.get("BUG")).containsEntry("expertise_level", "beginner");
        assertThat(result).containsEntry("project_domains", List.of("Checkout", "Search"));
    }

    @Test
    @DisplayName("get_contributor_expertise with no recent items reports zero rates")
    @SuppressWarnings("unchecked")
    void expertiseWithoutRecentItems() {
        when(tx.run(contains("MATCH (c:Contributor {id: $contributorId})"), anyMap()))
            .thenReturn(List.of(Map.of("id", "alice", "name", "Alice")));

        Map<String, Object> result = service.getContributorExpertise(
            ExpertiseQuery.from(ToolArguments.of(Map.of("contributor_id", "alice"))));

        assertThat((Map<String, Object>) result.get("overall_stats"))
            .containsEntry("total_items", 0)
            .containsEntry("completion_rate", 0.0);
        assertThat((Map<String, Object>) result.get("work_type_expertise")).isEmpty();
    }

    @Test
    @DisplayName("get_collaboration_network keeps only pairs of the requested strength")
    @SuppressWarnings("unchecked")
    void collaborationStrengthFilter() {
        // Given
        when(tx.run(contains("WHERE c1.id < c2.id"), anyMap())).thenReturn(List.of(
            pair("alice", "bob", 12L), pair("alice", "carol", 6L), pair("bob", "carol", 2L)));
        CollaborationQuery query = CollaborationQuery.from(ToolArguments.of(Map.of(
            "collaboration_strength", "moderate", "focus_contributor", "alice")));

        // When
        Map<String, Object> result = service.getCollaborationNetwork(query);

        // Then
        verify(tx).run(contains("WHERE c1.id < c2.id"), argThat(p -> "alice".equals(p.get("focusContributor"))
            && Long.valueOf(60L).equals(p.get("days"))));
        List<Map<String, Object>> network = (List<Map<String, Object>>) result.get("collaboration_network");
        assertThat(network).hasSize(1);
        assertThat((Map<String, Object>) network.get(0).get("contributor2")).containsEntry("id", "carol");
        assertThat((Map<String, Object>) network.get(0).get("collaboration")).containsEntry("strength", "moderate");
        Map<String, Object> summary = (Map<String, Object>) result.get("network_summary");
        assertThat(summary).containsEntry("total_collaborations", 1);
        assertThat(summary.get("strongest_collaboration")).isEqualTo(network.get(0));
    }

    @Test
    @DisplayName("get_contributor_availability classifies load and recommends per contributor")
    @SuppressWarnings("unchecked")
    void availability() {
        // Given
        when(tx.run(contains("WHERE n.status IN ['IN_PROGRESS', 'BLOCKED']"), anyMap())).thenReturn(List.of(
            Map.of("contributorId", "alice", "name", "Alice", "activeItems", 16L, "blockedItems", 2L, "avgActivePriority", 0.7),
            Map.of("contributorId", "bob", "name", "Bob", "activeItems", 0L, "blockedItems", 0L)));

        // When
        Map<String, Object> result = service.getContributorAvailability(AvailabilityQuery.from(ToolArguments.of(Map.of())));

        // Then
        List<Map<String, Object>> analysis = (List<Map<String, Object>>) result.get("availability_analysis");
        assertThat((Map<String, Object>) analysis.get(0).get("availability"))
            .containsEntry("capacity_status", "overloaded")
            .containsEntry("overload_risk", "high");
        assertThat((List<String>) analysis.get(0).get("recommendations")).containsExactly(
            "Consider redistributing some work items to other team members",
            "Help unblock 2 blocked items to improve throughput");
        assertThat((List<String>) analysis.get(1).get("recommendations")).containsExactly("Available for new assignments");
        assertThat((Map<String, Object>) result.get("summary"))
            .containsEntry("total_contributors", 2)
            .containsEntry("available_contributors", 1L)
            .containsEntry("overloaded_contributors", 1L)
            .containsEntry("total_active_items", 16L);
    }

    private static Map<String, Object> item(String type, String status, double priority, String project) {
        return Map.of("type", type, "status", status, "priority", priority, "project", project);
    }

    private static Map<String, Object> pair(String first, String second, long sharedItems) {
        return Map.of("contributor1", first, "name1", first, "contributor2", second, "name2", second,
            "sharedItems", sharedItems, "sharedWorkTypes", List.of("TASK"), "avgSharedPriority", 0.5);
    }
}
