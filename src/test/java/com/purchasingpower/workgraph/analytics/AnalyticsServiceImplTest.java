package com.purchasingpower.workgraph.analytics;

import com.purchasingpower.workgraph.storage.CypherRunner;
import com.purchasingpower.workgraph.storage.GraphStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("Analytics service")
class AnalyticsServiceImplTest {

    @Mock
    private GraphStore graphStore;

    @Mock
    private CypherRunner tx;

    private AnalyticsServiceImpl service;

    @BeforeEach
    void setUp() {
        service = new AnalyticsServiceImpl(graphStore, new HealthScoreCalculator(), new CapacityClassifier(),
            new WorkloadReader());
        lenient().when(graphStore.readTransaction(any())).thenAnswer(invocation -> {
            Function<CypherRunner, Object> work = invocation.getArgument(0);
            return work.apply(tx);
        });
    }

    @Test
    @DisplayName("Bottlenecks are scored and urgent ones get resolutions")
    @SuppressWarnings("unchecked")
    void bottlenecksWithResolutions() {
        // Given
        when(tx.run(contains("size(dependents) AS dependentCount"), anyMap())).thenReturn(List.of(
            Map.of("id", "n1", "title", "Auth service", "type", "FEATURE", "status", "PROPOSED",
                "priority", 0.9, "dependentCount", 8L, "dependents", List.of()),
            Map.of("id", "n2", "title", "Docs", "type", "TASK", "status", "COMPLETED",
                "priority", 0.1, "dependentCount", 6L, "dependents", List.of())));
        when(tx.run(contains("status: 'BLOCKED'"), anyMap())).thenReturn(List.of(
            Map.of("blockedId", "b1", "blockedTitle", "Checkout", "blocking",
                List.of(Map.of("id", "x"), Map.of("id", "y")))));

        // When
        Map<String, Object> result = service.getBottlenecks(BottleneckQuery.builder().build());

        // Then
        Map<String, Object> bottlenecks = (Map<String, Object>) result.get("bottlenecks");
        List<Map<String, Object>> high = (List<Map<String, Object>>) bottlenecks.get("high_dependency_bottlenecks");
        assertThat(high).extracting(b -> b.get("severity")).containsExactly("high", "low");

        List<Map<String, Object>> resolutions = (List<Map<String, Object>>) result.get("suggested_resolutions");
        assertThat(resolutions).extracting(r -> r.get("type")).containsExactly("priority_boost", "break_dependency_chain");
        assertThat(resolutions.get(0).get("description"))
            .isEqualTo("Increase priority of \"Auth service\" to unblock 8 dependent items");
        assertThat(resolutions.get(1).get("description"))
            .isEqualTo("Consider breaking dependency chain for \"Checkout\" - has 2 blocking items");

        Map<String, Object> summary = (Map<String, Object>) result.get("summary");
        assertThat(summary).containsEntry("total_bottlenecks", 3);
    }

    @Test
    @DisplayName("Health analysis returns only the requested sections but scores on all signals")
    @SuppressWarnings("unchecked")
    void healthSections() {
        // Given
        when(tx.run(contains("RETURN n.type AS type, n.status AS status"), anyMap())).thenReturn(List.of(
            Map.of("type", "TASK", "status", "PROPOSED", "count", 10L)));
        when(tx.run(contains("stDev(p) AS stdev"), anyMap())).thenReturn(List.of(
            Map.of("total", 10L, "average", 0.5, "stdev", 0.4, "minimum", 0.0, "maximum", 1.0, "high", 2L, "low", 2L)));
        when(tx.run(contains("totalDependencies"), anyMap())).thenReturn(List.of(
            Map.of("total", 10L, "totalDependencies", 5L, "average", 0.5, "maximum", 2L, "heavy", 0L)));
        when(tx.run(contains("WHERE dependentCount > $minDependents"), anyMap())).thenReturn(List.of());

        HealthQuery query = HealthQuery.builder()
            .metrics(java.util.Set.of(HealthQuery.PRIORITY_BALANCE))
            .build();

        // When
        Map<String, Object> result = service.analyzeGraphHealth(query);

        // Then
        assertThat(result.get("health_score")).isEqualTo(0.9);
        assertThat((Map<String, Object>) result.get("metrics")).containsOnlyKeys(HealthQuery.PRIORITY_BALANCE);
        assertThat(result.get("total_nodes")).isEqualTo(10L);
    }

    @Test
    @DisplayName("Workload summary buckets contributors around the average")
    @SuppressWarnings("unchecked")
    void workloadSummary() {
        List<ContributorWorkload> workloads = List.of(
            CapacityClassifierTest.workload("a", 10, 0),
            CapacityClassifierTest.workload("b", 4, 0),
            CapacityClassifierTest.workload("c", 1, 0));

        Map<String, Object> summary = AnalyticsServiceImpl.summarize(workloads);

        assertThat(summary).containsEntry("total_items", 15L).containsEntry("most_loaded_contributor", "a");
        assertThat((Map<String, Object>) summary.get("workload_distribution"))
            .containsEntry("heavily_loaded", 1L)
            .containsEntry("moderately_loaded", 1L)
            .containsEntry("lightly_loaded", 1L);
    }

    @Test
    @DisplayName("Predictions flag blocked ratios above 20% and more than 5 items in progress")
    @SuppressWarnings("unchecked")
    void predictions() {
        ContributorWorkload busy = ContributorWorkload.builder()
            .contributorId("dev").totalItems(10).blockedItems(3).inProgressItems(6).build();

        Map<String, Object> predictions = AnalyticsServiceImpl.predictions(List.of(busy));

        assertThat((List<Object>) predictions.get("bottleneck_predictions")).hasSize(1);
        assertThat((List<Object>) predictions.get("capacity_recommendations")).hasSize(1);
        assertThat((List<Object>) predictions.get("recommended_actions")).hasSize(2);
    }
}
