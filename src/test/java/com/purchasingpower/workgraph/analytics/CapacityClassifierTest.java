package com.purchasingpower.workgraph.analytics;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Capacity classification")
class CapacityClassifierTest {

    private final CapacityClassifier classifier = new CapacityClassifier();

    @Test
    @DisplayName("Load and blocked ratios decide the class")
    void classify() {
        assertThat(classifier.classify(1.6, 0.0)).isEqualTo(CapacityStatus.OVERLOADED);
        assertThat(classifier.classify(1.0, 0.31)).isEqualTo(CapacityStatus.OVERLOADED);
        assertThat(classifier.classify(0.4, 0.0)).isEqualTo(CapacityStatus.UNDERUTILIZED);
        assertThat(classifier.classify(1.5, 0.3)).isEqualTo(CapacityStatus.BALANCED);
        assertThat(classifier.classify(0.5, 0.0)).isEqualTo(CapacityStatus.BALANCED);
    }

    @Test
    @DisplayName("Overloaded and underutilized together produce a redistribution recommendation")
    @SuppressWarnings("unchecked")
    void redistribution() {
        // Given: average load is 6
        List<ContributorWorkload> workloads = List.of(
            workload("alice", 12, 3),
            workload("bob", 5, 0),
            workload("carol", 1, 0));

        // When
        Map<String, Object> analysis = classifier.analyze(workloads);

        // Then
        assertThat((List<Object>) analysis.get("bottlenecks")).containsExactly("alice");
        assertThat((List<Object>) analysis.get("recommendations"))
            .containsExactly(CapacityClassifier.REDISTRIBUTE, CapacityClassifier.UNBLOCK);
        assertThat(analysis.get("available_capacity")).isEqualTo(1.0 / 3);
        assertThat(analysis.get("utilization_rate")).isEqualTo(1.0 / 3);
    }

    @Test
    @DisplayName("An even cohort is balanced without recommendations")
    @SuppressWarnings("unchecked")
    void evenCohort() {
        Map<String, Object> analysis = classifier.analyze(List.of(workload("a", 4, 0), workload("b", 4, 0)));

        assertThat((List<Object>) analysis.get("recommendations")).isEmpty();
        assertThat(analysis.get("utilization_rate")).isEqualTo(1.0);
    }

    @Test
    @DisplayName("An empty cohort yields zero ratios")
    void emptyCohort() {
        Map<String, Object> analysis = classifier.analyze(List.of());

        assertThat(analysis.get("total_contributors")).isEqualTo(0);
        assertThat(analysis.get("available_capacity")).isEqualTo(0.0);
    }

    static ContributorWorkload workload(String id, long total, long blocked) {
        return ContributorWorkload.builder()
            .contributorId(id)
            .name(id)
            .totalItems(total)
            .blockedItems(blocked)
            .build();
    }
}
