package com.purchasingpower.workgraph.analytics;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Bottleneck severity")
class BottleneckSeverityTest {

    @ParameterizedTest(name = "{0} dependents, {1}, priority {2} -> {3} points")
    @CsvSource({
        "11, BLOCKED, 0.9, 8",
        "6, PROPOSED, 0.6, 5",
        "3, IN_PROGRESS, 0.1, 2",
        "2, COMPLETED, 0.5, 0",
        "10, PLANNED, 0.81, 4"
    })
    @DisplayName("Points add up the three signals")
    void points(long dependents, String status, double priority, int expected) {
        assertThat(BottleneckSeverity.points(dependents, status, priority)).isEqualTo(expected);
    }

    @Test
    @DisplayName("Point thresholds map to levels")
    void levels() {
        assertThat(BottleneckSeverity.fromPoints(2)).isEqualTo(BottleneckSeverity.LOW);
        assertThat(BottleneckSeverity.fromPoints(3)).isEqualTo(BottleneckSeverity.MEDIUM);
        assertThat(BottleneckSeverity.fromPoints(4)).isEqualTo(BottleneckSeverity.MEDIUM);
        assertThat(BottleneckSeverity.fromPoints(5)).isEqualTo(BottleneckSeverity.HIGH);
        assertThat(BottleneckSeverity.fromPoints(6)).isEqualTo(BottleneckSeverity.HIGH);
        assertThat(BottleneckSeverity.fromPoints(7)).isEqualTo(BottleneckSeverity.CRITICAL);
    }

    @Test
    @DisplayName("A blocked item with many high-priority dependents is critical")
    void criticalExample() {
        BottleneckSeverity severity = BottleneckSeverity.assess(12, "BLOCKED", 0.95);

        assertThat(severity).isEqualTo(BottleneckSeverity.CRITICAL);
        assertThat(severity.isUrgent()).isTrue();
        assertThat(severity.getValue()).isEqualTo("critical");
    }
}
