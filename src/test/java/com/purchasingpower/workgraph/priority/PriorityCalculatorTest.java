package com.purchasingpower.workgraph.priority;

import com.purchasingpower.workgraph.configuration.WorkGraphProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DisplayName("Priority calculator")
class PriorityCalculatorTest {

    private final PriorityCalculator calculator = new PriorityCalculator(new WorkGraphProperties());

    @Test
    @DisplayName("Composite uses the 0.4/0.3/0.3 weights")
    void composite() {
        PriorityScore score = calculator.score(1.0, 0.5, 0.0);

        assertThat(score.computed()).isCloseTo(0.55, within(1e-9));
        assertThat(score.radius()).isCloseTo(0.45, within(1e-9));
    }

    @Test
    @DisplayName("Zero inputs give zero priority and unit radius")
    void zeroInputs() {
        PriorityScore score = calculator.score(0.0, 0.0, 0.0);

        assertThat(score.computed()).isZero();
        assertThat(score.radius()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Maximum inputs give composite 1 and radius 0")
    void maximumInputs() {
        assertThat(calculator.computeComposite(1.0, 1.0, 1.0)).isCloseTo(1.0, within(1e-9));
        assertThat(calculator.radiusFor(1.0)).isZero();
    }

    @Test
    @DisplayName("Weights come from configuration")
    void configurableWeights() {
        WorkGraphProperties properties = new WorkGraphProperties();
        properties.setExecutiveWeight(1.0);
        properties.setIndividualWeight(0.0);
        properties.setCommunityWeight(0.0);

        assertThat(new PriorityCalculator(properties).computeComposite(0.3, 0.9, 0.9)).isCloseTo(0.3, within(1e-9));
    }
}
