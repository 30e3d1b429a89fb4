package com.purchasingpower.workgraph.priority;

import com.purchasingpower.workgraph.configuration.WorkGraphProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Weighted composite priority and the layout radius derived from it.
 *
 * <pre>
 * computed = executiveWeight * executive + individualWeight * individual + communityWeight * community
 * radius   = 1 - computed
 * </pre>
 * With the default weights 0.4/0.3/0.3 and inputs in [0,1], both results stay in [0,1].
 */
@Component
@RequiredArgsConstructor
public class PriorityCalculator {

    private final WorkGraphProperties properties;

    public double computeComposite(double executive, double individual, double community) {
        return properties.getExecutiveWeight() * executive
            + properties.getIndividualWeight() * individual
            + properties.getCommunityWeight() * community;
    }

    public double radiusFor(double computed) {
        return 1.0 - computed;
    }

    public PriorityScore score(double executive, double individual, double community) {
        double computed = computeComposite(executive, individual, community);
        return new PriorityScore(executive, individual, community, computed, radiusFor(computed));
    }
}
