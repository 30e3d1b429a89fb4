package com.purchasingpower.workgraph.analytics;

import java.util.Locale;

/**
 * Per work-type expertise of a contributor.
 *
 * <p>Below the item threshold a contributor is a beginner regardless of outcomes.
 * At or above it, a completion rate over 0.8 makes an expert.
 */
public enum ExpertiseLevel {
    EXPERT,
    PROFICIENT,
    BEGINNER;

    public static ExpertiseLevel of(long itemCount, double completionRate, int minItemsThreshold) {
        if (itemCount < minItemsThreshold) {
            return BEGINNER;
        }
        return completionRate > 0.8 ? EXPERT : PROFICIENT;
    }

    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
