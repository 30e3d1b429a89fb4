package com.purchasingpower.workgraph.analytics;

import java.util.Locale;

/**
 * Availability of a contributor by active (in-progress or blocked) item count.
 */
public enum AvailabilityStatus {
    AVAILABLE("low"),
    BUSY("low"),
    AT_CAPACITY("medium"),
    OVERLOADED("high");

    private final String overloadRisk;

    AvailabilityStatus(String overloadRisk) {
        this.overloadRisk = overloadRisk;
    }

    public static AvailabilityStatus fromActiveItems(long activeItems) {
        if (activeItems >= 15) {
            return OVERLOADED;
        }
        if (activeItems >= 10) {
            return AT_CAPACITY;
        }
        return activeItems >= 5 ? BUSY : AVAILABLE;
    }

    public String getOverloadRisk() {
        return overloadRisk;
    }

    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
