package com.purchasingpower.workgraph.analytics;

import com.purchasingpower.workgraph.core.WorkItemStatus;

import java.util.Locale;

/**
 * Severity of a bottleneck, from a point score built on three independent signals.
 *
 * <pre>
 * dependents:  > 10 -> 3,  > 5 -> 2,  > 2 -> 1
 * status:      BLOCKED -> 3,  PROPOSED -> 2,  IN_PROGRESS -> 1
 * priority:    > 0.8 -> 2,  > 0.5 -> 1
 * level:       >= 7 critical,  >= 5 high,  >= 3 medium,  else low
 * </pre>
 */
public enum BottleneckSeverity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isUrgent() {
        return this == HIGH || this == CRITICAL;
    }

    public static BottleneckSeverity assess(long dependentCount, String status, double priority) {
        return fromPoints(points(dependentCount, status, priority));
    }

    static int points(long dependentCount, String status, double priority) {
        int score = 0;

        if (dependentCount > 10) {
            score += 3;
        } else if (dependentCount > 5) {
            score += 2;
        } else if (dependentCount > 2) {
            score += 1;
        }

        if (WorkItemStatus.BLOCKED.name().equals(status)) {
            score += 3;
        } else if (WorkItemStatus.PROPOSED.name().equals(status)) {
            score += 2;
        } else if (WorkItemStatus.IN_PROGRESS.name().equals(status)) {
            score += 1;
        }

        if (priority > 0.8) {
            score += 2;
        } else if (priority > 0.5) {
            score += 1;
        }
        return score;
    }

    static BottleneckSeverity fromPoints(int points) {
        if (points >= 7) {
            return CRITICAL;
        }
        if (points >= 5) {
            return HIGH;
        }
        if (points >= 3) {
            return MEDIUM;
        }
        return LOW;
    }
}
