package com.purchasingpower.workgraph.analytics;

import com.purchasingpower.workgraph.util.InputSanitizer;

import java.util.Locale;

/**
 * Strength of a contributor pair, by the number of work items they share.
 */
public enum CollaborationStrength {
    STRONG,
    MODERATE,
    WEAK;

    public static CollaborationStrength fromSharedItems(long sharedItems) {
        if (sharedItems >= 10) {
            return STRONG;
        }
        return sharedItems >= 5 ? MODERATE : WEAK;
    }

    /**
     * Parse a filter value. Absent or {@code all} means no filter and yields null.
     */
    public static CollaborationStrength filterOf(String value) {
        if (value == null || value.isBlank() || "all".equalsIgnoreCase(value.trim())) {
            return null;
        }
        return InputSanitizer.sanitizeEnum(value, CollaborationStrength.class, null, "collaboration_strength");
    }

    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
