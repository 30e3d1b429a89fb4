package com.purchasingpower.workgraph.core;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Relationship types allowed between two work items.
 *
 * <p>The enum name is used verbatim as the Neo4j relationship type, so only
 * values from this set are ever interpolated into Cypher.
 */
public enum EdgeType {
    DEPENDS_ON,
    BLOCKS,
    RELATES_TO,
    CONTAINS,
    PART_OF;

    /**
     * Cypher alternation of every type, e.g. {@code DEPENDS_ON|BLOCKS|...}.
     */
    public static String cypherAlternation() {
        return Arrays.stream(values())
            .map(Enum::name)
            .collect(Collectors.joining("|"));
    }
}
