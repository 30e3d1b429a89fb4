package com.purchasingpower.workgraph.query;

import lombok.Builder;
import lombok.Getter;

import java.util.Map;

/**
 * A compiled browse request: the main statement, the count statement sharing
 * its predicate (absent for {@link QueryType#DEPENDENCIES}), and the bound parameters.
 */
@Getter
@Builder
public class BrowseQuery {

    private final QueryType queryType;
    private final String cypher;
    private final String countCypher;
    private final Map<String, Object> parameters;
    private final int limit;
    private final int offset;

    public boolean isPaginated() {
        return countCypher != null;
    }
}
