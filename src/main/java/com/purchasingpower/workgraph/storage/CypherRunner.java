package com.purchasingpower.workgraph.storage;

import java.util.List;
import java.util.Map;

/**
 * Something that can run a parameterized Cypher statement: an auto-commit
 * session, a managed transaction function or an explicit transaction.
 *
 * <p>Mutation code is written against this interface so the same statement
 * sequence can run standalone or as one step of a bulk transaction.
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface CypherRunner {

    /**
     * Run a statement and materialize every row.
     *
     * <p>Nodes come back as their property maps, relationships as
     * {@code {type, properties}}, paths as {@code {nodes, relationships, length}}
     * and temporal values as ISO-8601 strings.
     *
     * @param cypher Cypher text; values must be passed as parameters, never concatenated
     * @param parameters Statement parameters (Long/Integer bind as Cypher integers, Double as floats)
     * @return Rows keyed by the RETURN aliases, in result order
     */
    List<Map<String, Object>> run(String cypher, Map<String, Object> parameters);
}
