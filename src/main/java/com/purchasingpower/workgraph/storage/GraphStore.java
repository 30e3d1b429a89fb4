package com.purchasingpower.workgraph.storage;

import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Access to the property graph holding work items, contributors and graph containers.
 *
 * <p>Driver failures surface as {@code GraphOperationException} with kind {@code STORAGE}.
 *
 * @since 1.0.0
 */
public interface GraphStore {

    // ================================================================
    // READ OPERATIONS
    // ================================================================

    /**
     * Run a read-only statement in its own transaction.
     */
    List<Map<String, Object>> read(String cypher, Map<String, Object> parameters);

    /**
     * Run several read statements against one consistent snapshot.
     */
    <T> T readTransaction(Function<CypherRunner, T> work);

    // ================================================================
    // WRITE OPERATIONS
    // ================================================================

    /**
     * Run a single write statement in its own transaction.
     */
    List<Map<String, Object>> write(String cypher, Map<String, Object> parameters);

    /**
     * Run {@code work} in one managed write transaction.
     *
     * <p>Committed when {@code work} returns, rolled back when it throws.
     * The driver may retry {@code work} on transient failures, so it must not
     * have side effects outside the graph.
     */
    <T> T writeTransaction(Function<CypherRunner, T> work);

    /**
     * Open an explicit transaction. Caller must commit or roll back and close it.
     */
    GraphTransaction beginTransaction();

    // ================================================================
    // CONNECTION
    // ================================================================

    /**
     * Check that the database is reachable.
     */
    boolean verifyConnectivity();

    String getUri();
}
