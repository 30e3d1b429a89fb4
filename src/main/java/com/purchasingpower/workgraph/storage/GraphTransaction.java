package com.purchasingpower.workgraph.storage;

/**
 * Explicit transaction over the graph store.
 *
 * <p>Nothing run through it is visible to other sessions until {@link #commit()}.
 * Closing without committing rolls back.
 *
 * @since 1.0.0
 */
public interface GraphTransaction extends CypherRunner, AutoCloseable {

    void commit();

    void rollback();

    /**
     * Whether the transaction can still run statements.
     */
    boolean isOpen();

    @Override
    void close();
}
