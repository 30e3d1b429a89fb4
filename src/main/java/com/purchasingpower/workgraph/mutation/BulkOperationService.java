package com.purchasingpower.workgraph.mutation;

import java.util.List;
import java.util.Map;

/**
 * Runs a batch of heterogeneous mutations, atomically or one by one.
 *
 * @since 1.0.0
 */
public interface BulkOperationService {

    /**
     * Execute {@code operations} in order.
     *
     * <p>With {@code transactional}, every step shares one transaction. The first
     * failure rolls everything back when {@code rollbackOnError} is set. Without it,
     * validation and not-found failures are recorded and the rest is committed,
     * while a storage failure still aborts the transaction.
     *
     * <p>Without {@code transactional}, each step commits on its own.
     *
     * @return Report with totals and a per-operation result or error
     */
    Map<String, Object> execute(List<BulkOperation> operations, boolean transactional, boolean rollbackOnError);
}
