package com.purchasingpower.workgraph.mutation;

import com.purchasingpower.workgraph.configuration.WorkGraphProperties;
import com.purchasingpower.workgraph.core.ErrorKind;
import com.purchasingpower.workgraph.exception.GraphOperationException;
import com.purchasingpower.workgraph.storage.CypherRunner;
import com.purchasingpower.workgraph.storage.GraphStore;
import com.purchasingpower.workgraph.storage.GraphTransaction;
import com.purchasingpower.workgraph.util.IdGenerator;
import com.purchasingpower.workgraph.util.InputSanitizer;
import com.purchasingpower.workgraph.util.ToolArguments;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class BulkOperationServiceImpl implements BulkOperationService {

    static final String ROLLED_BACK_MESSAGE = "Bulk operations failed - transaction rolled back";

    private final GraphStore graphStore;
    private final WorkItemWriter writer;
    private final WorkGraphProperties properties;

    @Override
    public Map<String, Object> execute(List<BulkOperation> operations, boolean transactional, boolean rollbackOnError) {
        if (operations == null || operations.isEmpty()) {
            throw GraphOperationException.validation("No operations provided");
        }
        InputSanitizer.validateBulkOperation(operations.size(), properties.getMaxBulkOperations());
        rejectIdCollisions(operations);

        log.info("Executing {} bulk operations (transaction={}, rollback_on_error={})",
            operations.size(), transactional, rollbackOnError);

        return transactional
            ? executeInTransaction(operations, rollbackOnError)
            : executeIndividually(operations);
    }

    // Compared in stored form, so IDs differing only in stripped characters collide.
    private void rejectIdCollisions(List<BulkOperation> operations) {
        List<String> ids = new ArrayList<>();
        for (BulkOperation operation : operations) {
            if (operation.getType() == BulkOperationType.CREATE_NODE && operation.arguments().has("id")) {
                ids.add(InputSanitizer.sanitizeNodeId(operation.arguments().getString("id")));
            }
        }
        List<String> collisions = IdGenerator.detectIdCollisions(ids);
        if (!collisions.isEmpty()) {
            throw GraphOperationException.conflict("ID collisions detected in bulk operation: " + collisions);
        }
    }

    private Map<String, Object> executeInTransaction(List<BulkOperation> operations, boolean rollbackOnError) {
        List<Map<String, Object>> results = new ArrayList<>();
        int succeeded = 0;
        int failed = 0;

        try (GraphTransaction tx = graphStore.beginTransaction()) {
            for (int i = 0; i < operations.size(); i++) {
                BulkOperation operation = operations.get(i);
                try {
                    results.add(successEntry(i, operation, apply(tx, operation)));
                    succeeded++;
                } catch (RuntimeException e) {
                    GraphOperationException failure = asGraphFailure(e);
                    results.add(failureEntry(i, operation, failure));
                    failed++;

                    boolean transactionBroken = failure.getKind() == ErrorKind.STORAGE
                        || failure.getKind() == ErrorKind.INTERNAL;
                    if (rollbackOnError || transactionBroken) {
                        tx.rollback();
                        log.warn("Bulk operation {} ({}) failed, rolled back {} operations: {}",
                            i, operation.getType().getValue(), operations.size(), failure.getMessage());
                        return rolledBackReport(operations.size(), results, succeeded, failed,
                            "Operation " + operation.getType().getValue() + " failed: " + failure.getMessage());
                    }
                }
            }

            try {
                tx.commit();
            } catch (GraphOperationException e) {
                log.error("Bulk transaction commit failed", e);
                return rolledBackReport(operations.size(), results, succeeded, failed, e.getMessage());
            }
        }

        if (failed > 0) {
            log.warn("Bulk transaction committed with {} failed operations", failed);
        }
        return completedReport(operations.size(), results, succeeded, failed, true);
    }

    private Map<String, Object> executeIndividually(List<BulkOperation> operations) {
        List<Map<String, Object>> results = new ArrayList<>();
        int succeeded = 0;
        int failed = 0;

        for (int i = 0; i < operations.size(); i++) {
            BulkOperation operation = operations.get(i);
            try {
                Map<String, Object> result = graphStore.writeTransaction(tx -> apply(tx, operation));
                results.add(successEntry(i, operation, result));
                succeeded++;
            } catch (RuntimeException e) {
                GraphOperationException failure = asGraphFailure(e);
                results.add(failureEntry(i, operation, failure));
                failed++;
            }
        }
        return completedReport(operations.size(), results, succeeded, failed, false);
    }

    private Map<String, Object> apply(CypherRunner tx, BulkOperation operation) {
        ToolArguments args = operation.arguments();
        return switch (operation.getType()) {
            case CREATE_NODE -> writer.createNode(tx, CreateNodeCommand.from(args));
            case UPDATE_NODE -> writer.updateNode(tx, args.requireString("node_id"), NodeUpdate.from(args));
            case CREATE_EDGE -> writer.createEdge(tx, EdgeCommand.from(args));
            case DELETE_EDGE -> writer.deleteEdge(tx, EdgeCommand.from(args));
        };
    }

    private GraphOperationException asGraphFailure(RuntimeException e) {
        if (e instanceof GraphOperationException graphFailure) {
            return graphFailure;
        }
        log.error("Unexpected bulk operation failure", e);
        return new GraphOperationException(ErrorKind.INTERNAL, e.getMessage(), e);
    }

    private Map<String, Object> successEntry(int index, BulkOperation operation, Object result) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("index", index);
        entry.put("operation_type", operation.getType().getValue());
        entry.put("success", true);
        entry.put("result", result);
        return entry;
    }

    private Map<String, Object> failureEntry(int index, BulkOperation operation, GraphOperationException failure) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("index", index);
        entry.put("operation_type", operation.getType().getValue());
        entry.put("success", false);
        entry.put("error", failure.getMessage());
        entry.put("error_kind", failure.getKind().name());
        return entry;
    }

    private Map<String, Object> rolledBackReport(int total, List<Map<String, Object>> results,
                                                 int succeeded, int failed, String error) {
        Map<String, Object> report = new LinkedHashMap<>();
        report.put("message", ROLLED_BACK_MESSAGE);
        report.put("error", error);
        report.put("total_operations", total);
        report.put("completed_operations", succeeded);
        report.put("successful_operations", 0);
        report.put("failed_operations", failed);
        report.put("transaction_used", true);
        report.put("rolled_back", true);
        report.put("committed_with_failures", false);
        report.put("results", results);
        return report;
    }

    private Map<String, Object> completedReport(int total, List<Map<String, Object>> results,
                                                int succeeded, int failed, boolean transactional) {
        Map<String, Object> report = new LinkedHashMap<>();
        report.put("message", "Bulk operations completed");
        report.put("total_operations", total);
        report.put("successful_operations", succeeded);
        report.put("failed_operations", failed);
        report.put("transaction_used", transactional);
        report.put("rolled_back", false);
        report.put("committed_with_failures", transactional && failed > 0);
        report.put("results", results);
        return report;
    }
}
