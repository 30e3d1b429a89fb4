package com.purchasingpower.workgraph.agent.tools;

import com.purchasingpower.workgraph.mutation.BulkOperation;
import com.purchasingpower.workgraph.mutation.BulkOperationService;
import com.purchasingpower.workgraph.util.ToolArguments;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Tool for running many node and edge mutations in one request.
 *
 * With {@code transaction=true} all operations share one Neo4j transaction:
 * - rollback_on_error=true: the first failure rolls everything back
 * - rollback_on_error=false: failed steps are reported and the rest commit
 *
 * @since 1.0.0
 */
@Component
@RequiredArgsConstructor
public class BulkOperationsTool extends AbstractGraphTool {

    private final BulkOperationService bulkOperationService;

    @Override
    public String getName() {
        return "bulk_operations";
    }

    @Override
    public String getDescription() {
        return "Run create_node, update_node, create_edge and delete_edge operations in one batch, optionally in one transaction.";
    }

    @Override
    public String getParameterSchema() {
        return "{\"operations\": \"array (required) of {type, params}\", \"transaction\": \"boolean (optional, default true)\", \"rollback_on_error\": \"boolean (optional, default true)\"}";
    }

    @Override
    public ToolCategory getCategory() {
        return ToolCategory.MUTATION;
    }

    @Override
    protected Map<String, Object> run(ToolArguments args) {
        List<Map<String, Object>> raw = args.getObjectList("operations");
        List<BulkOperation> operations = raw != null
            ? raw.stream().map(BulkOperation::from).toList()
            : List.of();
        return bulkOperationService.execute(
            operations,
            args.getBoolean("transaction", true),
            args.getBoolean("rollback_on_error", true));
    }
}
