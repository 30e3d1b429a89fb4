package com.purchasingpower.workgraph.mutation;

import com.purchasingpower.workgraph.exception.GraphOperationException;
import com.purchasingpower.workgraph.util.ToolArguments;
import lombok.Builder;
import lombok.Getter;

import java.util.Map;

/**
 * One step of a bulk request: an operation type and its arguments.
 */
@Getter
@Builder
public class BulkOperation {

    private final BulkOperationType type;
    private final Map<String, Object> params;

    public ToolArguments arguments() {
        return ToolArguments.of(params);
    }

    public static BulkOperation from(Map<String, Object> raw) {
        ToolArguments args = ToolArguments.of(raw);
        if (!args.has("type")) {
            throw GraphOperationException.validation("Each bulk operation needs a type");
        }
        Map<String, Object> params = args.getMap("params");
        if (params == null) {
            throw GraphOperationException.validation("Each bulk operation needs params");
        }
        return BulkOperation.builder()
            .type(BulkOperationType.fromValue(args.getString("type")))
            .params(params)
            .build();
    }
}
