package com.purchasingpower.workgraph.agent.tools;

import com.purchasingpower.workgraph.agent.Tool;
import com.purchasingpower.workgraph.agent.ToolContext;
import com.purchasingpower.workgraph.agent.ToolResult;
import com.purchasingpower.workgraph.exception.GraphOperationException;
import com.purchasingpower.workgraph.util.ToolArguments;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;

/**
 * Base for tools backed by one service call returning a JSON-shaped map.
 *
 * <p>Engine errors become failure results carrying their error kind.
 * The payload's {@code message} entry, when present, is the result message.
 *
 * @since 1.0.0
 */
@Slf4j
public abstract class AbstractGraphTool implements Tool {

    @Override
    public ToolResult execute(Map<String, Object> parameters, ToolContext context) {
        try {
            Map<String, Object> data = run(ToolArguments.of(parameters));
            Object message = data.get("message");
            return ToolResult.success(data, message != null ? message.toString() : getName() + " completed");
        } catch (GraphOperationException e) {
            log.warn("⚠️  {} failed [{}] ({}): {}", getName(), context.getRequestId(), e.getKind(), e.getMessage());
            return ToolResult.from(e);
        }
    }

    protected abstract Map<String, Object> run(ToolArguments args);
}
