package com.purchasingpower.workgraph.agent;

import com.purchasingpower.workgraph.agent.impl.ToolContextImpl;
import com.purchasingpower.workgraph.core.ErrorKind;
import com.purchasingpower.workgraph.exception.GraphOperationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Dispatches tool calls by name and runs the applicable interceptors around them.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
public class ToolExecutor {

    private final Map<String, Tool> tools = new TreeMap<>();
    private final List<ToolInterceptor> interceptors;

    public ToolExecutor(List<Tool> tools, List<ToolInterceptor> interceptors) {
        for (Tool tool : tools) {
            Tool previous = this.tools.put(tool.getName(), tool);
            if (previous != null) {
                throw new IllegalStateException("Duplicate tool name: " + tool.getName());
            }
        }
        this.interceptors = interceptors != null ? new ArrayList<>(interceptors) : List.of();
        log.info("✅ Registered {} tools, {} interceptors", this.tools.size(), this.interceptors.size());
    }

    public Collection<Tool> getTools() {
        return Collections.unmodifiableCollection(tools.values());
    }

    public boolean hasTool(String toolName) {
        return toolName != null && tools.containsKey(toolName);
    }

    public ToolResult execute(String toolName, Map<String, Object> parameters) {
        Tool tool = toolName != null ? tools.get(toolName) : null;
        if (tool == null) {
            log.warn("Unknown tool '{}'. Valid tools: {}", toolName, tools.keySet());
            return ToolResult.failure(ErrorKind.NOT_FOUND, "Unknown tool: " + toolName);
        }

        Map<String, Object> arguments = parameters != null ? parameters : Map.of();
        ToolContext context = ToolContextImpl.create(toolName);
        log.info("🔧 Executing tool {} [{}]", toolName, context.getRequestId());

        ToolResult result;
        try {
            runBeforeInterceptors(tool, arguments, context);
            result = tool.execute(arguments, context);
        } catch (GraphOperationException e) {
            log.warn("⚠️  Tool {} rejected: {}", toolName, e.getMessage());
            result = ToolResult.from(e);
        } catch (RuntimeException e) {
            log.error("Tool {} failed", toolName, e);
            result = ToolResult.failure(ErrorKind.INTERNAL, e.getMessage() != null ? e.getMessage() : e.toString());
        }

        runAfterInterceptors(tool, context, result);
        return result;
    }

    private void runBeforeInterceptors(Tool tool, Map<String, Object> parameters, ToolContext context) {
        for (ToolInterceptor interceptor : interceptors) {
            if (interceptor.appliesTo(tool)) {
                interceptor.beforeExecute(tool, parameters, context);
            }
        }
    }

    private void runAfterInterceptors(Tool tool, ToolContext context, ToolResult result) {
        for (ToolInterceptor interceptor : interceptors) {
            if (interceptor.appliesTo(tool)) {
                try {
                    interceptor.afterExecute(tool, context, result);
                } catch (RuntimeException e) {
                    log.warn("Interceptor {} failed after {}: {}",
                        interceptor.getClass().getSimpleName(), tool.getName(), e.getMessage());
                }
            }
        }
    }
}
