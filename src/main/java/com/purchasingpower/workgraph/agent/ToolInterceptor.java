package com.purchasingpower.workgraph.agent;

import java.util.Map;

/**
 * Interceptor for tool execution.
 *
 * Allows pre/post processing around tool execution.
 * Used for cross-cutting concerns like payload limits and usage counters.
 *
 * @since 1.0.0
 */
public interface ToolInterceptor {

    /**
     * Called before tool execution.
     *
     * @param tool The tool about to be executed
     * @param parameters The call arguments
     * @param context The execution context
     * @throws com.purchasingpower.workgraph.exception.GraphOperationException if pre-conditions fail
     */
    void beforeExecute(Tool tool, Map<String, Object> parameters, ToolContext context);

    /**
     * Called after tool execution.
     *
     * @param tool The tool that was executed
     * @param context The execution context
     * @param result The result from the tool
     */
    default void afterExecute(Tool tool, ToolContext context, ToolResult result) {
    }

    /**
     * Check if this interceptor applies to the given tool.
     *
     * @param tool The tool to check
     * @return true if interceptor should run for this tool
     */
    boolean appliesTo(Tool tool);
}
