package com.purchasingpower.workgraph.agent;

import java.util.Map;

/**
 * One operation of the engine exposed as a named tool call.
 *
 * <p>Tools never throw for caller-visible failures; they return
 * {@link ToolResult#failure} with an error kind instead.
 *
 * <p>Example implementation:
 * <pre>
 * public class DeleteNodeTool implements Tool {
 *     public String getName() { return "delete_node"; }
 *
 *     public ToolResult execute(Map&lt;String, Object&gt; params, ToolContext context) {
 *         String nodeId = (String) params.get("node_id");
 *         // Delete and report the removed relationships
 *     }
 * }
 * </pre>
 *
 * @since 1.0.0
 */
public interface Tool {

    /**
     * Unique name for this tool (e.g., "browse_graph", "create_edge").
     * Used as the path segment of the tool endpoint.
     */
    String getName();

    /**
     * Human-readable description of what the tool does.
     */
    String getDescription();

    /**
     * Description of the tool's arguments, one entry per argument.
     *
     * @return JSON object string
     */
    String getParameterSchema();

    /**
     * Execute this tool with the given arguments.
     *
     * @param parameters Arguments of the call
     * @param context Per-call context
     * @return Tool execution result
     */
    ToolResult execute(Map<String, Object> parameters, ToolContext context);

    /**
     * Category of this tool for organization.
     */
    ToolCategory getCategory();

    /**
     * Tool categories for organization and filtering.
     */
    enum ToolCategory {
        /**
         * Read-only lookups and traversals.
         */
        QUERY,

        /**
         * Node and edge writes, single or bulk.
         */
        MUTATION,

        /**
         * Priority inputs and priority statistics.
         */
        PRIORITY,

        /**
         * Health, bottleneck and workload heuristics.
         */
        ANALYTICS,

        /**
         * Graph container lifecycle.
         */
        GRAPH_MANAGEMENT
    }
}
