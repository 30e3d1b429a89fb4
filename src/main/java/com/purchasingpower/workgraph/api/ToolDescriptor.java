package com.purchasingpower.workgraph.api;

import com.purchasingpower.workgraph.agent.Tool;

/**
 * Listing entry for one registered tool.
 */
public record ToolDescriptor(
    String name,
    String description,
    String parameterSchema,
    Tool.ToolCategory category
) {

    public static ToolDescriptor of(Tool tool) {
        return new ToolDescriptor(tool.getName(), tool.getDescription(), tool.getParameterSchema(), tool.getCategory());
    }
}
