package com.purchasingpower.workgraph.agent.interceptors;

import com.purchasingpower.workgraph.agent.Tool;
import com.purchasingpower.workgraph.agent.ToolContext;
import com.purchasingpower.workgraph.agent.ToolInterceptor;
import com.purchasingpower.workgraph.configuration.WorkGraphProperties;
import com.purchasingpower.workgraph.util.InputSanitizer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Rejects write calls whose arguments exceed {@code app.graph.max-payload-mb}.
 *
 * @since 1.0.0
 */
@Component
@RequiredArgsConstructor
public class PayloadSizeInterceptor implements ToolInterceptor {

    private final WorkGraphProperties properties;

    @Override
    public void beforeExecute(Tool tool, Map<String, Object> parameters, ToolContext context) {
        InputSanitizer.validateMemoryUsage(parameters, properties.getMaxPayloadMb());
    }

    @Override
    public boolean appliesTo(Tool tool) {
        return tool.getCategory() == Tool.ToolCategory.MUTATION
            || tool.getCategory() == Tool.ToolCategory.PRIORITY
            || tool.getCategory() == Tool.ToolCategory.GRAPH_MANAGEMENT;
    }
}
