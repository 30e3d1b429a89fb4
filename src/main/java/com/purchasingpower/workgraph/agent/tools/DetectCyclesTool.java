package com.purchasingpower.workgraph.agent.tools;

import com.purchasingpower.workgraph.query.QueryService;
import com.purchasingpower.workgraph.util.ToolArguments;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Tool for finding DEPENDS_ON cycles.
 *
 * @since 1.0.0
 */
@Component
@RequiredArgsConstructor
public class DetectCyclesTool extends AbstractGraphTool {

    private final QueryService queryService;

    @Override
    public String getName() {
        return "detect_cycles";
    }

    @Override
    public String getDescription() {
        return "Find DEPENDS_ON cycles of length 2 to 10.";
    }

    @Override
    public String getParameterSchema() {
        return "{\"limit\": \"integer (optional, default 10)\", \"offset\": \"integer (optional, default 0)\"}";
    }

    @Override
    public ToolCategory getCategory() {
        return ToolCategory.QUERY;
    }

    @Override
    protected Map<String, Object> run(ToolArguments args) {
        return queryService.detectCycles(args.getInteger("limit"), args.getInteger("offset"));
    }
}
