package com.purchasingpower.workgraph.project;

import com.purchasingpower.workgraph.core.GraphStatus;
import com.purchasingpower.workgraph.core.GraphType;
import com.purchasingpower.workgraph.exception.GraphOperationException;
import com.purchasingpower.workgraph.util.InputSanitizer;
import com.purchasingpower.workgraph.util.ToolArguments;
import lombok.Builder;
import lombok.Getter;

import java.util.Map;

/**
 * Partial update of a graph container; null fields are left untouched.
 */
@Getter
@Builder
public class GraphUpdate {

    private final String name;
    private final String description;
    private final GraphType type;
    private final GraphStatus status;
    private final String teamId;
    private final String parentGraphId;
    private final Boolean shared;
    private final Map<String, Object> settings;

    public boolean isEmpty() {
        return name == null && description == null && type == null && status == null
            && teamId == null && parentGraphId == null && shared == null && settings == null;
    }

    public static GraphUpdate from(ToolArguments args) {
        String name = null;
        if (args.has("name")) {
            name = InputSanitizer.sanitizeString(args.getRaw("name"), 200);
            if (name.isBlank()) {
                throw GraphOperationException.validation("Graph name cannot be empty");
            }
            name = name.trim();
        }
        return GraphUpdate.builder()
            .name(name)
            .description(args.has("description") ? InputSanitizer.sanitizeString(args.getRaw("description"), 2000) : null)
            .type(args.has("type") ? InputSanitizer.sanitizeEnum(args.getRaw("type"), GraphType.class, null, "graph type") : null)
            .status(args.has("status") ? InputSanitizer.sanitizeEnum(args.getRaw("status"), GraphStatus.class, null, "graph status") : null)
            .teamId(args.has("teamId") ? InputSanitizer.sanitizeId(args.getRaw("teamId"), "teamId") : null)
            .parentGraphId(args.has("parentGraphId") ? InputSanitizer.sanitizeId(args.getRaw("parentGraphId"), "parentGraphId") : null)
            .shared(args.getBooleanOrNull("isShared"))
            .settings(args.has("settings") ? InputSanitizer.sanitizeMetadata(args.getRaw("settings")) : null)
            .build();
    }
}
