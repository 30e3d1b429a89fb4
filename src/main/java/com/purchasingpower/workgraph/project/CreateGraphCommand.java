package com.purchasingpower.workgraph.project;

import com.purchasingpower.workgraph.core.GraphStatus;
import com.purchasingpower.workgraph.core.GraphType;
import com.purchasingpower.workgraph.exception.GraphOperationException;
import com.purchasingpower.workgraph.util.InputSanitizer;
import com.purchasingpower.workgraph.util.ToolArguments;
import lombok.Builder;
import lombok.Data;

import java.util.Map;

/**
 * A new graph container. Graph tools take camelCase arguments.
 */
@Data
@Builder
public class CreateGraphCommand {

    private static final int MAX_NAME_LENGTH = 200;
    private static final int MAX_DESCRIPTION_LENGTH = 2000;

    private String name;
    private String description;
    private GraphType type;
    private GraphStatus status;
    private String teamId;
    private String parentGraphId;
    private boolean shared;
    private Map<String, Object> settings;

    public static CreateGraphCommand from(ToolArguments args) {
        String name = InputSanitizer.sanitizeString(args.getRaw("name"), MAX_NAME_LENGTH);
        if (name == null || name.isBlank()) {
            throw GraphOperationException.validation("Graph name is required and cannot be empty");
        }
        return CreateGraphCommand.builder()
            .name(name.trim())
            .description(args.has("description")
                ? InputSanitizer.sanitizeString(args.getRaw("description"), MAX_DESCRIPTION_LENGTH)
                : "")
            .type(InputSanitizer.sanitizeEnum(args.getRaw("type"), GraphType.class, GraphType.PROJECT, "graph type"))
            .status(InputSanitizer.sanitizeEnum(args.getRaw("status"), GraphStatus.class, GraphStatus.ACTIVE, "graph status"))
            .teamId(args.has("teamId") ? InputSanitizer.sanitizeId(args.getRaw("teamId"), "teamId") : null)
            .parentGraphId(args.has("parentGraphId") ? InputSanitizer.sanitizeId(args.getRaw("parentGraphId"), "parentGraphId") : null)
            .shared(args.getBoolean("isShared", false))
            .settings(InputSanitizer.sanitizeMetadata(args.getRaw("settings")))
            .build();
    }
}
