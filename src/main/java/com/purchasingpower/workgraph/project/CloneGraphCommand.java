package com.purchasingpower.workgraph.project;

import com.purchasingpower.workgraph.exception.GraphOperationException;
import com.purchasingpower.workgraph.util.InputSanitizer;
import com.purchasingpower.workgraph.util.ToolArguments;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class CloneGraphCommand {

    private String sourceGraphId;
    private String newName;
    @Builder.Default
    private boolean includeNodes = true;
    @Builder.Default
    private boolean includeEdges = true;
    private String teamId;

    public static CloneGraphCommand from(ToolArguments args) {
        String newName = InputSanitizer.sanitizeString(args.getRaw("newName"), 200);
        if (newName == null || newName.isBlank()) {
            throw GraphOperationException.validation("newName is required");
        }
        return CloneGraphCommand.builder()
            .sourceGraphId(InputSanitizer.sanitizeId(args.requireString("sourceGraphId"), "sourceGraphId"))
            .newName(newName.trim())
            .includeNodes(args.getBoolean("includeNodes", true))
            .includeEdges(args.getBoolean("includeEdges", true))
            .teamId(args.has("teamId") ? InputSanitizer.sanitizeId(args.getRaw("teamId"), "teamId") : null)
            .build();
    }
}
