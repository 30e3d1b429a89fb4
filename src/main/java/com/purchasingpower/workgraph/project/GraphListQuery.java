package com.purchasingpower.workgraph.project;

import com.purchasingpower.workgraph.core.GraphStatus;
import com.purchasingpower.workgraph.core.GraphType;
import com.purchasingpower.workgraph.util.InputSanitizer;
import com.purchasingpower.workgraph.util.ToolArguments;
import lombok.Builder;
import lombok.Getter;

/**
 * Filters for listing graphs. Null filters match everything.
 */
@Getter
@Builder
public class GraphListQuery {

    private final GraphType type;
    private final GraphStatus status;
    private final String teamId;
    private final Boolean shared;
    private final Integer limit;
    private final Integer offset;

    public static GraphListQuery from(ToolArguments args) {
        return GraphListQuery.builder()
            .type(args.has("type") ? InputSanitizer.sanitizeEnum(args.getRaw("type"), GraphType.class, null, "graph type") : null)
            .status(args.has("status") ? InputSanitizer.sanitizeEnum(args.getRaw("status"), GraphStatus.class, null, "graph status") : null)
            .teamId(args.has("teamId") ? InputSanitizer.sanitizeId(args.getRaw("teamId"), "teamId") : null)
            .shared(args.getBooleanOrNull("isShared"))
            .limit(args.getInteger("limit"))
            .offset(args.getInteger("offset"))
            .build();
    }
}
