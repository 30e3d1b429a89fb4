package com.purchasingpower.workgraph.mutation;

import com.purchasingpower.workgraph.util.ToolArguments;
import lombok.Builder;
import lombok.Data;

import java.util.Map;

/**
 * Identifies an edge by (source, target, type); weight and metadata apply on create.
 */
@Data
@Builder
public class EdgeCommand {

    private String sourceId;
    private String targetId;
    private String type;
    private Double weight;
    private Map<String, Object> metadata;

    public static EdgeCommand from(ToolArguments args) {
        return EdgeCommand.builder()
            .sourceId(args.getString("source_id"))
            .targetId(args.getString("target_id"))
            .type(args.getString("type"))
            .weight(args.getDouble("weight"))
            .metadata(args.getMap("metadata"))
            .build();
    }
}
