package com.purchasingpower.workgraph.mutation;

import com.purchasingpower.workgraph.util.ToolArguments;
import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * Raw request to create a work item. Values are sanitized by {@link WorkItemWriter}.
 */
@Data
@Builder
public class CreateNodeCommand {

    /**
     * Caller-chosen ID; generated when absent.
     */
    private String id;
    private String title;
    private String description;
    private String type;
    private String status;
    private List<String> contributorIds;
    private Map<String, Object> metadata;

    /**
     * Graph container to attach the item to.
     */
    private String graphId;

    public static CreateNodeCommand from(ToolArguments args) {
        return CreateNodeCommand.builder()
            .id(args.getString("id"))
            .title(args.getString("title"))
            .description(args.getString("description"))
            .type(args.getString("type"))
            .status(args.getString("status"))
            .contributorIds(args.getStringList("contributor_ids"))
            .metadata(args.getMap("metadata"))
            .graphId(args.getString("graph_id"))
            .build();
    }
}
