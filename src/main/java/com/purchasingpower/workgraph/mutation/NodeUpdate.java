package com.purchasingpower.workgraph.mutation;

import com.purchasingpower.workgraph.core.WorkItemStatus;
import com.purchasingpower.workgraph.core.WorkItemType;
import com.purchasingpower.workgraph.util.InputSanitizer;
import com.purchasingpower.workgraph.util.ToolArguments;
import lombok.Builder;
import lombok.Getter;

import java.util.List;
import java.util.Map;

/**
 * Partial update of a work item. A null field means "leave unchanged".
 *
 * <p>{@code contributorIds}, when present, replaces the whole contributor set;
 * an empty list removes every contributor.
 */
@Getter
@Builder
public class NodeUpdate {

    private final String title;
    private final String description;
    private final WorkItemType type;
    private final WorkItemStatus status;
    private final Map<String, Object> metadata;
    private final List<String> contributorIds;

    public boolean isEmpty() {
        return title == null && description == null && type == null && status == null
            && metadata == null && contributorIds == null;
    }

    /**
     * Reads the fields present in a tool call; enum values are validated here.
     */
    public static NodeUpdate from(ToolArguments args) {
        return NodeUpdate.builder()
            .title(args.getString("title"))
            .description(args.getString("description"))
            .type(args.has("type") ? InputSanitizer.sanitizeNodeType(args.getString("type"), null) : null)
            .status(args.has("status") ? InputSanitizer.sanitizeNodeStatus(args.getString("status"), null) : null)
            .metadata(args.getMap("metadata"))
            .contributorIds(args.getStringList("contributor_ids"))
            .build();
    }
}
