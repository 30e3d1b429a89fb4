package com.purchasingpower.workgraph.priority;

import com.purchasingpower.workgraph.util.InputSanitizer;
import com.purchasingpower.workgraph.util.ToolArguments;
import lombok.Builder;
import lombok.Getter;

/**
 * Requested change to a node's priority inputs. Null components stay as stored.
 */
@Getter
@Builder
public class PriorityUpdate {

    private final String nodeId;
    private final Double executive;
    private final Double individual;
    private final Double community;

    @Builder.Default
    private final boolean recalculate = true;

    public boolean hasValues() {
        return executive != null || individual != null || community != null;
    }

    /**
     * Reads {@code node_id} and the {@code priority_*} components, rejecting values outside [0,1].
     */
    public static PriorityUpdate from(ToolArguments args, boolean recalculate) {
        return PriorityUpdate.builder()
            .nodeId(args.requireString("node_id"))
            .executive(InputSanitizer.sanitizePriority(args.getRaw("priority_executive"), "priority_executive"))
            .individual(InputSanitizer.sanitizePriority(args.getRaw("priority_individual"), "priority_individual"))
            .community(InputSanitizer.sanitizePriority(args.getRaw("priority_community"), "priority_community"))
            .recalculate(recalculate)
            .build();
    }
}
