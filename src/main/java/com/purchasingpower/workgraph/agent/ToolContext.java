package com.purchasingpower.workgraph.agent;

import java.time.Instant;

/**
 * Context provided to tools and interceptors during one call.
 *
 * @since 1.0.0
 */
public interface ToolContext {

    /**
     * Identifier of this call, used to correlate log lines.
     */
    String getRequestId();

    /**
     * Name the caller asked for.
     */
    String getToolName();

    Instant getStartedAt();
}
