package com.purchasingpower.workgraph.agent.impl;

import com.purchasingpower.workgraph.agent.ToolContext;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.UUID;

/**
 * Default implementation of ToolContext.
 *
 * @since 1.0.0
 */
@Data
@Builder
public class ToolContextImpl implements ToolContext {

    private String requestId;

    private String toolName;

    @Builder.Default
    private Instant startedAt = Instant.now();

    public static ToolContextImpl create(String toolName) {
        return ToolContextImpl.builder()
            .requestId(UUID.randomUUID().toString())
            .toolName(toolName)
            .build();
    }
}
