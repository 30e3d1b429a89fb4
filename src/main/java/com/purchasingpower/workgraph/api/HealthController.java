package com.purchasingpower.workgraph.api;

import com.purchasingpower.workgraph.agent.Tool;
import com.purchasingpower.workgraph.agent.ToolExecutor;
import com.purchasingpower.workgraph.agent.interceptors.UsageTrackingInterceptor;
import com.purchasingpower.workgraph.configuration.ServerInfoProperties;
import com.purchasingpower.workgraph.storage.GraphStore;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Liveness and usage endpoints.
 *
 * @since 1.0.0
 */
@RestController
@RequiredArgsConstructor
public class HealthController {

    private final Instant startedAt = Instant.now();

    private final ServerInfoProperties serverInfo;
    private final ToolExecutor toolExecutor;
    private final UsageTrackingInterceptor usageTracker;
    private final GraphStore graphStore;

    /**
     * GET /health
     */
    @GetMapping("/health")
    public Map<String, Object> health() {
        boolean connected = graphStore.verifyConnectivity();

        Map<String, Object> health = new LinkedHashMap<>();
        health.put("status", connected ? "healthy" : "degraded");
        health.put("timestamp", Instant.now().toString());
        health.put("server", serverInfo.getName());
        health.put("version", serverInfo.getVersion());
        health.put("uptime", Duration.between(startedAt, Instant.now()).toSeconds());
        health.put("neo4j", connected ? "connected" : "unavailable");
        health.put("capabilities", toolExecutor.getTools().stream().map(Tool::getName).toList());
        return health;
    }

    /**
     * GET /status
     */
    @GetMapping("/status")
    public Map<String, Object> status() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("active", true);
        status.putAll(usageTracker.snapshot());
        status.put("neo4jUri", graphStore.getUri());
        return status;
    }
}
