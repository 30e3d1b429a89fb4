package com.purchasingpower.workgraph.agent.interceptors;

import com.purchasingpower.workgraph.agent.Tool;
import com.purchasingpower.workgraph.agent.ToolContext;
import com.purchasingpower.workgraph.agent.ToolInterceptor;
import com.purchasingpower.workgraph.agent.ToolResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Counts tool calls for the status endpoint.
 *
 * @since 1.0.0
 */
@Slf4j
@Component
public class UsageTrackingInterceptor implements ToolInterceptor {

    private final AtomicLong totalRequests = new AtomicLong();
    private final AtomicLong failedRequests = new AtomicLong();
    private final AtomicReference<Instant> lastRequestAt = new AtomicReference<>();
    private final AtomicReference<String> lastTool = new AtomicReference<>();
    private final Map<String, AtomicLong> callsByTool = new ConcurrentHashMap<>();

    @Override
    public void beforeExecute(Tool tool, Map<String, Object> parameters, ToolContext context) {
        totalRequests.incrementAndGet();
        lastRequestAt.set(context.getStartedAt());
        lastTool.set(tool.getName());
        callsByTool.computeIfAbsent(tool.getName(), name -> new AtomicLong()).incrementAndGet();
    }

    @Override
    public void afterExecute(Tool tool, ToolContext context, ToolResult result) {
        if (!result.isSuccess()) {
            failedRequests.incrementAndGet();
        }
        log.debug("Tool {} [{}] finished in {} ms (success={})", tool.getName(), context.getRequestId(),
            Duration.between(context.getStartedAt(), Instant.now()).toMillis(), result.isSuccess());
    }

    @Override
    public boolean appliesTo(Tool tool) {
        return true;
    }

    public long getTotalRequests() {
        return totalRequests.get();
    }

    public long getFailedRequests() {
        return failedRequests.get();
    }

    public Map<String, Object> snapshot() {
        Map<String, Long> byTool = new TreeMap<>();
        callsByTool.forEach((name, count) -> byTool.put(name, count.get()));

        Instant last = lastRequestAt.get();
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("totalRequests", totalRequests.get());
        snapshot.put("failedRequests", failedRequests.get());
        snapshot.put("lastRequest", last != null ? last.toString() : null);
        snapshot.put("lastTool", lastTool.get());
        snapshot.put("requestsByTool", byTool);
        return snapshot;
    }
}
