package com.purchasingpower.workgraph.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.workgraph.agent.ToolExecutor;
import com.purchasingpower.workgraph.agent.ToolResult;
import com.purchasingpower.workgraph.core.ErrorKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST transport for tool calls.
 *
 * @since 1.0.0
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/tools")
@RequiredArgsConstructor
public class ToolController {

    private final ToolExecutor toolExecutor;
    private final ObjectMapper objectMapper;

    /**
     * List registered tools.
     *
     * GET /api/v1/tools
     */
    @GetMapping
    public List<ToolDescriptor> listTools() {
        return toolExecutor.getTools().stream().map(ToolDescriptor::of).toList();
    }

    /**
     * Call a tool with a JSON argument object.
     *
     * POST /api/v1/tools/{name}
     */
    @PostMapping("/{name}")
    public ResponseEntity<ToolCallResponse> callTool(@PathVariable String name,
                                                     @RequestBody(required = false) Map<String, Object> arguments) {
        if (!toolExecutor.hasTool(name)) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(ToolCallResponse.error(ErrorKind.NOT_FOUND, "Unknown tool: " + name));
        }

        ToolResult result = toolExecutor.execute(name, arguments);
        if (!result.isSuccess()) {
            ErrorKind kind = result.getErrorKind() != null ? result.getErrorKind() : ErrorKind.INTERNAL;
            return ResponseEntity.status(statusFor(kind))
                .body(ToolCallResponse.error(kind, "Error executing " + name + ": " + result.getMessage()));
        }

        try {
            String text = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(result.getData());
            return ResponseEntity.ok(ToolCallResponse.success(text));
        } catch (JsonProcessingException e) {
            log.error("Could not serialize result of {}", name, e);
            return ResponseEntity.internalServerError().body(ToolCallResponse.error(
                ErrorKind.INTERNAL, "Error executing " + name + ": result is not serializable"));
        }
    }

    static HttpStatus statusFor(ErrorKind kind) {
        return switch (kind) {
            case VALIDATION -> HttpStatus.BAD_REQUEST;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case CONFLICT -> HttpStatus.CONFLICT;
            case STORAGE -> HttpStatus.SERVICE_UNAVAILABLE;
            case INTERNAL -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
