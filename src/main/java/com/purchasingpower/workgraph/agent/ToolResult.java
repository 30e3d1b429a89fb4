package com.purchasingpower.workgraph.agent;

import com.purchasingpower.workgraph.core.ErrorKind;
import com.purchasingpower.workgraph.exception.GraphOperationException;

/**
 * Result from a tool execution.
 *
 * <p>The single result contract of every operation: either a data payload or
 * an error kind with a message.
 *
 * @since 1.0.0
 */
public interface ToolResult {

    /**
     * Whether the tool executed successfully.
     */
    boolean isSuccess();

    /**
     * The result payload; null for failures.
     */
    Object getData();

    /**
     * Human-readable message about the result.
     */
    String getMessage();

    /**
     * Kind of failure; null for successes.
     */
    ErrorKind getErrorKind();

    /**
     * Create a successful result.
     */
    static ToolResult success(Object data, String message) {
        return new ToolResultImpl(true, data, message, null);
    }

    /**
     * Create a failed result.
     */
    static ToolResult failure(ErrorKind kind, String message) {
        return new ToolResultImpl(false, null, message, kind);
    }

    static ToolResult from(GraphOperationException e) {
        return failure(e.getKind(), e.getMessage());
    }
}

/**
 * Default implementation of ToolResult.
 */
record ToolResultImpl(
    boolean isSuccess,
    Object data,
    String message,
    ErrorKind errorKind
) implements ToolResult {

    @Override
    public boolean isSuccess() {
        return isSuccess;
    }

    @Override
    public Object getData() {
        return data;
    }

    @Override
    public String getMessage() {
        return message;
    }

    @Override
    public ErrorKind getErrorKind() {
        return errorKind;
    }
}
