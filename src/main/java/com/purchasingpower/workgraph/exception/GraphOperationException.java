package com.purchasingpower.workgraph.exception;

import com.purchasingpower.workgraph.core.ErrorKind;
import lombok.Getter;

@Getter
public class GraphOperationException extends RuntimeException {

    private final ErrorKind kind;

    public GraphOperationException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public GraphOperationException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public static GraphOperationException validation(String message) {
        return new GraphOperationException(ErrorKind.VALIDATION, message);
    }

    public static GraphOperationException notFound(String message) {
        return new GraphOperationException(ErrorKind.NOT_FOUND, message);
    }

    public static GraphOperationException conflict(String message) {
        return new GraphOperationException(ErrorKind.CONFLICT, message);
    }

    public static GraphOperationException storage(String message, Throwable cause) {
        return new GraphOperationException(ErrorKind.STORAGE, message, cause);
    }
}
