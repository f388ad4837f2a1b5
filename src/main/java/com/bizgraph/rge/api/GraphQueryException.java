package com.bizgraph.rge.api;

/**
 * Base of every error the engine surfaces to callers. Unchecked; each subclass
 * maps to one {@link ErrorCode}.
 */
public class GraphQueryException extends RuntimeException {
    private final ErrorCode code;

    public GraphQueryException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public GraphQueryException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public ErrorCode code() {
        return code;
    }
}
