package com.bizgraph.rge.api;

/** Requested max depth is outside {@code [1, ceiling]}. Not retryable. */
public class InvalidDepthException extends GraphQueryException {

    public InvalidDepthException(int depth, int ceiling) {
        super(ErrorCode.INVALID_DEPTH, "maxDepth must be within [1, " + ceiling + "], got " + depth);
    }
}
