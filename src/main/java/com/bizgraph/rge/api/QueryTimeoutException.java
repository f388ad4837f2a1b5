package com.bizgraph.rge.api;

/**
 * The deadline passed before a complete answer was available. Partial results
 * are discarded. Callers may retry with backoff; the engine never retries it.
 */
public class QueryTimeoutException extends GraphQueryException {

    public QueryTimeoutException(String message) {
        super(ErrorCode.TIMEOUT, message);
    }
}
