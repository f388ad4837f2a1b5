package com.bizgraph.rge.api;

/** Stable error codes surfaced to callers in response envelopes. */
public enum ErrorCode {
    NOT_FOUND(404),
    INVALID_DEPTH(400),
    INVALID_ARGUMENT(400),
    CONFLICT(409),
    TIMEOUT(504),
    STORE_UNAVAILABLE(503),
    INTERNAL(500);

    private final int httpStatus;

    ErrorCode(int httpStatus) {
        this.httpStatus = httpStatus;
    }

    public int httpStatus() {
        return httpStatus;
    }
}
