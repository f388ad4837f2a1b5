package com.bizgraph.rge.api;

/** A store read failed for a reason expected to clear on its own (connection reset, leader change). */
public class TransientStoreException extends GraphQueryException {

    public TransientStoreException(String message) {
        super(ErrorCode.STORE_UNAVAILABLE, message);
    }

    public TransientStoreException(String message, Throwable cause) {
        super(ErrorCode.STORE_UNAVAILABLE, message, cause);
    }
}
