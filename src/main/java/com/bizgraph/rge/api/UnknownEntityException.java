package com.bizgraph.rge.api;

/** A referenced business id does not exist in the store. */
public class UnknownEntityException extends GraphQueryException {
    private final String entityId;

    public UnknownEntityException(String entityId) {
        super(ErrorCode.NOT_FOUND, "Unknown business: " + entityId);
        this.entityId = entityId;
    }

    public String entityId() {
        return entityId;
    }
}
