package com.bizgraph.rge.api;

/**
 * An upsert would create a second active record for the same pair and
 * relationship type, and the writer did not ask to overwrite.
 */
public class EdgeConflictException extends GraphQueryException {

    public EdgeConflictException(EdgePair pair, RelationshipType type) {
        super(ErrorCode.CONFLICT, "Active " + type.wireName() + " relationship already exists for " + pair);
    }
}
