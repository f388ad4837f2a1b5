package com.bizgraph.rge.api;

import java.time.Instant;
import java.util.Objects;

/**
 * A business entity participating in the network.
 *
 * The id is opaque and immutable; two nodes are the same entity iff their ids
 * match. Everything else is profile data owned by the business service and
 * carried here only so query responses can render it.
 */
public record BusinessNode(String id, String name, String category, String location,
        SizeClass sizeClass, Instant createdAt, Instant updatedAt) {

    public BusinessNode {
        if (id == null || id.isBlank())
            throw new IllegalArgumentException("Business id must not be blank");
        Objects.requireNonNull(createdAt, "createdAt");
        if (updatedAt == null)
            updatedAt = createdAt;
    }

    /** Minimal node, mostly useful for tests and seed data. */
    public static BusinessNode of(String id, String name, Instant at) {
        return new BusinessNode(id, name, null, null, SizeClass.SMALL, at, at);
    }

    public BusinessNode withUpdatedAt(Instant at) {
        return new BusinessNode(id, name, category, location, sizeClass, createdAt, at);
    }
}
