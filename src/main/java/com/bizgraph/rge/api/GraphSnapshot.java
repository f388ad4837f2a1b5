package com.bizgraph.rge.api;

import java.util.List;
import java.util.Optional;

/**
 * Immutable, point-in-time view of the graph. A traversal reads exactly one
 * snapshot, so it never observes a half-applied write.
 */
public interface GraphSnapshot {

    /** Store version this snapshot was taken at. Strictly increases with every applied write. */
    long version();

    Optional<BusinessNode> findNode(String id);

    /**
     * @throws UnknownEntityException if the id is absent
     */
    default BusinessNode node(String id) {
        return findNode(id).orElseThrow(() -> new UnknownEntityException(id));
    }

    default boolean contains(String id) {
        return findNode(id).isPresent();
    }

    /**
     * Neighbours of {@code id}, one entry per edge (a pair joined by two
     * relationship types appears twice). Ordered by neighbour id, then type.
     *
     * @throws UnknownEntityException if the id is absent
     */
    List<Adjacency> neighbors(String id);

    int nodeCount();

    int edgeCount();
}
