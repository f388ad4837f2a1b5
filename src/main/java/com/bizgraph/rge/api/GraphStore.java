package com.bizgraph.rge.api;

import java.util.List;

/**
 * Read/write access to the canonical business graph.
 *
 * Reads never block on writers. Writes touching the same unordered pair are
 * linearized; writes to disjoint pairs proceed independently. How the store
 * achieves that (transactions, copy-on-write, sharding) is its own business.
 */
public interface GraphStore {

    /**
     * @throws UnknownEntityException if the id is absent
     */
    default BusinessNode getNode(String id) {
        return snapshot().node(id);
    }

    /**
     * @throws UnknownEntityException if the id is absent
     */
    default List<Adjacency> getNeighbors(String id) {
        return snapshot().neighbors(id);
    }

    /** Consistent view for the duration of one traversal. */
    GraphSnapshot snapshot();

    /**
     * Deadline-bounded variant of {@link #snapshot()}. Stores backed by remote
     * systems override this to bound their own waits.
     *
     * @throws QueryTimeoutException if the deadline passes first
     */
    default GraphSnapshot snapshot(Deadline deadline) {
        deadline.check("store snapshot");
        return snapshot();
    }

    long version();

    /** Inserts or replaces a business node. */
    WriteResult putNode(BusinessNode node);

    /**
     * Inserts an edge, or replaces the active record of the same pair and type
     * when {@code overwrite} is set.
     *
     * @throws UnknownEntityException if either endpoint is absent
     * @throws EdgeConflictException  if a record exists and {@code overwrite} is false
     */
    WriteResult upsertEdge(RelationshipEdge edge, boolean overwrite);

    /**
     * Removes the active record of the given pair and type. Returns a
     * non-applied result when there is none.
     *
     * @throws UnknownEntityException if either endpoint is absent
     */
    WriteResult deleteEdge(EdgePair pair, RelationshipType type);
}
