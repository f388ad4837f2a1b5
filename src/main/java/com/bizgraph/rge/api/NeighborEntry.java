package com.bizgraph.rge.api;

import java.util.List;

/**
 * A node reached by a neighbourhood query.
 *
 * @param distance hop distance from the source (>= 1)
 * @param weight   aggregate weight of the best path found to this node
 * @param path     node ids of that best path, source first
 * @param edges    edges of that best path, in walking order
 */
public record NeighborEntry(String nodeId, int distance, double weight, List<String> path,
        List<RelationshipEdge> edges) {

    public NeighborEntry {
        path = List.copyOf(path);
        edges = List.copyOf(edges);
    }
}
