package com.bizgraph.rge.api;

import java.util.List;
import java.util.Optional;

/** All nodes within {@code maxDepth} hops of {@code source}, ordered by (distance, id). */
public record Neighborhood(String source, int maxDepth, List<NeighborEntry> entries) {

    public Neighborhood {
        entries = List.copyOf(entries);
    }

    public Optional<NeighborEntry> entry(String nodeId) {
        for (NeighborEntry e : entries) {
            if (e.nodeId().equals(nodeId))
                return Optional.of(e);
        }
        return Optional.empty();
    }

    public int size() {
        return entries.size();
    }
}
