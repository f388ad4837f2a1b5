package com.bizgraph.rge.api;

import java.util.List;

/**
 * Outcome of a path query. Immutable.
 *
 * A result with {@code found == false} is the "no path within the bound"
 * signal; it is a normal answer and is cached like any other.
 *
 * @param nodes          node ids from source to target, inclusive; empty when not found
 * @param edges          traversed edges, {@code edges.size() == nodes.size() - 1}
 * @param weight         product of edge weights; 1.0 for the trivial path, 0.0 when not found
 * @param maxDepth       the hop bound the query ran with
 */
public record PathResult(String source, String target, boolean found, List<String> nodes,
        List<RelationshipEdge> edges, double weight, int maxDepth) {

    public PathResult {
        nodes = List.copyOf(nodes);
        edges = List.copyOf(edges);
    }

    public static PathResult trivial(String source, int maxDepth) {
        return new PathResult(source, source, true, List.of(source), List.of(), 1.0, maxDepth);
    }

    public static PathResult notFound(String source, String target, int maxDepth) {
        return new PathResult(source, target, false, List.of(), List.of(), 0.0, maxDepth);
    }

    public int hops() {
        return found ? nodes.size() - 1 : -1;
    }
}
