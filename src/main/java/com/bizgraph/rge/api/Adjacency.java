package com.bizgraph.rge.api;

/** One entry of a node's neighbour list: the node on the other side and the edge leading there. */
public record Adjacency(String neighborId, RelationshipEdge edge) {
}
