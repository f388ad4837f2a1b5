package com.bizgraph.rge.store;

import com.bizgraph.rge.api.*;

import java.util.*;

/**
 * Copy-on-write snapshot backing {@link InMemoryGraphStore}.
 *
 * Every {@code with*} method returns a new snapshot sharing all untouched
 * structure with this one. Adjacency lists are immutable and kept sorted by
 * (neighbour id, relationship type) so traversals see a stable order.
 */
final class ImmutableGraphSnapshot implements GraphSnapshot {

    static final ImmutableGraphSnapshot EMPTY = new ImmutableGraphSnapshot(0, Map.of(), Map.of(), Map.of());

    private static final Comparator<Adjacency> ADJACENCY_ORDER = Comparator
            .comparing(Adjacency::neighborId)
            .thenComparing(a -> a.edge().type());

    private final long version;
    private final Map<String, BusinessNode> nodes;
    private final Map<String, List<Adjacency>> adjacency;
    private final Map<EdgeKey, RelationshipEdge> edges;

    /** Identity of an active edge record: one per pair and type. */
    record EdgeKey(EdgePair pair, RelationshipType type) {
    }

    private ImmutableGraphSnapshot(long version, Map<String, BusinessNode> nodes,
            Map<String, List<Adjacency>> adjacency, Map<EdgeKey, RelationshipEdge> edges) {
        this.version = version;
        this.nodes = nodes;
        this.adjacency = adjacency;
        this.edges = edges;
    }

    @Override
    public long version() {
        return version;
    }

    @Override
    public Optional<BusinessNode> findNode(String id) {
        return Optional.ofNullable(nodes.get(id));
    }

    @Override
    public List<Adjacency> neighbors(String id) {
        if (!nodes.containsKey(id))
            throw new UnknownEntityException(id);
        return adjacency.getOrDefault(id, List.of());
    }

    @Override
    public int nodeCount() {
        return nodes.size();
    }

    @Override
    public int edgeCount() {
        return edges.size();
    }

    RelationshipEdge edge(EdgePair pair, RelationshipType type) {
        return edges.get(new EdgeKey(pair, type));
    }

    ImmutableGraphSnapshot withNode(BusinessNode node) {
        Map<String, BusinessNode> nextNodes = new HashMap<>(nodes);
        nextNodes.put(node.id(), node);
        return new ImmutableGraphSnapshot(version + 1, Collections.unmodifiableMap(nextNodes), adjacency, edges);
    }

    ImmutableGraphSnapshot withEdge(RelationshipEdge edge) {
        EdgeKey key = new EdgeKey(edge.pair(), edge.type());
        Map<EdgeKey, RelationshipEdge> nextEdges = new HashMap<>(edges);
        nextEdges.put(key, edge);

        Map<String, List<Adjacency>> nextAdj = new HashMap<>(adjacency);
        String low = edge.pair().low(), high = edge.pair().high();
        nextAdj.put(low, replaceAdjacency(low, high, edge.type(), edge));
        nextAdj.put(high, replaceAdjacency(high, low, edge.type(), edge));

        return new ImmutableGraphSnapshot(version + 1, nodes, Collections.unmodifiableMap(nextAdj),
                Collections.unmodifiableMap(nextEdges));
    }

    ImmutableGraphSnapshot withoutEdge(EdgePair pair, RelationshipType type) {
        Map<EdgeKey, RelationshipEdge> nextEdges = new HashMap<>(edges);
        nextEdges.remove(new EdgeKey(pair, type));

        Map<String, List<Adjacency>> nextAdj = new HashMap<>(adjacency);
        nextAdj.put(pair.low(), replaceAdjacency(pair.low(), pair.high(), type, null));
        nextAdj.put(pair.high(), replaceAdjacency(pair.high(), pair.low(), type, null));

        return new ImmutableGraphSnapshot(version + 1, nodes, Collections.unmodifiableMap(nextAdj),
                Collections.unmodifiableMap(nextEdges));
    }

    // Rebuilds one node's adjacency list with the (neighbor, type) slot replaced, or removed when edge is null.
    private List<Adjacency> replaceAdjacency(String owner, String neighbor, RelationshipType type,
            RelationshipEdge edge) {
        List<Adjacency> current = adjacency.getOrDefault(owner, List.of());
        List<Adjacency> next = new ArrayList<>(current.size() + 1);
        for (Adjacency a : current) {
            if (!(a.neighborId().equals(neighbor) && a.edge().type() == type))
                next.add(a);
        }
        if (edge != null)
            next.add(new Adjacency(neighbor, edge));
        next.sort(ADJACENCY_ORDER);
        return List.copyOf(next);
    }
}
