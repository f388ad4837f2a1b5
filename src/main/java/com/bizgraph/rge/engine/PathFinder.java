package com.bizgraph.rge.engine;

import com.bizgraph.rge.api.*;
import com.bizgraph.rge.util.ErrorRateLimiter;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.*;

/**
 * Bounded-depth traversal over the undirected, weighted business multigraph.
 *
 * <h2>Selection policy</h2>
 * Among all paths from the source to a node, the engine picks:
 * <ol>
 * <li>the one with the fewest hops, then</li>
 * <li>the one with the greatest aggregate weight (product of edge weights),
 * then</li>
 * <li>the lexicographically smallest node-id sequence.</li>
 * </ol>
 * Where several edges join the same two nodes, the heaviest one is walked
 * (ties resolved by {@link RelationshipType} declaration order). Aggregate
 * weights within a relative {@value #WEIGHT_TOLERANCE} of each other count as
 * equal, so products of the same factors in a different order still tie.
 *
 * <h2>Algorithm</h2>
 * Layered breadth-first search. Layer {@code d} holds every node first reached
 * at {@code d} hops. For each such node two trails are kept:
 * <ul>
 * <li><b>best</b>: winner under the full policy;</li>
 * <li><b>lexMin</b>: lexicographically smallest trail ignoring weight.</li>
 * </ul>
 * A candidate through a positive-weight edge extends the parent's best trail
 * (scaling by a positive constant preserves the parent's ordering). Through a
 * zero-weight edge every extension weighs zero, so the parent's lexMin trail
 * wins instead. Both trails of layer {@code d} are therefore exact once every
 * node of layer {@code d - 1} has been expanded.
 *
 * A path query stops after the layer that contains the target. Nodes are
 * expanded even above the fan-out cap; the cap only triggers a warning.
 *
 * The finder is stateless and thread-safe; every call reads exactly one
 * {@link GraphSnapshot}.
 */
public final class PathFinder {
    private static final Logger log = LogManager.getLogger(PathFinder.class);

    static final double WEIGHT_TOLERANCE = 1e-9;

    private final TraversalLimits limits;
    private final QueryListener listener;
    private final ErrorRateLimiter fanOutWarnings = new ErrorRateLimiter(log, 5_000);

    public PathFinder(TraversalLimits limits, QueryListener listener) {
        this.limits = limits;
        this.listener = listener;
    }

    public PathFinder(TraversalLimits limits) {
        this(limits, new QueryListener() {
        });
    }

    public TraversalLimits limits() {
        return limits;
    }

    /**
     * Finds the best path from {@code source} to {@code target} within
     * {@code maxDepth} hops.
     *
     * @return the path, or a {@link PathResult#notFound not-found} result when
     *         the two are not connected within the bound
     * @throws InvalidDepthException  if maxDepth is out of range
     * @throws UnknownEntityException if source or target is absent
     * @throws QueryTimeoutException  if the deadline passes mid-traversal
     */
    public PathResult findPath(GraphSnapshot graph, String source, String target, int maxDepth,
            Deadline deadline) {
        limits.validateDepth(maxDepth);
        graph.node(source);
        graph.node(target);
        if (source.equals(target))
            return PathResult.trivial(source, maxDepth);

        Map<String, Reach> reached = traverse(graph, source, target, maxDepth, deadline);
        Reach hit = reached.get(target);
        if (hit == null) {
            log.debug("No path {} -> {} within {} hops", source, target, maxDepth);
            return PathResult.notFound(source, target, maxDepth);
        }
        Trail best = hit.best;
        return new PathResult(source, target, true, best.nodeIds(), best.edges(), best.weight, maxDepth);
    }

    /**
     * Every node reachable from {@code source} within {@code maxDepth} hops,
     * excluding the source itself.
     *
     * @throws InvalidDepthException  if maxDepth is out of range
     * @throws UnknownEntityException if source is absent
     * @throws QueryTimeoutException  if the deadline passes mid-traversal
     */
    public Neighborhood neighborhood(GraphSnapshot graph, String source, int maxDepth, Deadline deadline) {
        limits.validateDepth(maxDepth);
        graph.node(source);

        Map<String, Reach> reached = traverse(graph, source, null, maxDepth, deadline);
        List<NeighborEntry> entries = new ArrayList<>(reached.size());
        for (Map.Entry<String, Reach> e : reached.entrySet()) {
            if (e.getKey().equals(source))
                continue;
            Trail best = e.getValue().best;
            entries.add(new NeighborEntry(e.getKey(), best.depth, best.weight, best.nodeIds(), best.edges()));
        }
        entries.sort(Comparator.comparingInt(NeighborEntry::distance).thenComparing(NeighborEntry::nodeId));
        return new Neighborhood(source, maxDepth, entries);
    }

    // Layered BFS. Returns every reached node (source included) with its final trails.
    private Map<String, Reach> traverse(GraphSnapshot graph, String source, String target, int maxDepth,
            Deadline deadline) {
        Map<String, Reach> reached = new HashMap<>();
        Trail root = new Trail(source, null, null, 1.0, 0);
        reached.put(source, new Reach(root, root));

        List<String> frontier = List.of(source);
        for (int depth = 1; depth <= maxDepth && !frontier.isEmpty(); depth++) {
            Map<String, Reach> layer = new HashMap<>();

            for (String u : frontier) {
                deadline.check("traversal at depth " + depth);
                Reach from = reached.get(u);
                List<Adjacency> adjacency = graph.neighbors(u);
                if (adjacency.size() > limits.neighborCap())
                    reportFanOut(u, adjacency.size());

                // Adjacency is sorted by (neighbour, type): walk each run of equal neighbours once.
                int i = 0;
                while (i < adjacency.size()) {
                    String v = adjacency.get(i).neighborId();
                    RelationshipEdge heaviest = adjacency.get(i).edge();
                    int j = i + 1;
                    while (j < adjacency.size() && adjacency.get(j).neighborId().equals(v)) {
                        if (adjacency.get(j).edge().weight() > heaviest.weight())
                            heaviest = adjacency.get(j).edge();
                        j++;
                    }
                    i = j;

                    if (reached.containsKey(v))
                        continue;
                    relax(layer, v, from, heaviest, depth);
                }
            }

            reached.putAll(layer);
            if (target != null && layer.containsKey(target))
                break;
            frontier = new ArrayList<>(layer.keySet());
        }
        deadline.check("traversal completion");
        return reached;
    }

    private static void relax(Map<String, Reach> layer, String v, Reach from, RelationshipEdge edge, int depth) {
        double w = edge.weight();
        Trail viaBest = w > 0
                ? new Trail(v, from.best, edge, from.best.weight * w, depth)
                : new Trail(v, from.lexMin, edge, 0.0, depth);
        Trail viaLex = new Trail(v, from.lexMin, edge, from.lexMin.weight * w, depth);

        Reach existing = layer.get(v);
        if (existing == null) {
            layer.put(v, new Reach(viaBest, viaLex));
            return;
        }
        Trail best = preferred(existing.best, viaBest);
        Trail lexMin = Trail.compareIds(viaLex, existing.lexMin) < 0 ? viaLex : existing.lexMin;
        layer.put(v, new Reach(best, lexMin));
    }

    private static Trail preferred(Trail a, Trail b) {
        int byWeight = compareWeights(a.weight, b.weight);
        if (byWeight != 0)
            return byWeight > 0 ? a : b;
        return Trail.compareIds(a, b) <= 0 ? a : b;
    }

    static int compareWeights(double x, double y) {
        if (Math.abs(x - y) <= WEIGHT_TOLERANCE * Math.max(Math.abs(x), Math.abs(y)))
            return 0;
        return Double.compare(x, y);
    }

    private void reportFanOut(String nodeId, int degree) {
        listener.onFanOutCapExceeded(nodeId, degree);
        fanOutWarnings.warn(String.format(
                "Node '%s' has %d relationships, above the fan-out cap of %d; traversal cost grows as cap^depth",
                nodeId, degree, limits.neighborCap()));
    }

    /** Best and lexicographically-smallest trails of one reached node. */
    private record Reach(Trail best, Trail lexMin) {
    }

    /**
     * Persistent singly-linked trail back to the source. Sharing prefixes keeps
     * a layer's allocations proportional to the edges it relaxes.
     */
    private static final class Trail {
        final String node;
        final Trail parent;
        final RelationshipEdge edge;
        final double weight;
        final int depth;

        Trail(String node, Trail parent, RelationshipEdge edge, double weight, int depth) {
            this.node = node;
            this.parent = parent;
            this.edge = edge;
            this.weight = weight;
            this.depth = depth;
        }

        List<String> nodeIds() {
            String[] ids = new String[depth + 1];
            Trail t = this;
            for (int k = depth; k >= 0; k--, t = t.parent)
                ids[k] = t.node;
            return Arrays.asList(ids);
        }

        List<RelationshipEdge> edges() {
            RelationshipEdge[] out = new RelationshipEdge[depth];
            Trail t = this;
            for (int k = depth - 1; k >= 0; k--, t = t.parent)
                out[k] = t.edge;
            return Arrays.asList(out);
        }

        // Both trails end at the same node and have the same length.
        static int compareIds(Trail a, Trail b) {
            if (a == b)
                return 0;
            List<String> x = a.nodeIds(), y = b.nodeIds();
            for (int k = 0; k < x.size(); k++) {
                int c = x.get(k).compareTo(y.get(k));
                if (c != 0)
                    return c;
            }
            return 0;
        }
    }
}
