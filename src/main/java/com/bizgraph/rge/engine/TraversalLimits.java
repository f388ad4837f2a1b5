package com.bizgraph.rge.engine;

import com.bizgraph.rge.api.InvalidDepthException;

/**
 * Bounds applied to every traversal.
 *
 * Worst-case work of a query is O(neighborCap ^ maxDepth) adjacency visits
 * when every node sits at the cap. The cap itself is advisory (nodes above it
 * are still expanded and reported), so the depth ceiling is what keeps the
 * worst case bounded and is enforced strictly.
 *
 * @param defaultMaxDepth depth used when a caller does not specify one
 * @param maxDepthCeiling hard upper bound for any requested depth
 * @param neighborCap     expected maximum degree of a business
 */
public record TraversalLimits(int defaultMaxDepth, int maxDepthCeiling, int neighborCap) {

    public static final TraversalLimits DEFAULT = new TraversalLimits(3, 6, 100);

    public TraversalLimits {
        if (maxDepthCeiling < 1)
            throw new IllegalArgumentException("maxDepthCeiling must be >= 1");
        if (defaultMaxDepth < 1 || defaultMaxDepth > maxDepthCeiling)
            throw new IllegalArgumentException("defaultMaxDepth must be within [1, " + maxDepthCeiling + "]");
        if (neighborCap < 1)
            throw new IllegalArgumentException("neighborCap must be >= 1");
    }

    /**
     * @throws InvalidDepthException if {@code depth} is outside [1, ceiling]
     */
    public int validateDepth(int depth) {
        if (depth <= 0 || depth > maxDepthCeiling)
            throw new InvalidDepthException(depth, maxDepthCeiling);
        return depth;
    }
}
