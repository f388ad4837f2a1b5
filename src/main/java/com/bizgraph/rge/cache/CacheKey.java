package com.bizgraph.rge.cache;

import com.bizgraph.rge.api.QueryShape;

/**
 * Identity of a cached query result.
 *
 * @param target null for shapes without a target
 * @param bucket coarse time bucket the query ran in; moving to the next bucket
 *               naturally orphans old entries even without invalidation
 */
public record CacheKey(QueryShape shape, String source, String target, int maxDepth, long bucket) {

    /** True when the result describes at most the source's direct relationships. */
    public boolean isOneHop() {
        return maxDepth == 1;
    }

    @Override
    public String toString() {
        return shape + "(" + source + (target == null ? "" : "->" + target) + ", d=" + maxDepth + ", b=" + bucket
                + ")";
    }
}
