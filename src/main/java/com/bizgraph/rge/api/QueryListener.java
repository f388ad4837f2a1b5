package com.bizgraph.rge.api;

/**
 * Observability hook for the query path.
 *
 * Callbacks run on request threads (and on the invalidation consumer thread
 * for {@link #onInvalidation}). Keep them cheap and non-blocking.
 */
public interface QueryListener {

    default void onCacheHit(QueryShape shape, String source) {
    }

    default void onCacheMiss(QueryShape shape, String source) {
    }

    /**
     * @param durationNanos wall time from request validation to response assembly
     */
    default void onQueryCompleted(QueryShape shape, long durationNanos) {
    }

    default void onQueryFailed(QueryShape shape, Throwable error) {
    }

    /** A traversal expanded a node whose degree exceeds the configured fan-out cap. */
    default void onFanOutCapExceeded(String nodeId, int degree) {
    }

    /**
     * @param changedIds number of distinct node ids in the coalesced batch
     * @param removed    cache entries removed eagerly
     */
    default void onInvalidation(int changedIds, int removed) {
    }
}
