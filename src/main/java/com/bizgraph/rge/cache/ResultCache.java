package com.bizgraph.rge.cache;

import java.util.Collection;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Memoization of traversal results.
 *
 * Each call is atomic on its own; nothing spans calls, so a miss followed by a
 * put is not exclusive and concurrent identical misses may both compute. The
 * cache only holds derived copies: losing any of it is always safe.
 */
public interface ResultCache {

    Optional<CacheEntry> get(CacheKey key);

    /**
     * Stores an entry unless a fresher one is already present for the key, or
     * unless a node the entry covers changed after the entry's snapshot.
     *
     * @return true if the entry is now the cached value for its key
     */
    boolean put(CacheEntry entry);

    /** Removes every entry whose key matches. Returns the number removed. */
    int invalidate(Predicate<CacheKey> keyPredicate);

    /** Removes every entry that matches, with access to the cached value. */
    int invalidateEntries(Predicate<CacheEntry> entryPredicate);

    /**
     * Records that the given nodes changed at {@code version}. Later puts of
     * entries computed from an older snapshot and covering one of them are
     * rejected.
     */
    void markChanged(Collection<String> nodeIds, long version);

    void invalidateAll();

    long size();
}
