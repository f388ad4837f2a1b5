package com.bizgraph.rge.cache;

import com.bizgraph.rge.api.*;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Immutable cached value plus the bookkeeping needed to expire, order and
 * invalidate it. Entries are replaced or evicted, never modified.
 *
 * @param value           a {@link PathResult}, {@link Neighborhood} or {@link BusinessNetworkView}
 * @param insertedAt      when the computation that produced the value began
 * @param snapshotVersion store version the value was computed from
 * @param coveredNodes    every node id the value depends on (source, path nodes, neighbours)
 */
public record CacheEntry(CacheKey key, Object value, Duration ttl, Instant insertedAt, long snapshotVersion,
        Set<String> coveredNodes) {

    public CacheEntry {
        coveredNodes = Set.copyOf(coveredNodes);
    }

    public static CacheEntry of(CacheKey key, Object value, Duration ttl, Instant insertedAt, long snapshotVersion) {
        return new CacheEntry(key, value, ttl, insertedAt, snapshotVersion, coveredNodesOf(key, value));
    }

    public <T> T valueAs(Class<T> type) {
        return type.cast(value);
    }

    /** True when this entry was computed from a newer state than {@code other}. */
    public boolean isFresherThan(CacheEntry other) {
        if (snapshotVersion != other.snapshotVersion)
            return snapshotVersion > other.snapshotVersion;
        return !insertedAt.isBefore(other.insertedAt);
    }

    public boolean covers(String nodeId) {
        return coveredNodes.contains(nodeId);
    }

    static Set<String> coveredNodesOf(CacheKey key, Object value) {
        Set<String> ids = new LinkedHashSet<>();
        ids.add(key.source());
        if (key.target() != null)
            ids.add(key.target());
        if (value instanceof PathResult p) {
            ids.addAll(p.nodes());
        } else if (value instanceof Neighborhood n) {
            for (NeighborEntry e : n.entries())
                ids.addAll(e.path());
        } else if (value instanceof BusinessNetworkView v) {
            for (Adjacency a : v.relationships())
                ids.add(a.neighborId());
        } else {
            throw new IllegalArgumentException("Not a cacheable result: " + value.getClass().getName());
        }
        return ids;
    }
}
