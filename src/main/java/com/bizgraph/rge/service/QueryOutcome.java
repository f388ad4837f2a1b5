package com.bizgraph.rge.service;

/**
 * A query answer plus how it was produced.
 *
 * @param snapshotVersion store version the value was computed from
 * @param queryTimeNanos  time spent serving this request
 */
public record QueryOutcome<T>(T value, boolean cacheHit, long snapshotVersion, long queryTimeNanos) {

    public long queryTimeMillis() {
        return queryTimeNanos / 1_000_000;
    }
}
