package com.bizgraph.rge.api;

/**
 * Outcome of a store write.
 *
 * @param kind    what happened to the record
 * @param applied false when the write was a no-op (e.g. deleting an absent edge)
 * @param version store version after the write
 */
public record WriteResult(ChangeKind kind, boolean applied, long version) {
}
