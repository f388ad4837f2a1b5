package com.bizgraph.rge.service;

import com.bizgraph.rge.api.ChangeKind;

/**
 * Acknowledgement of a mutation.
 *
 * @param applied             false if the store was left unchanged (e.g. deleting an absent edge)
 * @param storeVersion        store version after the write
 * @param sequence            invalidation sequence, or -1 when nothing was published
 * @param invalidationApplied true once one-hop cached results touching the change are gone;
 *                            false means the coordinator is still catching up and
 *                            will apply it shortly
 */
public record ChangeAck(ChangeKind kind, boolean applied, long storeVersion, long sequence,
        boolean invalidationApplied) {
}
