package com.bizgraph.rge.service;

import com.bizgraph.rge.api.WeightFunction;

import java.time.Duration;

/**
 * @param cacheTtl         lifetime of every cached result
 * @param singleFlightWait longest a request waits for an identical in-flight
 *                         computation before computing on its own
 * @param ackWait          longest a mutation waits for its invalidation to be applied
 * @param weightFunction   maps transaction volume to edge weight
 */
public record ServiceOptions(Duration cacheTtl, Duration singleFlightWait, Duration ackWait,
        WeightFunction weightFunction) {
}
