package com.bizgraph.rge.api;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

/**
 * Undirected, weighted relationship record between two businesses.
 *
 * The weight is derived from the transaction volume by a {@link WeightFunction}
 * at construction time and is always within [0,1]. At most one active record
 * exists per (pair, type); the store enforces that.
 */
public record RelationshipEdge(EdgePair pair, RelationshipType type, BigDecimal transactionVolume,
        Frequency frequency, Instant createdAt, Instant lastTransaction, double weight) {

    public RelationshipEdge {
        Objects.requireNonNull(pair, "pair");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(transactionVolume, "transactionVolume");
        Objects.requireNonNull(createdAt, "createdAt");
        if (transactionVolume.signum() < 0)
            throw new IllegalArgumentException("transaction_volume must be >= 0: " + transactionVolume);
        if (!(weight >= 0.0 && weight <= 1.0))
            throw new IllegalArgumentException("weight must be within [0,1]: " + weight);
        if (frequency == null)
            frequency = Frequency.AD_HOC;
        if (lastTransaction == null)
            lastTransaction = createdAt;
    }

    public static RelationshipEdge create(String a, String b, RelationshipType type, BigDecimal volume,
            Frequency frequency, Instant createdAt, Instant lastTransaction, WeightFunction weightFn) {
        return new RelationshipEdge(EdgePair.of(a, b), type, volume, frequency, createdAt, lastTransaction,
                weightFn.weightOf(volume));
    }

    public boolean touches(String id) {
        return pair.touches(id);
    }

    public String other(String id) {
        return pair.other(id);
    }
}
