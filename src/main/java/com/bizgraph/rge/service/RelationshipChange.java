package com.bizgraph.rge.service;

import com.bizgraph.rge.api.*;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

/**
 * A relationship mutation as delivered by the ingestion side.
 *
 * <ul>
 * <li>{@code CREATED}: insert; fails with a conflict if the pair already has
 * an active record of this type, unless {@code overwrite} is set.</li>
 * <li>{@code UPDATED}: insert or replace.</li>
 * <li>{@code DELETED}: remove; volume and frequency are ignored.</li>
 * </ul>
 */
public record RelationshipChange(ChangeKind kind, String sourceId, String targetId, RelationshipType type,
        BigDecimal transactionVolume, Frequency frequency, Instant createdAt, Instant lastTransaction,
        boolean overwrite) {

    public RelationshipChange {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(type, "relationship_type");
        if (kind != ChangeKind.DELETED) {
            Objects.requireNonNull(transactionVolume, "transaction_volume");
            Objects.requireNonNull(createdAt, "created_at");
        }
    }

    public static RelationshipChange created(String a, String b, RelationshipType type, BigDecimal volume,
            Frequency frequency, Instant at) {
        return new RelationshipChange(ChangeKind.CREATED, a, b, type, volume, frequency, at, at, false);
    }

    public static RelationshipChange updated(String a, String b, RelationshipType type, BigDecimal volume,
            Frequency frequency, Instant createdAt, Instant lastTransaction) {
        return new RelationshipChange(ChangeKind.UPDATED, a, b, type, volume, frequency, createdAt,
                lastTransaction, true);
    }

    public static RelationshipChange deleted(String a, String b, RelationshipType type) {
        return new RelationshipChange(ChangeKind.DELETED, a, b, type, null, null, null, null, false);
    }

    public EdgePair pair() {
        return EdgePair.of(sourceId, targetId);
    }

    public RelationshipEdge toEdge(WeightFunction weightFn) {
        return RelationshipEdge.create(sourceId, targetId, type, transactionVolume, frequency, createdAt,
                lastTransaction, weightFn);
    }
}
