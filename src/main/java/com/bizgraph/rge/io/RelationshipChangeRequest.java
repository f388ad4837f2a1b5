package com.bizgraph.rge.io;

import com.bizgraph.rge.api.ChangeKind;
import com.bizgraph.rge.api.Frequency;
import com.bizgraph.rge.api.RelationshipType;
import com.bizgraph.rge.service.RelationshipChange;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Locale;

import lombok.Data;

/**
 * Wire form of a relationship change, using the persisted edge record field
 * names ({@code transaction_volume}, {@code relationship_type}, ...).
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class RelationshipChangeRequest {
    /** {@code created}, {@code updated} or {@code deleted}. */
    private String change;
    @JsonProperty("source_id")
    private String sourceId;
    @JsonProperty("target_id")
    private String targetId;
    @JsonProperty("relationship_type")
    private String relationshipType;
    @JsonProperty("transaction_volume")
    private BigDecimal transactionVolume;
    private String frequency;
    @JsonProperty("created_at")
    private Instant createdAt;
    @JsonProperty("last_transaction")
    private Instant lastTransaction;
    private boolean overwrite;

    /**
     * @param now used for missing timestamps
     * @throws IllegalArgumentException on a missing or unknown field value
     */
    public RelationshipChange toChange(Instant now) {
        if (change == null)
            throw new IllegalArgumentException("change is required");
        ChangeKind kind;
        try {
            kind = ChangeKind.valueOf(change.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown change: " + change, e);
        }
        RelationshipType type = RelationshipType.fromWire(relationshipType);
        if (kind == ChangeKind.DELETED)
            return RelationshipChange.deleted(sourceId, targetId, type);
        if (transactionVolume == null)
            throw new IllegalArgumentException("transaction_volume is required");
        Instant created = createdAt != null ? createdAt : now;
        Instant last = lastTransaction != null ? lastTransaction : created;
        return new RelationshipChange(kind, sourceId, targetId, type, transactionVolume,
                Frequency.fromWire(frequency), created, last, overwrite || kind == ChangeKind.UPDATED);
    }
}
