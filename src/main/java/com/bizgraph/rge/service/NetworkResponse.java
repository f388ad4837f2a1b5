package com.bizgraph.rge.service;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import lombok.Data;

/**
 * Response envelope shared by every query endpoint.
 *
 * Field names are part of the external contract and must not change:
 * {@code status}, {@code data.business}, {@code data.relationships[].weight},
 * {@code data.relationships[].transaction_volume},
 * {@code metadata.total_relationships}, {@code metadata.query_time_ms}.
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({ "status", "data", "metadata", "error" })
public final class NetworkResponse {
    public static final String SUCCESS = "success";
    public static final String NO_PATH = "no_path";
    public static final String ERROR = "error";

    private String status;
    private Payload data;
    private Metadata metadata;
    private ErrorBody error;

    /** Query payload. Only the parts relevant to the query shape are set. */
    @Data
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static final class Payload {
        private BusinessView business;
        private List<RelationshipView> relationships;
        private PathView path;
        private List<NeighborView> neighbors;
    }

    @Data
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static final class BusinessView {
        private String id, name, category, location;
        @JsonProperty("size_class")
        private String sizeClass;
        @JsonProperty("created_at")
        private Instant createdAt;
        @JsonProperty("updated_at")
        private Instant updatedAt;
    }

    /** One relationship, oriented from {@code source_id} (the side nearer the queried business). */
    @Data
    public static final class RelationshipView {
        @JsonProperty("source_id")
        private String sourceId;
        @JsonProperty("business_id")
        private String businessId;
        @JsonProperty("relationship_type")
        private String relationshipType;
        private double weight;
        @JsonProperty("transaction_volume")
        private BigDecimal transactionVolume;
        private String frequency;
        @JsonProperty("created_at")
        private Instant createdAt;
        @JsonProperty("last_transaction")
        private Instant lastTransaction;
    }

    @Data
    public static final class PathView {
        private String source, target;
        private List<String> nodes;
        private int hops;
        private double weight;
        @JsonProperty("max_depth")
        private int maxDepth;
    }

    @Data
    public static final class NeighborView {
        @JsonProperty("business_id")
        private String businessId;
        private int distance;
        private double weight;
        private List<String> path;
    }

    @Data
    public static final class Metadata {
        @JsonProperty("total_relationships")
        private long totalRelationships;
        @JsonProperty("query_time_ms")
        private long queryTimeMs;
        @JsonProperty("cache_hit")
        private boolean cacheHit;
        @JsonProperty("snapshot_version")
        private long snapshotVersion;
    }

    @Data
    public static final class ErrorBody {
        private String code;
        private String message;
    }
}
