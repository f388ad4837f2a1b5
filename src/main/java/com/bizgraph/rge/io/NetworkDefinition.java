package com.bizgraph.rge.io;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Data;

/**
 * POJO representation of a business network seed file.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class NetworkDefinition {
    private NetworkInfo network;

    /** Meta-information plus the businesses and relationships to load. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class NetworkInfo {
        private String name, version;
        private List<BusinessDef> businesses;
        private List<RelationshipDef> relationships;
    }

    /** Definition of a single business. {@code createdAt} defaults to load time. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class BusinessDef {
        private String id, name, category, location, sizeClass;
        private Instant createdAt;
    }

    /** Definition of a single relationship between two businesses. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class RelationshipDef {
        private String source, target, type, frequency;
        private BigDecimal transactionVolume;
        private Instant createdAt, lastTransaction;
    }
}
