package com.bizgraph.rge.api;

import java.util.Locale;

/**
 * Kind of business relationship an edge records.
 *
 * The declaration order is also the tie-break order when two nodes are joined
 * by several edges of equal weight.
 */
public enum RelationshipType {
    VENDOR, CLIENT, PARTNER;

    /** Wire name as persisted in edge records ({@code vendor}, {@code client}, {@code partner}). */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static RelationshipType fromWire(String value) {
        if (value == null || value.isBlank())
            throw new IllegalArgumentException("relationship_type is required");
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown relationship_type: " + value, e);
        }
    }
}
