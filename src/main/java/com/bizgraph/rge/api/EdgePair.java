package com.bizgraph.rge.api;

/**
 * Unordered pair of business ids. Normalized so that {@code low <= high}, which
 * makes {@code EdgePair.of(a, b).equals(EdgePair.of(b, a))}.
 */
public record EdgePair(String low, String high) {

    public EdgePair {
        if (low == null || high == null || low.isBlank() || high.isBlank())
            throw new IllegalArgumentException("Edge endpoints must not be blank");
        if (low.equals(high))
            throw new IllegalArgumentException("Self-relationship not allowed: " + low);
        if (low.compareTo(high) > 0) {
            String t = low;
            low = high;
            high = t;
        }
    }

    public static EdgePair of(String a, String b) {
        return new EdgePair(a, b);
    }

    public boolean touches(String id) {
        return low.equals(id) || high.equals(id);
    }

    /** Returns the endpoint opposite to {@code id}. */
    public String other(String id) {
        if (low.equals(id))
            return high;
        if (high.equals(id))
            return low;
        throw new IllegalArgumentException(id + " is not an endpoint of " + this);
    }

    @Override
    public String toString() {
        return low + "<->" + high;
    }
}
