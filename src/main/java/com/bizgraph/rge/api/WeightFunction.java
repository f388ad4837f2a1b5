package com.bizgraph.rge.api;

import java.math.BigDecimal;

/**
 * Maps a non-negative transaction volume to an edge weight in [0,1].
 * Implementations must be monotonic non-decreasing in volume.
 */
@FunctionalInterface
public interface WeightFunction {

    double weightOf(BigDecimal transactionVolume);

    /**
     * {@code v / (v + half)}: reaches 0.5 at {@code half} and approaches 1
     * asymptotically. Default for production data, where volumes are unbounded.
     */
    static WeightFunction saturating(double half) {
        if (!(half > 0))
            throw new IllegalArgumentException("half-saturation volume must be > 0");
        return v -> {
            double x = v.doubleValue();
            if (x <= 0)
                return 0.0;
            // Volumes beyond double range saturate.
            return Double.isInfinite(x) ? 1.0 : x / (x + half);
        };
    }

    /** {@code min(1, v / cap)}. */
    static WeightFunction linear(double cap) {
        if (!(cap > 0))
            throw new IllegalArgumentException("cap must be > 0");
        return v -> {
            double x = v.doubleValue();
            return x <= 0 ? 0.0 : Math.min(1.0, x / cap);
        };
    }
}
