package com.bizgraph.rge.cache;

import com.bizgraph.rge.api.QueryShape;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Derives cache keys. The key is a pure function of the query and the time
 * bucket the clock currently falls in.
 */
public final class CacheKeys {
    private final Clock clock;
    private final long bucketMillis;

    public CacheKeys(Clock clock, Duration bucketWidth) {
        if (bucketWidth.isNegative() || bucketWidth.isZero())
            throw new IllegalArgumentException("bucket width must be positive: " + bucketWidth);
        this.clock = clock;
        this.bucketMillis = bucketWidth.toMillis();
    }

    public CacheKey path(String source, String target, int maxDepth) {
        return of(QueryShape.PATH, source, target, maxDepth, clock.instant(), bucketMillis);
    }

    public CacheKey neighborhood(String source, int maxDepth) {
        return of(QueryShape.NEIGHBORHOOD, source, null, maxDepth, clock.instant(), bucketMillis);
    }

    public CacheKey network(String businessId) {
        return of(QueryShape.NETWORK, businessId, null, 1, clock.instant(), bucketMillis);
    }

    public static CacheKey of(QueryShape shape, String source, String target, int maxDepth, Instant now,
            long bucketMillis) {
        return new CacheKey(shape, source, target, maxDepth, Math.floorDiv(now.toEpochMilli(), bucketMillis));
    }
}
