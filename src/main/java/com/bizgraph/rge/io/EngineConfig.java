package com.bizgraph.rge.io;

import com.bizgraph.rge.api.WeightFunction;
import com.bizgraph.rge.engine.TraversalLimits;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Duration;
import java.util.Locale;

import lombok.Data;

/**
 * POJO representation of the engine configuration file ({@code bizgraph.json}).
 * Every field has a default, so an empty object is a valid configuration.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class EngineConfig {
    private Traversal traversal = new Traversal();
    private CacheSettings cache = new CacheSettings();
    private Invalidation invalidation = new Invalidation();
    private Store store = new Store();
    private Weight weight = new Weight();
    private Server server = new Server();

    /** Hop bounds and fan-out expectations. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Traversal {
        private int defaultMaxDepth = 3;
        private int maxDepthCeiling = 6;
        private int neighborCap = 100;
        private long defaultDeadlineMillis = 250;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class CacheSettings {
        private long ttlSeconds = 3600;
        private long maxEntries = 10_000;
        private long timeBucketMinutes = 60;
        private long singleFlightWaitMillis = 50;
    }

    /** {@code mode} is {@code disruptor} (background consumer) or {@code direct} (inline). */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Invalidation {
        private String mode = "disruptor";
        private int ringBufferSize = 1024;
        private long ackWaitMillis = 100;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Store {
        private int retryAttempts = 3;
        private long retryBackoffMillis = 20;
    }

    /** {@code function} is {@code saturating} (scale = half-saturation volume) or {@code linear} (scale = cap). */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Weight {
        private String function = "saturating";
        private double scale = 10_000;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Server {
        private int port = 7070;
    }

    public TraversalLimits traversalLimits() {
        return new TraversalLimits(traversal.defaultMaxDepth, traversal.maxDepthCeiling, traversal.neighborCap);
    }

    public WeightFunction weightFunction() {
        return switch (weight.function.toLowerCase(Locale.ROOT)) {
            case "saturating" -> WeightFunction.saturating(weight.scale);
            case "linear" -> WeightFunction.linear(weight.scale);
            default -> throw new IllegalArgumentException("Unknown weight function: " + weight.function);
        };
    }

    public boolean directInvalidation() {
        return "direct".equalsIgnoreCase(invalidation.mode);
    }

    public Duration cacheTtl() {
        return Duration.ofSeconds(cache.ttlSeconds);
    }

    public Duration timeBucket() {
        return Duration.ofMinutes(cache.timeBucketMinutes);
    }

    public Duration defaultDeadline() {
        return Duration.ofMillis(traversal.defaultDeadlineMillis);
    }

    /**
     * Fails fast on values that would only surface later as odd runtime
     * behaviour.
     *
     * @throws IllegalArgumentException describing the first invalid setting
     */
    public EngineConfig validate() {
        traversalLimits();
        weightFunction();
        if (cache.ttlSeconds <= 0)
            throw new IllegalArgumentException("cache.ttlSeconds must be > 0");
        if (cache.maxEntries <= 0)
            throw new IllegalArgumentException("cache.maxEntries must be > 0");
        if (cache.timeBucketMinutes <= 0)
            throw new IllegalArgumentException("cache.timeBucketMinutes must be > 0");
        if (cache.singleFlightWaitMillis < 0)
            throw new IllegalArgumentException("cache.singleFlightWaitMillis must be >= 0");
        if (traversal.defaultDeadlineMillis <= 0)
            throw new IllegalArgumentException("traversal.defaultDeadlineMillis must be > 0");
        if (Integer.bitCount(invalidation.ringBufferSize) != 1)
            throw new IllegalArgumentException("invalidation.ringBufferSize must be a power of 2");
        if (!directInvalidation() && !"disruptor".equalsIgnoreCase(invalidation.mode))
            throw new IllegalArgumentException("invalidation.mode must be 'disruptor' or 'direct'");
        if (store.retryAttempts < 1)
            throw new IllegalArgumentException("store.retryAttempts must be >= 1");
        return this;
    }
}
