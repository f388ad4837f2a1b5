package com.bizgraph.rge;

import com.bizgraph.rge.api.*;
import com.bizgraph.rge.cache.CacheKeys;
import com.bizgraph.rge.cache.CaffeineResultCache;
import com.bizgraph.rge.cache.ResultCache;
import com.bizgraph.rge.engine.PathFinder;
import com.bizgraph.rge.io.EngineConfig;
import com.bizgraph.rge.io.NetworkDefinition;
import com.bizgraph.rge.io.NetworkDefinitionLoader;
import com.bizgraph.rge.service.NetworkQueryService;
import com.bizgraph.rge.service.ServiceOptions;
import com.bizgraph.rge.store.InMemoryGraphStore;
import com.bizgraph.rge.store.RetryingGraphStore;
import com.bizgraph.rge.util.CompositeQueryListener;
import com.bizgraph.rge.util.QueryStatsListener;
import com.bizgraph.rge.web.NetworkQueryServer;
import com.bizgraph.rge.wiring.DirectInvalidationSink;
import com.bizgraph.rge.wiring.DisruptorInvalidationSink;
import com.bizgraph.rge.wiring.InvalidationCoordinator;
import com.bizgraph.rge.wiring.InvalidationSink;

import com.github.benmanes.caffeine.cache.Ticker;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Relationship graph engine for a business network.
 *
 * <h2>Overview</h2>
 * <p>
 * Answers bounded-depth questions over a weighted, undirected multigraph of
 * businesses and their vendor/client/partner relationships:
 * <ul>
 * <li><b>Paths:</b> the best connection between two businesses within N
 * hops (fewest hops, then strongest, then lexicographically first).</li>
 * <li><b>Neighbourhoods:</b> everyone within N hops, with distance and
 * strength of the best path.</li>
 * <li><b>Networks:</b> a business and its direct relationships.</li>
 * </ul>
 *
 * <h3>Moving parts</h3>
 * <ul>
 * <li>{@link GraphStore}: canonical state, snapshot reads.</li>
 * <li>{@link PathFinder}: layered BFS over one snapshot.</li>
 * <li>{@link ResultCache}: TTL + size bounded memoization.</li>
 * <li>{@link InvalidationCoordinator}: consumes change events from an LMAX
 * Disruptor ring buffer and evicts affected results.</li>
 * <li>{@link NetworkQueryService}: the entry point tying them together.</li>
 * </ul>
 *
 * This class only wires the parts from an {@link EngineConfig} and owns their
 * lifecycle. Use {@link #builder()}.
 */
public final class BusinessNetwork implements AutoCloseable {
    private static final Logger log = LogManager.getLogger(BusinessNetwork.class);

    private final EngineConfig config;
    private final GraphStore store;
    private final ResultCache cache;
    private final InvalidationSink invalidations;
    private final NetworkQueryService queries;
    private final QueryStatsListener stats;
    private final CompositeQueryListener listeners;
    private NetworkQueryServer server;

    private BusinessNetwork(Builder b) {
        this.config = b.config.validate();
        this.stats = new QueryStatsListener();
        this.listeners = new CompositeQueryListener();
        listeners.addForComposite(stats);
        if (b.extraListener != null)
            listeners.addForComposite(b.extraListener);

        GraphStore canonical = b.store != null ? b.store : new InMemoryGraphStore();
        this.store = new RetryingGraphStore(canonical, config.getStore().getRetryAttempts(),
                Duration.ofMillis(config.getStore().getRetryBackoffMillis()));

        this.cache = new CaffeineResultCache(config.getCache().getMaxEntries(), b.ticker, Runnable::run,
                config.cacheTtl());
        InvalidationCoordinator coordinator = new InvalidationCoordinator(cache, listeners);
        this.invalidations = config.directInvalidation()
                ? new DirectInvalidationSink(coordinator)
                : new DisruptorInvalidationSink(coordinator, config.getInvalidation().getRingBufferSize());

        PathFinder finder = new PathFinder(config.traversalLimits(), listeners);
        ServiceOptions options = new ServiceOptions(config.cacheTtl(),
                Duration.ofMillis(config.getCache().getSingleFlightWaitMillis()),
                Duration.ofMillis(config.getInvalidation().getAckWaitMillis()),
                config.weightFunction());
        this.queries = new NetworkQueryService(store, finder, cache, new CacheKeys(b.clock, config.timeBucket()),
                invalidations, listeners, options, b.clock);

        log.info("Business network engine ready (maxDepth={}..{}, cacheTtl={}, invalidation={})",
                config.getTraversal().getDefaultMaxDepth(), config.getTraversal().getMaxDepthCeiling(),
                config.cacheTtl(), config.getInvalidation().getMode());
    }

    /**
     * Entry point: create a new builder.
     *
     * @return a builder with default configuration and system clocks
     */
    public static Builder builder() {
        return new Builder();
    }

    public NetworkQueryService queries() {
        return queries;
    }

    public GraphStore store() {
        return store;
    }

    public ResultCache cache() {
        return cache;
    }

    public QueryStatsListener stats() {
        return stats;
    }

    public EngineConfig config() {
        return config;
    }

    /** Registers an additional listener alongside the built-in statistics. */
    public void addListener(QueryListener listener) {
        listeners.addForComposite(listener);
    }

    /** A deadline using the configured default request budget. */
    public Deadline newDeadline() {
        return Deadline.after(config.defaultDeadline());
    }

    /**
     * Loads a seed definition straight into the store and clears the result
     * cache. Intended for start-up; bulk loads bypass the invalidation ring, so
     * live changes should go through {@link NetworkQueryService} instead.
     */
    public NetworkDefinitionLoader.LoadSummary load(NetworkDefinition definition) {
        NetworkDefinitionLoader.LoadSummary summary = NetworkDefinitionLoader.load(definition, store,
                config.weightFunction(), Instant.now());
        cache.invalidateAll();
        return summary;
    }

    /**
     * Starts the HTTP surface.
     *
     * @param port port to bind, 0 for an ephemeral one
     */
    public synchronized NetworkQueryServer startServer(int port) {
        if (server != null)
            throw new IllegalStateException("Server already running on port " + server.port());
        server = new NetworkQueryServer(queries, stats, config.defaultDeadline());
        server.start(port);
        return server;
    }

    @Override
    public synchronized void close() {
        if (server != null) {
            server.stop();
            server = null;
        }
        invalidations.close();
        log.info("Business network engine stopped");
    }

    /** Builder for {@link BusinessNetwork}. */
    public static final class Builder {
        private EngineConfig config = new EngineConfig();
        private Clock clock = Clock.systemUTC();
        private Ticker ticker = Ticker.systemTicker();
        private GraphStore store;
        private QueryListener extraListener;

        public Builder config(EngineConfig config) {
            this.config = config;
            return this;
        }

        /** Clock for cache time buckets and timestamps. */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /** Time source for cache expiry. */
        public Builder ticker(Ticker ticker) {
            this.ticker = ticker;
            return this;
        }

        /** Canonical store to use instead of a fresh in-memory one. */
        public Builder store(GraphStore store) {
            this.store = store;
            return this;
        }

        public Builder listener(QueryListener listener) {
            this.extraListener = listener;
            return this;
        }

        public BusinessNetwork build() {
            return new BusinessNetwork(this);
        }
    }
}
