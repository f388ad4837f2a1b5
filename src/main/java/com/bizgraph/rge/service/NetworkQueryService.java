package com.bizgraph.rge.service;

import com.bizgraph.rge.api.*;
import com.bizgraph.rge.cache.CacheEntry;
import com.bizgraph.rge.cache.CacheKey;
import com.bizgraph.rge.cache.CacheKeys;
import com.bizgraph.rge.cache.ResultCache;
import com.bizgraph.rge.engine.PathFinder;
import com.bizgraph.rge.engine.TraversalLimits;
import com.bizgraph.rge.wiring.InvalidationSink;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * Query and mutation entry point of the engine.
 *
 * <h2>Reads</h2>
 * Validate, look the key up in the {@link ResultCache}, and on a miss compute
 * against one store snapshot and write the result through. No lock is held
 * while the store is read. Identical concurrent misses are coalesced on a
 * best-effort basis: followers wait for the leader at most
 * {@code singleFlightWait} (and never past their own deadline), then compute
 * independently. Duplicate work is acceptable; blocking is not.
 *
 * <h2>Writes</h2>
 * Apply the change to the store, publish an invalidation, and wait (bounded)
 * until the coordinator has removed the affected one-hop results, so the next
 * read of any of them reflects the change.
 *
 * Thread-safe. Collaborators are passed in explicitly; nothing here reaches
 * for process-wide state.
 */
public final class NetworkQueryService {
    private static final Logger log = LogManager.getLogger(NetworkQueryService.class);

    private final GraphStore store;
    private final PathFinder finder;
    private final ResultCache cache;
    private final CacheKeys keys;
    private final InvalidationSink invalidations;
    private final QueryListener listener;
    private final ServiceOptions options;
    private final Clock clock;

    private final ConcurrentMap<CacheKey, CompletableFuture<CacheEntry>> inFlight = new ConcurrentHashMap<>();

    public NetworkQueryService(GraphStore store, PathFinder finder, ResultCache cache, CacheKeys keys,
            InvalidationSink invalidations, QueryListener listener, ServiceOptions options, Clock clock) {
        this.store = store;
        this.finder = finder;
        this.cache = cache;
        this.keys = keys;
        this.invalidations = invalidations;
        this.listener = listener;
        this.options = options;
        this.clock = clock;
    }

    public TraversalLimits limits() {
        return finder.limits();
    }

    // ── Queries ──────────────────────────────────────────────────────────

    public QueryOutcome<PathResult> findPath(String source, String target, Deadline deadline) {
        return findPath(source, target, limits().defaultMaxDepth(), deadline);
    }

    /**
     * @throws InvalidDepthException  if maxDepth is outside [1, ceiling]
     * @throws UnknownEntityException if source or target is absent
     * @throws QueryTimeoutException  if the deadline passes first
     */
    public QueryOutcome<PathResult> findPath(String source, String target, int maxDepth, Deadline deadline) {
        return run(QueryShape.PATH, source, PathResult.class, deadline, () -> {
            requireId(target, "target");
            limits().validateDepth(maxDepth);
            return keys.path(source, target, maxDepth);
        }, snap -> finder.findPath(snap, source, target, maxDepth, deadline));
    }

    public QueryOutcome<Neighborhood> neighborhood(String source, Deadline deadline) {
        return neighborhood(source, limits().defaultMaxDepth(), deadline);
    }

    /**
     * @throws InvalidDepthException  if maxDepth is outside [1, ceiling]
     * @throws UnknownEntityException if source is absent
     * @throws QueryTimeoutException  if the deadline passes first
     */
    public QueryOutcome<Neighborhood> neighborhood(String source, int maxDepth, Deadline deadline) {
        return run(QueryShape.NEIGHBORHOOD, source, Neighborhood.class, deadline, () -> {
            limits().validateDepth(maxDepth);
            return keys.neighborhood(source, maxDepth);
        }, snap -> finder.neighborhood(snap, source, maxDepth, deadline));
    }

    /**
     * A business and its direct relationships.
     *
     * @throws UnknownEntityException if the business is absent
     */
    public QueryOutcome<BusinessNetworkView> network(String businessId, Deadline deadline) {
        return run(QueryShape.NETWORK, businessId, BusinessNetworkView.class, deadline,
                () -> keys.network(businessId), snap -> {
                    BusinessNode node = snap.node(businessId);
                    List<Adjacency> relationships = snap.neighbors(businessId);
                    deadline.check("network view");
                    return new BusinessNetworkView(node, relationships);
                });
    }

    /**
     * Current profile of a business, read from the store rather than the
     * cache. Used to render envelopes.
     */
    public Optional<BusinessNode> business(String id, Deadline deadline) {
        return store.snapshot(deadline).findNode(id);
    }

    // ── Mutations ────────────────────────────────────────────────────────

    /**
     * Applies a relationship change and waits for its invalidation.
     *
     * @throws UnknownEntityException if either business is absent
     * @throws EdgeConflictException  if a create collides with an active record
     */
    public ChangeAck applyRelationshipChange(RelationshipChange change, Deadline deadline) {
        deadline.check("relationship change");
        EdgePair pair = change.pair();
        WriteResult write = switch (change.kind()) {
            case CREATED -> store.upsertEdge(change.toEdge(options.weightFunction()), change.overwrite());
            case UPDATED -> store.upsertEdge(change.toEdge(options.weightFunction()), true);
            case DELETED -> store.deleteEdge(pair, change.type());
        };
        log.debug("Applied {} {} {} -> {} (v{})", change.kind(), change.type().wireName(), pair,
                write.applied() ? "written" : "no-op", write.version());
        if (!write.applied())
            return new ChangeAck(write.kind(), false, write.version(), -1, true);

        long timestamp = change.lastTransaction() != null ? change.lastTransaction().toEpochMilli()
                : clock.millis();
        try {
            long seq = invalidations.publishEdgeChange(pair, change.type(), write.kind(), timestamp,
                    write.version(), deadline);
            return new ChangeAck(write.kind(), true, write.version(), seq, awaitInvalidation(seq, deadline));
        } catch (QueryTimeoutException e) {
            degradeToFullFlush(List.of(pair.low(), pair.high()), write.version(), e);
            return new ChangeAck(write.kind(), true, write.version(), -1, true);
        }
    }

    /** Registers a business or refreshes its profile. */
    public ChangeAck upsertBusiness(BusinessNode node, Deadline deadline) {
        deadline.check("business upsert");
        WriteResult write = store.putNode(node);
        try {
            long seq = invalidations.publishNodeChange(node.id(), write.kind(), clock.millis(), write.version(),
                    deadline);
            return new ChangeAck(write.kind(), true, write.version(), seq, awaitInvalidation(seq, deadline));
        } catch (QueryTimeoutException e) {
            degradeToFullFlush(List.of(node.id()), write.version(), e);
            return new ChangeAck(write.kind(), true, write.version(), -1, true);
        }
    }

    private boolean awaitInvalidation(long seq, Deadline deadline) {
        boolean applied = invalidations.awaitApplied(seq, deadline.capped(options.ackWait()));
        if (!applied)
            log.warn("Invalidation seq={} not yet applied when acknowledging; cached views converge shortly", seq);
        return applied;
    }

    // The ring could not take the event in time. Dropping the cache keeps reads correct.
    private void degradeToFullFlush(List<String> ids, long version, QueryTimeoutException cause) {
        log.warn("Could not publish invalidation for {} (v{}): {}; flushing result cache", ids, version,
                cause.getMessage());
        cache.markChanged(ids, version);
        cache.invalidateAll();
    }

    // ── Query pipeline ───────────────────────────────────────────────────

    private <T> QueryOutcome<T> run(QueryShape shape, String source, Class<T> type, Deadline deadline,
            KeyFactory keyFactory, Function<GraphSnapshot, T> compute) {
        long start = System.nanoTime();
        try {
            requireId(source, "source");
            CacheKey key = keyFactory.key();
            deadline.check(shape.name().toLowerCase(Locale.ROOT) + " lookup");

            Optional<CacheEntry> cached = cache.get(key);
            CacheEntry entry;
            boolean hit = cached.isPresent();
            if (hit) {
                listener.onCacheHit(shape, source);
                entry = cached.get();
            } else {
                listener.onCacheMiss(shape, source);
                entry = computeCoalesced(key, deadline, compute);
            }

            long elapsed = System.nanoTime() - start;
            listener.onQueryCompleted(shape, elapsed);
            return new QueryOutcome<>(entry.valueAs(type), hit, entry.snapshotVersion(), elapsed);
        } catch (RuntimeException e) {
            listener.onQueryFailed(shape, e);
            throw e;
        }
    }

    private <T> CacheEntry computeCoalesced(CacheKey key, Deadline deadline, Function<GraphSnapshot, T> compute) {
        CompletableFuture<CacheEntry> mine = new CompletableFuture<>();
        CompletableFuture<CacheEntry> leader = inFlight.putIfAbsent(key, mine);
        if (leader != null) {
            Optional<CacheEntry> shared = awaitLeader(key, leader, deadline);
            if (shared.isPresent())
                return shared.get();
            return computeAndCache(key, deadline, compute);
        }
        try {
            CacheEntry entry = computeAndCache(key, deadline, compute);
            mine.complete(entry);
            return entry;
        } catch (RuntimeException e) {
            mine.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(key, mine);
        }
    }

    private Optional<CacheEntry> awaitLeader(CacheKey key, CompletableFuture<CacheEntry> leader,
            Deadline deadline) {
        Deadline wait = deadline.capped(options.singleFlightWait());
        try {
            return Optional.of(leader.get(Math.max(0, wait.remainingNanos()), TimeUnit.NANOSECONDS));
        } catch (TimeoutException e) {
            log.debug("Leader for {} still running after {}; computing independently", key,
                    options.singleFlightWait());
            return Optional.empty();
        } catch (ExecutionException e) {
            // Caller errors (unknown id, bad depth) would repeat; anything else is worth our own attempt.
            if (e.getCause() instanceof GraphQueryException gqe && !(gqe instanceof QueryTimeoutException)
                    && !(gqe instanceof TransientStoreException))
                throw gqe;
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new QueryTimeoutException("Interrupted while waiting for " + key);
        }
    }

    private <T> CacheEntry computeAndCache(CacheKey key, Deadline deadline, Function<GraphSnapshot, T> compute) {
        Instant startedAt = clock.instant();
        GraphSnapshot snapshot = store.snapshot(deadline);
        T value = compute.apply(snapshot);
        CacheEntry entry = CacheEntry.of(key, value, options.cacheTtl(), startedAt, snapshot.version());
        if (!cache.put(entry))
            log.debug("Cache kept a fresher entry for {}", key);
        return entry;
    }

    private static void requireId(String id, String what) {
        if (id == null || id.isBlank())
            throw new GraphQueryException(ErrorCode.INVALID_ARGUMENT, what + " id must not be blank");
    }

    @FunctionalInterface
    private interface KeyFactory {
        CacheKey key();
    }
}
