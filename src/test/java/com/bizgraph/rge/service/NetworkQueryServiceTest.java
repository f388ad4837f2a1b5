package com.bizgraph.rge.service;

import com.bizgraph.rge.api.*;
import com.bizgraph.rge.cache.CacheKeys;
import com.bizgraph.rge.cache.CaffeineResultCache;
import com.bizgraph.rge.engine.PathFinder;
import com.bizgraph.rge.engine.TraversalLimits;
import com.bizgraph.rge.store.InMemoryGraphStore;
import com.bizgraph.rge.util.QueryStatsListener;
import com.bizgraph.rge.wiring.DirectInvalidationSink;
import com.bizgraph.rge.wiring.DisruptorInvalidationSink;
import com.bizgraph.rge.wiring.InvalidationCoordinator;
import com.bizgraph.rge.wiring.InvalidationSink;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static com.bizgraph.rge.SampleGraphs.*;
import static org.junit.Assert.*;

public class NetworkQueryServiceTest {

    private static final Duration TTL = Duration.ofMinutes(30);

    private InMemoryGraphStore store;
    private CaffeineResultCache cache;
    private AtomicLong ticker;
    private QueryStatsListener stats;
    private InvalidationSink sink;
    private NetworkQueryService service;

    @Before
    public void setUp() {
        store = triangle();
        ticker = new AtomicLong();
        cache = new CaffeineResultCache(1000, ticker::get, Runnable::run);
        stats = new QueryStatsListener();
        sink = new DirectInvalidationSink(new InvalidationCoordinator(cache, stats));
        service = newService(sink);
    }

    @After
    public void tearDown() {
        sink.close();
    }

    private NetworkQueryService newService(InvalidationSink invalidations) {
        return new NetworkQueryService(store, new PathFinder(TraversalLimits.DEFAULT, stats), cache,
                new CacheKeys(Clock.fixed(T0, ZoneOffset.UTC), Duration.ofHours(1)), invalidations, stats,
                new ServiceOptions(TTL, Duration.ofMillis(50), Duration.ofSeconds(2), WEIGHTS),
                Clock.fixed(T0, ZoneOffset.UTC));
    }

    private RelationshipChange create(String a, String b, RelationshipType type, long volume) {
        return RelationshipChange.created(a, b, type, BigDecimal.valueOf(volume), Frequency.WEEKLY, T0);
    }

    @Test
    public void testFindPathIsServedFromCacheOnRepeat() {
        QueryOutcome<PathResult> first = service.findPath("A", "C", 2, relaxed());
        QueryOutcome<PathResult> second = service.findPath("A", "C", 2, relaxed());

        assertFalse(first.cacheHit());
        assertTrue(second.cacheHit());
        assertEquals(List.of("A", "C"), first.value().nodes());
        assertEquals(first.value(), second.value());
        assertEquals(first.snapshotVersion(), second.snapshotVersion());
        assertEquals(1, stats.hits(QueryShape.PATH));
        assertEquals(1, stats.misses(QueryShape.PATH));
    }

    @Test
    public void testDefaultDepthIsUsedWhenOmitted() {
        QueryOutcome<Neighborhood> n = service.neighborhood("A", relaxed());
        assertEquals(TraversalLimits.DEFAULT.defaultMaxDepth(), n.value().maxDepth());
        assertEquals(TraversalLimits.DEFAULT.defaultMaxDepth(), service.findPath("A", "B", relaxed()).value().maxDepth());
    }

    @Test
    public void testOneHopResultsReflectChangeOnNextRead() {
        addNodes(store, "D");
        assertEquals(2, service.neighborhood("A", 1, relaxed()).value().size());
        assertEquals(2, service.network("A", relaxed()).value().relationships().size());
        assertFalse(service.findPath("A", "D", 1, relaxed()).value().found());

        ChangeAck ack = service.applyRelationshipChange(create("A", "D", RelationshipType.CLIENT, 700), relaxed());
        assertTrue(ack.applied());
        assertTrue(ack.invalidationApplied());
        assertEquals(ChangeKind.CREATED, ack.kind());

        QueryOutcome<Neighborhood> n = service.neighborhood("A", 1, relaxed());
        assertFalse(n.cacheHit());
        assertEquals(0.7, n.value().entry("D").orElseThrow().weight(), 1e-9);
        assertEquals(3, service.network("A", relaxed()).value().relationships().size());
        assertTrue(service.findPath("A", "D", 1, relaxed()).value().found());
    }

    @Test
    public void testDeletedRelationshipDisappearsFromDirectNetwork() {
        service.network("B", relaxed());
        service.applyRelationshipChange(RelationshipChange.deleted("C", "B", RelationshipType.CLIENT), relaxed());

        QueryOutcome<BusinessNetworkView> view = service.network("B", relaxed());
        assertFalse(view.cacheHit());
        assertEquals(1, view.value().relationships().size());
        assertEquals("A", view.value().relationships().get(0).neighborId());
    }

    @Test
    public void testDeepResultsConvergeWithinTtl() {
        addNodes(store, "D");
        link(store, "C", "D", RelationshipType.VENDOR, 400);
        assertEquals(3, service.neighborhood("A", 2, relaxed()).value().size());

        service.applyRelationshipChange(RelationshipChange.deleted("C", "D", RelationshipType.VENDOR), relaxed());

        QueryOutcome<Neighborhood> stale = service.neighborhood("A", 2, relaxed());
        assertTrue(stale.cacheHit());
        assertEquals(3, stale.value().size());

        ticker.addAndGet(TTL.toNanos() + 1);
        QueryOutcome<Neighborhood> fresh = service.neighborhood("A", 2, relaxed());
        assertFalse(fresh.cacheHit());
        assertEquals(2, fresh.value().size());
    }

    @Test
    public void testNoPathIsCachedLikeAnyResult() {
        addNodes(store, "island");
        assertFalse(service.findPath("A", "island", 3, relaxed()).value().found());
        QueryOutcome<PathResult> again = service.findPath("A", "island", 3, relaxed());
        assertTrue(again.cacheHit());
        assertEquals(-1, again.value().hops());
    }

    @Test
    public void testValidationFailures() {
        try {
            service.findPath("X", "Y", 0, relaxed());
            fail();
        } catch (InvalidDepthException expected) {
            assertEquals(400, expected.code().httpStatus());
        }
        try {
            service.neighborhood(" ", 1, relaxed());
            fail();
        } catch (GraphQueryException e) {
            assertEquals(ErrorCode.INVALID_ARGUMENT, e.code());
        }
        try {
            service.network("ghost", relaxed());
            fail();
        } catch (UnknownEntityException e) {
            assertEquals(404, e.code().httpStatus());
        }
        assertEquals(3, stats.failedQueries());
        assertEquals(0, cache.size());
    }

    @Test
    public void testTimeoutCachesNothing() {
        AtomicLong nanos = new AtomicLong();
        Deadline deadline = Deadline.after(Duration.ofMillis(1), nanos::get);
        nanos.set(Duration.ofMillis(5).toNanos());

        try {
            service.neighborhood("A", 3, deadline);
            fail();
        } catch (QueryTimeoutException e) {
            assertEquals(504, e.code().httpStatus());
        }
        assertEquals(0, cache.size());
    }

    @Test
    public void testCreateConflictAndOverwrite() {
        try {
            service.applyRelationshipChange(create("B", "A", RelationshipType.VENDOR, 100), relaxed());
            fail();
        } catch (EdgeConflictException e) {
            assertEquals(409, e.code().httpStatus());
        }

        RelationshipChange overwrite = new RelationshipChange(ChangeKind.CREATED, "B", "A", RelationshipType.VENDOR,
                BigDecimal.valueOf(100), Frequency.DAILY, T0, T0, true);
        ChangeAck ack = service.applyRelationshipChange(overwrite, relaxed());
        assertEquals(ChangeKind.UPDATED, ack.kind());
        assertEquals(0.1, service.findPath("A", "B", 1, relaxed()).value().weight(), 1e-9);
    }

    @Test
    public void testDeletingAbsentRelationshipIsANoOp() {
        long before = store.version();
        ChangeAck ack = service.applyRelationshipChange(
                RelationshipChange.deleted("A", "B", RelationshipType.PARTNER), relaxed());
        assertFalse(ack.applied());
        assertEquals(-1, ack.sequence());
        assertEquals(before, store.version());
    }

    @Test
    public void testBusinessUpsertRefreshesDirectNetwork() {
        service.network("A", relaxed());
        ChangeAck ack = service.upsertBusiness(BusinessNode.of("A", "Acme Renamed", T0), relaxed());
        assertEquals(ChangeKind.UPDATED, ack.kind());

        QueryOutcome<BusinessNetworkView> view = service.network("A", relaxed());
        assertFalse(view.cacheHit());
        assertEquals("Acme Renamed", view.value().business().name());
        assertEquals("Acme Renamed", service.business("A", relaxed()).orElseThrow().name());
    }

    @Test
    public void testDisruptorSinkAcknowledgesAfterInvalidation() {
        DisruptorInvalidationSink ring = new DisruptorInvalidationSink(new InvalidationCoordinator(cache, stats), 64);
        try {
            NetworkQueryService async = newService(ring);
            addNodes(store, "D");
            async.network("D", relaxed());

            ChangeAck ack = async.applyRelationshipChange(create("D", "B", RelationshipType.PARTNER, 250), relaxed());
            assertTrue(ack.invalidationApplied());
            assertEquals(1, async.network("D", relaxed()).value().relationships().size());
        } finally {
            ring.close();
        }
    }

    @Test
    public void testConcurrentIdenticalQueriesAgree() throws Exception {
        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        List<Future<PathResult>> results = new ArrayList<>();
        Callable<PathResult> query = () -> service.findPath("B", "C", 3, relaxed()).value();
        for (int i = 0; i < threads; i++)
            results.add(pool.submit(query));

        PathResult expected = results.get(0).get(10, TimeUnit.SECONDS);
        for (Future<PathResult> f : results)
            assertEquals(expected, f.get(10, TimeUnit.SECONDS));
        pool.shutdown();
        assertEquals(threads, stats.totalHits() + stats.totalMisses());
    }
}
