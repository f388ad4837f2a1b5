package com.bizgraph.rge.store;

import com.bizgraph.rge.api.*;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.bizgraph.rge.SampleGraphs.*;
import static org.junit.Assert.*;

public class InMemoryGraphStoreTest {

    private InMemoryGraphStore store;

    @Before
    public void setUp() {
        store = triangle();
    }

    @Test
    public void testNeighborsAreSymmetricAndSorted() {
        List<Adjacency> ofA = store.getNeighbors("A");
        assertEquals(2, ofA.size());
        assertEquals("B", ofA.get(0).neighborId());
        assertEquals("C", ofA.get(1).neighborId());

        List<Adjacency> ofC = store.getNeighbors("C");
        assertEquals("A", ofC.get(0).neighborId());
        assertSame(ofA.get(1).edge(), ofC.get(0).edge());
    }

    @Test
    public void testCreateConflictsWithActiveRecord() {
        try {
            link(store, "B", "A", RelationshipType.VENDOR, 100);
            fail("second vendor record for A<->B should conflict");
        } catch (EdgeConflictException e) {
            assertEquals(ErrorCode.CONFLICT, e.code());
        }
        // A different type on the same pair is a separate record.
        WriteResult partner = link(store, "A", "B", RelationshipType.PARTNER, 100);
        assertTrue(partner.applied());
        assertEquals(ChangeKind.CREATED, partner.kind());
        assertEquals(3, store.getNeighbors("A").size());
    }

    @Test
    public void testOverwriteReplacesRecord() {
        WriteResult r = store.upsertEdge(edge("A", "B", RelationshipType.VENDOR, 100), true);
        assertTrue(r.applied());
        assertEquals(ChangeKind.UPDATED, r.kind());
        assertEquals(0.1, store.getNeighbors("A").get(0).edge().weight(), 1e-9);
        assertEquals(3, store.snapshot().edgeCount());
    }

    @Test
    public void testDelete() {
        WriteResult r = store.deleteEdge(EdgePair.of("C", "B"), RelationshipType.CLIENT);
        assertTrue(r.applied());
        assertEquals(ChangeKind.DELETED, r.kind());
        assertEquals(1, store.getNeighbors("B").size());

        WriteResult again = store.deleteEdge(EdgePair.of("C", "B"), RelationshipType.CLIENT);
        assertFalse(again.applied());
        assertEquals(r.version(), again.version());
    }

    @Test(expected = UnknownEntityException.class)
    public void testEdgeToUnknownBusiness() {
        link(store, "A", "Z", RelationshipType.VENDOR, 100);
    }

    @Test
    public void testSnapshotIsIsolatedFromLaterWrites() {
        GraphSnapshot before = store.snapshot();
        addNodes(store, "D");
        link(store, "C", "D", RelationshipType.VENDOR, 400);

        assertFalse(before.contains("D"));
        assertEquals(2, before.neighbors("C").size());
        assertEquals(3, store.getNeighbors("C").size());
        assertTrue(store.version() > before.version());
    }

    @Test
    public void testVersionIncreasesWithEveryAppliedWrite() {
        long v = store.version();
        store.putNode(BusinessNode.of("A", "Renamed", T0));
        assertEquals(v + 1, store.version());
        assertEquals("Renamed", store.getNode("A").name());
    }

    @Test
    public void testConcurrentCreatesOnSamePairYieldOneWinner() throws Exception {
        addNodes(store, "P", "Q");
        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> results = new ArrayList<>();
        for (int i = 0; i < threads; i++) {
            final long volume = 100 + i;
            results.add(pool.submit(() -> {
                start.await();
                try {
                    return link(store, "P", "Q", RelationshipType.VENDOR, volume).applied();
                } catch (EdgeConflictException e) {
                    return false;
                }
            }));
        }
        start.countDown();
        int winners = 0;
        for (Future<Boolean> f : results) {
            if (f.get(10, TimeUnit.SECONDS))
                winners++;
        }
        pool.shutdown();
        assertEquals(1, winners);
        assertEquals(1, store.getNeighbors("P").size());
    }

    @Test
    public void testConcurrentDisjointWritesAllLand() throws Exception {
        int writers = 4, perWriter = 50;
        for (int w = 0; w < writers; w++)
            for (int i = 0; i < perWriter; i++)
                addNodes(store, "w" + w + "-" + i);

        ExecutorService pool = Executors.newFixedThreadPool(writers);
        List<Future<?>> futures = new ArrayList<>();
        for (int w = 0; w < writers; w++) {
            final int writer = w;
            futures.add(pool.submit(() -> {
                for (int i = 1; i < perWriter; i++)
                    link(store, "w" + writer + "-" + (i - 1), "w" + writer + "-" + i, RelationshipType.PARTNER, 10);
            }));
        }
        for (Future<?> f : futures)
            f.get(10, TimeUnit.SECONDS);
        pool.shutdown();

        assertEquals(3 + writers * (perWriter - 1), store.snapshot().edgeCount());
    }
}
