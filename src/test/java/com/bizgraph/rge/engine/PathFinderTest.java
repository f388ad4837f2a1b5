package com.bizgraph.rge.engine;

import com.bizgraph.rge.api.*;
import com.bizgraph.rge.store.InMemoryGraphStore;
import org.junit.Before;
import org.junit.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import static com.bizgraph.rge.SampleGraphs.*;
import static org.junit.Assert.*;

public class PathFinderTest {

    private PathFinder finder;
    private GraphSnapshot triangle;

    @Before
    public void setUp() {
        finder = new PathFinder(TraversalLimits.DEFAULT);
        triangle = triangle().snapshot();
    }

    @Test
    public void testFewestHopsBeatsHeavierLongerPath() {
        PathResult p = finder.findPath(triangle, "A", "C", 2, relaxed());

        // A-B-C weighs .45, but one hop wins.
        assertTrue(p.found());
        assertEquals(List.of("A", "C"), p.nodes());
        assertEquals(1, p.hops());
        assertEquals(0.3, p.weight(), 1e-9);
        assertEquals(RelationshipType.PARTNER, p.edges().get(0).type());
    }

    @Test
    public void testSelfPathIsTrivial() {
        for (int depth = 1; depth <= 6; depth++) {
            PathResult p = finder.findPath(triangle, "A", "A", depth, relaxed());
            assertTrue(p.found());
            assertEquals(List.of("A"), p.nodes());
            assertEquals(0, p.hops());
            assertTrue(p.edges().isEmpty());
        }
    }

    @Test
    public void testNeighborhoodOfOneHop() {
        Neighborhood n = finder.neighborhood(triangle, "A", 1, relaxed());

        assertEquals(2, n.size());
        assertEquals(1, n.entry("B").orElseThrow().distance());
        assertEquals(0.9, n.entry("B").orElseThrow().weight(), 1e-9);
        assertEquals(1, n.entry("C").orElseThrow().distance());
        assertEquals(0.3, n.entry("C").orElseThrow().weight(), 1e-9);
        assertFalse(n.entry("A").isPresent());
    }

    @Test
    public void testNeighborhoodIsOrderedByDistanceThenId() {
        InMemoryGraphStore store = new InMemoryGraphStore();
        addNodes(store, "S", "z", "y", "x");
        link(store, "S", "z", RelationshipType.VENDOR, 100);
        link(store, "S", "y", RelationshipType.VENDOR, 100);
        link(store, "z", "x", RelationshipType.VENDOR, 100);

        Neighborhood n = finder.neighborhood(store.snapshot(), "S", 3, relaxed());
        List<String> ids = new ArrayList<>();
        for (NeighborEntry e : n.entries())
            ids.add(e.nodeId());
        assertEquals(List.of("y", "z", "x"), ids);
        assertEquals(List.of("S", "z", "x"), n.entry("x").orElseThrow().path());
        assertEquals(2, n.entry("x").orElseThrow().edges().size());
    }

    @Test
    public void testInvalidDepth() {
        for (int depth : new int[] { 0, -1, 7 }) {
            try {
                finder.findPath(triangle, "A", "B", depth, relaxed());
                fail("depth " + depth + " should be rejected");
            } catch (InvalidDepthException e) {
                assertEquals(ErrorCode.INVALID_DEPTH, e.code());
            }
        }
    }

    @Test(expected = InvalidDepthException.class)
    public void testInvalidDepthCheckedBeforeUnknownIds() {
        finder.findPath(triangle, "X", "Y", 0, relaxed());
    }

    @Test
    public void testUnknownEntity() {
        try {
            finder.findPath(triangle, "A", "nope", 2, relaxed());
            fail("unknown target should be rejected");
        } catch (UnknownEntityException e) {
            assertEquals("nope", e.entityId());
            assertEquals(ErrorCode.NOT_FOUND, e.code());
        }
    }

    @Test(expected = UnknownEntityException.class)
    public void testUnknownNeighborhoodSource() {
        finder.neighborhood(triangle, "ghost", 1, relaxed());
    }

    @Test
    public void testNoPathWithinDepth() {
        InMemoryGraphStore store = new InMemoryGraphStore();
        addNodes(store, "A", "B", "C", "D", "island");
        link(store, "A", "B", RelationshipType.VENDOR, 500);
        link(store, "B", "C", RelationshipType.VENDOR, 500);
        link(store, "C", "D", RelationshipType.VENDOR, 500);

        PathResult tooShort = finder.findPath(store.snapshot(), "A", "D", 2, relaxed());
        assertFalse(tooShort.found());
        assertEquals(0.0, tooShort.weight(), 0.0);
        assertTrue(tooShort.nodes().isEmpty());

        PathResult enough = finder.findPath(store.snapshot(), "A", "D", 3, relaxed());
        assertTrue(enough.found());
        assertEquals(3, enough.hops());
        assertEquals(0.125, enough.weight(), 1e-9);

        assertFalse(finder.findPath(store.snapshot(), "A", "island", 6, relaxed()).found());
    }

    @Test
    public void testEqualHopsPickHeavierPath() {
        InMemoryGraphStore store = new InMemoryGraphStore();
        addNodes(store, "S", "M1", "M2", "T");
        link(store, "S", "M1", RelationshipType.VENDOR, 500);
        link(store, "M1", "T", RelationshipType.VENDOR, 500);
        link(store, "S", "M2", RelationshipType.VENDOR, 800);
        link(store, "M2", "T", RelationshipType.VENDOR, 700);

        PathResult p = finder.findPath(store.snapshot(), "S", "T", 3, relaxed());
        assertEquals(List.of("S", "M2", "T"), p.nodes());
        assertEquals(0.56, p.weight(), 1e-9);
    }

    @Test
    public void testEqualWeightTieBreaksLexicographically() {
        InMemoryGraphStore store = new InMemoryGraphStore();
        addNodes(store, "S", "b", "a", "T");
        link(store, "S", "b", RelationshipType.VENDOR, 500);
        link(store, "b", "T", RelationshipType.VENDOR, 500);
        link(store, "S", "a", RelationshipType.VENDOR, 500);
        link(store, "a", "T", RelationshipType.VENDOR, 500);

        GraphSnapshot snap = store.snapshot();
        for (int run = 0; run < 20; run++)
            assertEquals(List.of("S", "a", "T"), finder.findPath(snap, "S", "T", 4, relaxed()).nodes());
    }

    @Test
    public void testReorderedEqualProductsStillTie() {
        // .001 * .012 * .053 and .053 * .012 * .001 differ in the last bit when multiplied in order.
        InMemoryGraphStore store = new InMemoryGraphStore();
        addNodes(store, "S", "P", "Q", "X", "Y", "T");
        link(store, "S", "X", RelationshipType.VENDOR, 1);
        link(store, "X", "Y", RelationshipType.VENDOR, 12);
        link(store, "Y", "T", RelationshipType.VENDOR, 53);
        link(store, "S", "P", RelationshipType.VENDOR, 53);
        link(store, "P", "Q", RelationshipType.VENDOR, 12);
        link(store, "Q", "T", RelationshipType.VENDOR, 1);

        PathResult p = finder.findPath(store.snapshot(), "S", "T", 3, relaxed());
        assertEquals(List.of("S", "P", "Q", "T"), p.nodes());
        assertEquals(6.36e-7, p.weight(), 1e-15);
    }

    @Test
    public void testWeightComparisonTolerance() {
        assertEquals(0, PathFinder.compareWeights(6.36e-7, 6.359999999999999e-7));
        assertEquals(0, PathFinder.compareWeights(0.0, 0.0));
        assertTrue(PathFinder.compareWeights(0.5, 0.4999) > 0);
        assertTrue(PathFinder.compareWeights(0.0, 1e-300) < 0);
    }

    @Test
    public void testZeroWeightPathsStillTieBreakLexicographically() {
        InMemoryGraphStore store = new InMemoryGraphStore();
        addNodes(store, "S", "a", "b", "c", "T");
        // S-b-?-T and S-a-?-T, all through zero-volume edges at the end.
        link(store, "S", "a", RelationshipType.VENDOR, 100);
        link(store, "S", "b", RelationshipType.VENDOR, 900);
        link(store, "a", "c", RelationshipType.VENDOR, 0);
        link(store, "b", "c", RelationshipType.VENDOR, 0);
        link(store, "c", "T", RelationshipType.VENDOR, 600);

        PathResult p = finder.findPath(store.snapshot(), "S", "T", 3, relaxed());
        assertEquals(0.0, p.weight(), 0.0);
        assertEquals(List.of("S", "a", "c", "T"), p.nodes());
    }

    @Test
    public void testMultiEdgeWalksHeaviestRecord() {
        InMemoryGraphStore store = new InMemoryGraphStore();
        addNodes(store, "A", "B");
        link(store, "A", "B", RelationshipType.VENDOR, 200);
        link(store, "A", "B", RelationshipType.PARTNER, 700);

        PathResult p = finder.findPath(store.snapshot(), "A", "B", 1, relaxed());
        assertEquals(RelationshipType.PARTNER, p.edges().get(0).type());
        assertEquals(0.7, p.weight(), 1e-9);
    }

    @Test
    public void testExpiredDeadlineTimesOut() {
        AtomicLong nanos = new AtomicLong();
        Deadline deadline = Deadline.after(Duration.ofMillis(5), nanos::get);
        nanos.addAndGet(Duration.ofMillis(6).toNanos());
        try {
            finder.neighborhood(triangle, "A", 3, deadline);
            fail("expired deadline should abort traversal");
        } catch (QueryTimeoutException e) {
            assertEquals(ErrorCode.TIMEOUT, e.code());
        }
    }

    @Test
    public void testFanOutAboveCapIsReportedButExpanded() {
        InMemoryGraphStore store = new InMemoryGraphStore();
        addNodes(store, "hub");
        for (int i = 0; i < 5; i++) {
            addNodes(store, "n" + i);
            link(store, "hub", "n" + i, RelationshipType.CLIENT, 100);
        }
        List<String> reported = new ArrayList<>();
        PathFinder capped = new PathFinder(new TraversalLimits(2, 6, 3), new QueryListener() {
            @Override
            public void onFanOutCapExceeded(String nodeId, int degree) {
                reported.add(nodeId + ":" + degree);
            }
        });

        Neighborhood n = capped.neighborhood(store.snapshot(), "hub", 1, relaxed());
        assertEquals(5, n.size());
        assertEquals(List.of("hub:5"), reported);
    }
}
