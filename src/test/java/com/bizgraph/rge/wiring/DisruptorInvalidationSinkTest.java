package com.bizgraph.rge.wiring;

import com.bizgraph.rge.api.*;
import com.bizgraph.rge.cache.CacheEntry;
import com.bizgraph.rge.cache.CacheKey;
import com.bizgraph.rge.cache.CaffeineResultCache;
import org.junit.After;
import org.junit.Test;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static com.bizgraph.rge.SampleGraphs.*;
import static org.junit.Assert.*;

public class DisruptorInvalidationSinkTest {

    private DisruptorInvalidationSink sink;

    @After
    public void tearDown() {
        if (sink != null)
            sink.close();
    }

    @Test
    public void testPublishedChangeIsAppliedBeforeAck() {
        CaffeineResultCache cache = new CaffeineResultCache(100);
        CacheKey key = new CacheKey(QueryShape.NETWORK, "A", null, 1, 0);
        cache.put(CacheEntry.of(key, new BusinessNetworkView(BusinessNode.of("A", "A", T0),
                List.of(new Adjacency("B", edge("A", "B", RelationshipType.VENDOR, 500)))), Duration.ofHours(1), T0, 1));

        sink = new DisruptorInvalidationSink(new InvalidationCoordinator(cache, new QueryListener() {
        }), 64);
        long seq = sink.publishEdgeChange(EdgePair.of("A", "B"), RelationshipType.VENDOR, ChangeKind.DELETED, 0, 2,
                relaxed());

        assertTrue(sink.awaitApplied(seq, Deadline.after(Duration.ofSeconds(5))));
        assertFalse(cache.get(key).isPresent());
    }

    @Test
    public void testManyProducersAllApplied() throws Exception {
        CaffeineResultCache cache = new CaffeineResultCache(100);
        sink = new DisruptorInvalidationSink(new InvalidationCoordinator(cache, new QueryListener() {
        }), 16);

        int producers = 4, each = 100;
        Thread[] threads = new Thread[producers];
        long[] last = new long[producers];
        for (int p = 0; p < producers; p++) {
            final int id = p;
            threads[p] = new Thread(() -> {
                for (int i = 0; i < each; i++)
                    last[id] = sink.publishNodeChange("n" + id + "-" + i, ChangeKind.CREATED, 0, i, relaxed());
            });
            threads[p].start();
        }
        long max = -1;
        for (int p = 0; p < producers; p++) {
            threads[p].join(10_000);
            max = Math.max(max, last[p]);
        }
        assertEquals(producers * each - 1, max);
        assertTrue(sink.awaitApplied(max, Deadline.after(Duration.ofSeconds(5))));
    }

    @Test
    public void testFullRingTimesOutInsteadOfBlocking() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch consuming = new CountDownLatch(1);
        InvalidationCoordinator coordinator = new InvalidationCoordinator(
                new BlockingCache(new CaffeineResultCache(100), consuming, release),
                new QueryListener() {
                });
        sink = new DisruptorInvalidationSink(coordinator, 2);

        long first = sink.publishNodeChange("A", ChangeKind.UPDATED, 0, 1, relaxed());
        assertTrue(consuming.await(5, TimeUnit.SECONDS));
        // Consumer holds sequence 0; one more slot is left in a ring of two.
        sink.publishNodeChange("B", ChangeKind.UPDATED, 0, 2, relaxed());

        assertFalse(sink.awaitApplied(first, Deadline.after(Duration.ofMillis(20))));
        try {
            sink.publishNodeChange("C", ChangeKind.UPDATED, 0, 3, Deadline.after(Duration.ofMillis(50)));
            fail("ring is full while the consumer is stuck");
        } catch (QueryTimeoutException e) {
            assertEquals(ErrorCode.TIMEOUT, e.code());
        }
        assertEquals(1.0, sink.backpressure(), 0.0);

        release.countDown();
        assertTrue(sink.awaitApplied(first, Deadline.after(Duration.ofSeconds(5))));
    }

    /** Blocks the consumer inside {@code markChanged} until released. */
    private static final class BlockingCache extends ForwardingResultCache {
        private final CountDownLatch consuming;
        private final CountDownLatch release;

        BlockingCache(CaffeineResultCache delegate, CountDownLatch consuming, CountDownLatch release) {
            super(delegate);
            this.consuming = consuming;
            this.release = release;
        }

        @Override
        public void markChanged(Collection<String> nodeIds, long version) {
            consuming.countDown();
            try {
                release.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            super.markChanged(nodeIds, version);
        }
    }
}
