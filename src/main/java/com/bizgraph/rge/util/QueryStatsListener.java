package com.bizgraph.rge.util;

import com.bizgraph.rge.api.QueryListener;
import com.bizgraph.rge.api.QueryShape;

import java.util.EnumMap;
import java.util.Locale;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAccumulator;
import java.util.concurrent.atomic.LongAdder;

/**
 * Tracks cache effectiveness and query latency.
 *
 * <p>
 * Captures:
 * <ul>
 * <li><b>Cache:</b> hits and misses per query shape.</li>
 * <li><b>Latency:</b> last, min, max and average per completed query.</li>
 * <li><b>Failures:</b> failed queries, fan-out cap breaches.</li>
 * <li><b>Invalidation:</b> batches processed and entries removed eagerly.</li>
 * </ul>
 *
 * <p>
 * Counters are striped ({@link LongAdder}) since callbacks arrive from many
 * request threads at once.
 */
public final class QueryStatsListener implements QueryListener {

    private final Map<QueryShape, LongAdder> hits = new EnumMap<>(QueryShape.class);
    private final Map<QueryShape, LongAdder> misses = new EnumMap<>(QueryShape.class);
    private final LongAdder completed = new LongAdder();
    private final LongAdder failed = new LongAdder();
    private final LongAdder totalLatencyNanos = new LongAdder();
    private final LongAccumulator minLatencyNanos = new LongAccumulator(Math::min, Long.MAX_VALUE);
    private final LongAccumulator maxLatencyNanos = new LongAccumulator(Math::max, Long.MIN_VALUE);
    private final AtomicLong lastLatencyNanos = new AtomicLong();
    private final LongAdder fanOutBreaches = new LongAdder();
    private final LongAdder invalidationBatches = new LongAdder();
    private final LongAdder invalidatedEntries = new LongAdder();

    public QueryStatsListener() {
        for (QueryShape s : QueryShape.values()) {
            hits.put(s, new LongAdder());
            misses.put(s, new LongAdder());
        }
    }

    @Override
    public void onCacheHit(QueryShape shape, String source) {
        hits.get(shape).increment();
    }

    @Override
    public void onCacheMiss(QueryShape shape, String source) {
        misses.get(shape).increment();
    }

    @Override
    public void onQueryCompleted(QueryShape shape, long durationNanos) {
        completed.increment();
        totalLatencyNanos.add(durationNanos);
        minLatencyNanos.accumulate(durationNanos);
        maxLatencyNanos.accumulate(durationNanos);
        lastLatencyNanos.set(durationNanos);
    }

    @Override
    public void onQueryFailed(QueryShape shape, Throwable error) {
        failed.increment();
    }

    @Override
    public void onFanOutCapExceeded(String nodeId, int degree) {
        fanOutBreaches.increment();
    }

    @Override
    public void onInvalidation(int changedIds, int removed) {
        invalidationBatches.increment();
        invalidatedEntries.add(removed);
    }

    public long hits(QueryShape shape) {
        return hits.get(shape).sum();
    }

    public long misses(QueryShape shape) {
        return misses.get(shape).sum();
    }

    public long totalHits() {
        return hits.values().stream().mapToLong(LongAdder::sum).sum();
    }

    public long totalMisses() {
        return misses.values().stream().mapToLong(LongAdder::sum).sum();
    }

    public double hitRatio() {
        long h = totalHits(), m = totalMisses();
        return h + m == 0 ? 0.0 : (double) h / (h + m);
    }

    public long completedQueries() {
        return completed.sum();
    }

    public long failedQueries() {
        return failed.sum();
    }

    public long fanOutBreaches() {
        return fanOutBreaches.sum();
    }

    public long invalidationBatches() {
        return invalidationBatches.sum();
    }

    public long invalidatedEntries() {
        return invalidatedEntries.sum();
    }

    public double lastLatencyMicros() {
        return lastLatencyNanos.get() / 1000.0;
    }

    public double avgLatencyMicros() {
        long n = completed.sum();
        return n > 0 ? totalLatencyNanos.sum() / 1000.0 / n : 0;
    }

    public double minLatencyMicros() {
        long v = minLatencyNanos.get();
        return v == Long.MAX_VALUE ? 0 : v / 1000.0;
    }

    public double maxLatencyMicros() {
        long v = maxLatencyNanos.get();
        return v == Long.MIN_VALUE ? 0 : v / 1000.0;
    }

    /** Flat snapshot for the stats endpoint. */
    public Map<String, Object> toMap() {
        Map<String, Object> m = new LinkedHashMap<>();
        for (QueryShape s : QueryShape.values()) {
            String k = s.name().toLowerCase(Locale.ROOT);
            m.put(k + "_hits", hits(s));
            m.put(k + "_misses", misses(s));
        }
        m.put("hit_ratio", hitRatio());
        m.put("completed_queries", completedQueries());
        m.put("failed_queries", failedQueries());
        m.put("fan_out_breaches", fanOutBreaches());
        m.put("invalidation_batches", invalidationBatches());
        m.put("invalidated_entries", invalidatedEntries());
        m.put("avg_latency_us", avgLatencyMicros());
        m.put("max_latency_us", maxLatencyMicros());
        return m;
    }

    public String dump() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("%-14s | %10s | %10s%n", "Shape", "Hits", "Misses"));
        sb.append("----------------------------------------\n");
        for (QueryShape s : QueryShape.values())
            sb.append(String.format("%-14s | %10d | %10d%n", s, hits(s), misses(s)));
        sb.append(String.format("Latency (us): avg=%.2f min=%.2f max=%.2f last=%.2f over %d queries, %d failed%n",
                avgLatencyMicros(), minLatencyMicros(), maxLatencyMicros(), lastLatencyMicros(),
                completedQueries(), failedQueries()));
        return sb.toString();
    }
}
