package com.bizgraph.rge.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import com.github.benmanes.caffeine.cache.stats.CacheStats;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Predicate;

/**
 * {@link ResultCache} on top of a Caffeine cache.
 *
 * <ul>
 * <li>Expiry is per entry: each {@link CacheEntry} carries its own TTL.</li>
 * <li>Size is bounded by {@code maximumSize}; Caffeine evicts the entries least
 * likely to be used again, favouring recently read ones.</li>
 * <li>Puts merge atomically per key and keep whichever entry is fresher, so a
 * slow writer holding an old snapshot cannot clobber a newer result.</li>
 * <li>Per-node change watermarks reject late puts of results computed before
 * an invalidation that should have removed them. A watermark is dropped once
 * it is older than the retention window; puts are bounded by request
 * deadlines, which are far shorter.</li>
 * </ul>
 */
public final class CaffeineResultCache implements ResultCache {
    private static final Logger log = LogManager.getLogger(CaffeineResultCache.class);

    static final Duration DEFAULT_WATERMARK_RETENTION = Duration.ofHours(1);

    private final Cache<CacheKey, CacheEntry> cache;
    private final ConcurrentMap<String, Watermark> changeWatermarks;
    private final Ticker ticker;
    private final long retentionNanos;
    private final AtomicLong lastPruneNanos;

    public CaffeineResultCache(long maximumSize) {
        this(maximumSize, Ticker.systemTicker(), Runnable::run);
    }

    public CaffeineResultCache(long maximumSize, Ticker ticker, Executor executor) {
        this(maximumSize, ticker, executor, DEFAULT_WATERMARK_RETENTION);
    }

    /**
     * @param ticker             time source for expiry and watermark age
     * @param executor           runs Caffeine's maintenance; {@code Runnable::run}
     *                           keeps eviction on the calling thread
     * @param watermarkRetention how long a change watermark is kept; at least
     *                           the longest entry TTL
     */
    public CaffeineResultCache(long maximumSize, Ticker ticker, Executor executor, Duration watermarkRetention) {
        this(maximumSize, ticker, executor, watermarkRetention, new ConcurrentHashMap<>());
    }

    CaffeineResultCache(long maximumSize, Ticker ticker, Executor executor, Duration watermarkRetention,
            ConcurrentMap<String, Watermark> changeWatermarks) {
        if (watermarkRetention.isNegative() || watermarkRetention.isZero())
            throw new IllegalArgumentException("watermark retention must be > 0: " + watermarkRetention);
        this.ticker = ticker;
        this.retentionNanos = watermarkRetention.toNanos();
        this.changeWatermarks = changeWatermarks;
        this.lastPruneNanos = new AtomicLong(ticker.read());
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .expireAfter(new EntryTtl())
                .ticker(ticker)
                .executor(executor)
                .recordStats()
                .build();
    }

    @Override
    public Optional<CacheEntry> get(CacheKey key) {
        return Optional.ofNullable(cache.getIfPresent(key));
    }

    @Override
    public boolean put(CacheEntry entry) {
        if (isStale(entry)) {
            log.debug("Rejected stale put for {} (snapshot v{})", entry.key(), entry.snapshotVersion());
            return false;
        }
        CacheEntry winner = cache.asMap().merge(entry.key(), entry,
                (old, candidate) -> candidate.isFresherThan(old) ? candidate : old);
        if (winner != entry)
            return false;
        // A change may have been marked and scanned between the check and the merge.
        // Watermarks are recorded before the scan, so the second check sees that change.
        if (isStale(entry)) {
            cache.asMap().remove(entry.key(), entry);
            log.debug("Dropped put for {} (snapshot v{}) invalidated while storing", entry.key(),
                    entry.snapshotVersion());
            return false;
        }
        return true;
    }

    @Override
    public int invalidate(Predicate<CacheKey> keyPredicate) {
        int removed = 0;
        for (CacheKey key : cache.asMap().keySet()) {
            if (keyPredicate.test(key) && cache.asMap().remove(key) != null)
                removed++;
        }
        return removed;
    }

    @Override
    public int invalidateEntries(Predicate<CacheEntry> entryPredicate) {
        int removed = 0;
        for (Map.Entry<CacheKey, CacheEntry> e : cache.asMap().entrySet()) {
            if (entryPredicate.test(e.getValue()) && cache.asMap().remove(e.getKey(), e.getValue()))
                removed++;
        }
        return removed;
    }

    @Override
    public void markChanged(Collection<String> nodeIds, long version) {
        long now = ticker.read();
        Watermark mark = new Watermark(version, now);
        for (String id : nodeIds)
            changeWatermarks.merge(id, mark, Watermark::max);
        pruneWatermarks(now);
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
    }

    @Override
    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    public CacheStats stats() {
        return cache.stats();
    }

    int watermarkCount() {
        return changeWatermarks.size();
    }

    private boolean isStale(CacheEntry entry) {
        for (String id : entry.coveredNodes()) {
            Watermark changed = changeWatermarks.get(id);
            if (changed != null && changed.version() > entry.snapshotVersion())
                return true;
        }
        return false;
    }

    // At most one sweep per retention window.
    private void pruneWatermarks(long now) {
        long last = lastPruneNanos.get();
        if (now - last < retentionNanos || !lastPruneNanos.compareAndSet(last, now))
            return;
        int before = changeWatermarks.size();
        changeWatermarks.values().removeIf(w -> now - w.markedAtNanos() > retentionNanos);
        log.debug("Pruned {} change watermarks", before - changeWatermarks.size());
    }

    /** Store version a node last changed at, and when that was recorded. */
    record Watermark(long version, long markedAtNanos) {
        static Watermark max(Watermark a, Watermark b) {
            if (a.version != b.version)
                return a.version > b.version ? a : b;
            return a.markedAtNanos >= b.markedAtNanos ? a : b;
        }
    }

    private static final class EntryTtl implements Expiry<CacheKey, CacheEntry> {
        @Override
        public long expireAfterCreate(CacheKey key, CacheEntry value, long currentTime) {
            return value.ttl().toNanos();
        }

        @Override
        public long expireAfterUpdate(CacheKey key, CacheEntry value, long currentTime, long currentDuration) {
            return value.ttl().toNanos();
        }

        @Override
        public long expireAfterRead(CacheKey key, CacheEntry value, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
