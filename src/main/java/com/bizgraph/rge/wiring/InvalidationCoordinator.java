package com.bizgraph.rge.wiring;

import com.bizgraph.rge.api.QueryListener;
import com.bizgraph.rge.cache.ResultCache;
import com.bizgraph.rge.util.ErrorRateLimiter;

import com.lmax.disruptor.EventHandler;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Disruptor EventHandler that turns relationship and business changes into
 * cache invalidations.
 *
 * Runs on a single consumer thread. Policy:
 * <ul>
 * <li><b>Eager</b> for one-hop results (direct network views, depth-1
 * neighbourhoods and paths): every such entry that covers a changed node is
 * removed before the change is acknowledged.</li>
 * <li><b>Lazy</b> for deeper results: they age out with their TTL. Every
 * change is therefore visible to all cached results within one TTL, without a
 * full cache scan per mutation for deep queries.</li>
 * </ul>
 * In both cases the cache is told which nodes changed at which store version,
 * so late writers holding an older snapshot cannot re-insert stale results.
 *
 * Batching/Coalescing: changed ids are accumulated while the Disruptor reports
 * more events immediately available ({@code endOfBatch == false}) and the
 * cache is scanned once per batch, so a burst of mutations costs one scan.
 */
public final class InvalidationCoordinator implements EventHandler<InvalidationEvent> {
    private static final Logger log = LogManager.getLogger(InvalidationCoordinator.class);

    // Bounds the coalesced set under sustained bursts where endOfBatch rarely arrives.
    private static final int MAX_PENDING_IDS = 1024;

    private final ResultCache cache;
    private final QueryListener listener;
    private final ErrorRateLimiter errLimiter = new ErrorRateLimiter(log, 1000);

    // Consumer-thread state.
    private final Set<String> pendingIds = new HashSet<>();
    private long pendingVersion;

    // Highest sequence whose invalidation has been applied. Read by producers waiting for acknowledgement.
    private final AtomicLong appliedSequence = new AtomicLong(-1);

    public InvalidationCoordinator(ResultCache cache, QueryListener listener) {
        this.cache = cache;
        this.listener = listener;
    }

    @Override
    public void onEvent(InvalidationEvent event, long sequence, boolean endOfBatch) {
        final boolean flushRequested = event.isFlush();
        try {
            if (event.isEdgeChange()) {
                pendingIds.add(event.low());
                pendingIds.add(event.high());
            } else if (event.nodeId() != null) {
                pendingIds.add(event.nodeId());
            } else {
                log.error("Received empty invalidation event at sequence {}", sequence);
            }
            pendingVersion = Math.max(pendingVersion, event.storeVersion());
            log.trace("Queued {} (seq={})", event, sequence);
        } finally {
            event.clear();
        }

        if (endOfBatch || flushRequested || pendingIds.size() >= MAX_PENDING_IDS)
            flush(sequence);
    }

    /** Highest ring sequence whose invalidation is complete. */
    public long appliedSequence() {
        return appliedSequence.get();
    }

    private void flush(long sequence) {
        if (pendingIds.isEmpty()) {
            appliedSequence.set(sequence);
            return;
        }
        Set<String> changed = Set.copyOf(pendingIds);
        try {
            cache.markChanged(changed, pendingVersion);
            int removed = cache.invalidateEntries(e -> e.key().isOneHop() && coversAny(e.coveredNodes(), changed));
            log.debug("Invalidated {} one-hop entries for {} changed businesses (v{})", removed, changed.size(),
                    pendingVersion);
            listener.onInvalidation(changed.size(), removed);
        } catch (Exception e) {
            // Dropping everything is always safe: the cache only holds derived data.
            errLimiter.error("Targeted invalidation failed, flushing the whole result cache", e);
            cache.invalidateAll();
        } finally {
            pendingIds.clear();
            appliedSequence.set(sequence);
        }
    }

    private static boolean coversAny(Set<String> covered, Set<String> changed) {
        Set<String> small = covered.size() < changed.size() ? covered : changed;
        Set<String> large = small == covered ? changed : covered;
        for (String id : small) {
            if (large.contains(id))
                return true;
        }
        return false;
    }
}
