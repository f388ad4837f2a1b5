package com.bizgraph.rge.store;

import com.bizgraph.rge.api.*;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.LongAdder;

/**
 * Decorator that retries transient read failures of the wrapped store.
 *
 * Only {@link TransientStoreException} is retried, with bounded attempts and
 * exponential backoff randomized around each interval. Writes pass through
 * untouched: a failed write is reported to the writer, which knows whether
 * repeating it is safe. Deadline-aware reads never back off past their
 * deadline and stop retrying once it has passed.
 */
public final class RetryingGraphStore implements GraphStore {
    private static final Logger log = LogManager.getLogger(RetryingGraphStore.class);

    private final GraphStore delegate;
    private final int maxAttempts;
    private final IntervalFunction backoff;
    private final Retry retry;
    private final LongAdder succeededAfterRetry = new LongAdder();
    private final LongAdder failedAfterRetry = new LongAdder();

    public RetryingGraphStore(GraphStore delegate, int maxAttempts, Duration initialBackoff) {
        this.delegate = delegate;
        this.maxAttempts = maxAttempts;
        this.backoff = IntervalFunction.ofExponentialRandomBackoff(initialBackoff, 2.0, 0.5);
        this.retry = newRetry("graph-store-read", backoff);
    }

    @Override
    public GraphSnapshot snapshot() {
        return retry.executeSupplier(delegate::snapshot);
    }

    @Override
    public GraphSnapshot snapshot(Deadline deadline) {
        return newRetry("graph-store-snapshot", cappedBy(deadline)).executeSupplier(() -> {
            deadline.check("store snapshot");
            return delegate.snapshot(deadline);
        });
    }

    /**
     * Backoff that never sleeps past the deadline. Once it has passed, the next
     * attempt fails its deadline check straight away.
     */
    private IntervalFunction cappedBy(Deadline deadline) {
        return attempt -> Math.max(1L, Math.min(backoff.apply(attempt), deadline.remaining().toMillis()));
    }

    private Retry newRetry(String name, IntervalFunction intervals) {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(intervals)
                .retryExceptions(TransientStoreException.class)
                .build();
        Retry r = Retry.of(name, config);
        r.getEventPublisher()
                .onRetry(e -> log.warn("Transient store failure, attempt {} of {}, next in {}: {}",
                        e.getNumberOfRetryAttempts(), maxAttempts, e.getWaitInterval(),
                        e.getLastThrowable() == null ? "?" : e.getLastThrowable().getMessage()))
                .onSuccess(e -> succeededAfterRetry.increment())
                .onError(e -> failedAfterRetry.increment());
        return r;
    }

    @Override
    public BusinessNode getNode(String id) {
        return retry.executeSupplier(() -> delegate.getNode(id));
    }

    @Override
    public List<Adjacency> getNeighbors(String id) {
        return retry.executeSupplier(() -> delegate.getNeighbors(id));
    }

    @Override
    public long version() {
        return delegate.version();
    }

    @Override
    public WriteResult putNode(BusinessNode node) {
        return delegate.putNode(node);
    }

    @Override
    public WriteResult upsertEdge(RelationshipEdge edge, boolean overwrite) {
        return delegate.upsertEdge(edge, overwrite);
    }

    @Override
    public WriteResult deleteEdge(EdgePair pair, RelationshipType type) {
        return delegate.deleteEdge(pair, type);
    }

    /** Reads that still failed after exhausting their retries. */
    public long failedCallsWithRetry() {
        return failedAfterRetry.sum();
    }

    /** Reads that succeeded only after at least one retry. */
    public long successfulCallsWithRetry() {
        return succeededAfterRetry.sum();
    }
}
