package com.bizgraph.rge.util;

import com.bizgraph.rge.api.QueryListener;
import com.bizgraph.rge.api.QueryShape;

import java.util.Arrays;

/**
 * Fans every callback out to a set of {@link QueryListener}s.
 *
 * Listeners are held in an array replaced on registration, so dispatch needs
 * no lock and allocates nothing.
 */
public class CompositeQueryListener implements QueryListener {
    private volatile QueryListener[] listeners = new QueryListener[0];

    public synchronized void addForComposite(QueryListener listener) {
        QueryListener[] old = listeners;
        QueryListener[] next = Arrays.copyOf(old, old.length + 1);
        next[old.length] = listener;
        listeners = next;
    }

    @Override
    public void onCacheHit(QueryShape shape, String source) {
        for (QueryListener l : listeners)
            l.onCacheHit(shape, source);
    }

    @Override
    public void onCacheMiss(QueryShape shape, String source) {
        for (QueryListener l : listeners)
            l.onCacheMiss(shape, source);
    }

    @Override
    public void onQueryCompleted(QueryShape shape, long durationNanos) {
        for (QueryListener l : listeners)
            l.onQueryCompleted(shape, durationNanos);
    }

    @Override
    public void onQueryFailed(QueryShape shape, Throwable error) {
        for (QueryListener l : listeners)
            l.onQueryFailed(shape, error);
    }

    @Override
    public void onFanOutCapExceeded(String nodeId, int degree) {
        for (QueryListener l : listeners)
            l.onFanOutCapExceeded(nodeId, degree);
    }

    @Override
    public void onInvalidation(int changedIds, int removed) {
        for (QueryListener l : listeners)
            l.onInvalidation(changedIds, removed);
    }
}
