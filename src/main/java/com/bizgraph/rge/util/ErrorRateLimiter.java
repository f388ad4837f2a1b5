package com.bizgraph.rge.util;

import org.apache.logging.log4j.Logger;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Limits how often a recurring condition is logged.
 *
 * Used on the traversal and invalidation paths, where a persistent problem
 * (an over-connected node, a broken consumer) would otherwise produce one log
 * line per request. Suppressed occurrences are counted and reported with the
 * next line that gets through.
 */
public class ErrorRateLimiter {
    private final Logger logger;
    private final long minIntervalNanos;
    private final AtomicLong lastLogTime;
    private final AtomicLong suppressed = new AtomicLong();

    public ErrorRateLimiter(Logger logger, long minIntervalMillis) {
        this.logger = logger;
        this.minIntervalNanos = minIntervalMillis * 1_000_000;
        // Start one interval in the past so the first occurrence is always logged.
        this.lastLogTime = new AtomicLong(System.nanoTime() - minIntervalNanos - 1);
    }

    public void error(String message, Throwable t) {
        if (acquire())
            logger.error(decorate(message), t);
    }

    public void warn(String message) {
        if (acquire())
            logger.warn(decorate(message));
    }

    public long suppressedCount() {
        return suppressed.get();
    }

    private boolean acquire() {
        long now = System.nanoTime();
        long last = lastLogTime.get();
        // Check-and-set so only one thread logs per interval.
        if (now - last > minIntervalNanos && lastLogTime.compareAndSet(last, now))
            return true;
        suppressed.incrementAndGet();
        return false;
    }

    private String decorate(String message) {
        long n = suppressed.getAndSet(0);
        return n == 0 ? message : message + " (" + n + " similar suppressed)";
    }
}
