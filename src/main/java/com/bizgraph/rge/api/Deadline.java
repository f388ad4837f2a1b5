package com.bizgraph.rge.api;

import java.time.Duration;
import java.util.function.LongSupplier;

/**
 * Absolute point in (monotonic) time by which a call must complete.
 *
 * Every query and mutation carries one. Components poll {@link #check(String)}
 * at their own granularity; nothing in the engine waits past it.
 */
public final class Deadline {
    private final LongSupplier nanoClock;
    private final long deadlineNanos;

    private Deadline(LongSupplier nanoClock, long deadlineNanos) {
        this.nanoClock = nanoClock;
        this.deadlineNanos = deadlineNanos;
    }

    public static Deadline after(Duration budget) {
        return after(budget, System::nanoTime);
    }

    public static Deadline after(Duration budget, LongSupplier nanoClock) {
        if (budget.isNegative())
            throw new IllegalArgumentException("Deadline budget must not be negative: " + budget);
        long now = nanoClock.getAsLong();
        long at;
        try {
            at = Math.addExact(now, budget.toNanos());
        } catch (ArithmeticException e) {
            // Budgets beyond the clock's range never expire.
            at = Long.MAX_VALUE;
        }
        return new Deadline(nanoClock, at);
    }

    /** Nanoseconds left, saturating at {@link Long#MIN_VALUE} once far past. */
    public long remainingNanos() {
        long now = nanoClock.getAsLong();
        try {
            return Math.subtractExact(deadlineNanos, now);
        } catch (ArithmeticException e) {
            return deadlineNanos > now ? Long.MAX_VALUE : Long.MIN_VALUE;
        }
    }

    public Duration remaining() {
        return Duration.ofNanos(Math.max(0, remainingNanos()));
    }

    public boolean isExpired() {
        return remainingNanos() <= 0;
    }

    /**
     * Returns the earlier of this deadline and {@code now + budget}.
     */
    public Deadline capped(Duration budget) {
        Deadline other = after(budget, nanoClock);
        return other.remainingNanos() < remainingNanos() ? other : this;
    }

    /**
     * @throws QueryTimeoutException if the deadline has passed
     */
    public void check(String operation) {
        if (isExpired())
            throw new QueryTimeoutException("Deadline exceeded during " + operation);
    }

    @Override
    public String toString() {
        return "Deadline[remaining=" + remaining().toMillis() + "ms]";
    }
}
