package com.bizgraph.rge.wiring;

import com.bizgraph.rge.api.ChangeKind;
import com.bizgraph.rge.api.Deadline;
import com.bizgraph.rge.api.EdgePair;
import com.bizgraph.rge.api.QueryTimeoutException;
import com.bizgraph.rge.api.RelationshipType;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.InsufficientCapacityException;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.TimeoutException;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import com.lmax.disruptor.util.DaemonThreadFactory;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.LockSupport;

/**
 * Runs the {@link InvalidationCoordinator} behind an LMAX Disruptor ring
 * buffer.
 *
 * Many request threads publish (multi-producer); one daemon thread consumes.
 * Publishing never blocks past the caller's deadline: when the ring is full
 * the producer retries {@code tryNext()} until the deadline and then gives up
 * with a timeout.
 */
public final class DisruptorInvalidationSink implements InvalidationSink {
    private static final Logger log = LogManager.getLogger(DisruptorInvalidationSink.class);
    private static final long PARK_NANOS = 50_000;

    private final Disruptor<InvalidationEvent> disruptor;
    private final RingBuffer<InvalidationEvent> ringBuffer;
    private final InvalidationCoordinator coordinator;

    public DisruptorInvalidationSink(InvalidationCoordinator coordinator, int ringBufferSize) {
        if (Integer.bitCount(ringBufferSize) != 1)
            throw new IllegalArgumentException("ringBufferSize must be a power of 2: " + ringBufferSize);
        this.coordinator = coordinator;
        this.disruptor = new Disruptor<>(
                InvalidationEvent::new,
                ringBufferSize,
                DaemonThreadFactory.INSTANCE,
                ProducerType.MULTI,
                new BlockingWaitStrategy());
        disruptor.handleEventsWith(coordinator);
        this.ringBuffer = disruptor.start();
        log.info("Invalidation ring buffer started (size={})", ringBufferSize);
    }

    @Override
    public long publishEdgeChange(EdgePair pair, RelationshipType type, ChangeKind kind, long timestampMillis,
            long storeVersion, Deadline deadline) {
        long sequence = claim(deadline);
        try {
            ringBuffer.get(sequence).setEdgeChange(pair, type, kind, timestampMillis, storeVersion, false);
        } finally {
            ringBuffer.publish(sequence);
        }
        return sequence;
    }

    @Override
    public long publishNodeChange(String nodeId, ChangeKind kind, long timestampMillis, long storeVersion,
            Deadline deadline) {
        long sequence = claim(deadline);
        try {
            ringBuffer.get(sequence).setNodeChange(nodeId, kind, timestampMillis, storeVersion, false);
        } finally {
            ringBuffer.publish(sequence);
        }
        return sequence;
    }

    @Override
    public boolean awaitApplied(long sequence, Deadline deadline) {
        while (coordinator.appliedSequence() < sequence) {
            if (deadline.isExpired())
                return false;
            LockSupport.parkNanos(PARK_NANOS);
        }
        return true;
    }

    /** Fraction of the ring currently occupied by unconsumed events. */
    public double backpressure() {
        long capacity = ringBuffer.getBufferSize();
        return (capacity - ringBuffer.remainingCapacity()) / (double) capacity;
    }

    @Override
    public void close() {
        try {
            disruptor.shutdown(2, TimeUnit.SECONDS);
            log.info("Invalidation ring buffer drained and stopped");
        } catch (TimeoutException e) {
            log.warn("Invalidation ring buffer did not drain in time, halting", e);
            disruptor.halt();
        }
    }

    private long claim(Deadline deadline) {
        while (true) {
            try {
                return ringBuffer.tryNext();
            } catch (InsufficientCapacityException e) {
                if (deadline.isExpired())
                    throw new QueryTimeoutException("Invalidation ring buffer full");
                LockSupport.parkNanos(PARK_NANOS);
            }
        }
    }
}
