package com.bizgraph.rge.wiring;

import com.bizgraph.rge.api.ChangeKind;
import com.bizgraph.rge.api.Deadline;
import com.bizgraph.rge.api.EdgePair;
import com.bizgraph.rge.api.RelationshipType;

/**
 * Applies every change inline on the publishing thread. For embedded use and
 * tests, where a consumer thread is not worth having. Publishers are
 * serialized, which preserves the coordinator's single-consumer contract.
 */
public final class DirectInvalidationSink implements InvalidationSink {
    private final InvalidationCoordinator coordinator;
    private final InvalidationEvent event = new InvalidationEvent();
    private long sequence = -1;

    public DirectInvalidationSink(InvalidationCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    @Override
    public synchronized long publishEdgeChange(EdgePair pair, RelationshipType type, ChangeKind kind,
            long timestampMillis, long storeVersion, Deadline deadline) {
        event.setEdgeChange(pair, type, kind, timestampMillis, storeVersion, true);
        coordinator.onEvent(event, ++sequence, true);
        return sequence;
    }

    @Override
    public synchronized long publishNodeChange(String nodeId, ChangeKind kind, long timestampMillis,
            long storeVersion, Deadline deadline) {
        event.setNodeChange(nodeId, kind, timestampMillis, storeVersion, true);
        coordinator.onEvent(event, ++sequence, true);
        return sequence;
    }

    @Override
    public boolean awaitApplied(long sequence, Deadline deadline) {
        return coordinator.appliedSequence() >= sequence;
    }

    @Override
    public void close() {
        // nothing to release
    }
}
