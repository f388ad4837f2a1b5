package com.bizgraph.rge.wiring;

import com.bizgraph.rge.api.ChangeKind;
import com.bizgraph.rge.api.Deadline;
import com.bizgraph.rge.api.EdgePair;
import com.bizgraph.rge.api.RelationshipType;

/**
 * Where the mutation entry point sends change notifications.
 *
 * Publishing returns a sequence; {@link #awaitApplied} blocks, up to a
 * deadline, until the coordinator has processed that sequence.
 */
public interface InvalidationSink extends AutoCloseable {

    /**
     * @throws com.bizgraph.rge.api.QueryTimeoutException if there is no room to publish before the deadline
     */
    long publishEdgeChange(EdgePair pair, RelationshipType type, ChangeKind kind, long timestampMillis,
            long storeVersion, Deadline deadline);

    /**
     * @throws com.bizgraph.rge.api.QueryTimeoutException if there is no room to publish before the deadline
     */
    long publishNodeChange(String nodeId, ChangeKind kind, long timestampMillis, long storeVersion,
            Deadline deadline);

    /**
     * @return true once the sequence has been applied, false if the deadline passed first
     */
    boolean awaitApplied(long sequence, Deadline deadline);

    @Override
    void close();
}
