package com.bizgraph.rge.wiring;

import com.bizgraph.rge.api.ChangeKind;
import com.bizgraph.rge.api.EdgePair;
import com.bizgraph.rge.api.RelationshipType;

/**
 * A mutable data holder for graph changes, used within the LMAX Disruptor
 * RingBuffer.
 *
 * Pattern: Flyweight / Mutable Event. Instances are pre-allocated when the
 * ring buffer is built and reused for the lifetime of the process; producers
 * overwrite them with {@link #setEdgeChange} or {@link #setNodeChange}.
 *
 * An event references either one business (node change) or one relationship
 * (edge change, both endpoints). It is consumed once by the
 * {@link InvalidationCoordinator} and then recycled.
 */
public final class InvalidationEvent {
    private ChangeKind kind;
    private String nodeId;
    private String low;
    private String high;
    private RelationshipType type;
    private long timestampMillis;
    private long storeVersion;
    private boolean flush;

    public void setEdgeChange(EdgePair pair, RelationshipType type, ChangeKind kind, long timestampMillis,
            long storeVersion, boolean flush) {
        this.kind = kind;
        this.nodeId = null;
        this.low = pair.low();
        this.high = pair.high();
        this.type = type;
        this.timestampMillis = timestampMillis;
        this.storeVersion = storeVersion;
        this.flush = flush;
    }

    public void setNodeChange(String nodeId, ChangeKind kind, long timestampMillis, long storeVersion,
            boolean flush) {
        this.kind = kind;
        this.nodeId = nodeId;
        this.low = null;
        this.high = null;
        this.type = null;
        this.timestampMillis = timestampMillis;
        this.storeVersion = storeVersion;
        this.flush = flush;
    }

    public boolean isEdgeChange() {
        return low != null;
    }

    public ChangeKind kind() {
        return kind;
    }

    public String nodeId() {
        return nodeId;
    }

    public String low() {
        return low;
    }

    public String high() {
        return high;
    }

    public RelationshipType type() {
        return type;
    }

    public long timestampMillis() {
        return timestampMillis;
    }

    public long storeVersion() {
        return storeVersion;
    }

    /** If true, the coordinator invalidates right after this event instead of waiting for the batch end. */
    public boolean isFlush() {
        return flush;
    }

    public void clear() {
        kind = null;
        nodeId = null;
        low = null;
        high = null;
        type = null;
        timestampMillis = 0;
        storeVersion = 0;
        flush = false;
    }

    @Override
    public String toString() {
        return isEdgeChange()
                ? "EdgeChange[" + kind + " " + low + "<->" + high + " " + type + " v" + storeVersion + "]"
                : "NodeChange[" + kind + " " + nodeId + " v" + storeVersion + "]";
    }
}
