package com.bizgraph.rge.store;

import com.bizgraph.rge.api.*;

import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

import lombok.extern.log4j.Log4j2;

/**
 * Lock-free, copy-on-write {@link GraphStore}.
 *
 * State lives in a single {@link ImmutableGraphSnapshot} published through an
 * {@link AtomicReference}. Readers take the current reference and keep it for
 * the whole traversal, so they never see a partial write.
 *
 * Writers build the next snapshot from the one they read and publish it with
 * compare-and-set, retrying on contention. Conflict checks run inside that
 * loop against the exact snapshot being replaced, which linearizes writes to
 * the same pair. Writers to disjoint pairs never block; at worst one of them
 * recomputes its snapshot.
 *
 * Cost: a write copies the top-level maps, O(nodes + edges). Fine for the
 * embedded and test deployments this class serves; a remote-backed store
 * replaces it behind the same interface.
 */
@Log4j2
public final class InMemoryGraphStore implements GraphStore {

    private final AtomicReference<ImmutableGraphSnapshot> current =
            new AtomicReference<>(ImmutableGraphSnapshot.EMPTY);

    @Override
    public GraphSnapshot snapshot() {
        return current.get();
    }

    @Override
    public long version() {
        return current.get().version();
    }

    @Override
    public WriteResult putNode(BusinessNode node) {
        return mutate(snap -> {
            ChangeKind kind = snap.contains(node.id()) ? ChangeKind.UPDATED : ChangeKind.CREATED;
            return new Step(snap.withNode(node), kind);
        });
    }

    @Override
    public WriteResult upsertEdge(RelationshipEdge edge, boolean overwrite) {
        return mutate(snap -> {
            requireEndpoints(snap, edge.pair());
            RelationshipEdge existing = snap.edge(edge.pair(), edge.type());
            if (existing != null && !overwrite)
                throw new EdgeConflictException(edge.pair(), edge.type());
            ChangeKind kind = existing == null ? ChangeKind.CREATED : ChangeKind.UPDATED;
            return new Step(snap.withEdge(edge), kind);
        });
    }

    @Override
    public WriteResult deleteEdge(EdgePair pair, RelationshipType type) {
        return mutate(snap -> {
            requireEndpoints(snap, pair);
            if (snap.edge(pair, type) == null)
                return new Step(snap, ChangeKind.DELETED);
            return new Step(snap.withoutEdge(pair, type), ChangeKind.DELETED);
        });
    }

    private static void requireEndpoints(ImmutableGraphSnapshot snap, EdgePair pair) {
        if (!snap.contains(pair.low()))
            throw new UnknownEntityException(pair.low());
        if (!snap.contains(pair.high()))
            throw new UnknownEntityException(pair.high());
    }

    private record Step(ImmutableGraphSnapshot next, ChangeKind kind) {
    }

    private WriteResult mutate(Function<ImmutableGraphSnapshot, Step> fn) {
        int attempts = 0;
        while (true) {
            ImmutableGraphSnapshot snap = current.get();
            Step step = fn.apply(snap);
            if (step.next() == snap)
                return new WriteResult(step.kind(), false, snap.version());
            if (current.compareAndSet(snap, step.next())) {
                if (attempts > 0)
                    log.debug("Store write published after {} contended attempts (version={})", attempts,
                            step.next().version());
                return new WriteResult(step.kind(), true, step.next().version());
            }
            attempts++;
        }
    }
}
