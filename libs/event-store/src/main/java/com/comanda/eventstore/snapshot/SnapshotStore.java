package com.comanda.eventstore.snapshot;

import java.util.Optional;
import java.util.UUID;

/**
 * Holds the latest snapshot per aggregate. Snapshots are an optimization only: losing them never
 * changes what a load returns.
 */
public interface SnapshotStore {

    /** Stores the snapshot if it is newer than the one already held. */
    void save(Snapshot<?> snapshot);

    /**
     * Latest snapshot of the aggregate, if one exists and its state is of {@code stateType}.
     */
    <S> Optional<Snapshot<S>> latest(UUID aggregateId, Class<S> stateType);
}
