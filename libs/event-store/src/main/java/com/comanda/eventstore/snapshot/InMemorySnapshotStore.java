package com.comanda.eventstore.snapshot;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

public class InMemorySnapshotStore implements SnapshotStore {

    private final Map<UUID, Snapshot<?>> snapshots = new ConcurrentHashMap<>();

    @Override
    public void save(Snapshot<?> snapshot) {
        snapshots.merge(
                snapshot.aggregateId(),
                snapshot,
                (held, offered) -> offered.version() > held.version() ? offered : held);
    }

    @Override
    @SuppressWarnings("unchecked")
    public <S> Optional<Snapshot<S>> latest(UUID aggregateId, Class<S> stateType) {
        Snapshot<?> snapshot = snapshots.get(aggregateId);
        if (snapshot == null || !stateType.isInstance(snapshot.state())) {
            return Optional.empty();
        }
        return Optional.of((Snapshot<S>) snapshot);
    }

    public int size() {
        return snapshots.size();
    }
}
