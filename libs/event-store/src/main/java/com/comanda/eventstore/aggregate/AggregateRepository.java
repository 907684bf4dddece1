package com.comanda.eventstore.aggregate;

import com.comanda.eventmodel.AggregateType;
import com.comanda.eventmodel.DomainEvent;
import com.comanda.eventstore.EventStore;
import com.comanda.eventstore.snapshot.Snapshot;
import com.comanda.eventstore.snapshot.SnapshotStore;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads aggregates by replay and persists their pending events in one append.
 *
 * <p>When a snapshot interval is set, a snapshot is saved whenever a persist crosses a multiple of
 * the interval. Loading starts from the latest snapshot and replays only the tail.
 *
 * @param <S> the state type
 * @param <A> the aggregate type
 */
public class AggregateRepository<S, A extends AggregateRoot<S>> {

    private static final Logger log = LoggerFactory.getLogger(AggregateRepository.class);

    private final EventStore eventStore;
    private final SnapshotStore snapshotStore;
    private final AggregateType aggregateType;
    private final Class<S> stateType;
    private final StateEvolver<S> evolver;
    private final AggregateFactory<S, A> factory;
    private final MetadataProvider metadata;
    private final int snapshotInterval;
    private final Clock clock;

    public AggregateRepository(
            EventStore eventStore,
            SnapshotStore snapshotStore,
            AggregateType aggregateType,
            Class<S> stateType,
            StateEvolver<S> evolver,
            AggregateFactory<S, A> factory,
            MetadataProvider metadata,
            int snapshotInterval,
            Clock clock) {
        this.eventStore = eventStore;
        this.snapshotStore = snapshotStore;
        this.aggregateType = aggregateType;
        this.stateType = stateType;
        this.evolver = evolver;
        this.factory = factory;
        this.metadata = metadata;
        this.snapshotInterval = snapshotInterval;
        this.clock = clock;
    }

    /** A fresh aggregate at version 0. Nothing is written until {@link #persist}. */
    public A create(UUID id) {
        return factory.create(id, evolver.initial(id), 0, metadata);
    }

    /** Replays the aggregate, or returns empty if its stream does not exist. */
    public Optional<A> load(UUID id) {
        S state = evolver.initial(id);
        long version = 0;
        Optional<Snapshot<S>> snapshot = snapshotStore.latest(id, stateType);
        if (snapshot.isPresent()) {
            state = snapshot.get().state();
            version = snapshot.get().version();
        }
        List<DomainEvent> tail = eventStore.loadAfter(id, version);
        if (version == 0 && tail.isEmpty()) {
            return Optional.empty();
        }
        state = evolver.applyAll(state, tail);
        version += tail.size();
        log.debug(
                "Loaded {} {} at version {} ({} event(s) replayed{})",
                aggregateType.value(),
                id,
                version,
                tail.size(),
                snapshot.isPresent() ? " after snapshot" : "");
        return Optional.of(factory.create(id, state, version, metadata));
    }

    /**
     * Appends the aggregate's pending events with its loaded version as the expected version.
     *
     * @return the new stream version
     * @throws com.comanda.eventstore.ConcurrencyConflictException if the stream moved on
     */
    public long persist(A aggregate) {
        if (!aggregate.hasPendingEvents()) {
            return aggregate.persistedVersion();
        }
        long before = aggregate.persistedVersion();
        long after =
                eventStore.append(
                        aggregate.id(), aggregateType, before, aggregate.pendingEvents());
        aggregate.markPersisted(after);
        if (snapshotInterval > 0 && after / snapshotInterval > before / snapshotInterval) {
            snapshotStore.save(
                    new Snapshot<>(aggregate.id(), after, aggregate.state(), clock.instant()));
            log.debug("Snapshot of {} {} at version {}", aggregateType.value(), aggregate.id(), after);
        }
        return after;
    }

    /** Folds a list of committed events from the initial state. */
    public S replay(UUID id, List<DomainEvent> events) {
        return evolver.applyAll(evolver.initial(id), events);
    }

    public AggregateType aggregateType() {
        return aggregateType;
    }
}
