package com.comanda.eventstore.aggregate;

import com.comanda.eventmodel.AggregateType;
import com.comanda.eventmodel.EventFactory;
import com.comanda.eventmodel.EventPayload;
import com.comanda.eventmodel.EventType;
import com.comanda.eventmodel.PendingEvent;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Base class of event-sourced aggregates.
 *
 * <p>State is replaced only by {@link #recordThat}, which runs the same {@link StateEvolver} used
 * for replay. Subclasses validate a command against {@link #state()} first and record events only
 * once every check has passed. Recorded events stay pending until the repository persists them.
 *
 * @param <S> the immutable state type
 */
public abstract class AggregateRoot<S> {

    private final UUID id;
    private final StateEvolver<S> evolver;
    private final MetadataProvider metadata;
    private final List<PendingEvent> pending = new ArrayList<>();
    private S state;
    private long persistedVersion;

    protected AggregateRoot(
            UUID id,
            StateEvolver<S> evolver,
            MetadataProvider metadata,
            S state,
            long persistedVersion) {
        this.id = id;
        this.evolver = evolver;
        this.metadata = metadata;
        this.state = state;
        this.persistedVersion = persistedVersion;
    }

    public abstract AggregateType aggregateType();

    public UUID id() {
        return id;
    }

    public S state() {
        return state;
    }

    /** Version of the stream this aggregate was loaded at (or last persisted to). */
    public long persistedVersion() {
        return persistedVersion;
    }

    /** Version including pending events. */
    public long version() {
        return persistedVersion + pending.size();
    }

    public List<PendingEvent> pendingEvents() {
        return List.copyOf(pending);
    }

    public boolean hasPendingEvents() {
        return !pending.isEmpty();
    }

    protected final void recordThat(EventType type, EventPayload payload) {
        PendingEvent event = EventFactory.pending(type, payload, metadata.next());
        state = evolver.apply(state, event);
        pending.add(event);
    }

    /** Called by the repository once the pending events are committed at {@code newVersion}. */
    void markPersisted(long newVersion) {
        pending.clear();
        persistedVersion = newVersion;
    }
}
