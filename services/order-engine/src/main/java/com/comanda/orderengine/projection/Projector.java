package com.comanda.orderengine.projection;

import com.comanda.eventmodel.AggregateType;
import com.comanda.eventmodel.DomainEvent;
import com.comanda.eventstore.EventStore;
import com.comanda.eventstore.aggregate.StateEvolver;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Folds the events of one aggregate type into a {@link ProjectionStore}, with the same evolver the
 * aggregates use.
 *
 * <p>A version at or below the row's last version is a duplicate and ignored. The next version is
 * applied. A later version means events were missed, so the row catches up from the store.
 */
public class Projector<S> {

    private static final Logger log = LoggerFactory.getLogger(Projector.class);

    private final AggregateType aggregateType;
    private final StateEvolver<S> evolver;
    private final EventStore eventStore;
    private final ProjectionStore<S> rows;

    public Projector(
            AggregateType aggregateType, StateEvolver<S> evolver, EventStore eventStore, ProjectionStore<S> rows) {
        this.aggregateType = aggregateType;
        this.evolver = evolver;
        this.eventStore = eventStore;
        this.rows = rows;
    }

    public boolean handles(AggregateType type) {
        return aggregateType == type;
    }

    public AggregateType aggregateType() {
        return aggregateType;
    }

    public void project(DomainEvent event) {
        rows.update(
                event.aggregateId(),
                (id, row) -> {
                    long last = row == null ? 0 : row.lastVersion();
                    if (event.version() <= last) {
                        log.debug("Ignoring duplicate {} v{} of {}", event.eventType().value(), event.version(), id);
                        return row;
                    }
                    if (event.version() == last + 1) {
                        return fold(id, row, List.of(event));
                    }
                    List<DomainEvent> missed = eventStore.loadAfter(id, last);
                    log.info(
                            "Projection of {} {} is at v{} but received v{}; catching up {} event(s)",
                            aggregateType.value(),
                            id,
                            last,
                            event.version(),
                            missed.size());
                    return missed.isEmpty() ? row : fold(id, row, missed);
                });
    }

    /**
     * Marks the row stale after a failed update. When the aggregate's first event failed there is
     * no row yet, so an empty stale row is left for health checks and {@link #rebuild} to find.
     */
    public void markStale(UUID aggregateId) {
        rows.update(
                aggregateId,
                (id, row) -> row == null
                        ? ProjectedRow.stalePlaceholder(id, evolver.initial(id))
                        : row.markedStale());
    }

    /** Replays the aggregate from its first event and replaces the row. */
    public void rebuild(UUID aggregateId) {
        List<DomainEvent> events = eventStore.load(aggregateId);
        if (events.isEmpty()) {
            rows.remove(aggregateId);
            return;
        }
        rows.put(fold(aggregateId, null, events));
    }

    /**
     * Rebuilds every row of this aggregate type.
     *
     * @return the number of rows rebuilt
     */
    public int rebuildAll() {
        List<UUID> ids = eventStore.aggregateIds(aggregateType);
        for (UUID id : ids) {
            rebuild(id);
        }
        log.info("Rebuilt {} {} projection row(s)", ids.size(), aggregateType.value());
        return ids.size();
    }

    private ProjectedRow<S> fold(UUID id, ProjectedRow<S> row, List<DomainEvent> events) {
        S state = row == null ? evolver.initial(id) : row.state();
        state = evolver.applyAll(state, events);
        DomainEvent lastEvent = events.get(events.size() - 1);
        return new ProjectedRow<>(
                id,
                state,
                lastEvent.version(),
                false,
                row == null || !row.hasEvents() ? events.get(0).recordedAt() : row.createdAt(),
                lastEvent.recordedAt());
    }
}
