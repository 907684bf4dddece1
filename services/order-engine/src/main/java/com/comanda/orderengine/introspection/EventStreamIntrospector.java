package com.comanda.orderengine.introspection;

import com.comanda.eventmodel.AggregateType;
import com.comanda.eventmodel.DomainEvent;
import com.comanda.eventmodel.EventType;
import com.comanda.eventstore.EventStore;
import com.comanda.eventstore.aggregate.StateEvolver;
import com.comanda.eventstore.snapshot.Snapshot;
import com.comanda.eventstore.snapshot.SnapshotStore;
import com.comanda.orderengine.domain.exception.OrderEngineException;
import com.comanda.orderengine.domain.exception.OrderNotFoundException;
import com.comanda.orderengine.domain.exception.SessionNotFoundException;
import com.comanda.orderengine.domain.exception.ValidationException;
import com.comanda.orderengine.domain.order.OrderEvolver;
import com.comanda.orderengine.domain.order.OrderState;
import com.comanda.orderengine.domain.session.SessionEvolver;
import com.comanda.orderengine.domain.session.SessionState;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;
import java.util.function.Function;

/**
 * Read-only views of event streams: state at a past instant, statistics and annotated timelines.
 * Only committed events are read and no locks are taken.
 */
public class EventStreamIntrospector {

    private final EventStore eventStore;
    private final SnapshotStore snapshotStore;

    public EventStreamIntrospector(EventStore eventStore, SnapshotStore snapshotStore) {
        this.eventStore = eventStore;
        this.snapshotStore = snapshotStore;
    }

    /**
     * The order as of {@code timestamp}, folded from the events recorded at or before it.
     *
     * @return empty if the order's first event was recorded after {@code timestamp}
     * @throws OrderNotFoundException if no such order exists
     */
    public Optional<OrderState> getOrderStateAtTimestamp(UUID orderId, Instant timestamp) {
        return stateAt(orderId, timestamp, AggregateType.ORDER, OrderEvolver.INSTANCE, OrderNotFoundException::new);
    }

    public Optional<SessionState> getSessionStateAtTimestamp(UUID sessionId, Instant timestamp) {
        return stateAt(
                sessionId, timestamp, AggregateType.ORDER_SESSION, SessionEvolver.INSTANCE, SessionNotFoundException::new);
    }

    public EventStatistics getEventStatistics(UUID aggregateId) {
        List<DomainEvent> events = requireStream(aggregateId);
        Map<EventType, Long> byType = new EnumMap<>(EventType.class);
        Map<String, Long> byActor = new TreeMap<>();
        for (DomainEvent event : events) {
            byType.merge(event.eventType(), 1L, Long::sum);
            byActor.merge(event.actorOrSystem(), 1L, Long::sum);
        }
        Instant first = events.get(0).recordedAt();
        Instant last = events.get(events.size() - 1).recordedAt();
        return new EventStatistics(
                aggregateId,
                events.get(0).aggregateType(),
                events.size(),
                byType,
                byActor,
                first,
                last,
                Duration.between(first, last));
    }

    /**
     * Events recorded within {@code [from, to]}, oldest first.
     *
     * @throws ValidationException if {@code from} is after {@code to}
     */
    public List<TimelineEntry> replayBetween(UUID aggregateId, Instant from, Instant to) {
        if (from == null || to == null || from.isAfter(to)) {
            throw new ValidationException("replay window [%s, %s] is empty or incomplete".formatted(from, to));
        }
        requireStream(aggregateId);
        return eventStore.loadBetween(aggregateId, from, to).stream().map(TimelineEntry::of).toList();
    }

    /** The whole stream, newest first. */
    public List<TimelineEntry> getEventStream(UUID aggregateId) {
        List<TimelineEntry> timeline = new ArrayList<>();
        for (DomainEvent event : requireStream(aggregateId)) {
            timeline.add(TimelineEntry.of(event));
        }
        Collections.reverse(timeline);
        return timeline;
    }

    public <S> Optional<Snapshot<S>> getLatestSnapshot(UUID aggregateId, Class<S> stateType) {
        return snapshotStore.latest(aggregateId, stateType);
    }

    private <S> Optional<S> stateAt(
            UUID aggregateId,
            Instant timestamp,
            AggregateType type,
            StateEvolver<S> evolver,
            Function<UUID, OrderEngineException> notFound) {
        List<DomainEvent> all = eventStore.load(aggregateId);
        if (all.isEmpty() || all.get(0).aggregateType() != type) {
            throw notFound.apply(aggregateId);
        }
        List<DomainEvent> prefix = eventStore.loadUpTo(aggregateId, timestamp);
        if (prefix.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(evolver.applyAll(evolver.initial(aggregateId), prefix));
    }

    private List<DomainEvent> requireStream(UUID aggregateId) {
        List<DomainEvent> events = eventStore.load(aggregateId);
        if (events.isEmpty()) {
            throw new OrderNotFoundException(aggregateId);
        }
        return events;
    }
}
