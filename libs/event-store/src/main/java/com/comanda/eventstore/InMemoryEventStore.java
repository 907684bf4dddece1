package com.comanda.eventstore;

import com.comanda.eventmodel.AggregateType;
import com.comanda.eventmodel.DomainEvent;
import com.comanda.eventmodel.EventFactory;
import com.comanda.eventmodel.EventSerializer;
import com.comanda.eventmodel.EventValidator;
import com.comanda.eventmodel.PendingEvent;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link EventStore} backed by a {@link ConcurrentHashMap}.
 *
 * <p>Appends to one aggregate are serialized by {@code compute} on its key; appends to different
 * aggregates never contend. Each stream is an immutable snapshot replaced on append, so readers
 * never see a partial batch. Events are held in their JSON wire form and deserialized on read.
 */
public class InMemoryEventStore implements EventStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryEventStore.class);

    private final Map<UUID, Stream> streams = new ConcurrentHashMap<>();
    private final List<EventStreamListener> listeners = new CopyOnWriteArrayList<>();
    private final Clock clock;

    public InMemoryEventStore(Clock clock) {
        this.clock = clock;
    }

    public InMemoryEventStore() {
        this(Clock.systemUTC());
    }

    @Override
    public long append(
            UUID aggregateId,
            AggregateType aggregateType,
            long expectedVersion,
            List<PendingEvent> events) {
        validate(aggregateId, aggregateType, events);

        var committed = new ArrayList<DomainEvent>(events.size());
        Stream updated =
                streams.compute(
                        aggregateId,
                        (id, existing) -> {
                            long current = existing == null ? 0 : existing.version();
                            if (existing != null && existing.type() != aggregateType) {
                                throw new InvalidEventException(
                                        id,
                                        List.of(
                                                "stream is of type %s, not %s"
                                                        .formatted(
                                                                existing.type().value(),
                                                                aggregateType.value())));
                            }
                            if (current != expectedVersion) {
                                throw new ConcurrencyConflictException(id, expectedVersion, current);
                            }
                            Instant recordedAt = clock.instant();
                            if (existing != null && recordedAt.isBefore(existing.lastRecordedAt())) {
                                recordedAt = existing.lastRecordedAt();
                            }
                            var rows = new ArrayList<StoredEvent>();
                            if (existing != null) {
                                rows.addAll(existing.rows());
                            }
                            long version = current;
                            for (PendingEvent pending : events) {
                                version++;
                                DomainEvent event =
                                        EventFactory.committed(
                                                id, aggregateType, version, pending, recordedAt);
                                rows.add(
                                        new StoredEvent(
                                                version, recordedAt, EventSerializer.serialize(event)));
                                committed.add(event);
                            }
                            return new Stream(aggregateType, List.copyOf(rows));
                        });

        log.debug(
                "Appended {} event(s) to {} {}; now at version {}",
                events.size(),
                aggregateType.value(),
                aggregateId,
                updated.version());
        notifyListeners(committed);
        return updated.version();
    }

    @Override
    public List<DomainEvent> load(UUID aggregateId) {
        return read(aggregateId, row -> true);
    }

    @Override
    public List<DomainEvent> loadAfter(UUID aggregateId, long afterVersion) {
        return read(aggregateId, row -> row.version() > afterVersion);
    }

    @Override
    public List<DomainEvent> loadUpTo(UUID aggregateId, Instant timestamp) {
        return read(aggregateId, row -> !row.recordedAt().isAfter(timestamp));
    }

    @Override
    public List<DomainEvent> loadBetween(UUID aggregateId, Instant from, Instant to) {
        return read(
                aggregateId,
                row -> !row.recordedAt().isBefore(from) && !row.recordedAt().isAfter(to));
    }

    @Override
    public long currentVersion(UUID aggregateId) {
        Stream stream = streams.get(aggregateId);
        return stream == null ? 0 : stream.version();
    }

    @Override
    public List<UUID> aggregateIds(AggregateType aggregateType) {
        return streams.entrySet().stream()
                .filter(e -> e.getValue().type() == aggregateType)
                .map(Map.Entry::getKey)
                .toList();
    }

    @Override
    public void subscribe(EventStreamListener listener) {
        listeners.add(listener);
    }

    /** Total number of stored events across all streams. */
    public long eventCount() {
        return streams.values().stream().mapToLong(Stream::version).sum();
    }

    private void validate(UUID aggregateId, AggregateType aggregateType, List<PendingEvent> events) {
        if (aggregateId == null || aggregateType == null) {
            throw new InvalidEventException(
                    aggregateId, List.of("aggregateId and aggregateType are required"));
        }
        if (events == null || events.isEmpty()) {
            throw new InvalidEventException(aggregateId, List.of("no events to append"));
        }
        var errors = new ArrayList<String>();
        for (int i = 0; i < events.size(); i++) {
            errors.addAll(EventValidator.validate(events.get(i), aggregateType).prefixed("event[" + i + "]: ").errors());
        }
        if (!errors.isEmpty()) {
            throw new InvalidEventException(aggregateId, errors);
        }
    }

    private List<DomainEvent> read(UUID aggregateId, Predicate<StoredEvent> filter) {
        Stream stream = streams.get(aggregateId);
        if (stream == null) {
            return List.of();
        }
        return stream.rows().stream()
                .filter(filter)
                .map(row -> EventSerializer.deserialize(row.json()))
                .toList();
    }

    private void notifyListeners(List<DomainEvent> committed) {
        for (EventStreamListener listener : listeners) {
            try {
                listener.onAppended(committed);
            } catch (RuntimeException e) {
                // The append is already committed; listeners repair themselves from the store.
                log.error(
                        "Listener {} failed for aggregate {}",
                        listener.getClass().getSimpleName(),
                        committed.get(0).aggregateId(),
                        e);
            }
        }
    }

    private record StoredEvent(long version, Instant recordedAt, String json) {}

    private record Stream(AggregateType type, List<StoredEvent> rows) {

        long version() {
            return rows.size();
        }

        Instant lastRecordedAt() {
            return rows.get(rows.size() - 1).recordedAt();
        }
    }
}
