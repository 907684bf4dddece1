package com.comanda.eventstore;

import com.comanda.eventmodel.AggregateType;
import com.comanda.eventmodel.DomainEvent;
import com.comanda.eventmodel.PendingEvent;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Append-only, versioned storage of domain events, one stream per aggregate.
 *
 * <p>Every read returns events in ascending version order. Returned events are copies; nothing a
 * caller does to them can change what is stored.
 */
public interface EventStore {

    /**
     * Atomically appends {@code events} to the stream of {@code aggregateId}.
     *
     * @param expectedVersion the version the caller last saw; 0 for a new stream
     * @return the stream version after the append
     * @throws ConcurrencyConflictException if the stream is not at {@code expectedVersion}
     * @throws InvalidEventException if any event fails validation or belongs to another stream type
     */
    long append(
            UUID aggregateId,
            AggregateType aggregateType,
            long expectedVersion,
            List<PendingEvent> events);

    /** All events of the stream; empty if the aggregate does not exist. */
    List<DomainEvent> load(UUID aggregateId);

    /** Events with a version strictly greater than {@code afterVersion}. */
    List<DomainEvent> loadAfter(UUID aggregateId, long afterVersion);

    /** Events recorded at or before {@code timestamp}. */
    List<DomainEvent> loadUpTo(UUID aggregateId, Instant timestamp);

    /** Events recorded within {@code [from, to]}, both ends inclusive. */
    List<DomainEvent> loadBetween(UUID aggregateId, Instant from, Instant to);

    /** Current version of the stream; 0 if it does not exist. */
    long currentVersion(UUID aggregateId);

    /** Ids of every stream of the given aggregate type. */
    List<UUID> aggregateIds(AggregateType aggregateType);

    /** Registers a listener notified after every successful append. */
    void subscribe(EventStreamListener listener);
}
