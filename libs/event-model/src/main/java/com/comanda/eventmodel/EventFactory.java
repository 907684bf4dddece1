package com.comanda.eventmodel;

import java.time.Instant;
import java.util.UUID;

/** Factory methods for {@link PendingEvent}s, committed {@link DomainEvent}s and child metadata. */
public final class EventFactory {

    private EventFactory() {
        // utility class
    }

    /** Creates a pending event of the given kind. */
    public static PendingEvent pending(
            EventType eventType, EventPayload payload, EventMetadata metadata) {
        return new PendingEvent(eventType, payload, metadata);
    }

    /** Turns a pending event into a committed one with a fresh event id. */
    public static DomainEvent committed(
            UUID aggregateId,
            AggregateType aggregateType,
            long version,
            PendingEvent pending,
            Instant recordedAt) {
        return new DomainEvent(
                UUID.randomUUID(),
                aggregateId,
                aggregateType,
                version,
                pending.eventType(),
                pending.payload(),
                pending.metadata(),
                recordedAt);
    }

    /**
     * Creates metadata for an event caused by {@code parent}. Correlation is inherited and the
     * causation id is set to the parent's event id.
     */
    public static EventMetadata childMetadata(
            DomainEvent parent, String actorId, String actorName, String source, Instant at) {
        String correlationId =
                parent.metadata() != null && parent.metadata().correlationId() != null
                        ? parent.metadata().correlationId()
                        : parent.eventId().toString();
        return new EventMetadata(
                actorId,
                actorName,
                correlationId,
                parent.eventId().toString(),
                source,
                at,
                java.util.Map.of());
    }
}
