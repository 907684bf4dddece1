package com.comanda.eventmodel;

import java.time.Instant;
import java.util.UUID;

/**
 * A committed, immutable domain event.
 *
 * <p>Once appended an event is never modified or deleted. Versions within one aggregate stream start
 * at 1 and have no gaps.
 */
public record DomainEvent(
        /** Unique identifier for this event instance. */
        UUID eventId,

        /** The aggregate stream this event belongs to. */
        UUID aggregateId,

        /** Type of the aggregate stream. */
        AggregateType aggregateType,

        /** Position of the event in its stream, starting at 1. */
        long version,

        /** The kind of event. */
        EventType eventType,

        /** Typed payload matching {@link EventType#payloadType()}. */
        EventPayload payload,

        /** Actor, correlation and business time. */
        EventMetadata metadata,

        /** When the store committed the event. Time-travel queries filter on this. */
        Instant recordedAt)
        implements EventData {

    /** Actor id, or {@code "system"} when the event has none. */
    public String actorOrSystem() {
        if (metadata == null || metadata.actorId() == null || metadata.actorId().isBlank()) {
            return "system";
        }
        return metadata.actorId();
    }
}
