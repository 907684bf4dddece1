package com.comanda.orderengine.introspection;

import com.comanda.eventmodel.DomainEvent;
import com.comanda.eventmodel.EventPayload;
import com.comanda.eventmodel.EventType;
import java.time.Instant;
import java.util.UUID;

/** A committed event annotated for display. */
public record TimelineEntry(
        UUID eventId,
        long version,
        EventType eventType,
        EventPayload payload,
        String actorId,
        Instant occurredAt,
        Instant recordedAt,
        EventPresentation presentation) {

    public static TimelineEntry of(DomainEvent event) {
        return new TimelineEntry(
                event.eventId(),
                event.version(),
                event.eventType(),
                event.payload(),
                event.actorOrSystem(),
                event.metadata().occurredAt(),
                event.recordedAt(),
                EventPresentations.describe(event));
    }
}
