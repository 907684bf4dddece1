package com.comanda.eventmodel;

/**
 * An event recorded by an aggregate but not yet appended to the store. The store assigns the
 * version, event id and recording time on append.
 */
public record PendingEvent(EventType eventType, EventPayload payload, EventMetadata metadata)
        implements EventData {}
