package com.comanda.eventmodel;

/**
 * The part of an event that state evolution reads: its kind, payload and metadata.
 *
 * <p>Implemented both by events still pending in an aggregate and by committed {@link
 * DomainEvent}s, so the same fold runs on either.
 */
public interface EventData {

    EventType eventType();

    EventPayload payload();

    EventMetadata metadata();

    /**
     * Returns the payload cast to the expected record.
     *
     * @throws IllegalStateException if the payload is of a different type
     */
    default <T extends EventPayload> T payloadAs(Class<T> type) {
        EventPayload payload = payload();
        if (!type.isInstance(payload)) {
            throw new IllegalStateException(
                    "Event %s carries %s, not %s"
                            .formatted(
                                    eventType().value(),
                                    payload == null ? "no payload" : payload.getClass().getName(),
                                    type.getName()));
        }
        return type.cast(payload);
    }
}
