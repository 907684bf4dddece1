package com.comanda.eventmodel;

import java.time.Instant;
import java.util.Map;

/**
 * Who, when and why for a single domain event.
 *
 * <p>{@code occurredAt} is stamped when the aggregate records the event and is the only clock that
 * derived state may read. Anything that does not fit a named field goes in {@code attributes}.
 */
public record EventMetadata(
        /** Identifier of the staff member, customer or system that caused the event. */
        String actorId,

        /** Display name of the actor, when known. */
        String actorName,

        /** Correlation ID linking the events of one command or flow. */
        String correlationId,

        /** ID of the event or command that directly caused this event. */
        String causationId,

        /** Name of the component that recorded the event (e.g. "order-engine"). */
        String source,

        /** Business time of the event. */
        Instant occurredAt,

        /** Free-form string attributes. Never null. */
        Map<String, String> attributes) {

    public EventMetadata {
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    /** Metadata for an event caused directly by an actor, without correlation. */
    public static EventMetadata of(String actorId, String actorName, Instant occurredAt) {
        return new EventMetadata(actorId, actorName, null, null, null, occurredAt, Map.of());
    }

    /** Copy with a different business time. */
    public EventMetadata withOccurredAt(Instant at) {
        return new EventMetadata(
                actorId, actorName, correlationId, causationId, source, at, attributes);
    }

    /** Copy with one more attribute. Replaces an existing value for the same key. */
    public EventMetadata withAttribute(String key, String value) {
        var merged = new java.util.HashMap<>(attributes);
        merged.put(key, value);
        return new EventMetadata(
                actorId, actorName, correlationId, causationId, source, occurredAt, merged);
    }
}
