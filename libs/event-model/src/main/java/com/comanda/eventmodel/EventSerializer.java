package com.comanda.eventmodel;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * JSON serialization and deserialization for {@link DomainEvent}.
 *
 * <p>Wire shape: {@code {eventId, aggregateId, aggregateType, version, eventType, payload,
 * metadata, recordedAt}} where {@code eventType} and {@code aggregateType} are their canonical
 * string values and {@code payload} is the payload record as an object. The payload class is
 * resolved from the event type on the way back in.
 */
public final class EventSerializer {

    private static final ObjectMapper MAPPER = createMapper();

    private EventSerializer() {
        // utility class
    }

    private static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    /**
     * Serializes a committed event to a JSON string.
     *
     * @throws EventSerializationException if serialization fails
     */
    public static String serialize(DomainEvent event) {
        try {
            ObjectNode node = MAPPER.createObjectNode();
            node.put("eventId", event.eventId().toString());
            node.put("aggregateId", event.aggregateId().toString());
            node.put("aggregateType", event.aggregateType().value());
            node.put("version", event.version());
            node.put("eventType", event.eventType().value());
            node.set("payload", MAPPER.valueToTree(event.payload()));
            node.set("metadata", MAPPER.valueToTree(event.metadata()));
            node.set("recordedAt", MAPPER.valueToTree(event.recordedAt()));
            return MAPPER.writeValueAsString(node);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new EventSerializationException(
                    "Failed to serialize event: " + event.eventId(), e);
        }
    }

    /**
     * Deserializes a JSON string back to a committed event with its typed payload.
     *
     * @throws EventSerializationException if the JSON is malformed or names an unknown kind
     */
    public static DomainEvent deserialize(String json) {
        try {
            JsonNode node = MAPPER.readTree(json);
            String typeValue = requiredText(node, "eventType");
            EventType eventType =
                    EventType.fromString(typeValue)
                            .orElseThrow(
                                    () ->
                                            new EventSerializationException(
                                                    "Unknown event type: " + typeValue, null));
            String aggregateValue = requiredText(node, "aggregateType");
            AggregateType aggregateType =
                    AggregateType.fromString(aggregateValue)
                            .orElseThrow(
                                    () ->
                                            new EventSerializationException(
                                                    "Unknown aggregate type: " + aggregateValue,
                                                    null));
            EventPayload payload = MAPPER.treeToValue(node.get("payload"), eventType.payloadType());
            EventMetadata metadata = MAPPER.treeToValue(node.get("metadata"), EventMetadata.class);
            Instant recordedAt = MAPPER.treeToValue(node.get("recordedAt"), Instant.class);
            return new DomainEvent(
                    UUID.fromString(requiredText(node, "eventId")),
                    UUID.fromString(requiredText(node, "aggregateId")),
                    aggregateType,
                    node.path("version").asLong(),
                    eventType,
                    payload,
                    metadata,
                    recordedAt);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new EventSerializationException("Failed to deserialize event", e);
        }
    }

    /** Safely deserializes, returning empty on failure. */
    public static Optional<DomainEvent> tryDeserialize(String json) {
        try {
            return Optional.of(deserialize(json));
        } catch (EventSerializationException e) {
            return Optional.empty();
        }
    }

    /** Serializes any value (payloads, snapshot state) with the shared mapper. */
    public static String toJson(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new EventSerializationException(
                    "Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    /** Returns the shared ObjectMapper (for advanced use). */
    public static ObjectMapper objectMapper() {
        return MAPPER;
    }

    private static String requiredText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.asText().isBlank()) {
            throw new EventSerializationException("Missing field: " + field, null);
        }
        return value.asText();
    }

    /** Exception thrown when event serialization/deserialization fails. */
    public static class EventSerializationException extends RuntimeException {
        public EventSerializationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
