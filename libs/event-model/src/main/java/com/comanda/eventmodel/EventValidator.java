package com.comanda.eventmodel;

import java.util.ArrayList;

/**
 * Validates events for required fields and kind/payload/stream consistency before they are
 * written. Returns all errors at once in a {@link ValidationResult}.
 */
public final class EventValidator {

    private EventValidator() {
        // utility class
    }

    /**
     * Validates a pending event destined for a stream of the given aggregate type.
     *
     * @param event the event to validate
     * @param streamType the aggregate type of the target stream
     * @return a {@link ValidationResult} with any errors found
     */
    public static ValidationResult validate(PendingEvent event, AggregateType streamType) {
        var errors = new ArrayList<String>();
        if (event == null) {
            errors.add("event must not be null");
            return ValidationResult.of(errors);
        }
        EventType type = event.eventType();
        if (type == null) {
            errors.add("eventType must not be null");
        }
        if (event.payload() == null) {
            errors.add("payload must not be null");
        }
        if (type != null && event.payload() != null
                && !type.payloadType().isInstance(event.payload())) {
            errors.add(
                    "payload of %s must be %s but was %s"
                            .formatted(
                                    type.value(),
                                    type.payloadType().getSimpleName(),
                                    event.payload().getClass().getSimpleName()));
        }
        if (type != null && streamType != null && type.aggregateType() != streamType) {
            errors.add(
                    "%s does not belong to a %s stream"
                            .formatted(type.value(), streamType.value()));
        }
        if (event.metadata() == null) {
            errors.add("metadata must not be null");
        } else if (event.metadata().occurredAt() == null) {
            errors.add("metadata.occurredAt must not be null");
        }
        return ValidationResult.of(errors);
    }

    /** Validates a committed event, including its identity fields. */
    public static ValidationResult validate(DomainEvent event) {
        var errors = new ArrayList<String>();
        if (event.eventId() == null) {
            errors.add("eventId must not be null");
        }
        if (event.aggregateId() == null) {
            errors.add("aggregateId must not be null");
        }
        if (event.aggregateType() == null) {
            errors.add("aggregateType must not be null");
        }
        if (event.version() < 1) {
            errors.add("version must be >= 1");
        }
        if (event.recordedAt() == null) {
            errors.add("recordedAt must not be null");
        }
        var pending = new PendingEvent(event.eventType(), event.payload(), event.metadata());
        errors.addAll(validate(pending, event.aggregateType()).errors());
        return ValidationResult.of(errors);
    }
}
