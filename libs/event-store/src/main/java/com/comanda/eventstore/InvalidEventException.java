package com.comanda.eventstore;

import java.util.List;
import java.util.UUID;

/** Thrown when an append batch contains an event that fails validation. Nothing was written. */
public class InvalidEventException extends EventStoreException {

    private final UUID aggregateId;
    private final List<String> errors;

    public InvalidEventException(UUID aggregateId, List<String> errors) {
        super("Rejected events for aggregate %s: %s"
                .formatted(aggregateId, String.join("; ", errors)));
        this.aggregateId = aggregateId;
        this.errors = List.copyOf(errors);
    }

    public UUID aggregateId() {
        return aggregateId;
    }

    public List<String> errors() {
        return errors;
    }
}
