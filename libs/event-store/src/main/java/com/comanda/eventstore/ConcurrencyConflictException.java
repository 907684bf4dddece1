package com.comanda.eventstore;

import java.util.UUID;

/**
 * Thrown when an append names an expected version that no longer matches the stream. Nothing was
 * written; the caller must reload the aggregate and re-issue the command.
 */
public class ConcurrencyConflictException extends EventStoreException {

    private final UUID aggregateId;
    private final long expectedVersion;
    private final long actualVersion;

    public ConcurrencyConflictException(UUID aggregateId, long expectedVersion, long actualVersion) {
        super("Concurrency conflict on aggregate %s: expected version %d but stream is at %d"
                .formatted(aggregateId, expectedVersion, actualVersion));
        this.aggregateId = aggregateId;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    public UUID aggregateId() {
        return aggregateId;
    }

    public long expectedVersion() {
        return expectedVersion;
    }

    public long actualVersion() {
        return actualVersion;
    }
}
