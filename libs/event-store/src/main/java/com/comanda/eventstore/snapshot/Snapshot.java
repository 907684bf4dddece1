package com.comanda.eventstore.snapshot;

import java.time.Instant;
import java.util.UUID;

/**
 * Aggregate state as of {@code version}. Replay resumes with the event at {@code version + 1}.
 *
 * @param <S> the immutable state type
 */
public record Snapshot<S>(UUID aggregateId, long version, S state, Instant takenAt) {}
