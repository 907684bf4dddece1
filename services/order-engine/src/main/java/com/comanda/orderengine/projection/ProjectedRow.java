package com.comanda.orderengine.projection;

import java.time.Instant;
import java.util.UUID;

/**
 * One read-model row: the folded state of an aggregate up to {@code lastVersion}.
 *
 * @param stale true when applying a later event failed; {@link Projector#rebuild} repairs the row
 */
public record ProjectedRow<S>(
        UUID aggregateId, S state, long lastVersion, boolean stale, Instant createdAt, Instant updatedAt) {

    /** A stale row for an aggregate none of whose events could be applied. */
    public static <S> ProjectedRow<S> stalePlaceholder(UUID aggregateId, S initialState) {
        return new ProjectedRow<>(aggregateId, initialState, 0, true, null, null);
    }

    /** False only for a placeholder that no event has been applied to. */
    public boolean hasEvents() {
        return lastVersion > 0;
    }

    public ProjectedRow<S> markedStale() {
        return new ProjectedRow<>(aggregateId, state, lastVersion, true, createdAt, updatedAt);
    }
}
