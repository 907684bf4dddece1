package com.comanda.eventstore.aggregate;

import com.comanda.eventmodel.EventData;
import java.util.List;
import java.util.UUID;

/**
 * Pure fold from events to immutable aggregate state.
 *
 * <p>Implementations must be deterministic: they may read only the state and the event, never a
 * clock or any other ambient value. Timestamps come from the event metadata.
 *
 * @param <S> the state type
 */
public interface StateEvolver<S> {

    /** State of an aggregate before its first event. */
    S initial(UUID aggregateId);

    /** State after applying {@code event}. Must not modify {@code state}. */
    S apply(S state, EventData event);

    /** Folds {@code events} over {@code state} in order. */
    default S applyAll(S state, List<? extends EventData> events) {
        S current = state;
        for (EventData event : events) {
            current = apply(current, event);
        }
        return current;
    }
}
