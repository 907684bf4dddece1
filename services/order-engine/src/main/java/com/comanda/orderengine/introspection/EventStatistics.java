package com.comanda.orderengine.introspection;

import com.comanda.eventmodel.AggregateType;
import com.comanda.eventmodel.EventType;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Summary of one event stream.
 *
 * @param byActor event counts per actor id; events without an actor count as {@code system}
 * @param duration time between the first and the last {@code recordedAt}
 */
public record EventStatistics(
        UUID aggregateId,
        AggregateType aggregateType,
        long totalEvents,
        Map<EventType, Long> byType,
        Map<String, Long> byActor,
        Instant firstEventAt,
        Instant lastEventAt,
        Duration duration) {

    public EventStatistics {
        byType = Map.copyOf(byType);
        byActor = Map.copyOf(byActor);
    }
}
