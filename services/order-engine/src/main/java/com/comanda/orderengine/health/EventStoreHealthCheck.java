package com.comanda.orderengine.health;

import com.comanda.eventmodel.AggregateType;
import com.comanda.eventstore.EventStore;
import com.comanda.observability.ComponentHealth;
import com.comanda.observability.HealthCheck;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/** Reads the stream index of the event store; unhealthy if that read fails. */
public class EventStoreHealthCheck implements HealthCheck {

    static final String NAME = "event-store";

    private final EventStore eventStore;

    public EventStoreHealthCheck(EventStore eventStore) {
        this.eventStore = eventStore;
    }

    @Override
    public CompletableFuture<ComponentHealth> check() {
        return CompletableFuture.supplyAsync(
                () -> {
                    try {
                        long orders = eventStore.aggregateIds(AggregateType.ORDER).size();
                        long sessions = eventStore.aggregateIds(AggregateType.ORDER_SESSION).size();
                        return ComponentHealth.healthy(NAME, Map.of("orders", orders, "sessions", sessions));
                    } catch (RuntimeException e) {
                        return ComponentHealth.unhealthy(NAME, "stream index unreadable: " + e.getMessage());
                    }
                });
    }
}
