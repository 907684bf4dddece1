package com.comanda.orderengine.health;

import com.comanda.observability.ComponentHealth;
import com.comanda.observability.HealthCheck;
import com.comanda.orderengine.projection.ProjectionDispatcher;
import com.comanda.orderengine.projection.ProjectionStore;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/** Degraded when any row is stale or the projection backlog exceeds its limit. */
public class ProjectionHealthCheck implements HealthCheck {

    static final String NAME = "projections";

    private final ProjectionDispatcher dispatcher;
    private final List<ProjectionStore<?>> stores;
    private final long maxBacklog;

    public ProjectionHealthCheck(ProjectionDispatcher dispatcher, List<ProjectionStore<?>> stores, long maxBacklog) {
        this.dispatcher = dispatcher;
        this.stores = List.copyOf(stores);
        this.maxBacklog = maxBacklog;
    }

    @Override
    public CompletableFuture<ComponentHealth> check() {
        long stale = stores.stream().mapToLong(ProjectionStore::staleCount).sum();
        long backlog = dispatcher.backlog();
        Map<String, Long> details = Map.of("staleRows", stale, "backlog", backlog);
        ComponentHealth health;
        if (stale > 0) {
            health = ComponentHealth.degraded(NAME, stale + " stale row(s); rebuild required", details);
        } else if (backlog > maxBacklog) {
            health = ComponentHealth.degraded(NAME, "backlog of " + backlog + " exceeds " + maxBacklog, details);
        } else {
            health = ComponentHealth.healthy(NAME, details);
        }
        return CompletableFuture.completedFuture(health);
    }
}
