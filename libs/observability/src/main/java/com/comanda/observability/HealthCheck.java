package com.comanda.observability;

import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * A probe of one component. The registry runs all probes concurrently and bounds each by a
 * timeout.
 */
@FunctionalInterface
public interface HealthCheck {

    CompletableFuture<ComponentHealth> check();

    /** Adapts a synchronous probe; it runs on the common pool. */
    static HealthCheck of(Supplier<ComponentHealth> probe) {
        return () -> CompletableFuture.supplyAsync(probe);
    }
}
