package com.comanda.observability;

import java.time.Instant;
import java.util.Map;

/**
 * Aggregate health of all registered components.
 *
 * @param status the worst component status, HEALTHY when nothing is registered
 * @param checks component results keyed by component name
 * @param timestamp when the checks completed
 */
public record HealthResult(HealthStatus status, Map<String, ComponentHealth> checks, Instant timestamp) {

    public HealthResult {
        checks = Map.copyOf(checks);
    }

    public boolean isHealthy() {
        return status == HealthStatus.HEALTHY;
    }
}
