package com.comanda.observability;

import java.util.Map;

/**
 * Health of a single component.
 *
 * @param name component name (e.g. "event-store", "projections")
 * @param status health status of this component
 * @param message optional human-readable message
 * @param details numeric facts behind the status (e.g. queue backlog)
 */
public record ComponentHealth(
        String name, HealthStatus status, String message, Map<String, Long> details) {

    public ComponentHealth {
        details = details == null ? Map.of() : Map.copyOf(details);
    }

    public static ComponentHealth healthy(String name, Map<String, Long> details) {
        return new ComponentHealth(name, HealthStatus.HEALTHY, null, details);
    }

    public static ComponentHealth degraded(String name, String message, Map<String, Long> details) {
        return new ComponentHealth(name, HealthStatus.DEGRADED, message, details);
    }

    public static ComponentHealth unhealthy(String name, String message) {
        return new ComponentHealth(name, HealthStatus.UNHEALTHY, message, Map.of());
    }
}
