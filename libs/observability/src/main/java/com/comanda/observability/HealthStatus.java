package com.comanda.observability;

/** Health of one component or of the whole engine. Ordered from best to worst. */
public enum HealthStatus {

    /** Functioning normally. */
    HEALTHY,

    /** Serving commands, but reads may be stale or slow. */
    DEGRADED,

    /** Cannot serve commands. */
    UNHEALTHY;

    /** The worse of the two statuses. */
    public HealthStatus worst(HealthStatus other) {
        return other.ordinal() > ordinal() ? other : this;
    }
}
