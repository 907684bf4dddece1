package com.comanda.observability;

import java.util.UUID;

/**
 * Immutable context of the command being handled: who issues it, at which location, and the
 * identifiers that tie its log lines, spans and events together.
 *
 * <p>Set on the handling thread through {@link CorrelationContextHolder}; its values are copied
 * into SLF4J MDC and into the metadata of every event the command records.
 *
 * @param correlationId unique ID for the business flow (e.g. a session and the order it becomes)
 * @param locationId restaurant location handling the command (nullable)
 * @param actorId staff member, customer or integration issuing the command (nullable for system)
 * @param actorName display name of the actor (nullable)
 * @param requestId unique ID for this specific command invocation
 * @param traceId current OpenTelemetry trace ID (nullable if tracing is not active)
 */
public record CorrelationContext(
        String correlationId,
        String locationId,
        String actorId,
        String actorName,
        String requestId,
        String traceId) {

    public static final String MDC_CORRELATION_ID = "correlationId";
    public static final String MDC_LOCATION_ID = "locationId";
    public static final String MDC_ACTOR_ID = "actorId";
    public static final String MDC_REQUEST_ID = "requestId";
    public static final String MDC_TRACE_ID = "traceId";

    public CorrelationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }

    /** A new flow started by the given actor, with fresh correlation and request ids. */
    public static CorrelationContext forActor(String actorId, String actorName, String locationId) {
        return new CorrelationContext(
                UUID.randomUUID().toString(),
                locationId,
                actorId,
                actorName,
                UUID.randomUUID().toString(),
                null);
    }

    /** Same flow and actor, new request id. */
    public CorrelationContext nextRequest() {
        return new CorrelationContext(
                correlationId, locationId, actorId, actorName, UUID.randomUUID().toString(), traceId);
    }
}
