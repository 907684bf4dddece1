package com.comanda.observability;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Thin wrapper around an OpenTelemetry {@link Tracer} that runs work inside a span and attaches
 * the current {@link CorrelationContext} as span attributes.
 *
 * <p>SDK setup (exporter, sampler, resource) is the application's concern.
 */
public final class SpanHelper {

    private final Tracer tracer;

    public SpanHelper(Tracer tracer) {
        if (tracer == null) {
            throw new IllegalArgumentException("tracer must not be null");
        }
        this.tracer = tracer;
    }

    /** Runs {@code work} in an internal span named {@code spanName}. */
    public <T> T withSpan(String spanName, Supplier<T> work) {
        return withSpan(spanName, SpanKind.INTERNAL, Map.of(), work);
    }

    /**
     * Runs {@code work} in a new span. The span ends when the work returns or throws; a thrown
     * exception is recorded on the span and rethrown unchanged.
     *
     * @param attributes extra string attributes (e.g. aggregate id)
     */
    public <T> T withSpan(
            String spanName, SpanKind kind, Map<String, String> attributes, Supplier<T> work) {
        var spanBuilder = tracer.spanBuilder(spanName).setSpanKind(kind);
        attributes.forEach(spanBuilder::setAttribute);
        Span span = spanBuilder.startSpan();

        CorrelationContextHolder.get()
                .ifPresent(
                        ctx -> {
                            span.setAttribute("correlation.id", ctx.correlationId());
                            if (ctx.locationId() != null) {
                                span.setAttribute("location.id", ctx.locationId());
                            }
                            if (ctx.actorId() != null) {
                                span.setAttribute("actor.id", ctx.actorId());
                            }
                        });

        try (Scope ignored = span.makeCurrent()) {
            T result = work.get();
            span.setStatus(StatusCode.OK);
            return result;
        } catch (RuntimeException e) {
            span.setStatus(StatusCode.ERROR, e.getMessage() == null ? "" : e.getMessage());
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    /** Void variant of {@link #withSpan(String, Supplier)}. */
    public void runInSpan(String spanName, Runnable runnable) {
        withSpan(
                spanName,
                () -> {
                    runnable.run();
                    return null;
                });
    }

    public Tracer tracer() {
        return tracer;
    }
}
