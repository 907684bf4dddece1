package com.comanda.orderengine.application;

import com.comanda.eventstore.ConcurrencyConflictException;
import com.comanda.observability.CorrelationContext;
import com.comanda.observability.CorrelationContextHolder;
import com.comanda.observability.MetricFactory;
import com.comanda.observability.SpanHelper;
import com.comanda.orderengine.domain.exception.OrderEngineException;
import io.micrometer.core.instrument.Timer;
import io.opentelemetry.api.trace.SpanKind;
import java.util.Map;
import java.util.UUID;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wraps every command in a span, a timer and an outcome counter, and logs its result.
 *
 * <p>Outcomes are {@code ok}, {@code conflict} (stale expected version), {@code rejected} (an
 * {@link OrderEngineException}) and {@code error}. A command issued without a correlation context
 * runs in a fresh one, so its events and log lines still share a correlation id.
 */
public class CommandInstrumentation {

    private static final Logger log = LoggerFactory.getLogger(CommandInstrumentation.class);

    static final String COMMANDS = "order_engine.commands";
    static final String COMMAND_DURATION = "order_engine.command.duration";
    static final String CONFLICTS = "order_engine.concurrency.conflicts";

    private final MetricFactory metrics;
    private final SpanHelper spans;

    public CommandInstrumentation(MetricFactory metrics, SpanHelper spans) {
        this.metrics = metrics;
        this.spans = spans;
    }

    public <T> T run(String command, UUID aggregateId, Supplier<T> work) {
        if (CorrelationContextHolder.get().isEmpty()) {
            return CorrelationContextHolder.callWithContext(
                    CorrelationContext.forActor(null, null, null), () -> instrumented(command, aggregateId, work));
        }
        return instrumented(command, aggregateId, work);
    }

    public void runVoid(String command, UUID aggregateId, Runnable work) {
        run(
                command,
                aggregateId,
                () -> {
                    work.run();
                    return null;
                });
    }

    private <T> T instrumented(String command, UUID aggregateId, Supplier<T> work) {
        Timer.Sample sample = Timer.start(metrics.registry());
        String outcome = "error";
        try {
            T result =
                    spans.withSpan(
                            "order-engine." + command,
                            SpanKind.INTERNAL,
                            Map.of("aggregate.id", String.valueOf(aggregateId)),
                            work);
            outcome = "ok";
            log.info("{} completed for {}", command, aggregateId);
            return result;
        } catch (ConcurrencyConflictException e) {
            outcome = "conflict";
            metrics.counter(
                            CONFLICTS,
                            "Appends rejected for a stale expected version",
                            MetricFactory.TAG_COMMAND,
                            command)
                    .increment();
            log.warn("{} conflicted on {}: {}", command, aggregateId, e.getMessage());
            throw e;
        } catch (OrderEngineException e) {
            outcome = "rejected";
            log.warn("{} rejected for {} [{}]: {}", command, aggregateId, e.code(), e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            log.error("{} failed for {}", command, aggregateId, e);
            throw e;
        } finally {
            metrics.commandCounter(COMMANDS, "Commands handled by outcome", command, outcome).increment();
            sample.stop(metrics.commandTimer(COMMAND_DURATION, "Command handling time", command));
        }
    }
}
