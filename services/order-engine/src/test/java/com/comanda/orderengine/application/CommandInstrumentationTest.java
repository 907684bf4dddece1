package com.comanda.orderengine.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.comanda.eventstore.ConcurrencyConflictException;
import com.comanda.observability.CorrelationContext;
import com.comanda.observability.CorrelationContextHolder;
import com.comanda.observability.MetricFactory;
import com.comanda.observability.SpanHelper;
import com.comanda.observability.testing.TestCorrelationContextFactory;
import com.comanda.orderengine.domain.exception.ValidationException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.opentelemetry.api.OpenTelemetry;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.slf4j.MDC;

class CommandInstrumentationTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final CommandInstrumentation instrumentation =
            new CommandInstrumentation(
                    new MetricFactory(registry, "order-engine-test"),
                    new SpanHelper(OpenTelemetry.noop().getTracer("test")));
    private final UUID aggregateId = UUID.randomUUID();

    @AfterEach
    void clear() {
        CorrelationContextHolder.clear();
    }

    private double count(String command, String outcome) {
        return registry.get(CommandInstrumentation.COMMANDS)
                .tags("command", command, "outcome", outcome)
                .counter()
                .count();
    }

    @ParameterizedTest(name = "{0} is counted as {1}")
    @CsvSource({"conflict, conflict", "rejected, rejected", "crash, error", "success, ok"})
    void countsOutcomes(String behaviour, String outcome) {
        Runnable work =
                switch (behaviour) {
                    case "conflict" -> () -> {
                        throw new ConcurrencyConflictException(aggregateId, 5, 6);
                    };
                    case "rejected" -> () -> {
                        throw new ValidationException("bad input");
                    };
                    case "crash" -> () -> {
                        throw new IllegalStateException("boom");
                    };
                    default -> () -> { };
                };

        if (outcome.equals("ok")) {
            instrumentation.runVoid("addTip", aggregateId, work);
        } else {
            assertThatThrownBy(() -> instrumentation.runVoid("addTip", aggregateId, work))
                    .isInstanceOf(RuntimeException.class);
        }

        assertThat(count("addTip", outcome)).isEqualTo(1.0);
        assertThat(registry.get(CommandInstrumentation.COMMAND_DURATION).tag("command", "addTip").timer().count())
                .isEqualTo(1);
    }

    @Test
    void conflictsAreCountedSeparately() {
        assertThatThrownBy(() -> instrumentation.run("cancelOrder", aggregateId, () -> {
                    throw new ConcurrencyConflictException(aggregateId, 2, 3);
                }))
                .isInstanceOf(ConcurrencyConflictException.class);

        assertThat(registry.get(CommandInstrumentation.CONFLICTS).tag("command", "cancelOrder").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void keepsTheCallersContext() {
        CorrelationContext caller = TestCorrelationContextFactory.createDefault();
        CorrelationContextHolder.set(caller);

        CorrelationContext seen = instrumentation.run("addTip", aggregateId, () -> CorrelationContextHolder.get().orElseThrow());

        assertThat(seen).isEqualTo(caller);
        assertThat(CorrelationContextHolder.get()).contains(caller);
    }

    @Test
    void opensAFreshContextAndRemovesItAfterwards() {
        AtomicReference<String> mdcCorrelation = new AtomicReference<>();

        CorrelationContext seen =
                instrumentation.run(
                        "addTip",
                        aggregateId,
                        () -> {
                            mdcCorrelation.set(MDC.get(CorrelationContext.MDC_CORRELATION_ID));
                            return CorrelationContextHolder.get().orElseThrow();
                        });

        assertThat(seen.correlationId()).isNotBlank().isEqualTo(mdcCorrelation.get());
        assertThat(CorrelationContextHolder.get()).isEmpty();
        assertThat(MDC.get(CorrelationContext.MDC_CORRELATION_ID)).isNull();
    }
}
