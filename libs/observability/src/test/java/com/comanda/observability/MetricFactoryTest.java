package com.comanda.observability;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("MetricFactory")
class MetricFactoryTest {

    private SimpleMeterRegistry registry;
    private MetricFactory factory;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        factory = new MetricFactory(registry, "order-engine");
    }

    @Test
    @DisplayName("should reject blank service name")
    void rejectsBlankService() {
        assertThatThrownBy(() -> new MetricFactory(registry, " "))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("counters carry the service tag and are shared by name and tags")
    void counterTags() {
        factory.counter("orders.commands", "Commands", "command", "confirm").increment();
        factory.counter("orders.commands", "Commands", "command", "confirm").increment();

        var counter =
                registry.get("orders.commands")
                        .tag(MetricFactory.TAG_SERVICE, "order-engine")
                        .tag("command", "confirm")
                        .counter();
        assertThat(counter.count()).isEqualTo(2.0);
    }

    @Test
    @DisplayName("command meters are tagged with the command and outcome")
    void commandMeters() {
        factory.commandCounter("order_engine.commands", "Commands", "confirmOrder", "ok").increment();
        factory.commandCounter("order_engine.commands", "Commands", "confirmOrder", "rejected").increment();
        factory.commandTimer("order_engine.command.duration", "Time", "confirmOrder").record(Duration.ofMillis(5));

        assertThat(registry.get("order_engine.commands")
                        .tags(MetricFactory.TAG_COMMAND, "confirmOrder", MetricFactory.TAG_OUTCOME, "ok")
                        .counter()
                        .count())
                .isEqualTo(1.0);
        assertThat(registry.get("order_engine.commands").counters()).hasSize(2);
        assertThat(registry.get("order_engine.command.duration")
                        .tag(MetricFactory.TAG_SERVICE, "order-engine")
                        .timer()
                        .count())
                .isEqualTo(1);
    }

    @Test
    @DisplayName("gauge reads its supplier on every poll")
    void gauge() {
        var backlog = new AtomicInteger(3);
        factory.gauge("projections.backlog", "Queued batches", backlog::get);

        backlog.set(7);

        assertThat(registry.get("projections.backlog").gauge().value()).isEqualTo(7.0);
    }
}
