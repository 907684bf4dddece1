package com.comanda.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.util.function.Supplier;

/**
 * Creates Micrometer meters that all carry a {@code service} tag.
 *
 * <p>Meters are registered on first use and looked up afterwards, so a command handler may ask
 * for its counter on every invocation instead of holding a reference.
 */
public final class MetricFactory {

    public static final String TAG_SERVICE = "service";
    public static final String TAG_COMMAND = "command";
    public static final String TAG_OUTCOME = "outcome";

    private final MeterRegistry registry;
    private final String serviceName;

    public MetricFactory(MeterRegistry registry, String serviceName) {
        if (registry == null || serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("a registry and a service name are required");
        }
        this.registry = registry;
        this.serviceName = serviceName;
    }

    /**
     * Counter with the service tag plus {@code tags} (key-value pairs).
     *
     * @param name metric name (e.g. "order_engine.projection.failures")
     */
    public Counter counter(String name, String description, String... tags) {
        return Counter.builder(name).description(description).tags(tagged(tags)).register(registry);
    }

    /** Counter of one command ending with one outcome, e.g. {@code confirmOrder} / {@code rejected}. */
    public Counter commandCounter(String name, String description, String command, String outcome) {
        return counter(name, description, TAG_COMMAND, command, TAG_OUTCOME, outcome);
    }

    /** Timer of one command, whatever its outcome. */
    public Timer commandTimer(String name, String description, String command) {
        return Timer.builder(name)
                .description(description)
                .tags(tagged(TAG_COMMAND, command))
                .register(registry);
    }

    /** Gauge reading {@code value} on every scrape. The supplier must be cheap and thread-safe. */
    public void gauge(String name, String description, Supplier<Number> value, String... tags) {
        Gauge.builder(name, value).description(description).tags(tagged(tags)).register(registry);
    }

    public MeterRegistry registry() {
        return registry;
    }

    public String serviceName() {
        return serviceName;
    }

    private Tags tagged(String... keyValues) {
        return Tags.of(keyValues).and(TAG_SERVICE, serviceName);
    }
}
