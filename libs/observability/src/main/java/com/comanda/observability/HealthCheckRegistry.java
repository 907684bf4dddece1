package com.comanda.observability;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs every registered {@link HealthCheck} concurrently and folds the results into one {@link
 * HealthResult}. A check that fails or exceeds the timeout counts as UNHEALTHY.
 */
public final class HealthCheckRegistry {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckRegistry.class);

    public static final long DEFAULT_TIMEOUT_MS = 5000;

    private final Map<String, HealthCheck> checks = new ConcurrentHashMap<>();
    private final long timeoutMs;
    private final Clock clock;

    public HealthCheckRegistry() {
        this(DEFAULT_TIMEOUT_MS, Clock.systemUTC());
    }

    public HealthCheckRegistry(long timeoutMs, Clock clock) {
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be positive");
        }
        this.timeoutMs = timeoutMs;
        this.clock = clock;
    }

    /** Registers a check, replacing any existing check with the same name. */
    public void register(String name, HealthCheck check) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        if (check == null) {
            throw new IllegalArgumentException("check must not be null");
        }
        checks.put(name, check);
    }

    public boolean deregister(String name) {
        return checks.remove(name) != null;
    }

    public HealthResult checkAll() {
        Map<String, CompletableFuture<ComponentHealth>> futures = new LinkedHashMap<>();
        checks.forEach((name, check) -> futures.put(name, start(name, check)));

        Map<String, ComponentHealth> results = new LinkedHashMap<>();
        HealthStatus overall = HealthStatus.HEALTHY;
        for (Map.Entry<String, CompletableFuture<ComponentHealth>> entry : futures.entrySet()) {
            String name = entry.getKey();
            ComponentHealth result;
            try {
                result = entry.getValue().orTimeout(timeoutMs, TimeUnit.MILLISECONDS).join();
            } catch (CompletionException e) {
                Throwable cause = e.getCause() == null ? e : e.getCause();
                log.warn("Health check {} failed: {}", name, cause.toString());
                result = ComponentHealth.unhealthy(name, "Timeout or error: " + cause);
            }
            if (result.status() != HealthStatus.HEALTHY) {
                log.info("Component {} is {}: {}", name, result.status(), result.message());
            }
            results.put(name, result);
            overall = overall.worst(result.status());
        }
        return new HealthResult(overall, results, clock.instant());
    }

    public int size() {
        return checks.size();
    }

    public long timeoutMs() {
        return timeoutMs;
    }

    private static CompletableFuture<ComponentHealth> start(String name, HealthCheck check) {
        try {
            return check.check();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }
}
