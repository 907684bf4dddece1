package com.comanda.observability;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("HealthCheckRegistry")
class HealthCheckRegistryTest {

    private HealthCheckRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new HealthCheckRegistry(200, Clock.systemUTC());
    }

    @Test
    @DisplayName("should reject non-positive timeout")
    void rejectsTimeout() {
        assertThatThrownBy(() -> new HealthCheckRegistry(0, Clock.systemUTC()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("is healthy with no checks registered")
    void empty() {
        assertThat(registry.checkAll().isHealthy()).isTrue();
    }

    @Nested
    @DisplayName("aggregation")
    class Aggregation {

        @Test
        @DisplayName("degraded component makes the whole result degraded")
        void degraded() {
            registry.register(
                    "event-store", HealthCheck.of(() -> ComponentHealth.healthy("event-store", null)));
            registry.register(
                    "projections",
                    HealthCheck.of(
                            () ->
                                    ComponentHealth.degraded(
                                            "projections", "2 stale", Map.of("stale", 2L))));

            HealthResult result = registry.checkAll();

            assertThat(result.status()).isEqualTo(HealthStatus.DEGRADED);
            assertThat(result.checks().get("projections").details()).containsEntry("stale", 2L);
        }

        @Test
        @DisplayName("unhealthy wins over degraded")
        void unhealthyWins() {
            registry.register(
                    "a", HealthCheck.of(() -> ComponentHealth.degraded("a", "slow", Map.of())));
            registry.register("b", HealthCheck.of(() -> ComponentHealth.unhealthy("b", "down")));

            assertThat(registry.checkAll().status()).isEqualTo(HealthStatus.UNHEALTHY);
        }

        @Test
        @DisplayName("a check that never completes is reported unhealthy")
        void timeout() {
            registry.register("stuck", CompletableFuture::new);

            HealthResult result = registry.checkAll();

            assertThat(result.status()).isEqualTo(HealthStatus.UNHEALTHY);
            assertThat(result.checks().get("stuck").message()).contains("Timeout or error");
        }

        @Test
        @DisplayName("a check that throws is reported unhealthy")
        void throwing() {
            registry.register(
                    "broken",
                    () -> {
                        throw new IllegalStateException("no store");
                    });

            assertThat(registry.checkAll().checks().get("broken").status())
                    .isEqualTo(HealthStatus.UNHEALTHY);
        }
    }

    @Test
    @DisplayName("deregister removes a check")
    void deregister() {
        registry.register("x", HealthCheck.of(() -> ComponentHealth.unhealthy("x", "down")));
        assertThat(registry.deregister("x")).isTrue();
        assertThat(registry.size()).isZero();
    }
}
