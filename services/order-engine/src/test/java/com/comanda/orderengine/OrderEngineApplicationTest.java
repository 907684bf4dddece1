package com.comanda.orderengine;

import static org.assertj.core.api.Assertions.assertThat;

import com.comanda.eventmodel.order.OrderStatus;
import com.comanda.eventmodel.order.OrderType;
import com.comanda.eventmodel.order.PaymentMethod;
import com.comanda.observability.HealthCheckRegistry;
import com.comanda.observability.HealthStatus;
import com.comanda.orderengine.application.OrderCommandService;
import com.comanda.orderengine.application.SessionCommandService;
import com.comanda.orderengine.collaborator.CatalogItem;
import com.comanda.orderengine.collaborator.InMemoryItemCatalog;
import com.comanda.orderengine.collaborator.ItemCatalog;
import com.comanda.orderengine.config.OrderEngineProperties;
import com.comanda.orderengine.config.ProjectionMode;
import com.comanda.orderengine.domain.order.OrderCommands;
import com.comanda.orderengine.domain.order.OrderState;
import com.comanda.orderengine.projection.ProjectionDispatcher;
import com.comanda.orderengine.projection.SynchronousProjectionDispatcher;
import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.ActiveProfiles;

/** Loads the full context with the test profile and drives one order through it. */
@SpringBootTest
@ActiveProfiles("test")
@DisplayName("Order Engine Application")
class OrderEngineApplicationTest {

    @Autowired private ApplicationContext context;
    @Autowired private OrderCommandService orders;
    @Autowired private SessionCommandService sessions;
    @Autowired private ItemCatalog catalog;

    @BeforeEach
    void stockCatalog() {
        ((InMemoryItemCatalog) catalog).put(CatalogItem.of("burger", "Burger", 1000));
    }

    @Test
    @DisplayName("properties are loaded from the test profile")
    void propertiesAreLoaded() {
        var props = context.getBean(OrderEngineProperties.class);
        assertThat(props.name()).isEqualTo("order-engine-test");
        assertThat(props.environment()).isEqualTo("test");
        assertThat(props.taxRate()).isEqualByComparingTo("0.10");
        assertThat(props.locationTaxRates()).containsEntry("LOC2", new BigDecimal("0.07"));
        assertThat(props.snapshotInterval()).isEqualTo(5);
        assertThat(props.projectionMode()).isEqualTo(ProjectionMode.SYNCHRONOUS);
        assertThat(context.getBean(ProjectionDispatcher.class)).isInstanceOf(SynchronousProjectionDispatcher.class);
    }

    @Test
    @DisplayName("an order flows from creation to the read model")
    void orderFlow() {
        UUID orderId =
                orders.createOrder(
                        new OrderCommands.StartOrder("staff-1", "LOC1", "4", OrderType.DINE_IN, false, null, null, null, null),
                        List.of(OrderCommands.NewLine.of("burger", 2)));

        OrderState confirmed = orders.confirmOrder(orderId, PaymentMethod.CASH);

        assertThat(confirmed.status()).isEqualTo(OrderStatus.CONFIRMED);
        assertThat(confirmed.tax()).isEqualTo(200);
        assertThat(confirmed.total()).isEqualTo(2200);
        assertThat(confirmed.orderNumber()).matches("\\d{8}-LOC1-\\d{4}");
        assertThat(orders.getOrder(orderId))
                .satisfies(row -> {
                    assertThat(row.version()).isEqualTo(confirmed.version());
                    assertThat(row.total()).isEqualTo(2200);
                    assertThat(row.status()).isEqualTo(OrderStatus.CONFIRMED);
                });
    }

    @Test
    void sessionsStartActive() {
        UUID sessionId = sessions.startSession("guest", "LOC1", "web", null, null);

        assertThat(sessions.getSession(sessionId).cartItemCount()).isZero();
    }

    @Test
    @DisplayName("health checks are registered and healthy")
    void healthChecks() {
        HealthCheckRegistry registry = context.getBean(HealthCheckRegistry.class);

        assertThat(registry.size()).isEqualTo(2);
        assertThat(registry.checkAll().status()).isEqualTo(HealthStatus.HEALTHY);
    }
}
