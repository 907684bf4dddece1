package com.comanda.orderengine.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.comanda.eventmodel.AggregateType;
import com.comanda.eventmodel.order.CustomerDetails;
import com.comanda.eventmodel.order.LineItem;
import com.comanda.eventmodel.order.LineModifier;
import com.comanda.eventmodel.order.OrderStatus;
import com.comanda.eventmodel.order.OrderType;
import com.comanda.eventmodel.order.PaymentMethod;
import com.comanda.eventmodel.session.CartModifier;
import com.comanda.eventstore.ConcurrencyConflictException;
import com.comanda.orderengine.EngineFixture;
import com.comanda.orderengine.collaborator.CatalogItem;
import com.comanda.orderengine.collaborator.CatalogModifier;
import com.comanda.orderengine.collaborator.ItemCatalog;
import com.comanda.orderengine.collaborator.NoPromotionEngine;
import com.comanda.orderengine.config.MissingItemPolicy;
import com.comanda.orderengine.domain.exception.DependencyException;
import com.comanda.orderengine.domain.exception.InsufficientStockException;
import com.comanda.orderengine.domain.exception.InvalidOrderStateException;
import com.comanda.orderengine.domain.exception.ValidationException;
import com.comanda.orderengine.domain.order.OrderState;
import com.comanda.orderengine.domain.session.SessionState;
import com.comanda.orderengine.domain.session.SessionStatus;
import io.opentelemetry.api.OpenTelemetry;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("SessionToOrderConverter")
class SessionToOrderConverterTest {

    private EngineFixture engine;

    @BeforeEach
    void setUp() {
        engine = new EngineFixture();
    }

    /** A session with two burgers and fries, dine-in at table 4, paying by card. */
    private UUID readySession() {
        UUID sessionId = engine.sessionService.startSession("user-1", "LOC1", "web", null, null);
        engine.sessionService.addToCart(sessionId, "burger", "Burger", 2, List.of(), null);
        engine.sessionService.addToCart(
                sessionId, "fries", "Fries", 1, List.of(new CartModifier("nosalt", "no salt")), "crispy");
        engine.sessionService.selectServingType(sessionId, OrderType.DINE_IN, "4", null);
        engine.sessionService.enterCustomerInfo(sessionId, CustomerDetails.named("Eli"));
        engine.sessionService.selectPaymentMethod(sessionId, PaymentMethod.CARD);
        return sessionId;
    }

    private List<UUID> orderStreams() {
        return engine.eventStore.aggregateIds(AggregateType.ORDER);
    }

    @Test
    @DisplayName("prices the cart at conversion time and links session and order")
    void convertsAtCurrentPrices() {
        UUID sessionId = readySession();
        engine.catalog.put(CatalogItem.of("burger", "Burger", 1200));

        ConversionResult result = engine.sessionService.convertToOrder(sessionId);

        assertThat(result.sessionId()).isEqualTo(sessionId);
        assertThat(result.total()).isEqualTo(2900);
        assertThat(result.currency()).isEqualTo("USD");
        assertThat(result.skippedItemIds()).isEmpty();

        OrderState order = engine.orderService.getOrder(result.orderId());
        assertThat(order.status()).isEqualTo(OrderStatus.CONFIRMED);
        assertThat(order.orderNumber()).isEqualTo(EngineFixture.ORDER_NUMBER);
        assertThat(order.sessionId()).isEqualTo(sessionId);
        assertThat(order.staffId()).isEqualTo("user-1");
        assertThat(order.orderType()).isEqualTo(OrderType.DINE_IN);
        assertThat(order.tableNumber()).isEqualTo("4");
        assertThat(order.customer().name()).isEqualTo("Eli");
        assertThat(order.paymentMethod()).isEqualTo(PaymentMethod.CARD);
        assertThat(order.attributes()).containsEntry("source", "session");
        assertThat(order.items()).extracting(LineItem::unitPrice).containsExactly(1200L, 500L);
        assertThat(order.items().get(1).modifiers()).containsExactly(new LineModifier("nosalt", "No salt", 0));
        assertThat(order.items().get(1).notes()).isEqualTo("crispy");

        SessionState session = engine.sessionService.getSession(sessionId);
        assertThat(session.status()).isEqualTo(SessionStatus.CONVERTED);
        assertThat(session.convertedOrderId()).isEqualTo(result.orderId());
    }

    @Test
    @DisplayName("cart modifiers are charged at their catalog price")
    void chargesModifiersFromTheCatalog() {
        UUID sessionId = readySession();
        engine.sessionService.addToCart(
                sessionId, "soda", "Soda", 2, List.of(new CartModifier("cheese", "whatever the client says")), null);

        ConversionResult result = engine.sessionService.convertToOrder(sessionId);

        OrderState order = engine.orderService.getOrder(result.orderId());
        assertThat(order.items().get(2).modifiers()).containsExactly(new LineModifier("cheese", "Extra cheese", 150));
        assertThat(order.items().get(2).lineTotal()).isEqualTo(800);
        assertThat(order.subtotal()).isEqualTo(2000 + 500 + 800);
        assertThat(result.total()).isEqualTo(order.total());
    }

    @Test
    void unknownCartModifierStopsTheConversion() {
        UUID sessionId = readySession();
        engine.sessionService.addToCart(
                sessionId, "soda", "Soda", 1, List.of(new CartModifier("free-refills", "Free refills")), null);

        assertThatThrownBy(() -> engine.sessionService.convertToOrder(sessionId))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("free-refills");
        assertThat(orderStreams()).isEmpty();
        assertThat(engine.sessionService.getSession(sessionId).status()).isEqualTo(SessionStatus.ACTIVE);
    }

    @Test
    void deliveryAddressIsCarriedIntoTheCustomer() {
        UUID sessionId = readySession();
        engine.sessionService.selectServingType(sessionId, OrderType.DELIVERY, null, "9 Elm St");

        ConversionResult result = engine.sessionService.convertToOrder(sessionId);

        OrderState order = engine.orderService.getOrder(result.orderId());
        assertThat(order.orderType()).isEqualTo(OrderType.DELIVERY);
        assertThat(order.customer().name()).isEqualTo("Eli");
        assertThat(order.customer().deliveryAddress()).isEqualTo("9 Elm St");
    }

    @Test
    @DisplayName("items no longer in the catalog are skipped by default")
    void skipsMissingItems() {
        UUID sessionId = readySession();
        engine.catalog.remove("fries");

        ConversionResult result = engine.sessionService.convertToOrder(sessionId);

        assertThat(result.skippedItemIds()).containsExactly("fries");
        assertThat(result.total()).isEqualTo(2000);
        assertThat(engine.orderService.getOrder(result.orderId()).items())
                .extracting(LineItem::itemId)
                .containsExactly("burger");
    }

    @Test
    void unavailableItemsCountAsMissing() {
        UUID sessionId = readySession();
        engine.catalog.put(new CatalogItem("fries", "Fries", 500, null, false));

        assertThat(engine.sessionService.convertToOrder(sessionId).skippedItemIds()).containsExactly("fries");
    }

    @Test
    void failPolicyRejectsTheConversion() {
        engine = new EngineFixture(OpenTelemetry.noop(), MissingItemPolicy.FAIL, new NoPromotionEngine(), null, null);
        UUID sessionId = readySession();
        engine.catalog.remove("fries");

        assertThatThrownBy(() -> engine.sessionService.convertToOrder(sessionId))
                .isInstanceOf(ValidationException.class)
                .hasMessage("item fries is no longer available");

        assertThat(orderStreams()).isEmpty();
        assertThat(engine.sessionService.getSession(sessionId).status()).isEqualTo(SessionStatus.ACTIVE);
    }

    @Test
    void nothingLeftToOrder() {
        UUID sessionId = readySession();
        engine.catalog.remove("fries");
        engine.catalog.remove("burger");

        assertThatThrownBy(() -> engine.sessionService.convertToOrder(sessionId))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("none of the items");
        assertThat(orderStreams()).isEmpty();
    }

    @Test
    void preconditions() {
        UUID empty = engine.sessionService.startSession("user-1", "LOC1", "web", null, null);
        assertThatThrownBy(() -> engine.sessionService.convertToOrder(empty))
                .isInstanceOf(ValidationException.class)
                .hasMessage("cannot convert a session with an empty cart");

        engine.sessionService.addToCart(empty, "soda", "Soda", 1, List.of(), null);
        assertThatThrownBy(() -> engine.sessionService.convertToOrder(empty))
                .isInstanceOf(InvalidOrderStateException.class)
                .hasMessage("a payment method must be selected before conversion");

        UUID abandoned = readySession();
        engine.sessionService.abandonSession(abandoned, "idle");
        assertThatThrownBy(() -> engine.sessionService.convertToOrder(abandoned))
                .isInstanceOf(InvalidOrderStateException.class)
                .hasMessageContaining("ABANDONED");

        assertThat(orderStreams()).isEmpty();
    }

    @Test
    void aConvertedSessionCannotBeConvertedAgain() {
        UUID sessionId = readySession();
        engine.sessionService.convertToOrder(sessionId);

        assertThatThrownBy(() -> engine.sessionService.convertToOrder(sessionId))
                .isInstanceOf(InvalidOrderStateException.class)
                .hasMessageContaining("CONVERTED");
        assertThat(orderStreams()).hasSize(1);
    }

    @Test
    void insufficientStockRejectsTheConversion() {
        UUID sessionId = readySession();
        engine.inventory.setStock("burger", 1);

        assertThatThrownBy(() -> engine.sessionService.convertToOrder(sessionId))
                .isInstanceOf(InsufficientStockException.class);
        assertThat(orderStreams()).isEmpty();
    }

    @Test
    void catalogOutageIsADependencyError() {
        ItemCatalog failing = mock(ItemCatalog.class);
        when(failing.findItem(anyString())).thenThrow(new IllegalStateException("catalog timeout"));
        engine = new EngineFixture(OpenTelemetry.noop(), MissingItemPolicy.SKIP, new NoPromotionEngine(), failing, null);
        UUID sessionId = readySession();

        assertThatThrownBy(() -> engine.sessionService.convertToOrder(sessionId))
                .isInstanceOfSatisfying(
                        DependencyException.class, e -> assertThat(e.collaborator()).isEqualTo("item-catalog"))
                .hasRootCauseMessage("catalog timeout");
        assertThat(orderStreams()).isEmpty();
    }

    @Test
    @DisplayName("a session changed mid-conversion cancels the new order and rethrows the conflict")
    void sessionChangedDuringConversion() {
        ItemCatalog catalog = mock(ItemCatalog.class);
        engine = new EngineFixture(OpenTelemetry.noop(), MissingItemPolicy.SKIP, new NoPromotionEngine(), catalog, null);
        UUID sessionId = readySession();
        when(catalog.findItem("fries")).thenReturn(Optional.of(CatalogItem.of("fries", "Fries", 500)));
        when(catalog.findModifier("nosalt")).thenReturn(Optional.of(CatalogModifier.of("nosalt", "No salt", 0)));
        when(catalog.findItem("burger"))
                .thenAnswer(invocation -> {
                    engine.sessionService.saveDraft(sessionId, "saved from another tab", false);
                    return Optional.of(CatalogItem.of("burger", "Burger", 1000));
                });

        assertThatThrownBy(() -> engine.sessionService.convertToOrder(sessionId))
                .isInstanceOf(ConcurrencyConflictException.class);

        assertThat(orderStreams()).hasSize(1);
        OrderState order = engine.orderService.getOrderState(orderStreams().get(0));
        assertThat(order.status()).isEqualTo(OrderStatus.CANCELLED);
        assertThat(order.cancellationReason()).isEqualTo(SessionToOrderConverter.SESSION_CHANGED);

        SessionState session = engine.sessionService.getSession(sessionId);
        assertThat(session.status()).isEqualTo(SessionStatus.ACTIVE);
        assertThat(session.draftCount()).isEqualTo(1);
        assertThat(engine.meterRegistry
                        .get(CommandInstrumentation.CONFLICTS)
                        .tag("command", "convertToOrder")
                        .counter()
                        .count())
                .isEqualTo(1.0);
    }
}
