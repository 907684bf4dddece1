package com.comanda.orderengine.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.comanda.eventmodel.DomainEvent;
import com.comanda.eventmodel.EventType;
import com.comanda.eventmodel.order.CustomerDetails;
import com.comanda.eventmodel.order.ItemChange;
import com.comanda.eventmodel.order.LineModifier;
import com.comanda.eventmodel.order.OrderStatus;
import com.comanda.eventmodel.order.OrderType;
import com.comanda.eventmodel.order.PaymentMethod;
import com.comanda.eventmodel.order.PriceAdjustmentType;
import com.comanda.eventmodel.order.PromotionLine;
import com.comanda.eventstore.ConcurrencyConflictException;
import com.comanda.observability.CorrelationContextHolder;
import com.comanda.observability.testing.TestCorrelationContextFactory;
import com.comanda.orderengine.EngineFixture;
import com.comanda.orderengine.collaborator.CatalogItem;
import com.comanda.orderengine.collaborator.CatalogModifier;
import com.comanda.orderengine.collaborator.PromotionQuote;
import com.comanda.orderengine.config.MissingItemPolicy;
import com.comanda.orderengine.domain.exception.DependencyException;
import com.comanda.orderengine.domain.exception.ErrorCode;
import com.comanda.orderengine.domain.exception.InsufficientStockException;
import com.comanda.orderengine.domain.exception.InvalidOrderStateException;
import com.comanda.orderengine.domain.exception.OrderNotFoundException;
import com.comanda.orderengine.domain.exception.ValidationException;
import com.comanda.orderengine.domain.order.OrderAggregate;
import com.comanda.orderengine.domain.order.OrderCommands;
import com.comanda.orderengine.domain.order.OrderState;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.testing.exporter.InMemorySpanExporter;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.data.SpanData;
import io.opentelemetry.sdk.trace.export.SimpleSpanProcessor;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("OrderCommandService")
class OrderCommandServiceTest {

    private EngineFixture engine;

    @BeforeEach
    void setUp() {
        engine = new EngineFixture();
    }

    @AfterEach
    void clearContext() {
        CorrelationContextHolder.clear();
    }

    private static OrderCommands.StartOrder dineIn(String locationId) {
        return new OrderCommands.StartOrder(
                "staff-1", locationId, "12", OrderType.DINE_IN, false, null, null, null, Map.of());
    }

    private UUID burgersAndFries(String locationId) {
        return engine.orderService.createOrder(
                dineIn(locationId),
                List.of(OrderCommands.NewLine.of("burger", 2), OrderCommands.NewLine.of("fries", 1)));
    }

    private double commandCount(String command, String outcome) {
        return engine.meterRegistry
                .get(CommandInstrumentation.COMMANDS)
                .tags("command", command, "outcome", outcome)
                .counter()
                .count();
    }

    @Nested
    @DisplayName("createOrder")
    class Create {

        @Test
        void pricesItemsFromTheCatalog() {
            UUID id = burgersAndFries("LOC1");

            OrderState order = engine.orderService.getOrder(id);
            assertThat(order.status()).isEqualTo(OrderStatus.STARTED);
            assertThat(order.subtotal()).isEqualTo(2500);
            assertThat(order.currency()).isEqualTo("USD");
            assertThat(order.items()).extracting(l -> l.unitPrice()).containsExactly(1000L, 500L);
            assertThat(engine.eventStore.currentVersion(id)).isEqualTo(2);
        }

        @Test
        @DisplayName("an unknown item rejects the whole command and writes nothing")
        void unknownItem() {
            assertThatThrownBy(() -> engine.orderService.createOrder(
                            dineIn("LOC1"),
                            List.of(OrderCommands.NewLine.of("burger", 1), OrderCommands.NewLine.of("pizza", 1))))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("pizza");

            assertThat(engine.eventStore.eventCount()).isZero();
            assertThat(commandCount("createOrder", "rejected")).isEqualTo(1.0);
        }

        @Test
        void eventsCarryTheCallersCorrelation() {
            UUID id =
                    CorrelationContextHolder.callWithContext(
                            TestCorrelationContextFactory.createDefault(), () -> burgersAndFries("LOC1"));

            List<DomainEvent> events = engine.eventStore.load(id);
            assertThat(events)
                    .allSatisfy(event -> {
                        assertThat(event.metadata().correlationId())
                                .isEqualTo(TestCorrelationContextFactory.DEFAULT_CORRELATION_ID);
                        assertThat(event.metadata().causationId())
                                .isEqualTo(TestCorrelationContextFactory.DEFAULT_REQUEST_ID);
                        assertThat(event.metadata().actorId())
                                .isEqualTo(TestCorrelationContextFactory.DEFAULT_ACTOR_ID);
                    });
        }

        @Test
        void withoutAContextEventsShareAFreshCorrelation() {
            UUID id = burgersAndFries("LOC1");

            List<DomainEvent> events = engine.eventStore.load(id);
            String correlation = events.get(0).metadata().correlationId();
            assertThat(correlation).isNotBlank();
            assertThat(events).allSatisfy(e -> assertThat(e.metadata().correlationId()).isEqualTo(correlation));
            assertThat(events.get(0).actorOrSystem()).isEqualTo("system");
            assertThat(CorrelationContextHolder.get()).isEmpty();
        }
    }

    @Nested
    @DisplayName("modifier pricing")
    class ModifierPricing {

        private UUID burgerWith(String... modifierIds) {
            return engine.orderService.createOrder(
                    dineIn("LOC1"), List.of(new OrderCommands.NewLine("burger", 1, List.of(modifierIds), null)));
        }

        @Test
        @DisplayName("modifier prices come from the catalog, not the caller")
        void pricedFromTheCatalog() {
            UUID id = burgerWith("cheese");

            OrderState order = engine.orderService.getOrder(id);
            assertThat(order.items().get(0).modifiers())
                    .containsExactly(new LineModifier("cheese", "Extra cheese", 150));
            assertThat(order.subtotal()).isEqualTo(1150);
        }

        @Test
        void unknownModifierIsRejected() {
            assertThatThrownBy(() -> burgerWith("half-price"))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("half-price");
            assertThat(engine.eventStore.eventCount()).isZero();
        }

        @Test
        @DisplayName("confirmation re-prices modifiers along with the item")
        void confirmationRepricesModifiers() {
            UUID id = burgerWith("cheese");
            engine.catalog.put(CatalogModifier.of("cheese", "Extra cheese", 175));

            OrderState confirmed = engine.orderService.confirmOrder(id, PaymentMethod.CASH);

            assertThat(confirmed.subtotal()).isEqualTo(1175);
            assertThat(confirmed.tax()).isEqualTo(223);
            assertThat(confirmed.total()).isEqualTo(1398);
        }

        @Test
        void modifiersOfOneLineChange() {
            UUID id = burgersAndFries("LOC1");

            OrderState withBacon =
                    engine.orderService.modifyItemModifiers(
                            id, new OrderCommands.ChangeModifiers("burger", List.of("bacon"), List.of(), "add bacon"));
            assertThat(withBacon.subtotal()).isEqualTo(2900);
            assertThat(withBacon.modificationCount()).isEqualTo(1);

            OrderState swapped =
                    engine.orderService.modifyItemModifiers(
                            id,
                            new OrderCommands.ChangeModifiers("burger", List.of("cheese"), List.of("bacon"), null));
            assertThat(swapped.items().get(0).modifiers()).extracting(LineModifier::modifierId).containsExactly("cheese");
            assertThat(swapped.subtotal()).isEqualTo(2800);
            assertThat(engine.orderService.getOrderState(id)).isEqualTo(swapped);
        }
    }

    @Nested
    @DisplayName("confirmOrder")
    class Confirm {

        @Test
        @DisplayName("validates, prices and confirms in one append")
        void confirms() {
            UUID id = burgersAndFries("LOC1");

            OrderState confirmed = engine.orderService.confirmOrder(id, PaymentMethod.CARD);

            assertThat(confirmed.status()).isEqualTo(OrderStatus.CONFIRMED);
            assertThat(confirmed.orderNumber()).isEqualTo(EngineFixture.ORDER_NUMBER);
            assertThat(confirmed.tax()).isEqualTo(475);
            assertThat(confirmed.total()).isEqualTo(2975);
            assertThat(confirmed.taxRate()).isEqualByComparingTo("0.19");
            assertThat(engine.eventStore.load(id))
                    .extracting(DomainEvent::eventType)
                    .containsExactly(
                            EventType.ORDER_STARTED,
                            EventType.ITEMS_ADDED_TO_ORDER,
                            EventType.ITEMS_VALIDATED,
                            EventType.PROMOTIONS_CALCULATED,
                            EventType.PAYMENT_METHOD_SET,
                            EventType.PRICE_CALCULATED,
                            EventType.ORDER_CONFIRMED);
            assertThat(engine.orderService.getOrder(id)).isEqualTo(confirmed);
            assertThat(engine.snapshots.latest(id, OrderState.class))
                    .hasValueSatisfying(snapshot -> assertThat(snapshot.version()).isEqualTo(7));
            assertThat(commandCount("confirmOrder", "ok")).isEqualTo(1.0);
        }

        @Test
        void usesTheLocationTaxRate() {
            UUID id = burgersAndFries("LOC2");
            OrderState confirmed = engine.orderService.confirmOrder(id, PaymentMethod.CASH);
            assertThat(confirmed.tax()).isEqualTo(175);
            assertThat(confirmed.total()).isEqualTo(2675);
        }

        @Test
        void repricesFromTheCurrentCatalog() {
            UUID id = burgersAndFries("LOC1");
            engine.catalog.put(new CatalogItem("burger", "Burger", 1000, 800L, true));

            OrderState confirmed = engine.orderService.confirmOrder(id, PaymentMethod.CARD);

            assertThat(confirmed.subtotal()).isEqualTo(2100);
            assertThat(confirmed.tax()).isEqualTo(399);
        }

        @Test
        @DisplayName("rejections leave the stream untouched")
        void rejections() {
            UUID id = burgersAndFries("LOC1");

            assertThatThrownBy(() -> engine.orderService.confirmOrder(id, null))
                    .isInstanceOf(InvalidOrderStateException.class)
                    .hasMessageContaining("payment method");

            engine.inventory.setStock("burger", 1);
            assertThatThrownBy(() -> engine.orderService.confirmOrder(id, PaymentMethod.CARD))
                    .isInstanceOfSatisfying(
                            InsufficientStockException.class,
                            e -> assertThat(e.code()).isEqualTo(ErrorCode.INSUFFICIENT_STOCK));

            engine.inventory.setStock("burger", 10);
            engine.catalog.remove("fries");
            assertThatThrownBy(() -> engine.orderService.confirmOrder(id, PaymentMethod.CARD))
                    .isInstanceOf(ValidationException.class);

            assertThat(engine.eventStore.currentVersion(id)).isEqualTo(2);
            assertThat(engine.orderService.getOrder(id).status()).isEqualTo(OrderStatus.STARTED);
        }

        @Test
        void autoAppliedPromotionsReduceTheTotal() {
            PromotionLine combo = new PromotionLine("combo", "Burger combo", 200);
            engine = new EngineFixture(
                    OpenTelemetry.noop(),
                    MissingItemPolicy.SKIP,
                    order -> new PromotionQuote(List.of(combo), List.of(combo)),
                    null,
                    null);
            UUID id = burgersAndFries("LOC1");

            OrderState confirmed = engine.orderService.confirmOrder(id, PaymentMethod.CARD);

            assertThat(confirmed.appliedPromotions()).containsExactly(combo);
            assertThat(confirmed.discount()).isEqualTo(200);
            assertThat(confirmed.total()).isEqualTo(2775);
        }

        @Test
        void failingPromotionEngineIsADependencyError() {
            engine = new EngineFixture(
                    OpenTelemetry.noop(),
                    MissingItemPolicy.SKIP,
                    order -> {
                        throw new IllegalStateException("promotions offline");
                    },
                    null,
                    null);
            UUID id = burgersAndFries("LOC1");

            assertThatThrownBy(() -> engine.orderService.confirmOrder(id, PaymentMethod.CARD))
                    .isInstanceOfSatisfying(
                            DependencyException.class,
                            e -> assertThat(e.collaborator()).isEqualTo("promotion-engine"))
                    .hasRootCauseMessage("promotions offline");
            assertThat(engine.eventStore.currentVersion(id)).isEqualTo(2);
        }
    }

    @Nested
    @DisplayName("after confirmation")
    class Lifecycle {

        private UUID id;

        @BeforeEach
        void confirmed() {
            id = burgersAndFries("LOC1");
            engine.orderService.confirmOrder(id, PaymentMethod.CARD);
        }

        @Test
        void statusTransitionsAndCancel() {
            engine.orderService.transitionStatus(id, OrderStatus.PREPARING, null);
            assertThatThrownBy(() -> engine.orderService.transitionStatus(id, OrderStatus.CONFIRMED, null))
                    .isInstanceOf(InvalidOrderStateException.class);

            OrderState cancelled = engine.orderService.cancelOrder(id, "kitchen fire");

            assertThat(cancelled.status()).isEqualTo(OrderStatus.CANCELLED);
            assertThat(engine.orderService.getOrder(id).cancellationReason()).isEqualTo("kitchen fire");
            assertThat(engine.orderReadModel.findOrdersByStatus(OrderStatus.CANCELLED))
                    .extracting(OrderState::id)
                    .containsExactly(id);
        }

        @Test
        void modificationsTipsAndAdjustments() {
            engine.orderService.modifyOrder(
                    id,
                    new OrderCommands.ModifyItems(
                            List.of(OrderCommands.NewLine.of("soda", 2)),
                            List.of(),
                            List.of(new ItemChange("burger", null, "medium rare")),
                            "table request"));
            engine.orderService.addTip(id, 300);
            OrderState adjusted =
                    engine.orderService.adjustPrice(
                            id, new OrderCommands.AdjustPrice(PriceAdjustmentType.DISCOUNT, 100, "loyalty", "mgr-1"));

            assertThat(adjusted.subtotal()).isEqualTo(3000);
            assertThat(adjusted.modificationCount()).isEqualTo(1);
            assertThat(adjusted.tip()).isEqualTo(300);
            assertThat(adjusted.total())
                    .isEqualTo(adjusted.subtotal() + adjusted.tax() - adjusted.discount() + adjusted.tip());
        }

        @Test
        @DisplayName("items added after confirmation are taxed at the confirmed rate")
        void taxFollowsItemsAddedAfterConfirmation() {
            OrderState changed = engine.orderService.addItems(id, List.of(OrderCommands.NewLine.of("soda", 4)));

            assertThat(changed.subtotal()).isEqualTo(3500);
            assertThat(changed.tax()).isEqualTo(665);
            assertThat(changed.total()).isEqualTo(4165);
            assertThat(changed.priceCalculated()).isFalse();
            assertThat(engine.orderService.getOrder(id)).isEqualTo(engine.orderService.getOrderState(id));
        }

        @Test
        @DisplayName("payments reduce the outstanding balance and never exceed it")
        void payments() {
            OrderState paid =
                    engine.orderService.processPayment(
                            id, new OrderCommands.ProcessPayment("pay-1", PaymentMethod.CARD, 2000, "captured", "txn-98765"));

            assertThat(paid.amountPaid()).isEqualTo(2000);
            assertThat(paid.outstanding()).isEqualTo(975);
            assertThat(paid.lastPaymentAttempt().succeeded()).isTrue();
            assertThat(paid.lastPaymentAttempt().transactionId()).isEqualTo("txn-98765");

            assertThatThrownBy(() -> engine.orderService.processPayment(
                            id, new OrderCommands.ProcessPayment("pay-2", PaymentMethod.CARD, 1000, "captured", null)))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("outstanding balance 975");

            OrderState failed =
                    engine.orderService.recordPaymentFailure(
                            id, new OrderCommands.RecordPaymentFailure("pay-3", PaymentMethod.CARD, 975, "card declined", "E051"));
            assertThat(failed.amountPaid()).isEqualTo(2000);
            assertThat(failed.lastPaymentAttempt().succeeded()).isFalse();
            assertThat(failed.lastPaymentAttempt().failureReason()).isEqualTo("card declined");
            assertThat(engine.eventStore.load(id))
                    .extracting(DomainEvent::eventType)
                    .endsWith(EventType.PAYMENT_PROCESSED, EventType.PAYMENT_FAILED);
        }

        @Test
        @DisplayName("a completed order still takes its payment")
        void paymentAfterCompletion() {
            engine.orderService.transitionStatus(id, OrderStatus.PREPARING, null);
            engine.orderService.transitionStatus(id, OrderStatus.READY, null);
            engine.orderService.transitionStatus(id, OrderStatus.COMPLETED, null);

            OrderState paid =
                    engine.orderService.processPayment(
                            id, new OrderCommands.ProcessPayment("pay-1", PaymentMethod.CASH, 2975, "settled", null));

            assertThat(paid.outstanding()).isZero();
            assertThat(paid.paymentMethod()).isEqualTo(PaymentMethod.CASH);
        }

        @Test
        void customerInfo() {
            OrderState updated =
                    engine.orderService.updateCustomerInfo(
                            id, new CustomerDetails("Dana", "+1 555 0100", "dana@example.com", null, null));
            assertThat(updated.customer().email()).isEqualTo("dana@example.com");
        }

        @Test
        @DisplayName("the read model and a replay agree")
        void readModelMatchesReplay() {
            engine.orderService.transitionStatus(id, OrderStatus.PREPARING, null);
            engine.orderService.addTip(id, 150);

            assertThat(engine.orderService.getOrder(id)).isEqualTo(engine.orderService.getOrderState(id));
        }
    }

    @Nested
    @DisplayName("concurrency")
    class Concurrency {

        @Test
        @DisplayName("two writers loaded at version 5: the second append conflicts and is not retried")
        void staleWriterConflicts() {
            UUID id = burgersAndFries("LOC1");
            engine.orderService.addTip(id, 100);
            engine.orderService.addTip(id, 200);
            engine.orderService.addTip(id, 300);
            assertThat(engine.eventStore.currentVersion(id)).isEqualTo(5);

            OrderAggregate first = engine.orders.require(id);
            OrderAggregate second = engine.orders.require(id);
            first.addTip(400, "staff-1");
            engine.orders.persist(first);

            second.cancelOrder("duplicate", "staff-2");
            assertThatThrownBy(() -> engine.orders.persist(second))
                    .isInstanceOfSatisfying(
                            ConcurrencyConflictException.class,
                            e -> {
                                assertThat(e.expectedVersion()).isEqualTo(5);
                                assertThat(e.actualVersion()).isEqualTo(6);
                            });

            OrderState state = engine.orderService.getOrderState(id);
            assertThat(state.tip()).isEqualTo(400);
            assertThat(state.status()).isEqualTo(OrderStatus.STARTED);
            assertThat(engine.eventStore.currentVersion(id)).isEqualTo(6);
        }
    }

    @Test
    @DisplayName("payments are refused before confirmation")
    void paymentBeforeConfirmation() {
        UUID id = burgersAndFries("LOC1");

        assertThatThrownBy(() -> engine.orderService.processPayment(
                        id, new OrderCommands.ProcessPayment("pay-1", PaymentMethod.CARD, 100, "captured", null)))
                .isInstanceOf(InvalidOrderStateException.class);
        assertThatThrownBy(() -> engine.orderService.recordPaymentFailure(
                        id, new OrderCommands.RecordPaymentFailure("pay-1", PaymentMethod.CARD, 100, "declined", null)))
                .isInstanceOf(InvalidOrderStateException.class);
        assertThat(engine.eventStore.currentVersion(id)).isEqualTo(2);
    }

    @Test
    void unknownOrder() {
        UUID missing = UUID.randomUUID();
        assertThatThrownBy(() -> engine.orderService.getOrder(missing)).isInstanceOf(OrderNotFoundException.class);
        assertThatThrownBy(() -> engine.orderService.addTip(missing, 100))
                .isInstanceOfSatisfying(
                        OrderNotFoundException.class, e -> assertThat(e.orderId()).isEqualTo(missing));
    }

    @Test
    @DisplayName("every command runs in a span named after it")
    void spans() {
        InMemorySpanExporter exporter = InMemorySpanExporter.create();
        SdkTracerProvider tracerProvider =
                SdkTracerProvider.builder().addSpanProcessor(SimpleSpanProcessor.create(exporter)).build();
        engine = new EngineFixture(
                OpenTelemetrySdk.builder().setTracerProvider(tracerProvider).build(),
                MissingItemPolicy.SKIP,
                order -> PromotionQuote.NONE,
                null,
                null);

        UUID id = burgersAndFries("LOC1");
        assertThatThrownBy(() -> engine.orderService.transitionStatus(id, OrderStatus.READY, null))
                .isInstanceOf(InvalidOrderStateException.class);

        List<SpanData> spans = exporter.getFinishedSpanItems();
        assertThat(spans).extracting(SpanData::getName)
                .containsExactly("order-engine.createOrder", "order-engine.transitionStatus");
        assertThat(spans.get(0).getAttributes().get(AttributeKey.stringKey("aggregate.id"))).isEqualTo(id.toString());
        assertThat(spans.get(1).getStatus().getStatusCode()).isEqualTo(StatusCode.ERROR);
        tracerProvider.close();
    }

    @Test
    void taxRateOfUnknownLocationFallsBackToDefault() {
        UUID id = burgersAndFries("LOC9");
        assertThat(engine.orderService.confirmOrder(id, PaymentMethod.CARD).taxRate())
                .isEqualByComparingTo(new BigDecimal("0.19"));
    }
}
