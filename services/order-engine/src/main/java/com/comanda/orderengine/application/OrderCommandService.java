package com.comanda.orderengine.application;

import com.comanda.eventmodel.order.CustomerDetails;
import com.comanda.eventmodel.order.LineItem;
import com.comanda.eventmodel.order.OrderStatus;
import com.comanda.eventmodel.order.PaymentMethod;
import com.comanda.observability.SensitiveDataRedactor;
import com.comanda.orderengine.collaborator.ActorResolver;
import com.comanda.orderengine.collaborator.OrderNumberGenerator;
import com.comanda.orderengine.collaborator.PromotionEngine;
import com.comanda.orderengine.collaborator.PromotionQuote;
import com.comanda.orderengine.collaborator.TaxRateProvider;
import com.comanda.orderengine.domain.exception.DependencyException;
import com.comanda.orderengine.domain.exception.InvalidOrderStateException;
import com.comanda.orderengine.domain.exception.OrderNotFoundException;
import com.comanda.orderengine.domain.order.OrderAggregate;
import com.comanda.orderengine.domain.order.OrderCommands;
import com.comanda.orderengine.domain.order.OrderState;
import com.comanda.orderengine.domain.order.PriceBreakdown;
import com.comanda.orderengine.domain.order.PriceCalculator;
import com.comanda.orderengine.projection.OrderReadModel;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Order commands. Each call loads the order, runs one aggregate command (or, for confirmation, a
 * fixed sequence of them) and persists once. A {@link
 * com.comanda.eventstore.ConcurrencyConflictException} is never retried here.
 */
public class OrderCommandService {

    private static final Logger log = LoggerFactory.getLogger(OrderCommandService.class);

    private final OrderRepository orders;
    private final OrderReadModel readModel;
    private final CatalogGateway catalog;
    private final PromotionEngine promotions;
    private final TaxRateProvider taxRates;
    private final OrderNumberGenerator orderNumbers;
    private final ActorResolver actors;
    private final SensitiveDataRedactor redactor;
    private final CommandInstrumentation instrumentation;
    private final String defaultCurrency;

    public OrderCommandService(
            OrderRepository orders,
            OrderReadModel readModel,
            CatalogGateway catalog,
            PromotionEngine promotions,
            TaxRateProvider taxRates,
            OrderNumberGenerator orderNumbers,
            ActorResolver actors,
            SensitiveDataRedactor redactor,
            CommandInstrumentation instrumentation,
            String defaultCurrency) {
        this.orders = orders;
        this.readModel = readModel;
        this.catalog = catalog;
        this.promotions = promotions;
        this.taxRates = taxRates;
        this.orderNumbers = orderNumbers;
        this.actors = actors;
        this.redactor = redactor;
        this.instrumentation = instrumentation;
        this.defaultCurrency = defaultCurrency;
    }

    /**
     * Starts an order and adds the given items, priced from the catalog.
     *
     * @return the new order's id
     */
    public UUID createOrder(OrderCommands.StartOrder command, List<OrderCommands.NewLine> items) {
        UUID orderId = UUID.randomUUID();
        return instrumentation.run(
                "createOrder",
                orderId,
                () -> {
                    OrderAggregate order = orders.create(orderId);
                    OrderCommands.StartOrder start =
                            command.currency() == null ? command.withCurrency(defaultCurrency) : command;
                    order.startOrder(start);
                    if (items != null && !items.isEmpty()) {
                        order.addItems(price(items));
                    }
                    orders.persist(order);
                    return orderId;
                });
    }

    public OrderState addItems(UUID orderId, List<OrderCommands.NewLine> items) {
        return instrumentation.run(
                "addItems",
                orderId,
                () -> {
                    OrderAggregate order = orders.require(orderId);
                    order.addItems(price(items));
                    orders.persist(order);
                    return order.state();
                });
    }

    public OrderState modifyOrder(UUID orderId, OrderCommands.ModifyItems command) {
        return instrumentation.run(
                "modifyOrder",
                orderId,
                () -> {
                    OrderAggregate order = orders.require(orderId);
                    order.modifyItems(
                            price(command.toAdd()),
                            command.toRemove(),
                            command.toModify(),
                            actors.currentActor().id(),
                            command.reason());
                    orders.persist(order);
                    return order.state();
                });
    }

    /**
     * Validates items against the catalog and inventory, applies promotions, prices the order and
     * confirms it, all in one append.
     *
     * @param paymentMethod the method to set, or null to keep the one already on the order
     */
    public OrderState confirmOrder(UUID orderId, PaymentMethod paymentMethod) {
        return instrumentation.run(
                "confirmOrder",
                orderId,
                () -> {
                    OrderAggregate order = orders.require(orderId);
                    order.requireConfirmable();
                    if (paymentMethod == null && order.state().paymentMethod() == null) {
                        throw new InvalidOrderStateException(
                                "a payment method is required before confirmation");
                    }

                    List<LineItem> repriced = catalog.reprice(order.state().items());
                    catalog.checkStock(repriced);
                    long subtotal = repriced.stream().mapToLong(LineItem::lineTotal).sum();
                    order.markItemsAsValidated(repriced, subtotal, actors.currentActor().id());

                    PromotionQuote quote = quote(order.state());
                    order.setPromotions(quote.available(), quote.autoApplied());

                    if (paymentMethod != null && paymentMethod != order.state().paymentMethod()) {
                        order.setPaymentMethod(paymentMethod);
                    }

                    PriceBreakdown price =
                            PriceCalculator.calculate(order.state(), taxRates.taxRate(order.state().locationId()));
                    order.calculateFinalPrice(price);
                    order.confirmOrder(orderNumbers.next(order.state().locationId()));
                    orders.persist(order);
                    log.info(
                            "Order {} confirmed as {} with total {} {}",
                            orderId,
                            order.state().orderNumber(),
                            order.state().total(),
                            order.state().currency());
                    return order.state();
                });
    }

    public OrderState cancelOrder(UUID orderId, String reason) {
        return instrumentation.run(
                "cancelOrder",
                orderId,
                () -> {
                    OrderAggregate order = orders.require(orderId);
                    order.cancelOrder(reason, actors.currentActor().id());
                    orders.persist(order);
                    return order.state();
                });
    }

    public OrderState transitionStatus(UUID orderId, OrderStatus to, String reason) {
        return instrumentation.run(
                "transitionStatus",
                orderId,
                () -> {
                    OrderAggregate order = orders.require(orderId);
                    order.transitionStatus(to, reason, actors.currentActor().id());
                    orders.persist(order);
                    return order.state();
                });
    }

    public OrderState updateCustomerInfo(UUID orderId, CustomerDetails customer) {
        return instrumentation.run(
                "updateCustomerInfo",
                orderId,
                () -> {
                    OrderAggregate order = orders.require(orderId);
                    order.updateCustomerInfo(customer);
                    orders.persist(order);
                    log.info("Customer of order {} updated: {}", orderId, redactor.redact(asMap(customer)));
                    return order.state();
                });
    }

    public OrderState addTip(UUID orderId, long amount) {
        return instrumentation.run(
                "addTip",
                orderId,
                () -> {
                    OrderAggregate order = orders.require(orderId);
                    order.addTip(amount, actors.currentActor().id());
                    orders.persist(order);
                    return order.state();
                });
    }

    public OrderState adjustPrice(UUID orderId, OrderCommands.AdjustPrice command) {
        return instrumentation.run(
                "adjustPrice",
                orderId,
                () -> {
                    OrderAggregate order = orders.require(orderId);
                    order.adjustPrice(command);
                    orders.persist(order);
                    return order.state();
                });
    }

    /** Adds and removes modifiers on one line; added modifiers are priced from the catalog. */
    public OrderState modifyItemModifiers(UUID orderId, OrderCommands.ChangeModifiers command) {
        return instrumentation.run(
                "modifyItemModifiers",
                orderId,
                () -> {
                    OrderAggregate order = orders.require(orderId);
                    order.modifyItemModifiers(
                            command.itemId(),
                            catalog.modifiers(command.addedModifierIds()),
                            command.removedModifierIds(),
                            actors.currentActor().id(),
                            command.reason());
                    orders.persist(order);
                    return order.state();
                });
    }

    public OrderState processPayment(UUID orderId, OrderCommands.ProcessPayment command) {
        return instrumentation.run(
                "processPayment",
                orderId,
                () -> {
                    OrderAggregate order = orders.require(orderId);
                    order.processPayment(command);
                    orders.persist(order);
                    log.info(
                            "Payment {} of {} {} taken on order {} (transaction {}), {} outstanding",
                            command.paymentId(),
                            command.amount(),
                            order.state().currency(),
                            orderId,
                            redactor.mask(command.transactionId()),
                            order.state().outstanding());
                    return order.state();
                });
    }

    public OrderState recordPaymentFailure(UUID orderId, OrderCommands.RecordPaymentFailure command) {
        return instrumentation.run(
                "recordPaymentFailure",
                orderId,
                () -> {
                    OrderAggregate order = orders.require(orderId);
                    order.recordPaymentFailure(command);
                    orders.persist(order);
                    log.warn(
                            "Payment {} on order {} failed: {} ({})",
                            command.paymentId(),
                            orderId,
                            command.failureReason(),
                            command.errorCode());
                    return order.state();
                });
    }

    /** The projected order. May lag the event store when projections are queued. */
    public OrderState getOrder(UUID orderId) {
        return readModel.findOrder(orderId).orElseThrow(() -> new OrderNotFoundException(orderId));
    }

    /** The order replayed from the event store. */
    public OrderState getOrderState(UUID orderId) {
        return orders.require(orderId).state();
    }

    private List<LineItem> price(List<OrderCommands.NewLine> lines) {
        if (lines == null) {
            return List.of();
        }
        return lines.stream()
                .map(line -> catalog.price(line.itemId(), line.quantity(), line.modifierIds(), line.notes()))
                .toList();
    }

    private PromotionQuote quote(OrderState state) {
        try {
            return promotions.quote(state);
        } catch (RuntimeException e) {
            throw new DependencyException("promotion-engine", "quote for order " + state.id() + " failed", e);
        }
    }

    private static Map<String, Object> asMap(CustomerDetails customer) {
        Map<String, Object> fields = new HashMap<>();
        fields.put("name", customer.name());
        fields.put("phone", customer.phone());
        fields.put("email", customer.email());
        fields.put("address", customer.deliveryAddress());
        return fields;
    }
}
