package com.comanda.orderengine.application;

import com.comanda.eventmodel.order.CustomerDetails;
import com.comanda.eventmodel.order.LineItem;
import com.comanda.eventmodel.order.OrderType;
import com.comanda.eventmodel.session.CartModifier;
import com.comanda.eventstore.ConcurrencyConflictException;
import com.comanda.orderengine.collaborator.Actor;
import com.comanda.orderengine.collaborator.ActorResolver;
import com.comanda.orderengine.collaborator.CatalogItem;
import com.comanda.orderengine.collaborator.OrderNumberGenerator;
import com.comanda.orderengine.config.MissingItemPolicy;
import com.comanda.orderengine.domain.exception.InvalidOrderStateException;
import com.comanda.orderengine.domain.exception.ValidationException;
import com.comanda.orderengine.domain.order.OrderAggregate;
import com.comanda.orderengine.domain.order.OrderCommands;
import com.comanda.orderengine.domain.session.CartLine;
import com.comanda.orderengine.domain.session.OrderSession;
import com.comanda.orderengine.domain.session.SessionState;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns an active session's cart into a confirmed order.
 *
 * <p>Item and modifier prices always come from the catalog at conversion time. The order is
 * persisted first; the session is then marked converted at the version it was loaded at. If the
 * session moved on in the meantime, the new order is cancelled and the conflict rethrown, so every
 * live order converted from a session is referenced by that session.
 */
public class SessionToOrderConverter {

    private static final Logger log = LoggerFactory.getLogger(SessionToOrderConverter.class);

    static final String SESSION_CHANGED = "session changed during conversion";

    private final SessionRepository sessions;
    private final OrderRepository orders;
    private final CatalogGateway catalog;
    private final OrderNumberGenerator orderNumbers;
    private final ActorResolver actors;
    private final MissingItemPolicy missingItemPolicy;
    private final String currency;

    public SessionToOrderConverter(
            SessionRepository sessions,
            OrderRepository orders,
            CatalogGateway catalog,
            OrderNumberGenerator orderNumbers,
            ActorResolver actors,
            MissingItemPolicy missingItemPolicy,
            String currency) {
        this.sessions = sessions;
        this.orders = orders;
        this.catalog = catalog;
        this.orderNumbers = orderNumbers;
        this.actors = actors;
        this.missingItemPolicy = missingItemPolicy;
        this.currency = currency;
    }

    public ConversionResult convert(UUID sessionId) {
        OrderSession session = sessions.require(sessionId);
        SessionState cart = session.state();
        if (!cart.isActive()) {
            throw new InvalidOrderStateException(
                    "session is %s and cannot be converted".formatted(cart.status()));
        }
        if (cart.cart().isEmpty()) {
            throw new ValidationException("cannot convert a session with an empty cart");
        }
        if (cart.paymentMethod() == null) {
            throw new InvalidOrderStateException("a payment method must be selected before conversion");
        }

        List<LineItem> lines = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        for (CartLine line : cart.cart()) {
            Optional<CatalogItem> item = catalog.findAvailable(line.itemId());
            if (item.isEmpty()) {
                if (missingItemPolicy == MissingItemPolicy.FAIL) {
                    throw new ValidationException(
                            "item %s is no longer available".formatted(line.itemId()));
                }
                log.warn("Skipping item {} of session {}: not available in the catalog", line.itemId(), sessionId);
                skipped.add(line.itemId());
                continue;
            }
            catalog.checkStock(line.itemId(), line.quantity());
            CatalogItem priced = item.get();
            lines.add(
                    LineItem.of(
                            line.itemId(),
                            priced.name(),
                            line.quantity(),
                            priced.effectivePrice(),
                            catalog.modifiers(modifierIds(line.modifiers())),
                            line.notes()));
        }
        if (lines.isEmpty()) {
            throw new ValidationException("none of the items in session %s are available".formatted(sessionId));
        }

        UUID orderId = UUID.randomUUID();
        Actor actor = actors.currentActor();
        OrderAggregate order = orders.create(orderId);
        order.startOrder(startCommand(cart, actor));
        order.addItems(lines);
        List<LineItem> merged = order.state().items();
        long subtotal = merged.stream().mapToLong(LineItem::lineTotal).sum();
        order.markItemsAsValidated(merged, subtotal, actor.id());
        order.setPaymentMethod(cart.paymentMethod());
        order.confirmOrder(orderNumbers.next(cart.locationId()));
        orders.persist(order);
        long total = order.state().total();

        session.markConverted(orderId, total);
        try {
            sessions.persist(session);
        } catch (ConcurrencyConflictException e) {
            compensate(order, sessionId, e);
            throw e;
        }
        log.info(
                "Session {} converted into order {} ({} line(s), {} skipped)",
                sessionId,
                orderId,
                lines.size(),
                skipped.size());
        return new ConversionResult(orderId, sessionId, total, order.state().currency(), skipped);
    }

    private void compensate(OrderAggregate order, UUID sessionId, ConcurrencyConflictException conflict) {
        log.warn("Session {} changed during conversion; cancelling order {}", sessionId, order.id());
        try {
            order.cancelOrder(SESSION_CHANGED, actors.currentActor().id());
            orders.persist(order);
        } catch (RuntimeException e) {
            log.error("Could not cancel order {} after a failed conversion of session {}", order.id(), sessionId, e);
            conflict.addSuppressed(e);
        }
    }

    private OrderCommands.StartOrder startCommand(SessionState session, Actor actor) {
        OrderType type = session.servingType();
        if (type == null) {
            type = session.tableNumber() != null ? OrderType.DINE_IN : OrderType.TAKEOUT;
        }
        CustomerDetails customer = session.customer();
        if (session.deliveryAddress() != null) {
            customer =
                    customer == null
                            ? new CustomerDetails(null, null, null, session.deliveryAddress(), null)
                            : new CustomerDetails(
                                    customer.name(),
                                    customer.phone(),
                                    customer.email(),
                                    session.deliveryAddress(),
                                    customer.notes());
        }
        String staffId = session.userId() != null ? session.userId() : actor.id();
        return new OrderCommands.StartOrder(
                staffId,
                session.locationId(),
                session.tableNumber(),
                type,
                false,
                session.id(),
                currency,
                customer,
                Map.of("source", "session"));
    }

    private static List<String> modifierIds(List<CartModifier> modifiers) {
        return modifiers.stream().map(CartModifier::modifierId).toList();
    }
}
