package com.comanda.orderengine.application;

import com.comanda.eventmodel.order.CustomerDetails;
import com.comanda.eventmodel.order.OrderType;
import com.comanda.eventmodel.order.PaymentMethod;
import com.comanda.eventmodel.session.CartModifier;
import com.comanda.orderengine.domain.exception.SessionNotFoundException;
import com.comanda.orderengine.domain.session.OrderSession;
import com.comanda.orderengine.domain.session.SessionState;
import com.comanda.orderengine.projection.SessionReadModel;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Consumer;

/** Session commands. Each loads the session, runs one command and persists. */
public class SessionCommandService {

    private final SessionRepository sessions;
    private final SessionReadModel readModel;
    private final SessionToOrderConverter converter;
    private final CommandInstrumentation instrumentation;

    public SessionCommandService(
            SessionRepository sessions,
            SessionReadModel readModel,
            SessionToOrderConverter converter,
            CommandInstrumentation instrumentation) {
        this.sessions = sessions;
        this.readModel = readModel;
        this.converter = converter;
        this.instrumentation = instrumentation;
    }

    public UUID startSession(
            String userId, String locationId, String platform, String referrer, Map<String, String> attributes) {
        UUID sessionId = UUID.randomUUID();
        return instrumentation.run(
                "startSession",
                sessionId,
                () -> {
                    OrderSession session = sessions.create(sessionId);
                    session.initiate(userId, locationId, platform, referrer, attributes);
                    sessions.persist(session);
                    return sessionId;
                });
    }

    public SessionState addToCart(
            UUID sessionId, String itemId, String itemName, int quantity, List<CartModifier> modifiers, String notes) {
        return execute("addToCart", sessionId, s -> s.addToCart(itemId, itemName, quantity, modifiers, notes));
    }

    public SessionState removeFromCart(UUID sessionId, String itemId, String reason) {
        return execute("removeFromCart", sessionId, s -> s.removeFromCart(itemId, reason));
    }

    public SessionState modifyCartItem(
            UUID sessionId, String itemId, Integer quantity, List<CartModifier> modifiers, String notes) {
        return execute("modifyCartItem", sessionId, s -> s.modifyCartItem(itemId, quantity, modifiers, notes));
    }

    public SessionState recordSearch(UUID sessionId, String query, Map<String, String> filters, int resultsCount) {
        return execute("recordSearch", sessionId, s -> s.recordSearch(query, filters, resultsCount));
    }

    public SessionState browseCategory(UUID sessionId, String categoryId, String categoryName, int itemsViewed) {
        return execute("browseCategory", sessionId, s -> s.browseCategory(categoryId, categoryName, itemsViewed));
    }

    public SessionState viewItem(UUID sessionId, String itemId, String itemName, String source) {
        return execute("viewItem", sessionId, s -> s.viewItem(itemId, itemName, source));
    }

    public SessionState selectServingType(
            UUID sessionId, OrderType servingType, String tableNumber, String deliveryAddress) {
        return execute(
                "selectServingType", sessionId, s -> s.selectServingType(servingType, tableNumber, deliveryAddress));
    }

    public SessionState enterCustomerInfo(UUID sessionId, CustomerDetails customer) {
        return execute("enterCustomerInfo", sessionId, s -> s.enterCustomerInfo(customer));
    }

    public SessionState selectPaymentMethod(UUID sessionId, PaymentMethod method) {
        return execute("selectPaymentMethod", sessionId, s -> s.selectPaymentMethod(method));
    }

    public SessionState saveDraft(UUID sessionId, String reason, boolean autoSave) {
        return execute("saveDraft", sessionId, s -> s.saveDraft(reason, autoSave));
    }

    public SessionState abandonSession(UUID sessionId, String reason) {
        return execute("abandonSession", sessionId, s -> s.abandon(reason));
    }

    public ConversionResult convertToOrder(UUID sessionId) {
        return instrumentation.run("convertToOrder", sessionId, () -> converter.convert(sessionId));
    }

    /** The projected session. May lag the event store when projections are queued. */
    public SessionState getSession(UUID sessionId) {
        return readModel.findSession(sessionId).orElseThrow(() -> new SessionNotFoundException(sessionId));
    }

    private SessionState execute(String command, UUID sessionId, Consumer<OrderSession> action) {
        return instrumentation.run(
                command,
                sessionId,
                () -> {
                    OrderSession session = sessions.require(sessionId);
                    action.accept(session);
                    sessions.persist(session);
                    return session.state();
                });
    }
}
