package com.comanda.orderengine.domain.session;

import com.comanda.eventmodel.EventData;
import com.comanda.eventmodel.session.CartModifier;
import com.comanda.eventmodel.session.SessionEvents;
import com.comanda.eventstore.aggregate.StateEvolver;
import com.comanda.orderengine.domain.exception.IntegrityException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/** Folds session events into {@link SessionState}. */
public final class SessionEvolver implements StateEvolver<SessionState> {

    public static final SessionEvolver INSTANCE = new SessionEvolver();

    private SessionEvolver() {}

    @Override
    public SessionState initial(UUID aggregateId) {
        return SessionState.initial(aggregateId);
    }

    @Override
    public SessionState apply(SessionState state, EventData event) {
        Instant at = event.metadata().occurredAt();
        SessionState next =
                switch (event.eventType()) {
                    case SESSION_INITIATED -> {
                        var payload = event.payloadAs(SessionEvents.SessionInitiated.class);
                        yield state.toBuilder()
                                .status(SessionStatus.ACTIVE)
                                .userId(payload.userId())
                                .locationId(payload.locationId())
                                .platform(payload.platform())
                                .referrer(payload.referrer())
                                .attributes(payload.attributes())
                                .startedAt(at)
                                .build();
                    }
                    case ITEM_SEARCHED -> state.toBuilder()
                            .searches(append(state.searches(), event.payloadAs(SessionEvents.ItemSearched.class).query()))
                            .build();
                    case CATEGORY_BROWSED -> state.toBuilder()
                            .browsedCategories(
                                    append(
                                            state.browsedCategories(),
                                            event.payloadAs(SessionEvents.CategoryBrowsed.class).categoryId()))
                            .build();
                    case ITEM_VIEWED -> state.toBuilder()
                            .viewedItems(append(state.viewedItems(), event.payloadAs(SessionEvents.ItemViewed.class).itemId()))
                            .build();
                    case ITEM_ADDED_TO_CART -> state.toBuilder()
                            .cart(addToCart(state.cart(), event.payloadAs(SessionEvents.ItemAddedToCart.class)))
                            .build();
                    case ITEM_REMOVED_FROM_CART -> {
                        String itemId = event.payloadAs(SessionEvents.ItemRemovedFromCart.class).itemId();
                        List<CartLine> cart = new ArrayList<>(state.cart());
                        cart.removeIf(line -> line.itemId().equals(itemId));
                        yield state.toBuilder().cart(cart).build();
                    }
                    case CART_ITEM_MODIFIED -> state.toBuilder()
                            .cart(modifyCart(state.cart(), event.payloadAs(SessionEvents.CartItemModified.class)))
                            .build();
                    case SERVING_TYPE_SELECTED -> {
                        var payload = event.payloadAs(SessionEvents.ServingTypeSelected.class);
                        yield state.toBuilder()
                                .servingType(payload.servingType())
                                .tableNumber(payload.tableNumber())
                                .deliveryAddress(payload.deliveryAddress())
                                .build();
                    }
                    case CUSTOMER_INFO_ENTERED -> state.toBuilder()
                            .customer(event.payloadAs(SessionEvents.CustomerInfoEntered.class).customer())
                            .build();
                    case PAYMENT_METHOD_SELECTED -> state.toBuilder()
                            .paymentMethod(event.payloadAs(SessionEvents.PaymentMethodSelected.class).paymentMethod())
                            .build();
                    case DRAFT_SAVED -> state.toBuilder().draftCount(state.draftCount() + 1).build();
                    case SESSION_ABANDONED -> state.toBuilder()
                            .status(SessionStatus.ABANDONED)
                            .abandonReason(event.payloadAs(SessionEvents.SessionAbandoned.class).reason())
                            .build();
                    case SESSION_CONVERTED -> state.toBuilder()
                            .status(SessionStatus.CONVERTED)
                            .convertedOrderId(event.payloadAs(SessionEvents.SessionConverted.class).orderId())
                            .build();
                    case ORDER_STARTED,
                            ITEMS_ADDED_TO_ORDER,
                            ITEMS_MODIFIED,
                            ITEMS_VALIDATED,
                            PROMOTIONS_CALCULATED,
                            PROMOTION_APPLIED,
                            PROMOTION_REMOVED,
                            PRICE_CALCULATED,
                            TIP_ADDED,
                            PRICE_ADJUSTED,
                            PAYMENT_METHOD_SET,
                            ORDER_CONFIRMED,
                            ORDER_STATUS_TRANSITIONED,
                            ORDER_CANCELLED,
                            CUSTOMER_INFO_UPDATED,
                            ITEM_MODIFIERS_CHANGED,
                            PAYMENT_PROCESSED,
                            PAYMENT_FAILED -> throw new IntegrityException(
                            "%s cannot be applied to session %s".formatted(event.eventType().value(), state.id()));
                };
        return next.toBuilder().version(state.version() + 1).lastActivityAt(at).build();
    }

    private static List<String> append(List<String> values, String value) {
        List<String> result = new ArrayList<>(values);
        result.add(value);
        return result;
    }

    /** Merges into a line with the same item and modifiers, otherwise appends a new line. */
    private static List<CartLine> addToCart(List<CartLine> cart, SessionEvents.ItemAddedToCart added) {
        List<CartLine> result = new ArrayList<>(cart);
        List<CartModifier> modifiers = added.modifiers() == null ? List.of() : added.modifiers();
        for (int i = 0; i < result.size(); i++) {
            CartLine line = result.get(i);
            if (line.itemId().equals(added.itemId()) && line.modifiers().equals(modifiers)) {
                result.set(
                        i,
                        new CartLine(
                                line.itemId(),
                                line.itemName(),
                                line.quantity() + added.quantity(),
                                line.modifiers(),
                                added.notes() != null ? added.notes() : line.notes()));
                return result;
            }
        }
        result.add(new CartLine(added.itemId(), added.itemName(), added.quantity(), added.modifiers(), added.notes()));
        return result;
    }

    private static List<CartLine> modifyCart(List<CartLine> cart, SessionEvents.CartItemModified change) {
        List<CartLine> result = new ArrayList<>(cart);
        for (int i = 0; i < result.size(); i++) {
            CartLine line = result.get(i);
            if (line.itemId().equals(change.itemId())) {
                result.set(
                        i,
                        new CartLine(
                                line.itemId(),
                                line.itemName(),
                                change.quantity() != null ? change.quantity() : line.quantity(),
                                change.modifiers() != null ? change.modifiers() : line.modifiers(),
                                change.notes() != null ? change.notes() : line.notes()));
            }
        }
        return result;
    }
}
