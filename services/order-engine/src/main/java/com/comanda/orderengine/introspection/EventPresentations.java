package com.comanda.orderengine.introspection;

import com.comanda.eventmodel.EventData;
import com.comanda.eventmodel.order.OrderEvents;
import com.comanda.eventmodel.session.SessionEvents;
import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Timeline presentation of every event kind. Depends only on the kind and the payload, so the
 * same event always reads the same way.
 */
public final class EventPresentations {

    private EventPresentations() {}

    public static EventPresentation describe(EventData event) {
        return switch (event.eventType()) {
            case ORDER_STARTED -> of("Order was created", "play-circle", "blue");
            case ITEMS_ADDED_TO_ORDER -> of(
                    "Added %d items to order"
                            .formatted(event.payloadAs(OrderEvents.ItemsAddedToOrder.class).items().size()),
                    "shopping-cart",
                    "green");
            case ITEMS_VALIDATED -> of("Items were validated", "check-circle", "green");
            case ITEMS_MODIFIED -> of("Order items were modified", "edit", "yellow");
            case ITEM_MODIFIERS_CHANGED -> of(
                    "Modifiers changed for "
                            + orDefault(event.payloadAs(OrderEvents.ItemModifiersChanged.class).itemName(), "item"),
                    "sliders",
                    "yellow");
            case PROMOTIONS_CALCULATED -> of("Promotions were calculated", "percent", "purple");
            case PROMOTION_APPLIED -> of("Promotion was applied", "tag", "purple");
            case PROMOTION_REMOVED -> of("Promotion was removed", "tag-x", "orange");
            case PRICE_CALCULATED -> of(
                    "Price calculated: " + money(event.payloadAs(OrderEvents.PriceCalculated.class).total()),
                    "calculator",
                    "blue");
            case TIP_ADDED -> of(
                    "Tip added: " + money(event.payloadAs(OrderEvents.TipAdded.class).amount()),
                    "dollar-sign",
                    "green");
            case PRICE_ADJUSTED -> of(
                    "Price adjusted: " + orDefault(event.payloadAs(OrderEvents.PriceAdjusted.class).reason(), "No reason"),
                    "trending-up",
                    "orange");
            case PAYMENT_METHOD_SET -> of(
                    "Payment method set to " + event.payloadAs(OrderEvents.PaymentMethodSet.class).paymentMethod(),
                    "credit-card",
                    "blue");
            case ORDER_CONFIRMED -> of("Order was confirmed", "check-circle-2", "green");
            case ORDER_STATUS_TRANSITIONED -> of(
                    "Status changed to " + event.payloadAs(OrderEvents.OrderStatusTransitioned.class).to(),
                    "arrow-right-circle",
                    "blue");
            case ORDER_CANCELLED -> of(
                    "Order cancelled: " + orDefault(event.payloadAs(OrderEvents.OrderCancelled.class).reason(), "No reason"),
                    "x-circle",
                    "red");
            case CUSTOMER_INFO_UPDATED -> of("Customer information updated", "user", "blue");
            case PAYMENT_PROCESSED -> of(
                    "Payment processed: " + money(event.payloadAs(OrderEvents.PaymentProcessed.class).amount()),
                    "check-square",
                    "green");
            case PAYMENT_FAILED -> of(
                    "Payment failed: "
                            + orDefault(event.payloadAs(OrderEvents.PaymentFailed.class).failureReason(), "Unknown error"),
                    "alert-triangle",
                    "red");
            case SESSION_INITIATED -> {
                String platform = event.payloadAs(SessionEvents.SessionInitiated.class).platform();
                yield of(platform == null ? "Session started" : "Session started on " + platform, "log-in", "blue");
            }
            case ITEM_SEARCHED -> {
                var payload = event.payloadAs(SessionEvents.ItemSearched.class);
                yield of(
                        "Searched for \"%s\" (%d results)".formatted(payload.query(), payload.resultsCount()),
                        "search",
                        "gray");
            }
            case CATEGORY_BROWSED -> {
                var payload = event.payloadAs(SessionEvents.CategoryBrowsed.class);
                yield of("Browsed " + orDefault(payload.categoryName(), payload.categoryId()), "grid", "gray");
            }
            case ITEM_VIEWED -> {
                var payload = event.payloadAs(SessionEvents.ItemViewed.class);
                yield of("Viewed " + orDefault(payload.itemName(), payload.itemId()), "eye", "gray");
            }
            case ITEM_ADDED_TO_CART -> {
                var payload = event.payloadAs(SessionEvents.ItemAddedToCart.class);
                yield of(
                        "Added %d x %s to cart"
                                .formatted(payload.quantity(), orDefault(payload.itemName(), payload.itemId())),
                        "shopping-cart",
                        "green");
            }
            case ITEM_REMOVED_FROM_CART -> of(
                    "Removed %s from cart".formatted(event.payloadAs(SessionEvents.ItemRemovedFromCart.class).itemId()),
                    "trash-2",
                    "orange");
            case CART_ITEM_MODIFIED -> of(
                    "Cart item %s modified".formatted(event.payloadAs(SessionEvents.CartItemModified.class).itemId()),
                    "edit",
                    "yellow");
            case SERVING_TYPE_SELECTED -> of(
                    "Serving type set to " + event.payloadAs(SessionEvents.ServingTypeSelected.class).servingType(),
                    "utensils",
                    "blue");
            case CUSTOMER_INFO_ENTERED -> of("Customer information entered", "user", "blue");
            case PAYMENT_METHOD_SELECTED -> of(
                    "Payment method selected: "
                            + event.payloadAs(SessionEvents.PaymentMethodSelected.class).paymentMethod(),
                    "credit-card",
                    "blue");
            case DRAFT_SAVED -> of(
                    event.payloadAs(SessionEvents.DraftSaved.class).autoSave() ? "Draft auto-saved" : "Draft saved",
                    "save",
                    "gray");
            case SESSION_ABANDONED -> of(
                    "Session abandoned: "
                            + orDefault(event.payloadAs(SessionEvents.SessionAbandoned.class).reason(), "No reason"),
                    "log-out",
                    "red");
            case SESSION_CONVERTED -> of(
                    "Converted to order " + event.payloadAs(SessionEvents.SessionConverted.class).orderId(),
                    "check-circle-2",
                    "green");
        };
    }

    /** Minor units as dollars, e.g. 1234 becomes "$12.34". */
    static String money(long minorUnits) {
        return "$" + BigDecimal.valueOf(minorUnits).movePointLeft(2).setScale(2, RoundingMode.UNNECESSARY).toPlainString();
    }

    private static EventPresentation of(String description, String icon, String color) {
        return new EventPresentation(description, icon, color);
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}
