package com.comanda.eventmodel;

import com.comanda.eventmodel.order.OrderEvents;
import com.comanda.eventmodel.session.SessionEvents;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * All known event kinds in the order engine.
 *
 * <p>The set is closed: every kind names its canonical JSON value, the aggregate type whose stream
 * it may appear in, and the payload record it carries.
 */
public enum EventType {

    // ---- Order Events ----
    ORDER_STARTED("OrderStarted", AggregateType.ORDER, OrderEvents.OrderStarted.class),
    ITEMS_ADDED_TO_ORDER(
            "ItemsAddedToOrder", AggregateType.ORDER, OrderEvents.ItemsAddedToOrder.class),
    ITEMS_MODIFIED("ItemsModified", AggregateType.ORDER, OrderEvents.ItemsModified.class),
    ITEMS_VALIDATED("ItemsValidated", AggregateType.ORDER, OrderEvents.ItemsValidated.class),
    ITEM_MODIFIERS_CHANGED(
            "ItemModifiersChanged", AggregateType.ORDER, OrderEvents.ItemModifiersChanged.class),
    PROMOTIONS_CALCULATED(
            "PromotionsCalculated", AggregateType.ORDER, OrderEvents.PromotionsCalculated.class),
    PROMOTION_APPLIED("PromotionApplied", AggregateType.ORDER, OrderEvents.PromotionApplied.class),
    PROMOTION_REMOVED("PromotionRemoved", AggregateType.ORDER, OrderEvents.PromotionRemoved.class),
    PRICE_CALCULATED("PriceCalculated", AggregateType.ORDER, OrderEvents.PriceCalculated.class),
    TIP_ADDED("TipAdded", AggregateType.ORDER, OrderEvents.TipAdded.class),
    PRICE_ADJUSTED("PriceAdjusted", AggregateType.ORDER, OrderEvents.PriceAdjusted.class),
    PAYMENT_METHOD_SET("PaymentMethodSet", AggregateType.ORDER, OrderEvents.PaymentMethodSet.class),
    ORDER_CONFIRMED("OrderConfirmed", AggregateType.ORDER, OrderEvents.OrderConfirmed.class),
    ORDER_STATUS_TRANSITIONED(
            "OrderStatusTransitioned",
            AggregateType.ORDER,
            OrderEvents.OrderStatusTransitioned.class),
    ORDER_CANCELLED("OrderCancelled", AggregateType.ORDER, OrderEvents.OrderCancelled.class),
    CUSTOMER_INFO_UPDATED(
            "CustomerInfoUpdated", AggregateType.ORDER, OrderEvents.CustomerInfoUpdated.class),
    PAYMENT_PROCESSED("PaymentProcessed", AggregateType.ORDER, OrderEvents.PaymentProcessed.class),
    PAYMENT_FAILED("PaymentFailed", AggregateType.ORDER, OrderEvents.PaymentFailed.class),

    // ---- Session Events ----
    SESSION_INITIATED(
            "SessionInitiated", AggregateType.ORDER_SESSION, SessionEvents.SessionInitiated.class),
    ITEM_SEARCHED("ItemSearched", AggregateType.ORDER_SESSION, SessionEvents.ItemSearched.class),
    CATEGORY_BROWSED(
            "CategoryBrowsed", AggregateType.ORDER_SESSION, SessionEvents.CategoryBrowsed.class),
    ITEM_VIEWED("ItemViewed", AggregateType.ORDER_SESSION, SessionEvents.ItemViewed.class),
    ITEM_ADDED_TO_CART(
            "ItemAddedToCart", AggregateType.ORDER_SESSION, SessionEvents.ItemAddedToCart.class),
    ITEM_REMOVED_FROM_CART(
            "ItemRemovedFromCart",
            AggregateType.ORDER_SESSION,
            SessionEvents.ItemRemovedFromCart.class),
    CART_ITEM_MODIFIED(
            "CartItemModified", AggregateType.ORDER_SESSION, SessionEvents.CartItemModified.class),
    SERVING_TYPE_SELECTED(
            "ServingTypeSelected",
            AggregateType.ORDER_SESSION,
            SessionEvents.ServingTypeSelected.class),
    CUSTOMER_INFO_ENTERED(
            "CustomerInfoEntered",
            AggregateType.ORDER_SESSION,
            SessionEvents.CustomerInfoEntered.class),
    PAYMENT_METHOD_SELECTED(
            "PaymentMethodSelected",
            AggregateType.ORDER_SESSION,
            SessionEvents.PaymentMethodSelected.class),
    DRAFT_SAVED("DraftSaved", AggregateType.ORDER_SESSION, SessionEvents.DraftSaved.class),
    SESSION_ABANDONED(
            "SessionAbandoned", AggregateType.ORDER_SESSION, SessionEvents.SessionAbandoned.class),
    SESSION_CONVERTED(
            "SessionConverted", AggregateType.ORDER_SESSION, SessionEvents.SessionConverted.class);

    private final String value;
    private final AggregateType aggregateType;
    private final Class<? extends EventPayload> payloadType;

    EventType(
            String value, AggregateType aggregateType, Class<? extends EventPayload> payloadType) {
        this.value = value;
        this.aggregateType = aggregateType;
        this.payloadType = payloadType;
    }

    /** The canonical string representation used in JSON (e.g. "ItemsAddedToOrder"). */
    public String value() {
        return value;
    }

    /** The only aggregate type whose stream may contain this kind. */
    public AggregateType aggregateType() {
        return aggregateType;
    }

    /** The payload record this kind carries. */
    public Class<? extends EventPayload> payloadType() {
        return payloadType;
    }

    /**
     * Looks up an EventType by its canonical string value.
     *
     * @param value the string to match (e.g. "OrderConfirmed")
     * @return the matching EventType, or empty if not found
     */
    public static Optional<EventType> fromString(String value) {
        for (EventType type : values()) {
            if (type.value.equals(value)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    /** Checks whether a string corresponds to a known event type. */
    public static boolean isKnown(String value) {
        return fromString(value).isPresent();
    }

    /** All kinds that belong to the given aggregate type, in declaration order. */
    public static List<EventType> forAggregate(AggregateType aggregateType) {
        return Arrays.stream(values()).filter(t -> t.aggregateType == aggregateType).toList();
    }
}
