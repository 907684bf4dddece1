package com.comanda.orderengine.domain.order;

import com.comanda.eventmodel.EventData;
import com.comanda.eventmodel.order.ItemChange;
import com.comanda.eventmodel.order.LineItem;
import com.comanda.eventmodel.order.LineModifier;
import com.comanda.eventmodel.order.OrderEvents;
import com.comanda.eventmodel.order.OrderStatus;
import com.comanda.eventmodel.order.PriceAdjustmentType;
import com.comanda.eventmodel.order.PromotionLine;
import com.comanda.eventstore.aggregate.StateEvolver;
import com.comanda.orderengine.domain.exception.IntegrityException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Folds order events into {@link OrderState}. Shared by the aggregate, the projector and the
 * introspector, so all three derive identical state from the same events.
 */
public final class OrderEvolver implements StateEvolver<OrderState> {

    public static final OrderEvolver INSTANCE = new OrderEvolver();

    private OrderEvolver() {}

    @Override
    public OrderState initial(UUID aggregateId) {
        return OrderState.initial(aggregateId);
    }

    @Override
    public OrderState apply(OrderState state, EventData event) {
        Instant at = event.metadata().occurredAt();
        String actor = event.metadata().actorId();
        OrderState next =
                switch (event.eventType()) {
                    case ORDER_STARTED -> started(state, event.payloadAs(OrderEvents.OrderStarted.class), at, actor);
                    case ITEMS_ADDED_TO_ORDER -> itemsChanged(
                            state,
                            mergeLines(state.items(), event.payloadAs(OrderEvents.ItemsAddedToOrder.class).items()),
                            false);
                    case ITEMS_MODIFIED -> itemsChanged(
                            state, modified(state.items(), event.payloadAs(OrderEvents.ItemsModified.class)), true);
                    case ITEMS_VALIDATED -> validated(state, event.payloadAs(OrderEvents.ItemsValidated.class));
                    case ITEM_MODIFIERS_CHANGED -> itemsChanged(
                            state,
                            modifiersChanged(state, event.payloadAs(OrderEvents.ItemModifiersChanged.class)),
                            true);
                    case PROMOTIONS_CALCULATED -> {
                        var payload = event.payloadAs(OrderEvents.PromotionsCalculated.class);
                        yield state.toBuilder()
                                .availablePromotions(payload.available())
                                .appliedPromotions(payload.autoApplied())
                                .promotionsCalculated(true)
                                .priceCalculated(false)
                                .build();
                    }
                    case PROMOTION_APPLIED -> {
                        var payload = event.payloadAs(OrderEvents.PromotionApplied.class);
                        var applied = withoutPromotion(state.appliedPromotions(), payload.promotionId());
                        applied.add(new PromotionLine(payload.promotionId(), payload.name(), payload.discountAmount()));
                        yield state.toBuilder().appliedPromotions(applied).priceCalculated(false).build();
                    }
                    case PROMOTION_REMOVED -> state.toBuilder()
                            .appliedPromotions(
                                    withoutPromotion(
                                            state.appliedPromotions(),
                                            event.payloadAs(OrderEvents.PromotionRemoved.class).promotionId()))
                            .priceCalculated(false)
                            .build();
                    case PRICE_CALCULATED -> {
                        var payload = event.payloadAs(OrderEvents.PriceCalculated.class);
                        yield state.toBuilder()
                                .tax(payload.tax())
                                .taxRate(payload.taxRate())
                                .priceCalculated(true)
                                .build();
                    }
                    case TIP_ADDED -> state.toBuilder()
                            .tip(event.payloadAs(OrderEvents.TipAdded.class).amount())
                            .build();
                    case PRICE_ADJUSTED -> {
                        var payload = event.payloadAs(OrderEvents.PriceAdjusted.class);
                        yield adjusted(state, payload.adjustmentType(), payload.amount());
                    }
                    case PAYMENT_METHOD_SET -> state.toBuilder()
                            .paymentMethod(event.payloadAs(OrderEvents.PaymentMethodSet.class).paymentMethod())
                            .build();
                    case ORDER_CONFIRMED -> StatusTransitionValidator.applyStatus(
                                    state, OrderStatus.CONFIRMED, at, null, actor)
                            .toBuilder()
                            .orderNumber(event.payloadAs(OrderEvents.OrderConfirmed.class).orderNumber())
                            .build();
                    case ORDER_STATUS_TRANSITIONED -> {
                        var payload = event.payloadAs(OrderEvents.OrderStatusTransitioned.class);
                        yield StatusTransitionValidator.applyStatus(state, payload.to(), at, payload.reason(), actor);
                    }
                    case ORDER_CANCELLED -> {
                        var payload = event.payloadAs(OrderEvents.OrderCancelled.class);
                        yield StatusTransitionValidator.applyStatus(
                                        state, OrderStatus.CANCELLED, at, payload.reason(), actor)
                                .toBuilder()
                                .cancellationReason(payload.reason())
                                .build();
                    }
                    case CUSTOMER_INFO_UPDATED -> state.toBuilder()
                            .customer(event.payloadAs(OrderEvents.CustomerInfoUpdated.class).customer())
                            .build();
                    case PAYMENT_PROCESSED -> {
                        var payload = event.payloadAs(OrderEvents.PaymentProcessed.class);
                        yield state.toBuilder()
                                .paymentMethod(payload.paymentMethod())
                                .amountPaid(state.amountPaid() + payload.amount())
                                .lastPaymentAttempt(
                                        new PaymentAttempt(
                                                payload.paymentId(),
                                                payload.paymentMethod(),
                                                payload.amount(),
                                                true,
                                                payload.status(),
                                                payload.transactionId(),
                                                null,
                                                null,
                                                at))
                                .build();
                    }
                    case PAYMENT_FAILED -> {
                        var payload = event.payloadAs(OrderEvents.PaymentFailed.class);
                        yield state.toBuilder()
                                .lastPaymentAttempt(
                                        new PaymentAttempt(
                                                payload.paymentId(),
                                                payload.paymentMethod(),
                                                payload.amount(),
                                                false,
                                                null,
                                                null,
                                                payload.failureReason(),
                                                payload.errorCode(),
                                                at))
                                .build();
                    }
                    case SESSION_INITIATED,
                            ITEM_SEARCHED,
                            CATEGORY_BROWSED,
                            ITEM_VIEWED,
                            ITEM_ADDED_TO_CART,
                            ITEM_REMOVED_FROM_CART,
                            CART_ITEM_MODIFIED,
                            SERVING_TYPE_SELECTED,
                            CUSTOMER_INFO_ENTERED,
                            PAYMENT_METHOD_SELECTED,
                            DRAFT_SAVED,
                            SESSION_ABANDONED,
                            SESSION_CONVERTED -> throw new IntegrityException(
                            "%s cannot be applied to order %s".formatted(event.eventType().value(), state.id()));
                };
        return next.toBuilder().version(state.version() + 1).updatedAt(at).build();
    }

    private static OrderState started(
            OrderState state, OrderEvents.OrderStarted payload, Instant at, String actor) {
        OrderStatus initial = payload.initialStatus() == null ? OrderStatus.STARTED : payload.initialStatus();
        return StatusTransitionValidator.applyStatus(state, initial, at, null, actor)
                .toBuilder()
                .orderType(payload.orderType())
                .staffId(payload.staffId())
                .locationId(payload.locationId())
                .tableNumber(payload.tableNumber())
                .sessionId(payload.sessionId())
                .currency(payload.currency())
                .customer(payload.customer())
                .attributes(payload.attributes())
                .createdAt(at)
                .build();
    }

    private static OrderState adjusted(OrderState state, PriceAdjustmentType type, long amount) {
        return switch (type) {
            case DISCOUNT -> state.toBuilder().manualDiscount(state.manualDiscount() + amount).build();
            case SURCHARGE -> state.toBuilder().manualDiscount(state.manualDiscount() - amount).build();
            case CORRECTION -> state.toBuilder()
                    .manualDiscount(state.manualDiscount() + state.total() - amount)
                    .build();
            case TIP -> state.toBuilder().tip(state.tip() + amount).build();
        };
    }

    private static OrderState itemsChanged(OrderState state, List<LineItem> items, boolean modification) {
        long subtotal = 0;
        for (LineItem item : items) {
            subtotal += item.lineTotal();
        }
        return state.toBuilder()
                .items(items)
                .subtotal(subtotal)
                .tax(taxAtLastRate(state, subtotal))
                .itemsValidated(false)
                .priceCalculated(false)
                .modificationCount(state.modificationCount() + (modification ? 1 : 0))
                .build();
    }

    private static OrderState validated(OrderState state, OrderEvents.ItemsValidated payload) {
        long sum = 0;
        for (LineItem item : payload.items()) {
            sum += item.lineTotal();
        }
        if (sum != payload.subtotal()) {
            throw new IntegrityException(
                    "validated subtotal %d of order %s does not equal the line total %d"
                            .formatted(payload.subtotal(), state.id(), sum));
        }
        return state.toBuilder()
                .items(payload.items())
                .subtotal(payload.subtotal())
                .tax(taxAtLastRate(state, payload.subtotal()))
                .itemsValidated(true)
                .priceCalculated(false)
                .build();
    }

    /** Tax on a changed subtotal at the last calculated rate, zero while none has been calculated. */
    private static long taxAtLastRate(OrderState state, long subtotal) {
        return state.taxRate() == null ? 0 : PriceCalculator.tax(subtotal, state.taxRate());
    }

    /** Adds lines, merging each into an existing line for the same item, modifiers and price. */
    static List<LineItem> mergeLines(List<LineItem> existing, List<LineItem> added) {
        List<LineItem> result = new ArrayList<>(existing);
        for (LineItem line : added) {
            int match = -1;
            for (int i = 0; i < result.size(); i++) {
                if (result.get(i).sameLineAs(line)) {
                    match = i;
                    break;
                }
            }
            if (match >= 0) {
                LineItem current = result.get(match);
                result.set(match, current.withQuantity(current.quantity() + line.quantity()));
            } else {
                result.add(line);
            }
        }
        return result;
    }

    private static List<LineItem> modified(List<LineItem> items, OrderEvents.ItemsModified payload) {
        List<LineItem> result = new ArrayList<>();
        for (LineItem item : items) {
            if (!payload.removedItemIds().contains(item.itemId())) {
                result.add(item);
            }
        }
        for (ItemChange change : payload.modified()) {
            for (int i = 0; i < result.size(); i++) {
                LineItem line = result.get(i);
                if (!line.itemId().equals(change.itemId())) {
                    continue;
                }
                if (change.quantity() != null) {
                    line = line.withQuantity(change.quantity());
                }
                if (change.notes() != null) {
                    line = line.withNotes(change.notes());
                }
                result.set(i, line);
            }
        }
        return mergeLines(result, payload.added());
    }

    private static List<LineItem> modifiersChanged(OrderState state, OrderEvents.ItemModifiersChanged payload) {
        List<LineItem> result = new ArrayList<>();
        for (LineItem line : state.items()) {
            if (!line.itemId().equals(payload.itemId())) {
                result.add(line);
                continue;
            }
            List<LineModifier> modifiers = new ArrayList<>();
            for (LineModifier modifier : line.modifiers()) {
                if (!payload.removedModifierIds().contains(modifier.modifierId())) {
                    modifiers.add(modifier);
                }
            }
            modifiers.addAll(payload.added());
            LineItem changed =
                    LineItem.of(line.itemId(), line.name(), line.quantity(), line.unitPrice(), modifiers, line.notes());
            if (changed.lineTotal() != payload.newLineTotal()) {
                throw new IntegrityException(
                        "line total %d of %s on order %s does not match the recorded %d"
                                .formatted(changed.lineTotal(), line.itemId(), state.id(), payload.newLineTotal()));
            }
            result.add(changed);
        }
        return result;
    }

    private static List<PromotionLine> withoutPromotion(List<PromotionLine> promotions, String promotionId) {
        List<PromotionLine> result = new ArrayList<>();
        for (PromotionLine promotion : promotions) {
            if (!promotion.promotionId().equals(promotionId)) {
                result.add(promotion);
            }
        }
        return result;
    }
}
