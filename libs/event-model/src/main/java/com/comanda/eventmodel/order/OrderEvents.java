package com.comanda.eventmodel.order;

import com.comanda.eventmodel.EventPayload;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/** Payload records of the order stream, one per order {@code EventType}. */
public final class OrderEvents {

    private OrderEvents() {}

    /**
     * Opens an order.
     *
     * @param initialStatus {@code STARTED}, or {@code DRAFT} for a held order
     * @param sessionId the session the order was converted from, if any
     */
    public record OrderStarted(
            String staffId,
            String locationId,
            String tableNumber,
            OrderType orderType,
            OrderStatus initialStatus,
            UUID sessionId,
            String currency,
            CustomerDetails customer,
            Map<String, String> attributes)
            implements EventPayload {

        public OrderStarted {
            attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
        }
    }

    public record ItemsAddedToOrder(List<LineItem> items) implements EventPayload {

        public ItemsAddedToOrder {
            items = List.copyOf(items);
        }
    }

    public record ItemsModified(
            List<LineItem> added,
            List<String> removedItemIds,
            List<ItemChange> modified,
            String modifiedBy,
            String reason)
            implements EventPayload {

        public ItemsModified {
            added = added == null ? List.of() : List.copyOf(added);
            removedItemIds = removedItemIds == null ? List.of() : List.copyOf(removedItemIds);
            modified = modified == null ? List.of() : List.copyOf(modified);
        }
    }

    /** Items re-priced from the catalog. {@code subtotal} is frozen from this point. */
    public record ItemsValidated(List<LineItem> items, long subtotal, String validatedBy)
            implements EventPayload {

        public ItemsValidated {
            items = List.copyOf(items);
        }
    }

    /**
     * Modifiers added to or removed from the single line of {@code itemId}. Added modifiers carry
     * their catalog price.
     */
    public record ItemModifiersChanged(
            String itemId,
            String itemName,
            List<LineModifier> added,
            List<String> removedModifierIds,
            long oldLineTotal,
            long newLineTotal,
            String modifiedBy,
            String reason)
            implements EventPayload {

        public ItemModifiersChanged {
            added = added == null ? List.of() : List.copyOf(added);
            removedModifierIds = removedModifierIds == null ? List.of() : List.copyOf(removedModifierIds);
        }
    }

    public record PromotionsCalculated(
            List<PromotionLine> available, List<PromotionLine> autoApplied, long totalDiscount)
            implements EventPayload {

        public PromotionsCalculated {
            available = available == null ? List.of() : List.copyOf(available);
            autoApplied = autoApplied == null ? List.of() : List.copyOf(autoApplied);
        }
    }

    public record PromotionApplied(String promotionId, String name, long discountAmount)
            implements EventPayload {}

    public record PromotionRemoved(String promotionId, long discountAmount)
            implements EventPayload {}

    public record PriceCalculated(
            long subtotal, long discount, long tax, long tip, long total, BigDecimal taxRate)
            implements EventPayload {}

    public record TipAdded(long amount, String addedBy) implements EventPayload {}

    public record PriceAdjusted(
            PriceAdjustmentType adjustmentType,
            long amount,
            String reason,
            String authorizedBy,
            long newTotal)
            implements EventPayload {}

    public record PaymentMethodSet(PaymentMethod paymentMethod) implements EventPayload {}

    public record OrderConfirmed(String orderNumber, long total) implements EventPayload {}

    public record OrderStatusTransitioned(OrderStatus from, OrderStatus to, String reason)
            implements EventPayload {}

    public record OrderCancelled(OrderStatus from, String reason, String cancelledBy)
            implements EventPayload {}

    public record CustomerInfoUpdated(CustomerDetails customer) implements EventPayload {}

    /**
     * A payment taken against a confirmed or completed order.
     *
     * @param status the processor's status, e.g. "captured"
     */
    public record PaymentProcessed(
            String paymentId,
            PaymentMethod paymentMethod,
            long amount,
            String currency,
            String status,
            String transactionId)
            implements EventPayload {}

    public record PaymentFailed(
            String paymentId,
            PaymentMethod paymentMethod,
            long amount,
            String currency,
            String failureReason,
            String errorCode)
            implements EventPayload {}
}
