package com.comanda.orderengine.domain.order;

import com.comanda.eventmodel.order.CustomerDetails;
import com.comanda.eventmodel.order.LineItem;
import com.comanda.eventmodel.order.OrderStatus;
import com.comanda.eventmodel.order.OrderType;
import com.comanda.eventmodel.order.PaymentMethod;
import com.comanda.eventmodel.order.PromotionLine;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Current state of an order, derived only by folding its events with {@link OrderEvolver}.
 *
 * <p>{@code version} is the number of events applied. Money is in integer minor units; {@link
 * #discount()} and {@link #total()} are derived from the stored components.
 */
public record OrderState(
        UUID id,
        long version,
        OrderStatus status,
        OrderType orderType,
        String staffId,
        String locationId,
        String tableNumber,
        UUID sessionId,
        String orderNumber,
        String currency,
        List<LineItem> items,
        CustomerDetails customer,
        long subtotal,
        long tax,
        long tip,
        long manualDiscount,
        BigDecimal taxRate,
        List<PromotionLine> availablePromotions,
        List<PromotionLine> appliedPromotions,
        PaymentMethod paymentMethod,
        long amountPaid,
        PaymentAttempt lastPaymentAttempt,
        Map<OrderStatus, Instant> statusTimestamps,
        List<StatusChange> history,
        String cancellationReason,
        boolean itemsValidated,
        boolean promotionsCalculated,
        boolean priceCalculated,
        int modificationCount,
        Instant createdAt,
        Instant updatedAt,
        Map<String, String> attributes) {

    public OrderState {
        items = List.copyOf(items);
        availablePromotions = List.copyOf(availablePromotions);
        appliedPromotions = List.copyOf(appliedPromotions);
        statusTimestamps = Map.copyOf(statusTimestamps);
        history = List.copyOf(history);
        attributes = Map.copyOf(attributes);
    }

    /** State of an order before its first event. */
    public static OrderState initial(UUID id) {
        return new Builder()
                .id(id)
                .status(OrderStatus.UNINITIALIZED)
                .build();
    }

    /** Promotion discounts plus manual discounts. */
    public long discount() {
        long promotions = 0;
        for (PromotionLine promotion : appliedPromotions) {
            promotions += promotion.discountAmount();
        }
        return promotions + manualDiscount;
    }

    public long total() {
        return subtotal + tax - discount() + tip;
    }

    public OrderTotals totals() {
        return OrderTotals.of(subtotal, discount(), tax, tip, currency);
    }

    /** What is still owed: the total less everything paid so far, never below zero. */
    public long outstanding() {
        return Math.max(0, total() - amountPaid);
    }

    public long itemsTotal() {
        long sum = 0;
        for (LineItem item : items) {
            sum += item.lineTotal();
        }
        return sum;
    }

    public Optional<Instant> timestamp(OrderStatus of) {
        return Optional.ofNullable(statusTimestamps.get(of));
    }

    public boolean hasItem(String itemId) {
        return items.stream().anyMatch(i -> i.itemId().equals(itemId));
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    /** Mutable builder used by the evolver to derive the next state. */
    public static final class Builder {
        private UUID id;
        private long version;
        private OrderStatus status = OrderStatus.UNINITIALIZED;
        private OrderType orderType;
        private String staffId;
        private String locationId;
        private String tableNumber;
        private UUID sessionId;
        private String orderNumber;
        private String currency;
        private List<LineItem> items = List.of();
        private CustomerDetails customer;
        private long subtotal;
        private long tax;
        private long tip;
        private long manualDiscount;
        private BigDecimal taxRate;
        private List<PromotionLine> availablePromotions = List.of();
        private List<PromotionLine> appliedPromotions = List.of();
        private PaymentMethod paymentMethod;
        private long amountPaid;
        private PaymentAttempt lastPaymentAttempt;
        private Map<OrderStatus, Instant> statusTimestamps = Map.of();
        private List<StatusChange> history = List.of();
        private String cancellationReason;
        private boolean itemsValidated;
        private boolean promotionsCalculated;
        private boolean priceCalculated;
        private int modificationCount;
        private Instant createdAt;
        private Instant updatedAt;
        private Map<String, String> attributes = Map.of();

        public Builder() {}

        private Builder(OrderState s) {
            id = s.id;
            version = s.version;
            status = s.status;
            orderType = s.orderType;
            staffId = s.staffId;
            locationId = s.locationId;
            tableNumber = s.tableNumber;
            sessionId = s.sessionId;
            orderNumber = s.orderNumber;
            currency = s.currency;
            items = s.items;
            customer = s.customer;
            subtotal = s.subtotal;
            tax = s.tax;
            tip = s.tip;
            manualDiscount = s.manualDiscount;
            taxRate = s.taxRate;
            availablePromotions = s.availablePromotions;
            appliedPromotions = s.appliedPromotions;
            paymentMethod = s.paymentMethod;
            amountPaid = s.amountPaid;
            lastPaymentAttempt = s.lastPaymentAttempt;
            statusTimestamps = s.statusTimestamps;
            history = s.history;
            cancellationReason = s.cancellationReason;
            itemsValidated = s.itemsValidated;
            promotionsCalculated = s.promotionsCalculated;
            priceCalculated = s.priceCalculated;
            modificationCount = s.modificationCount;
            createdAt = s.createdAt;
            updatedAt = s.updatedAt;
            attributes = s.attributes;
        }

        public Builder id(UUID value) {
            id = value;
            return this;
        }

        public Builder version(long value) {
            version = value;
            return this;
        }

        public Builder status(OrderStatus value) {
            status = value;
            return this;
        }

        public Builder orderType(OrderType value) {
            orderType = value;
            return this;
        }

        public Builder staffId(String value) {
            staffId = value;
            return this;
        }

        public Builder locationId(String value) {
            locationId = value;
            return this;
        }

        public Builder tableNumber(String value) {
            tableNumber = value;
            return this;
        }

        public Builder sessionId(UUID value) {
            sessionId = value;
            return this;
        }

        public Builder orderNumber(String value) {
            orderNumber = value;
            return this;
        }

        public Builder currency(String value) {
            currency = value;
            return this;
        }

        public Builder items(List<LineItem> value) {
            items = value;
            return this;
        }

        public Builder customer(CustomerDetails value) {
            customer = value;
            return this;
        }

        public Builder subtotal(long value) {
            subtotal = value;
            return this;
        }

        public Builder tax(long value) {
            tax = value;
            return this;
        }

        public Builder tip(long value) {
            tip = value;
            return this;
        }

        public Builder manualDiscount(long value) {
            manualDiscount = value;
            return this;
        }

        public Builder taxRate(BigDecimal value) {
            taxRate = value;
            return this;
        }

        public Builder availablePromotions(List<PromotionLine> value) {
            availablePromotions = value;
            return this;
        }

        public Builder appliedPromotions(List<PromotionLine> value) {
            appliedPromotions = value;
            return this;
        }

        public Builder paymentMethod(PaymentMethod value) {
            paymentMethod = value;
            return this;
        }

        public Builder amountPaid(long value) {
            amountPaid = value;
            return this;
        }

        public Builder lastPaymentAttempt(PaymentAttempt value) {
            lastPaymentAttempt = value;
            return this;
        }

        public Builder statusTimestamps(Map<OrderStatus, Instant> value) {
            statusTimestamps = value;
            return this;
        }

        public Builder history(List<StatusChange> value) {
            history = value;
            return this;
        }

        public Builder cancellationReason(String value) {
            cancellationReason = value;
            return this;
        }

        public Builder itemsValidated(boolean value) {
            itemsValidated = value;
            return this;
        }

        public Builder promotionsCalculated(boolean value) {
            promotionsCalculated = value;
            return this;
        }

        public Builder priceCalculated(boolean value) {
            priceCalculated = value;
            return this;
        }

        public Builder modificationCount(int value) {
            modificationCount = value;
            return this;
        }

        public Builder createdAt(Instant value) {
            createdAt = value;
            return this;
        }

        public Builder updatedAt(Instant value) {
            updatedAt = value;
            return this;
        }

        public Builder attributes(Map<String, String> value) {
            attributes = value;
            return this;
        }

        public OrderState build() {
            return new OrderState(
                    id,
                    version,
                    status,
                    orderType,
                    staffId,
                    locationId,
                    tableNumber,
                    sessionId,
                    orderNumber,
                    currency,
                    items,
                    customer,
                    subtotal,
                    tax,
                    tip,
                    manualDiscount,
                    taxRate,
                    availablePromotions,
                    appliedPromotions,
                    paymentMethod,
                    amountPaid,
                    lastPaymentAttempt,
                    statusTimestamps,
                    history,
                    cancellationReason,
                    itemsValidated,
                    promotionsCalculated,
                    priceCalculated,
                    modificationCount,
                    createdAt,
                    updatedAt,
                    attributes);
        }
    }
}
