package com.comanda.orderengine.domain.order;

import com.comanda.eventmodel.AggregateType;
import com.comanda.eventmodel.EventType;
import com.comanda.eventmodel.order.CustomerDetails;
import com.comanda.eventmodel.order.ItemChange;
import com.comanda.eventmodel.order.LineItem;
import com.comanda.eventmodel.order.LineModifier;
import com.comanda.eventmodel.order.OrderEvents;
import com.comanda.eventmodel.order.OrderStatus;
import com.comanda.eventmodel.order.PaymentMethod;
import com.comanda.eventmodel.order.PriceAdjustmentType;
import com.comanda.eventmodel.order.PromotionLine;
import com.comanda.eventstore.aggregate.AggregateRoot;
import com.comanda.eventstore.aggregate.MetadataProvider;
import com.comanda.orderengine.domain.exception.IntegrityException;
import com.comanda.orderengine.domain.exception.InvalidOrderStateException;
import com.comanda.orderengine.domain.exception.ValidationException;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * The order aggregate. Every command checks its preconditions against the current state and only
 * then records events, so a rejected command leaves no pending events behind.
 */
public class OrderAggregate extends AggregateRoot<OrderState> {

    /** Statuses in which the line items may still change. */
    public static final Set<OrderStatus> EDITABLE =
            EnumSet.of(
                    OrderStatus.DRAFT,
                    OrderStatus.STARTED,
                    OrderStatus.PLACED,
                    OrderStatus.CONFIRMED,
                    OrderStatus.PREPARING);

    /** Statuses in which payments are taken or their failures recorded. */
    public static final Set<OrderStatus> PAYABLE = EnumSet.of(OrderStatus.CONFIRMED, OrderStatus.COMPLETED);

    /** Statuses from which {@link #confirmOrder} is accepted. */
    public static final Set<OrderStatus> CONFIRMABLE =
            EnumSet.of(OrderStatus.DRAFT, OrderStatus.STARTED, OrderStatus.PLACED);

    public OrderAggregate(UUID id, OrderState state, long version, MetadataProvider metadata) {
        super(id, OrderEvolver.INSTANCE, metadata, state, version);
    }

    @Override
    public AggregateType aggregateType() {
        return AggregateType.ORDER;
    }

    public void startOrder(OrderCommands.StartOrder command) {
        if (state().status() != OrderStatus.UNINITIALIZED) {
            throw new InvalidOrderStateException("order %s has already been started".formatted(id()));
        }
        requireText(command.staffId(), "staffId");
        requireText(command.locationId(), "locationId");
        requireText(command.currency(), "currency");
        if (command.orderType() == null) {
            throw new ValidationException("orderType is required");
        }
        recordThat(
                EventType.ORDER_STARTED,
                new OrderEvents.OrderStarted(
                        command.staffId(),
                        command.locationId(),
                        command.tableNumber(),
                        command.orderType(),
                        command.draft() ? OrderStatus.DRAFT : OrderStatus.STARTED,
                        command.sessionId(),
                        command.currency(),
                        command.customer(),
                        command.attributes()));
    }

    public void addItems(List<LineItem> items) {
        requireEditable();
        if (items == null || items.isEmpty()) {
            throw new ValidationException("at least one item is required");
        }
        items.forEach(OrderAggregate::requireValidLine);
        recordThat(EventType.ITEMS_ADDED_TO_ORDER, new OrderEvents.ItemsAddedToOrder(items));
    }

    /**
     * Adds, removes and changes lines in one event. Once preparing has started only additions are
     * accepted.
     */
    public void modifyItems(
            List<LineItem> toAdd,
            List<String> toRemove,
            List<ItemChange> toModify,
            String modifiedBy,
            String reason) {
        requireEditable();
        List<LineItem> added = toAdd == null ? List.of() : toAdd;
        List<String> removed = toRemove == null ? List.of() : toRemove;
        List<ItemChange> changed = toModify == null ? List.of() : toModify;
        if (added.isEmpty() && removed.isEmpty() && changed.isEmpty()) {
            throw new ValidationException("modification contains no changes");
        }
        if (state().status() == OrderStatus.PREPARING && (!removed.isEmpty() || !changed.isEmpty())) {
            throw new InvalidOrderStateException("cannot remove items once preparing has started");
        }
        added.forEach(OrderAggregate::requireValidLine);
        for (String itemId : removed) {
            if (!state().hasItem(itemId)) {
                throw new ValidationException("item %s is not on order %s".formatted(itemId, id()));
            }
        }
        for (ItemChange change : changed) {
            if (!state().hasItem(change.itemId())) {
                throw new ValidationException(
                        "item %s is not on order %s".formatted(change.itemId(), id()));
            }
            if (change.quantity() != null && change.quantity() <= 0) {
                throw new ValidationException(
                        "quantity of %s must be positive; remove the item instead".formatted(change.itemId()));
            }
        }
        recordThat(
                EventType.ITEMS_MODIFIED,
                new OrderEvents.ItemsModified(added, removed, changed, modifiedBy, reason));
    }

    /**
     * Adds and removes modifiers on the single line of {@code itemId}. {@code added} must already
     * carry catalog prices.
     */
    public void modifyItemModifiers(
            String itemId, List<LineModifier> added, List<String> removedModifierIds, String modifiedBy, String reason) {
        requireEditable();
        List<LineModifier> adding = added == null ? List.of() : added;
        List<String> removing = removedModifierIds == null ? List.of() : removedModifierIds;
        if (adding.isEmpty() && removing.isEmpty()) {
            throw new ValidationException("modifier change contains no changes");
        }
        List<LineItem> lines =
                state().items().stream().filter(line -> line.itemId().equals(itemId)).toList();
        if (lines.isEmpty()) {
            throw new ValidationException("item %s is not on order %s".formatted(itemId, id()));
        }
        if (lines.size() > 1) {
            throw new ValidationException("item %s is on more than one line of order %s".formatted(itemId, id()));
        }
        LineItem line = lines.get(0);
        List<LineModifier> modifiers = new ArrayList<>();
        for (LineModifier modifier : line.modifiers()) {
            if (!removing.contains(modifier.modifierId())) {
                modifiers.add(modifier);
            }
        }
        for (String removed : removing) {
            if (line.modifiers().stream().noneMatch(m -> m.modifierId().equals(removed))) {
                throw new ValidationException("modifier %s is not on item %s".formatted(removed, itemId));
            }
        }
        for (LineModifier modifier : adding) {
            if (modifiers.stream().anyMatch(m -> m.modifierId().equals(modifier.modifierId()))) {
                throw new ValidationException(
                        "modifier %s is already on item %s".formatted(modifier.modifierId(), itemId));
            }
            modifiers.add(modifier);
        }
        LineItem changed =
                LineItem.of(line.itemId(), line.name(), line.quantity(), line.unitPrice(), modifiers, line.notes());
        requireValidLine(changed);
        recordThat(
                EventType.ITEM_MODIFIERS_CHANGED,
                new OrderEvents.ItemModifiersChanged(
                        itemId,
                        line.name(),
                        adding,
                        removing,
                        line.lineTotal(),
                        changed.lineTotal(),
                        modifiedBy,
                        reason));
    }

    /** Replaces the lines with their catalog-priced versions and freezes the subtotal. */
    public void markItemsAsValidated(List<LineItem> items, long subtotal, String validatedBy) {
        requireEditable();
        if (items == null || items.isEmpty()) {
            throw new ValidationException("cannot validate an order without items");
        }
        long sum = 0;
        for (LineItem item : items) {
            requireValidLine(item);
            sum += item.lineTotal();
        }
        if (sum != subtotal) {
            throw new IntegrityException(
                    "subtotal %d does not equal the sum of line totals %d".formatted(subtotal, sum));
        }
        recordThat(EventType.ITEMS_VALIDATED, new OrderEvents.ItemsValidated(items, subtotal, validatedBy));
    }

    public void setPromotions(List<PromotionLine> available, List<PromotionLine> autoApplied) {
        requireEditable();
        if (!state().itemsValidated()) {
            throw new InvalidOrderStateException("items must be validated before promotions are calculated");
        }
        List<PromotionLine> offered = available == null ? List.of() : available;
        List<PromotionLine> applied = autoApplied == null ? List.of() : autoApplied;
        long discount = 0;
        for (PromotionLine promotion : applied) {
            discount += promotion.discountAmount();
        }
        if (discount > state().subtotal()) {
            throw new ValidationException(
                    "promotion discount %d exceeds subtotal %d".formatted(discount, state().subtotal()));
        }
        recordThat(
                EventType.PROMOTIONS_CALCULATED,
                new OrderEvents.PromotionsCalculated(offered, applied, discount));
    }

    public void applyPromotion(PromotionLine promotion) {
        requireEditable();
        if (!state().promotionsCalculated()) {
            throw new InvalidOrderStateException("promotions have not been calculated for order " + id());
        }
        if (promotion.discountAmount() < 0) {
            throw new ValidationException("promotion discount must not be negative");
        }
        boolean alreadyApplied =
                state().appliedPromotions().stream()
                        .anyMatch(p -> p.promotionId().equals(promotion.promotionId()));
        if (alreadyApplied) {
            throw new ValidationException("promotion %s is already applied".formatted(promotion.promotionId()));
        }
        if (state().discount() + promotion.discountAmount() > state().subtotal()) {
            throw new ValidationException("discount would exceed the subtotal");
        }
        recordThat(
                EventType.PROMOTION_APPLIED,
                new OrderEvents.PromotionApplied(
                        promotion.promotionId(), promotion.name(), promotion.discountAmount()));
    }

    public void removePromotion(String promotionId) {
        requireEditable();
        PromotionLine applied =
                state().appliedPromotions().stream()
                        .filter(p -> p.promotionId().equals(promotionId))
                        .findFirst()
                        .orElseThrow(
                                () -> new ValidationException(
                                        "promotion %s is not applied".formatted(promotionId)));
        recordThat(
                EventType.PROMOTION_REMOVED,
                new OrderEvents.PromotionRemoved(promotionId, applied.discountAmount()));
    }

    /** Records the final price; the breakdown must match the order's current money. */
    public void calculateFinalPrice(PriceBreakdown breakdown) {
        requireEditable();
        if (!state().itemsValidated()) {
            throw new InvalidOrderStateException("items must be validated before pricing");
        }
        if (!breakdown.isConsistent()) {
            throw new IntegrityException("price breakdown does not add up: " + breakdown);
        }
        if (breakdown.subtotal() != state().subtotal()
                || breakdown.discount() != state().discount()
                || breakdown.tip() != state().tip()) {
            throw new IntegrityException(
                    "price breakdown %s does not match order %s".formatted(breakdown, state().totals()));
        }
        recordThat(
                EventType.PRICE_CALCULATED,
                new OrderEvents.PriceCalculated(
                        breakdown.subtotal(),
                        breakdown.discount(),
                        breakdown.tax(),
                        breakdown.tip(),
                        breakdown.total(),
                        breakdown.taxRate()));
    }

    /** Sets the tip, replacing any earlier one. */
    public void addTip(long amount, String addedBy) {
        requireActive();
        if (amount < 0) {
            throw new ValidationException("tip must not be negative");
        }
        recordThat(EventType.TIP_ADDED, new OrderEvents.TipAdded(amount, addedBy));
    }

    public void adjustPrice(OrderCommands.AdjustPrice command) {
        requireActive();
        if (command.type() == null) {
            throw new ValidationException("adjustment type is required");
        }
        boolean correction = command.type() == PriceAdjustmentType.CORRECTION;
        if (correction ? command.amount() < 0 : command.amount() <= 0) {
            throw new ValidationException(
                    correction ? "corrected total must not be negative" : "adjustment amount must be positive");
        }
        requireText(command.reason(), "reason");
        requireText(command.authorizedBy(), "authorizedBy");
        long current = state().total();
        long newTotal =
                switch (command.type()) {
                    case DISCOUNT -> current - command.amount();
                    case SURCHARGE, TIP -> current + command.amount();
                    case CORRECTION -> command.amount();
                };
        if (command.type() == PriceAdjustmentType.DISCOUNT
                && state().discount() + command.amount() > state().subtotal()) {
            throw new ValidationException("discount would exceed the subtotal");
        }
        recordThat(
                EventType.PRICE_ADJUSTED,
                new OrderEvents.PriceAdjusted(
                        command.type(), command.amount(), command.reason(), command.authorizedBy(), newTotal));
    }

    public void setPaymentMethod(PaymentMethod method) {
        requireActive();
        if (method == null) {
            throw new ValidationException("paymentMethod is required");
        }
        recordThat(EventType.PAYMENT_METHOD_SET, new OrderEvents.PaymentMethodSet(method));
    }

    public void updateCustomerInfo(CustomerDetails customer) {
        requireActive();
        if (customer == null) {
            throw new ValidationException("customer is required");
        }
        recordThat(EventType.CUSTOMER_INFO_UPDATED, new OrderEvents.CustomerInfoUpdated(customer));
    }

    /** Records a successful payment; the amount may not exceed what is still owed. */
    public void processPayment(OrderCommands.ProcessPayment command) {
        requirePayable();
        requirePaymentDetails(command.paymentId(), command.paymentMethod(), command.amount());
        requireText(command.status(), "status");
        if (command.amount() > state().outstanding()) {
            throw new ValidationException(
                    "payment of %d exceeds the outstanding balance %d"
                            .formatted(command.amount(), state().outstanding()));
        }
        recordThat(
                EventType.PAYMENT_PROCESSED,
                new OrderEvents.PaymentProcessed(
                        command.paymentId(),
                        command.paymentMethod(),
                        command.amount(),
                        state().currency(),
                        command.status(),
                        command.transactionId()));
    }

    public void recordPaymentFailure(OrderCommands.RecordPaymentFailure command) {
        requirePayable();
        requirePaymentDetails(command.paymentId(), command.paymentMethod(), command.amount());
        requireText(command.failureReason(), "failureReason");
        recordThat(
                EventType.PAYMENT_FAILED,
                new OrderEvents.PaymentFailed(
                        command.paymentId(),
                        command.paymentMethod(),
                        command.amount(),
                        state().currency(),
                        command.failureReason(),
                        command.errorCode()));
    }

    /** Checks the status and items allow confirmation, without recording anything. */
    public void requireConfirmable() {
        requireActive();
        OrderStatus status = state().status();
        if (!CONFIRMABLE.contains(status)) {
            throw new InvalidOrderStateException("cannot confirm an order that is " + status);
        }
        if (state().items().isEmpty()) {
            throw new InvalidOrderStateException("cannot confirm an order without items");
        }
    }

    public void confirmOrder(String orderNumber) {
        requireConfirmable();
        if (!state().itemsValidated()) {
            throw new InvalidOrderStateException("items must be validated before confirmation");
        }
        if (state().paymentMethod() == null) {
            throw new InvalidOrderStateException("a payment method is required before confirmation");
        }
        requireText(orderNumber, "orderNumber");
        recordThat(EventType.ORDER_CONFIRMED, new OrderEvents.OrderConfirmed(orderNumber, state().total()));
    }

    /** Cancels from any started, non-terminal status. */
    public void cancelOrder(String reason, String cancelledBy) {
        requireActive();
        if (reason == null || reason.isBlank()) {
            throw new InvalidOrderStateException("a reason is required to cancel an order");
        }
        recordThat(
                EventType.ORDER_CANCELLED,
                new OrderEvents.OrderCancelled(state().status(), reason, cancelledBy));
    }

    /**
     * Moves along the status state machine. Cancelling is delegated to {@link #cancelOrder} and
     * the first confirmation must go through {@link #confirmOrder}.
     */
    public void transitionStatus(OrderStatus to, String reason, String actorId) {
        requireActive();
        OrderStatus from = state().status();
        if (to == OrderStatus.CANCELLED) {
            cancelOrder(reason, actorId);
            return;
        }
        if (to == OrderStatus.CONFIRMED && CONFIRMABLE.contains(from)) {
            throw new InvalidOrderStateException("use confirmOrder to confirm an order that is " + from);
        }
        StatusTransitionValidator.validate(from, to, state().orderType(), reason);
        recordThat(
                EventType.ORDER_STATUS_TRANSITIONED,
                new OrderEvents.OrderStatusTransitioned(from, to, reason));
    }

    private void requireActive() {
        OrderStatus status = state().status();
        if (status == OrderStatus.UNINITIALIZED) {
            throw new InvalidOrderStateException("order %s has not been started".formatted(id()));
        }
        if (status.isTerminal()) {
            throw new InvalidOrderStateException(
                    "order is %s and accepts no further changes".formatted(status));
        }
    }

    private void requireEditable() {
        requireActive();
        if (!EDITABLE.contains(state().status())) {
            throw new InvalidOrderStateException(
                    "items cannot change while the order is " + state().status());
        }
    }

    private void requirePayable() {
        if (!PAYABLE.contains(state().status())) {
            throw new InvalidOrderStateException(
                    "cannot process payment for an order that is " + state().status());
        }
    }

    private static void requirePaymentDetails(String paymentId, PaymentMethod method, long amount) {
        requireText(paymentId, "paymentId");
        if (method == null) {
            throw new ValidationException("paymentMethod is required");
        }
        if (amount <= 0) {
            throw new ValidationException("payment amount must be positive");
        }
    }

    private static void requireValidLine(LineItem item) {
        if (item == null || item.itemId() == null || item.itemId().isBlank()) {
            throw new ValidationException("itemId is required");
        }
        if (item.quantity() <= 0) {
            throw new ValidationException(
                    "quantity of %s must be positive, was %d".formatted(item.itemId(), item.quantity()));
        }
        if (item.unitPrice() < 0) {
            throw new ValidationException("price of %s must not be negative".formatted(item.itemId()));
        }
        for (LineModifier modifier : item.modifiers()) {
            if (modifier.priceDelta() < 0) {
                throw new ValidationException(
                        "modifier %s of %s must not lower the price".formatted(modifier.modifierId(), item.itemId()));
            }
        }
        long expected = LineItem.computeTotal(item.quantity(), item.unitPrice(), item.modifiers());
        if (item.lineTotal() != expected) {
            throw new IntegrityException(
                    "line total %d of %s does not equal %d".formatted(item.lineTotal(), item.itemId(), expected));
        }
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(field + " is required");
        }
    }
}
