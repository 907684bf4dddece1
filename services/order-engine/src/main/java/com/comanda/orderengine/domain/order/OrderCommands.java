package com.comanda.orderengine.domain.order;

import com.comanda.eventmodel.order.CustomerDetails;
import com.comanda.eventmodel.order.ItemChange;
import com.comanda.eventmodel.order.OrderType;
import com.comanda.eventmodel.order.PaymentMethod;
import com.comanda.eventmodel.order.PriceAdjustmentType;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/** Command inputs of the order aggregate and the order command service. */
public final class OrderCommands {

    private OrderCommands() {}

    /**
     * Opens an order.
     *
     * @param draft open the order as a held draft instead of started
     * @param sessionId the session being converted, if any
     * @param currency ISO currency code; the configured default when null
     */
    public record StartOrder(
            String staffId,
            String locationId,
            String tableNumber,
            OrderType orderType,
            boolean draft,
            UUID sessionId,
            String currency,
            CustomerDetails customer,
            Map<String, String> attributes) {

        public StartOrder {
            attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
        }

        public StartOrder withCurrency(String value) {
            return new StartOrder(
                    staffId,
                    locationId,
                    tableNumber,
                    orderType,
                    draft,
                    sessionId,
                    value,
                    customer,
                    attributes);
        }
    }

    /**
     * An item requested by the caller. Modifiers are named by id only; the item and every modifier
     * are priced from the catalog.
     */
    public record NewLine(String itemId, int quantity, List<String> modifierIds, String notes) {

        public NewLine {
            modifierIds = modifierIds == null ? List.of() : List.copyOf(modifierIds);
        }

        public static NewLine of(String itemId, int quantity) {
            return new NewLine(itemId, quantity, List.of(), null);
        }
    }

    public record ModifyItems(
            List<NewLine> toAdd, List<String> toRemove, List<ItemChange> toModify, String reason) {

        public ModifyItems {
            toAdd = toAdd == null ? List.of() : List.copyOf(toAdd);
            toRemove = toRemove == null ? List.of() : List.copyOf(toRemove);
            toModify = toModify == null ? List.of() : List.copyOf(toModify);
        }
    }

    public record AdjustPrice(
            PriceAdjustmentType type, long amount, String reason, String authorizedBy) {}

    public record ChangeModifiers(
            String itemId, List<String> addedModifierIds, List<String> removedModifierIds, String reason) {

        public ChangeModifiers {
            addedModifierIds = addedModifierIds == null ? List.of() : List.copyOf(addedModifierIds);
            removedModifierIds = removedModifierIds == null ? List.of() : List.copyOf(removedModifierIds);
        }
    }

    /** @param status the processor's status, e.g. "captured" */
    public record ProcessPayment(
            String paymentId, PaymentMethod paymentMethod, long amount, String status, String transactionId) {}

    public record RecordPaymentFailure(
            String paymentId, PaymentMethod paymentMethod, long amount, String failureReason, String errorCode) {}
}
