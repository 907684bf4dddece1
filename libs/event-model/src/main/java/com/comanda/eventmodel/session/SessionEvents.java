package com.comanda.eventmodel.session;

import com.comanda.eventmodel.EventPayload;
import com.comanda.eventmodel.order.CustomerDetails;
import com.comanda.eventmodel.order.OrderType;
import com.comanda.eventmodel.order.PaymentMethod;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Payload records of the order-session stream.
 *
 * <p>None of these carry a price. The cart is a list of intentions, priced only when the session is
 * converted into an order.
 */
public final class SessionEvents {

    private SessionEvents() {}

    public record SessionInitiated(
            String userId,
            String locationId,
            String platform,
            String referrer,
            Map<String, String> attributes)
            implements EventPayload {

        public SessionInitiated {
            attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
        }
    }

    public record ItemSearched(String query, Map<String, String> filters, int resultsCount)
            implements EventPayload {

        public ItemSearched {
            filters = filters == null ? Map.of() : Map.copyOf(filters);
        }
    }

    public record CategoryBrowsed(String categoryId, String categoryName, int itemsViewed)
            implements EventPayload {}

    public record ItemViewed(String itemId, String itemName, String source)
            implements EventPayload {}

    public record ItemAddedToCart(
            String itemId,
            String itemName,
            int quantity,
            List<CartModifier> modifiers,
            String notes)
            implements EventPayload {

        public ItemAddedToCart {
            modifiers = modifiers == null ? List.of() : List.copyOf(modifiers);
        }
    }

    public record ItemRemovedFromCart(String itemId, String reason) implements EventPayload {}

    /** Null fields leave the corresponding attribute of the cart line unchanged. */
    public record CartItemModified(
            String itemId, Integer quantity, List<CartModifier> modifiers, String notes)
            implements EventPayload {

        public CartItemModified {
            modifiers = modifiers == null ? null : List.copyOf(modifiers);
        }
    }

    public record ServingTypeSelected(
            OrderType servingType, String tableNumber, String deliveryAddress)
            implements EventPayload {}

    public record CustomerInfoEntered(CustomerDetails customer) implements EventPayload {}

    public record PaymentMethodSelected(PaymentMethod paymentMethod) implements EventPayload {}

    public record DraftSaved(String reason, boolean autoSave) implements EventPayload {}

    public record SessionAbandoned(String reason, int cartItemCount) implements EventPayload {}

    /** Back-reference from a session to the order created from it. */
    public record SessionConverted(UUID orderId, long orderTotal) implements EventPayload {}
}
