package com.comanda.orderengine.domain.session;

import com.comanda.eventmodel.AggregateType;
import com.comanda.eventmodel.EventType;
import com.comanda.eventmodel.order.CustomerDetails;
import com.comanda.eventmodel.order.OrderType;
import com.comanda.eventmodel.order.PaymentMethod;
import com.comanda.eventmodel.session.CartModifier;
import com.comanda.eventmodel.session.SessionEvents;
import com.comanda.eventstore.aggregate.AggregateRoot;
import com.comanda.eventstore.aggregate.MetadataProvider;
import com.comanda.orderengine.domain.exception.InvalidOrderStateException;
import com.comanda.orderengine.domain.exception.ValidationException;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * A customer's browsing and cart-building session. Only an active session accepts commands; a
 * session ends either converted into an order or abandoned.
 */
public class OrderSession extends AggregateRoot<SessionState> {

    public OrderSession(UUID id, SessionState state, long version, MetadataProvider metadata) {
        super(id, SessionEvolver.INSTANCE, metadata, state, version);
    }

    @Override
    public AggregateType aggregateType() {
        return AggregateType.ORDER_SESSION;
    }

    public void initiate(
            String userId, String locationId, String platform, String referrer, Map<String, String> attributes) {
        if (state().status() != SessionStatus.UNINITIALIZED) {
            throw new InvalidOrderStateException("session %s has already been initiated".formatted(id()));
        }
        if (locationId == null || locationId.isBlank()) {
            throw new ValidationException("locationId is required");
        }
        recordThat(
                EventType.SESSION_INITIATED,
                new SessionEvents.SessionInitiated(userId, locationId, platform, referrer, attributes));
    }

    public void recordSearch(String query, Map<String, String> filters, int resultsCount) {
        requireActive();
        if (query == null || query.isBlank()) {
            throw new ValidationException("search query is required");
        }
        recordThat(EventType.ITEM_SEARCHED, new SessionEvents.ItemSearched(query, filters, resultsCount));
    }

    public void browseCategory(String categoryId, String categoryName, int itemsViewed) {
        requireActive();
        requireId(categoryId, "categoryId");
        recordThat(
                EventType.CATEGORY_BROWSED,
                new SessionEvents.CategoryBrowsed(categoryId, categoryName, itemsViewed));
    }

    public void viewItem(String itemId, String itemName, String source) {
        requireActive();
        requireId(itemId, "itemId");
        recordThat(EventType.ITEM_VIEWED, new SessionEvents.ItemViewed(itemId, itemName, source));
    }

    public void addToCart(
            String itemId, String itemName, int quantity, List<CartModifier> modifiers, String notes) {
        requireActive();
        requireId(itemId, "itemId");
        requirePositive(quantity, itemId);
        recordThat(
                EventType.ITEM_ADDED_TO_CART,
                new SessionEvents.ItemAddedToCart(itemId, itemName, quantity, modifiers, notes));
    }

    /** Removes every cart line of the item, whatever its modifiers. */
    public void removeFromCart(String itemId, String reason) {
        requireActive();
        requireInCart(itemId);
        recordThat(EventType.ITEM_REMOVED_FROM_CART, new SessionEvents.ItemRemovedFromCart(itemId, reason));
    }

    /** Changes every cart line of the item; null arguments leave that attribute unchanged. */
    public void modifyCartItem(String itemId, Integer quantity, List<CartModifier> modifiers, String notes) {
        requireActive();
        requireInCart(itemId);
        if (quantity != null) {
            requirePositive(quantity, itemId);
        }
        recordThat(
                EventType.CART_ITEM_MODIFIED,
                new SessionEvents.CartItemModified(itemId, quantity, modifiers, notes));
    }

    public void selectServingType(OrderType servingType, String tableNumber, String deliveryAddress) {
        requireActive();
        if (servingType == null) {
            throw new ValidationException("servingType is required");
        }
        if (servingType == OrderType.DELIVERY && (deliveryAddress == null || deliveryAddress.isBlank())) {
            throw new ValidationException("a delivery address is required for delivery");
        }
        recordThat(
                EventType.SERVING_TYPE_SELECTED,
                new SessionEvents.ServingTypeSelected(servingType, tableNumber, deliveryAddress));
    }

    public void enterCustomerInfo(CustomerDetails customer) {
        requireActive();
        if (customer == null) {
            throw new ValidationException("customer is required");
        }
        recordThat(EventType.CUSTOMER_INFO_ENTERED, new SessionEvents.CustomerInfoEntered(customer));
    }

    public void selectPaymentMethod(PaymentMethod method) {
        requireActive();
        if (method == null) {
            throw new ValidationException("paymentMethod is required");
        }
        recordThat(EventType.PAYMENT_METHOD_SELECTED, new SessionEvents.PaymentMethodSelected(method));
    }

    public void saveDraft(String reason, boolean autoSave) {
        requireActive();
        recordThat(EventType.DRAFT_SAVED, new SessionEvents.DraftSaved(reason, autoSave));
    }

    public void abandon(String reason) {
        requireActive();
        recordThat(
                EventType.SESSION_ABANDONED,
                new SessionEvents.SessionAbandoned(reason, state().cartItemCount()));
    }

    /** Links the session to the order created from it and closes the session. */
    public void markConverted(UUID orderId, long orderTotal) {
        requireActive();
        if (orderId == null || orderId.equals(id())) {
            throw new ValidationException("the converted order needs its own id");
        }
        recordThat(EventType.SESSION_CONVERTED, new SessionEvents.SessionConverted(orderId, orderTotal));
    }

    private void requireActive() {
        SessionStatus status = state().status();
        if (status == SessionStatus.UNINITIALIZED) {
            throw new InvalidOrderStateException("session %s has not been initiated".formatted(id()));
        }
        if (status != SessionStatus.ACTIVE) {
            throw new InvalidOrderStateException("session is %s and accepts no further changes".formatted(status));
        }
    }

    private void requireInCart(String itemId) {
        if (!state().hasCartItem(itemId)) {
            throw new ValidationException("item %s is not in the cart".formatted(itemId));
        }
    }

    private static void requireId(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(field + " is required");
        }
    }

    private static void requirePositive(int quantity, String itemId) {
        if (quantity <= 0) {
            throw new ValidationException("quantity of %s must be positive, was %d".formatted(itemId, quantity));
        }
    }
}
