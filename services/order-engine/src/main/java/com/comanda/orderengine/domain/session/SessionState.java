package com.comanda.orderengine.domain.session;

import com.comanda.eventmodel.order.CustomerDetails;
import com.comanda.eventmodel.order.OrderType;
import com.comanda.eventmodel.order.PaymentMethod;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * State of an order session, folded from session events by {@link SessionEvolver}.
 *
 * <p>The cart keeps one line per item id in insertion order.
 */
public record SessionState(
        UUID id,
        long version,
        SessionStatus status,
        String userId,
        String locationId,
        String platform,
        String referrer,
        List<CartLine> cart,
        OrderType servingType,
        String tableNumber,
        String deliveryAddress,
        CustomerDetails customer,
        PaymentMethod paymentMethod,
        List<String> searches,
        List<String> browsedCategories,
        List<String> viewedItems,
        int draftCount,
        UUID convertedOrderId,
        String abandonReason,
        Instant startedAt,
        Instant lastActivityAt,
        Map<String, String> attributes) {

    public SessionState {
        cart = List.copyOf(cart);
        searches = List.copyOf(searches);
        browsedCategories = List.copyOf(browsedCategories);
        viewedItems = List.copyOf(viewedItems);
        attributes = Map.copyOf(attributes);
    }

    public static SessionState initial(UUID id) {
        return new Builder().id(id).build();
    }

    public boolean isActive() {
        return status == SessionStatus.ACTIVE;
    }

    public boolean hasCartItem(String itemId) {
        return cart.stream().anyMatch(line -> line.itemId().equals(itemId));
    }

    public int cartItemCount() {
        int count = 0;
        for (CartLine line : cart) {
            count += line.quantity();
        }
        return count;
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    public static final class Builder {
        private UUID id;
        private long version;
        private SessionStatus status = SessionStatus.UNINITIALIZED;
        private String userId;
        private String locationId;
        private String platform;
        private String referrer;
        private List<CartLine> cart = List.of();
        private OrderType servingType;
        private String tableNumber;
        private String deliveryAddress;
        private CustomerDetails customer;
        private PaymentMethod paymentMethod;
        private List<String> searches = List.of();
        private List<String> browsedCategories = List.of();
        private List<String> viewedItems = List.of();
        private int draftCount;
        private UUID convertedOrderId;
        private String abandonReason;
        private Instant startedAt;
        private Instant lastActivityAt;
        private Map<String, String> attributes = Map.of();

        public Builder() {}

        private Builder(SessionState s) {
            id = s.id;
            version = s.version;
            status = s.status;
            userId = s.userId;
            locationId = s.locationId;
            platform = s.platform;
            referrer = s.referrer;
            cart = s.cart;
            servingType = s.servingType;
            tableNumber = s.tableNumber;
            deliveryAddress = s.deliveryAddress;
            customer = s.customer;
            paymentMethod = s.paymentMethod;
            searches = s.searches;
            browsedCategories = s.browsedCategories;
            viewedItems = s.viewedItems;
            draftCount = s.draftCount;
            convertedOrderId = s.convertedOrderId;
            abandonReason = s.abandonReason;
            startedAt = s.startedAt;
            lastActivityAt = s.lastActivityAt;
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

        public Builder status(SessionStatus value) {
            status = value;
            return this;
        }

        public Builder userId(String value) {
            userId = value;
            return this;
        }

        public Builder locationId(String value) {
            locationId = value;
            return this;
        }

        public Builder platform(String value) {
            platform = value;
            return this;
        }

        public Builder referrer(String value) {
            referrer = value;
            return this;
        }

        public Builder cart(List<CartLine> value) {
            cart = value;
            return this;
        }

        public Builder servingType(OrderType value) {
            servingType = value;
            return this;
        }

        public Builder tableNumber(String value) {
            tableNumber = value;
            return this;
        }

        public Builder deliveryAddress(String value) {
            deliveryAddress = value;
            return this;
        }

        public Builder customer(CustomerDetails value) {
            customer = value;
            return this;
        }

        public Builder paymentMethod(PaymentMethod value) {
            paymentMethod = value;
            return this;
        }

        public Builder searches(List<String> value) {
            searches = value;
            return this;
        }

        public Builder browsedCategories(List<String> value) {
            browsedCategories = value;
            return this;
        }

        public Builder viewedItems(List<String> value) {
            viewedItems = value;
            return this;
        }

        public Builder draftCount(int value) {
            draftCount = value;
            return this;
        }

        public Builder convertedOrderId(UUID value) {
            convertedOrderId = value;
            return this;
        }

        public Builder abandonReason(String value) {
            abandonReason = value;
            return this;
        }

        public Builder startedAt(Instant value) {
            startedAt = value;
            return this;
        }

        public Builder lastActivityAt(Instant value) {
            lastActivityAt = value;
            return this;
        }

        public Builder attributes(Map<String, String> value) {
            attributes = value;
            return this;
        }

        public SessionState build() {
            return new SessionState(
                    id,
                    version,
                    status,
                    userId,
                    locationId,
                    platform,
                    referrer,
                    cart,
                    servingType,
                    tableNumber,
                    deliveryAddress,
                    customer,
                    paymentMethod,
                    searches,
                    browsedCategories,
                    viewedItems,
                    draftCount,
                    convertedOrderId,
                    abandonReason,
                    startedAt,
                    lastActivityAt,
                    attributes);
        }
    }
}
