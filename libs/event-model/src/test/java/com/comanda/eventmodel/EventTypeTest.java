package com.comanda.eventmodel;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

@DisplayName("EventType registry")
class EventTypeTest {

    @Nested
    @DisplayName("lookup")
    class Lookup {

        @Test
        @DisplayName("fromString returns correct enum for known type")
        void fromStringKnown() {
            assertThat(EventType.fromString("ItemsAddedToOrder"))
                    .contains(EventType.ITEMS_ADDED_TO_ORDER);
            assertThat(EventType.fromString("SessionConverted"))
                    .contains(EventType.SESSION_CONVERTED);
        }

        @Test
        @DisplayName("fromString returns empty for unknown type")
        void fromStringUnknown() {
            assertThat(EventType.fromString("OrderTeleported")).isEmpty();
            assertThat(EventType.isKnown("OrderTeleported")).isFalse();
        }

        @ParameterizedTest
        @EnumSource(EventType.class)
        @DisplayName("every canonical value maps back to its own constant")
        void valueRoundTrip(EventType type) {
            assertThat(EventType.fromString(type.value())).contains(type);
        }
    }

    @Nested
    @DisplayName("stream ownership")
    class Ownership {

        @Test
        @DisplayName("order and session kinds partition the registry")
        void partition() {
            assertThat(EventType.forAggregate(AggregateType.ORDER)).hasSize(18);
            assertThat(EventType.forAggregate(AggregateType.ORDER_SESSION)).hasSize(13);
            assertThat(EventType.values()).hasSize(31);
        }

        @Test
        @DisplayName("cart events belong to the session stream")
        void cartEventsAreSessionEvents() {
            assertThat(EventType.ITEM_ADDED_TO_CART.aggregateType())
                    .isEqualTo(AggregateType.ORDER_SESSION);
            assertThat(EventType.ORDER_CANCELLED.aggregateType()).isEqualTo(AggregateType.ORDER);
        }
    }
}
