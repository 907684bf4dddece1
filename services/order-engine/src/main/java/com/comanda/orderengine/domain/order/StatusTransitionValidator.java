package com.comanda.orderengine.domain.order;

import static com.comanda.eventmodel.order.OrderStatus.CANCELLED;
import static com.comanda.eventmodel.order.OrderStatus.COMPLETED;
import static com.comanda.eventmodel.order.OrderStatus.CONFIRMED;
import static com.comanda.eventmodel.order.OrderStatus.DELIVERED;
import static com.comanda.eventmodel.order.OrderStatus.DELIVERING;
import static com.comanda.eventmodel.order.OrderStatus.DRAFT;
import static com.comanda.eventmodel.order.OrderStatus.PLACED;
import static com.comanda.eventmodel.order.OrderStatus.PREPARING;
import static com.comanda.eventmodel.order.OrderStatus.READY;
import static com.comanda.eventmodel.order.OrderStatus.REFUNDED;
import static com.comanda.eventmodel.order.OrderStatus.STARTED;
import static com.comanda.eventmodel.order.OrderStatus.UNINITIALIZED;

import com.comanda.eventmodel.order.OrderStatus;
import com.comanda.eventmodel.order.OrderType;
import com.comanda.orderengine.domain.exception.InvalidOrderStateException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The order status state machine as a pure table.
 *
 * <p>A move is legal when the target is adjacent to the source and, for DELIVERING and DELIVERED,
 * the order is a delivery order. Cancelling and moving backwards in {@link #FORWARD_ORDER} need a
 * reason. A backward move clears the timestamps of every status after the target.
 */
public final class StatusTransitionValidator {

    /** Canonical forward ordering used to detect backward moves. */
    public static final List<OrderStatus> FORWARD_ORDER =
            List.of(DRAFT, PLACED, CONFIRMED, PREPARING, READY, DELIVERING, DELIVERED, COMPLETED);

    private static final Map<OrderStatus, Set<OrderStatus>> ADJACENCY = adjacency();

    private static final Set<OrderStatus> DELIVERY_ONLY = EnumSet.of(DELIVERING, DELIVERED);

    private StatusTransitionValidator() {}

    private static Map<OrderStatus, Set<OrderStatus>> adjacency() {
        Map<OrderStatus, Set<OrderStatus>> table = new EnumMap<>(OrderStatus.class);
        table.put(UNINITIALIZED, EnumSet.of(DRAFT, STARTED));
        table.put(DRAFT, EnumSet.of(STARTED, PLACED, CONFIRMED, CANCELLED));
        table.put(STARTED, EnumSet.of(PLACED, CONFIRMED, CANCELLED));
        table.put(PLACED, EnumSet.of(CONFIRMED, CANCELLED));
        table.put(CONFIRMED, EnumSet.of(PREPARING, PLACED, CANCELLED, REFUNDED));
        table.put(PREPARING, EnumSet.of(READY, CONFIRMED, CANCELLED, REFUNDED));
        table.put(READY, EnumSet.of(DELIVERING, COMPLETED, PREPARING, CANCELLED, REFUNDED));
        table.put(DELIVERING, EnumSet.of(DELIVERED, READY, CANCELLED, REFUNDED));
        table.put(DELIVERED, EnumSet.of(COMPLETED, DELIVERING, REFUNDED));
        table.put(COMPLETED, EnumSet.noneOf(OrderStatus.class));
        table.put(CANCELLED, EnumSet.noneOf(OrderStatus.class));
        table.put(REFUNDED, EnumSet.noneOf(OrderStatus.class));
        return table;
    }

    public static boolean canTransition(OrderStatus from, OrderStatus to, OrderType orderType) {
        if (from == null || to == null || from == to) {
            return false;
        }
        if (!ADJACENCY.get(from).contains(to)) {
            return false;
        }
        return !DELIVERY_ONLY.contains(to) || orderType == OrderType.DELIVERY;
    }

    public static boolean requiresReason(OrderStatus from, OrderStatus to) {
        return to == CANCELLED || isBackward(from, to);
    }

    /** True when both statuses are in {@link #FORWARD_ORDER} and {@code to} comes first. */
    public static boolean isBackward(OrderStatus from, OrderStatus to) {
        int fromIndex = FORWARD_ORDER.indexOf(from);
        int toIndex = FORWARD_ORDER.indexOf(to);
        return fromIndex >= 0 && toIndex >= 0 && toIndex < fromIndex;
    }

    /** Every status reachable in one move, in declaration order. */
    public static Set<OrderStatus> availableTransitions(OrderStatus from, OrderType orderType) {
        Set<OrderStatus> result = EnumSet.noneOf(OrderStatus.class);
        for (OrderStatus to : ADJACENCY.get(from)) {
            if (canTransition(from, to, orderType)) {
                result.add(to);
            }
        }
        return result;
    }

    /**
     * Rejects an illegal move or a missing reason.
     *
     * @throws InvalidOrderStateException naming the rejected move
     */
    public static void validate(
            OrderStatus from, OrderStatus to, OrderType orderType, String reason) {
        if (!canTransition(from, to, orderType)) {
            if (from != null && from.isTerminal()) {
                throw new InvalidOrderStateException(
                        "order is %s and accepts no further status changes".formatted(from));
            }
            if (DELIVERY_ONLY.contains(to) && orderType != OrderType.DELIVERY) {
                throw new InvalidOrderStateException(
                        "%s is only reachable for delivery orders, not %s".formatted(to, orderType));
            }
            throw new InvalidOrderStateException(
                    "cannot transition from %s to %s".formatted(from, to));
        }
        if (requiresReason(from, to) && (reason == null || reason.isBlank())) {
            throw new InvalidOrderStateException(
                    "a reason is required to move from %s to %s".formatted(from, to));
        }
    }

    /** Validates the move, then applies it with {@link #applyStatus}. */
    public static OrderState transition(
            OrderState state, OrderStatus to, Instant at, String reason, String actorId) {
        validate(state.status(), to, state.orderType(), reason);
        return applyStatus(state, to, at, reason, actorId);
    }

    /**
     * Sets the status and its timestamp, clears timestamps after {@code to} on a backward move and
     * appends a history entry. Does not check legality.
     */
    public static OrderState applyStatus(
            OrderState state, OrderStatus to, Instant at, String reason, String actorId) {
        OrderStatus from = state.status();
        Map<OrderStatus, Instant> timestamps = new EnumMap<>(OrderStatus.class);
        timestamps.putAll(state.statusTimestamps());
        if (isBackward(from, to)) {
            int toIndex = FORWARD_ORDER.indexOf(to);
            for (OrderStatus later : FORWARD_ORDER.subList(toIndex + 1, FORWARD_ORDER.size())) {
                timestamps.remove(later);
            }
        }
        timestamps.put(to, at);

        List<StatusChange> history = new ArrayList<>(state.history());
        history.add(new StatusChange(from, to, reason, actorId, at));

        return state.toBuilder()
                .status(to)
                .statusTimestamps(timestamps)
                .history(history)
                .build();
    }
}
