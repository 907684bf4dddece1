package com.comanda.orderengine.projection;

import com.comanda.eventmodel.order.OrderStatus;
import com.comanda.orderengine.domain.order.OrderState;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/** Queries over projected orders. */
public class OrderReadModel {

    private static final Comparator<OrderState> BY_CREATION =
            Comparator.comparing(OrderState::createdAt, Comparator.nullsLast(Comparator.naturalOrder()));

    private final ProjectionStore<OrderState> rows;

    public OrderReadModel(ProjectionStore<OrderState> rows) {
        this.rows = rows;
    }

    public Optional<OrderState> findOrder(UUID orderId) {
        return rows.find(orderId).filter(ProjectedRow::hasEvents).map(ProjectedRow::state);
    }

    public Optional<ProjectedRow<OrderState>> findRow(UUID orderId) {
        return rows.find(orderId);
    }

    public List<OrderState> findOrdersByStatus(OrderStatus status) {
        return rows.all().stream()
                .filter(ProjectedRow::hasEvents)
                .map(ProjectedRow::state)
                .filter(order -> order.status() == status)
                .sorted(BY_CREATION)
                .toList();
    }

    public List<OrderState> findOrdersByLocation(String locationId) {
        return rows.all().stream()
                .filter(ProjectedRow::hasEvents)
                .map(ProjectedRow::state)
                .filter(order -> Objects.equals(order.locationId(), locationId))
                .sorted(BY_CREATION)
                .toList();
    }
}
