package com.comanda.orderengine.domain.order;

import com.comanda.eventmodel.order.OrderStatus;
import java.time.Instant;

/** One entry of an order's status history. */
public record StatusChange(
        OrderStatus from, OrderStatus to, String reason, String actorId, Instant at) {}
