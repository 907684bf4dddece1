package com.comanda.eventmodel.order;

/** Lifecycle status of an order. */
public enum OrderStatus {
    UNINITIALIZED,
    DRAFT,
    STARTED,
    PLACED,
    CONFIRMED,
    PREPARING,
    READY,
    DELIVERING,
    DELIVERED,
    COMPLETED,
    CANCELLED,
    REFUNDED;

    /** No command is accepted once an order reaches a terminal status. */
    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED || this == REFUNDED;
    }
}
