package com.comanda.eventmodel;

import java.util.Optional;

/** The kinds of event-sourced aggregates. Each stream belongs to exactly one. */
public enum AggregateType {
    ORDER("Order"),
    ORDER_SESSION("OrderSession");

    private final String value;

    AggregateType(String value) {
        this.value = value;
    }

    /** The canonical string representation used in JSON (e.g. "OrderSession"). */
    public String value() {
        return value;
    }

    public static Optional<AggregateType> fromString(String value) {
        for (AggregateType type : values()) {
            if (type.value.equals(value)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
