package com.comanda.orderengine.domain.exception;

import java.util.UUID;

public class OrderNotFoundException extends OrderEngineException {

    private final UUID orderId;

    public OrderNotFoundException(UUID orderId) {
        super(ErrorCode.NOT_FOUND, "Order %s not found".formatted(orderId));
        this.orderId = orderId;
    }

    public UUID orderId() {
        return orderId;
    }
}
