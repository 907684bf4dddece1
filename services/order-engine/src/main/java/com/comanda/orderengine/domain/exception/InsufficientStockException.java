package com.comanda.orderengine.domain.exception;

public class InsufficientStockException extends OrderEngineException {

    private final String itemId;
    private final int requestedQuantity;

    public InsufficientStockException(String itemId, int requestedQuantity) {
        super(
                ErrorCode.INSUFFICIENT_STOCK,
                "Insufficient stock for item %s (requested %d)".formatted(itemId, requestedQuantity));
        this.itemId = itemId;
        this.requestedQuantity = requestedQuantity;
    }

    public String itemId() {
        return itemId;
    }

    public int requestedQuantity() {
        return requestedQuantity;
    }
}
