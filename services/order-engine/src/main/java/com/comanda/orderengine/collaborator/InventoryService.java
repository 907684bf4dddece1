package com.comanda.orderengine.collaborator;

/** Stock check consulted before an order is confirmed. */
public interface InventoryService {

    boolean isAvailable(String itemId, int quantity);
}
