package com.comanda.orderengine.collaborator;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/** Items without a stock level are treated as unlimited. */
public class InMemoryInventoryService implements InventoryService {

    private final Map<String, Integer> stock = new ConcurrentHashMap<>();

    public InMemoryInventoryService setStock(String itemId, int quantity) {
        stock.put(itemId, quantity);
        return this;
    }

    @Override
    public boolean isAvailable(String itemId, int quantity) {
        Integer level = stock.get(itemId);
        return level == null || level >= quantity;
    }
}
