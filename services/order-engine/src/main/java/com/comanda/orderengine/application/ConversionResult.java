package com.comanda.orderengine.application;

import java.util.List;
import java.util.UUID;

/**
 * Outcome of converting a session into an order.
 *
 * @param total order total before tax, in minor units
 * @param skippedItemIds cart items left out because the catalog no longer offers them
 */
public record ConversionResult(
        UUID orderId, UUID sessionId, long total, String currency, List<String> skippedItemIds) {

    public ConversionResult {
        skippedItemIds = List.copyOf(skippedItemIds);
    }
}
