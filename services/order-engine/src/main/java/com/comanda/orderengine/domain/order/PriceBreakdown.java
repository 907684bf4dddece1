package com.comanda.orderengine.domain.order;

import java.math.BigDecimal;

/** Result of pricing an order. See {@link PriceCalculator}. */
public record PriceBreakdown(
        long subtotal, long discount, long tax, long tip, long total, BigDecimal taxRate) {

    /** True when {@code total == subtotal + tax - discount + tip}. */
    public boolean isConsistent() {
        return total == subtotal + tax - discount + tip;
    }
}
