package com.comanda.orderengine.domain.order;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Integer minor-unit pricing. Tax is computed on the subtotal with exact decimal arithmetic and
 * rounded half-up to a whole minor unit.
 */
public final class PriceCalculator {

    private PriceCalculator() {}

    public static long tax(long subtotal, BigDecimal taxRate) {
        if (taxRate == null || taxRate.signum() < 0) {
            throw new IllegalArgumentException("taxRate must be non-negative");
        }
        return BigDecimal.valueOf(subtotal)
                .multiply(taxRate)
                .setScale(0, RoundingMode.HALF_UP)
                .longValueExact();
    }

    public static PriceBreakdown calculate(
            long subtotal, long discount, long tip, BigDecimal taxRate) {
        long tax = tax(subtotal, taxRate);
        return new PriceBreakdown(
                subtotal, discount, tax, tip, subtotal + tax - discount + tip, taxRate);
    }

    /** Prices the order's current subtotal, discount and tip. */
    public static PriceBreakdown calculate(OrderState state, BigDecimal taxRate) {
        return calculate(state.subtotal(), state.discount(), state.tip(), taxRate);
    }
}
