package com.comanda.orderengine.domain.order;

/**
 * Money of an order in integer minor units.
 *
 * <p>{@code total} is always {@code subtotal + tax - discount + tip}.
 */
public record OrderTotals(
        long subtotal, long discount, long tax, long tip, long total, String currency) {

    public static OrderTotals of(long subtotal, long discount, long tax, long tip, String currency) {
        return new OrderTotals(subtotal, discount, tax, tip, subtotal + tax - discount + tip, currency);
    }
}
