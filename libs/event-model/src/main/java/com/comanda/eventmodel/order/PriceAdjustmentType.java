package com.comanda.eventmodel.order;

/**
 * Manual change to an order's money.
 *
 * <p>{@code DISCOUNT} and {@code SURCHARGE} move the manual discount down or up, {@code CORRECTION}
 * sets the total to the given amount by moving the manual discount, and {@code TIP} adds to the
 * tip. The total stays {@code subtotal + tax - discount + tip} in every case.
 */
public enum PriceAdjustmentType {
    DISCOUNT,
    SURCHARGE,
    CORRECTION,
    TIP
}
