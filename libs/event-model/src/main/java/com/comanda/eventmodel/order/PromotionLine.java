package com.comanda.eventmodel.order;

/**
 * A promotion offered or applied to an order.
 *
 * @param promotionId promotion identifier
 * @param name display name
 * @param discountAmount discount in minor units
 */
public record PromotionLine(String promotionId, String name, long discountAmount) {}
