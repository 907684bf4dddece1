package com.comanda.eventmodel.order;

/**
 * A modifier on an order line (e.g. "extra cheese").
 *
 * @param modifierId catalog id of the modifier
 * @param name display name
 * @param priceDelta price added per unit, in minor units
 */
public record LineModifier(String modifierId, String name, long priceDelta) {}
