package com.comanda.orderengine.collaborator;

/**
 * Catalog entry of a modifier that can be put on any line, e.g. "extra cheese".
 *
 * @param priceDelta price added per unit, in minor units; never negative
 */
public record CatalogModifier(String modifierId, String name, long priceDelta, boolean available) {

    public CatalogModifier {
        if (priceDelta < 0) {
            throw new IllegalArgumentException("priceDelta of modifier " + modifierId + " must not be negative");
        }
    }

    public static CatalogModifier of(String modifierId, String name, long priceDelta) {
        return new CatalogModifier(modifierId, name, priceDelta, true);
    }
}
