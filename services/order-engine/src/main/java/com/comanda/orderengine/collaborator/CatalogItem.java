package com.comanda.orderengine.collaborator;

/**
 * Catalog entry of a menu item. Prices are integer minor units.
 *
 * @param salePrice current sale price, or null when the item is not on sale
 */
public record CatalogItem(String itemId, String name, long basePrice, Long salePrice, boolean available) {

    public static CatalogItem of(String itemId, String name, long basePrice) {
        return new CatalogItem(itemId, name, basePrice, null, true);
    }

    /** The sale price when present, otherwise the base price. */
    public long effectivePrice() {
        return salePrice != null ? salePrice : basePrice;
    }
}
