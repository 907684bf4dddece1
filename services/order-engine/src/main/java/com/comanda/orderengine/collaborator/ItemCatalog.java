package com.comanda.orderengine.collaborator;

import java.util.Optional;

/**
 * Authoritative source of item and modifier names and prices. Implementations signal an outage by
 * throwing; callers wrap the failure in a {@code DependencyException} and never substitute cached
 * prices.
 */
public interface ItemCatalog {

    Optional<CatalogItem> findItem(String itemId);

    Optional<CatalogModifier> findModifier(String modifierId);
}
