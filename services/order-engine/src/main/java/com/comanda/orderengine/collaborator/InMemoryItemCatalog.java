package com.comanda.orderengine.collaborator;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryItemCatalog implements ItemCatalog {

    private final Map<String, CatalogItem> items = new ConcurrentHashMap<>();
    private final Map<String, CatalogModifier> modifiers = new ConcurrentHashMap<>();

    public InMemoryItemCatalog put(CatalogItem item) {
        items.put(item.itemId(), item);
        return this;
    }

    public InMemoryItemCatalog put(CatalogModifier modifier) {
        modifiers.put(modifier.modifierId(), modifier);
        return this;
    }

    public void remove(String itemId) {
        items.remove(itemId);
    }

    @Override
    public Optional<CatalogItem> findItem(String itemId) {
        return Optional.ofNullable(items.get(itemId));
    }

    @Override
    public Optional<CatalogModifier> findModifier(String modifierId) {
        return Optional.ofNullable(modifiers.get(modifierId));
    }
}
