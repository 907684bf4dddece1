package com.comanda.orderengine.application;

import com.comanda.eventmodel.order.LineItem;
import com.comanda.eventmodel.order.LineModifier;
import com.comanda.orderengine.collaborator.CatalogItem;
import com.comanda.orderengine.collaborator.CatalogModifier;
import com.comanda.orderengine.collaborator.InventoryService;
import com.comanda.orderengine.collaborator.ItemCatalog;
import com.comanda.orderengine.domain.exception.DependencyException;
import com.comanda.orderengine.domain.exception.InsufficientStockException;
import com.comanda.orderengine.domain.exception.ValidationException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Prices lines and their modifiers from the catalog and checks stock. Every failure of the catalog or the inventory
 * surfaces as a {@link DependencyException}; there is no fallback to earlier prices.
 */
public class CatalogGateway {

    static final String CATALOG = "item-catalog";
    static final String INVENTORY = "inventory";

    private final ItemCatalog catalog;
    private final InventoryService inventory;

    public CatalogGateway(ItemCatalog catalog, InventoryService inventory) {
        this.catalog = catalog;
        this.inventory = inventory;
    }

    /** The item if it is in the catalog and available for sale. */
    public Optional<CatalogItem> findAvailable(String itemId) {
        Optional<CatalogItem> item;
        try {
            item = catalog.findItem(itemId);
        } catch (RuntimeException e) {
            throw new DependencyException(CATALOG, "lookup of item " + itemId + " failed", e);
        }
        return item.filter(CatalogItem::available);
    }

    public CatalogItem requireAvailable(String itemId) {
        if (itemId == null || itemId.isBlank()) {
            throw new ValidationException("itemId is required");
        }
        return findAvailable(itemId)
                .orElseThrow(() -> new ValidationException("item %s is not available".formatted(itemId)));
    }

    /** A line priced at the item's current effective price plus the catalog price of each modifier. */
    public LineItem price(String itemId, int quantity, List<String> modifierIds, String notes) {
        CatalogItem item = requireAvailable(itemId);
        return LineItem.of(itemId, item.name(), quantity, item.effectivePrice(), modifiers(modifierIds), notes);
    }

    /** Re-prices existing lines, keeping quantities, modifier choices and notes. */
    public List<LineItem> reprice(List<LineItem> lines) {
        return lines.stream()
                .map(line -> price(line.itemId(), line.quantity(), modifierIds(line.modifiers()), line.notes()))
                .toList();
    }

    /** Resolves modifier ids to their current catalog names and prices. */
    public List<LineModifier> modifiers(List<String> modifierIds) {
        if (modifierIds == null) {
            return List.of();
        }
        return modifierIds.stream().map(this::requireModifier).toList();
    }

    private LineModifier requireModifier(String modifierId) {
        if (modifierId == null || modifierId.isBlank()) {
            throw new ValidationException("modifierId is required");
        }
        Optional<CatalogModifier> modifier;
        try {
            modifier = catalog.findModifier(modifierId);
        } catch (RuntimeException e) {
            throw new DependencyException(CATALOG, "lookup of modifier " + modifierId + " failed", e);
        }
        return modifier.filter(CatalogModifier::available)
                .map(m -> new LineModifier(m.modifierId(), m.name(), m.priceDelta()))
                .orElseThrow(() -> new ValidationException("modifier %s is not available".formatted(modifierId)));
    }

    private static List<String> modifierIds(List<LineModifier> modifiers) {
        return modifiers.stream().map(LineModifier::modifierId).toList();
    }

    /** Checks the total quantity per item across {@code lines}. */
    public void checkStock(List<LineItem> lines) {
        Map<String, Integer> quantities = new LinkedHashMap<>();
        for (LineItem line : lines) {
            quantities.merge(line.itemId(), line.quantity(), Integer::sum);
        }
        quantities.forEach(this::checkStock);
    }

    public void checkStock(String itemId, int quantity) {
        boolean available;
        try {
            available = inventory.isAvailable(itemId, quantity);
        } catch (RuntimeException e) {
            throw new DependencyException(INVENTORY, "stock check of item " + itemId + " failed", e);
        }
        if (!available) {
            throw new InsufficientStockException(itemId, quantity);
        }
    }
}
