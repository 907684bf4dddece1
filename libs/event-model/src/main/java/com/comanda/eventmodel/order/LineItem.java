package com.comanda.eventmodel.order;

import java.util.List;
import java.util.Objects;

/**
 * One priced line of an order. All amounts are integer minor units.
 *
 * <p>{@code lineTotal} is always {@code (unitPrice + sum(modifier priceDelta)) * quantity}; use
 * {@link #of} to build a line so the invariant holds.
 */
public record LineItem(
        String itemId,
        String name,
        int quantity,
        long unitPrice,
        List<LineModifier> modifiers,
        String notes,
        long lineTotal) {

    public LineItem {
        modifiers = modifiers == null ? List.of() : List.copyOf(modifiers);
    }

    public static LineItem of(
            String itemId,
            String name,
            int quantity,
            long unitPrice,
            List<LineModifier> modifiers,
            String notes) {
        List<LineModifier> mods = modifiers == null ? List.of() : modifiers;
        long total = computeTotal(quantity, unitPrice, mods);
        return new LineItem(itemId, name, quantity, unitPrice, mods, notes, total);
    }

    public static long computeTotal(int quantity, long unitPrice, List<LineModifier> modifiers) {
        long perUnit = unitPrice;
        for (LineModifier modifier : modifiers) {
            perUnit += modifier.priceDelta();
        }
        return perUnit * quantity;
    }

    /** Same item, same modifiers and same unit price: the two lines can be merged. */
    public boolean sameLineAs(LineItem other) {
        return Objects.equals(itemId, other.itemId)
                && unitPrice == other.unitPrice
                && Objects.equals(modifiers, other.modifiers);
    }

    public LineItem withQuantity(int newQuantity) {
        return of(itemId, name, newQuantity, unitPrice, modifiers, notes);
    }

    public LineItem withNotes(String newNotes) {
        return new LineItem(itemId, name, quantity, unitPrice, modifiers, newNotes, lineTotal);
    }
}
