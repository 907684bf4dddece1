package com.comanda.eventmodel.order;

/**
 * Change to the existing lines of one item. A null field leaves that attribute unchanged.
 *
 * @param itemId the item whose lines are changed
 * @param quantity new quantity per line, must be positive when present
 * @param notes replacement notes
 */
public record ItemChange(String itemId, Integer quantity, String notes) {}
