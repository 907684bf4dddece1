package com.comanda.orderengine.domain.session;

import com.comanda.eventmodel.session.CartModifier;
import java.util.List;

/** One cart line of a session. Carries no price; prices are looked up on conversion. */
public record CartLine(
        String itemId, String itemName, int quantity, List<CartModifier> modifiers, String notes) {

    public CartLine {
        modifiers = modifiers == null ? List.of() : List.copyOf(modifiers);
    }
}
