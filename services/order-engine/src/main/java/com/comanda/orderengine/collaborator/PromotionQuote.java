package com.comanda.orderengine.collaborator;

import com.comanda.eventmodel.order.PromotionLine;
import java.util.List;

/** Promotions offered for an order and those applied without asking. */
public record PromotionQuote(List<PromotionLine> available, List<PromotionLine> autoApplied) {

    public static final PromotionQuote NONE = new PromotionQuote(List.of(), List.of());

    public PromotionQuote {
        available = List.copyOf(available);
        autoApplied = List.copyOf(autoApplied);
    }
}
