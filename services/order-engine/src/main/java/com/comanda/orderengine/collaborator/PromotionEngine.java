package com.comanda.orderengine.collaborator;

import com.comanda.orderengine.domain.order.OrderState;

public interface PromotionEngine {

    /** Quotes promotions for an order whose items have been validated. */
    PromotionQuote quote(OrderState order);
}
