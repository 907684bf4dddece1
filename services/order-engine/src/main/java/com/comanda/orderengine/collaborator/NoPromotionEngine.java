package com.comanda.orderengine.collaborator;

import com.comanda.orderengine.domain.order.OrderState;

public class NoPromotionEngine implements PromotionEngine {

    @Override
    public PromotionQuote quote(OrderState order) {
        return PromotionQuote.NONE;
    }
}
