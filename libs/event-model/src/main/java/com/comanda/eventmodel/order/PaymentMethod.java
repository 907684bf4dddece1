package com.comanda.eventmodel.order;

public enum PaymentMethod {
    CASH,
    CARD,
    MOBILE_WALLET,
    BANK_TRANSFER,
    VOUCHER
}
