package com.comanda.eventmodel.order;

/** How the order is served. Only delivery orders may go out for delivery. */
public enum OrderType {
    DINE_IN,
    TAKEOUT,
    DELIVERY
}
