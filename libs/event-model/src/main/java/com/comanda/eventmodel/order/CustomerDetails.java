package com.comanda.eventmodel.order;

/** Customer contact details shared by orders and sessions. Every field is optional. */
public record CustomerDetails(
        String name, String phone, String email, String deliveryAddress, String notes) {

    public static CustomerDetails named(String name) {
        return new CustomerDetails(name, null, null, null, null);
    }
}
