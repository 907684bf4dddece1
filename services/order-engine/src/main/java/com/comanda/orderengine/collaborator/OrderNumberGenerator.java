package com.comanda.orderengine.collaborator;

@FunctionalInterface
public interface OrderNumberGenerator {

    String next(String locationId);
}
