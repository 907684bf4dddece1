package com.comanda.orderengine.collaborator;

/** Who issued a command. */
public record Actor(String id, String name) {

    public static final Actor SYSTEM = new Actor("system", "System");
}
