package com.comanda.eventmodel.session;

/** A modifier chosen for a cart line. Carries no price: prices come from the catalog at checkout. */
public record CartModifier(String modifierId, String name) {}
