package com.comanda.orderengine.introspection;

/** How a timeline shows an event: a sentence, an icon name and a color name. */
public record EventPresentation(String description, String icon, String color) {}
