package com.comanda.eventmodel;

/**
 * Marker for the typed payload records carried by domain events.
 *
 * <p>Every {@link EventType} maps to exactly one implementation, so a stored payload can always be
 * read back into its concrete record.
 */
public interface EventPayload {}
