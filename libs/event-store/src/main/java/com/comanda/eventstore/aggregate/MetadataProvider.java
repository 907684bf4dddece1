package com.comanda.eventstore.aggregate;

import com.comanda.eventmodel.EventMetadata;

/**
 * Supplies metadata for each event an aggregate records: the current actor, correlation and a
 * fresh {@code occurredAt}.
 */
@FunctionalInterface
public interface MetadataProvider {

    EventMetadata next();
}
