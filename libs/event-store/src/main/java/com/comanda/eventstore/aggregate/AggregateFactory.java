package com.comanda.eventstore.aggregate;

import java.util.UUID;

/** Builds a concrete aggregate around replayed state. */
@FunctionalInterface
public interface AggregateFactory<S, A extends AggregateRoot<S>> {

    A create(UUID id, S state, long version, MetadataProvider metadata);
}
