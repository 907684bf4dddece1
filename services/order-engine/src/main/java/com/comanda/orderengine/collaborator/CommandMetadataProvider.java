package com.comanda.orderengine.collaborator;

import com.comanda.eventmodel.EventMetadata;
import com.comanda.eventstore.aggregate.MetadataProvider;
import com.comanda.observability.CorrelationContext;
import com.comanda.observability.CorrelationContextHolder;
import java.time.Clock;
import java.util.Map;
import java.util.Optional;

/**
 * Stamps recorded events with the current actor, the correlation id of the running command and the
 * clock's instant as {@code occurredAt}.
 */
public class CommandMetadataProvider implements MetadataProvider {

    private final Clock clock;
    private final ActorResolver actors;
    private final String source;

    public CommandMetadataProvider(Clock clock, ActorResolver actors, String source) {
        this.clock = clock;
        this.actors = actors;
        this.source = source;
    }

    @Override
    public EventMetadata next() {
        Actor actor = actors.currentActor();
        Optional<CorrelationContext> context = CorrelationContextHolder.get();
        return new EventMetadata(
                actor.id(),
                actor.name(),
                context.map(CorrelationContext::correlationId).orElse(null),
                context.map(CorrelationContext::requestId).orElse(null),
                source,
                clock.instant(),
                Map.of());
    }
}
