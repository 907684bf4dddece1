package com.comanda.orderengine.collaborator;

import com.comanda.observability.CorrelationContextHolder;

/** Reads the actor from the thread's correlation context; {@link Actor#SYSTEM} when absent. */
public class ContextActorResolver implements ActorResolver {

    @Override
    public Actor currentActor() {
        return CorrelationContextHolder.get()
                .filter(ctx -> ctx.actorId() != null)
                .map(ctx -> new Actor(ctx.actorId(), ctx.actorName()))
                .orElse(Actor.SYSTEM);
    }
}
