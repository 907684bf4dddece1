package com.comanda.orderengine.collaborator;

@FunctionalInterface
public interface ActorResolver {

    Actor currentActor();
}
