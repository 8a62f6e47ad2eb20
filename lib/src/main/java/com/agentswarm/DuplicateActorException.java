package com.agentswarm;

public class DuplicateActorException extends ActorException {

    public DuplicateActorException(String actorId) {
        super("Actor " + actorId + " is already registered", actorId);
    }
}
