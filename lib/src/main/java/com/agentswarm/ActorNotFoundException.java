package com.agentswarm;

public class ActorNotFoundException extends ActorException {

    public ActorNotFoundException(String actorId) {
        super("Actor " + actorId + " is not registered", actorId);
    }
}
