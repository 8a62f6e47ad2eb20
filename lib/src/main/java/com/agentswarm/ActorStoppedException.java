package com.agentswarm;

/**
 * Thrown when a message is sent to an actor that has been stopped.
 */
public class ActorStoppedException extends ActorException {

    public ActorStoppedException(String actorId) {
        super("Actor " + actorId + " is stopped", actorId);
    }
}
