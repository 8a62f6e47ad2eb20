package com.agentswarm;

/**
 * Thrown when {@code start} is called on an actor that is not idle.
 */
public class ActorAlreadyRunningException extends ActorException {

    private final ActorState state;

    public ActorAlreadyRunningException(String actorId, ActorState state) {
        super("Actor " + actorId + " cannot be started from state " + state, actorId);
        this.state = state;
    }

    public ActorState getState() {
        return state;
    }
}
