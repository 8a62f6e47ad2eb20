package com.agentswarm;

/**
 * Thrown when an actor's loop did not exit cleanly during {@code stop}.
 * The actor is still marked stopped when this is thrown.
 */
public class ActorStopException extends ActorException {

    public ActorStopException(String actorId, String reason) {
        super("Actor " + actorId + " did not stop cleanly: " + reason, actorId);
    }

    public ActorStopException(String actorId, String reason, Throwable cause) {
        super("Actor " + actorId + " did not stop cleanly: " + reason, cause, actorId);
    }
}
