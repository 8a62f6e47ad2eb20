package com.agentswarm;

/**
 * Root of the failures {@link Actor} and {@link Swarm} report to callers: rejected sends,
 * lifecycle violations, registry lookups and swarm-wide operations that partly failed.
 * <p>
 * Errors thrown by message handlers never surface as this type; the run loop catches them and
 * reports them through {@link Actor#onHandlerError}.
 */
public class ActorException extends RuntimeException {

    private final String actorId;

    /**
     * For failures that concern the swarm as a whole rather than one actor.
     */
    public ActorException(String message) {
        super(message);
        this.actorId = null;
    }

    public ActorException(String message, String actorId) {
        super(message);
        this.actorId = actorId;
    }

    public ActorException(String message, Throwable cause, String actorId) {
        super(message, cause);
        this.actorId = actorId;
    }

    /**
     * The actor the failure concerns, or null for swarm-wide failures such as
     * {@link NoAvailableActorException}.
     */
    public String getActorId() {
        return actorId;
    }
}
