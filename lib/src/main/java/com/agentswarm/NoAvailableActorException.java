package com.agentswarm;

/**
 * Thrown when a task cannot be routed because no registered actor is accepting work.
 */
public class NoAvailableActorException extends ActorException {

    public NoAvailableActorException(String taskId) {
        super("No available actor for task " + taskId);
    }
}
