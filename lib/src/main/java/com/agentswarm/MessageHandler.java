package com.agentswarm;

/**
 * Handles messages of one {@link MessageType} on behalf of an actor.
 * Runs on the actor's own thread; an exception thrown here is reported but does not stop the actor.
 */
@FunctionalInterface
public interface MessageHandler {

    void handle(Message message) throws Exception;
}
