package com.agentswarm;

/**
 * Thrown when a send finds the recipient's mailbox at capacity. The message is not enqueued.
 */
public class MailboxFullException extends ActorException {

    private final int capacity;

    public MailboxFullException(String actorId, int capacity) {
        super("Mailbox of actor " + actorId + " is full (capacity " + capacity + ")", actorId);
        this.capacity = capacity;
    }

    public int getCapacity() {
        return capacity;
    }
}
