package com.agentswarm;

import java.util.Objects;

/**
 * An envelope delivered to an actor's mailbox.
 *
 * @param sender    id of the sender, never null
 * @param recipient id of the recipient, null for broadcasts
 * @param payload   the content
 */
public record Message(String sender, String recipient, Payload payload) {

    public Message {
        Objects.requireNonNull(sender, "sender");
        Objects.requireNonNull(payload, "payload");
    }

    public static Message task(String sender, String recipient, Task task) {
        return new Message(sender, recipient, new Payload.TaskAssignment(task));
    }

    public static Message query(String sender, String recipient, String question) {
        return new Message(sender, recipient, new Payload.Query(question));
    }

    public static Message result(String sender, String recipient, TaskResult result) {
        return new Message(sender, recipient, new Payload.TaskReport(result));
    }

    public MessageType type() {
        return payload.type();
    }

    /**
     * Returns a copy addressed to nobody with the payload wrapped as a broadcast.
     * A message that is already a broadcast is not wrapped twice.
     */
    public Message asBroadcast() {
        Payload content = payload instanceof Payload.Broadcast ? payload : new Payload.Broadcast(payload);
        return new Message(sender, null, content);
    }

    public Message withRecipient(String recipient) {
        return new Message(sender, recipient, payload);
    }
}
