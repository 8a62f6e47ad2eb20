package com.agentswarm.event;

import com.agentswarm.TaskResult;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * A notification of something an actor did.
 *
 * @param kind      what happened
 * @param timestamp when it happened
 * @param actorId   the actor involved
 * @param taskId    the task involved, or null
 * @param message   human-readable summary
 * @param payload   extra data; a {@link TaskResult} for terminal task events
 */
public record Event(EventKind kind,
                    Instant timestamp,
                    String actorId,
                    String taskId,
                    String message,
                    Object payload) {

    public Event {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(actorId, "actorId");
        message = message == null ? "" : message;
    }

    public static Event of(EventKind kind, String actorId, String taskId, String message, Object payload) {
        return new Event(kind, Instant.now(), actorId, taskId, message, payload);
    }

    public static Event of(EventKind kind, String actorId, String taskId, String message) {
        return of(kind, actorId, taskId, message, null);
    }

    /**
     * Returns the task result carried by this event, if any.
     */
    public Optional<TaskResult> result() {
        return payload instanceof TaskResult ? Optional.of((TaskResult) payload) : Optional.empty();
    }

    public boolean concerns(String taskId) {
        return taskId != null && taskId.equals(this.taskId);
    }
}
