package com.agentswarm;

import java.util.Objects;

/**
 * Why a task did not succeed.
 *
 * @param kind    category of the failure
 * @param message human-readable detail
 * @param cause   underlying exception, if any
 */
public record TaskError(Kind kind, String message, Throwable cause) {

    public enum Kind {
        /** The task ran and reported failure. */
        TASK_FAILED,
        /** Processing threw. */
        HANDLER_ERROR,
        /** No terminal event arrived before the deadline. */
        TIMEOUT
    }

    public TaskError {
        Objects.requireNonNull(kind, "kind");
        message = message == null ? "" : message;
    }

    public TaskError(Kind kind, String message) {
        this(kind, message, null);
    }
}
