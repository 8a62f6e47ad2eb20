package com.agentswarm;

import java.time.Duration;
import java.util.Objects;

/**
 * Outcome of processing a {@link Task}.
 * A successful result has no error; a failed one always carries one.
 *
 * @param taskId  the task this result belongs to
 * @param success whether processing succeeded
 * @param data    opaque output, may be null
 * @param error   failure detail, null on success
 */
public record TaskResult(String taskId, boolean success, Object data, TaskError error) {

    public TaskResult {
        Objects.requireNonNull(taskId, "taskId");
        if (success && error != null) {
            throw new IllegalArgumentException("Successful result cannot carry an error");
        }
        if (!success && error == null) {
            throw new IllegalArgumentException("Failed result must carry an error");
        }
    }

    public static TaskResult success(String taskId, Object data) {
        return new TaskResult(taskId, true, data, null);
    }

    public static TaskResult failure(String taskId, String message) {
        return new TaskResult(taskId, false, null, new TaskError(TaskError.Kind.TASK_FAILED, message));
    }

    public static TaskResult timeout(String taskId, Duration after) {
        return new TaskResult(taskId, false, null,
                new TaskError(TaskError.Kind.TIMEOUT, "Task " + taskId + " timed out after " + after.toMillis() + "ms"));
    }

    public static TaskResult handlerError(String taskId, Throwable cause) {
        return new TaskResult(taskId, false, null,
                new TaskError(TaskError.Kind.HANDLER_ERROR, String.valueOf(cause.getMessage()), cause));
    }

    public boolean isTimeout() {
        return error != null && error.kind() == TaskError.Kind.TIMEOUT;
    }

    public String errorMessage() {
        return error == null ? null : error.message();
    }
}
