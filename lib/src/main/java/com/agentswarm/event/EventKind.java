package com.agentswarm.event;

/**
 * Kinds of events published on the bus.
 */
public enum EventKind {
    TASK_RECEIVED,
    TASK_STARTED,
    TASK_COMPLETED,
    TASK_FAILED,
    MESSAGE,
    CUSTOM;

    /**
     * Returns true for the kinds that end a task's event sequence.
     */
    public boolean isTerminal() {
        return this == TASK_COMPLETED || this == TASK_FAILED;
    }
}
