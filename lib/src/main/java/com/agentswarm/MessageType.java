package com.agentswarm;

/**
 * Kind of a {@link Message}, derived from its payload.
 */
public enum MessageType {
    TASK,
    RESULT,
    QUERY,
    BROADCAST
}
