package com.agentswarm;

/**
 * Dispatches on the concrete {@link Payload} variant.
 *
 * @param <R> result type
 */
public interface PayloadVisitor<R> {

    R visitTask(Payload.TaskAssignment payload);

    R visitResult(Payload.TaskReport payload);

    R visitBroadcast(Payload.Broadcast payload);

    R visitQuery(Payload.Query payload);
}
