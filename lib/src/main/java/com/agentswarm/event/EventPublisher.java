package com.agentswarm.event;

/**
 * Accepts events for delivery. Publishing never blocks.
 */
@FunctionalInterface
public interface EventPublisher {

    void publish(Event event);
}
