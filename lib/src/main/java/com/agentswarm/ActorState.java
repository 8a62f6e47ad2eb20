package com.agentswarm;

/**
 * Lifecycle state of an actor. Transitions only move forward:
 * IDLE to PROCESSING on start, and either of those to STOPPED on stop.
 */
public enum ActorState {
    IDLE,
    PROCESSING,
    STOPPED
}
