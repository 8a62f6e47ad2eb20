package com.agentswarm.event;

/**
 * Source of events. Each subscription receives every event published after it was created.
 */
public interface EventStream {

    Subscription subscribe();
}
