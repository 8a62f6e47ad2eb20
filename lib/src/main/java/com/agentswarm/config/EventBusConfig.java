package com.agentswarm.config;

/**
 * Configuration for the event bus.
 */
public class EventBusConfig {
    public static final int DEFAULT_SUBSCRIBER_CAPACITY = 100;

    private int subscriberCapacity = DEFAULT_SUBSCRIBER_CAPACITY;

    /**
     * Sets the buffer size of each subscription. Events published to a full
     * subscription are dropped for that subscriber only.
     *
     * @param subscriberCapacity The per-subscriber buffer size, at least 1
     * @return This EventBusConfig instance
     */
    public EventBusConfig setSubscriberCapacity(int subscriberCapacity) {
        if (subscriberCapacity < 1) {
            throw new IllegalArgumentException("Subscriber capacity must be at least 1");
        }
        this.subscriberCapacity = subscriberCapacity;
        return this;
    }

    public int getSubscriberCapacity() {
        return subscriberCapacity;
    }
}
