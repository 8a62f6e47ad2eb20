package com.agentswarm.event;

import com.agentswarm.config.EventBusConfig;
import com.agentswarm.mailbox.MailboxType;
import com.agentswarm.mailbox.Mailboxes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fans events out to every current subscriber.
 * <p>
 * Publishing is non-blocking: each subscriber has a bounded buffer and an event that does not fit
 * is dropped for that subscriber alone. After {@link #close()} publishing is a no-op and
 * every subscription is closed, though events it already buffered can still be polled.
 */
public class EventBus implements EventPublisher, EventStream, AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(EventBus.class);

    private final EventBusConfig config;
    private final List<Subscription> subscribers = new CopyOnWriteArrayList<>();
    private final AtomicLong nextId = new AtomicLong();
    private volatile boolean closed;

    public EventBus() {
        this(new EventBusConfig());
    }

    public EventBus(EventBusConfig config) {
        this.config = config;
    }

    @Override
    public void publish(Event event) {
        if (closed) {
            return;
        }
        for (Subscription subscription : subscribers) {
            if (!subscription.deliver(event)) {
                logger.debug("Dropped {} event for subscriber {} (task {})",
                        event.kind(), subscription.id(), event.taskId());
            }
        }
    }

    @Override
    public Subscription subscribe() {
        Subscription subscription = new Subscription(
                nextId.incrementAndGet(),
                Mailboxes.bounded(MailboxType.MPSC, config.getSubscriberCapacity()),
                subscribers::remove);
        if (closed) {
            subscription.closeBuffer();
            return subscription;
        }
        subscribers.add(subscription);
        // close() may have run between the check and the add
        if (closed) {
            subscribers.remove(subscription);
            subscription.closeBuffer();
        }
        logger.debug("Subscriber {} added, {} active", subscription.id(), subscribers.size());
        return subscription;
    }

    public int subscriberCount() {
        return subscribers.size();
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        for (Subscription subscription : subscribers) {
            subscription.closeBuffer();
        }
        subscribers.clear();
        logger.debug("Event bus closed");
    }
}
