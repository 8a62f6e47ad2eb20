package com.agentswarm.event;

import com.agentswarm.mailbox.Mailbox;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * A subscriber's private buffer of events.
 * <p>
 * Events arrive in publish order. When the buffer is full new events are dropped for this
 * subscriber only and counted in {@link #droppedCount()}. Closing unsubscribes and discards
 * whatever is still buffered. When the bus itself closes, the subscription stops accepting
 * events but still hands out the ones it already holds.
 */
public final class Subscription implements AutoCloseable {

    private final long id;
    private final Mailbox<Event> buffer;
    private final Consumer<Subscription> onClose;
    private final AtomicLong dropped = new AtomicLong();
    private volatile boolean closed;

    Subscription(long id, Mailbox<Event> buffer, Consumer<Subscription> onClose) {
        this.id = id;
        this.buffer = buffer;
        this.onClose = onClose;
    }

    /**
     * Waits up to {@code timeout} for the next event.
     *
     * @return the next event, or empty if none arrived in time or the subscription is closed and drained
     */
    public Optional<Event> poll(Duration timeout) throws InterruptedException {
        if (closed) {
            return tryPoll();
        }
        return Optional.ofNullable(buffer.poll(timeout.toNanos(), TimeUnit.NANOSECONDS));
    }

    /**
     * Returns the next buffered event without waiting.
     */
    public Optional<Event> tryPoll() {
        return Optional.ofNullable(buffer.poll());
    }

    /**
     * Returns true if the event was buffered, false if it was dropped.
     */
    boolean deliver(Event event) {
        if (closed) {
            return false;
        }
        if (buffer.offer(event)) {
            return true;
        }
        if (!buffer.isClosed()) {
            dropped.incrementAndGet();
        }
        return false;
    }

    public long droppedCount() {
        return dropped.get();
    }

    public int pending() {
        return buffer.size();
    }

    public boolean isClosed() {
        return closed;
    }

    long id() {
        return id;
    }

    /**
     * Stops accepting events while leaving buffered ones available to poll.
     */
    void closeBuffer() {
        closed = true;
    }

    @Override
    public void close() {
        closed = true;
        if (!buffer.isClosed()) {
            buffer.close();
            onClose.accept(this);
        }
    }
}
