package com.agentswarm.mailbox;

import java.util.Objects;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Bounded mailbox implementation using LinkedBlockingQueue.
 *
 * Recommended for:
 * - Actors with few senders
 * - Small capacities where an array sized to the next power of two is wasteful
 *
 * @param <T> The type of messages
 */
public class LinkedMailbox<T> implements Mailbox<T> {

    private final LinkedBlockingQueue<T> queue;
    private final int capacity;
    private volatile boolean closed = false;

    /**
     * Creates a bounded mailbox with the specified capacity.
     *
     * @param capacity the maximum number of messages
     */
    public LinkedMailbox(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Capacity must be at least 1, was " + capacity);
        }
        this.queue = new LinkedBlockingQueue<>(capacity);
        this.capacity = capacity;
    }

    @Override
    public boolean offer(T message) {
        Objects.requireNonNull(message, "Message cannot be null");
        return !closed && queue.offer(message);
    }

    @Override
    public T poll() {
        return closed ? null : queue.poll();
    }

    @Override
    public T poll(long timeout, TimeUnit unit) throws InterruptedException {
        if (closed) {
            return null;
        }
        return queue.poll(timeout, unit);
    }

    @Override
    public int size() {
        return queue.size();
    }

    @Override
    public int remainingCapacity() {
        return queue.remainingCapacity();
    }

    @Override
    public int capacity() {
        return capacity;
    }

    @Override
    public void clear() {
        queue.clear();
    }

    @Override
    public void close() {
        closed = true;
        queue.clear();
    }

    @Override
    public boolean isClosed() {
        return closed;
    }
}
