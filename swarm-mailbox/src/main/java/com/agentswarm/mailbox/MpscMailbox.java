package com.agentswarm.mailbox;

import org.jctools.queues.MpscArrayQueue;

import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded mailbox backed by a JCTools MPSC (Multi-Producer Single-Consumer) array queue.
 *
 * <p>JCTools rounds array capacities up to a power of two, so the exact capacity
 * is enforced separately with a reservation counter: a producer claims a slot
 * before enqueueing and gives it back if the enqueue fails.
 *
 * <p>Producers are lock-free apart from signalling a waiting consumer.
 * Consumers serialize on a lock, which keeps the single-consumer contract of the
 * underlying queue even when a caller polls alongside the actor's own run loop.
 *
 * @param <T> The type of messages
 */
public class MpscMailbox<T> implements Mailbox<T> {

    private final MpscArrayQueue<T> queue;
    private final int capacity;
    private final AtomicInteger reserved = new AtomicInteger();
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private volatile boolean closed = false;

    /**
     * Creates an MPSC mailbox holding at most {@code capacity} messages.
     *
     * @param capacity the maximum number of queued messages, at least 1
     */
    public MpscMailbox(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Capacity must be at least 1, was " + capacity);
        }
        this.capacity = capacity;
        // JCTools requires at least 2
        this.queue = new MpscArrayQueue<>(Math.max(2, capacity));
    }

    @Override
    public boolean offer(T message) {
        Objects.requireNonNull(message, "Message cannot be null");
        if (closed || !reserveSlot()) {
            return false;
        }
        if (!queue.offer(message)) {
            reserved.decrementAndGet();
            return false;
        }
        signalNotEmpty();
        return true;
    }

    @Override
    public T poll() {
        lock.lock();
        try {
            return dequeue();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public T poll(long timeout, TimeUnit unit) throws InterruptedException {
        long nanos = unit.toNanos(timeout);
        lock.lockInterruptibly();
        try {
            T message = dequeue();
            while (message == null && nanos > 0 && !closed) {
                nanos = notEmpty.awaitNanos(nanos);
                message = dequeue();
            }
            return message;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int size() {
        return reserved.get();
    }

    @Override
    public int remainingCapacity() {
        return Math.max(0, capacity - reserved.get());
    }

    @Override
    public int capacity() {
        return capacity;
    }

    @Override
    public void clear() {
        lock.lock();
        try {
            while (queue.poll() != null) {
                reserved.decrementAndGet();
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void close() {
        closed = true;
        lock.lock();
        try {
            while (queue.poll() != null) {
                reserved.decrementAndGet();
            }
            notEmpty.signalAll();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean isClosed() {
        return closed;
    }

    private boolean reserveSlot() {
        while (true) {
            int current = reserved.get();
            if (current >= capacity) {
                return false;
            }
            if (reserved.compareAndSet(current, current + 1)) {
                return true;
            }
        }
    }

    // Caller must hold the lock
    private T dequeue() {
        if (closed) {
            return null;
        }
        T message = queue.poll();
        if (message != null) {
            reserved.decrementAndGet();
        }
        return message;
    }

    private void signalNotEmpty() {
        lock.lock();
        try {
            notEmpty.signal();
        } finally {
            lock.unlock();
        }
    }
}
