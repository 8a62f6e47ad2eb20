package com.agentswarm.mailbox;

import java.util.concurrent.TimeUnit;

/**
 * Abstraction for actor mailbox operations.
 * A mailbox is a bounded, insertion-ordered queue owned by exactly one actor.
 * Enqueueing never blocks: a full or closed mailbox rejects the message immediately.
 *
 * @param <T> The type of messages stored in the mailbox
 */
public interface Mailbox<T> {

    /**
     * Inserts the specified message into this mailbox if it is possible to do
     * so immediately without exceeding capacity, returning true upon success
     * and false if the mailbox is full or closed.
     *
     * @param message the message to add
     * @return true if the message was added, false otherwise
     * @throws NullPointerException if the message is null
     */
    boolean offer(T message);

    /**
     * Retrieves and removes the head of this mailbox, or returns null if empty or closed.
     *
     * @return the head of this mailbox, or null if empty
     */
    T poll();

    /**
     * Retrieves and removes the head of this mailbox, waiting up to the
     * specified wait time if necessary for a message to become available.
     *
     * @param timeout how long to wait before giving up
     * @param unit the time unit of the timeout argument
     * @return the head of this mailbox, or null if timeout elapsed or the mailbox was closed
     * @throws InterruptedException if interrupted while waiting
     */
    T poll(long timeout, TimeUnit unit) throws InterruptedException;

    /**
     * Returns the number of messages in this mailbox.
     *
     * @return the number of messages
     */
    int size();

    /**
     * Returns true if this mailbox contains no messages.
     *
     * @return true if empty
     */
    default boolean isEmpty() {
        return size() == 0;
    }

    /**
     * Returns the number of additional messages this mailbox can accept.
     *
     * @return the remaining capacity
     */
    int remainingCapacity();

    /**
     * Returns the configured capacity of this mailbox.
     *
     * @return the total capacity
     */
    int capacity();

    /**
     * Removes all messages from this mailbox.
     */
    void clear();

    /**
     * Closes this mailbox. Pending messages are discarded, subsequent offers
     * are rejected and waiting consumers are released.
     */
    void close();

    /**
     * Returns true once {@link #close()} has been called.
     *
     * @return true if closed
     */
    boolean isClosed();
}
