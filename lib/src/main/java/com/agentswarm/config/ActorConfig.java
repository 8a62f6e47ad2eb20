package com.agentswarm.config;

import com.agentswarm.mailbox.MailboxType;

import java.time.Duration;
import java.util.Objects;

/**
 * Configuration for a single actor: mailbox sizing, run-loop polling and shutdown behaviour.
 */
public class ActorConfig {
    // Default values for actor configuration
    public static final int DEFAULT_MAILBOX_CAPACITY = 100;
    public static final MailboxType DEFAULT_MAILBOX_TYPE = MailboxType.MPSC;
    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(10);
    public static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(30);

    private int mailboxCapacity;
    private MailboxType mailboxType;
    private Duration pollInterval;
    private Duration shutdownTimeout;
    private ActorThreadFactory threadFactory;

    /**
     * Creates a new ActorConfig with default values.
     */
    public ActorConfig() {
        this.mailboxCapacity = DEFAULT_MAILBOX_CAPACITY;
        this.mailboxType = DEFAULT_MAILBOX_TYPE;
        this.pollInterval = DEFAULT_POLL_INTERVAL;
        this.shutdownTimeout = DEFAULT_SHUTDOWN_TIMEOUT;
        this.threadFactory = new ActorThreadFactory();
    }

    /**
     * Sets the maximum number of messages the mailbox holds before sends are rejected.
     *
     * @param mailboxCapacity The capacity, at least 1
     * @return This ActorConfig instance
     */
    public ActorConfig setMailboxCapacity(int mailboxCapacity) {
        if (mailboxCapacity < 1) {
            throw new IllegalArgumentException("Mailbox capacity must be at least 1");
        }
        this.mailboxCapacity = mailboxCapacity;
        return this;
    }

    public int getMailboxCapacity() {
        return mailboxCapacity;
    }

    /**
     * Sets the mailbox implementation.
     *
     * @param mailboxType The mailbox type
     * @return This ActorConfig instance
     */
    public ActorConfig setMailboxType(MailboxType mailboxType) {
        this.mailboxType = Objects.requireNonNull(mailboxType, "mailboxType");
        return this;
    }

    public MailboxType getMailboxType() {
        return mailboxType;
    }

    /**
     * Sets how long the run loop waits on an empty mailbox before re-checking cancellation.
     * This bounds how quickly a cancelled actor notices it should exit.
     *
     * @param pollInterval The poll interval
     * @return This ActorConfig instance
     */
    public ActorConfig setPollInterval(Duration pollInterval) {
        this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval");
        return this;
    }

    public Duration getPollInterval() {
        return pollInterval;
    }

    /**
     * Sets how long {@code stop()} waits for the run loop to exit.
     *
     * @param shutdownTimeout The shutdown timeout
     * @return This ActorConfig instance
     */
    public ActorConfig setShutdownTimeout(Duration shutdownTimeout) {
        this.shutdownTimeout = Objects.requireNonNull(shutdownTimeout, "shutdownTimeout");
        return this;
    }

    public Duration getShutdownTimeout() {
        return shutdownTimeout;
    }

    public ActorConfig setThreadFactory(ActorThreadFactory threadFactory) {
        this.threadFactory = Objects.requireNonNull(threadFactory, "threadFactory");
        return this;
    }

    public ActorThreadFactory getThreadFactory() {
        return threadFactory;
    }
}
