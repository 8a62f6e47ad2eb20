package com.agentswarm.mailbox;

/**
 * Available bounded mailbox implementations.
 */
public enum MailboxType {
    /**
     * JCTools multi-producer single-consumer array queue. Default.
     */
    MPSC,

    /**
     * {@link java.util.concurrent.LinkedBlockingQueue} with a fixed bound.
     */
    LINKED
}
