package com.agentswarm.mailbox;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates mailboxes by type.
 */
public final class Mailboxes {

    private static final Logger logger = LoggerFactory.getLogger(Mailboxes.class);

    private Mailboxes() {
    }

    /**
     * Creates a bounded mailbox.
     *
     * @param type     the implementation to use
     * @param capacity the maximum number of queued messages
     * @param <T>      the message type
     * @return a new, empty mailbox
     */
    public static <T> Mailbox<T> bounded(MailboxType type, int capacity) {
        logger.debug("Creating {} mailbox with capacity {}", type, capacity);
        return switch (type) {
            case MPSC -> new MpscMailbox<>(capacity);
            case LINKED -> new LinkedMailbox<>(capacity);
        };
    }
}
