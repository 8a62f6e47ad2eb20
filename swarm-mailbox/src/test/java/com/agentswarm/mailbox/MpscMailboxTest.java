package com.agentswarm.mailbox;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MpscMailboxTest extends BoundedMailboxContract {

    @Override
    protected Mailbox<String> create(int capacity) {
        return new MpscMailbox<>(capacity);
    }

    @Test
    void testCapacityIsExactEvenWhenNotAPowerOfTwo() {
        MpscMailbox<String> mailbox = new MpscMailbox<>(3);
        assertTrue(mailbox.offer("a"));
        assertTrue(mailbox.offer("b"));
        assertTrue(mailbox.offer("c"));
        assertFalse(mailbox.offer("d"));
    }

    @Test
    void testSingleSlotMailbox() {
        MpscMailbox<String> mailbox = new MpscMailbox<>(1);
        assertTrue(mailbox.offer("only"));
        assertFalse(mailbox.offer("second"));
        assertEquals("only", mailbox.poll());
        assertTrue(mailbox.offer("second"));
    }

    @Test
    void testRejectsNonPositiveCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new MpscMailbox<String>(0));
    }
}
