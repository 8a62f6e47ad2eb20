package com.agentswarm.mailbox;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Behaviour every bounded mailbox must share. Concrete test classes supply the implementation.
 */
abstract class BoundedMailboxContract {

    protected abstract Mailbox<String> create(int capacity);

    @Test
    void testOfferRejectsNull() {
        Mailbox<String> mailbox = create(4);
        assertThrows(NullPointerException.class, () -> mailbox.offer(null));
    }

    @Test
    void testMessagesComeOutInInsertionOrder() {
        Mailbox<String> mailbox = create(10);
        for (int i = 0; i < 10; i++) {
            assertTrue(mailbox.offer("m" + i));
        }
        for (int i = 0; i < 10; i++) {
            assertEquals("m" + i, mailbox.poll());
        }
        assertNull(mailbox.poll());
    }

    @Test
    void testOfferFailsOnceCapacityIsReached() {
        Mailbox<String> mailbox = create(100);
        for (int i = 0; i < 100; i++) {
            assertTrue(mailbox.offer("m" + i), "offer " + i + " should succeed");
        }
        assertFalse(mailbox.offer("overflow"));
        assertEquals(100, mailbox.size());
        assertEquals(0, mailbox.remainingCapacity());
        assertEquals(100, mailbox.capacity());

        assertEquals("m0", mailbox.poll());
        assertTrue(mailbox.offer("after-poll"));
    }

    @Test
    void testPollWithTimeoutReturnsNullWhenEmpty() throws InterruptedException {
        Mailbox<String> mailbox = create(4);

        long start = System.nanoTime();
        String result = mailbox.poll(100, TimeUnit.MILLISECONDS);
        long elapsed = System.nanoTime() - start;

        assertNull(result);
        assertTrue(elapsed >= TimeUnit.MILLISECONDS.toNanos(90));
    }

    @Test
    @Timeout(5)
    void testPollWithTimeoutWakesUpOnOffer() throws Exception {
        Mailbox<String> mailbox = create(4);
        CountDownLatch started = new CountDownLatch(1);
        List<String> received = new ArrayList<>();

        Thread consumer = new Thread(() -> {
            started.countDown();
            try {
                received.add(mailbox.poll(3, TimeUnit.SECONDS));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        consumer.start();
        started.await();
        Thread.sleep(50);
        mailbox.offer("wake");
        consumer.join(2000);

        assertEquals(List.of("wake"), received);
    }

    @Test
    void testCloseDiscardsPendingAndRejectsFurtherOffers() throws InterruptedException {
        Mailbox<String> mailbox = create(4);
        mailbox.offer("a");
        mailbox.offer("b");

        mailbox.close();

        assertTrue(mailbox.isClosed());
        assertTrue(mailbox.isEmpty());
        assertFalse(mailbox.offer("c"));
        assertNull(mailbox.poll());
        assertNull(mailbox.poll(10, TimeUnit.MILLISECONDS));
    }

    @Test
    void testClearEmptiesMailbox() {
        Mailbox<String> mailbox = create(4);
        mailbox.offer("a");
        mailbox.offer("b");

        mailbox.clear();

        assertEquals(0, mailbox.size());
        assertEquals(4, mailbox.remainingCapacity());
        assertFalse(mailbox.isClosed());
    }

    @Test
    @Timeout(10)
    void testConcurrentProducersNeverExceedCapacity() throws Exception {
        int capacity = 50;
        Mailbox<String> mailbox = create(capacity);
        int producers = 8;
        AtomicInteger accepted = new AtomicInteger();
        CountDownLatch go = new CountDownLatch(1);
        List<Thread> threads = new ArrayList<>();

        for (int p = 0; p < producers; p++) {
            final int id = p;
            Thread t = new Thread(() -> {
                try {
                    go.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
                for (int i = 0; i < 100; i++) {
                    if (mailbox.offer("p" + id + "-" + i)) {
                        accepted.incrementAndGet();
                    }
                }
            });
            threads.add(t);
            t.start();
        }
        go.countDown();
        for (Thread t : threads) {
            t.join();
        }

        assertEquals(capacity, accepted.get());
        assertEquals(capacity, mailbox.size());
    }
}
