package com.agentswarm;

import com.agentswarm.mailbox.Mailbox;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.function.BiConsumer;

/**
 * Runs an actor's receive loop on a dedicated thread.
 * <p>
 * The loop takes one message at a time in FIFO order and exits once its cancellation scope is
 * cancelled. Cancellation is cooperative: a message being handled is finished first, and messages
 * still queued at that point are left undelivered. Any throwable raised while
 * dispatching is routed to the exception handler and the loop carries on.
 */
class MailboxProcessor {
    private static final Logger logger = LoggerFactory.getLogger(MailboxProcessor.class);

    private final String actorId;
    private final Mailbox<Message> mailbox;
    private final MessageHandler dispatcher;
    private final BiConsumer<Message, Throwable> exceptionHandler;
    private final long pollNanos;
    private final CountDownLatch terminated = new CountDownLatch(1);

    private volatile Thread thread;

    /**
     * Creates a new mailbox processor.
     *
     * @param actorId          The ID of the actor for logging
     * @param mailbox          The mailbox to poll messages from
     * @param dispatcher       Delivers one message to the actor
     * @param exceptionHandler Handler to route message processing errors
     * @param pollInterval     Longest wait on an empty mailbox before re-checking cancellation
     */
    MailboxProcessor(String actorId,
                     Mailbox<Message> mailbox,
                     MessageHandler dispatcher,
                     BiConsumer<Message, Throwable> exceptionHandler,
                     Duration pollInterval) {
        this.actorId = actorId;
        this.mailbox = mailbox;
        this.dispatcher = dispatcher;
        this.exceptionHandler = exceptionHandler;
        this.pollNanos = Math.max(1, pollInterval.toNanos());
    }

    /**
     * Starts the loop on a new thread from the given factory.
     *
     * @param scope         The loop exits once this scope is cancelled
     * @param threadFactory Supplies the loop thread
     */
    void start(CancellationScope scope, ThreadFactory threadFactory) {
        Thread t = threadFactory.newThread(() -> processMailboxLoop(scope));
        thread = t;
        t.start();
        logger.debug("Actor {} loop started on thread {}", actorId, t.getName());
    }

    private void processMailboxLoop(CancellationScope scope) {
        try {
            while (!scope.isCancelled()) {
                Message message;
                try {
                    message = mailbox.poll(pollNanos, TimeUnit.NANOSECONDS);
                } catch (InterruptedException e) {
                    // a stray interrupt (e.g. re-asserted by a handler) must not end the loop
                    continue;
                }
                if (message == null || scope.isCancelled()) {
                    continue;
                }
                try {
                    dispatcher.handle(message);
                } catch (Throwable e) {
                    try {
                        exceptionHandler.accept(message, e);
                    } catch (RuntimeException handlerFailure) {
                        logger.error("Exception handler of actor {} failed", actorId, handlerFailure);
                    }
                }
            }
        } finally {
            logger.debug("Actor {} loop exited", actorId);
            terminated.countDown();
        }
    }

    /**
     * Waits for the loop to exit.
     *
     * @return true if the loop exited within the timeout, or was never started
     */
    boolean awaitTermination(Duration timeout) throws InterruptedException {
        if (thread == null) {
            return true;
        }
        return terminated.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    boolean isLoopThread() {
        return Thread.currentThread() == thread;
    }

    void interrupt() {
        Thread t = thread;
        if (t != null) {
            t.interrupt();
        }
    }
}
