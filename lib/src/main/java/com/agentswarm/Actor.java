package com.agentswarm;

import com.agentswarm.config.ActorConfig;
import com.agentswarm.event.Event;
import com.agentswarm.event.EventKind;
import com.agentswarm.event.EventPublisher;
import com.agentswarm.mailbox.Mailbox;
import com.agentswarm.mailbox.Mailboxes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * An independently scheduled unit of work with a private bounded mailbox.
 * <p>
 * Once started, the actor handles its messages one at a time, in the order they were sent, on its
 * own thread. Handler code can therefore use actor-local fields without locking. Sending never
 * blocks: a full mailbox or a stopped actor fails the send immediately.
 * <p>
 * Messages are dispatched to the handler registered for their {@link MessageType}. Without one,
 * task messages go through {@link #processTask(Task)} and everything else is logged. Subclasses
 * normally override {@code processTask} to do their real work.
 */
public class Actor {

    private static final Logger logger = LoggerFactory.getLogger(Actor.class);

    private final String actorId;
    private final ActorConfig config;
    private final Mailbox<Message> mailbox;
    // Per-actor logger with actor ID context
    private final Logger actorLogger;

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<MessageType, MessageHandler> handlers = new EnumMap<>(MessageType.class);
    private final Object stopMonitor = new Object();

    private ActorState state = ActorState.IDLE;
    private CancellationScope scope;
    private MailboxProcessor mailboxProcessor;
    private volatile EventPublisher eventPublisher;

    public Actor(String actorId) {
        this(actorId, new ActorConfig());
    }

    public Actor(String actorId, ActorConfig config) {
        this(actorId, config, null);
    }

    /**
     * Creates a new idle actor.
     *
     * @param actorId        Unique, immutable identifier
     * @param config         Mailbox and run-loop settings
     * @param eventPublisher Where lifecycle events go, or null to bind later
     */
    public Actor(String actorId, ActorConfig config, EventPublisher eventPublisher) {
        if (actorId == null || actorId.isBlank()) {
            throw new IllegalArgumentException("Actor id must not be blank");
        }
        this.actorId = actorId;
        this.config = Objects.requireNonNull(config, "config");
        this.mailbox = Mailboxes.bounded(config.getMailboxType(), config.getMailboxCapacity());
        this.actorLogger = LoggerFactory.getLogger(getClass().getName() + "." + actorId);
        this.eventPublisher = eventPublisher;
        logger.debug("Actor {} created with {} mailbox of capacity {}",
                actorId, config.getMailboxType(), config.getMailboxCapacity());
    }

    public String id() {
        return actorId;
    }

    public ActorState state() {
        lock.readLock().lock();
        try {
            return state;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Starts the run loop under a scope derived from {@code parent}. Returns without waiting
     * for the loop to begin.
     *
     * @throws ActorAlreadyRunningException if the actor is not idle
     * @throws ActorException                if {@link #preStart()} fails; the actor stays idle
     */
    public void start(CancellationScope parent) {
        Objects.requireNonNull(parent, "parent");
        lock.writeLock().lock();
        try {
            if (state != ActorState.IDLE) {
                throw new ActorAlreadyRunningException(actorId, state);
            }
            CancellationScope runScope = parent.child();
            try {
                preStart();
            } catch (RuntimeException e) {
                runScope.cancel();
                throw new ActorException("Actor " + actorId + " failed in preStart", e, actorId);
            }
            scope = runScope;
            state = ActorState.PROCESSING;
            mailboxProcessor = new MailboxProcessor(
                    actorId, mailbox, this::dispatch, this::onHandlerError, config.getPollInterval());
            mailboxProcessor.start(scope, config.getThreadFactory().createThreadFactory(actorId));
        } finally {
            lock.writeLock().unlock();
        }
        logger.info("Actor {} started", actorId);
    }

    /**
     * Stops the actor. Waits for the run loop to finish the message it is handling, then marks the
     * actor stopped and closes its mailbox. Calling this on a stopped actor does nothing.
     * <p>
     * When called from the actor's own handler the loop is not joined; it exits after the
     * current message.
     *
     * @throws ActorStopException if the loop did not exit within the shutdown timeout; the actor is
     *                            stopped regardless
     */
    public void stop() {
        MailboxProcessor processor = currentProcessor();
        if (processor != null && processor.isLoopThread()) {
            scope.cancel();
            finishStop();
            return;
        }
        synchronized (stopMonitor) {
            CancellationScope runScope;
            lock.readLock().lock();
            try {
                if (state == ActorState.STOPPED) {
                    return;
                }
                runScope = scope;
                processor = mailboxProcessor;
            } finally {
                lock.readLock().unlock();
            }
            if (processor == null) {
                finishStop();
                return;
            }

            logger.debug("Stopping actor {}", actorId);
            runScope.cancel();
            Duration timeout = config.getShutdownTimeout();
            ActorStopException failure = null;
            try {
                if (!processor.awaitTermination(timeout)) {
                    actorLogger.warn("Run loop did not exit within {}ms, interrupting", timeout.toMillis());
                    processor.interrupt();
                    failure = new ActorStopException(actorId, "run loop still busy after " + timeout.toMillis() + "ms");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                failure = new ActorStopException(actorId, "interrupted while waiting for the run loop", e);
            }
            finishStop();
            if (failure != null) {
                throw failure;
            }
        }
    }

    private MailboxProcessor currentProcessor() {
        lock.readLock().lock();
        try {
            return mailboxProcessor;
        } finally {
            lock.readLock().unlock();
        }
    }

    private void finishStop() {
        lock.writeLock().lock();
        try {
            if (state == ActorState.STOPPED) {
                return;
            }
            state = ActorState.STOPPED;
            mailbox.close();
        } finally {
            lock.writeLock().unlock();
        }
        postStop();
        logger.info("Actor {} stopped", actorId);
    }

    /**
     * Enqueues a message without blocking.
     *
     * @throws ActorStoppedException if the actor has been stopped
     * @throws MailboxFullException  if the mailbox has no free slot
     */
    public void send(Message message) {
        Objects.requireNonNull(message, "message");
        lock.readLock().lock();
        try {
            if (state == ActorState.STOPPED) {
                throw new ActorStoppedException(actorId);
            }
            if (!mailbox.offer(message)) {
                if (mailbox.isClosed()) {
                    throw new ActorStoppedException(actorId);
                }
                throw new MailboxFullException(actorId, mailbox.capacity());
            }
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Takes the next message without waiting, bypassing the run loop.
     */
    public Optional<Message> tryReceive() {
        return Optional.ofNullable(mailbox.poll());
    }

    /**
     * Registers the handler for a message type, replacing any earlier one. Safe to call while running.
     */
    public void registerHandler(MessageType type, MessageHandler handler) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(handler, "handler");
        lock.writeLock().lock();
        try {
            handlers.put(type, handler);
        } finally {
            lock.writeLock().unlock();
        }
    }

    private MessageHandler handlerFor(MessageType type) {
        lock.readLock().lock();
        try {
            return handlers.get(type);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Performs a task. The default implementation succeeds without doing anything.
     */
    public TaskResult processTask(Task task) {
        return TaskResult.success(task.id(), "Agent " + actorId + " processed task " + task.id());
    }

    /**
     * Called with the actor's lock held, just before the run loop is launched.
     * If it throws, the actor stays idle and may be started again.
     */
    protected void preStart() {
        // Default implementation does nothing
    }

    /**
     * Called once, after the actor has been marked stopped.
     * Override to perform cleanup logic.
     */
    protected void postStop() {
        // Default implementation does nothing
    }

    private void dispatch(Message message) throws Exception {
        MessageHandler handler = handlerFor(message.type());
        if (handler != null) {
            handler.handle(message);
            return;
        }
        message.payload().accept(new DefaultBehaviour(message));
    }

    /**
     * Reports a failure raised while handling a message. The actor keeps running.
     */
    protected void onHandlerError(Message message, Throwable error) {
        actorLogger.error("Handler for {} message from {} failed", message.type(), message.sender(), error);
        if (message.payload() instanceof Payload.TaskAssignment assignment) {
            String taskId = assignment.task().id();
            publish(Event.of(EventKind.TASK_FAILED, actorId, taskId,
                    "Handler failed: " + error.getMessage(), TaskResult.handlerError(taskId, error)));
        } else {
            publish(Event.of(EventKind.CUSTOM, actorId, null,
                    "Handler for " + message.type() + " failed: " + error.getMessage(), error));
        }
    }

    private void handleTask(Task task) {
        publish(Event.of(EventKind.TASK_RECEIVED, actorId, task.id(), "Received task: " + task.description()));
        publish(Event.of(EventKind.TASK_STARTED, actorId, task.id(), "Started task " + task.id()));

        TaskResult result;
        try {
            result = processTask(task);
            if (result == null) {
                result = TaskResult.failure(task.id(), "processTask returned no result");
            }
        } catch (RuntimeException e) {
            actorLogger.error("Task {} threw", task.id(), e);
            result = TaskResult.handlerError(task.id(), e);
        }

        if (result.success()) {
            actorLogger.debug("Task {} completed", task.id());
            publish(Event.of(EventKind.TASK_COMPLETED, actorId, task.id(), "Completed task " + task.id(), result));
        } else {
            actorLogger.warn("Task {} failed: {}", task.id(), result.errorMessage());
            publish(Event.of(EventKind.TASK_FAILED, actorId, task.id(),
                    "Task " + task.id() + " failed: " + result.errorMessage(), result));
        }
    }

    private void handleOther(Message message) {
        actorLogger.info("Received {} message from {}", message.type(), message.sender());
        publish(Event.of(EventKind.MESSAGE, actorId, null,
                "Received " + message.type() + " from " + message.sender(), message.payload()));
    }

    /**
     * Publishes an event if the actor is bound to a publisher.
     */
    protected void publish(Event event) {
        EventPublisher publisher = eventPublisher;
        if (publisher != null) {
            publisher.publish(event);
        }
    }

    public Optional<EventPublisher> eventPublisher() {
        return Optional.ofNullable(eventPublisher);
    }

    public void setEventPublisher(EventPublisher eventPublisher) {
        this.eventPublisher = eventPublisher;
    }

    public int mailboxSize() {
        return mailbox.size();
    }

    public int capacity() {
        return mailbox.capacity();
    }

    /**
     * Gets a logger for this actor with the actor ID as context.
     *
     * @return A logger instance configured for this actor
     */
    public Logger getLogger() {
        return actorLogger;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + actorId + ", " + state() + "]";
    }

    private final class DefaultBehaviour implements PayloadVisitor<Void> {
        private final Message message;

        DefaultBehaviour(Message message) {
            this.message = message;
        }

        @Override
        public Void visitTask(Payload.TaskAssignment payload) {
            handleTask(payload.task());
            return null;
        }

        @Override
        public Void visitResult(Payload.TaskReport payload) {
            handleOther(message);
            return null;
        }

        @Override
        public Void visitBroadcast(Payload.Broadcast payload) {
            handleOther(message);
            return null;
        }

        @Override
        public Void visitQuery(Payload.Query payload) {
            handleOther(message);
            return null;
        }
    }
}
