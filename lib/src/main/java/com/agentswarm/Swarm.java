package com.agentswarm;

import com.agentswarm.config.EventBusConfig;
import com.agentswarm.event.EventBus;
import com.agentswarm.event.EventPublisher;
import com.agentswarm.event.EventStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Registry and router for a set of actors, and owner of the event bus they publish to.
 * <p>
 * Tasks are routed round-robin: each {@link #distribute(Task)} starts looking at the actor
 * registered after the one chosen last time, in registration order, and skips stopped actors.
 * Operations applied to every actor try them all and report the failures together.
 */
public class Swarm {

    private static final Logger logger = LoggerFactory.getLogger(Swarm.class);

    private final String name;
    private final EventBus eventBus;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, Actor> actors = new LinkedHashMap<>();
    private final Object routingLock = new Object();
    private int cursor;
    private volatile CancellationScope scope;

    public Swarm() {
        this("swarm");
    }

    public Swarm(String name) {
        this(name, new EventBus(new EventBusConfig()));
    }

    public Swarm(String name, EventBus eventBus) {
        this.name = Objects.requireNonNull(name, "name");
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus");
    }

    public String name() {
        return name;
    }

    /**
     * Adds an actor without starting it. An actor with no event publisher is bound to this swarm's bus.
     *
     * @throws DuplicateActorException if an actor with the same id is registered
     */
    public void register(Actor actor) {
        Objects.requireNonNull(actor, "actor");
        lock.writeLock().lock();
        try {
            if (actors.containsKey(actor.id())) {
                throw new DuplicateActorException(actor.id());
            }
            if (actor.eventPublisher().isEmpty()) {
                actor.setEventPublisher(eventBus);
            }
            actors.put(actor.id(), actor);
        } finally {
            lock.writeLock().unlock();
        }
        logger.info("Registered actor {} in swarm {}", actor.id(), name);
    }

    /**
     * Stops the actor and removes it. A stop failure propagates and the actor stays registered.
     *
     * @throws ActorNotFoundException if no actor has this id
     */
    public void deregister(String actorId) {
        Actor actor = lookup(actorId);
        actor.stop();
        lock.writeLock().lock();
        try {
            actors.remove(actorId, actor);
        } finally {
            lock.writeLock().unlock();
        }
        logger.info("Deregistered actor {} from swarm {}", actorId, name);
    }

    /**
     * Starts every registered actor under one scope shared by the swarm.
     * Actors that fail to start are reported together; the others keep running.
     *
     * @throws SwarmOperationException if any actor failed to start
     */
    public void startAll(CancellationScope parent) {
        Objects.requireNonNull(parent, "parent");
        CancellationScope shared = parent.child();
        this.scope = shared;
        Map<String, ActorException> failures = new LinkedHashMap<>();
        for (Actor actor : snapshot()) {
            try {
                actor.start(shared);
            } catch (ActorException e) {
                logger.error("Failed to start actor {}", actor.id(), e);
                failures.put(actor.id(), e);
            }
        }
        if (!failures.isEmpty()) {
            throw new SwarmOperationException("startAll", failures);
        }
        logger.info("Swarm {} started {} actors", name, size());
    }

    /**
     * Cancels the shared scope and stops every actor.
     *
     * @throws SwarmOperationException if any actor failed to stop cleanly
     */
    public void stopAll() {
        CancellationScope shared = scope;
        if (shared != null) {
            shared.cancel();
        }
        Map<String, ActorException> failures = new LinkedHashMap<>();
        for (Actor actor : snapshot()) {
            try {
                actor.stop();
            } catch (ActorException e) {
                logger.error("Failed to stop actor {}", actor.id(), e);
                failures.put(actor.id(), e);
            }
        }
        if (!failures.isEmpty()) {
            throw new SwarmOperationException("stopAll", failures);
        }
        logger.info("Swarm {} stopped", name);
    }

    /**
     * Sends the task to the next live actor in round-robin order.
     *
     * @return id of the actor the task was sent to
     * @throws NoAvailableActorException if no registered actor is live
     * @throws MailboxFullException      if the chosen actor's mailbox is full
     * @throws ActorStoppedException     if the chosen actor stopped concurrently
     */
    public String distribute(Task task) {
        Objects.requireNonNull(task, "task");
        Actor target = nextAvailable();
        if (target == null) {
            throw new NoAvailableActorException(task.id());
        }
        target.send(Message.task(name, target.id(), task));
        logger.debug("Task {} distributed to {}", task.id(), target.id());
        return target.id();
    }

    private Actor nextAvailable() {
        List<Actor> candidates = snapshot();
        if (candidates.isEmpty()) {
            return null;
        }
        synchronized (routingLock) {
            int n = candidates.size();
            for (int i = 0; i < n; i++) {
                int index = Math.floorMod(cursor + i, n);
                Actor actor = candidates.get(index);
                if (actor.state() != ActorState.STOPPED) {
                    cursor = index + 1;
                    return actor;
                }
            }
        }
        return null;
    }

    /**
     * Sends the message, re-tagged as a broadcast, to every registered actor.
     *
     * @throws SwarmOperationException naming every actor the send failed for
     */
    public void broadcast(Message message) {
        Objects.requireNonNull(message, "message");
        Message broadcast = message.asBroadcast();
        Map<String, ActorException> failures = new LinkedHashMap<>();
        for (Actor actor : snapshot()) {
            try {
                actor.send(broadcast);
            } catch (ActorException e) {
                failures.put(actor.id(), e);
            }
        }
        if (!failures.isEmpty()) {
            logger.warn("Broadcast from {} failed for {}", message.sender(), failures.keySet());
            throw new SwarmOperationException("broadcast", failures);
        }
    }

    /**
     * Sends a message to one named actor.
     *
     * @throws ActorNotFoundException if no actor has this id
     */
    public void send(String recipient, Message message) {
        lookup(recipient).send(message.withRecipient(recipient));
    }

    /**
     * Returns a point-in-time view of each actor's state, in registration order.
     */
    public Map<String, ActorState> status() {
        Map<String, ActorState> status = new LinkedHashMap<>();
        for (Actor actor : snapshot()) {
            status.put(actor.id(), actor.state());
        }
        return Collections.unmodifiableMap(status);
    }

    public List<String> actorIds() {
        lock.readLock().lock();
        try {
            return List.copyOf(actors.keySet());
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return actors.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Read-only access to the event bus, for observers.
     */
    public EventStream events() {
        return eventBus::subscribe;
    }

    /**
     * Publishing access to the event bus, for actors created outside the swarm.
     */
    public EventPublisher publisher() {
        return eventBus::publish;
    }

    /**
     * Stops every actor, then closes the event bus.
     */
    public void shutdown() {
        try {
            stopAll();
        } finally {
            eventBus.close();
        }
    }

    private Actor lookup(String actorId) {
        lock.readLock().lock();
        try {
            Actor actor = actors.get(actorId);
            if (actor == null) {
                throw new ActorNotFoundException(actorId);
            }
            return actor;
        } finally {
            lock.readLock().unlock();
        }
    }

    private List<Actor> snapshot() {
        lock.readLock().lock();
        try {
            return new ArrayList<>(actors.values());
        } finally {
            lock.readLock().unlock();
        }
    }
}
