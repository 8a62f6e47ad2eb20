package com.agentswarm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A hierarchical cancellation signal.
 * <p>
 * Cancelling a scope cancels every scope derived from it; cancelling a child never affects its parent.
 * Cancellation is permanent and idempotent. A child derived from an already-cancelled scope starts cancelled.
 */
public final class CancellationScope {

    private static final Logger logger = LoggerFactory.getLogger(CancellationScope.class);

    private final CancellationScope parent;
    private final Object lock = new Object();
    private final Set<CancellationScope> children = new LinkedHashSet<>();
    private final List<Runnable> callbacks = new ArrayList<>();
    private volatile boolean cancelled;

    private CancellationScope(CancellationScope parent) {
        this.parent = parent;
    }

    /**
     * Creates a new scope with no parent.
     */
    public static CancellationScope root() {
        return new CancellationScope(null);
    }

    /**
     * Derives a child scope that is cancelled whenever this scope is.
     */
    public CancellationScope child() {
        CancellationScope child = new CancellationScope(this);
        synchronized (lock) {
            if (!cancelled) {
                children.add(child);
                return child;
            }
        }
        child.cancel();
        return child;
    }

    /**
     * Cancels this scope and all of its descendants.
     */
    public void cancel() {
        List<CancellationScope> toCancel;
        List<Runnable> toRun;
        synchronized (lock) {
            if (cancelled) {
                return;
            }
            cancelled = true;
            toCancel = new ArrayList<>(children);
            toRun = new ArrayList<>(callbacks);
            children.clear();
            callbacks.clear();
        }
        for (CancellationScope child : toCancel) {
            child.cancel();
        }
        for (Runnable callback : toRun) {
            runCallback(callback);
        }
        if (parent != null) {
            parent.detach(this);
        }
    }

    public boolean isCancelled() {
        return cancelled;
    }

    /**
     * Registers a callback to run once when this scope is cancelled.
     * Runs immediately on the calling thread if the scope is already cancelled.
     */
    public void onCancel(Runnable callback) {
        synchronized (lock) {
            if (!cancelled) {
                callbacks.add(callback);
                return;
            }
        }
        runCallback(callback);
    }

    private void detach(CancellationScope child) {
        synchronized (lock) {
            children.remove(child);
        }
    }

    private static void runCallback(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            logger.error("Cancellation callback failed", e);
        }
    }
}
