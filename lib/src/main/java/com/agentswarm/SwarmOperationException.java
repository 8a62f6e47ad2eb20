package com.agentswarm;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Aggregates per-actor failures from an operation applied to the whole swarm.
 * Each failure is also attached as a suppressed exception.
 */
public class SwarmOperationException extends ActorException {

    private final String operation;
    private final Map<String, ActorException> failures;

    public SwarmOperationException(String operation, Map<String, ActorException> failures) {
        super(operation + " failed for " + failures.size() + " actor(s): " + failures.keySet());
        this.operation = operation;
        this.failures = Collections.unmodifiableMap(new LinkedHashMap<>(failures));
        failures.values().forEach(this::addSuppressed);
    }

    public String getOperation() {
        return operation;
    }

    /**
     * Returns the failures keyed by actor id, in the order they occurred.
     */
    public Map<String, ActorException> getFailures() {
        return failures;
    }
}
