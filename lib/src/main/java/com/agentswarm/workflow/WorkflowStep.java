package com.agentswarm.workflow;

import java.time.Duration;
import java.util.Objects;

/**
 * One step of a sequential workflow.
 *
 * @param name        step name, unique within the workflow
 * @param description task description handed to the actor
 * @param payload     task payload
 * @param priority    task priority
 * @param outputKey   context key later steps find this step's output under
 * @param timeout     deadline for this step, or null for the driver's default
 */
public record WorkflowStep(String name,
                           String description,
                           Object payload,
                           int priority,
                           String outputKey,
                           Duration timeout) {

    public WorkflowStep {
        Objects.requireNonNull(name, "name");
        description = description == null ? name : description;
        outputKey = outputKey == null ? name + "_output" : outputKey;
    }

    public static WorkflowStep of(String name, String description) {
        return new WorkflowStep(name, description, null, 0, null, null);
    }

    public WorkflowStep withPayload(Object payload) {
        return new WorkflowStep(name, description, payload, priority, outputKey, timeout);
    }

    public WorkflowStep withPriority(int priority) {
        return new WorkflowStep(name, description, payload, priority, outputKey, timeout);
    }

    public WorkflowStep withOutputKey(String outputKey) {
        return new WorkflowStep(name, description, payload, priority, outputKey, timeout);
    }

    public WorkflowStep withTimeout(Duration timeout) {
        return new WorkflowStep(name, description, payload, priority, outputKey, timeout);
    }
}
