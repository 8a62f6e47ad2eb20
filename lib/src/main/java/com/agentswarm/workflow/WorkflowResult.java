package com.agentswarm.workflow;

import com.agentswarm.TaskResult;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Outcome of one workflow run.
 */
public final class WorkflowResult {

    private final String name;
    private final String runId;
    private final Map<String, TaskResult> stepResults;
    private final Map<String, Object> outputs;
    private final String failedStep;
    private final Instant startedAt;
    private final Instant finishedAt;

    private WorkflowResult(String name,
                           String runId,
                           Map<String, TaskResult> stepResults,
                           Map<String, Object> outputs,
                           String failedStep,
                           Instant startedAt,
                           Instant finishedAt) {
        this.name = name;
        this.runId = runId;
        this.stepResults = Collections.unmodifiableMap(new LinkedHashMap<>(stepResults));
        this.outputs = Collections.unmodifiableMap(new LinkedHashMap<>(outputs));
        this.failedStep = failedStep;
        this.startedAt = startedAt;
        this.finishedAt = finishedAt;
    }

    static WorkflowResult completed(String name, String runId, Map<String, TaskResult> stepResults,
                                    Map<String, Object> outputs, Instant startedAt) {
        return new WorkflowResult(name, runId, stepResults, outputs, null, startedAt, Instant.now());
    }

    static WorkflowResult failed(String name, String runId, Map<String, TaskResult> stepResults,
                                 Map<String, Object> outputs, String failedStep, Instant startedAt) {
        return new WorkflowResult(name, runId, stepResults, outputs, failedStep, startedAt, Instant.now());
    }

    public String name() {
        return name;
    }

    public String runId() {
        return runId;
    }

    public boolean success() {
        return failedStep == null;
    }

    /**
     * Results of every step that ran, in execution order.
     */
    public Map<String, TaskResult> stepResults() {
        return stepResults;
    }

    /**
     * Outputs of the successful steps, keyed by each step's output key.
     */
    public Map<String, Object> outputs() {
        return outputs;
    }

    public Optional<String> failedStep() {
        return Optional.ofNullable(failedStep);
    }

    /**
     * The failing step's result, if the run failed.
     */
    public Optional<TaskResult> failure() {
        return failedStep == null ? Optional.empty() : Optional.of(stepResults.get(failedStep));
    }

    /**
     * Output of the last step, if the run succeeded and had any steps.
     */
    public Optional<Object> finalOutput() {
        if (!success() || stepResults.isEmpty()) {
            return Optional.empty();
        }
        TaskResult last = null;
        for (TaskResult result : stepResults.values()) {
            last = result;
        }
        return Optional.ofNullable(last.data());
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Instant finishedAt() {
        return finishedAt;
    }

    public Duration duration() {
        return Duration.between(startedAt, finishedAt);
    }

    @Override
    public String toString() {
        return "WorkflowResult{" + name + "-" + runId + ", success=" + success()
                + (failedStep == null ? "" : ", failedStep=" + failedStep)
                + ", steps=" + stepResults.keySet() + ", duration=" + duration().toMillis() + "ms}";
    }
}
