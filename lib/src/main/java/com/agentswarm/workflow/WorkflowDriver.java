package com.agentswarm.workflow;

import com.agentswarm.ActorException;
import com.agentswarm.Swarm;
import com.agentswarm.Task;
import com.agentswarm.TaskResult;
import com.agentswarm.config.WorkflowConfig;
import com.agentswarm.event.Event;
import com.agentswarm.event.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Runs dependent steps one after another through a {@link Swarm}.
 * <p>
 * Each step becomes a task whose context holds the outputs of every earlier step. The driver
 * distributes it, then waits on the swarm's event stream for that task's terminal event or the
 * step deadline, whichever comes first. The first failed or timed-out step ends the run.
 * <p>
 * A timed-out task is not cancelled: its actor may still finish it later, and that late result
 * is published to the bus without any workflow consuming it.
 */
public class WorkflowDriver {

    private static final Logger logger = LoggerFactory.getLogger(WorkflowDriver.class);

    private final Swarm swarm;
    private final WorkflowConfig config;

    public WorkflowDriver(Swarm swarm) {
        this(swarm, new WorkflowConfig());
    }

    public WorkflowDriver(Swarm swarm, WorkflowConfig config) {
        this.swarm = Objects.requireNonNull(swarm, "swarm");
        this.config = Objects.requireNonNull(config, "config");
    }

    /**
     * Executes the steps in order.
     *
     * @param workflowName name used in task ids and logs
     * @param steps        the steps, run strictly in list order
     * @return the outcome; a failed or timed-out step is reported here, not thrown
     * @throws IllegalArgumentException if two steps share a name or an output key
     * @throws WorkflowException    if a step could not be distributed
     * @throws InterruptedException if interrupted while waiting for a step
     */
    public WorkflowResult execute(String workflowName, List<WorkflowStep> steps) throws InterruptedException {
        Objects.requireNonNull(workflowName, "workflowName");
        Objects.requireNonNull(steps, "steps");
        validateSteps(workflowName, steps);
        String runId = UUID.randomUUID().toString().substring(0, 8);
        Instant startedAt = Instant.now();

        Map<String, Object> outputs = new LinkedHashMap<>();
        Map<String, TaskResult> stepResults = new LinkedHashMap<>();
        List<String> previousTaskIds = new ArrayList<>();

        logger.info("Starting workflow {} run {} with {} steps", workflowName, runId, steps.size());
        for (WorkflowStep step : steps) {
            Task task = Task.builder(workflowName + "-" + runId + "-" + step.name())
                    .description(step.description())
                    .payload(step.payload())
                    .priority(step.priority())
                    .context(outputs)
                    .dependencies(previousTaskIds)
                    .build();
            Duration deadline = step.timeout() != null ? step.timeout() : config.getStepTimeout();

            logger.info("Workflow {} step {}: distributing task {}", workflowName, step.name(), task.id());
            TaskResult result = runStep(workflowName, step, task, deadline);
            stepResults.put(step.name(), result);

            if (!result.success()) {
                logger.warn("Workflow {} failed at step {}: {}", workflowName, step.name(), result.errorMessage());
                return WorkflowResult.failed(workflowName, runId, stepResults, outputs, step.name(), startedAt);
            }
            outputs.put(step.outputKey(), result.data());
            previousTaskIds.add(task.id());
            logger.info("Workflow {} step {} completed", workflowName, step.name());
        }

        WorkflowResult result = WorkflowResult.completed(workflowName, runId, stepResults, outputs, startedAt);
        logger.info("Workflow {} run {} completed in {}ms", workflowName, runId, result.duration().toMillis());
        return result;
    }

    private static void validateSteps(String workflowName, List<WorkflowStep> steps) {
        Set<String> names = new HashSet<>();
        Set<String> outputKeys = new HashSet<>();
        for (WorkflowStep step : steps) {
            Objects.requireNonNull(step, "step");
            if (!names.add(step.name())) {
                throw new IllegalArgumentException(
                        "Workflow " + workflowName + " has more than one step named " + step.name());
            }
            if (!outputKeys.add(step.outputKey())) {
                throw new IllegalArgumentException(
                        "Workflow " + workflowName + " has more than one step writing output key " + step.outputKey());
            }
        }
    }

    private TaskResult runStep(String workflowName, WorkflowStep step, Task task, Duration deadline)
            throws InterruptedException {
        // subscribe first so a fast actor cannot finish before we listen
        try (Subscription subscription = swarm.events().subscribe()) {
            String actorId;
            try {
                actorId = swarm.distribute(task);
            } catch (ActorException e) {
                throw new WorkflowException(workflowName, step.name(), e);
            }
            logger.debug("Task {} accepted by {}", task.id(), actorId);
            return awaitCompletion(subscription, task.id(), deadline);
        }
    }

    private TaskResult awaitCompletion(Subscription subscription, String taskId, Duration deadline)
            throws InterruptedException {
        long deadlineNanos = System.nanoTime() + deadline.toNanos();
        long pollNanos = Math.max(1, config.getPollInterval().toNanos());
        while (true) {
            long remaining = deadlineNanos - System.nanoTime();
            if (remaining <= 0) {
                logger.warn("Task {} did not finish within {}ms, abandoning it", taskId, deadline.toMillis());
                return TaskResult.timeout(taskId, deadline);
            }
            Optional<Event> next = subscription.poll(Duration.ofNanos(Math.min(remaining, pollNanos)));
            if (next.isEmpty() && subscription.isClosed()) {
                // closed streams accept nothing new, so one last look drains the buffer
                next = subscription.tryPoll();
                if (next.isEmpty()) {
                    return TaskResult.failure(taskId, "Event stream closed while waiting for task " + taskId);
                }
            }
            if (next.isEmpty()) {
                continue;
            }
            Event event = next.get();
            if (!event.concerns(taskId) || !event.kind().isTerminal()) {
                continue;
            }
            return event.result().orElseGet(() -> synthesize(event, taskId));
        }
    }

    private static TaskResult synthesize(Event event, String taskId) {
        switch (event.kind()) {
            case TASK_COMPLETED:
                return TaskResult.success(taskId, event.message());
            default:
                return TaskResult.failure(taskId, event.message());
        }
    }
}
