package com.agentswarm.scenario;

import com.agentswarm.ActorException;
import com.agentswarm.Swarm;
import com.agentswarm.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.BiConsumer;

/**
 * A named batch of tasks to push through a swarm.
 *
 * @param name        display name
 * @param description what the batch exercises
 * @param tasks       the tasks, distributed in list order
 */
public record Scenario(String name, String description, List<Task> tasks) {

    private static final Logger logger = LoggerFactory.getLogger(Scenario.class);

    public Scenario {
        Objects.requireNonNull(name, "name");
        description = description == null ? "" : description;
        tasks = List.copyOf(tasks);
    }

    /**
     * Distributes every task, carrying on past failures.
     *
     * @return the distribution failure of each task that could not be placed, keyed by task id
     */
    public Map<String, ActorException> distributeAll(Swarm swarm) {
        return distributeAll(swarm, (done, total) -> { });
    }

    /**
     * Distributes every task, reporting progress after each attempt.
     *
     * @param progress called with (tasks attempted, total tasks)
     */
    public Map<String, ActorException> distributeAll(Swarm swarm, BiConsumer<Integer, Integer> progress) {
        logger.info("Executing scenario {} with {} tasks", name, tasks.size());
        Map<String, ActorException> failures = new LinkedHashMap<>();
        int attempted = 0;
        for (Task task : tasks) {
            try {
                swarm.distribute(task);
            } catch (ActorException e) {
                logger.warn("Could not distribute task {}: {}", task.id(), e.getMessage());
                failures.put(task.id(), e);
            }
            progress.accept(++attempted, tasks.size());
        }
        logger.info("Scenario {} distributed {}/{} tasks", name, tasks.size() - failures.size(), tasks.size());
        return failures;
    }
}
