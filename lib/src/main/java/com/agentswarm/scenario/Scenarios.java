package com.agentswarm.scenario;

import com.agentswarm.Task;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ready-made scenarios.
 */
public final class Scenarios {

    public static final String DEFAULT_TOPIC = "artificial intelligence";
    public static final int DEFAULT_PARALLEL_COUNT = 10;
    public static final int DEFAULT_STRESS_COUNT = 50;

    private Scenarios() {
    }

    /**
     * Research, analysis and report tasks for a topic, each listing the ones before it as dependencies.
     */
    public static Scenario researchAnalysis(String topic) {
        List<Task> tasks = List.of(
                Task.builder("research-001")
                        .description("Research the topic: " + topic
                                + ". Provide comprehensive findings with key insights, trends, and supporting evidence.")
                        .priority(1)
                        .payload(payload("research", topic, "researcher"))
                        .build(),
                Task.builder("analyze-001")
                        .description("Analyze the research findings on " + topic
                                + ". Identify patterns, correlations, and generate actionable insights.")
                        .priority(2)
                        .payload(payload("analysis", topic, "analyzer"))
                        .dependencies(List.of("research-001"))
                        .build(),
                Task.builder("report-001")
                        .description("Generate a comprehensive executive report on " + topic
                                + " based on research and analysis.")
                        .priority(3)
                        .payload(payload("report", topic, "reporter"))
                        .dependencies(List.of("research-001", "analyze-001"))
                        .build());
        return new Scenario("Research & Analysis Workflow",
                "Complete research and analysis pipeline for: " + topic, tasks);
    }

    /**
     * {@code count} independent tasks with ids {@code parallel-001} onwards.
     */
    public static Scenario parallelProcessing(int count) {
        requirePositive(count);
        List<Task> tasks = new ArrayList<>(count);
        for (int i = 1; i <= count; i++) {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("batch", i);
            payload.put("timestamp", Instant.now());
            tasks.add(Task.builder(String.format("parallel-%03d", i))
                    .description("Parallel task #" + i + ": Process data batch")
                    .priority(1)
                    .payload(payload)
                    .build());
        }
        return new Scenario("Parallel Task Processing",
                "Process " + count + " tasks in parallel across available workers", tasks);
    }

    /**
     * {@code count} tasks with ids {@code stress-0001} onwards and priorities cycling 1, 2, 3.
     */
    public static Scenario stressTest(int count) {
        requirePositive(count);
        List<Task> tasks = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            int priority = (i % 3) + 1;
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("index", i);
            payload.put("priority", priority);
            tasks.add(Task.builder(String.format("stress-%04d", i + 1))
                    .description("Stress test task #" + (i + 1))
                    .priority(priority)
                    .payload(payload)
                    .build());
        }
        return new Scenario("Stress Test", "Process " + count + " tasks to test swarm capacity", tasks);
    }

    /**
     * Looks up a scenario by name: {@code research} (param {@code topic}), {@code parallel} and
     * {@code stress} (param {@code count}). Missing or mistyped params fall back to the defaults;
     * an unknown name yields a single {@code default-001} task.
     */
    public static Scenario template(String name, Map<String, Object> params) {
        Map<String, Object> values = params == null ? Map.of() : params;
        switch (String.valueOf(name)) {
            case "research": {
                Object topic = values.get("topic");
                return researchAnalysis(topic instanceof String ? (String) topic : DEFAULT_TOPIC);
            }
            case "parallel":
                return parallelProcessing(count(values, DEFAULT_PARALLEL_COUNT));
            case "stress":
                return stressTest(count(values, DEFAULT_STRESS_COUNT));
            default:
                return new Scenario("Default Scenario", "Simple task processing",
                        List.of(Task.builder("default-001").description("Default task").priority(1).build()));
        }
    }

    public static Scenario custom(String name, String description, List<Task> tasks) {
        return new Scenario(name, description, tasks);
    }

    private static Map<String, Object> payload(String type, String topic, String agentType) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("type", type);
        payload.put("topic", topic);
        payload.put("agent_type", agentType);
        return payload;
    }

    private static int count(Map<String, Object> params, int fallback) {
        Object count = params.get("count");
        return count instanceof Integer ? (Integer) count : fallback;
    }

    private static void requirePositive(int count) {
        if (count < 1) {
            throw new IllegalArgumentException("Task count must be positive, got " + count);
        }
    }
}
