package com.agentswarm.workflow;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The research, analysis and report pipeline.
 * Analysis sees the research findings; the report sees both.
 */
public class ResearchWorkflow {

    public static final String NAME = "research";
    public static final String RESEARCH_FINDINGS = "research_findings";
    public static final String ANALYSIS_INSIGHTS = "analysis_insights";
    public static final String FINAL_REPORT = "final_report";

    private final WorkflowDriver driver;

    public ResearchWorkflow(WorkflowDriver driver) {
        this.driver = Objects.requireNonNull(driver, "driver");
    }

    /**
     * Builds the three steps for a topic.
     */
    public static List<WorkflowStep> steps(String topic) {
        return List.of(
                WorkflowStep.of("research", "Research the topic: " + topic
                                + ". Provide comprehensive findings with key insights, trends, and supporting evidence.")
                        .withPayload(payload("research", topic))
                        .withPriority(1)
                        .withOutputKey(RESEARCH_FINDINGS),
                WorkflowStep.of("analysis", "Analyze the research findings on " + topic
                                + ". Identify patterns, correlations, and generate actionable insights.")
                        .withPayload(payload("analysis", topic))
                        .withPriority(2)
                        .withOutputKey(ANALYSIS_INSIGHTS),
                WorkflowStep.of("report", "Generate a comprehensive executive report on " + topic
                                + " based on research and analysis.")
                        .withPayload(payload("report", topic))
                        .withPriority(3)
                        .withOutputKey(FINAL_REPORT));
    }

    public WorkflowResult run(String topic) throws InterruptedException {
        if (topic == null || topic.isBlank()) {
            throw new IllegalArgumentException("Topic must not be blank");
        }
        return driver.execute(NAME, steps(topic));
    }

    private static Map<String, Object> payload(String type, String topic) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("type", type);
        payload.put("topic", topic);
        return payload;
    }
}
