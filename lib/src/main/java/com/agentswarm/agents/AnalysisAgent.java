package com.agentswarm.agents;

import com.agentswarm.Task;
import com.agentswarm.completion.CompletionClient;

/**
 * Looks for patterns and insights in earlier findings.
 */
public class AnalysisAgent extends CompletionAgent {

    private static final String SYSTEM_PROMPT = "You are a data analysis specialist agent. Your role is to:\n"
            + "1. Assess data quality and completeness\n"
            + "2. Identify patterns, trends, and anomalies\n"
            + "3. Apply analytical techniques\n"
            + "4. Generate actionable insights\n\n"
            + "Provide thorough, evidence-based analysis.";

    public AnalysisAgent(String actorId, CompletionClient completionClient) {
        super(actorId, completionClient);
    }

    @Override
    public String specialty() {
        return "analysis";
    }

    @Override
    protected String systemPrompt() {
        return SYSTEM_PROMPT;
    }

    @Override
    protected String userPrompt(Task task) {
        return "Analysis Task: " + task.description() + "\n\n"
                + "Data/Research to analyze:\n" + formatContext(task.context()) + "\n\n"
                + "Please provide a comprehensive analysis including:\n"
                + "- Data quality assessment\n"
                + "- Key patterns and trends identified\n"
                + "- Statistical insights\n"
                + "- Correlations and relationships\n"
                + "- Actionable recommendations\n"
                + "- Confidence levels in findings";
    }

    @Override
    protected String failureLabel() {
        return "Analysis";
    }
}
