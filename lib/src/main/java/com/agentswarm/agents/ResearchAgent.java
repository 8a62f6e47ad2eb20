package com.agentswarm.agents;

import com.agentswarm.Task;
import com.agentswarm.completion.CompletionClient;

/**
 * Breaks a topic down and gathers findings.
 */
public class ResearchAgent extends CompletionAgent {

    private static final String SYSTEM_PROMPT = "You are a research specialist agent. Your role is to:\n"
            + "1. Break down the research topic into key questions\n"
            + "2. Gather and synthesize relevant information\n"
            + "3. Identify patterns and insights\n"
            + "4. Present findings clearly with evidence\n\n"
            + "Provide comprehensive, well-structured research output.";

    public ResearchAgent(String actorId, CompletionClient completionClient) {
        super(actorId, completionClient);
    }

    @Override
    public String specialty() {
        return "research";
    }

    @Override
    protected String systemPrompt() {
        return SYSTEM_PROMPT;
    }

    @Override
    protected String userPrompt(Task task) {
        return "Research Task: " + task.description() + "\n\n"
                + "Please provide a thorough research report including:\n"
                + "- Executive summary\n"
                + "- Key findings (3-5 main points)\n"
                + "- Supporting details and evidence\n"
                + "- Trends and patterns identified\n"
                + "- Recommendations for next steps\n\n"
                + "Context from previous tasks:\n" + formatContext(task.context());
    }

    @Override
    protected String failureLabel() {
        return "Research";
    }
}
