package com.agentswarm.agents;

import com.agentswarm.Task;
import com.agentswarm.completion.CompletionClient;

/**
 * Turns research and analysis into an executive report.
 */
public class ReportAgent extends CompletionAgent {

    private static final String SYSTEM_PROMPT = "You are a professional report writer agent. Your role is to:\n"
            + "1. Synthesize information from research and analysis\n"
            + "2. Create clear, well-structured reports\n"
            + "3. Present findings in an executive-friendly format\n"
            + "4. Provide actionable recommendations\n\n"
            + "Create comprehensive, professional reports.";

    public ReportAgent(String actorId, CompletionClient completionClient) {
        super(actorId, completionClient);
    }

    @Override
    public String specialty() {
        return "report";
    }

    @Override
    protected String systemPrompt() {
        return SYSTEM_PROMPT;
    }

    @Override
    protected String userPrompt(Task task) {
        return "Report Generation Task: " + task.description() + "\n\n"
                + "Research and Analysis Results:\n" + formatContext(task.context()) + "\n\n"
                + "Please create a comprehensive report including:\n"
                + "- Executive Summary (2-3 paragraphs)\n"
                + "- Key Findings (clearly numbered/bulleted)\n"
                + "- Detailed Analysis\n"
                + "- Recommendations (actionable next steps)\n"
                + "- Conclusion\n\n"
                + "Format the report professionally with clear sections and markdown formatting.";
    }

    @Override
    protected String failureLabel() {
        return "Report generation";
    }
}
