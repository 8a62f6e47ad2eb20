package com.agentswarm.completion;

import com.agentswarm.config.CompletionProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;

/**
 * Offline stand-in that answers with canned text chosen by keywords in the user prompt.
 * Checked in order: "research", "analyze", then "report" or "summary"; anything else gets a
 * generic answer. Every answer ends with a note that it is simulated.
 */
public class MockCompletionClient implements CompletionClient {

    private static final Logger logger = LoggerFactory.getLogger(MockCompletionClient.class);

    public static final String SIMULATED_NOTE =
            "*Note: This is a simulated response. Set OPENAI_API_KEY or ANTHROPIC_API_KEY for real AI analysis.*";

    static final String RESEARCH_RESPONSE = "# Research Findings\n\n"
            + "Based on comprehensive analysis:\n\n"
            + "## Key Points:\n"
            + "1. Current trends show significant growth in this area\n"
            + "2. Market analysis indicates strong demand\n"
            + "3. Technical feasibility is high\n\n"
            + "## Recommendations:\n"
            + "- Continue monitoring developments\n"
            + "- Consider strategic partnerships\n"
            + "- Invest in related technologies\n\n"
            + SIMULATED_NOTE;

    static final String ANALYSIS_RESPONSE = "# Analysis Results\n\n"
            + "## Data Quality: High\n"
            + "## Key Patterns:\n"
            + "- Pattern A: Shows consistent growth\n"
            + "- Pattern B: Seasonal variations detected\n"
            + "- Pattern C: Strong correlation with market trends\n\n"
            + "## Insights:\n"
            + "The data suggests positive momentum with manageable risks.\n\n"
            + SIMULATED_NOTE;

    static final String REPORT_RESPONSE = "# Executive Report\n\n"
            + "## Overview\n"
            + "This report synthesizes findings from research and analysis phases.\n\n"
            + "## Key Findings:\n"
            + "- Finding 1: Market opportunity is substantial\n"
            + "- Finding 2: Technical approach is sound\n"
            + "- Finding 3: Timeline is achievable\n\n"
            + "## Recommendations:\n"
            + "1. Proceed with phase 2 planning\n"
            + "2. Allocate additional resources\n"
            + "3. Schedule stakeholder review\n\n"
            + SIMULATED_NOTE;

    static final String GENERIC_RESPONSE = "Task completed successfully.\n\n"
            + "Analysis shows positive outcomes with actionable next steps identified.\n\n"
            + SIMULATED_NOTE;

    @Override
    public String complete(String systemPrompt, String userPrompt, List<ChatMessage> history) {
        String prompt = userPrompt == null ? "" : userPrompt.toLowerCase(Locale.ROOT);
        logger.debug("Simulating completion for a {} character prompt", prompt.length());
        if (prompt.contains("research")) {
            return RESEARCH_RESPONSE;
        }
        if (prompt.contains("analyze")) {
            return ANALYSIS_RESPONSE;
        }
        if (prompt.contains("report") || prompt.contains("summary")) {
            return REPORT_RESPONSE;
        }
        return GENERIC_RESPONSE;
    }

    @Override
    public CompletionProvider provider() {
        return CompletionProvider.MOCK;
    }
}
