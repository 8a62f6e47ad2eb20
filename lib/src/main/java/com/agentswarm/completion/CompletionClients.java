package com.agentswarm.completion;

import com.agentswarm.config.CompletionConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates the completion client matching a configuration.
 */
public final class CompletionClients {

    private static final Logger logger = LoggerFactory.getLogger(CompletionClients.class);

    private CompletionClients() {
    }

    public static CompletionClient create(CompletionConfig config) {
        logger.info("Using {} completion client (model {})", config.getProvider(), config.getModel());
        switch (config.getProvider()) {
            case OPENAI:
                return new OpenAiCompletionClient(config);
            case ANTHROPIC:
                return new AnthropicCompletionClient(config);
            case MOCK:
            default:
                return new MockCompletionClient();
        }
    }
}
