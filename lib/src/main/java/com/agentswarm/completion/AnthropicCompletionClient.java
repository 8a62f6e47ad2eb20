package com.agentswarm.completion;

import com.agentswarm.config.CompletionConfig;
import com.agentswarm.config.CompletionProvider;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Messages API. The system prompt goes in its own field; system entries in the history are folded into it.
 */
public class AnthropicCompletionClient extends HttpCompletionClient {

    public static final String API_VERSION = "2023-06-01";

    public AnthropicCompletionClient(CompletionConfig config) {
        super(config);
    }

    @Override
    protected Map<String, Object> requestBody(String systemPrompt, String userPrompt, List<ChatMessage> history) {
        String system = systemPrompt;
        List<ChatMessage> messages = new ArrayList<>();
        for (ChatMessage message : history) {
            if (ChatMessage.SYSTEM.equals(message.role())) {
                system = message.content();
            } else {
                messages.add(message);
            }
        }
        messages.add(ChatMessage.user(userPrompt));

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", config.getModel());
        body.put("max_tokens", config.getMaxTokens());
        body.put("messages", messages);
        if (system != null && !system.isEmpty()) {
            body.put("system", system);
        }
        return body;
    }

    @Override
    protected Map<String, String> headers() {
        return Map.of(
                "x-api-key", config.getApiKey(),
                "anthropic-version", API_VERSION);
    }

    @Override
    protected String extractText(JsonNode response) {
        JsonNode text = response.path("content").path(0).path("text");
        return text.isTextual() ? text.asText() : null;
    }

    @Override
    public CompletionProvider provider() {
        return CompletionProvider.ANTHROPIC;
    }
}
