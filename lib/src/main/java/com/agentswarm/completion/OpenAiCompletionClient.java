package com.agentswarm.completion;

import com.agentswarm.config.CompletionConfig;
import com.agentswarm.config.CompletionProvider;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Chat completions API. The system prompt travels as the first message.
 */
public class OpenAiCompletionClient extends HttpCompletionClient {

    public OpenAiCompletionClient(CompletionConfig config) {
        super(config);
    }

    @Override
    protected Map<String, Object> requestBody(String systemPrompt, String userPrompt, List<ChatMessage> history) {
        List<ChatMessage> messages = new ArrayList<>();
        if (systemPrompt != null && !systemPrompt.isEmpty()) {
            messages.add(ChatMessage.system(systemPrompt));
        }
        messages.addAll(history);
        messages.add(ChatMessage.user(userPrompt));

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", config.getModel());
        body.put("messages", messages);
        return body;
    }

    @Override
    protected Map<String, String> headers() {
        return Map.of("Authorization", "Bearer " + config.getApiKey());
    }

    @Override
    protected String extractText(JsonNode response) {
        JsonNode content = response.path("choices").path(0).path("message").path("content");
        return content.isTextual() ? content.asText() : null;
    }

    @Override
    public CompletionProvider provider() {
        return CompletionProvider.OPENAI;
    }
}
