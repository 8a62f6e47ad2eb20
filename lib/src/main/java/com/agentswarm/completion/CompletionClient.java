package com.agentswarm.completion;

import com.agentswarm.config.CompletionProvider;

import java.util.List;

/**
 * Synchronous access to a language completion backend.
 * Implementations must be safe to call from several actor threads at once.
 */
public interface CompletionClient {

    /**
     * Produces a completion.
     *
     * @param systemPrompt instructions shaping the response
     * @param userPrompt   the request
     * @param history      earlier exchanges, oldest first
     * @return the completion text
     * @throws CompletionException if the backend fails or returns nothing
     */
    String complete(String systemPrompt, String userPrompt, List<ChatMessage> history) throws CompletionException;

    CompletionProvider provider();
}
