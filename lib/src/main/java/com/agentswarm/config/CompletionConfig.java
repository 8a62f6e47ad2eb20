package com.agentswarm.config;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Configuration for a completion client.
 * <p>
 * {@link #fromEnvironment(Map)} picks a provider from the usual API key variables:
 * {@code OPENAI_API_KEY} wins over {@code ANTHROPIC_API_KEY}, and with neither set
 * the mock provider is used. {@code AGENT_SWARM_MODEL} overrides the default model.
 */
public class CompletionConfig {
    public static final String OPENAI_API_KEY = "OPENAI_API_KEY";
    public static final String ANTHROPIC_API_KEY = "ANTHROPIC_API_KEY";
    public static final String MODEL_OVERRIDE = "AGENT_SWARM_MODEL";

    public static final String OPENAI_ENDPOINT = "https://api.openai.com/v1/chat/completions";
    public static final String ANTHROPIC_ENDPOINT = "https://api.anthropic.com/v1/messages";
    public static final String OPENAI_DEFAULT_MODEL = "gpt-4";
    public static final String ANTHROPIC_DEFAULT_MODEL = "claude-3-5-sonnet-20241022";

    public static final int DEFAULT_MAX_TOKENS = 4096;
    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(60);

    private CompletionProvider provider = CompletionProvider.MOCK;
    private String apiKey;
    private String model = "mock";
    private String endpoint;
    private int maxTokens = DEFAULT_MAX_TOKENS;
    private Duration requestTimeout = DEFAULT_REQUEST_TIMEOUT;

    public static CompletionConfig mock() {
        return new CompletionConfig();
    }

    public static CompletionConfig openAi(String apiKey) {
        return new CompletionConfig()
                .setProvider(CompletionProvider.OPENAI)
                .setApiKey(apiKey)
                .setModel(OPENAI_DEFAULT_MODEL)
                .setEndpoint(OPENAI_ENDPOINT);
    }

    public static CompletionConfig anthropic(String apiKey) {
        return new CompletionConfig()
                .setProvider(CompletionProvider.ANTHROPIC)
                .setApiKey(apiKey)
                .setModel(ANTHROPIC_DEFAULT_MODEL)
                .setEndpoint(ANTHROPIC_ENDPOINT);
    }

    public static CompletionConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    public static CompletionConfig fromEnvironment(Map<String, String> env) {
        CompletionConfig config;
        if (hasText(env.get(OPENAI_API_KEY))) {
            config = openAi(env.get(OPENAI_API_KEY));
        } else if (hasText(env.get(ANTHROPIC_API_KEY))) {
            config = anthropic(env.get(ANTHROPIC_API_KEY));
        } else {
            config = mock();
        }
        String model = env.get(MODEL_OVERRIDE);
        if (hasText(model)) {
            config.setModel(model);
        }
        return config;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    public CompletionProvider getProvider() {
        return provider;
    }

    public CompletionConfig setProvider(CompletionProvider provider) {
        this.provider = Objects.requireNonNull(provider, "provider");
        return this;
    }

    public String getApiKey() {
        return apiKey;
    }

    public CompletionConfig setApiKey(String apiKey) {
        this.apiKey = apiKey;
        return this;
    }

    public String getModel() {
        return model;
    }

    public CompletionConfig setModel(String model) {
        this.model = model;
        return this;
    }

    public String getEndpoint() {
        return endpoint;
    }

    public CompletionConfig setEndpoint(String endpoint) {
        this.endpoint = endpoint;
        return this;
    }

    public int getMaxTokens() {
        return maxTokens;
    }

    public CompletionConfig setMaxTokens(int maxTokens) {
        if (maxTokens < 1) {
            throw new IllegalArgumentException("maxTokens must be positive");
        }
        this.maxTokens = maxTokens;
        return this;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public CompletionConfig setRequestTimeout(Duration requestTimeout) {
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
        return this;
    }

    @Override
    public String toString() {
        // never print the key
        return "CompletionConfig{provider=" + provider + ", model=" + model + ", endpoint=" + endpoint + "}";
    }
}
