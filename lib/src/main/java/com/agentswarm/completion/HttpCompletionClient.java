package com.agentswarm.completion;

import com.agentswarm.config.CompletionConfig;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.hc.client5.http.classic.methods.HttpPost;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.core5.http.ContentType;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.http.io.entity.StringEntity;
import org.apache.hc.core5.util.Timeout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Base for clients that post a JSON request to a hosted chat completion endpoint.
 * Subclasses build the provider-specific body and headers and pick the text out of the response.
 */
public abstract class HttpCompletionClient implements CompletionClient, AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(HttpCompletionClient.class);

    protected final CompletionConfig config;
    protected final ObjectMapper objectMapper;
    private final CloseableHttpClient httpClient;

    protected HttpCompletionClient(CompletionConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        if (config.getApiKey() == null || config.getApiKey().isBlank()) {
            throw new IllegalArgumentException(config.getProvider() + " client requires an API key");
        }
        if (config.getEndpoint() == null) {
            throw new IllegalArgumentException(config.getProvider() + " client requires an endpoint");
        }
        this.objectMapper = new ObjectMapper();
        Timeout timeout = Timeout.ofMilliseconds(config.getRequestTimeout().toMillis());
        this.httpClient = HttpClients.custom()
                .setDefaultRequestConfig(RequestConfig.custom()
                        .setConnectionRequestTimeout(timeout)
                        .setResponseTimeout(timeout)
                        .build())
                .build();
    }

    @Override
    public String complete(String systemPrompt, String userPrompt, List<ChatMessage> history)
            throws CompletionException {
        String requestJson;
        try {
            requestJson = objectMapper.writeValueAsString(requestBody(systemPrompt, userPrompt, history));
        } catch (JsonProcessingException e) {
            throw new CompletionException("Could not encode completion request", e);
        }

        HttpPost httpPost = new HttpPost(config.getEndpoint());
        headers().forEach(httpPost::setHeader);
        httpPost.setEntity(new StringEntity(requestJson, ContentType.APPLICATION_JSON));

        HttpReply reply;
        try {
            reply = httpClient.execute(httpPost, response -> new HttpReply(
                    response.getCode(),
                    response.getEntity() == null ? "" : EntityUtils.toString(response.getEntity(), StandardCharsets.UTF_8)));
        } catch (IOException e) {
            logger.warn("Completion request to {} failed", config.getEndpoint(), e);
            throw new CompletionException("Completion request failed: " + e.getMessage(), e);
        }

        if (reply.status() != 200) {
            throw new CompletionException("API error: " + reply.body(), reply.status(), null);
        }
        try {
            String text = extractText(objectMapper.readTree(reply.body()));
            if (text == null) {
                throw new CompletionException("no response from API");
            }
            return text;
        } catch (JsonProcessingException e) {
            throw new CompletionException("Could not parse completion response", e);
        }
    }

    /**
     * Builds the JSON request body.
     */
    protected abstract Map<String, Object> requestBody(String systemPrompt, String userPrompt, List<ChatMessage> history);

    /**
     * Returns the headers to send besides the content type.
     */
    protected abstract Map<String, String> headers();

    /**
     * Picks the completion text out of the parsed response, or returns null if there is none.
     */
    protected abstract String extractText(JsonNode response);

    @Override
    public void close() throws IOException {
        httpClient.close();
    }

    private record HttpReply(int status, String body) {
    }
}
