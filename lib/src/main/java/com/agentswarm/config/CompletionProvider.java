package com.agentswarm.config;

/**
 * Backends a completion client can talk to.
 */
public enum CompletionProvider {
    OPENAI,
    ANTHROPIC,
    /** Canned responses, no network access. */
    MOCK
}
