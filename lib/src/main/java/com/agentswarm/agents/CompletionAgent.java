package com.agentswarm.agents;

import com.agentswarm.Actor;
import com.agentswarm.Task;
import com.agentswarm.TaskResult;
import com.agentswarm.completion.ChatMessage;
import com.agentswarm.completion.CompletionClient;
import com.agentswarm.completion.CompletionException;
import com.agentswarm.config.ActorConfig;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * An actor that performs each task by asking a language completion backend.
 * <p>
 * Keeps a rolling history of its recent exchanges and hands it to the backend with each request.
 */
public abstract class CompletionAgent extends Actor {

    public static final int DEFAULT_HISTORY_SIZE = 6;

    private final CompletionClient completionClient;
    private final int historySize;
    private final Deque<ChatMessage> history = new ArrayDeque<>();

    protected CompletionAgent(String actorId, CompletionClient completionClient) {
        this(actorId, completionClient, new ActorConfig(), DEFAULT_HISTORY_SIZE);
    }

    protected CompletionAgent(String actorId, CompletionClient completionClient, ActorConfig config, int historySize) {
        super(actorId, config);
        if (historySize < 0) {
            throw new IllegalArgumentException("History size must not be negative");
        }
        this.completionClient = Objects.requireNonNull(completionClient, "completionClient");
        this.historySize = historySize;
    }

    /**
     * Short name of what this agent does.
     */
    public abstract String specialty();

    protected abstract String systemPrompt();

    protected abstract String userPrompt(Task task);

    /**
     * Prefix for the failure message when the backend call fails.
     */
    protected abstract String failureLabel();

    @Override
    public TaskResult processTask(Task task) {
        String userPrompt = userPrompt(task);
        String response;
        try {
            response = completionClient.complete(systemPrompt(), userPrompt, history());
        } catch (CompletionException e) {
            getLogger().warn("Completion for task {} failed: {}", task.id(), e.getMessage());
            return TaskResult.failure(task.id(), failureLabel() + " failed: " + e.getMessage());
        }
        remember(ChatMessage.user(userPrompt));
        remember(ChatMessage.assistant(response));
        getLogger().debug("Task {} answered with {} characters", task.id(), response.length());
        return TaskResult.success(task.id(), response);
    }

    private void remember(ChatMessage message) {
        synchronized (history) {
            history.addLast(message);
            while (history.size() > historySize) {
                history.removeFirst();
            }
        }
    }

    /**
     * Returns a copy of the current history, oldest first.
     */
    public List<ChatMessage> history() {
        synchronized (history) {
            return List.copyOf(history);
        }
    }

    /**
     * Renders a task context as {@code key: value} lines, in insertion order.
     */
    protected static String formatContext(Map<String, Object> context) {
        if (context.isEmpty()) {
            return "(none)";
        }
        return context.entrySet().stream()
                .map(e -> e.getKey() + ": " + e.getValue())
                .collect(Collectors.joining("\n"));
    }
}
