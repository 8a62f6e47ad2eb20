package com.agentswarm.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Configuration for the workflow driver.
 */
public class WorkflowConfig {
    public static final Duration DEFAULT_STEP_TIMEOUT = Duration.ofSeconds(60);
    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(100);

    private Duration stepTimeout = DEFAULT_STEP_TIMEOUT;
    private Duration pollInterval = DEFAULT_POLL_INTERVAL;

    /**
     * Sets the deadline applied to each step unless the step declares its own.
     *
     * @param stepTimeout The per-step deadline
     * @return This WorkflowConfig instance
     */
    public WorkflowConfig setStepTimeout(Duration stepTimeout) {
        Objects.requireNonNull(stepTimeout, "stepTimeout");
        if (stepTimeout.isNegative() || stepTimeout.isZero()) {
            throw new IllegalArgumentException("Step timeout must be positive");
        }
        this.stepTimeout = stepTimeout;
        return this;
    }

    public Duration getStepTimeout() {
        return stepTimeout;
    }

    /**
     * Sets the longest single wait on the event subscription between deadline checks.
     *
     * @param pollInterval The poll interval
     * @return This WorkflowConfig instance
     */
    public WorkflowConfig setPollInterval(Duration pollInterval) {
        this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval");
        return this;
    }

    public Duration getPollInterval() {
        return pollInterval;
    }
}
