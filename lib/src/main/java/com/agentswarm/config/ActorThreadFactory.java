package com.agentswarm.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Creates the platform threads that run actor loops.
 * Each actor gets one thread named after it, which keeps thread dumps and log output readable.
 */
public class ActorThreadFactory {

    private static final Logger logger = LoggerFactory.getLogger(ActorThreadFactory.class);

    private String threadNamePrefix = "actor";
    private boolean daemon = true;

    /**
     * Creates a thread factory for the given actor.
     *
     * @param actorId The actor the threads will run
     * @return A thread factory that creates named threads
     */
    public ThreadFactory createThreadFactory(String actorId) {
        String baseName = threadNamePrefix + "-" + actorId;
        return new ThreadFactory() {
            private final AtomicInteger threadNumber = new AtomicInteger(0);

            @Override
            public Thread newThread(Runnable r) {
                int n = threadNumber.getAndIncrement();
                Thread thread = new Thread(r, n == 0 ? baseName : baseName + "-" + n);
                thread.setDaemon(daemon);
                thread.setUncaughtExceptionHandler((t, e) ->
                        logger.error("Uncaught exception in actor thread {}", t.getName(), e));
                return thread;
            }
        };
    }

    public String getThreadNamePrefix() {
        return threadNamePrefix;
    }

    public ActorThreadFactory setThreadNamePrefix(String threadNamePrefix) {
        this.threadNamePrefix = threadNamePrefix;
        return this;
    }

    public boolean isDaemon() {
        return daemon;
    }

    public ActorThreadFactory setDaemon(boolean daemon) {
        this.daemon = daemon;
        return this;
    }
}
