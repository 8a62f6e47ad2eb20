package com.agentswarm.config;

import com.agentswarm.mailbox.MailboxType;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ActorConfigTest {

    @Test
    void defaultsShouldMatchTheDocumentedValues() {
        ActorConfig config = new ActorConfig();

        assertEquals(100, config.getMailboxCapacity());
        assertEquals(MailboxType.MPSC, config.getMailboxType());
        assertEquals(Duration.ofMillis(10), config.getPollInterval());
        assertEquals(Duration.ofSeconds(30), config.getShutdownTimeout());
    }

    @Test
    void shouldRejectNonPositiveCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new ActorConfig().setMailboxCapacity(0));
    }

    @Test
    void threadFactoryShouldNameThreadsAfterTheActor() {
        ActorThreadFactory factory = new ActorThreadFactory();

        Thread first = factory.createThreadFactory("worker-1").newThread(() -> { });
        Thread second = factory.createThreadFactory("worker-1").newThread(() -> { });

        assertEquals("actor-worker-1", first.getName());
        assertEquals("actor-worker-1", second.getName());
        assertTrue(first.isDaemon());
    }

    @Test
    void threadFactoryShouldHonourPrefixAndDaemonFlag() {
        ActorThreadFactory factory = new ActorThreadFactory().setThreadNamePrefix("agent").setDaemon(false);

        Thread thread = factory.createThreadFactory("a1").newThread(() -> { });

        assertEquals("agent-a1", thread.getName());
        assertFalse(thread.isDaemon());
    }

    @Test
    void workflowConfigShouldRejectNonPositiveStepTimeout() {
        assertThrows(IllegalArgumentException.class, () -> new WorkflowConfig().setStepTimeout(Duration.ZERO));
        assertEquals(Duration.ofSeconds(60), new WorkflowConfig().getStepTimeout());
    }
}
