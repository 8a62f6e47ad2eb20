package com.agentswarm;

import com.agentswarm.config.ActorConfig;
import com.agentswarm.event.Event;
import com.agentswarm.event.EventBus;
import com.agentswarm.event.EventKind;
import com.agentswarm.helper.EventProbe;
import com.agentswarm.helper.RecordingActor;
import com.agentswarm.test.AsyncAssertion;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Timeout(10)
class ActorTest {

    private CancellationScope root;
    private EventBus bus;
    private final List<Actor> started = new ArrayList<>();

    @BeforeEach
    void setUp() {
        root = CancellationScope.root();
        bus = new EventBus();
    }

    @AfterEach
    void tearDown() {
        for (Actor actor : started) {
            actor.stop();
        }
        root.cancel();
        bus.close();
    }

    private <A extends Actor> A start(A actor) {
        actor.setEventPublisher(bus);
        actor.start(root);
        started.add(actor);
        return actor;
    }

    private static Message task(String id) {
        return Message.task("test", null, Task.of(id, "task " + id));
    }

    @Test
    void shouldHandleMessagesInSendOrder() {
        List<String> handled = new CopyOnWriteArrayList<>();
        Actor actor = new Actor("fifo");
        actor.registerHandler(MessageType.TASK,
                m -> handled.add(((Payload.TaskAssignment) m.payload()).task().id()));
        start(actor);

        List<String> sent = new ArrayList<>();
        for (int i = 0; i < 80; i++) {
            String id = "t" + i;
            sent.add(id);
            actor.send(task(id));
        }

        AsyncAssertion.eventually(() -> handled.size() == sent.size(), Duration.ofSeconds(2));
        assertEquals(sent, handled);
    }

    @Test
    void shouldRejectSendWhenMailboxIsFull() {
        Actor actor = new Actor("full");
        for (int i = 0; i < ActorConfig.DEFAULT_MAILBOX_CAPACITY; i++) {
            actor.send(task("t" + i));
        }

        MailboxFullException e = assertThrows(MailboxFullException.class, () -> actor.send(task("overflow")));
        assertEquals("full", e.getActorId());
        assertEquals(100, e.getCapacity());
        assertEquals(100, actor.mailboxSize());
    }

    @Test
    void shouldRespectConfiguredCapacity() {
        Actor actor = new Actor("small", new ActorConfig().setMailboxCapacity(3));
        actor.send(task("a"));
        actor.send(task("b"));
        actor.send(task("c"));

        assertThrows(MailboxFullException.class, () -> actor.send(task("d")));
        assertEquals(3, actor.capacity());
    }

    @Test
    void shouldRejectSendAfterStopAndHandleNothingMore() {
        AtomicInteger handled = new AtomicInteger();
        Actor actor = new Actor("stopped");
        actor.registerHandler(MessageType.TASK, m -> handled.incrementAndGet());
        start(actor);
        actor.send(task("before"));
        AsyncAssertion.eventually(() -> handled.get() == 1, Duration.ofSeconds(1));

        actor.stop();

        assertEquals(ActorState.STOPPED, actor.state());
        assertThrows(ActorStoppedException.class, () -> actor.send(task("after")));
        AsyncAssertion.never(() -> handled.get() != 1, Duration.ofMillis(100));
    }

    @Test
    void stopShouldBeIdempotent() {
        RecordingActor actor = start(new RecordingActor("twice"));

        actor.stop();
        actor.stop();

        assertEquals(ActorState.STOPPED, actor.state());
        assertEquals(1, actor.postStopCalls());
    }

    @Test
    void stoppingAnIdleActorShouldMakeItStopped() {
        RecordingActor actor = new RecordingActor("idle");

        actor.stop();

        assertEquals(ActorState.STOPPED, actor.state());
        assertEquals(1, actor.postStopCalls());
        assertThrows(ActorStoppedException.class, () -> actor.send(task("t")));
    }

    @Test
    void shouldRefuseToStartTwice() {
        Actor actor = start(new Actor("once"));

        ActorAlreadyRunningException e = assertThrows(ActorAlreadyRunningException.class, () -> actor.start(root));
        assertEquals(ActorState.PROCESSING, e.getState());
    }

    @Test
    void shouldRefuseToRestartAfterStop() {
        Actor actor = start(new Actor("restart"));
        actor.stop();

        assertThrows(ActorAlreadyRunningException.class, () -> actor.start(root));
    }

    @Test
    void shouldReportProcessingWhileWaitingOnAnEmptyMailbox() {
        Actor actor = new Actor("waiting");
        assertEquals(ActorState.IDLE, actor.state());

        start(actor);

        AsyncAssertion.never(() -> actor.state() != ActorState.PROCESSING, Duration.ofMillis(100));
    }

    @Test
    void handlerFailureShouldNotStopTheActor() throws Exception {
        List<String> handled = new CopyOnWriteArrayList<>();
        Actor actor = new Actor("fragile");
        actor.registerHandler(MessageType.TASK, m -> {
            String id = ((Payload.TaskAssignment) m.payload()).task().id();
            if (id.equals("bad")) {
                throw new IllegalStateException("malformed");
            }
            handled.add(id);
        });

        try (EventProbe probe = new EventProbe(bus)) {
            start(actor);
            actor.send(task("bad"));
            actor.send(task("good"));

            AsyncAssertion.eventually(() -> handled.contains("good"), Duration.ofSeconds(1));
            Event failed = probe.awaitTerminal("bad", Duration.ofSeconds(1));
            assertEquals(EventKind.TASK_FAILED, failed.kind());
            TaskResult result = failed.result().orElseThrow();
            assertEquals(TaskError.Kind.HANDLER_ERROR, result.error().kind());
            assertEquals("malformed", result.errorMessage());
        }
        assertEquals(ActorState.PROCESSING, actor.state());
    }

    @Test
    void defaultTaskHandlingShouldPublishLifecycleEvents() throws Exception {
        try (EventProbe probe = new EventProbe(bus)) {
            Actor actor = start(new Actor("worker"));
            actor.send(task("t1"));

            Event done = probe.awaitTerminal("t1", Duration.ofSeconds(1));

            assertEquals(List.of(EventKind.TASK_RECEIVED, EventKind.TASK_STARTED, EventKind.TASK_COMPLETED),
                    probe.kindsFor("t1"));
            assertEquals("worker", done.actorId());
            TaskResult result = done.result().orElseThrow();
            assertTrue(result.success());
            assertEquals("Agent worker processed task t1", result.data());
        }
    }

    @Test
    void throwingProcessTaskShouldPublishFailure() throws Exception {
        Actor actor = new Actor("broken") {
            @Override
            public TaskResult processTask(Task task) {
                throw new IllegalArgumentException("no such input");
            }
        };
        try (EventProbe probe = new EventProbe(bus)) {
            start(actor);
            actor.send(task("t1"));

            Event failed = probe.awaitTerminal("t1", Duration.ofSeconds(1));

            assertEquals(EventKind.TASK_FAILED, failed.kind());
            assertEquals(TaskError.Kind.HANDLER_ERROR, failed.result().orElseThrow().error().kind());
        }
    }

    @Test
    void unhandledNonTaskMessagesShouldOnlyBeReported() throws Exception {
        try (EventProbe probe = new EventProbe(bus)) {
            Actor actor = start(new Actor("listener"));
            actor.send(Message.query("test", "listener", "status?"));

            probe.awaitCount(EventKind.MESSAGE, 1, Duration.ofSeconds(1));
            Event event = probe.first(EventKind.MESSAGE).orElseThrow();
            assertEquals(new Payload.Query("status?"), event.payload());
        }
    }

    @Test
    void lastRegisteredHandlerShouldWin() {
        List<String> calls = new CopyOnWriteArrayList<>();
        Actor actor = new Actor("handlers");
        actor.registerHandler(MessageType.QUERY, m -> calls.add("first"));
        actor.registerHandler(MessageType.QUERY, m -> calls.add("second"));
        start(actor);

        actor.send(Message.query("test", "handlers", "?"));

        AsyncAssertion.eventually(() -> calls.size() == 1, Duration.ofSeconds(1));
        assertEquals(List.of("second"), calls);
    }

    @Test
    void tryReceiveShouldBypassTheRunLoop() {
        Actor actor = new Actor("manual");
        Message message = task("t1");
        actor.send(message);

        assertSame(message, actor.tryReceive().orElseThrow());
        assertFalse(actor.tryReceive().isPresent());
    }

    @Test
    void cancellingTheParentScopeShouldEndTheRunLoop() {
        AtomicInteger handled = new AtomicInteger();
        Actor actor = new Actor("cancelled");
        actor.registerHandler(MessageType.TASK, m -> handled.incrementAndGet());
        CancellationScope parent = root.child();
        actor.start(parent);
        started.add(actor);

        parent.cancel();
        actor.send(task("ignored"));

        AsyncAssertion.never(() -> handled.get() > 0, Duration.ofMillis(100));
    }

    @Test
    void stopFromInsideAHandlerShouldNotDeadlock() {
        Actor actor = new Actor("self-stopping");
        actor.registerHandler(MessageType.QUERY, m -> actor.stop());
        start(actor);

        actor.send(Message.query("test", "self-stopping", "stop"));

        AsyncAssertion.eventually(() -> actor.state() == ActorState.STOPPED, Duration.ofSeconds(1));
    }

    @Test
    void stopShouldWaitForTheCurrentMessage() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        AtomicInteger finished = new AtomicInteger();
        Actor actor = new Actor("busy");
        actor.registerHandler(MessageType.TASK, m -> {
            entered.countDown();
            Thread.sleep(150);
            finished.incrementAndGet();
        });
        start(actor);
        actor.send(task("slow"));
        assertTrue(entered.await(1, TimeUnit.SECONDS));

        actor.stop();

        assertEquals(1, finished.get());
    }

    @Test
    void stopShouldFailWhenTheLoopOutlivesTheShutdownTimeout() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch never = new CountDownLatch(1);
        Actor actor = new Actor("stuck", new ActorConfig().setShutdownTimeout(Duration.ofMillis(100)));
        actor.registerHandler(MessageType.TASK, m -> {
            entered.countDown();
            never.await();
        });
        start(actor);
        actor.send(task("hang"));
        assertTrue(entered.await(1, TimeUnit.SECONDS));

        ActorStopException e = assertThrows(ActorStopException.class, actor::stop);

        assertEquals("stuck", e.getActorId());
        assertEquals(ActorState.STOPPED, actor.state());
        assertThrows(ActorStoppedException.class, () -> actor.send(task("after")));
    }

    @Test
    void failingPreStartShouldLeaveTheActorIdle() {
        AtomicInteger attempts = new AtomicInteger();
        List<String> handled = new CopyOnWriteArrayList<>();
        Actor actor = new Actor("flaky") {
            @Override
            protected void preStart() {
                if (attempts.incrementAndGet() == 1) {
                    throw new IllegalStateException("warm-up failed");
                }
            }
        };
        actor.registerHandler(MessageType.TASK, m -> handled.add(m.sender()));
        actor.setEventPublisher(bus);

        ActorException e = assertThrows(ActorException.class, () -> actor.start(root));

        assertEquals("flaky", e.getActorId());
        assertTrue(e.getCause() instanceof IllegalStateException);
        assertEquals(ActorState.IDLE, actor.state());

        start(actor);
        actor.send(task("t1"));
        AsyncAssertion.eventually(() -> handled.size() == 1, Duration.ofSeconds(1));
        assertEquals(ActorState.PROCESSING, actor.state());
    }
}
