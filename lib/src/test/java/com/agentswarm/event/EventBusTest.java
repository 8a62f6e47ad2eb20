package com.agentswarm.event;

import com.agentswarm.TaskResult;
import com.agentswarm.config.EventBusConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Timeout(5)
class EventBusTest {

    private EventBus bus;

    @BeforeEach
    void setUp() {
        bus = new EventBus(new EventBusConfig().setSubscriberCapacity(4));
    }

    @AfterEach
    void tearDown() {
        bus.close();
    }

    private static Event event(int n) {
        return Event.of(EventKind.CUSTOM, "a1", "t" + n, "event " + n);
    }

    @Test
    void everySubscriberShouldReceiveOneCopy() {
        List<Subscription> subscriptions = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            subscriptions.add(bus.subscribe());
        }
        Event event = event(1);

        bus.publish(event);

        for (Subscription subscription : subscriptions) {
            assertEquals(Optional.of(event), subscription.tryPoll());
            assertEquals(Optional.empty(), subscription.tryPoll());
        }
    }

    @Test
    void fullSubscriberShouldNotBlockOrStarveOthers() {
        Subscription slow = bus.subscribe();
        for (int i = 0; i < 4; i++) {
            bus.publish(event(i));
        }
        Subscription fresh = bus.subscribe();

        bus.publish(event(99));

        assertEquals(1, slow.droppedCount());
        assertEquals(4, slow.pending());
        assertEquals("t0", slow.tryPoll().orElseThrow().taskId());
        assertEquals("t99", fresh.tryPoll().orElseThrow().taskId());
        assertEquals(0, fresh.droppedCount());
    }

    @Test
    void eventsShouldArriveInPublishOrder() throws Exception {
        Subscription subscription = bus.subscribe();
        bus.publish(event(1));
        bus.publish(event(2));
        bus.publish(event(3));

        assertEquals("t1", subscription.poll(Duration.ofMillis(100)).orElseThrow().taskId());
        assertEquals("t2", subscription.poll(Duration.ofMillis(100)).orElseThrow().taskId());
        assertEquals("t3", subscription.poll(Duration.ofMillis(100)).orElseThrow().taskId());
    }

    @Test
    void subscriberShouldOnlySeeEventsPublishedAfterSubscribing() {
        bus.publish(event(1));
        Subscription late = bus.subscribe();

        assertFalse(late.tryPoll().isPresent());
    }

    @Test
    void pollShouldTimeOutWhenNothingIsPublished() throws Exception {
        Subscription subscription = bus.subscribe();

        long start = System.nanoTime();
        assertFalse(subscription.poll(Duration.ofMillis(50)).isPresent());
        assertTrue(Duration.ofNanos(System.nanoTime() - start).toMillis() >= 40);
    }

    @Test
    void closingASubscriptionShouldUnsubscribe() {
        Subscription subscription = bus.subscribe();
        Subscription other = bus.subscribe();

        subscription.close();
        bus.publish(event(1));

        assertTrue(subscription.isClosed());
        assertEquals(1, bus.subscriberCount());
        assertEquals(0, subscription.droppedCount());
        assertTrue(other.tryPoll().isPresent());
    }

    @Test
    void closingTheBusShouldCloseSubscriptionsAndIgnoreLaterPublishes() throws Exception {
        Subscription subscription = bus.subscribe();

        bus.close();
        bus.publish(event(1));

        assertTrue(subscription.isClosed());
        assertFalse(subscription.poll(Duration.ofMillis(10)).isPresent());
        assertTrue(bus.subscribe().isClosed());
        assertEquals(0, bus.subscriberCount());
    }

    @Test
    void eventsBufferedBeforeCloseShouldStillBeDelivered() throws Exception {
        Subscription subscription = bus.subscribe();
        Event completed = Event.of(EventKind.TASK_COMPLETED, "a1", "t1", "done");
        bus.publish(completed);

        bus.close();
        bus.publish(event(2));

        assertTrue(subscription.isClosed());
        assertEquals(1, subscription.pending());
        assertEquals(Optional.of(completed), subscription.poll(Duration.ofMillis(50)));
        assertFalse(subscription.poll(Duration.ofMillis(50)).isPresent());
        assertEquals(0, subscription.droppedCount());
    }

    @Test
    void closingASubscriptionShouldDiscardItsBuffer() {
        Subscription subscription = bus.subscribe();
        bus.publish(event(1));

        subscription.close();

        assertEquals(0, subscription.pending());
        assertFalse(subscription.tryPoll().isPresent());
    }

    @Test
    void resultShouldExposeTaskResultPayloads() {
        TaskResult result = TaskResult.success("t1", "data");

        assertEquals(Optional.of(result), Event.of(EventKind.TASK_COMPLETED, "a1", "t1", "done", result).result());
        assertEquals(Optional.empty(), event(1).result());
    }

    @Test
    void onlyCompletionAndFailureShouldBeTerminal() {
        assertTrue(EventKind.TASK_COMPLETED.isTerminal());
        assertTrue(EventKind.TASK_FAILED.isTerminal());
        assertFalse(EventKind.TASK_STARTED.isTerminal());
        assertFalse(EventKind.TASK_RECEIVED.isTerminal());
        assertFalse(EventKind.CUSTOM.isTerminal());
    }

    @Test
    void concurrentPublishersShouldNotLoseEventsForRoomySubscribers() throws Exception {
        EventBus roomy = new EventBus(new EventBusConfig().setSubscriberCapacity(10_000));
        Subscription subscription = roomy.subscribe();
        List<Thread> publishers = new ArrayList<>();
        for (int p = 0; p < 4; p++) {
            Thread t = new Thread(() -> {
                for (int i = 0; i < 500; i++) {
                    roomy.publish(event(i));
                }
            });
            publishers.add(t);
            t.start();
        }
        for (Thread t : publishers) {
            t.join();
        }

        assertEquals(2000, subscription.pending());
        assertEquals(0, subscription.droppedCount());
        roomy.close();
    }
}
