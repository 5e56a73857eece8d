package com.switchyard.core.events;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link EventBus}.
 */
class EventBusTest {

    private EventBus eventBus;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus();
    }

    private static RouterEvent event(String type, String jobId) {
        return new RouterEvent(type, jobId, "build_graph", Map.of(), Instant.now());
    }

    @Nested
    @DisplayName("subscribe and publish")
    class SubscribeAndPublishTests {

        @Test
        @DisplayName("delivers event to job subscriber")
        void deliversEventToJobSubscriber() {
            List<RouterEvent> received = new ArrayList<>();
            eventBus.subscribe("job-1", received::add);

            var event = new RouterEvent(RouterEvent.JOB_STARTED, "job-1", "build_graph",
                    Map.of("attempt", 1), Instant.now());
            eventBus.publish(event);

            assertEquals(List.of(event), received);
        }

        @Test
        @DisplayName("does not deliver events of other jobs")
        void doesNotDeliverToDifferentJob() {
            List<RouterEvent> received = new ArrayList<>();
            eventBus.subscribe("job-2", received::add);

            eventBus.publish(event(RouterEvent.JOB_STARTED, "job-1"));

            assertTrue(received.isEmpty());
        }

        @Test
        @DisplayName("delivers a job lifecycle in order")
        void deliversLifecycleInOrder() {
            List<RouterEvent> received = new ArrayList<>();
            eventBus.subscribe("job-1", received::add);

            eventBus.publish(event(RouterEvent.JOB_QUEUED, "job-1"));
            eventBus.publish(event(RouterEvent.JOB_STARTED, "job-1"));
            eventBus.publish(event(RouterEvent.JOB_RETRY_SCHEDULED, "job-1"));
            eventBus.publish(event(RouterEvent.JOB_STARTED, "job-1"));
            eventBus.publish(event(RouterEvent.JOB_COMPLETED, "job-1"));

            assertEquals(List.of("job.queued", "job.started", "job.retry_scheduled", "job.started", "job.completed"),
                    received.stream().map(RouterEvent::eventType).toList());
        }
    }

    @Nested
    @DisplayName("global subscription")
    class GlobalSubscriptionTests {

        @Test
        @DisplayName("global and job subscribers both receive the event")
        void globalAndJobSubscribersBothReceive() {
            List<RouterEvent> global = new ArrayList<>();
            List<RouterEvent> job = new ArrayList<>();
            eventBus.subscribeAll(global::add);
            eventBus.subscribe("job-1", job::add);

            eventBus.publish(event(RouterEvent.JOB_FAILED, "job-1"));
            eventBus.publish(event(RouterEvent.JOB_FAILED, "job-2"));

            assertEquals(2, global.size());
            assertEquals(1, job.size());
        }
    }

    @Nested
    @DisplayName("unsubscribe")
    class UnsubscribeTests {

        @Test
        @DisplayName("unsubscribing stops delivery of future events")
        void unsubscribeStopsDelivery() {
            List<RouterEvent> received = new ArrayList<>();
            EventBus.Subscription subscription = eventBus.subscribe("job-1", received::add);

            eventBus.publish(event(RouterEvent.JOB_STARTED, "job-1"));
            subscription.unsubscribe();
            eventBus.publish(event(RouterEvent.JOB_COMPLETED, "job-1"));

            assertEquals(1, received.size());
        }

        @Test
        @DisplayName("unsubscribing one subscriber does not affect others")
        void unsubscribeDoesNotAffectOthers() {
            List<RouterEvent> first = new ArrayList<>();
            List<RouterEvent> second = new ArrayList<>();
            EventBus.Subscription sub = eventBus.subscribe("job-1", first::add);
            eventBus.subscribe("job-1", second::add);

            sub.unsubscribe();
            eventBus.publish(event(RouterEvent.JOB_STARTED, "job-1"));

            assertTrue(first.isEmpty());
            assertEquals(1, second.size());
        }

        @Test
        @DisplayName("unsubscribing a global subscription stops delivery")
        void unsubscribeGlobal() {
            List<RouterEvent> received = new ArrayList<>();
            EventBus.Subscription subscription = eventBus.subscribeAll(received::add);
            subscription.unsubscribe();

            eventBus.publish(event(RouterEvent.JOB_QUEUED, "job-1"));

            assertTrue(received.isEmpty());
        }
    }

    @Nested
    @DisplayName("terminal events")
    class TerminalEventTests {

        @Test
        @DisplayName("job watchers are dropped after the terminal event is delivered")
        void watchersDroppedAfterTerminal() {
            List<RouterEvent> received = new ArrayList<>();
            eventBus.subscribe("job-1", received::add);
            eventBus.publish(event(RouterEvent.JOB_RETRY_SCHEDULED, "job-1"));
            assertEquals(1, eventBus.watcherCount("job-1"));

            eventBus.publish(event(RouterEvent.JOB_FAILED, "job-1"));
            eventBus.publish(event(RouterEvent.JOB_REMOVED, "job-1"));

            assertEquals(2, received.size());
            assertEquals(0, eventBus.watcherCount("job-1"));
        }

        @Test
        @DisplayName("global listeners keep receiving after a job ends")
        void globalListenersSurviveTerminal() {
            List<RouterEvent> received = new ArrayList<>();
            eventBus.subscribeAll(received::add);

            eventBus.publish(event(RouterEvent.JOB_COMPLETED, "job-1"));
            eventBus.publish(event(RouterEvent.JOB_QUEUED, "job-2"));

            assertEquals(2, received.size());
        }

        @Test
        @DisplayName("completed, failed and removed are the terminal types")
        void terminalTypes() {
            assertTrue(event(RouterEvent.JOB_COMPLETED, "j").isTerminal());
            assertTrue(event(RouterEvent.JOB_FAILED, "j").isTerminal());
            assertTrue(event(RouterEvent.JOB_REMOVED, "j").isTerminal());
            assertFalse(event(RouterEvent.JOB_QUEUED, "j").isTerminal());
            assertFalse(event(RouterEvent.JOB_STARTED, "j").isTerminal());
            assertFalse(event(RouterEvent.JOB_RETRY_SCHEDULED, "j").isTerminal());
        }
    }

    @Nested
    @DisplayName("robustness")
    class RobustnessTests {

        @Test
        @DisplayName("handles concurrent publishes safely")
        void handlesConcurrentPublishes() throws InterruptedException {
            CopyOnWriteArrayList<RouterEvent> received = new CopyOnWriteArrayList<>();
            eventBus.subscribe("job-1", received::add);

            int threadCount = 8;
            int eventsPerThread = 100;
            CountDownLatch latch = new CountDownLatch(threadCount);
            for (int t = 0; t < threadCount; t++) {
                new Thread(() -> {
                    for (int i = 0; i < eventsPerThread; i++) {
                        eventBus.publish(event(RouterEvent.JOB_STARTED, "job-1"));
                    }
                    latch.countDown();
                }).start();
            }

            assertTrue(latch.await(10, TimeUnit.SECONDS));
            assertEquals(threadCount * eventsPerThread, received.size());
        }

        @Test
        @DisplayName("subscriber exception does not prevent delivery to other subscribers")
        void subscriberExceptionIsolated() {
            List<RouterEvent> received = new ArrayList<>();
            eventBus.subscribe("job-1", e -> {
                throw new RuntimeException("boom");
            });
            eventBus.subscribe("job-1", received::add);

            eventBus.publish(event(RouterEvent.JOB_STARTED, "job-1"));

            assertEquals(1, received.size());
        }
    }
}
