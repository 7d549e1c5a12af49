package com.gathering.realtime.bus;

import com.gathering.realtime.event.Event;
import com.gathering.realtime.event.EventType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("EventBus Tests")
class EventBusTest {

    private EventBus bus;

    @BeforeEach
    void setUp() {
        bus = new EventBus();
    }

    @AfterEach
    void tearDown() {
        bus.close();
    }

    private static Event taskCompleted(int taskId) {
        return Event.builder()
                .type(EventType.TASK_COMPLETED)
                .payload(Map.of("task_id", taskId))
                .sourceAgentId(1)
                .circleId(1)
                .build();
    }

    @Nested
    @DisplayName("Subscription Tests")
    class SubscriptionTests {

        @Test
        @DisplayName("Should return distinct handles for identical registrations")
        void shouldReturnDistinctHandles() {
            EventHandler handler = event -> { };

            SubscriptionId first = bus.subscribe(EventType.TASK_COMPLETED, handler);
            SubscriptionId second = bus.subscribe(EventType.TASK_COMPLETED, handler);

            assertThat(first).isNotEqualTo(second);
            assertThat(bus.getSubscriberCount(EventType.TASK_COMPLETED)).isEqualTo(2);
            assertThat(bus.getStats().activeSubscribers()).isEqualTo(2);
        }

        @Test
        @DisplayName("Unnamed subscriptions should be named after their event type")
        void defaultSubscriptionName() {
            SubscriptionId plain = bus.subscribe(EventType.TASK_COMPLETED, event -> { });
            SubscriptionId async = bus.subscribeAsync(EventType.MEMORY_SHARED,
                    event -> CompletableFuture.completedFuture(null), null, null);
            SubscriptionId named = bus.subscribe(EventType.TASK_COMPLETED, event -> { }, null, "audit");

            assertThat(bus.subscriptionName(plain)).isEqualTo("task.completed-handler");
            assertThat(bus.subscriptionName(async)).isEqualTo("memory.shared-handler");
            assertThat(bus.subscriptionName(named)).isEqualTo("audit");
        }

        @Test
        @DisplayName("Unsubscribe should succeed once then report false")
        void unsubscribeShouldSucceedOnce() {
            SubscriptionId id = bus.subscribe(EventType.TASK_COMPLETED, event -> { });

            assertThat(bus.unsubscribe(id)).isTrue();
            assertThat(bus.unsubscribe(id)).isFalse();
            assertThat(bus.unsubscribe(null)).isFalse();
            assertThat(bus.getSubscriberCount(EventType.TASK_COMPLETED)).isZero();
        }

        @Test
        @DisplayName("Unsubscribed handler should no longer receive events")
        void unsubscribedHandlerShouldNotReceive() {
            AtomicInteger calls = new AtomicInteger();
            SubscriptionId id = bus.subscribe(EventType.TASK_COMPLETED, event -> calls.incrementAndGet());
            bus.subscribe(EventType.TASK_COMPLETED, event -> calls.addAndGet(10));

            bus.unsubscribe(id);
            bus.publish(taskCompleted(1));

            assertThat(calls.get()).isEqualTo(10);
        }

        @Test
        @DisplayName("Both copies of a duplicate registration should fire")
        void duplicateRegistrationsShouldBothFire() {
            AtomicInteger calls = new AtomicInteger();
            EventHandler handler = event -> calls.incrementAndGet();
            bus.subscribe(EventType.TASK_COMPLETED, handler);
            bus.subscribe(EventType.TASK_COMPLETED, handler);

            bus.publish(taskCompleted(1));

            assertThat(calls.get()).isEqualTo(2);
        }
    }

    @Nested
    @DisplayName("Publishing Tests")
    class PublishingTests {

        @Test
        @DisplayName("Should deliver only to subscribers of the published type")
        void shouldDeliverOnlyToMatchingType() {
            List<Event> completed = Collections.synchronizedList(new ArrayList<>());
            AtomicInteger failedCalls = new AtomicInteger();
            bus.subscribe(EventType.TASK_COMPLETED, completed::add);
            bus.subscribe(EventType.TASK_FAILED, event -> failedCalls.incrementAndGet());

            Event event = taskCompleted(123);
            bus.publish(event);

            assertThat(completed).containsExactly(event);
            assertThat(failedCalls.get()).isZero();
        }

        @Test
        @DisplayName("Should skip subscribers whose filter rejects the event")
        void shouldApplyFilters() {
            List<Integer> received = Collections.synchronizedList(new ArrayList<>());
            bus.subscribe(EventType.TASK_COMPLETED,
                    event -> received.add(event.circleId()),
                    EventCriteria.forCircle(1));
            bus.subscribe(EventType.TASK_COMPLETED,
                    event -> received.add(-event.circleId()),
                    event -> event.circleId() != null && event.circleId() == 2);

            bus.publish(Event.builder().type(EventType.TASK_COMPLETED).circleId(1).build());
            bus.publish(Event.builder().type(EventType.TASK_COMPLETED).circleId(2).build());
            bus.publish(Event.builder().type(EventType.TASK_COMPLETED).circleId(3).build());

            assertThat(received).containsExactlyInAnyOrder(1, -2);
            assertThat(bus.getStats().eventsDelivered()).isEqualTo(2);
            assertThat(bus.getStats().eventsPublished()).isEqualTo(3);
        }

        @Test
        @DisplayName("A failing handler should not affect its siblings")
        void failingHandlerShouldBeIsolated() {
            AtomicInteger succeeded = new AtomicInteger();
            bus.subscribe(EventType.TASK_COMPLETED, event -> {
                throw new IllegalStateException("boom");
            }, null, "failing-1");
            bus.subscribe(EventType.TASK_COMPLETED, event -> succeeded.incrementAndGet());
            bus.subscribe(EventType.TASK_COMPLETED, event -> {
                throw new Exception("checked boom");
            }, null, "failing-2");
            bus.subscribe(EventType.TASK_COMPLETED, event -> succeeded.incrementAndGet());

            bus.publish(taskCompleted(1));

            assertThat(succeeded.get()).isEqualTo(2);
            EventBusStats stats = bus.getStats();
            assertThat(stats.handlerErrors()).isEqualTo(2);
            assertThat(stats.eventsDelivered()).isEqualTo(4);
        }

        @Test
        @DisplayName("A throwing filter should count as a handler error")
        void throwingFilterShouldCountAsHandlerError() {
            AtomicInteger succeeded = new AtomicInteger();
            bus.subscribe(EventType.TASK_COMPLETED, event -> succeeded.incrementAndGet(), event -> {
                throw new IllegalArgumentException("bad filter");
            });
            bus.subscribe(EventType.TASK_COMPLETED, event -> succeeded.incrementAndGet());

            bus.publish(taskCompleted(1));

            assertThat(succeeded.get()).isEqualTo(1);
            assertThat(bus.getStats().handlerErrors()).isEqualTo(1);
            assertThat(bus.getStats().eventsDelivered()).isEqualTo(1);
        }

        @Test
        @DisplayName("Publishing without subscribers should still record the event")
        void publishWithoutSubscribers() {
            bus.publish(taskCompleted(1));

            assertThat(bus.getStats().eventsPublished()).isEqualTo(1);
            assertThat(bus.getStats().eventsDelivered()).isZero();
            assertThat(bus.getHistory()).hasSize(1);
        }

        @Test
        @DisplayName("Should await asynchronous handlers before returning")
        void shouldAwaitAsyncHandlers() {
            AtomicBoolean finished = new AtomicBoolean();
            bus.subscribeAsync(EventType.TASK_COMPLETED,
                    event -> CompletableFuture.runAsync(() -> finished.set(true),
                            CompletableFuture.delayedExecutor(50, TimeUnit.MILLISECONDS)),
                    null, "async");

            bus.publish(taskCompleted(1));

            assertThat(finished).isTrue();
            assertThat(bus.getStats().handlerErrors()).isZero();
        }

        @Test
        @DisplayName("An exceptionally completed async handler should count as an error")
        void failedAsyncHandlerShouldCountAsError() {
            bus.subscribeAsync(EventType.TASK_COMPLETED,
                    event -> CompletableFuture.failedFuture(new IllegalStateException("async boom")),
                    null, "async-failing");

            bus.publish(taskCompleted(1));

            assertThat(bus.getStats().handlerErrors()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("Deduplication Tests")
    class DeduplicationTests {

        @Test
        @DisplayName("Deduplication should be disabled by default")
        void disabledByDefault() {
            AtomicInteger calls = new AtomicInteger();
            bus.subscribe(EventType.TASK_COMPLETED, event -> calls.incrementAndGet());

            for (int i = 0; i < 3; i++) {
                bus.publish(taskCompleted(1));
            }

            assertThat(bus.isDedupEnabled()).isFalse();
            assertThat(calls.get()).isEqualTo(3);
            assertThat(bus.getStats().eventsDeduplicated()).isZero();
        }

        @Test
        @DisplayName("Identical events within the window should be delivered once")
        void identicalEventsWithinWindow() throws InterruptedException {
            bus.configure(null, Duration.ofMillis(300), true);
            AtomicInteger calls = new AtomicInteger();
            bus.subscribe(EventType.TASK_COMPLETED, event -> calls.incrementAndGet());

            for (int i = 0; i < 5; i++) {
                bus.publish(taskCompleted(42));
            }

            assertThat(calls.get()).isEqualTo(1);
            assertThat(bus.getStats().eventsDeduplicated()).isEqualTo(4);
            assertThat(bus.getHistory()).hasSize(1);

            Thread.sleep(400);
            bus.publish(taskCompleted(42));

            assertThat(calls.get()).isEqualTo(2);
        }

        @Test
        @DisplayName("Distinct payloads should never be deduplicated")
        void distinctPayloadsAreDelivered() {
            bus.configure(null, Duration.ofSeconds(10), true);
            AtomicInteger calls = new AtomicInteger();
            bus.subscribe(EventType.TASK_COMPLETED, event -> calls.incrementAndGet());

            for (int i = 0; i < 50; i++) {
                bus.publish(taskCompleted(i));
            }

            assertThat(calls.get()).isEqualTo(50);
            assertThat(bus.getStats().eventsDeduplicated()).isZero();
        }

        @Test
        @DisplayName("Dedup key should ignore payload ordering but not source or circle")
        void dedupKeyComposition() {
            Event first = Event.builder().type(EventType.MEMORY_SHARED)
                    .payload(Map.of("a", 1, "b", 2)).sourceAgentId(1).circleId(7).build();
            Event reordered = Event.builder().type(EventType.MEMORY_SHARED)
                    .payload(Map.of("b", 2, "a", 1)).sourceAgentId(1).circleId(7).build();
            Event otherCircle = first.toBuilder().circleId(8).id(null).build();

            assertThat(EventBus.dedupKey(first)).isEqualTo(EventBus.dedupKey(reordered));
            assertThat(EventBus.dedupKey(first)).isNotEqualTo(EventBus.dedupKey(otherCircle));
            assertThat(EventBus.dedupKey(Event.of(EventType.MEMORY_SHARED)))
                    .isEqualTo(EventBus.dedupKey(Event.of(EventType.MEMORY_SHARED)));
        }

        @Test
        @DisplayName("Payloads with colliding string hashes should both be delivered")
        void collidingHashesAreDelivered() {
            // Given "Aa" and "BB" share a String hash code
            bus.configure(null, Duration.ofSeconds(10), true);
            AtomicInteger calls = new AtomicInteger();
            bus.subscribe(EventType.TASK_COMPLETED, event -> calls.incrementAndGet());

            // When
            bus.publish(Event.of(EventType.TASK_COMPLETED, Map.of("name", "Aa")));
            bus.publish(Event.of(EventType.TASK_COMPLETED, Map.of("name", "BB")));

            // Then
            assertThat(calls.get()).isEqualTo(2);
            assertThat(bus.getStats().eventsDeduplicated()).isZero();
        }

        @Test
        @DisplayName("Keys and values containing separators should not be confused")
        void separatorsInKeysAndValues() {
            bus.configure(null, Duration.ofSeconds(10), true);
            AtomicInteger calls = new AtomicInteger();
            bus.subscribe(EventType.TASK_COMPLETED, event -> calls.incrementAndGet());

            bus.publish(Event.of(EventType.TASK_COMPLETED, Map.of("a", "1=b")));
            bus.publish(Event.of(EventType.TASK_COMPLETED, Map.of("a=1", "b")));
            bus.publish(Event.of(EventType.TASK_COMPLETED, Map.of("n", 1)));
            bus.publish(Event.of(EventType.TASK_COMPLETED, Map.of("n", "1")));

            assertThat(calls.get()).isEqualTo(4);
            assertThat(bus.getStats().eventsDeduplicated()).isZero();
        }

        @Test
        @DisplayName("Stale dedup entries should be pruned periodically")
        void staleEntriesArePruned() throws InterruptedException {
            bus.configure(null, Duration.ofMillis(1), true);

            for (int i = 0; i < EventBus.DEDUP_PRUNE_INTERVAL; i++) {
                bus.publish(taskCompleted(i));
            }
            assertThat(bus.dedupCacheSize()).isEqualTo(EventBus.DEDUP_PRUNE_INTERVAL);

            Thread.sleep(20);
            bus.publish(taskCompleted(-1));

            assertThat(bus.dedupCacheSize()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("History Tests")
    class HistoryTests {

        @Test
        @DisplayName("Should return most recent events first")
        void mostRecentFirst() {
            for (int i = 0; i < 5; i++) {
                bus.publish(taskCompleted(i));
            }

            List<Event> history = bus.getHistory(EventType.TASK_COMPLETED, 3);

            assertThat(history).extracting(event -> event.payload().get("task_id")).containsExactly(4, 3, 2);
        }

        @Test
        @DisplayName("Should honor type and attribute filters")
        void typeAndAttributeFilters() {
            bus.publish(Event.builder().type(EventType.TASK_COMPLETED).circleId(1).build());
            bus.publish(Event.builder().type(EventType.TASK_FAILED).circleId(1).build());
            bus.publish(Event.builder().type(EventType.TASK_COMPLETED).circleId(2).sourceAgentId(5).build());

            assertThat(bus.getHistory(EventType.TASK_COMPLETED, 10)).hasSize(2);
            assertThat(bus.getHistory(null, 10, EventCriteria.forCircle(1))).hasSize(2);
            assertThat(bus.getHistory(EventType.TASK_COMPLETED, 10, EventCriteria.forCircle(1))).hasSize(1);
            assertThat(bus.getHistory(null, 10, EventCriteria.builder().circleId(2).sourceAgentId(5).build()))
                    .singleElement()
                    .extracting(Event::sourceAgentId)
                    .isEqualTo(5);
            assertThat(bus.getHistory(null, 10, EventCriteria.forTypes(EventType.TASK_FAILED))).hasSize(1);
            assertThat(bus.getHistory(null, 0)).isEmpty();
        }

        @Test
        @DisplayName("Should evict the oldest events beyond capacity")
        void evictsOldest() {
            try (EventBus small = new EventBus(10, 5, Duration.ofSeconds(1), false)) {
                for (int i = 0; i < 8; i++) {
                    small.publish(taskCompleted(i));
                }

                List<Event> history = small.getHistory(null, 100);

                assertThat(history).hasSize(5);
                assertThat(history).extracting(event -> event.payload().get("task_id")).containsExactly(7, 6, 5, 4, 3);
                assertThat(small.getStats().historySize()).isEqualTo(5);
            }
        }

        @Test
        @DisplayName("Should reject a negative limit")
        void rejectsNegativeLimit() {
            assertThatThrownBy(() -> bus.getHistory(null, -1))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Configuration Tests")
    class ConfigurationTests {

        @Test
        @DisplayName("Should only change the supplied settings")
        void partialConfiguration() {
            bus.configure(5, null, null);

            assertThat(bus.getMaxConcurrentHandlers()).isEqualTo(5);
            assertThat(bus.getDedupWindow()).isEqualTo(EventBus.DEFAULT_DEDUP_WINDOW);
            assertThat(bus.isDedupEnabled()).isFalse();

            bus.configure(null, Duration.ofMillis(250), true);

            assertThat(bus.getMaxConcurrentHandlers()).isEqualTo(5);
            assertThat(bus.getDedupWindow()).isEqualTo(Duration.ofMillis(250));
            assertThat(bus.isDedupEnabled()).isTrue();
        }

        @Test
        @DisplayName("Should reject invalid settings")
        void rejectsInvalidSettings() {
            assertThatThrownBy(() -> bus.configure(0, null, null)).isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> bus.configure(null, Duration.ofMillis(-1), null))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> new EventBus(10, 0, Duration.ZERO, false))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("Reset should clear subscriptions, history and counters")
        void resetClearsState() {
            bus.subscribe(EventType.TASK_COMPLETED, event -> {
                throw new IllegalStateException("boom");
            });
            bus.publish(taskCompleted(1));

            bus.reset();

            EventBusStats stats = bus.getStats();
            assertThat(stats.eventsPublished()).isZero();
            assertThat(stats.eventsDelivered()).isZero();
            assertThat(stats.handlerErrors()).isZero();
            assertThat(stats.activeSubscribers()).isZero();
            assertThat(stats.historySize()).isZero();
        }

        @Test
        @DisplayName("Stats map should use snake_case keys")
        void statsMap() {
            bus.publish(taskCompleted(1));

            assertThat(bus.getStats().toMap())
                    .containsEntry("events_published", 1L)
                    .containsKeys("events_delivered", "events_deduplicated", "handler_errors",
                            "active_subscribers", "history_size");
        }
    }
}
