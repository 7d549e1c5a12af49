package com.gathering.realtime.bus;

import com.gathering.realtime.event.Event;
import com.gathering.realtime.event.EventType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;

/**
 * In-process publish/subscribe hub.
 *
 * <p>Handlers of one publish run concurrently on the bus executor, each one
 * holding a permit of a single process-wide {@link Semaphore} while it runs.
 * {@link #publish(Event)} blocks until every dispatched handler has finished,
 * so events published one after another by the same caller are fanned out in
 * order. A failing handler (or filter) is logged and counted, never rethrown.
 *
 * <p>Identical events inside a short window can be suppressed when
 * deduplication is switched on through {@link #configure}. It is off by
 * default.
 */
@Slf4j
public class EventBus implements AutoCloseable {

    public static final int DEFAULT_MAX_CONCURRENT_HANDLERS = 100;
    public static final int DEFAULT_HISTORY_SIZE = 1000;
    public static final Duration DEFAULT_DEDUP_WINDOW = Duration.ofSeconds(1);

    static final int DEDUP_PRUNE_INTERVAL = 1000;

    // Registry: type -> subscriptions in registration order
    private final Map<EventType, List<Subscription>> subscribers = new ConcurrentHashMap<>();
    private final Map<SubscriptionId, Subscription> subscriptionsById = new ConcurrentHashMap<>();

    private final int historyCapacity;
    private final ArrayDeque<Event> history;

    // Dedup key -> System.nanoTime() of the last accepted sighting
    private final Map<DedupKey, Long> seenEvents = new ConcurrentHashMap<>();

    private final ExecutorService executor;

    private volatile int maxConcurrentHandlers;
    private volatile Semaphore handlerPermits;
    private volatile Duration dedupWindow;
    private volatile boolean dedupEnabled;

    private final AtomicLong eventsPublished = new AtomicLong();
    private final AtomicLong eventsDelivered = new AtomicLong();
    private final AtomicLong eventsDeduplicated = new AtomicLong();
    private final AtomicLong handlerErrors = new AtomicLong();

    public EventBus() {
        this(DEFAULT_MAX_CONCURRENT_HANDLERS, DEFAULT_HISTORY_SIZE, DEFAULT_DEDUP_WINDOW, false);
    }

    public EventBus(int maxConcurrentHandlers, int historyCapacity, Duration dedupWindow, boolean dedupEnabled) {
        if (historyCapacity <= 0) {
            throw new IllegalArgumentException("historyCapacity must be positive: " + historyCapacity);
        }
        validateConcurrency(maxConcurrentHandlers);
        validateWindow(dedupWindow);
        this.historyCapacity = historyCapacity;
        this.history = new ArrayDeque<>(Math.min(historyCapacity, 1024));
        this.maxConcurrentHandlers = maxConcurrentHandlers;
        this.handlerPermits = new Semaphore(maxConcurrentHandlers);
        this.dedupWindow = dedupWindow;
        this.dedupEnabled = dedupEnabled;

        // The semaphore is the only concurrency cap, the pool itself is unbounded.
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("event-bus-");
        threadFactory.setDaemon(true);
        this.executor = Executors.newCachedThreadPool(threadFactory);
    }

    // ==================== SUBSCRIPTIONS ====================

    public SubscriptionId subscribe(EventType type, EventHandler handler) {
        return subscribe(type, handler, null, null);
    }

    public SubscriptionId subscribe(EventType type, EventHandler handler, EventFilter filter) {
        return subscribe(type, handler, filter, null);
    }

    /**
     * Registers {@code handler} for events of {@code type}. Registering the same
     * handler twice yields two independent subscriptions that both fire.
     *
     * @param filter optional predicate, events it rejects are not delivered
     * @param name   display name used in logs, defaults to {@code <type>-handler}
     * @return handle for {@link #unsubscribe(SubscriptionId)}
     */
    public SubscriptionId subscribe(EventType type, EventHandler handler, EventFilter filter, String name) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(handler, "handler");

        SubscriptionId id = SubscriptionId.next();
        String displayName = name != null ? name : type.getValue() + "-handler";
        Subscription subscription = new Subscription(id, type, handler, filter, displayName);

        subscribers.computeIfAbsent(type, key -> new CopyOnWriteArrayList<>()).add(subscription);
        subscriptionsById.put(id, subscription);

        log.debug("Subscribed '{}' to {} ({})", displayName, type, id);
        return id;
    }

    /**
     * Registers a handler that completes asynchronously. The returned stage is
     * awaited while the handler holds its permit, and an exceptional completion
     * counts as a handler error.
     */
    public SubscriptionId subscribeAsync(EventType type,
                                         Function<Event, ? extends CompletionStage<?>> handler,
                                         EventFilter filter,
                                         String name) {
        Objects.requireNonNull(handler, "handler");
        EventHandler awaiting = event -> {
            CompletionStage<?> stage = handler.apply(event);
            if (stage == null) {
                return;
            }
            try {
                stage.toCompletableFuture().get();
            } catch (ExecutionException e) {
                if (e.getCause() instanceof Exception cause) {
                    throw cause;
                }
                throw e;
            }
        };
        return subscribe(type, awaiting, filter, name);
    }

    /**
     * @return true if the subscription existed and was removed, false otherwise
     */
    public boolean unsubscribe(SubscriptionId id) {
        if (id == null) {
            return false;
        }
        Subscription subscription = subscriptionsById.remove(id);
        if (subscription == null) {
            return false;
        }
        List<Subscription> forType = subscribers.get(subscription.type());
        if (forType != null) {
            forType.remove(subscription);
        }
        log.debug("Unsubscribed '{}' from {}", subscription.name(), subscription.type());
        return true;
    }

    public int getSubscriberCount(EventType type) {
        List<Subscription> forType = subscribers.get(type);
        return forType == null ? 0 : forType.size();
    }

    String subscriptionName(SubscriptionId id) {
        Subscription subscription = subscriptionsById.get(id);
        return subscription == null ? null : subscription.name();
    }

    // ==================== PUBLISHING ====================

    /**
     * Delivers {@code event} to every matching subscriber and returns once all of
     * them have finished, successfully or not.
     */
    public void publish(Event event) {
        Objects.requireNonNull(event, "event");

        if (dedupEnabled && isDuplicate(event)) {
            eventsDeduplicated.incrementAndGet();
            log.debug("Suppressed duplicate event {} ({})", event.id(), event.type());
            return;
        }

        recordHistory(event);
        eventsPublished.incrementAndGet();

        List<Subscription> candidates = subscribers.get(event.type());
        if (candidates == null || candidates.isEmpty()) {
            return;
        }

        List<Subscription> accepted = new ArrayList<>(candidates.size());
        for (Subscription subscription : candidates) {
            if (passesFilter(subscription, event)) {
                accepted.add(subscription);
            }
        }
        if (accepted.isEmpty()) {
            return;
        }

        CompletableFuture<?>[] invocations = new CompletableFuture<?>[accepted.size()];
        for (int i = 0; i < accepted.size(); i++) {
            Subscription subscription = accepted.get(i);
            invocations[i] = CompletableFuture.runAsync(() -> invoke(subscription, event), executor);
        }
        CompletableFuture.allOf(invocations).join();

        eventsDelivered.addAndGet(accepted.size());
    }

    private boolean passesFilter(Subscription subscription, Event event) {
        if (subscription.filter() == null) {
            return true;
        }
        try {
            return subscription.filter().accept(event);
        } catch (Exception e) {
            handlerErrors.incrementAndGet();
            log.error("Error in filter of handler '{}' for event {}", subscription.name(), event.id(), e);
            return false;
        }
    }

    private void invoke(Subscription subscription, Event event) {
        // Release into the limiter we acquired from, even if configure() swaps it meanwhile
        Semaphore permits = handlerPermits;
        try {
            permits.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            handlerErrors.incrementAndGet();
            log.warn("Interrupted while waiting to run handler '{}' for event {}", subscription.name(), event.id());
            return;
        }
        try {
            subscription.handler().handle(event);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            handlerErrors.incrementAndGet();
            log.error("Handler '{}' interrupted while processing event {}", subscription.name(), event.id(), e);
        } catch (Exception e) {
            handlerErrors.incrementAndGet();
            log.error("Error in handler '{}' for event {}", subscription.name(), event.id(), e);
        } finally {
            permits.release();
        }
    }

    // ==================== DEDUPLICATION ====================

    private boolean isDuplicate(Event event) {
        DedupKey key = dedupKey(event);
        long now = System.nanoTime();
        long windowNanos = dedupWindow.toNanos();
        synchronized (seenEvents) {
            Long lastSeen = seenEvents.get(key);
            if (lastSeen != null && now - lastSeen < windowNanos) {
                return true;
            }
            seenEvents.put(key, now);
            if (eventsPublished.get() % DEDUP_PRUNE_INTERVAL == 0) {
                pruneSeenEvents(now, windowNanos);
            }
            return false;
        }
    }

    static DedupKey dedupKey(Event event) {
        return new DedupKey(event.type(), event.sourceAgentId(), event.circleId(), event.payload());
    }

    /**
     * Identity of an event for deduplication. The payload takes part through
     * {@link Map#equals}, so entry order is irrelevant and distinct payloads
     * never share a key.
     */
    record DedupKey(EventType type, Integer sourceAgentId, Integer circleId, Map<String, Object> payload) {
    }

    private void pruneSeenEvents(long now, long windowNanos) {
        long maxAge = windowNanos * 2;
        int before = seenEvents.size();
        seenEvents.values().removeIf(seenAt -> now - seenAt > maxAge);
        log.debug("Pruned {} stale dedup entries", before - seenEvents.size());
    }

    int dedupCacheSize() {
        return seenEvents.size();
    }

    // ==================== HISTORY ====================

    private void recordHistory(Event event) {
        synchronized (history) {
            if (history.size() >= historyCapacity) {
                history.pollFirst();
            }
            history.addLast(event);
        }
    }

    public List<Event> getHistory() {
        return getHistory(null, 100, null);
    }

    public List<Event> getHistory(EventType type, int limit) {
        return getHistory(type, limit, null);
    }

    /**
     * Returns recorded events, most recent first.
     *
     * @param type     only events of this type, or any type when null
     * @param limit    maximum number of events returned
     * @param criteria additional attribute filter, may be null
     */
    public List<Event> getHistory(EventType type, int limit, EventCriteria criteria) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit must not be negative: " + limit);
        }
        List<Event> snapshot;
        synchronized (history) {
            snapshot = new ArrayList<>(history);
        }
        List<Event> result = new ArrayList<>(Math.min(limit, snapshot.size()));
        for (int i = snapshot.size() - 1; i >= 0 && result.size() < limit; i--) {
            Event event = snapshot.get(i);
            if (type != null && event.type() != type) {
                continue;
            }
            if (criteria != null && !criteria.accept(event)) {
                continue;
            }
            result.add(event);
        }
        return Collections.unmodifiableList(result);
    }

    public void clearHistory() {
        synchronized (history) {
            history.clear();
        }
    }

    public int getHistoryCapacity() {
        return historyCapacity;
    }

    // ==================== STATS & TUNING ====================

    public EventBusStats getStats() {
        int historySize;
        synchronized (history) {
            historySize = history.size();
        }
        return new EventBusStats(
                eventsPublished.get(),
                eventsDelivered.get(),
                eventsDeduplicated.get(),
                handlerErrors.get(),
                subscriptionsById.size(),
                historySize);
    }

    /**
     * Adjusts tuning at runtime. Null arguments leave the current value in place.
     * A new handler limit takes effect for invocations that start afterwards.
     */
    public void configure(Integer maxConcurrentHandlers, Duration dedupWindow, Boolean dedupEnabled) {
        if (maxConcurrentHandlers != null) {
            validateConcurrency(maxConcurrentHandlers);
            this.maxConcurrentHandlers = maxConcurrentHandlers;
            this.handlerPermits = new Semaphore(maxConcurrentHandlers);
        }
        if (dedupWindow != null) {
            validateWindow(dedupWindow);
            this.dedupWindow = dedupWindow;
        }
        if (dedupEnabled != null) {
            this.dedupEnabled = dedupEnabled;
        }
        log.info("Event bus configured: maxConcurrentHandlers={}, dedupWindow={}, dedupEnabled={}",
                this.maxConcurrentHandlers, this.dedupWindow, this.dedupEnabled);
    }

    public int getMaxConcurrentHandlers() {
        return maxConcurrentHandlers;
    }

    public Duration getDedupWindow() {
        return dedupWindow;
    }

    public boolean isDedupEnabled() {
        return dedupEnabled;
    }

    /**
     * Drops subscriptions, history, dedup state and counters. Meant for tests.
     */
    public void reset() {
        subscribers.clear();
        subscriptionsById.clear();
        clearHistory();
        synchronized (seenEvents) {
            seenEvents.clear();
        }
        handlerPermits = new Semaphore(maxConcurrentHandlers);
        eventsPublished.set(0);
        eventsDelivered.set(0);
        eventsDeduplicated.set(0);
        handlerErrors.set(0);
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                List<Runnable> dropped = executor.shutdownNow();
                log.warn("Event bus executor did not stop in time, {} queued invocations dropped", dropped.size());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }

    private static void validateConcurrency(int maxConcurrentHandlers) {
        if (maxConcurrentHandlers <= 0) {
            throw new IllegalArgumentException("maxConcurrentHandlers must be positive: " + maxConcurrentHandlers);
        }
    }

    private static void validateWindow(Duration window) {
        if (window == null || window.isNegative()) {
            throw new IllegalArgumentException("dedupWindow must not be negative: " + window);
        }
    }
}
