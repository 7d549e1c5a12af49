package com.gathering.realtime.bus;

import com.gathering.realtime.event.Event;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Non-blocking entry point for code that cannot wait on {@link EventBus#publish}.
 *
 * <p>Events go into a bounded queue that a single dispatcher thread drains,
 * publishing them one at a time in enqueue order.
 */
@Slf4j
public class QueuedEventPublisher implements SmartLifecycle {

    public static final int DEFAULT_CAPACITY = 10_000;

    private static final Duration POLL_INTERVAL = Duration.ofMillis(200);

    private final EventBus eventBus;
    private final BlockingQueue<Event> queue;
    private final Duration drainTimeout;

    private final AtomicLong enqueued = new AtomicLong();
    private final AtomicLong rejected = new AtomicLong();
    private final AtomicLong dispatched = new AtomicLong();

    private volatile boolean running;
    private volatile Thread dispatcher;

    public QueuedEventPublisher(EventBus eventBus) {
        this(eventBus, DEFAULT_CAPACITY, Duration.ofSeconds(5));
    }

    public QueuedEventPublisher(EventBus eventBus, int capacity, Duration drainTimeout) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus");
        this.queue = new LinkedBlockingQueue<>(capacity);
        this.drainTimeout = drainTimeout;
    }

    /**
     * Queues {@code event} for publishing without waiting.
     *
     * @return false when the publisher is stopped or the queue is full
     */
    public boolean enqueue(Event event) {
        Objects.requireNonNull(event, "event");
        if (!running || !queue.offer(event)) {
            rejected.incrementAndGet();
            log.warn("Dropped event {} ({}): publisher {}", event.id(), event.type(), running ? "queue full" : "not running");
            return false;
        }
        enqueued.incrementAndGet();
        return true;
    }

    private void dispatchLoop() {
        log.info("Event dispatcher started");
        while (running || !queue.isEmpty()) {
            Event event;
            try {
                event = queue.poll(POLL_INTERVAL.toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            if (event == null) {
                continue;
            }
            try {
                eventBus.publish(event);
                dispatched.incrementAndGet();
            } catch (RuntimeException e) {
                log.error("Failed to publish queued event {}", event.id(), e);
            }
        }
        log.info("Event dispatcher stopped, {} events left in queue", queue.size());
    }

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        Thread thread = new Thread(this::dispatchLoop, "event-dispatcher");
        thread.setDaemon(true);
        dispatcher = thread;
        thread.start();
    }

    /**
     * Stops accepting events and lets the dispatcher drain what is already queued,
     * waiting at most the drain timeout.
     */
    @Override
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        Thread thread = dispatcher;
        if (thread == null) {
            return;
        }
        try {
            thread.join(drainTimeout.toMillis());
            if (thread.isAlive()) {
                log.warn("Event dispatcher did not drain within {}, interrupting", drainTimeout);
                thread.interrupt();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            thread.interrupt();
        }
        dispatcher = null;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    public int getQueueSize() {
        return queue.size();
    }

    public long getEnqueuedCount() {
        return enqueued.get();
    }

    public long getRejectedCount() {
        return rejected.get();
    }

    public long getDispatchedCount() {
        return dispatched.get();
    }
}
