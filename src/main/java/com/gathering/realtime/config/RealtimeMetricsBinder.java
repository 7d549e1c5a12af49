package com.gathering.realtime.config;

import com.gathering.realtime.bus.EventBus;
import com.gathering.realtime.bus.QueuedEventPublisher;
import com.gathering.realtime.websocket.ConnectionManager;
import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;

/**
 * Exposes the bus and connection counters through Micrometer.
 */
@Component
public class RealtimeMetricsBinder implements MeterBinder {

    private final EventBus eventBus;
    private final QueuedEventPublisher queuedEventPublisher;
    private final ConnectionManager connectionManager;

    public RealtimeMetricsBinder(EventBus eventBus,
                                 QueuedEventPublisher queuedEventPublisher,
                                 ConnectionManager connectionManager) {
        this.eventBus = eventBus;
        this.queuedEventPublisher = queuedEventPublisher;
        this.connectionManager = connectionManager;
    }

    @Override
    public void bindTo(@NonNull MeterRegistry registry) {
        FunctionCounter.builder("events.published", eventBus, bus -> bus.getStats().eventsPublished())
                .register(registry);
        FunctionCounter.builder("events.delivered", eventBus, bus -> bus.getStats().eventsDelivered())
                .register(registry);
        FunctionCounter.builder("events.deduplicated", eventBus, bus -> bus.getStats().eventsDeduplicated())
                .register(registry);
        FunctionCounter.builder("events.handler.errors", eventBus, bus -> bus.getStats().handlerErrors())
                .register(registry);
        Gauge.builder("events.subscribers.active", eventBus, bus -> bus.getStats().activeSubscribers())
                .register(registry);
        Gauge.builder("events.queue.size", queuedEventPublisher, QueuedEventPublisher::getQueueSize)
                .register(registry);
        FunctionCounter.builder("events.queue.rejected", queuedEventPublisher, QueuedEventPublisher::getRejectedCount)
                .register(registry);

        Gauge.builder("websocket.connections.active", connectionManager, ConnectionManager::getClientCount)
                .register(registry);
        FunctionCounter.builder("websocket.messages.sent", connectionManager,
                        manager -> manager.getStats().totalMessagesSent())
                .register(registry);
        FunctionCounter.builder("websocket.broadcasts", connectionManager,
                        manager -> manager.getStats().totalBroadcasts())
                .register(registry);
    }
}
