package com.gathering.realtime.config;

import com.gathering.realtime.bus.EventBus;
import com.gathering.realtime.bus.QueuedEventPublisher;
import com.gathering.realtime.event.EventType;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Tuning for the event bus and the WebSocket broadcast, bound from {@code app.events.*}.
 */
@Data
@ConfigurationProperties(prefix = "app.events")
public class EventBusProperties {

    private int maxConcurrentHandlers = EventBus.DEFAULT_MAX_CONCURRENT_HANDLERS;

    private int historySize = EventBus.DEFAULT_HISTORY_SIZE;

    private Duration dedupWindow = EventBus.DEFAULT_DEDUP_WINDOW;

    // Opt-in only
    private boolean dedupEnabled = false;

    private int queueCapacity = QueuedEventPublisher.DEFAULT_CAPACITY;

    private Duration queueDrainTimeout = Duration.ofSeconds(5);

    private Broadcast broadcast = new Broadcast();

    @Data
    public static class Broadcast {

        private boolean enabled = true;

        /**
         * Types forwarded to WebSocket clients; empty means the default list.
         */
        private List<EventType> types = new ArrayList<>();
    }
}
