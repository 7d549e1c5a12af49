package com.gathering.realtime.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gathering.realtime.bus.EventBus;
import com.gathering.realtime.bus.QueuedEventPublisher;
import com.gathering.realtime.websocket.ConnectionManager;
import com.gathering.realtime.websocket.EventBroadcastBridge;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Builds the single bus and connection manager instances of the application and
 * wires them together. Everything else receives them by injection.
 */
@Slf4j
@Configuration
public class EventBusConfig {

    @Bean(destroyMethod = "close")
    public EventBus eventBus(EventBusProperties properties) {
        log.info("Creating event bus: maxConcurrentHandlers={}, historySize={}, dedupEnabled={}, dedupWindow={}",
                properties.getMaxConcurrentHandlers(), properties.getHistorySize(),
                properties.isDedupEnabled(), properties.getDedupWindow());
        return new EventBus(
                properties.getMaxConcurrentHandlers(),
                properties.getHistorySize(),
                properties.getDedupWindow(),
                properties.isDedupEnabled());
    }

    @Bean
    public QueuedEventPublisher queuedEventPublisher(EventBus eventBus, EventBusProperties properties) {
        return new QueuedEventPublisher(eventBus, properties.getQueueCapacity(), properties.getQueueDrainTimeout());
    }

    @Bean(destroyMethod = "close")
    public ConnectionManager connectionManager(ObjectMapper objectMapper) {
        return new ConnectionManager(objectMapper);
    }

    @Bean
    public EventBroadcastBridge eventBroadcastBridge(EventBus eventBus, ConnectionManager connectionManager) {
        return new EventBroadcastBridge(eventBus, connectionManager);
    }
}
