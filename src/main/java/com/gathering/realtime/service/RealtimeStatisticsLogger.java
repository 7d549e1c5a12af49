package com.gathering.realtime.service;

import com.gathering.realtime.bus.EventBus;
import com.gathering.realtime.bus.EventBusStats;
import com.gathering.realtime.bus.QueuedEventPublisher;
import com.gathering.realtime.websocket.ConnectionManager;
import com.gathering.realtime.websocket.ConnectionStats;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class RealtimeStatisticsLogger {

    static final long HANDLER_ERROR_ALERT_THRESHOLD = 100;

    private final EventBus eventBus;
    private final QueuedEventPublisher queuedEventPublisher;
    private final ConnectionManager connectionManager;

    private long lastHandlerErrors;

    /**
     * Log event distribution statistics for monitoring
     * Runs every 5 minutes by default
     */
    @Scheduled(fixedRateString = "${app.events.stats-log-interval:300000}")
    public synchronized void logStatistics() {
        try {
            EventBusStats bus = eventBus.getStats();
            ConnectionStats connections = connectionManager.getStats();

            log.info("=== EVENT DISTRIBUTION STATISTICS ===");
            log.info("Event Bus - Published: {}, Delivered: {}, Deduplicated: {}, Handler Errors: {}",
                    bus.eventsPublished(), bus.eventsDelivered(), bus.eventsDeduplicated(), bus.handlerErrors());
            log.info("Event Bus - Subscribers: {}, History: {}/{}",
                    bus.activeSubscribers(), bus.historySize(), eventBus.getHistoryCapacity());
            log.info("Queue - Pending: {}, Enqueued: {}, Dispatched: {}, Rejected: {}",
                    queuedEventPublisher.getQueueSize(), queuedEventPublisher.getEnqueuedCount(),
                    queuedEventPublisher.getDispatchedCount(), queuedEventPublisher.getRejectedCount());
            log.info("WebSocket - Active: {}, Total Connections: {}, Messages Sent: {}, Broadcasts: {}",
                    connections.activeConnections(), connections.totalConnections(),
                    connections.totalMessagesSent(), connections.totalBroadcasts());
            log.info("=====================================");

            long newErrors = bus.handlerErrors() - lastHandlerErrors;
            if (newErrors > HANDLER_ERROR_ALERT_THRESHOLD) {
                log.warn("HIGH ALERT: {} handler errors since last report - check subscribers", newErrors);
            }
            if (queuedEventPublisher.getRejectedCount() > 0) {
                log.warn("{} queued events were rejected so far - queue capacity may be too small",
                        queuedEventPublisher.getRejectedCount());
            }
            lastHandlerErrors = bus.handlerErrors();
        } catch (Exception ex) {
            log.error("Failed to log event distribution statistics: {}", ex.getMessage(), ex);
        }
    }
}
