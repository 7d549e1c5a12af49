package com.gathering.realtime.service;

import com.gathering.realtime.config.EventBusProperties;
import com.gathering.realtime.websocket.EventBroadcastBridge;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Hooks the bridge into the bus once the application is up.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BroadcastInitializer {

    private final EventBroadcastBridge bridge;
    private final EventBusProperties properties;

    @EventListener(ApplicationReadyEvent.class)
    public void enableBroadcasting() {
        if (!properties.getBroadcast().isEnabled()) {
            log.info("WebSocket broadcasting disabled by configuration");
            return;
        }
        if (bridge.getSubscriptionCount() > 0) {
            return;
        }
        bridge.setupBroadcasting(properties.getBroadcast().getTypes());
    }
}
