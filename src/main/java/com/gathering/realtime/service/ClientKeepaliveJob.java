package com.gathering.realtime.service;

import com.gathering.realtime.websocket.ConnectionManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Pings every connected client so dead connections get pruned even when no
 * events are flowing.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.websocket.keepalive.enabled", havingValue = "true", matchIfMissing = true)
public class ClientKeepaliveJob {

    private final ConnectionManager connectionManager;

    @Scheduled(fixedDelayString = "${app.websocket.keepalive.interval:30000}")
    public void pingClients() {
        int before = connectionManager.getClientCount();
        if (before == 0) {
            return;
        }
        int reachable = connectionManager.pingAll();
        if (reachable < before) {
            log.info("Keepalive dropped {} unreachable clients, {} remain", before - reachable, connectionManager.getClientCount());
        }
    }
}
