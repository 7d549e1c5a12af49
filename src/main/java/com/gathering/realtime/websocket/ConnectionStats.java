package com.gathering.realtime.websocket;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Point-in-time snapshot of the connection manager counters.
 */
public record ConnectionStats(
        int activeConnections,
        long totalConnections,
        long totalMessagesSent,
        long totalBroadcasts,
        List<ClientInfo> clients
) {

    public record ClientInfo(String clientId, Instant connectedAt, long messagesSent, long messagesReceived) { }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("active_connections", activeConnections);
        map.put("total_connections", totalConnections);
        map.put("total_messages_sent", totalMessagesSent);
        map.put("total_broadcasts", totalBroadcasts);
        map.put("clients", clients.stream().map(client -> {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("client_id", client.clientId());
            entry.put("connected_at", client.connectedAt().toString());
            entry.put("messages_sent", client.messagesSent());
            entry.put("messages_received", client.messagesReceived());
            return entry;
        }).toList());
        return map;
    }
}
