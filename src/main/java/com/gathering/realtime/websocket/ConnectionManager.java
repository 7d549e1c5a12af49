package com.gathering.realtime.websocket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Tracks connected real-time clients and pushes JSON messages to them.
 *
 * <p>A broadcast sends to every client concurrently. A client whose send
 * fails is dropped after the round completes; the other clients are not
 * affected.
 */
@Slf4j
public class ConnectionManager implements AutoCloseable {

    static final String TIMESTAMP = "timestamp";

    private final ObjectMapper objectMapper;
    private final Map<ClientConnection, ConnectionRecord> connections = new ConcurrentHashMap<>();
    private final ExecutorService sendExecutor;

    private final AtomicLong totalConnections = new AtomicLong();
    private final AtomicLong totalMessagesSent = new AtomicLong();
    private final AtomicLong totalBroadcasts = new AtomicLong();

    public ConnectionManager(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("ws-send-");
        threadFactory.setDaemon(true);
        this.sendExecutor = Executors.newCachedThreadPool(threadFactory);
    }

    // ==================== LIFECYCLE ====================

    public void connect(ClientConnection client) throws IOException {
        connect(client, null);
    }

    /**
     * Performs the handshake and starts tracking {@code client}. A handshake
     * failure propagates and nothing is recorded.
     *
     * @param clientId optional caller supplied identifier
     */
    public void connect(ClientConnection client, String clientId) throws IOException {
        Objects.requireNonNull(client, "client");
        client.accept();

        String id = clientId != null && !clientId.isBlank() ? clientId : client.defaultClientId();
        ConnectionRecord existing = connections.putIfAbsent(client, new ConnectionRecord(client, id, Instant.now()));
        if (existing != null) {
            log.debug("Client {} is already connected", existing.getClientId());
            return;
        }
        totalConnections.incrementAndGet();

        log.info("Client connected: {}", id);
        log.info("Active connections: {}", connections.size());
    }

    public void disconnect(ClientConnection client) {
        if (client == null) {
            return;
        }
        ConnectionRecord removed = connections.remove(client);
        if (removed != null) {
            log.info("Client disconnected: {}", removed.getClientId());
            log.info("Active connections: {}", connections.size());
        }
    }

    public boolean isConnected(ClientConnection client) {
        return client != null && connections.containsKey(client);
    }

    // ==================== SENDING ====================

    /**
     * Sends {@code message} to one client. On failure the client is disconnected.
     *
     * @return true if the message went out
     */
    public boolean sendPersonal(Map<String, Object> message, ClientConnection client) {
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(client, "client");
        try {
            client.send(objectMapper.writeValueAsString(message));
            recordSent(client);
            return true;
        } catch (Exception e) {
            log.warn("Error sending to client {}: {}", describe(client), e.getMessage());
            disconnect(client);
            return false;
        }
    }

    /**
     * Sends {@code message} to every connected client. A {@code timestamp} is
     * added to a copy of the message when it has none.
     *
     * @return number of clients the message was delivered to
     */
    public int broadcast(Map<String, Object> message) {
        Objects.requireNonNull(message, "message");
        if (connections.isEmpty()) {
            return 0;
        }

        Map<String, Object> outbound = new LinkedHashMap<>(message);
        if (!outbound.containsKey(TIMESTAMP)) {
            outbound.put(TIMESTAMP, Instant.now().toString());
        }

        String text;
        try {
            text = objectMapper.writeValueAsString(outbound);
        } catch (JsonProcessingException e) {
            log.error("Could not serialize broadcast message of type {}", outbound.get("type"), e);
            return 0;
        }

        List<ClientConnection> targets = new ArrayList<>(connections.keySet());
        List<CompletableFuture<Boolean>> sends = new ArrayList<>(targets.size());
        for (ClientConnection client : targets) {
            sends.add(CompletableFuture.supplyAsync(() -> sendQuietly(client, text), sendExecutor));
        }
        CompletableFuture.allOf(sends.toArray(new CompletableFuture<?>[0])).join();

        int successful = 0;
        List<ClientConnection> failed = new ArrayList<>();
        for (int i = 0; i < targets.size(); i++) {
            if (Boolean.TRUE.equals(sends.get(i).join())) {
                successful++;
            } else {
                failed.add(targets.get(i));
            }
        }

        // Prune only after the round so the set is not changed while sending
        failed.forEach(this::disconnect);
        totalBroadcasts.incrementAndGet();

        log.debug("Broadcast {} delivered to {}/{} clients", outbound.get("type"), successful, targets.size());
        return successful;
    }

    /**
     * Wraps {@code data} in the standard {@code {type, data, timestamp}} envelope
     * and broadcasts it.
     */
    public int broadcastEvent(String type, Map<String, Object> data) {
        Map<String, Object> message = new LinkedHashMap<>();
        message.put("type", type);
        message.put("data", data);
        message.put(TIMESTAMP, Instant.now().toString());
        return broadcast(message);
    }

    /**
     * Keepalive broadcast.
     *
     * @return number of clients still reachable
     */
    public int pingAll() {
        Map<String, Object> ping = new LinkedHashMap<>();
        ping.put("type", "ping");
        ping.put(TIMESTAMP, Instant.now().toString());
        return broadcast(ping);
    }

    private boolean sendQuietly(ClientConnection client, String text) {
        try {
            client.send(text);
            recordSent(client);
            return true;
        } catch (Exception e) {
            log.warn("Send error for client {}: {}", describe(client), e.getMessage());
            return false;
        }
    }

    private void recordSent(ClientConnection client) {
        ConnectionRecord record = connections.get(client);
        if (record != null) {
            record.recordSent();
            totalMessagesSent.incrementAndGet();
        }
    }

    /**
     * Counts an inbound message from {@code client}.
     */
    public void recordReceived(ClientConnection client) {
        ConnectionRecord record = connections.get(client);
        if (record != null) {
            record.recordReceived();
        }
    }

    private String describe(ClientConnection client) {
        ConnectionRecord record = connections.get(client);
        return record != null ? record.getClientId() : client.defaultClientId();
    }

    // ==================== INTROSPECTION ====================

    public int getClientCount() {
        return connections.size();
    }

    public ConnectionStats getStats() {
        List<ConnectionStats.ClientInfo> clients = connections.values().stream()
                .map(record -> new ConnectionStats.ClientInfo(
                        record.getClientId(),
                        record.getConnectedAt(),
                        record.getMessagesSent(),
                        record.getMessagesReceived()))
                .toList();
        return new ConnectionStats(
                connections.size(),
                totalConnections.get(),
                totalMessagesSent.get(),
                totalBroadcasts.get(),
                clients);
    }

    @Override
    public void close() {
        sendExecutor.shutdown();
        try {
            if (!sendExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                sendExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            sendExecutor.shutdownNow();
        }
    }
}
