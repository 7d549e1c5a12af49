package com.gathering.realtime.websocket;

import lombok.Getter;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bookkeeping for one connected client.
 */
@Getter
public class ConnectionRecord {

    private final ClientConnection client;
    private final String clientId;
    private final Instant connectedAt;

    private final AtomicLong messagesSent = new AtomicLong();
    private final AtomicLong messagesReceived = new AtomicLong();

    ConnectionRecord(ClientConnection client, String clientId, Instant connectedAt) {
        this.client = client;
        this.clientId = clientId;
        this.connectedAt = connectedAt;
    }

    void recordSent() {
        messagesSent.incrementAndGet();
    }

    void recordReceived() {
        messagesReceived.incrementAndGet();
    }

    public long getMessagesSent() {
        return messagesSent.get();
    }

    public long getMessagesReceived() {
        return messagesReceived.get();
    }
}
