package com.gathering.realtime.websocket;

import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.io.IOException;

/**
 * {@link ClientConnection} over a Spring {@link WebSocketSession}. Sends go
 * through a {@link ConcurrentWebSocketSessionDecorator} because a broadcast
 * and a personal reply may hit the same session at once.
 */
public class WebSocketSessionConnection implements ClientConnection {

    static final int SEND_TIME_LIMIT_MS = 10_000;
    static final int BUFFER_SIZE_LIMIT = 512 * 1024;

    private final WebSocketSession session;
    private final WebSocketSession sender;

    public WebSocketSessionConnection(WebSocketSession session) {
        this.session = session;
        this.sender = new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, BUFFER_SIZE_LIMIT);
    }

    /**
     * Spring finishes the HTTP upgrade before the handler sees the session, so
     * all that is left is to make sure it is still open.
     */
    @Override
    public void accept() throws IOException {
        if (!session.isOpen()) {
            throw new IOException("WebSocket session " + session.getId() + " is not open");
        }
    }

    @Override
    public void send(String text) throws IOException {
        sender.sendMessage(new TextMessage(text));
    }

    @Override
    public String defaultClientId() {
        return "client_" + session.getId();
    }
}
