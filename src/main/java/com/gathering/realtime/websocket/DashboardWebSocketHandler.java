package com.gathering.realtime.websocket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.IOException;
import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Dashboard endpoint: registers each session with the {@link ConnectionManager},
 * greets it, and answers client pings.
 */
@Slf4j
@RequiredArgsConstructor
public class DashboardWebSocketHandler extends TextWebSocketHandler {

    static final String CLIENT_ID_PARAM = "client_id";

    private final ConnectionManager connectionManager;
    private final ObjectMapper objectMapper;

    // session id -> connection handle known to the manager
    private final Map<String, WebSocketSessionConnection> sessions = new ConcurrentHashMap<>();

    @Override
    public void afterConnectionEstablished(@NonNull WebSocketSession session) throws IOException {
        WebSocketSessionConnection connection = new WebSocketSessionConnection(session);
        String clientId = clientIdOf(session.getUri());

        connectionManager.connect(connection, clientId);
        sessions.put(session.getId(), connection);

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("client_id", clientId != null ? clientId : connection.defaultClientId());
        data.put("message", "Connected to GatheRing dashboard");
        Map<String, Object> welcome = new LinkedHashMap<>();
        welcome.put("type", "connection.established");
        welcome.put("data", data);
        connectionManager.sendPersonal(welcome, connection);
    }

    @Override
    protected void handleTextMessage(@NonNull WebSocketSession session, @NonNull TextMessage message) {
        WebSocketSessionConnection connection = sessions.get(session.getId());
        if (connection == null) {
            return;
        }
        connectionManager.recordReceived(connection);

        JsonNode payload;
        try {
            payload = objectMapper.readTree(message.getPayload());
        } catch (JsonProcessingException e) {
            log.warn("Ignoring malformed message from session {}: {}", session.getId(), e.getOriginalMessage());
            return;
        }

        if ("ping".equals(payload.path("type").asText(null))) {
            Map<String, Object> pong = new LinkedHashMap<>();
            pong.put("type", "pong");
            JsonNode timestamp = payload.get("timestamp");
            pong.put("timestamp", timestamp == null || timestamp.isNull() ? null : timestamp.asText());
            connectionManager.sendPersonal(pong, connection);
        }
    }

    @Override
    public void handleTransportError(@NonNull WebSocketSession session, @NonNull Throwable exception) {
        log.warn("Transport error on session {}: {}", session.getId(), exception.getMessage());
        release(session);
    }

    @Override
    public void afterConnectionClosed(@NonNull WebSocketSession session, @NonNull CloseStatus status) {
        log.debug("Session {} closed with {}", session.getId(), status);
        release(session);
    }

    private void release(WebSocketSession session) {
        WebSocketSessionConnection connection = sessions.remove(session.getId());
        if (connection != null) {
            connectionManager.disconnect(connection);
        }
    }

    static String clientIdOf(URI uri) {
        if (uri == null) {
            return null;
        }
        String clientId = UriComponentsBuilder.fromUri(uri).build().getQueryParams().getFirst(CLIENT_ID_PARAM);
        return clientId == null || clientId.isBlank() ? null : clientId;
    }
}
