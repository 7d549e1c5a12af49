package com.gathering.realtime.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gathering.realtime.websocket.ConnectionManager;
import com.gathering.realtime.websocket.DashboardWebSocketHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final ConnectionManager connectionManager;
    private final ObjectMapper objectMapper;

    @Value("${app.websocket.path:/ws/dashboard}")
    private String path;

    @Value("${app.websocket.allowed-origins:*}")
    private String[] allowedOrigins;

    public WebSocketConfig(ConnectionManager connectionManager, ObjectMapper objectMapper) {
        this.connectionManager = connectionManager;
        this.objectMapper = objectMapper;
    }

    @Bean
    public DashboardWebSocketHandler dashboardWebSocketHandler() {
        return new DashboardWebSocketHandler(connectionManager, objectMapper);
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(dashboardWebSocketHandler(), path)
                .setAllowedOriginPatterns(allowedOrigins);
    }
}
