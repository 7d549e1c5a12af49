package com.gathering.realtime.controller;

import com.gathering.realtime.bus.EventBus;
import com.gathering.realtime.bus.EventCriteria;
import com.gathering.realtime.event.Event;
import com.gathering.realtime.event.EventType;
import com.gathering.realtime.websocket.ConnectionManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Read-only view of the bus and WebSocket statistics for status pages.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class RealtimeStatusController {

    private final EventBus eventBus;
    private final ConnectionManager connectionManager;

    @GetMapping("/ws/stats")
    public ResponseEntity<Map<String, Object>> websocketStats() {
        return ResponseEntity.ok(connectionManager.getStats().toMap());
    }

    @GetMapping("/api/events/stats")
    public ResponseEntity<Map<String, Object>> eventStats() {
        return ResponseEntity.ok(eventBus.getStats().toMap());
    }

    /**
     * Recent events, most recent first.
     */
    @GetMapping("/api/events/history")
    public ResponseEntity<List<Event>> history(@RequestParam(required = false) String type,
                                               @RequestParam(defaultValue = "100") int limit,
                                               @RequestParam(required = false) Integer sourceAgentId,
                                               @RequestParam(required = false) Integer circleId,
                                               @RequestParam(required = false) Integer projectId) {
        EventType eventType = type == null || type.isBlank() ? null : EventType.fromValue(type);
        EventCriteria criteria = EventCriteria.builder()
                .sourceAgentId(sourceAgentId)
                .circleId(circleId)
                .projectId(projectId)
                .build();
        return ResponseEntity.ok(eventBus.getHistory(eventType, limit, criteria));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> badRequest(IllegalArgumentException e) {
        log.warn("Rejected status request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
    }
}
