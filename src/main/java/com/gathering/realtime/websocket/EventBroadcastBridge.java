package com.gathering.realtime.websocket;

import com.gathering.realtime.bus.EventBus;
import com.gathering.realtime.bus.EventFilter;
import com.gathering.realtime.bus.SubscriptionId;
import com.gathering.realtime.event.Event;
import com.gathering.realtime.event.EventType;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Forwards selected bus events to the connected real-time clients.
 *
 * <p>Each forwarded type is an ordinary bus subscription, so the bus limiter,
 * filters and error isolation apply to broadcasting as well.
 */
@Slf4j
public class EventBroadcastBridge {

    static final String SUBSCRIPTION_NAME = "websocket-broadcast";

    public static final List<EventType> DEFAULT_BROADCAST_TYPES = List.of(
            EventType.AGENT_STARTED,
            EventType.AGENT_TASK_COMPLETED,
            EventType.AGENT_TOOL_EXECUTED,
            EventType.MEMORY_CREATED,
            EventType.MEMORY_SHARED,
            EventType.CIRCLE_CREATED,
            EventType.CIRCLE_MEMBER_ADDED,
            EventType.TASK_CREATED,
            EventType.TASK_STARTED,
            EventType.TASK_COMPLETED,
            EventType.TASK_FAILED,
            EventType.TASK_CONFLICT_DETECTED,
            EventType.CONVERSATION_MESSAGE
    );

    private final EventBus eventBus;
    private final ConnectionManager connectionManager;
    private final List<SubscriptionId> subscriptions = new CopyOnWriteArrayList<>();

    public EventBroadcastBridge(EventBus eventBus, ConnectionManager connectionManager) {
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus");
        this.connectionManager = Objects.requireNonNull(connectionManager, "connectionManager");
    }

    public List<SubscriptionId> setupBroadcasting() {
        return setupBroadcasting(DEFAULT_BROADCAST_TYPES);
    }

    /**
     * Subscribes the broadcaster to every type in {@code types}, or to
     * {@link #DEFAULT_BROADCAST_TYPES} when the collection is null or empty.
     */
    public List<SubscriptionId> setupBroadcasting(Collection<EventType> types) {
        Collection<EventType> toBroadcast = types == null || types.isEmpty() ? DEFAULT_BROADCAST_TYPES : types;
        List<SubscriptionId> ids = new ArrayList<>(toBroadcast.size());
        for (EventType type : toBroadcast) {
            ids.add(eventBus.subscribe(type, this::forward, null, SUBSCRIPTION_NAME));
        }
        subscriptions.addAll(ids);
        log.info("WebSocket broadcasting enabled for {} event types", toBroadcast.size());
        return ids;
    }

    /**
     * Broadcasts a single type, optionally only the events {@code filter} accepts,
     * e.g. the events of one circle.
     */
    public SubscriptionId setupCustomBroadcasting(EventType type, EventFilter filter) {
        SubscriptionId id = eventBus.subscribe(type, this::forward, filter, SUBSCRIPTION_NAME);
        subscriptions.add(id);
        log.info("Custom WebSocket broadcasting enabled for {}", type);
        return id;
    }

    /**
     * Removes every subscription this bridge registered.
     *
     * @return number of subscriptions removed
     */
    public int teardown() {
        int removed = 0;
        for (SubscriptionId id : subscriptions) {
            if (eventBus.unsubscribe(id)) {
                removed++;
            }
        }
        subscriptions.clear();
        log.info("WebSocket broadcasting disabled, {} subscriptions removed", removed);
        return removed;
    }

    public int getSubscriptionCount() {
        return subscriptions.size();
    }

    void forward(Event event) {
        if (connectionManager.getClientCount() == 0) {
            return;
        }
        connectionManager.broadcast(toWireMessage(event));
    }

    /**
     * Canonical wire form of an event. Absent correlation ids stay in the map
     * as nulls so clients always see the same keys.
     */
    public static Map<String, Object> toWireMessage(Event event) {
        Map<String, Object> message = new LinkedHashMap<>();
        message.put("type", event.type().getValue());
        message.put("data", event.payload());
        message.put("source_agent_id", event.sourceAgentId());
        message.put("circle_id", event.circleId());
        message.put("project_id", event.projectId());
        message.put("event_id", event.id());
        message.put("timestamp", event.timestamp().toString());
        return message;
    }
}
