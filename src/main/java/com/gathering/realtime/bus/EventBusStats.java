package com.gathering.realtime.bus;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Point-in-time snapshot of the bus counters.
 */
public record EventBusStats(
        long eventsPublished,
        long eventsDelivered,
        long eventsDeduplicated,
        long handlerErrors,
        int activeSubscribers,
        int historySize
) {

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("events_published", eventsPublished);
        map.put("events_delivered", eventsDelivered);
        map.put("events_deduplicated", eventsDeduplicated);
        map.put("handler_errors", handlerErrors);
        map.put("active_subscribers", activeSubscribers);
        map.put("history_size", historySize);
        return map;
    }
}
