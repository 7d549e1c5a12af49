package com.gathering.realtime.event;

import lombok.Builder;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Immutable record of something that happened on the platform.
 *
 * @param type          category of the event
 * @param payload       event specific key/value data, never null; nested maps and
 *                      lists are copied so later changes by the producer are not seen
 * @param sourceAgentId agent that triggered the event, if any
 * @param circleId      circle context, if any
 * @param projectId     project context, if any
 * @param timestamp     creation instant, defaults to now
 * @param id            process-unique identifier, derived from type and timestamp when absent
 */
@Builder(toBuilder = true)
public record Event(
        EventType type,
        Map<String, Object> payload,
        Integer sourceAgentId,
        Integer circleId,
        Integer projectId,
        Instant timestamp,
        String id
) {

    private static final AtomicLong SEQUENCE = new AtomicLong();

    public Event {
        Objects.requireNonNull(type, "type");
        payload = payload == null || payload.isEmpty() ? Collections.emptyMap() : freezeMap(payload);
        if (timestamp == null) {
            timestamp = Instant.now();
        }
        if (id == null) {
            long micros = timestamp.getEpochSecond() * 1_000_000L + timestamp.getNano() / 1_000;
            // two events of one type can share a microsecond, the sequence keeps ids apart
            id = type.getValue() + ":" + micros + ":" + SEQUENCE.incrementAndGet();
        }
    }

    public static Event of(EventType type) {
        return builder().type(type).build();
    }

    public static Event of(EventType type, Map<String, Object> payload) {
        return builder().type(type).payload(payload).build();
    }

    // Read-only deep copies; null values are allowed
    private static <K> Map<K, Object> freezeMap(Map<K, ?> source) {
        Map<K, Object> copy = new LinkedHashMap<>(source.size() * 2);
        source.forEach((key, value) -> copy.put(key, freeze(value)));
        return Collections.unmodifiableMap(copy);
    }

    private static Object freeze(Object value) {
        if (value instanceof Map<?, ?> map) {
            return freezeMap(map);
        }
        if (value instanceof Collection<?> collection) {
            List<Object> copy = new ArrayList<>(collection.size());
            for (Object element : collection) {
                copy.add(freeze(element));
            }
            return Collections.unmodifiableList(copy);
        }
        return value;
    }
}
