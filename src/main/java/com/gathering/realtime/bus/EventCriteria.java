package com.gathering.realtime.bus;

import com.gathering.realtime.event.Event;
import com.gathering.realtime.event.EventType;
import lombok.Builder;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Structured attribute-equality filter. A null field matches anything, an
 * empty type set matches every type.
 *
 * @param types         accepted event types
 * @param sourceAgentId required source agent
 * @param circleId      required circle
 * @param projectId     required project
 */
@Builder
public record EventCriteria(
        Set<EventType> types,
        Integer sourceAgentId,
        Integer circleId,
        Integer projectId
) implements EventFilter {

    public static final EventCriteria ANY = new EventCriteria(null, null, null, null);

    public EventCriteria {
        types = types == null || types.isEmpty() ? Set.of() : Set.copyOf(types);
    }

    public static EventCriteria forCircle(int circleId) {
        return builder().circleId(circleId).build();
    }

    public static EventCriteria forSourceAgent(int sourceAgentId) {
        return builder().sourceAgentId(sourceAgentId).build();
    }

    public static EventCriteria forProject(int projectId) {
        return builder().projectId(projectId).build();
    }

    public static EventCriteria forTypes(EventType first, EventType... rest) {
        return builder().types(EnumSet.of(first, rest)).build();
    }

    @Override
    public boolean accept(Event event) {
        if (!types.isEmpty() && !types.contains(event.type())) {
            return false;
        }
        return (sourceAgentId == null || Objects.equals(sourceAgentId, event.sourceAgentId()))
                && (circleId == null || Objects.equals(circleId, event.circleId()))
                && (projectId == null || Objects.equals(projectId, event.projectId()));
    }
}
