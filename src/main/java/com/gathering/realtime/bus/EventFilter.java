package com.gathering.realtime.bus;

import com.gathering.realtime.event.Event;

/**
 * Arbitrary predicate deciding whether a subscription receives an event.
 * Prefer {@link EventCriteria} for the common correlation id cases.
 */
@FunctionalInterface
public interface EventFilter {

    boolean accept(Event event);

    default EventFilter and(EventFilter other) {
        return event -> accept(event) && other.accept(event);
    }
}
