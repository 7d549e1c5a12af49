package com.gathering.realtime.bus;

import com.gathering.realtime.event.EventType;

/**
 * One registration in the bus registry.
 */
record Subscription(
        SubscriptionId id,
        EventType type,
        EventHandler handler,
        EventFilter filter,
        String name
) { }
