package com.gathering.realtime.bus;

import com.gathering.realtime.event.Event;

/**
 * Callback invoked once per matching publish. Anything thrown is contained by
 * the bus and counted as a handler error.
 */
@FunctionalInterface
public interface EventHandler {

    void handle(Event event) throws Exception;
}
