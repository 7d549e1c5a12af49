package com.gathering.realtime.bus;

import java.util.UUID;

/**
 * Opaque handle returned by {@link EventBus#subscribe} and handed back to
 * {@link EventBus#unsubscribe}.
 */
public final class SubscriptionId {

    private final UUID value;

    private SubscriptionId(UUID value) {
        this.value = value;
    }

    static SubscriptionId next() {
        return new SubscriptionId(UUID.randomUUID());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof SubscriptionId other && value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "sub-" + value;
    }
}
