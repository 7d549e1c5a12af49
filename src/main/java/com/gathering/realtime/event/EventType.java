package com.gathering.realtime.event;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Categories of things that happen on the platform, grouped by domain.
 * The dotted value is what goes over the wire.
 */
public enum EventType {
    // Agent lifecycle and actions
    AGENT_STARTED("agent.started"),
    AGENT_STOPPED("agent.stopped"),
    AGENT_TASK_ASSIGNED("agent.task.assigned"),
    AGENT_TASK_COMPLETED("agent.task.completed"),
    AGENT_TASK_FAILED("agent.task.failed"),
    AGENT_TOOL_EXECUTED("agent.tool.executed"),

    // Knowledge sharing
    MEMORY_CREATED("memory.created"),
    MEMORY_SHARED("memory.shared"),
    MEMORY_RECALLED("memory.recalled"),

    // Circle coordination
    CIRCLE_CREATED("circle.created"),
    CIRCLE_STARTED("circle.started"),
    CIRCLE_STOPPED("circle.stopped"),
    CIRCLE_MEMBER_ADDED("circle.member.added"),
    CIRCLE_MEMBER_REMOVED("circle.member.removed"),

    // Task management
    TASK_CREATED("task.created"),
    TASK_ASSIGNED("task.assigned"),
    TASK_STARTED("task.started"),
    TASK_COMPLETED("task.completed"),
    TASK_FAILED("task.failed"),
    TASK_CONFLICT_DETECTED("task.conflict.detected"),

    // Inter-agent communication
    CONVERSATION_MESSAGE("conversation.message"),
    CONVERSATION_TURN_COMPLETE("conversation.turn.complete"),

    SYSTEM_ERROR("system.error"),
    SYSTEM_WARNING("system.warning");

    private final String value;

    EventType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Resolves either the dotted wire value ({@code task.completed}) or the
     * constant name ({@code TASK_COMPLETED}).
     *
     * @throws IllegalArgumentException when nothing matches
     */
    public static EventType fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Event type must not be null");
        }
        for (EventType type : values()) {
            if (type.value.equals(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown event type: " + value);
    }

    @Override
    public String toString() {
        return value;
    }
}
