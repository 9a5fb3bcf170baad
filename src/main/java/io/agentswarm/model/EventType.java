package io.agentswarm.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum EventType {
    CONTENT_CHANGED("content_changed", EventPayload.ContentChanged.class),
    FILE_SAVED("file_saved", EventPayload.FileSaved.class),
    AGENT_MESSAGE("agent_message", EventPayload.AgentMessage.class),
    MANUAL_TRIGGER("manual_trigger", EventPayload.ManualTrigger.class),
    AGENT_START("agent_start", EventPayload.AgentStarted.class),
    AGENT_COMPLETE("agent_complete", EventPayload.AgentCompleted.class),
    AGENT_ERROR("agent_error", EventPayload.AgentFailed.class),
    AGENT_LIFECYCLE("agent_lifecycle", EventPayload.AgentLifecycle.class),
    TRIGGER_SKIPPED("trigger_skipped", EventPayload.TriggerSkipped.class);

    private final String wireName;
    private final Class<? extends EventPayload> payloadType;

    EventType(String wireName, Class<? extends EventPayload> payloadType) {
        this.wireName = wireName;
        this.payloadType = payloadType;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public Class<? extends EventPayload> payloadType() {
        return payloadType;
    }

    @JsonCreator
    public static EventType fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Event type must not be blank");
        }
        String trimmed = raw.trim();
        for (EventType value : values()) {
            if (value.wireName.equalsIgnoreCase(trimmed) || value.name().equalsIgnoreCase(trimmed)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown event type: " + raw);
    }
}
