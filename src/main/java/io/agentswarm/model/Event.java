package io.agentswarm.model;

import java.util.List;
import java.util.Optional;
import java.util.TreeSet;

public record Event(
        long id,
        String graphId,
        String correlationId,
        int cascadeDepth,
        List<String> tags,
        long createdAtMs,
        EventPayload payload
) {
    public Event {
        if (payload == null) {
            throw new IllegalArgumentException("payload must not be null");
        }
        graphId = graphId == null ? "" : graphId;
        correlationId = correlationId == null || correlationId.isBlank() ? null : correlationId;
        cascadeDepth = Math.max(0, cascadeDepth);
        tags = tags == null ? List.of() : List.copyOf(new TreeSet<>(tags));
    }

    public static Event of(EventPayload payload) {
        return new Event(0L, "", null, 0, List.of(), System.currentTimeMillis(), payload);
    }

    public Event withId(long newId) {
        return new Event(newId, graphId, correlationId, cascadeDepth, tags, createdAtMs, payload);
    }

    public Event withGraphId(String newGraphId) {
        return new Event(id, newGraphId, correlationId, cascadeDepth, tags, createdAtMs, payload);
    }

    public Event withTags(List<String> newTags) {
        return new Event(id, graphId, correlationId, cascadeDepth, newTags, createdAtMs, payload);
    }

    public Event inCascade(String newCorrelationId, int depth) {
        return new Event(id, graphId, newCorrelationId, depth, tags, createdAtMs, payload);
    }

    public EventType eventType() {
        return payload.type();
    }

    public boolean isRoot() {
        return correlationId == null;
    }

    public String cascadeId() {
        return correlationId != null ? correlationId : "evt-" + id;
    }

    public Optional<String> fromAgent() {
        if (payload instanceof EventPayload.AgentMessage message) {
            return Optional.of(message.fromAgent());
        }
        if (payload instanceof EventPayload.AgentStarted started) {
            return Optional.of(started.agentId());
        }
        if (payload instanceof EventPayload.AgentCompleted completed) {
            return Optional.of(completed.agentId());
        }
        if (payload instanceof EventPayload.AgentFailed failed) {
            return Optional.of(failed.agentId());
        }
        return Optional.empty();
    }

    public Optional<String> toAgent() {
        if (payload instanceof EventPayload.AgentMessage message) {
            return Optional.of(message.toAgent());
        }
        if (payload instanceof EventPayload.ManualTrigger trigger) {
            return Optional.of(trigger.toAgent());
        }
        return Optional.empty();
    }

    public Optional<String> path() {
        if (payload instanceof EventPayload.ContentChanged changed) {
            return Optional.of(changed.path());
        }
        if (payload instanceof EventPayload.FileSaved saved) {
            return Optional.of(saved.path());
        }
        return Optional.empty();
    }
}
