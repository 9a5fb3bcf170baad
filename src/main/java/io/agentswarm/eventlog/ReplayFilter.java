package io.agentswarm.eventlog;

import io.agentswarm.model.EventType;

import java.util.EnumSet;
import java.util.Set;

public record ReplayFilter(long afterId, String graphId, Set<EventType> eventTypes, Long sinceMs, Long untilMs) {

    public ReplayFilter {
        afterId = Math.max(0L, afterId);
        graphId = graphId == null || graphId.isBlank() ? null : graphId;
        eventTypes = eventTypes == null || eventTypes.isEmpty() ? Set.of() : Set.copyOf(EnumSet.copyOf(eventTypes));
    }

    public static ReplayFilter all() {
        return new ReplayFilter(0L, null, null, null, null);
    }

    public static ReplayFilter after(long afterId) {
        return new ReplayFilter(afterId, null, null, null, null);
    }

    public ReplayFilter withGraph(String newGraphId) {
        return new ReplayFilter(afterId, newGraphId, eventTypes, sinceMs, untilMs);
    }

    public ReplayFilter withTypes(Set<EventType> types) {
        return new ReplayFilter(afterId, graphId, types, sinceMs, untilMs);
    }

    public ReplayFilter between(Long since, Long until) {
        return new ReplayFilter(afterId, graphId, eventTypes, since, until);
    }
}
