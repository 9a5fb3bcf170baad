package io.agentswarm.model;

public record Trigger(String agentId, long eventId, Event event) {
}
