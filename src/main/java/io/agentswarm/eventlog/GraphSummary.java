package io.agentswarm.eventlog;

public record GraphSummary(String graphId, long firstEventAtMs, long lastEventAtMs, long eventCount) {
}
