package io.agentswarm.model;

public enum TriggerOutcome {
    ACCEPTED,
    SKIPPED_DEPTH,
    SKIPPED_COOLDOWN,
    COMPLETED,
    FAILED,
    CANCELLED,
    DELIVERY_FAILED
}
