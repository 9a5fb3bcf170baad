package io.agentswarm.model;

public enum AgentStatus {
    ACTIVE,
    ORPHANED;

    public static AgentStatus fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return ACTIVE;
        }
        for (AgentStatus value : values()) {
            if (value.name().equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown agent status: " + raw);
    }
}
