package io.agentswarm.swarm;

import io.agentswarm.model.AgentStatus;

import java.util.Objects;

public record AgentMetadata(
        String agentId,
        String nodeType,
        String name,
        String fullName,
        String filePath,
        String parentId,
        int startLine,
        int endLine,
        AgentStatus status,
        long createdAtMs,
        long updatedAtMs
) {
    public AgentMetadata {
        if (agentId == null || agentId.isBlank()) {
            throw new IllegalArgumentException("agentId must not be blank");
        }
        status = status == null ? AgentStatus.ACTIVE : status;
    }

    public static AgentMetadata fromUnit(DiscoveredUnit unit) {
        return new AgentMetadata(unit.agentId(), unit.nodeType(), unit.name(), unit.fullName(), unit.filePath(),
                unit.parentId(), unit.startLine(), unit.endLine(), AgentStatus.ACTIVE, 0L, 0L);
    }

    public boolean sameIdentity(DiscoveredUnit unit) {
        return Objects.equals(nodeType, unit.nodeType())
                && Objects.equals(name, unit.name())
                && Objects.equals(fullName, unit.fullName())
                && Objects.equals(filePath, unit.filePath())
                && Objects.equals(parentId, unit.parentId())
                && startLine == unit.startLine()
                && endLine == unit.endLine();
    }
}
