package io.agentswarm.swarm;

public record DiscoveredUnit(
        String agentId,
        String nodeType,
        String name,
        String fullName,
        String filePath,
        String parentId,
        int startLine,
        int endLine
) {
    public DiscoveredUnit {
        if (agentId == null || agentId.isBlank()) {
            throw new IllegalArgumentException("agentId must not be blank");
        }
        if (filePath == null || filePath.isBlank()) {
            throw new IllegalArgumentException("filePath must not be blank for " + agentId);
        }
        nodeType = nodeType == null || nodeType.isBlank() ? "unknown" : nodeType;
        name = name == null ? "" : name;
        fullName = fullName == null || fullName.isBlank() ? name : fullName;
        parentId = parentId == null || parentId.isBlank() ? null : parentId;
    }
}
