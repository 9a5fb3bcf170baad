package io.agentswarm.swarm;

import io.agentswarm.subscription.SubscriptionPattern;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record AgentState(
        String agentId,
        String nodeType,
        String name,
        String fullName,
        String filePath,
        String parentId,
        int startLine,
        int endLine,
        Map<String, String> connections,
        List<ChatEntry> chatHistory,
        List<SubscriptionPattern> customSubscriptions,
        String lastSnapshotRef,
        String lastOutcome,
        String lastError,
        long lastUpdatedMs
) {
    public AgentState {
        if (agentId == null || agentId.isBlank()) {
            throw new IllegalArgumentException("agentId must not be blank");
        }
        connections = connections == null ? Map.of() : Map.copyOf(connections);
        chatHistory = chatHistory == null ? List.of() : List.copyOf(chatHistory);
        customSubscriptions = customSubscriptions == null ? List.of() : List.copyOf(customSubscriptions);
    }

    public static AgentState fromUnit(DiscoveredUnit unit) {
        return new AgentState(unit.agentId(), unit.nodeType(), unit.name(), unit.fullName(), unit.filePath(),
                unit.parentId(), unit.startLine(), unit.endLine(), Map.of(), List.of(), List.of(),
                null, null, null, 0L);
    }

    public AgentState withIdentity(DiscoveredUnit unit) {
        return new AgentState(agentId, unit.nodeType(), unit.name(), unit.fullName(), unit.filePath(),
                unit.parentId(), unit.startLine(), unit.endLine(), connections, chatHistory, customSubscriptions,
                lastSnapshotRef, lastOutcome, lastError, lastUpdatedMs);
    }

    public AgentState withChat(List<ChatEntry> entries, int limit) {
        List<ChatEntry> merged = new ArrayList<>(chatHistory);
        merged.addAll(entries);
        int from = Math.max(0, merged.size() - Math.max(0, limit));
        return new AgentState(agentId, nodeType, name, fullName, filePath, parentId, startLine, endLine,
                connections, merged.subList(from, merged.size()), customSubscriptions,
                lastSnapshotRef, lastOutcome, lastError, lastUpdatedMs);
    }

    public AgentState withConnections(Map<String, String> added) {
        Map<String, String> merged = new LinkedHashMap<>(connections);
        if (added != null) {
            merged.putAll(added);
        }
        return new AgentState(agentId, nodeType, name, fullName, filePath, parentId, startLine, endLine,
                merged, chatHistory, customSubscriptions, lastSnapshotRef, lastOutcome, lastError, lastUpdatedMs);
    }

    public AgentState withCustomSubscription(SubscriptionPattern pattern) {
        List<SubscriptionPattern> merged = new ArrayList<>(customSubscriptions);
        merged.add(pattern);
        return new AgentState(agentId, nodeType, name, fullName, filePath, parentId, startLine, endLine,
                connections, chatHistory, merged, lastSnapshotRef, lastOutcome, lastError, lastUpdatedMs);
    }

    public AgentState withOutcome(String outcome, String error, String snapshotRef) {
        return new AgentState(agentId, nodeType, name, fullName, filePath, parentId, startLine, endLine,
                connections, chatHistory, customSubscriptions,
                snapshotRef == null ? lastSnapshotRef : snapshotRef, outcome, error, lastUpdatedMs);
    }

    AgentState stamped(long nowMs) {
        return new AgentState(agentId, nodeType, name, fullName, filePath, parentId, startLine, endLine,
                connections, chatHistory, customSubscriptions, lastSnapshotRef, lastOutcome, lastError, nowMs);
    }

    public record ChatEntry(String role, String content, long eventId, long atMs) {
        public static final String TRIGGER = "user";
        public static final String RESPONSE = "assistant";
    }
}
