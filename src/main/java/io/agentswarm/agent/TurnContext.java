package io.agentswarm.agent;

import io.agentswarm.model.Event;
import io.agentswarm.swarm.AgentState;

import java.util.List;

public record TurnContext(
        AgentState state,
        Event triggerEvent,
        String correlationId,
        int depth,
        List<AgentState.ChatEntry> recentHistory,
        SwarmTools tools
) {
    public TurnContext {
        recentHistory = recentHistory == null ? List.of() : List.copyOf(recentHistory);
    }

    public String agentId() {
        return state.agentId();
    }

    public String nodeType() {
        return state.nodeType();
    }
}
