package io.agentswarm.runner;

import io.agentswarm.agent.SwarmTools;
import io.agentswarm.eventlog.EventLog;
import io.agentswarm.model.Event;
import io.agentswarm.model.EventPayload;
import io.agentswarm.subscription.Subscription;
import io.agentswarm.subscription.SubscriptionPattern;
import io.agentswarm.subscription.SubscriptionRegistry;
import io.agentswarm.swarm.AgentMetadata;
import io.agentswarm.swarm.SwarmRegistry;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

final class TurnTools implements SwarmTools {
    private final String agentId;
    private final String graphId;
    private final String cascadeId;
    private final int childDepth;
    private final EventLog eventLog;
    private final SubscriptionRegistry subscriptions;
    private final SwarmRegistry swarm;
    private final List<SubscriptionPattern> addedSubscriptions = new ArrayList<>();

    TurnTools(String agentId, String graphId, String cascadeId, int childDepth, EventLog eventLog,
              SubscriptionRegistry subscriptions, SwarmRegistry swarm) {
        this.agentId = agentId;
        this.graphId = graphId;
        this.cascadeId = cascadeId;
        this.childDepth = childDepth;
        this.eventLog = eventLog;
        this.subscriptions = subscriptions;
        this.swarm = swarm;
    }

    Event inCascade(EventPayload payload, List<String> tags) {
        return Event.of(payload).withGraphId(graphId).withTags(tags).inCascade(cascadeId, childDepth);
    }

    @Override
    public long emit(EventPayload payload, List<String> tags) {
        return eventLog.append(inCascade(payload, tags));
    }

    @Override
    public long sendMessage(String toAgent, String content, List<String> tags) {
        return emit(new EventPayload.AgentMessage(agentId, toAgent, content), tags);
    }

    @Override
    public int broadcast(String target, String content) {
        if (target == null || target.isBlank()) {
            throw new IllegalArgumentException("broadcast target must not be blank");
        }
        String selector = target.trim();
        String lower = selector.toLowerCase(Locale.ROOT);
        List<AgentMetadata> agents = swarm.listActive();
        List<String> targets = new ArrayList<>();
        if (lower.equals("children")) {
            for (AgentMetadata agent : agents) {
                if (agentId.equals(agent.parentId())) {
                    targets.add(agent.agentId());
                }
            }
        } else if (lower.equals("siblings")) {
            Optional<AgentMetadata> self = swarm.getAgent(agentId);
            String parentId = self.map(AgentMetadata::parentId).orElse(null);
            if (parentId == null) {
                throw new IllegalStateException("Agent " + agentId + " has no parent for a sibling broadcast");
            }
            for (AgentMetadata agent : agents) {
                if (parentId.equals(agent.parentId()) && !agent.agentId().equals(agentId)) {
                    targets.add(agent.agentId());
                }
            }
        } else if (lower.startsWith("file:")) {
            String filePath = selector.substring("file:".length()).trim();
            if (filePath.isEmpty()) {
                throw new IllegalArgumentException("broadcast file target needs a path");
            }
            for (AgentMetadata agent : agents) {
                String path = agent.filePath();
                if (path != null && (path.equals(filePath) || path.endsWith(filePath))) {
                    targets.add(agent.agentId());
                }
            }
        } else {
            throw new IllegalArgumentException("Unknown broadcast target: " + target);
        }
        for (String to : targets) {
            sendMessage(to, content, List.of());
        }
        return targets.size();
    }

    @Override
    public Subscription subscribe(SubscriptionPattern pattern) {
        Subscription sub = subscriptions.register(agentId, pattern);
        synchronized (addedSubscriptions) {
            addedSubscriptions.add(pattern);
        }
        return sub;
    }

    @Override
    public boolean unsubscribe(long subscriptionId) {
        return subscriptions.unregister(subscriptionId);
    }

    @Override
    public List<AgentMetadata> queryAgents(String nodeType) {
        List<AgentMetadata> agents = swarm.listActive();
        if (nodeType == null || nodeType.isBlank()) {
            return agents;
        }
        List<AgentMetadata> out = new ArrayList<>();
        for (AgentMetadata agent : agents) {
            if (agent.nodeType() != null && agent.nodeType().equalsIgnoreCase(nodeType.trim())) {
                out.add(agent);
            }
        }
        return out;
    }

    List<SubscriptionPattern> addedSubscriptions() {
        synchronized (addedSubscriptions) {
            return List.copyOf(addedSubscriptions);
        }
    }
}
