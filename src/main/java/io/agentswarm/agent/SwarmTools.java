package io.agentswarm.agent;

import io.agentswarm.model.EventPayload;
import io.agentswarm.subscription.Subscription;
import io.agentswarm.subscription.SubscriptionPattern;
import io.agentswarm.swarm.AgentMetadata;

import java.util.List;

// Everything emitted through these tools joins the calling turn's cascade.
public interface SwarmTools {

    long emit(EventPayload payload, List<String> tags);

    long sendMessage(String toAgent, String content, List<String> tags);

    int broadcast(String target, String content);

    Subscription subscribe(SubscriptionPattern pattern);

    boolean unsubscribe(long subscriptionId);

    List<AgentMetadata> queryAgents(String nodeType);
}
