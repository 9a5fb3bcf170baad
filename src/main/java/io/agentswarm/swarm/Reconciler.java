package io.agentswarm.swarm;

import io.agentswarm.eventlog.EventLog;
import io.agentswarm.model.AgentStatus;
import io.agentswarm.model.Event;
import io.agentswarm.model.EventPayload;
import io.agentswarm.storage.StoreException;
import io.agentswarm.subscription.SubscriptionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class Reconciler {
    private static final Logger log = LoggerFactory.getLogger(Reconciler.class);

    private final SwarmRegistry registry;
    private final SubscriptionRegistry subscriptions;
    private final AgentStateStore states;
    private final EventLog eventLog;
    private final String graphId;

    public Reconciler(SwarmRegistry registry, SubscriptionRegistry subscriptions, AgentStateStore states,
                      EventLog eventLog, String graphId) {
        this.registry = registry;
        this.subscriptions = subscriptions;
        this.states = states;
        this.eventLog = eventLog;
        this.graphId = graphId == null ? "" : graphId;
    }

    public ReconcileSummary reconcile(List<DiscoveredUnit> units) {
        Map<String, DiscoveredUnit> discovered = new LinkedHashMap<>();
        for (DiscoveredUnit unit : units) {
            if (discovered.putIfAbsent(unit.agentId(), unit) != null) {
                log.warn("Duplicate discovered unit {} ignored", unit.agentId());
            }
        }
        Map<String, AgentMetadata> known = new LinkedHashMap<>();
        for (AgentMetadata agent : registry.listAgents(Optional.empty())) {
            known.put(agent.agentId(), agent);
        }

        int created = 0;
        int updated = 0;
        int unchanged = 0;
        for (DiscoveredUnit unit : discovered.values()) {
            AgentMetadata existing = known.get(unit.agentId());
            if (existing == null || existing.status() == AgentStatus.ORPHANED) {
                create(unit);
                created++;
            } else if (!existing.sameIdentity(unit)) {
                update(unit);
                updated++;
            } else {
                unchanged++;
            }
        }

        List<String> vanished = new ArrayList<>();
        for (AgentMetadata agent : known.values()) {
            if (agent.status() == AgentStatus.ACTIVE && !discovered.containsKey(agent.agentId())) {
                vanished.add(agent.agentId());
            }
        }
        for (String agentId : vanished) {
            registry.markOrphaned(agentId);
            int removed = subscriptions.unregisterAll(agentId);
            log.debug("Orphaned agent {} ({} subscriptions removed)", agentId, removed);
            appendLifecycle(agentId, EventPayload.AgentLifecycle.ORPHANED);
        }

        ReconcileSummary summary = new ReconcileSummary(created, vanished.size(), updated, unchanged,
                discovered.size());
        log.info("Reconciliation complete: {} new, {} orphaned, {} updated, {} unchanged",
                summary.created(), summary.orphaned(), summary.updated(), summary.unchanged());
        return summary;
    }

    private void create(DiscoveredUnit unit) {
        try {
            Files.createDirectories(states.layout().agentDir(unit.agentId()));
        } catch (IOException e) {
            throw new StoreException("Failed to create agent directory for " + unit.agentId(), e);
        }
        AgentState state = states.load(unit.agentId())
                .map(existing -> existing.withIdentity(unit))
                .orElseGet(() -> AgentState.fromUnit(unit));
        states.save(state);
        subscriptions.registerDefaults(unit.agentId(), unit.filePath());
        registry.upsert(AgentMetadata.fromUnit(unit));
        appendLifecycle(unit.agentId(), EventPayload.AgentLifecycle.CREATED);
    }

    private void update(DiscoveredUnit unit) {
        registry.upsert(AgentMetadata.fromUnit(unit));
        AgentState state = states.load(unit.agentId())
                .map(existing -> existing.withIdentity(unit))
                .orElseGet(() -> AgentState.fromUnit(unit));
        states.save(state);
        subscriptions.registerDefaults(unit.agentId(), unit.filePath());
        appendLifecycle(unit.agentId(), EventPayload.AgentLifecycle.UPDATED);
        eventLog.append(Event.of(EventPayload.ContentChanged.of(unit.filePath())).withGraphId(graphId));
    }

    private void appendLifecycle(String agentId, String change) {
        eventLog.append(Event.of(new EventPayload.AgentLifecycle(agentId, change)).withGraphId(graphId));
    }
}
