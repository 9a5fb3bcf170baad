package io.agentswarm.runtime;

import com.fasterxml.jackson.core.type.TypeReference;
import io.agentswarm.agent.EchoExecutor;
import io.agentswarm.agent.ExecutorRegistry;
import io.agentswarm.agent.ScriptExecutor;
import io.agentswarm.config.SwarmConfig;
import io.agentswarm.config.SwarmSettings;
import io.agentswarm.eventlog.EventLog;
import io.agentswarm.eventlog.GraphSummary;
import io.agentswarm.eventlog.ReplayFilter;
import io.agentswarm.model.AgentStatus;
import io.agentswarm.model.Event;
import io.agentswarm.model.EventPayload;
import io.agentswarm.observability.ObserverHub;
import io.agentswarm.runner.AgentRunner;
import io.agentswarm.storage.Database;
import io.agentswarm.storage.StoreException;
import io.agentswarm.subscription.Subscription;
import io.agentswarm.subscription.SubscriptionPattern;
import io.agentswarm.subscription.SubscriptionRegistry;
import io.agentswarm.swarm.AgentLayout;
import io.agentswarm.swarm.AgentMetadata;
import io.agentswarm.swarm.AgentStateStore;
import io.agentswarm.swarm.DiscoveredUnit;
import io.agentswarm.swarm.ReconcileSummary;
import io.agentswarm.swarm.Reconciler;
import io.agentswarm.swarm.SwarmRegistry;
import io.agentswarm.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

public final class SwarmRuntime implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(SwarmRuntime.class);
    private static final TypeReference<List<DiscoveredUnit>> UNIT_LIST = new TypeReference<>() {
    };

    private final SwarmConfig config;
    private final ObserverHub observers;
    private final Clock clock;
    private final SubscriptionRegistry subscriptions;
    private final EventLog eventLog;
    private final SwarmRegistry swarm;
    private final AgentStateStore states;
    private final ExecutorRegistry executors;
    private final Reconciler reconciler;
    private AgentRunner runner;
    private boolean closed;

    public SwarmRuntime(SwarmConfig config, ObserverHub observers) {
        this(config, observers, Clock.systemUTC());
    }

    public SwarmRuntime(SwarmConfig config, ObserverHub observers, Clock clock) {
        this.config = config;
        this.observers = observers;
        this.clock = clock;
        SwarmSettings settings = config.settings();
        try {
            Files.createDirectories(config.agentsRoot());
            Files.createDirectories(config.workspacesRoot());
        } catch (IOException e) {
            throw new StoreException("Failed to initialize storage root " + config.rootDir(), e);
        }
        this.subscriptions = new SubscriptionRegistry(new Database(config.subscriptionsDbFile()));
        this.eventLog = new EventLog(new Database(config.eventsDbFile()), subscriptions, observers,
                settings.triggerQueueCapacity(), settings.triggerPushTimeoutMs());
        this.swarm = new SwarmRegistry(new Database(config.swarmDbFile()), clock);
        this.states = new AgentStateStore(new AgentLayout(config.agentsRoot(), config.workspacesRoot()), clock);
        this.executors = new ExecutorRegistry(new EchoExecutor());
        for (Map.Entry<String, List<String>> entry : settings.scriptExecutors().entrySet()) {
            executors.register(entry.getKey(),
                    new ScriptExecutor("script:" + entry.getKey(), entry.getValue(), settings.scriptTimeoutMs()));
        }
        this.reconciler = new Reconciler(swarm, subscriptions, states, eventLog, settings.swarmId());
        log.info("Swarm runtime opened at {}", config.rootDir());
    }

    public SwarmConfig config() {
        return config;
    }

    public EventLog eventLog() {
        return eventLog;
    }

    public SubscriptionRegistry subscriptions() {
        return subscriptions;
    }

    public SwarmRegistry swarm() {
        return swarm;
    }

    public AgentStateStore states() {
        return states;
    }

    public ExecutorRegistry executors() {
        return executors;
    }

    public ReconcileSummary reconcile(List<DiscoveredUnit> units) {
        return reconciler.reconcile(units);
    }

    public static List<DiscoveredUnit> readUnits(Path file) {
        try {
            return Jsons.compact().readValue(file.toFile(), UNIT_LIST);
        } catch (IOException e) {
            throw new IllegalArgumentException("Invalid units file: " + file, e);
        }
    }

    public Event emit(EventPayload payload, List<String> tags) {
        return eventLog.appendAndGet(Event.of(payload).withGraphId(config.settings().swarmId()).withTags(tags));
    }

    public List<Event> replay(ReplayFilter filter, int limit) {
        try (Stream<Event> events = eventLog.replay(filter)) {
            return events.limit(Math.max(1, limit)).collect(Collectors.toList());
        }
    }

    public List<GraphSummary> graphs(int limit) {
        return eventLog.graphSummaries(limit);
    }

    public List<Subscription> subscriptions(String agentId) {
        return agentId == null || agentId.isBlank() ? subscriptions.listAll() : subscriptions.getSubscriptions(agentId);
    }

    public Subscription subscribe(String agentId, SubscriptionPattern pattern) {
        return subscriptions.register(agentId, pattern);
    }

    public List<AgentMetadata> agents(Optional<AgentStatus> status) {
        return swarm.listAgents(status);
    }

    public synchronized AgentRunner runner() {
        if (closed) {
            throw new IllegalStateException("Runtime is closed");
        }
        if (runner == null) {
            runner = new AgentRunner(config.settings(), eventLog, subscriptions, swarm, states, executors,
                    observers, clock);
        }
        return runner;
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (runner != null) {
            runner.stop();
        } else {
            eventLog.close();
            subscriptions.close();
            swarm.close();
        }
        log.info("Swarm runtime closed at {}", config.rootDir());
    }
}
