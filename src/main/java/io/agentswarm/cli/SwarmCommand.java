package io.agentswarm.cli;

import io.agentswarm.config.SwarmConfig;
import io.agentswarm.eventlog.ReplayFilter;
import io.agentswarm.model.AgentStatus;
import io.agentswarm.model.Event;
import io.agentswarm.model.EventPayload;
import io.agentswarm.model.EventType;
import io.agentswarm.observability.Observation;
import io.agentswarm.observability.ObservationStream;
import io.agentswarm.observability.ObserverHub;
import io.agentswarm.runner.AgentRunner;
import io.agentswarm.runtime.SwarmRuntime;
import io.agentswarm.storage.Database;
import io.agentswarm.subscription.Subscription;
import io.agentswarm.subscription.SubscriptionPattern;
import io.agentswarm.swarm.DiscoveredUnit;
import io.agentswarm.swarm.ReconcileSummary;
import io.agentswarm.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

@Command(
        name = "agentswarm",
        mixinStandardHelpOptions = true,
        description = "Reactive agent swarm core CLI",
        subcommands = {
                SwarmCommand.InitCommand.class,
                SwarmCommand.ReconcileCommand.class,
                SwarmCommand.RunCommand.class,
                SwarmCommand.EmitCommand.class,
                SwarmCommand.ReplayCommand.class,
                SwarmCommand.GraphsCommand.class,
                SwarmCommand.SubscriptionsCommand.class,
                SwarmCommand.SubscribeCommand.class,
                SwarmCommand.AgentsCommand.class,
                SwarmCommand.MigrationsCommand.class
        }
)
public final class SwarmCommand implements Runnable {

    @Option(names = {"--root"}, description = "Swarm storage root directory", defaultValue = SwarmConfig.DEFAULT_ROOT)
    String root;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | reconcile | run | emit | replay | graphs | subscriptions | subscribe | agents | migrations");
    }

    SwarmConfig config() {
        return SwarmConfig.fromRoot(root);
    }

    Session open() {
        ObserverHub hub = new ObserverHub(config().settings().observerBufferSize()).init();
        try {
            return new Session(hub, new SwarmRuntime(config(), hub));
        } catch (RuntimeException e) {
            hub.close();
            throw e;
        }
    }

    static Map<String, Object> view(Event event) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("id", event.id());
        out.put("type", event.eventType().wireName());
        out.put("graphId", event.graphId());
        out.put("correlationId", event.correlationId());
        out.put("cascadeDepth", event.cascadeDepth());
        out.put("tags", event.tags());
        out.put("createdAtMs", event.createdAtMs());
        out.put("payload", event.payload());
        return out;
    }

    static Map<String, Object> view(Observation observation) {
        Map<String, Object> out = new LinkedHashMap<>();
        if (observation instanceof Observation.Appended appended) {
            out.put("kind", "appended");
            out.put("event", view(appended.event()));
        } else if (observation instanceof Observation.Decision decision) {
            out.put("kind", "decision");
            out.put("decision", decision);
        }
        return out;
    }

    record Session(ObserverHub hub, SwarmRuntime runtime) implements AutoCloseable {
        @Override
        public void close() {
            try {
                runtime.close();
            } finally {
                hub.close();
            }
        }
    }

    @Command(name = "init", description = "Create the storage root and its stores")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        SwarmCommand parent;

        @Override
        public Integer call() {
            try (Session session = parent.open()) {
                System.out.println("Initialized swarm at: " + session.runtime().config().rootDir());
            }
            return 0;
        }
    }

    @Command(name = "reconcile", description = "Reconcile the swarm registry against discovered units")
    static final class ReconcileCommand implements Callable<Integer> {
        @ParentCommand
        SwarmCommand parent;

        @Option(names = {"--units"}, required = true, description = "JSON file with a list of discovered units")
        Path units;

        @Override
        public Integer call() {
            List<DiscoveredUnit> discovered = SwarmRuntime.readUnits(units);
            try (Session session = parent.open()) {
                ReconcileSummary summary = session.runtime().reconcile(discovered);
                System.out.println(Jsons.toJson(summary));
            }
            return 0;
        }
    }

    @Command(name = "run", description = "Run the agent runner until interrupted, or until idle with --drain."
            + " Events other processes append (for example with emit) are routed while it runs.")
    static final class RunCommand implements Callable<Integer> {
        @ParentCommand
        SwarmCommand parent;

        @Option(names = {"--units"}, description = "Reconcile against this units file before starting")
        Path units;

        @Option(names = {"--drain"}, description = "Exit once every pending trigger has settled")
        boolean drain;

        @Option(names = {"--drain-timeout-ms"}, defaultValue = "60000", description = "Maximum wait for --drain")
        long drainTimeoutMs;

        @Option(names = {"--watch"}, description = "Print observations as JSON lines")
        boolean watch;

        @Option(names = {"--follow-ms"}, defaultValue = "250",
                description = "Interval for routing events appended by other processes, 0 to disable")
        long followMs;

        @Option(names = {"--duration-ms"}, defaultValue = "0",
                description = "Stop after this long instead of waiting for an interrupt, 0 to wait")
        long durationMs;

        @Override
        public Integer call() throws InterruptedException {
            try (Session session = parent.open()) {
                SwarmRuntime runtime = session.runtime();
                ObservationStream stream = watch ? session.hub().subscribe() : null;
                if (followMs > 0) {
                    runtime.eventLog().follow();
                }
                if (units != null) {
                    System.out.println(Jsons.toJson(runtime.reconcile(SwarmRuntime.readUnits(units))));
                }
                AgentRunner runner = runtime.runner().start();
                ScheduledExecutorService follower = followMs > 0 ? startFollower(runtime) : null;
                Thread printer = stream == null ? null : startPrinter(stream);
                int code = 0;
                if (drain) {
                    boolean idle = runner.awaitIdle(Duration.ofMillis(drainTimeoutMs));
                    if (!idle) {
                        System.err.println("Runner did not drain within " + drainTimeoutMs + "ms");
                        code = 2;
                    }
                } else {
                    awaitShutdown(runner, follower);
                }
                stopFollower(follower);
                runner.stop();
                System.out.println(Jsons.toJson(runner.stats().snapshot()));
                if (stream != null) {
                    stream.close();
                    printer.join(1_000L);
                }
                return code;
            }
        }

        private ScheduledExecutorService startFollower(SwarmRuntime runtime) {
            ScheduledExecutorService follower = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "swarm-follow");
                t.setDaemon(true);
                return t;
            });
            follower.scheduleWithFixedDelay(() -> {
                try {
                    runtime.eventLog().routeExternalAppends();
                } catch (RuntimeException e) {
                    System.err.println("Could not route external events: " + e.getMessage());
                }
            }, followMs, followMs, TimeUnit.MILLISECONDS);
            return follower;
        }

        private static void stopFollower(ScheduledExecutorService follower) throws InterruptedException {
            if (follower != null) {
                follower.shutdownNow();
                follower.awaitTermination(5, TimeUnit.SECONDS);
            }
        }

        private void awaitShutdown(AgentRunner runner, ScheduledExecutorService follower)
                throws InterruptedException {
            // The JVM halts once hooks return, so the hook stops the runner itself.
            CountDownLatch stopped = new CountDownLatch(1);
            Thread hook = new Thread(() -> {
                try {
                    stopFollower(follower);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                runner.stop();
                stopped.countDown();
            }, "swarm-shutdown");
            Runtime.getRuntime().addShutdownHook(hook);
            if (durationMs > 0) {
                stopped.await(durationMs, TimeUnit.MILLISECONDS);
            } else {
                stopped.await();
            }
            try {
                Runtime.getRuntime().removeShutdownHook(hook);
            } catch (IllegalStateException e) {
                stopped.await();
            }
        }

        private Thread startPrinter(ObservationStream stream) {
            Thread t = new Thread(() -> {
                try {
                    while (!stream.isClosed()) {
                        Observation next = stream.poll(Duration.ofMillis(200));
                        if (next != null) {
                            System.out.println(Jsons.toCompactJson(view(next)));
                        }
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }, "swarm-watch");
            t.setDaemon(true);
            t.start();
            return t;
        }
    }

    @Command(
            name = "emit",
            description = "Append a root event. A separately started run routes it within its --follow-ms interval.",
            subcommands = {
                    EmitContentChangedCommand.class,
                    EmitFileSavedCommand.class,
                    EmitMessageCommand.class,
                    EmitTriggerCommand.class
            }
    )
    static final class EmitCommand implements Runnable {
        @ParentCommand
        SwarmCommand parent;

        @Option(names = {"--tag"}, description = "Tag to attach (repeatable)")
        List<String> tags = new ArrayList<>();

        @Override
        public void run() {
            System.out.println("Use: emit content-changed | file-saved | message | trigger");
        }

        int append(EventPayload payload) {
            try (Session session = parent.open()) {
                Event stored = session.runtime().emit(payload, tags);
                System.out.println(Jsons.toJson(view(stored)));
            }
            return 0;
        }
    }

    @Command(name = "content-changed", description = "Append a content_changed event")
    static final class EmitContentChangedCommand implements Callable<Integer> {
        @ParentCommand
        EmitCommand emit;

        @Option(names = {"--path"}, required = true)
        String path;

        @Option(names = {"--diff"})
        String diff;

        @Override
        public Integer call() {
            return emit.append(new EventPayload.ContentChanged(path, diff));
        }
    }

    @Command(name = "file-saved", description = "Append a file_saved event")
    static final class EmitFileSavedCommand implements Callable<Integer> {
        @ParentCommand
        EmitCommand emit;

        @Option(names = {"--path"}, required = true)
        String path;

        @Override
        public Integer call() {
            return emit.append(new EventPayload.FileSaved(path));
        }
    }

    @Command(name = "message", description = "Append an agent_message event")
    static final class EmitMessageCommand implements Callable<Integer> {
        @ParentCommand
        EmitCommand emit;

        @Option(names = {"--from"}, defaultValue = "user")
        String from;

        @Option(names = {"--to"}, required = true)
        String to;

        @Option(names = {"--content"}, defaultValue = "")
        String content;

        @Override
        public Integer call() {
            return emit.append(new EventPayload.AgentMessage(from, to, content));
        }
    }

    @Command(name = "trigger", description = "Append a manual_trigger event")
    static final class EmitTriggerCommand implements Callable<Integer> {
        @ParentCommand
        EmitCommand emit;

        @Option(names = {"--to"}, required = true)
        String to;

        @Option(names = {"--reason"}, defaultValue = "manual")
        String reason;

        @Override
        public Integer call() {
            return emit.append(new EventPayload.ManualTrigger(to, reason));
        }
    }

    @Command(name = "replay", description = "Print stored events in id order")
    static final class ReplayCommand implements Callable<Integer> {
        @ParentCommand
        SwarmCommand parent;

        @Option(names = {"--after"}, defaultValue = "0", description = "Only events with a larger id")
        long after;

        @Option(names = {"--graph"}, description = "Graph id filter")
        String graph;

        @Option(names = {"--type"}, description = "Event type filter (repeatable)")
        List<String> types = new ArrayList<>();

        @Option(names = {"--since-ms"})
        Long sinceMs;

        @Option(names = {"--until-ms"})
        Long untilMs;

        @Option(names = {"--limit"}, defaultValue = "1000")
        int limit;

        @Override
        public Integer call() {
            List<EventType> eventTypes = new ArrayList<>();
            for (String type : types) {
                eventTypes.add(EventType.fromString(type));
            }
            ReplayFilter filter = ReplayFilter.after(after).withGraph(graph).withTypes(Set.copyOf(eventTypes))
                    .between(sinceMs, untilMs);
            try (Session session = parent.open()) {
                List<Map<String, Object>> out = new ArrayList<>();
                for (Event event : session.runtime().replay(filter, limit)) {
                    out.add(view(event));
                }
                System.out.println(Jsons.toJson(out));
            }
            return 0;
        }
    }

    @Command(name = "graphs", description = "List graph ids with event counts")
    static final class GraphsCommand implements Callable<Integer> {
        @ParentCommand
        SwarmCommand parent;

        @Option(names = {"--limit"}, defaultValue = "50")
        int limit;

        @Override
        public Integer call() {
            try (Session session = parent.open()) {
                System.out.println(Jsons.toJson(session.runtime().graphs(limit)));
            }
            return 0;
        }
    }

    @Command(name = "subscriptions", description = "List subscriptions, optionally for one agent")
    static final class SubscriptionsCommand implements Callable<Integer> {
        @ParentCommand
        SwarmCommand parent;

        @Option(names = {"--agent"})
        String agentId;

        @Override
        public Integer call() {
            try (Session session = parent.open()) {
                List<Subscription> subs = session.runtime().subscriptions(agentId);
                System.out.println(Jsons.toJson(subs));
            }
            return 0;
        }
    }

    @Command(name = "subscribe", description = "Register a custom subscription for an agent")
    static final class SubscribeCommand implements Callable<Integer> {
        @ParentCommand
        SwarmCommand parent;

        @Option(names = {"--agent"}, required = true)
        String agentId;

        @Option(names = {"--type"}, description = "Event type (repeatable)")
        List<String> types = new ArrayList<>();

        @Option(names = {"--from"}, description = "Sending agent (repeatable)")
        List<String> fromAgents = new ArrayList<>();

        @Option(names = {"--to"})
        String toAgent;

        @Option(names = {"--path"}, description = "Path glob")
        String pathGlob;

        @Option(names = {"--tag"}, description = "Tag (repeatable)")
        List<String> tags = new ArrayList<>();

        @Override
        public Integer call() {
            SubscriptionPattern.Builder builder = SubscriptionPattern.builder()
                    .fromAgents(fromAgents)
                    .toAgent(toAgent)
                    .pathGlob(pathGlob)
                    .tags(tags);
            for (String type : types) {
                builder.eventType(EventType.fromString(type));
            }
            SubscriptionPattern pattern;
            try {
                pattern = builder.build();
            } catch (IllegalArgumentException e) {
                System.err.println(e.getMessage());
                return 2;
            }
            try (Session session = parent.open()) {
                System.out.println(Jsons.toJson(session.runtime().subscribe(agentId, pattern)));
            }
            return 0;
        }
    }

    @Command(name = "agents", description = "List registered agents")
    static final class AgentsCommand implements Callable<Integer> {
        @ParentCommand
        SwarmCommand parent;

        @Option(names = {"--status"}, description = "ACTIVE or ORPHANED")
        String status;

        @Override
        public Integer call() {
            Optional<AgentStatus> filter = status == null || status.isBlank()
                    ? Optional.empty()
                    : Optional.of(AgentStatus.fromString(status));
            try (Session session = parent.open()) {
                System.out.println(Jsons.toJson(session.runtime().agents(filter)));
            }
            return 0;
        }
    }

    @Command(name = "migrations", description = "Show applied schema migrations of each store")
    static final class MigrationsCommand implements Callable<Integer> {
        @ParentCommand
        SwarmCommand parent;

        @Option(names = {"--limit"}, defaultValue = "50")
        int limit;

        @Override
        public Integer call() {
            SwarmConfig config = parent.config();
            Map<String, Object> out = new LinkedHashMap<>();
            try (Session ignored = parent.open()) {
                out.put("events", new Database(config.eventsDbFile()).listSchemaMigrations(limit));
                out.put("subscriptions", new Database(config.subscriptionsDbFile()).listSchemaMigrations(limit));
                out.put("swarm", new Database(config.swarmDbFile()).listSchemaMigrations(limit));
            }
            System.out.println(Jsons.toJson(out));
            return 0;
        }
    }
}
