package io.agentswarm.runner;

import io.agentswarm.config.SwarmConfig;
import io.agentswarm.eventlog.ReplayFilter;
import io.agentswarm.model.Event;
import io.agentswarm.model.EventPayload;
import io.agentswarm.model.EventType;
import io.agentswarm.observability.ObserverHub;
import io.agentswarm.runtime.SwarmRuntime;
import io.agentswarm.subscription.Subscription;
import io.agentswarm.subscription.SubscriptionPattern;
import io.agentswarm.swarm.DiscoveredUnit;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

final class TurnToolsTest {

    @Test
    void broadcastTargetsAndCascadeStamping() throws Exception {
        Path root = Files.createTempDirectory("agentswarm-test-tools-");
        ObserverHub hub = new ObserverHub(64).init();
        try (SwarmRuntime runtime = new SwarmRuntime(SwarmConfig.fromRoot(root.toString()), hub)) {
            runtime.reconcile(List.of(
                    new DiscoveredUnit("mod", "module", "mod", "mod", "src/mod.py", null, 1, 50),
                    new DiscoveredUnit("mod.f", "function", "f", "mod.f", "src/mod.py", "mod", 2, 10),
                    new DiscoveredUnit("mod.g", "function", "g", "mod.g", "src/mod.py", "mod", 11, 20),
                    new DiscoveredUnit("util", "module", "util", "util", "lib/util.py", null, 1, 5)
            ));
            long before = runtime.eventLog().lastId();
            TurnTools tools = tools(runtime, "mod.f");

            assertEquals(1, tools.broadcast("siblings", "hi sibling"));
            assertEquals(3, tools.broadcast("file:mod.py", "file changed"));
            assertEquals(0, tools(runtime, "mod.g").broadcast("children", "none"));
            assertEquals(2, tools(runtime, "mod").broadcast("CHILDREN", "hello kids"));
            assertThrows(IllegalStateException.class, () -> tools(runtime, "util").broadcast("siblings", "x"));
            assertThrows(IllegalArgumentException.class, () -> tools.broadcast("everyone", "x"));
            assertThrows(IllegalArgumentException.class, () -> tools.broadcast("file: ", "x"));

            List<Event> messages = runtime.replay(
                    ReplayFilter.after(before).withTypes(Set.of(EventType.AGENT_MESSAGE)), 100);
            assertEquals(6, messages.size());
            for (Event message : messages) {
                assertEquals("evt-7", message.correlationId());
                assertEquals(2, message.cascadeDepth());
            }
            EventPayload.AgentMessage first = (EventPayload.AgentMessage) messages.get(0).payload();
            assertEquals("mod.f", first.fromAgent());
            assertEquals("mod.g", first.toAgent());

            assertEquals(2, tools.queryAgents("FUNCTION").size());
            assertEquals(4, tools.queryAgents(null).size());
        } finally {
            hub.close();
            deleteRecursively(root);
        }
    }

    @Test
    void subscriptionsMadeDuringATurnAreTracked() throws Exception {
        Path root = Files.createTempDirectory("agentswarm-test-tools-subs-");
        ObserverHub hub = new ObserverHub(64).init();
        try (SwarmRuntime runtime = new SwarmRuntime(SwarmConfig.fromRoot(root.toString()), hub)) {
            runtime.reconcile(List.of(new DiscoveredUnit("a", "function", "a", "a", "a.py", null, 1, 2)));
            TurnTools tools = tools(runtime, "a");
            SubscriptionPattern pattern = SubscriptionPattern.builder().pathGlob("docs/*.md").build();

            Subscription sub = tools.subscribe(pattern);
            assertEquals(List.of(pattern), tools.addedSubscriptions());
            assertTrue(runtime.subscriptions("a").stream().map(Subscription::id).collect(Collectors.toList())
                    .contains(sub.id()));
            assertTrue(tools.unsubscribe(sub.id()));
            assertEquals(2, runtime.subscriptions("a").size());
        } finally {
            hub.close();
            deleteRecursively(root);
        }
    }

    private static TurnTools tools(SwarmRuntime runtime, String agentId) {
        return new TurnTools(agentId, "swarm", "evt-7", 2, runtime.eventLog(), runtime.subscriptions(),
                runtime.swarm());
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
