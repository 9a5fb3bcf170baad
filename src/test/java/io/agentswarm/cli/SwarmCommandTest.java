package io.agentswarm.cli;

import io.agentswarm.config.SwarmConfig;
import io.agentswarm.eventlog.ReplayFilter;
import io.agentswarm.model.Event;
import io.agentswarm.model.EventType;
import io.agentswarm.observability.ObserverHub;
import io.agentswarm.runtime.SwarmRuntime;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SwarmCommandTest {

    @Test
    void commandsDriveTheSwarmEndToEnd() throws Exception {
        Path root = Files.createTempDirectory("agentswarm-test-cli-");
        Path store = root.resolve("store");
        Path units = root.resolve("units.json");
        Path movedUnits = root.resolve("units-moved.json");
        try {
            Files.writeString(units, """
                    [{"agentId":"a","nodeType":"function","name":"a","filePath":"src/a.py","startLine":1,"endLine":3}]
                    """);
            Files.writeString(movedUnits, """
                    [{"agentId":"a","nodeType":"function","name":"a","filePath":"src/pkg/a.py","startLine":1,"endLine":3}]
                    """);
            String rootArg = store.toString();

            assertEquals(0, run("--root", rootArg, "init"));
            assertEquals(0, run("--root", rootArg, "reconcile", "--units", units.toString()));
            assertEquals(0, run("--root", rootArg, "emit", "--tag", "manual", "trigger", "--to", "a"));
            assertEquals(0, run("--root", rootArg, "emit", "message", "--from", "user", "--to", "a", "--content", "hi"));
            assertEquals(0, run("--root", rootArg, "run", "--units", movedUnits.toString(), "--drain",
                    "--drain-timeout-ms", "20000"));
            assertEquals(0, run("--root", rootArg, "subscribe", "--agent", "a", "--path", "docs/*.md"));
            assertEquals(2, run("--root", rootArg, "subscribe", "--agent", "a"));
            assertEquals(0, run("--root", rootArg, "replay", "--type", "agent_complete"));
            assertEquals(0, run("--root", rootArg, "graphs"));
            assertEquals(0, run("--root", rootArg, "agents", "--status", "active"));
            assertEquals(0, run("--root", rootArg, "subscriptions", "--agent", "a"));
            assertEquals(0, run("--root", rootArg, "migrations"));

            ObserverHub hub = new ObserverHub(16).init();
            try (SwarmRuntime runtime = new SwarmRuntime(SwarmConfig.fromRoot(rootArg), hub)) {
                List<Event> completes = runtime.replay(
                        ReplayFilter.all().withTypes(Set.of(EventType.AGENT_COMPLETE)), 100);
                assertEquals(1, completes.size());
                List<Event> triggers = runtime.replay(
                        ReplayFilter.all().withTypes(Set.of(EventType.MANUAL_TRIGGER)), 100);
                assertEquals(List.of("manual"), triggers.get(0).tags());
                assertEquals(3, runtime.subscriptions("a").size());
                assertTrue(runtime.eventLog().eventCount(null) >= 7);
            } finally {
                hub.close();
            }
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void runRoutesEventsEmittedByAnotherCommand() throws Exception {
        Path root = Files.createTempDirectory("agentswarm-test-cli-follow-");
        Path store = root.resolve("store");
        Path units = root.resolve("units.json");
        Path movedUnits = root.resolve("units-moved.json");
        try {
            Files.createDirectories(store);
            Files.writeString(store.resolve(SwarmConfig.SETTINGS_FILE), "{\"triggerCooldownMs\":0}");
            Files.writeString(units, """
                    [{"agentId":"a","nodeType":"function","name":"a","filePath":"src/a.py","startLine":1,"endLine":3}]
                    """);
            Files.writeString(movedUnits, """
                    [{"agentId":"a","nodeType":"function","name":"a","filePath":"src/pkg/a.py","startLine":1,"endLine":3}]
                    """);
            String rootArg = store.toString();
            assertEquals(0, run("--root", rootArg, "reconcile", "--units", units.toString()));

            AtomicInteger runCode = new AtomicInteger(-1);
            Thread runner = new Thread(() -> runCode.set(run("--root", rootArg, "run", "--units", movedUnits.toString(),
                    "--follow-ms", "50", "--duration-ms", "8000")), "cli-run");
            runner.start();
            assertTrue(awaitEvents(rootArg, EventType.AGENT_COMPLETE, 1, 15_000L));

            assertEquals(0, run("--root", rootArg, "emit", "trigger", "--to", "a", "--reason", "from outside"));
            assertTrue(awaitEvents(rootArg, EventType.AGENT_COMPLETE, 2, 15_000L));
            runner.join(30_000L);
            assertFalse(runner.isAlive());
            assertEquals(0, runCode.get());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void unknownAgentStatusIsAnError() throws Exception {
        Path root = Files.createTempDirectory("agentswarm-test-cli-bad-");
        try {
            assertEquals(1, run("--root", root.toString(), "agents", "--status", "sleeping"));
        } finally {
            deleteRecursively(root);
        }
    }

    private static boolean awaitEvents(String rootArg, EventType type, int count, long timeoutMs) throws Exception {
        long deadline = System.currentTimeMillis() + timeoutMs;
        while (System.currentTimeMillis() < deadline) {
            ObserverHub hub = new ObserverHub(16).init();
            try (SwarmRuntime runtime = new SwarmRuntime(SwarmConfig.fromRoot(rootArg), hub)) {
                if (runtime.replay(ReplayFilter.all().withTypes(Set.of(type)), 100).size() >= count) {
                    return true;
                }
            } finally {
                hub.close();
            }
            Thread.sleep(100L);
        }
        return false;
    }

    private static int run(String... args) {
        return new CommandLine(new SwarmCommand()).execute(args);
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
