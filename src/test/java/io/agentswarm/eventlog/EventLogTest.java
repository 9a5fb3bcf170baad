package io.agentswarm.eventlog;

import io.agentswarm.model.Event;
import io.agentswarm.model.EventPayload;
import io.agentswarm.model.EventType;
import io.agentswarm.model.Trigger;
import io.agentswarm.model.TriggerOutcome;
import io.agentswarm.observability.Observation;
import io.agentswarm.observability.ObservationStream;
import io.agentswarm.observability.ObserverHub;
import io.agentswarm.storage.Database;
import io.agentswarm.subscription.SubscriptionPattern;
import io.agentswarm.subscription.SubscriptionRegistry;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.Statement;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

final class EventLogTest {

    @Test
    void appendAssignsIncreasingIdsAndReplayIsExclusiveAndRepeatable() throws Exception {
        Path root = Files.createTempDirectory("agentswarm-test-eventlog-");
        ObserverHub hub = new ObserverHub(64).init();
        try (EventLog log = openLog(root, hub, 16, 100L)) {
            long a = log.append(Event.of(EventPayload.ContentChanged.of("src/a.py")).withGraphId("g1"));
            long b = log.append(Event.of(new EventPayload.FileSaved("src/b.py")).withGraphId("g1"));
            long c = log.append(Event.of(new EventPayload.ManualTrigger("agent-1", "poke")).withGraphId("g2"));
            assertTrue(a < b && b < c);
            assertEquals(c, log.lastId());

            assertEquals(List.of(a, b, c), ids(log.replay(0L)));
            assertEquals(List.of(b, c), ids(log.replay(a)));
            assertEquals(ids(log.replay(0L)), ids(log.replay(0L)));
            assertEquals(List.of(c), ids(log.replay(0L, "g2")));
            assertEquals(List.of(b), ids(log.replay(ReplayFilter.all().withTypes(Set.of(EventType.FILE_SAVED)))));
            assertEquals(List.of(), ids(log.replay(c)));

            assertEquals(3L, log.eventCount(null));
            assertEquals(2L, log.eventCount("g1"));
            List<GraphSummary> graphs = log.graphSummaries(10);
            assertEquals(2, graphs.size());
            assertEquals(Set.of("g1", "g2"), graphs.stream().map(GraphSummary::graphId).collect(Collectors.toSet()));
        } finally {
            hub.close();
            deleteRecursively(root);
        }
    }

    @Test
    void replayStopsAtLastIdSeenWhenCalled() throws Exception {
        Path root = Files.createTempDirectory("agentswarm-test-eventlog-bound-");
        ObserverHub hub = new ObserverHub(64).init();
        try (EventLog log = openLog(root, hub, 16, 100L)) {
            for (int i = 0; i < 300; i++) {
                log.append(Event.of(new EventPayload.FileSaved("f" + i + ".txt")));
            }
            try (Stream<Event> replay = log.replay(0L)) {
                log.append(Event.of(new EventPayload.FileSaved("late.txt")));
                assertEquals(300L, replay.count());
            }
            assertEquals(301L, log.replay(0L).count());
        } finally {
            hub.close();
            deleteRecursively(root);
        }
    }

    @Test
    void routedEventIsDeliveredExactlyOncePerMatchingAgent() throws Exception {
        Path root = Files.createTempDirectory("agentswarm-test-eventlog-route-");
        ObserverHub hub = new ObserverHub(64).init();
        SubscriptionRegistry subs = registry(root);
        try (EventLog log = openLog(root, subs, hub, 16, 100L)) {
            subs.register("agent-b", SubscriptionPattern.directTo("agent-b"));
            subs.register("agent-b", SubscriptionPattern.builder().fromAgent("agent-a").build());
            subs.register("agent-c", SubscriptionPattern.builder().eventType(EventType.AGENT_MESSAGE).build());
            TriggerChannel channel = log.triggers();

            long id = log.append(Event.of(new EventPayload.AgentMessage("agent-a", "agent-b", "hi")));

            Trigger first = channel.poll(1_000L);
            Trigger second = channel.poll(1_000L);
            assertNotNull(first);
            assertNotNull(second);
            assertEquals("agent-b", first.agentId());
            assertEquals("agent-c", second.agentId());
            assertEquals(id, first.eventId());
            assertEquals(id, first.event().id());
            assertNull(channel.poll(50L));
            assertEquals(2L, channel.deliveredCount());

            assertThrows(IllegalStateException.class, log::triggers);
        } finally {
            hub.close();
            deleteRecursively(root);
        }
    }

    @Test
    void failedPersistDeliversNothing() throws Exception {
        Path root = Files.createTempDirectory("agentswarm-test-eventlog-persist-");
        ObserverHub hub = new ObserverHub(64).init();
        SubscriptionRegistry subs = registry(root);
        try (EventLog log = openLog(root, subs, hub, 16, 100L)) {
            subs.register("agent-b", SubscriptionPattern.directTo("agent-b"));
            TriggerChannel channel = log.triggers();
            ObservationStream observed = hub.subscribe();
            try (Connection c = log.database().openConnection(); Statement st = c.createStatement()) {
                st.execute("DROP TABLE events");
            }

            assertThrows(EventLogException.class,
                    () -> log.append(Event.of(new EventPayload.ManualTrigger("agent-b", "x"))));
            assertEquals(0, channel.pending());
            assertEquals(0L, channel.deliveredCount());
            assertTrue(observed.drain().isEmpty());
        } finally {
            hub.close();
            deleteRecursively(root);
        }
    }

    @Test
    void fullChannelFailsOnlyThatDelivery() throws Exception {
        Path root = Files.createTempDirectory("agentswarm-test-eventlog-full-");
        ObserverHub hub = new ObserverHub(64).init();
        SubscriptionRegistry subs = registry(root);
        try (EventLog log = openLog(root, subs, hub, 1, 20L)) {
            subs.register("agent-b", SubscriptionPattern.directTo("agent-b"));
            TriggerChannel channel = log.triggers();
            ObservationStream observed = hub.subscribe();

            long first = log.append(Event.of(new EventPayload.ManualTrigger("agent-b", "one")));
            long second = log.append(Event.of(new EventPayload.ManualTrigger("agent-b", "two")));

            assertEquals(2L, log.eventCount(null));
            assertEquals(1L, log.deliveryFailures());
            assertEquals(first, channel.poll(100L).eventId());
            List<Observation.Decision> failures = observed.drain().stream()
                    .filter(o -> o instanceof Observation.Decision)
                    .map(o -> (Observation.Decision) o)
                    .collect(Collectors.toList());
            assertEquals(1, failures.size());
            assertEquals(TriggerOutcome.DELIVERY_FAILED, failures.get(0).outcome());
            assertEquals(second, failures.get(0).eventId());
        } finally {
            hub.close();
            deleteRecursively(root);
        }
    }

    @Test
    void followedLogRoutesEventsAppendedElsewhereOnce() throws Exception {
        Path root = Files.createTempDirectory("agentswarm-test-eventlog-follow-");
        ObserverHub hub = new ObserverHub(64).init();
        ObserverHub otherHub = new ObserverHub(64).init();
        SubscriptionRegistry subs = registry(root);
        try (EventLog log = openLog(root, subs, hub, 16, 100L);
             EventLog other = openLog(root, otherHub, 16, 100L)) {
            subs.register("agent-b", SubscriptionPattern.directTo("agent-b"));
            TriggerChannel channel = log.triggers();
            other.append(Event.of(new EventPayload.ManualTrigger("agent-b", "before")));
            assertEquals(0, log.routeExternalAppends());

            log.follow();
            long external = other.append(Event.of(new EventPayload.ManualTrigger("agent-b", "after")));
            long local = log.append(Event.of(new EventPayload.ManualTrigger("agent-b", "here")));
            assertEquals(local, channel.poll(1_000L).eventId());

            assertEquals(1, log.routeExternalAppends());
            Trigger routed = channel.poll(1_000L);
            assertNotNull(routed);
            assertEquals(external, routed.eventId());
            assertEquals("agent-b", routed.agentId());

            assertEquals(0, log.routeExternalAppends());
            assertNull(channel.poll(50L));
            assertEquals(2L, channel.deliveredCount());
        } finally {
            hub.close();
            otherHub.close();
            deleteRecursively(root);
        }
    }

    @Test
    void appendAfterCloseIsRejected() throws Exception {
        Path root = Files.createTempDirectory("agentswarm-test-eventlog-closed-");
        ObserverHub hub = new ObserverHub(64).init();
        try {
            EventLog log = openLog(root, hub, 16, 100L);
            TriggerChannel channel = log.triggers();
            log.close();
            log.close();
            assertTrue(log.isClosed());
            assertTrue(channel.isClosed());
            assertNull(channel.take());
            assertThrows(IllegalStateException.class,
                    () -> log.append(Event.of(new EventPayload.FileSaved("a.txt"))));
        } finally {
            hub.close();
            deleteRecursively(root);
        }
    }

    @Test
    void legacyEventsTableIsMigratedInPlace() throws Exception {
        Path root = Files.createTempDirectory("agentswarm-test-eventlog-migrate-");
        Path dbFile = root.resolve("events.db");
        ObserverHub hub = new ObserverHub(64).init();
        try {
            Database legacy = new Database(dbFile);
            legacy.init(conn -> {
                try (Statement st = conn.createStatement()) {
                    st.execute("""
                            CREATE TABLE events (
                                id INTEGER PRIMARY KEY AUTOINCREMENT,
                                graph_id TEXT NOT NULL DEFAULT '',
                                event_type TEXT NOT NULL,
                                payload TEXT NOT NULL,
                                created_at_ms INTEGER NOT NULL
                            )
                            """);
                    st.execute("INSERT INTO events(graph_id,event_type,payload,created_at_ms) VALUES"
                            + "('g','agent_message','{\"fromAgent\":\"a\",\"toAgent\":\"b\",\"content\":\"hi\"}',10),"
                            + "('g','file_saved','{\"path\":\"src/x.py\"}',11)");
                }
            }, List.of());
            legacy.close();

            try (EventLog log = openLog(root, hub, 16, 100L)) {
                assertEquals(2L, log.eventCount(null));
                List<Event> events = log.replay(0L).collect(Collectors.toList());
                assertEquals(EventType.AGENT_MESSAGE, events.get(0).eventType());
                assertEquals("b", events.get(0).toAgent().orElseThrow());
                assertEquals(List.of(), events.get(0).tags());
                assertTrue(events.get(0).isRoot());

                try (Connection c = log.database().openConnection(); Statement st = c.createStatement();
                     ResultSet rs = st.executeQuery("SELECT from_agent,to_agent,path FROM events ORDER BY id")) {
                    assertTrue(rs.next());
                    assertEquals("a", rs.getString(1));
                    assertEquals("b", rs.getString(2));
                    assertTrue(rs.next());
                    assertEquals("src/x.py", rs.getString(3));
                }
                assertTrue(log.database().listSchemaMigrations(10).stream()
                        .anyMatch(row -> row.version().equals("20261019_001_routing_backfill") && row.success()));
            }
        } finally {
            hub.close();
            deleteRecursively(root);
        }
    }

    private static SubscriptionRegistry registry(Path root) {
        return new SubscriptionRegistry(new Database(root.resolve("subscriptions.db")));
    }

    private static EventLog openLog(Path root, SubscriptionRegistry subs, ObserverHub hub, int capacity,
                                    long pushTimeoutMs) {
        return new EventLog(new Database(root.resolve("events.db")), subs, hub, capacity, pushTimeoutMs);
    }

    private static EventLog openLog(Path root, ObserverHub hub, int capacity, long pushTimeoutMs) {
        return openLog(root, registry(root), hub, capacity, pushTimeoutMs);
    }

    private static List<Long> ids(Stream<Event> events) {
        try (events) {
            return events.map(Event::id).collect(Collectors.toList());
        }
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
