package io.agentswarm.subscription;

import io.agentswarm.model.Event;
import io.agentswarm.model.EventPayload;
import io.agentswarm.model.EventType;
import io.agentswarm.storage.Database;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

final class SubscriptionRegistryTest {

    @Test
    void defaultsAreIdempotentAndFollowAMovedFile() throws Exception {
        Path root = Files.createTempDirectory("agentswarm-test-subs-defaults-");
        try {
            SubscriptionRegistry subs = new SubscriptionRegistry(new Database(root.resolve("subscriptions.db")));
            List<Subscription> first = subs.registerDefaults("a1", "src/old.py");
            List<Subscription> again = subs.registerDefaults("a1", "src/old.py");
            assertEquals(2, first.size());
            assertEquals(ids(first), ids(again));
            assertEquals(2, subs.getSubscriptions("a1").size());

            List<Subscription> moved = subs.registerDefaults("a1", "src/new.py");
            assertEquals(first.get(0).id(), moved.get(0).id());
            assertNotEquals(first.get(1).id(), moved.get(1).id());
            assertEquals(2, subs.getSubscriptions("a1").size());

            Event oldPath = Event.of(EventPayload.ContentChanged.of("src/old.py"));
            Event newPath = Event.of(EventPayload.ContentChanged.of("/repo/src/new.py"));
            assertEquals(List.of(), subs.getMatchingAgents(oldPath));
            assertEquals(List.of("a1"), subs.getMatchingAgents(newPath));

            assertThrows(IllegalArgumentException.class, () -> subs.registerDefaults("a1", " "));
            subs.close();
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void matchingAgentsAreUniqueAndOrderedBySubscriptionId() throws Exception {
        Path root = Files.createTempDirectory("agentswarm-test-subs-order-");
        try {
            SubscriptionRegistry subs = new SubscriptionRegistry(new Database(root.resolve("subscriptions.db")));
            subs.register("zeta", SubscriptionPattern.builder().eventType(EventType.FILE_SAVED).build());
            subs.register("alpha", SubscriptionPattern.builder().pathGlob("*.py").build());
            subs.register("zeta", SubscriptionPattern.builder().pathGlob("src/*.py").build());
            subs.register("beta", SubscriptionPattern.builder().pathGlob("*.md").build());

            Event saved = Event.of(new EventPayload.FileSaved("src/main.py"));
            assertEquals(List.of("zeta", "alpha"), subs.getMatchingAgents(saved));

            assertEquals(2, subs.unregisterAll("zeta"));
            assertEquals(List.of("alpha"), subs.getMatchingAgents(saved));
            subs.close();
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void subscriptionsSurviveReopen() throws Exception {
        Path root = Files.createTempDirectory("agentswarm-test-subs-reopen-");
        try {
            SubscriptionRegistry subs = new SubscriptionRegistry(new Database(root.resolve("subscriptions.db")));
            Subscription custom = subs.register("a1", SubscriptionPattern.builder().tag("review").build());
            subs.registerDefaults("a1", "src/a.py");
            subs.close();

            SubscriptionRegistry reopened = new SubscriptionRegistry(new Database(root.resolve("subscriptions.db")));
            List<Subscription> all = reopened.listAll();
            assertEquals(3, all.size());
            assertEquals(custom.id(), all.get(0).id());
            assertFalse(all.get(0).isDefault());
            assertTrue(all.get(1).isDefault());
            assertEquals(custom.pattern(), all.get(0).pattern());

            assertTrue(reopened.unregister(custom.id()));
            assertFalse(reopened.unregister(custom.id()));
            assertEquals(2, reopened.listAll().size());
            reopened.close();
        } finally {
            deleteRecursively(root);
        }
    }

    private static List<Long> ids(List<Subscription> subs) {
        return subs.stream().map(Subscription::id).collect(Collectors.toList());
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
