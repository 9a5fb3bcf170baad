package io.agentswarm.subscription;

import io.agentswarm.model.Event;
import io.agentswarm.storage.Database;
import io.agentswarm.storage.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public final class SubscriptionRegistry implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(SubscriptionRegistry.class);

    private static final List<Database.MigrationStep> MIGRATIONS = List.of(
            new Database.MigrationStep(
                    "20261019_001_subscription_indexes",
                    "Index subscriptions by agent and default flag",
                    conn -> {
                        try (Statement st = conn.createStatement()) {
                            st.execute("CREATE INDEX IF NOT EXISTS idx_subscriptions_agent ON subscriptions(agent_id, is_default)");
                        }
                    }
            )
    );

    private final Database database;
    private final Object writeLock = new Object();
    private volatile List<Subscription> snapshot;

    public SubscriptionRegistry(Database database) {
        this.database = database;
        database.init(SubscriptionRegistry::createSchema, MIGRATIONS);
    }

    private static void createSchema(Connection conn) throws SQLException {
        try (Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS subscriptions (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        agent_id TEXT NOT NULL,
                        pattern_json TEXT NOT NULL,
                        is_default INTEGER NOT NULL DEFAULT 0,
                        created_at_ms INTEGER NOT NULL,
                        updated_at_ms INTEGER NOT NULL
                    )
                    """);
        }
        Database.ensureColumn(conn, "subscriptions", "is_default", "INTEGER NOT NULL DEFAULT 0");
        Database.ensureColumn(conn, "subscriptions", "updated_at_ms", "INTEGER NOT NULL DEFAULT 0");
    }

    public Subscription register(String agentId, SubscriptionPattern pattern) {
        return register(agentId, pattern, false);
    }

    public Subscription register(String agentId, SubscriptionPattern pattern, boolean isDefault) {
        requireAgent(agentId);
        if (pattern == null) {
            throw new IllegalArgumentException("pattern must not be null");
        }
        synchronized (writeLock) {
            long nowMs = System.currentTimeMillis();
            try (Connection c = database.openConnection()) {
                long id = insert(c, agentId, pattern, isDefault, nowMs);
                return new Subscription(id, agentId, pattern, isDefault, nowMs, nowMs);
            } catch (SQLException e) {
                throw new StoreException("Failed to register subscription for " + agentId, e);
            } finally {
                snapshot = null;
            }
        }
    }

    public List<Subscription> registerDefaults(String agentId, String filePath) {
        requireAgent(agentId);
        if (filePath == null || filePath.isBlank()) {
            throw new IllegalArgumentException("filePath must not be blank");
        }
        List<SubscriptionPattern> desired = List.of(
                SubscriptionPattern.directTo(agentId),
                SubscriptionPattern.contentChangedAt(filePath)
        );
        synchronized (writeLock) {
            long nowMs = System.currentTimeMillis();
            try (Connection c = database.openConnection()) {
                c.setAutoCommit(false);
                try {
                    List<Subscription> existing = query(c,
                            "SELECT id,agent_id,pattern_json,is_default,created_at_ms,updated_at_ms FROM subscriptions WHERE agent_id=? AND is_default=1 ORDER BY id",
                            agentId);
                    List<Subscription> result = new ArrayList<>();
                    Set<Long> kept = new HashSet<>();
                    for (SubscriptionPattern want : desired) {
                        String wantJson = want.toJson();
                        Subscription found = null;
                        for (Subscription sub : existing) {
                            if (!kept.contains(sub.id()) && sub.pattern().toJson().equals(wantJson)) {
                                found = sub;
                                break;
                            }
                        }
                        if (found == null) {
                            long id = insert(c, agentId, want, true, nowMs);
                            found = new Subscription(id, agentId, want, true, nowMs, nowMs);
                        }
                        kept.add(found.id());
                        result.add(found);
                    }
                    try (PreparedStatement del = c.prepareStatement("DELETE FROM subscriptions WHERE id=?")) {
                        for (Subscription sub : existing) {
                            if (!kept.contains(sub.id())) {
                                del.setLong(1, sub.id());
                                del.executeUpdate();
                                log.debug("Replaced stale default subscription {} for {}", sub.id(), agentId);
                            }
                        }
                    }
                    c.commit();
                    return List.copyOf(result);
                } catch (SQLException e) {
                    c.rollback();
                    throw e;
                } finally {
                    c.setAutoCommit(true);
                }
            } catch (SQLException e) {
                throw new StoreException("Failed to register default subscriptions for " + agentId, e);
            } finally {
                snapshot = null;
            }
        }
    }

    public int unregisterAll(String agentId) {
        requireAgent(agentId);
        synchronized (writeLock) {
            try (Connection c = database.openConnection();
                 PreparedStatement ps = c.prepareStatement("DELETE FROM subscriptions WHERE agent_id=?")) {
                ps.setString(1, agentId);
                return ps.executeUpdate();
            } catch (SQLException e) {
                throw new StoreException("Failed to unregister subscriptions for " + agentId, e);
            } finally {
                snapshot = null;
            }
        }
    }

    public boolean unregister(long subscriptionId) {
        synchronized (writeLock) {
            try (Connection c = database.openConnection();
                 PreparedStatement ps = c.prepareStatement("DELETE FROM subscriptions WHERE id=?")) {
                ps.setLong(1, subscriptionId);
                return ps.executeUpdate() > 0;
            } catch (SQLException e) {
                throw new StoreException("Failed to unregister subscription " + subscriptionId, e);
            } finally {
                snapshot = null;
            }
        }
    }

    public List<String> getMatchingAgents(Event event) {
        Set<String> agents = new LinkedHashSet<>();
        for (Subscription sub : listAll()) {
            if (!agents.contains(sub.agentId()) && PatternMatcher.matches(sub.pattern(), event)) {
                agents.add(sub.agentId());
            }
        }
        return List.copyOf(agents);
    }

    public List<Subscription> getSubscriptions(String agentId) {
        List<Subscription> out = new ArrayList<>();
        for (Subscription sub : listAll()) {
            if (sub.agentId().equals(agentId)) {
                out.add(sub);
            }
        }
        return out;
    }

    public List<Subscription> listAll() {
        List<Subscription> current = snapshot;
        if (current != null) {
            return current;
        }
        synchronized (writeLock) {
            if (snapshot == null) {
                try (Connection c = database.openConnection()) {
                    snapshot = List.copyOf(query(c,
                            "SELECT id,agent_id,pattern_json,is_default,created_at_ms,updated_at_ms FROM subscriptions ORDER BY id",
                            null));
                } catch (SQLException e) {
                    throw new StoreException("Failed to load subscriptions", e);
                }
            }
            return snapshot;
        }
    }

    @Override
    public void close() {
        synchronized (writeLock) {
            snapshot = null;
            database.close();
        }
    }

    private long insert(Connection c, String agentId, SubscriptionPattern pattern, boolean isDefault, long nowMs)
            throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "INSERT INTO subscriptions(agent_id,pattern_json,is_default,created_at_ms,updated_at_ms) VALUES(?,?,?,?,?)")) {
            ps.setString(1, agentId);
            ps.setString(2, pattern.toJson());
            ps.setInt(3, isDefault ? 1 : 0);
            ps.setLong(4, nowMs);
            ps.setLong(5, nowMs);
            ps.executeUpdate();
        }
        try (Statement st = c.createStatement(); ResultSet rs = st.executeQuery("SELECT last_insert_rowid()")) {
            rs.next();
            return rs.getLong(1);
        }
    }

    private List<Subscription> query(Connection c, String sql, String agentId) throws SQLException {
        List<Subscription> out = new ArrayList<>();
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            if (agentId != null) {
                ps.setString(1, agentId);
            }
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new Subscription(
                            rs.getLong("id"),
                            rs.getString("agent_id"),
                            SubscriptionPattern.fromJson(rs.getString("pattern_json")),
                            rs.getInt("is_default") == 1,
                            rs.getLong("created_at_ms"),
                            rs.getLong("updated_at_ms")
                    ));
                }
            }
        }
        return out;
    }

    private static void requireAgent(String agentId) {
        if (agentId == null || agentId.isBlank()) {
            throw new IllegalArgumentException("agentId must not be blank");
        }
    }
}
