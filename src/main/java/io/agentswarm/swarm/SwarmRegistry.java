package io.agentswarm.swarm;

import io.agentswarm.model.AgentStatus;
import io.agentswarm.storage.Database;
import io.agentswarm.storage.StoreException;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public final class SwarmRegistry implements AutoCloseable {
    private static final List<Database.MigrationStep> MIGRATIONS = List.of(
            new Database.MigrationStep(
                    "20261019_001_agent_indexes",
                    "Index agents by status, file and parent",
                    conn -> {
                        try (Statement st = conn.createStatement()) {
                            st.execute("CREATE INDEX IF NOT EXISTS idx_agents_status ON agents(status)");
                            st.execute("CREATE INDEX IF NOT EXISTS idx_agents_file ON agents(file_path)");
                            st.execute("CREATE INDEX IF NOT EXISTS idx_agents_parent ON agents(parent_id)");
                        }
                    }
            )
    );
    private static final String COLUMNS =
            "agent_id,node_type,name,full_name,file_path,parent_id,start_line,end_line,status,created_at_ms,updated_at_ms";

    private final Database database;
    private final Clock clock;

    public SwarmRegistry(Database database) {
        this(database, Clock.systemUTC());
    }

    public SwarmRegistry(Database database, Clock clock) {
        this.database = database;
        this.clock = clock;
        database.init(SwarmRegistry::createSchema, MIGRATIONS);
    }

    private static void createSchema(Connection conn) throws SQLException {
        try (Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS agents (
                        agent_id TEXT PRIMARY KEY,
                        node_type TEXT NOT NULL,
                        name TEXT NOT NULL DEFAULT '',
                        full_name TEXT NOT NULL DEFAULT '',
                        file_path TEXT NOT NULL,
                        parent_id TEXT,
                        start_line INTEGER NOT NULL DEFAULT 0,
                        end_line INTEGER NOT NULL DEFAULT 0,
                        status TEXT NOT NULL DEFAULT 'ACTIVE',
                        created_at_ms INTEGER NOT NULL,
                        updated_at_ms INTEGER NOT NULL
                    )
                    """);
        }
    }

    public AgentMetadata upsert(AgentMetadata metadata) {
        long nowMs = clock.millis();
        String sql = """
                INSERT INTO agents(agent_id,node_type,name,full_name,file_path,parent_id,start_line,end_line,status,created_at_ms,updated_at_ms)
                VALUES(?,?,?,?,?,?,?,?,?,?,?)
                ON CONFLICT(agent_id) DO UPDATE SET
                    node_type=excluded.node_type,
                    name=excluded.name,
                    full_name=excluded.full_name,
                    file_path=excluded.file_path,
                    parent_id=excluded.parent_id,
                    start_line=excluded.start_line,
                    end_line=excluded.end_line,
                    status=excluded.status,
                    updated_at_ms=excluded.updated_at_ms
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, metadata.agentId());
            ps.setString(2, metadata.nodeType() == null ? "unknown" : metadata.nodeType());
            ps.setString(3, metadata.name() == null ? "" : metadata.name());
            ps.setString(4, metadata.fullName() == null ? "" : metadata.fullName());
            ps.setString(5, metadata.filePath() == null ? "" : metadata.filePath());
            ps.setString(6, metadata.parentId());
            ps.setInt(7, metadata.startLine());
            ps.setInt(8, metadata.endLine());
            ps.setString(9, AgentStatus.ACTIVE.name());
            ps.setLong(10, nowMs);
            ps.setLong(11, nowMs);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new StoreException("Failed to upsert agent " + metadata.agentId(), e);
        }
        return getAgent(metadata.agentId())
                .orElseThrow(() -> new StoreException("Agent vanished after upsert: " + metadata.agentId()));
    }

    public boolean markOrphaned(String agentId) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "UPDATE agents SET status=?, updated_at_ms=? WHERE agent_id=? AND status<>?")) {
            ps.setString(1, AgentStatus.ORPHANED.name());
            ps.setLong(2, clock.millis());
            ps.setString(3, agentId);
            ps.setString(4, AgentStatus.ORPHANED.name());
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new StoreException("Failed to mark agent orphaned: " + agentId, e);
        }
    }

    public Optional<AgentMetadata> getAgent(String agentId) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("SELECT " + COLUMNS + " FROM agents WHERE agent_id=?")) {
            ps.setString(1, agentId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(read(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to read agent " + agentId, e);
        }
    }

    public List<AgentMetadata> listAgents(Optional<AgentStatus> status) {
        String sql = status.isPresent()
                ? "SELECT " + COLUMNS + " FROM agents WHERE status=? ORDER BY agent_id"
                : "SELECT " + COLUMNS + " FROM agents ORDER BY agent_id";
        List<AgentMetadata> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            if (status.isPresent()) {
                ps.setString(1, status.get().name());
            }
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(read(rs));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new StoreException("Failed to list agents", e);
        }
    }

    public List<AgentMetadata> listActive() {
        return listAgents(Optional.of(AgentStatus.ACTIVE));
    }

    @Override
    public void close() {
        database.close();
    }

    private AgentMetadata read(ResultSet rs) throws SQLException {
        return new AgentMetadata(
                rs.getString("agent_id"),
                rs.getString("node_type"),
                rs.getString("name"),
                rs.getString("full_name"),
                rs.getString("file_path"),
                rs.getString("parent_id"),
                rs.getInt("start_line"),
                rs.getInt("end_line"),
                AgentStatus.fromString(rs.getString("status")),
                rs.getLong("created_at_ms"),
                rs.getLong("updated_at_ms")
        );
    }
}
