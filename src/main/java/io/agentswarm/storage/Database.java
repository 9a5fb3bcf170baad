package io.agentswarm.storage;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

public final class Database {
    private static final String MIGRATION_SCHEMA_VERSION = "agentswarm.schema.migration.v1";

    private final Path dbFile;
    private final String jdbcUrl;
    private volatile boolean closed;

    public Database(Path dbFile) {
        if (dbFile == null) {
            throw new IllegalArgumentException("dbFile must not be null");
        }
        this.dbFile = dbFile.toAbsolutePath().normalize();
        this.jdbcUrl = "jdbc:sqlite:" + this.dbFile;
    }

    public void init(SchemaInitializer schema, List<MigrationStep> migrations) {
        initDirectories();
        applyAndValidatePragmas();
        try (Connection conn = openConnection()) {
            schema.apply(conn);
            ensureSchemaMigrationsTable(conn);
            for (MigrationStep step : migrations == null ? List.<MigrationStep>of() : migrations) {
                if (isMigrationApplied(conn, step.version())) {
                    continue;
                }
                applyMigration(conn, step);
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to initialize SQLite schema: " + dbFile, e);
        }
    }

    public Connection openConnection() throws SQLException {
        if (closed) {
            throw new SQLException("Database is closed: " + dbFile);
        }
        Connection conn = DriverManager.getConnection(jdbcUrl);
        try (Statement st = conn.createStatement()) {
            st.execute("PRAGMA busy_timeout=5000");
        } catch (SQLException e) {
            conn.close();
            throw e;
        }
        return conn;
    }

    public void close() {
        closed = true;
    }

    public static Set<String> columns(Connection conn, String table) throws SQLException {
        Set<String> columns = new HashSet<>();
        try (Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery("PRAGMA table_info(" + table + ")")) {
            while (rs.next()) {
                columns.add(rs.getString("name").toLowerCase(Locale.ROOT));
            }
        }
        return columns;
    }

    public static boolean ensureColumn(Connection conn, String table, String column, String definition)
            throws SQLException {
        Set<String> existing = columns(conn, table);
        if (existing.contains(column.toLowerCase(Locale.ROOT))) {
            return false;
        }
        try (Statement st = conn.createStatement()) {
            st.execute("ALTER TABLE " + table + " ADD COLUMN " + column + " " + definition);
        }
        return true;
    }

    private void initDirectories() {
        Path parent = dbFile.getParent();
        if (parent == null) {
            return;
        }
        try {
            Files.createDirectories(parent);
        } catch (IOException e) {
            throw new StoreException("Failed to initialize directories for " + dbFile, e);
        }
    }

    private void ensureSchemaMigrationsTable(Connection conn) throws SQLException {
        try (Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS schema_migrations (
                        version TEXT PRIMARY KEY,
                        description TEXT NOT NULL,
                        checksum TEXT NOT NULL,
                        applied_at_ms INTEGER NOT NULL,
                        success INTEGER NOT NULL
                    )
                    """);
        }
    }

    private boolean isMigrationApplied(Connection conn, String version) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT 1 FROM schema_migrations WHERE version=? AND success=1 LIMIT 1")) {
            ps.setString(1, version);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    private void applyMigration(Connection conn, MigrationStep step) throws SQLException {
        conn.setAutoCommit(false);
        try {
            step.body().apply(conn);
            try (PreparedStatement ps = conn.prepareStatement(
                    "INSERT OR REPLACE INTO schema_migrations(version,description,checksum,applied_at_ms,success) VALUES(?,?,?,?,1)")) {
                ps.setString(1, step.version());
                ps.setString(2, step.description());
                ps.setString(3, checksum(step));
                ps.setLong(4, Instant.now().toEpochMilli());
                ps.executeUpdate();
            }
            conn.commit();
        } catch (SQLException e) {
            conn.rollback();
            throw e;
        } finally {
            conn.setAutoCommit(true);
        }
    }

    private String checksum(MigrationStep step) {
        String material = MIGRATION_SCHEMA_VERSION + '|' + step.version() + '|' + step.description();
        return Integer.toHexString(material.hashCode());
    }

    private void applyAndValidatePragmas() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("PRAGMA journal_mode=WAL");
            st.execute("PRAGMA synchronous=NORMAL");
            validatePragma(st, "journal_mode", "wal");
        } catch (SQLException e) {
            throw new StoreException("Failed to apply SQLite pragmas: " + dbFile, e);
        }
    }

    private void validatePragma(Statement st, String pragma, String expected) throws SQLException {
        try (ResultSet rs = st.executeQuery("PRAGMA " + pragma)) {
            if (!rs.next()) {
                throw new IllegalStateException("PRAGMA " + pragma + " did not return a value");
            }
            String actual = rs.getString(1);
            if (actual == null || !actual.equalsIgnoreCase(expected)) {
                throw new IllegalStateException(
                        "PRAGMA " + pragma + " mismatch, expected=" + expected + ", actual=" + actual
                );
            }
        }
    }

    public List<SchemaMigrationRow> listSchemaMigrations(int limit) {
        String sql = """
                SELECT version,description,checksum,applied_at_ms,success
                FROM schema_migrations
                ORDER BY applied_at_ms DESC, version DESC
                LIMIT ?
                """;
        List<SchemaMigrationRow> out = new ArrayList<>();
        try (Connection c = openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setInt(1, Math.max(1, limit));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new SchemaMigrationRow(
                            rs.getString("version"),
                            rs.getString("description"),
                            rs.getString("checksum"),
                            rs.getLong("applied_at_ms"),
                            rs.getInt("success") == 1
                    ));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new StoreException("Failed to list schema migrations", e);
        }
    }

    @FunctionalInterface
    public interface SchemaInitializer {
        void apply(Connection conn) throws SQLException;
    }

    public record MigrationStep(String version, String description, SchemaInitializer body) {
    }

    public record SchemaMigrationRow(
            String version,
            String description,
            String checksum,
            long appliedAtMs,
            boolean success
    ) {
    }
}
