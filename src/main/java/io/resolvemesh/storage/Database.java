package io.resolvemesh.storage;

import io.resolvemesh.config.ResolveMeshConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.HashSet;
import java.util.Set;

public final class Database {
    private static final int BUSY_TIMEOUT_MS = 5_000;
    private final ResolveMeshConfig config;
    private final String jdbcUrl;

    public Database(ResolveMeshConfig config) {
        this.config = config;
        this.jdbcUrl = "jdbc:sqlite:" + config.dbFile().toString();
    }

    public ResolveMeshConfig config() {
        return config;
    }

    public void init() {
        initDirectories();
        initSchema();
        applyAndValidatePragmas();
    }

    public Connection openConnection() throws SQLException {
        Connection conn = DriverManager.getConnection(jdbcUrl);
        try (Statement st = conn.createStatement()) {
            // Per-connection: the coordinator, settlement workers and CLI share one file.
            st.execute("PRAGMA busy_timeout=" + BUSY_TIMEOUT_MS);
            st.execute("PRAGMA foreign_keys=ON");
        } catch (SQLException e) {
            conn.close();
            throw e;
        }
        return conn;
    }

    private void initDirectories() {
        try {
            Files.createDirectories(config.rootDir());
            Files.createDirectories(config.evidenceRoot());
            Files.createDirectories(config.transcriptRoot());
            Files.createDirectories(config.templatesRoot());
            Files.createDirectories(config.auditRoot());
            Files.createDirectories(config.securityRoot());
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize directories", e);
        }
    }

    private void initSchema() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS requests (
                        request_id TEXT PRIMARY KEY,
                        identifier TEXT NOT NULL,
                        request_timestamp INTEGER NOT NULL,
                        ancillary_data TEXT NOT NULL,
                        requester TEXT,
                        earliest_resolve_at_ms INTEGER NOT NULL,
                        deadline_at_ms INTEGER NOT NULL,
                        state TEXT NOT NULL,
                        finalization TEXT,
                        attempt_count INTEGER NOT NULL DEFAULT 0,
                        attempt_epoch INTEGER NOT NULL DEFAULT 0,
                        last_error TEXT,
                        last_error_class TEXT,
                        last_attempt_at_ms INTEGER,
                        next_eligible_at_ms INTEGER,
                        needs_operator INTEGER NOT NULL DEFAULT 0,
                        accepted_revision INTEGER,
                        override_decision TEXT,
                        override_value TEXT,
                        override_reason TEXT,
                        created_at_ms INTEGER NOT NULL,
                        updated_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("CREATE INDEX IF NOT EXISTS idx_requests_state ON requests(state, updated_at_ms)");

            st.execute("""
                    CREATE TABLE IF NOT EXISTS state_transitions (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        request_id TEXT NOT NULL,
                        from_state TEXT,
                        to_state TEXT NOT NULL,
                        finalization TEXT,
                        attempt_epoch INTEGER NOT NULL,
                        reason TEXT,
                        occurred_at_ms INTEGER NOT NULL,
                        FOREIGN KEY(request_id) REFERENCES requests(request_id)
                    )
                    """);
            st.execute("CREATE INDEX IF NOT EXISTS idx_transitions_request ON state_transitions(request_id, id)");

            st.execute("""
                    CREATE TABLE IF NOT EXISTS settlements (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        request_id TEXT NOT NULL,
                        tx_hash TEXT NOT NULL UNIQUE,
                        submitted_price TEXT NOT NULL,
                        nonce INTEGER NOT NULL,
                        evidence_hash TEXT NOT NULL,
                        evidence_revision INTEGER NOT NULL,
                        confirmation_state TEXT NOT NULL,
                        error TEXT,
                        confirmation_waits INTEGER NOT NULL DEFAULT 0,
                        submitted_at_ms INTEGER NOT NULL,
                        updated_at_ms INTEGER NOT NULL,
                        FOREIGN KEY(request_id) REFERENCES requests(request_id)
                    )
                    """);
            // At most one live settlement per request; FAILED rows are kept for audit.
            st.execute("""
                    CREATE UNIQUE INDEX IF NOT EXISTS ux_settlements_live
                    ON settlements(request_id)
                    WHERE confirmation_state IN ('PENDING', 'CONFIRMED')
                    """);

            st.execute("""
                    CREATE TABLE IF NOT EXISTS clock_anchor (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        offset_ms INTEGER NOT NULL,
                        synced_at_ms INTEGER NOT NULL,
                        authoritative_ms INTEGER NOT NULL,
                        proof TEXT,
                        recorded_at_ms INTEGER NOT NULL
                    )
                    """);
            ensureRequestColumns(conn);
            ensureSettlementColumns(conn);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to initialize schema", e);
        }
    }

    private void ensureRequestColumns(Connection conn) throws SQLException {
        Set<String> columns = columnsOf(conn, "requests");
        try (Statement st = conn.createStatement()) {
            if (!columns.contains("override_reason")) {
                st.execute("ALTER TABLE requests ADD COLUMN override_reason TEXT");
            }
            if (!columns.contains("needs_operator")) {
                st.execute("ALTER TABLE requests ADD COLUMN needs_operator INTEGER NOT NULL DEFAULT 0");
            }
        }
    }

    private void ensureSettlementColumns(Connection conn) throws SQLException {
        if (!columnsOf(conn, "settlements").contains("confirmation_waits")) {
            try (Statement st = conn.createStatement()) {
                st.execute("ALTER TABLE settlements ADD COLUMN confirmation_waits INTEGER NOT NULL DEFAULT 0");
            }
        }
    }

    private static Set<String> columnsOf(Connection conn, String table) throws SQLException {
        Set<String> columns = new HashSet<>();
        try (Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery("PRAGMA table_info(" + table + ")")) {
            while (rs.next()) {
                columns.add(rs.getString("name"));
            }
        }
        return columns;
    }

    private void applyAndValidatePragmas() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("PRAGMA journal_mode=WAL");
            st.execute("PRAGMA synchronous=NORMAL");
            validatePragma(st, "journal_mode", "wal");
            validatePragma(st, "foreign_keys", "1");
            validatePragma(st, "busy_timeout", String.valueOf(BUSY_TIMEOUT_MS));
        } catch (SQLException e) {
            throw new RuntimeException("Failed to apply SQLite pragmas", e);
        }
    }

    private void validatePragma(Statement st, String pragma, String expected) throws SQLException {
        try (ResultSet rs = st.executeQuery("PRAGMA " + pragma)) {
            if (!rs.next()) {
                throw new IllegalStateException("PRAGMA " + pragma + " did not return a value");
            }
            String actual = rs.getString(1);
            if (actual == null || !expected.equalsIgnoreCase(actual.trim())) {
                throw new IllegalStateException(
                        "PRAGMA " + pragma + " mismatch, expected=" + expected + ", actual=" + actual
                );
            }
        }
    }
}
