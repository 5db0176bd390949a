package io.conductor.storage;

import io.conductor.config.ConductorConfig;
import org.sqlite.SQLiteConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Properties;

public final class Database {
    private final ConductorConfig config;
    private final String jdbcUrl;
    private final Properties connectionProperties;

    public Database(ConductorConfig config) {
        this(config, ConductorConfig.DEFAULT_BUSY_TIMEOUT_MS);
    }

    public Database(ConductorConfig config, int busyTimeoutMs) {
        this.config = config;
        this.jdbcUrl = "jdbc:sqlite:" + config.dbFile().toString();
        SQLiteConfig sqlite = new SQLiteConfig();
        sqlite.setJournalMode(SQLiteConfig.JournalMode.WAL);
        sqlite.setSynchronous(SQLiteConfig.SynchronousMode.NORMAL);
        sqlite.setBusyTimeout(Math.max(0, busyTimeoutMs));
        // setAutoCommit(false) issues BEGIN IMMEDIATE: the write lock is held before the first read.
        sqlite.setTransactionMode(SQLiteConfig.TransactionMode.IMMEDIATE);
        this.connectionProperties = sqlite.toProperties();
    }

    public ConductorConfig config() {
        return config;
    }

    public void init() {
        initDirectories();
        initSchema();
        validatePragmas();
    }

    public Connection openConnection() throws SQLException {
        return DriverManager.getConnection(jdbcUrl, connectionProperties);
    }

    private void initDirectories() {
        try {
            Files.createDirectories(config.rootDir());
            Files.createDirectories(config.promptsRoot());
            Files.createDirectories(config.logsRoot());
            Files.createDirectories(config.auditRoot());
            Files.createDirectories(config.pendingReportsDir());
            Files.createDirectories(config.exportsRoot());
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize directories", e);
        }
    }

    private void initSchema() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS tasks (
                        task_id TEXT PRIMARY KEY,
                        project_path TEXT NOT NULL,
                        agent_kind TEXT NOT NULL,
                        model TEXT,
                        status TEXT NOT NULL,
                        content_fingerprint TEXT NOT NULL,
                        created_at_ms INTEGER NOT NULL,
                        finished_at_ms INTEGER,
                        files_modified TEXT NOT NULL DEFAULT '[]',
                        summary TEXT,
                        error TEXT,
                        cli_output TEXT,
                        execution_pid INTEGER
                    )
                    """);
            st.execute("CREATE INDEX IF NOT EXISTS idx_tasks_project_status ON tasks(project_path, status)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_tasks_fingerprint_created ON tasks(content_fingerprint, created_at_ms)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_tasks_created ON tasks(created_at_ms)");
        } catch (SQLException e) {
            throw new LedgerUnavailableException("Failed to initialize SQLite schema", e);
        }
    }

    private void validatePragmas() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            validatePragma(st, "journal_mode", "wal");
        } catch (SQLException e) {
            throw new LedgerUnavailableException("Failed to apply SQLite pragmas", e);
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
}
