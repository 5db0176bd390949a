package io.conductor.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class ConductorConfig {
    public static final String DEFAULT_ROOT_DIR = ".conductor";
    public static final long DEFAULT_STALE_AFTER_MS = 10L * 60L * 1000L;
    public static final long DEFAULT_DEDUP_WINDOW_MS = 5L * 60L * 1000L;
    public static final int DEFAULT_CLI_OUTPUT_MAX_CHARS = 4_000;
    public static final int DEFAULT_SUMMARY_MAX_CHARS = 500;
    public static final int DEFAULT_REPORT_RETRY_ATTEMPTS = 5;
    public static final long DEFAULT_REPORT_RETRY_BACKOFF_MS = 200L;
    public static final int DEFAULT_BUSY_TIMEOUT_MS = 5_000;

    private final Path rootDir;

    public ConductorConfig(Path rootDir) {
        this.rootDir = rootDir;
    }

    public static ConductorConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(System.getProperty("user.home"), DEFAULT_ROOT_DIR)
                : Paths.get(root);
        return new ConductorConfig(resolved.toAbsolutePath().normalize());
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path dbFile() {
        return rootDir.resolve("conductor.db");
    }

    public Path settingsFile() {
        return rootDir.resolve("conductor-settings.json");
    }

    public Path agentsFile() {
        return rootDir.resolve("agents.json");
    }

    public Path promptsRoot() {
        return rootDir.resolve("prompts");
    }

    public Path logsRoot() {
        return rootDir.resolve("logs");
    }

    public Path auditRoot() {
        return rootDir.resolve("audit");
    }

    public Path auditFile() {
        return auditRoot().resolve("audit.log");
    }

    public Path reportsRoot() {
        return rootDir.resolve("reports");
    }

    public Path pendingReportsDir() {
        return reportsRoot().resolve("pending");
    }

    public Path exportsRoot() {
        return rootDir.resolve("exports");
    }
}
