package io.resolvemesh.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class ResolveMeshConfig {
    public static final String DEFAULT_ROOT = "data";
    public static final String SETTINGS_FILE_NAME = "resolvemesh-settings.json";
    public static final String DEFAULT_SIGNER = "resolver";

    public static final long DEFAULT_CLOCK_SYNC_INTERVAL_MS = 60_000L;
    public static final long DEFAULT_CLOCK_STALE_AFTER_MS = 300_000L;
    public static final int DEFAULT_MAX_ATTEMPTS = 5;
    public static final long DEFAULT_BASE_BACKOFF_MS = 5_000L;
    public static final long DEFAULT_MAX_BACKOFF_MS = 300_000L;
    public static final long DEFAULT_EXECUTOR_TIMEOUT_MS = 120_000L;
    public static final int DEFAULT_WORKER_POOL_SIZE = 4;
    public static final long DEFAULT_WATCHER_POLL_INTERVAL_MS = 15_000L;
    public static final long DEFAULT_TICK_INTERVAL_MS = 250L;
    public static final long DEFAULT_GRACE_SECONDS = 0L;
    public static final long DEFAULT_RESOLUTION_WINDOW_SECONDS = 3_600L;
    public static final int DEFAULT_SETTLEMENT_TX_RETRIES = 3;
    public static final long DEFAULT_SETTLEMENT_TX_RETRY_BACKOFF_MS = 2_000L;
    public static final long DEFAULT_SETTLEMENT_CONFIRM_TIMEOUT_MS = 120_000L;
    public static final long DEFAULT_SETTLEMENT_POLL_INTERVAL_MS = 2_000L;
    public static final int DEFAULT_SETTLEMENT_MAX_CONFIRM_WAITS = 5;
    public static final long DEFAULT_STORE_RESYNC_INTERVAL_MS = 30_000L;
    public static final String DEFAULT_OUTCOME = "invalid";

    private final Path rootDir;

    public ResolveMeshConfig(Path rootDir) {
        this.rootDir = rootDir;
    }

    public static ResolveMeshConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(DEFAULT_ROOT)
                : Paths.get(root);
        return new ResolveMeshConfig(resolved.toAbsolutePath().normalize());
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path dbFile() {
        return rootDir.resolve("resolvemesh.db");
    }

    public Path settingsFile() {
        return rootDir.resolve(SETTINGS_FILE_NAME);
    }

    public Path evidenceRoot() {
        return rootDir.resolve("evidence");
    }

    public Path transcriptRoot() {
        return rootDir.resolve("transcripts");
    }

    public Path templatesRoot() {
        return rootDir.resolve("templates");
    }

    public Path auditRoot() {
        return rootDir.resolve("audit");
    }

    public Path auditFile() {
        return auditRoot().resolve("audit.log");
    }

    public Path securityRoot() {
        return rootDir.resolve("security");
    }
}
