package io.steadyloop.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class SteadyLoopConfig {
    public static final String SETTINGS_FILE_NAME = "steadyloop-settings.json";

    public static final int DEFAULT_POOL_MIN_SIZE = 2;
    public static final int DEFAULT_POOL_MAX_SIZE = 10;
    public static final long DEFAULT_POOL_MAX_IDLE_MS = 300_000L;
    public static final long DEFAULT_POOL_MAINTENANCE_INTERVAL_MS = 60_000L;
    public static final long DEFAULT_POOL_ACQUIRE_TIMEOUT_MS = 5_000L;

    public static final int DEFAULT_CACHE_MAX_SIZE = 1_000;
    public static final long DEFAULT_CACHE_TTL_MS = 3_600_000L;

    public static final int DEFAULT_BREAKER_FAILURE_THRESHOLD = 5;
    public static final long DEFAULT_BREAKER_RECOVERY_TIMEOUT_MS = 60_000L;
    public static final int DEFAULT_BREAKER_HALF_OPEN_ATTEMPTS = 1;

    public static final int DEFAULT_BUDGET_PER_HOUR = 10;
    public static final double DEFAULT_BUDGET_WARNING_THRESHOLD = 0.8d;
    public static final double DEFAULT_BUDGET_CRITICAL_THRESHOLD = 1.5d;

    public static final int DEFAULT_MIN_WORKERS = 1;
    public static final int DEFAULT_MAX_WORKERS = 3;
    public static final int DEFAULT_SCALE_UP_QUEUE_DEPTH = 5;
    public static final long DEFAULT_SCALE_DOWN_IDLE_MS = 30_000L;
    public static final double DEFAULT_CPU_THRESHOLD_PERCENT = 80.0d;
    public static final long DEFAULT_MONITOR_INTERVAL_MS = 5_000L;
    public static final long DEFAULT_POLL_TIMEOUT_MS = 1_000L;
    public static final long DEFAULT_GRACEFUL_SHUTDOWN_MS = 30_000L;
    public static final long DEFAULT_WORKER_JOIN_TIMEOUT_MS = 5_000L;

    public static final long DEFAULT_FINISHED_RETENTION_MS = 24L * 60L * 60L * 1000L;
    public static final int DEFAULT_THRESHOLD_ADJUST_EVERY = 20;
    public static final long DEFAULT_SCRIPT_TIMEOUT_MS = 60_000L;

    private final Path rootDir;

    public SteadyLoopConfig(Path rootDir) {
        this.rootDir = rootDir;
    }

    public static SteadyLoopConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get("data")
                : Paths.get(root);
        return new SteadyLoopConfig(resolved.toAbsolutePath().normalize());
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path dbFile() {
        return rootDir.resolve("steadyloop.db");
    }

    public Path journalRoot() {
        return rootDir.resolve("journal");
    }

    public Path journalFile() {
        return journalRoot().resolve("events.log");
    }

    public Path settingsFile() {
        return rootDir.resolve(SETTINGS_FILE_NAME);
    }
}
