package io.steadyloop.config;

import io.steadyloop.model.TaskCategory;
import io.steadyloop.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Effective engine tuning. Loaded from {@code steadyloop-settings.json} under the root directory;
 * every field in the file is optional and falls back to the {@link SteadyLoopConfig} default.
 */
public record EngineSettings(
        int poolMinSize,
        int poolMaxSize,
        long poolMaxIdleMs,
        long poolMaintenanceIntervalMs,
        long poolAcquireTimeoutMs,
        int cacheMaxSize,
        long cacheDefaultTtlMs,
        boolean cachePersistent,
        int breakerFailureThreshold,
        long breakerRecoveryTimeoutMs,
        int breakerHalfOpenAttempts,
        int budgetPerHour,
        double budgetWarningThreshold,
        double budgetCriticalThreshold,
        int minWorkers,
        int maxWorkers,
        boolean autoscaling,
        int scaleUpQueueDepth,
        long scaleDownIdleMs,
        double cpuThresholdPercent,
        long monitorIntervalMs,
        long pollTimeoutMs,
        long gracefulShutdownMs,
        long finishedRetentionMs,
        boolean installBuiltinWorkarounds,
        int thresholdAdjustEvery,
        long scriptTimeoutMs,
        Map<TaskCategory, RetryPolicySpec> retryPolicies,
        Map<TaskCategory, List<String>> scriptHandlers
) {
    public EngineSettings {
        retryPolicies = retryPolicies == null ? Map.of() : Map.copyOf(retryPolicies);
        scriptHandlers = scriptHandlers == null ? Map.of() : Map.copyOf(scriptHandlers);
    }

    public static EngineSettings defaults() {
        return new EngineSettings(
                SteadyLoopConfig.DEFAULT_POOL_MIN_SIZE,
                SteadyLoopConfig.DEFAULT_POOL_MAX_SIZE,
                SteadyLoopConfig.DEFAULT_POOL_MAX_IDLE_MS,
                SteadyLoopConfig.DEFAULT_POOL_MAINTENANCE_INTERVAL_MS,
                SteadyLoopConfig.DEFAULT_POOL_ACQUIRE_TIMEOUT_MS,
                SteadyLoopConfig.DEFAULT_CACHE_MAX_SIZE,
                SteadyLoopConfig.DEFAULT_CACHE_TTL_MS,
                false,
                SteadyLoopConfig.DEFAULT_BREAKER_FAILURE_THRESHOLD,
                SteadyLoopConfig.DEFAULT_BREAKER_RECOVERY_TIMEOUT_MS,
                SteadyLoopConfig.DEFAULT_BREAKER_HALF_OPEN_ATTEMPTS,
                SteadyLoopConfig.DEFAULT_BUDGET_PER_HOUR,
                SteadyLoopConfig.DEFAULT_BUDGET_WARNING_THRESHOLD,
                SteadyLoopConfig.DEFAULT_BUDGET_CRITICAL_THRESHOLD,
                SteadyLoopConfig.DEFAULT_MIN_WORKERS,
                SteadyLoopConfig.DEFAULT_MAX_WORKERS,
                true,
                SteadyLoopConfig.DEFAULT_SCALE_UP_QUEUE_DEPTH,
                SteadyLoopConfig.DEFAULT_SCALE_DOWN_IDLE_MS,
                SteadyLoopConfig.DEFAULT_CPU_THRESHOLD_PERCENT,
                SteadyLoopConfig.DEFAULT_MONITOR_INTERVAL_MS,
                SteadyLoopConfig.DEFAULT_POLL_TIMEOUT_MS,
                SteadyLoopConfig.DEFAULT_GRACEFUL_SHUTDOWN_MS,
                SteadyLoopConfig.DEFAULT_FINISHED_RETENTION_MS,
                false,
                SteadyLoopConfig.DEFAULT_THRESHOLD_ADJUST_EVERY,
                SteadyLoopConfig.DEFAULT_SCRIPT_TIMEOUT_MS,
                Map.of(),
                Map.of()
        );
    }

    public static EngineSettings load(Path settingsFile) {
        EngineSettings defaults = defaults();
        if (settingsFile == null || !Files.exists(settingsFile)) {
            return defaults;
        }
        try {
            SettingsFile file = Jsons.mapper().readValue(settingsFile.toFile(), SettingsFile.class);
            return fromFile(file, defaults);
        } catch (IOException e) {
            throw new RuntimeException("Failed to load engine settings: " + settingsFile, e);
        }
    }

    static EngineSettings fromFile(SettingsFile file, EngineSettings defaults) {
        if (file == null) {
            return defaults;
        }
        int poolMin = sanitizeInt(file.poolMinSize(), defaults.poolMinSize(), 0);
        int poolMax = Math.max(Math.max(1, poolMin), sanitizeInt(file.poolMaxSize(), defaults.poolMaxSize(), 1));
        int minWorkers = sanitizeInt(file.minWorkers(), defaults.minWorkers(), 1);
        int maxWorkers = Math.max(minWorkers, sanitizeInt(file.maxWorkers(), defaults.maxWorkers(), 1));
        double warning = sanitizeDouble(file.budgetWarningThreshold(), defaults.budgetWarningThreshold(), 0.01d);
        double critical = Math.max(warning, sanitizeDouble(file.budgetCriticalThreshold(), defaults.budgetCriticalThreshold(), 0.01d));

        Map<TaskCategory, RetryPolicySpec> policies = new EnumMap<>(TaskCategory.class);
        if (file.retryPolicies() != null) {
            for (Map.Entry<String, RetryPolicySpec> e : file.retryPolicies().entrySet()) {
                if (e.getValue() != null) {
                    policies.put(TaskCategory.fromString(e.getKey()), e.getValue());
                }
            }
        }
        Map<TaskCategory, List<String>> scripts = new EnumMap<>(TaskCategory.class);
        if (file.scriptHandlers() != null) {
            for (Map.Entry<String, List<String>> e : file.scriptHandlers().entrySet()) {
                if (e.getValue() != null && !e.getValue().isEmpty()) {
                    scripts.put(TaskCategory.fromString(e.getKey()), List.copyOf(e.getValue()));
                }
            }
        }

        return new EngineSettings(
                poolMin,
                poolMax,
                sanitizeLong(file.poolMaxIdleMs(), defaults.poolMaxIdleMs(), 1L),
                sanitizeLong(file.poolMaintenanceIntervalMs(), defaults.poolMaintenanceIntervalMs(), 10L),
                sanitizeLong(file.poolAcquireTimeoutMs(), defaults.poolAcquireTimeoutMs(), 1L),
                sanitizeInt(file.cacheMaxSize(), defaults.cacheMaxSize(), 1),
                sanitizeLong(file.cacheDefaultTtlMs(), defaults.cacheDefaultTtlMs(), 0L),
                file.cachePersistent() == null ? defaults.cachePersistent() : file.cachePersistent(),
                sanitizeInt(file.breakerFailureThreshold(), defaults.breakerFailureThreshold(), 1),
                sanitizeLong(file.breakerRecoveryTimeoutMs(), defaults.breakerRecoveryTimeoutMs(), 0L),
                sanitizeInt(file.breakerHalfOpenAttempts(), defaults.breakerHalfOpenAttempts(), 1),
                sanitizeInt(file.budgetPerHour(), defaults.budgetPerHour(), 1),
                warning,
                critical,
                minWorkers,
                maxWorkers,
                file.autoscaling() == null ? defaults.autoscaling() : file.autoscaling(),
                sanitizeInt(file.scaleUpQueueDepth(), defaults.scaleUpQueueDepth(), 0),
                sanitizeLong(file.scaleDownIdleMs(), defaults.scaleDownIdleMs(), 0L),
                sanitizeDouble(file.cpuThresholdPercent(), defaults.cpuThresholdPercent(), 0.0d),
                sanitizeLong(file.monitorIntervalMs(), defaults.monitorIntervalMs(), 10L),
                sanitizeLong(file.pollTimeoutMs(), defaults.pollTimeoutMs(), 10L),
                sanitizeLong(file.gracefulShutdownMs(), defaults.gracefulShutdownMs(), 0L),
                sanitizeLong(file.finishedRetentionMs(), defaults.finishedRetentionMs(), 0L),
                file.installBuiltinWorkarounds() == null ? defaults.installBuiltinWorkarounds() : file.installBuiltinWorkarounds(),
                sanitizeInt(file.thresholdAdjustEvery(), defaults.thresholdAdjustEvery(), 1),
                sanitizeLong(file.scriptTimeoutMs(), defaults.scriptTimeoutMs(), 1_000L),
                policies,
                scripts
        );
    }

    private static int sanitizeInt(Integer raw, int fallback, int min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static long sanitizeLong(Long raw, long fallback, long min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static double sanitizeDouble(Double raw, double fallback, double min) {
        if (raw == null || raw.isNaN()) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    public record RetryPolicySpec(
            Integer maxRetries,
            Long baseDelayMs,
            Long maxDelayMs,
            Double backoffFactor,
            Boolean jitter
    ) {
    }

    record SettingsFile(
            Integer poolMinSize,
            Integer poolMaxSize,
            Long poolMaxIdleMs,
            Long poolMaintenanceIntervalMs,
            Long poolAcquireTimeoutMs,
            Integer cacheMaxSize,
            Long cacheDefaultTtlMs,
            Boolean cachePersistent,
            Integer breakerFailureThreshold,
            Long breakerRecoveryTimeoutMs,
            Integer breakerHalfOpenAttempts,
            Integer budgetPerHour,
            Double budgetWarningThreshold,
            Double budgetCriticalThreshold,
            Integer minWorkers,
            Integer maxWorkers,
            Boolean autoscaling,
            Integer scaleUpQueueDepth,
            Long scaleDownIdleMs,
            Double cpuThresholdPercent,
            Long monitorIntervalMs,
            Long pollTimeoutMs,
            Long gracefulShutdownMs,
            Long finishedRetentionMs,
            Boolean installBuiltinWorkarounds,
            Integer thresholdAdjustEvery,
            Long scriptTimeoutMs,
            Map<String, RetryPolicySpec> retryPolicies,
            Map<String, List<String>> scriptHandlers
    ) {
    }
}
