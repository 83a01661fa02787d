package io.steadyloop.worker;

import io.steadyloop.config.EngineSettings;
import io.steadyloop.config.SteadyLoopConfig;

import java.time.Duration;

public record WorkerPoolSettings(
        int minWorkers,
        int maxWorkers,
        boolean autoscaling,
        int scaleUpQueueDepth,
        Duration scaleDownIdle,
        double cpuThresholdPercent,
        Duration monitorInterval,
        Duration pollTimeout,
        Duration gracefulShutdown,
        Duration joinTimeout
) {
    public WorkerPoolSettings {
        if (minWorkers < 1) {
            throw new IllegalArgumentException("minWorkers must be >= 1: " + minWorkers);
        }
        if (maxWorkers < minWorkers) {
            throw new IllegalArgumentException("maxWorkers must be >= minWorkers: " + maxWorkers + " < " + minWorkers);
        }
    }

    public static WorkerPoolSettings from(EngineSettings s) {
        return new WorkerPoolSettings(
                s.minWorkers(),
                s.maxWorkers(),
                s.autoscaling(),
                s.scaleUpQueueDepth(),
                Duration.ofMillis(s.scaleDownIdleMs()),
                s.cpuThresholdPercent(),
                Duration.ofMillis(s.monitorIntervalMs()),
                Duration.ofMillis(s.pollTimeoutMs()),
                Duration.ofMillis(s.gracefulShutdownMs()),
                Duration.ofMillis(SteadyLoopConfig.DEFAULT_WORKER_JOIN_TIMEOUT_MS)
        );
    }

    public WorkerPoolSettings withBounds(int min, int max) {
        return new WorkerPoolSettings(min, max, autoscaling, scaleUpQueueDepth, scaleDownIdle, cpuThresholdPercent,
                monitorInterval, pollTimeout, gracefulShutdown, joinTimeout);
    }
}
