package io.steadyloop.pool;

import java.time.Duration;

public record PoolSettings(
        int minSize,
        int maxSize,
        Duration maxIdleTime,
        Duration maintenanceInterval,
        Duration acquireTimeout
) {
    public PoolSettings {
        if (minSize < 0) {
            throw new IllegalArgumentException("minSize must be >= 0: " + minSize);
        }
        if (maxSize < 1 || maxSize < minSize) {
            throw new IllegalArgumentException("maxSize must be >= max(1, minSize): " + maxSize);
        }
        if (maxIdleTime == null || maxIdleTime.isNegative()) {
            throw new IllegalArgumentException("maxIdleTime must be >= 0");
        }
        maintenanceInterval = maintenanceInterval == null ? Duration.ZERO : maintenanceInterval;
        acquireTimeout = acquireTimeout == null ? Duration.ofSeconds(5) : acquireTimeout;
    }
}
