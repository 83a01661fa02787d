package io.steadyloop.pool;

public record PoolStats(
        String name,
        int live,
        int idle,
        int leased,
        int minSize,
        int maxSize,
        int peakLive,
        long created,
        long destroyed,
        long acquired,
        long released,
        long timeouts,
        long healthCheckFailures
) {
}
