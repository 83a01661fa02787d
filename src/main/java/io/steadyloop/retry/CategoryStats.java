package io.steadyloop.retry;

import io.steadyloop.model.TaskCategory;

public record CategoryStats(
        TaskCategory category,
        long executions,
        long attempts,
        long successes,
        long failures,
        long circuitRejections,
        double successRate,
        RetryPolicy policy,
        BreakerSnapshot breaker
) {
}
