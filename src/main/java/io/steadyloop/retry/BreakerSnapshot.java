package io.steadyloop.retry;

import io.steadyloop.model.TaskCategory;

public record BreakerSnapshot(
        TaskCategory category,
        CircuitState state,
        int failureCount,
        int failureThreshold,
        long recoveryTimeoutMs,
        Long lastFailureAtMs,
        int halfOpenAttempts,
        int halfOpenSuccesses
) {
}
