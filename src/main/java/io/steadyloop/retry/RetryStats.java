package io.steadyloop.retry;

import io.steadyloop.model.TaskCategory;

import java.util.Map;

public record RetryStats(Map<TaskCategory, CategoryStats> categories) {
    public RetryStats {
        categories = Map.copyOf(categories);
    }

    public double overallSuccessRate() {
        long executions = 0L;
        double weighted = 0.0d;
        for (CategoryStats s : categories.values()) {
            executions += s.executions();
            weighted += s.successRate() * s.executions();
        }
        return executions == 0L ? 1.0d : weighted / executions;
    }

    public boolean anyCircuitOpen() {
        for (CategoryStats s : categories.values()) {
            if (s.breaker().state() == CircuitState.OPEN) {
                return true;
            }
        }
        return false;
    }
}
