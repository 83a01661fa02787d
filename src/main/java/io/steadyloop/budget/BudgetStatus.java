package io.steadyloop.budget;

public enum BudgetStatus {
    HEALTHY,
    DEGRADED,
    CRITICAL,
    EXCEEDED
}
