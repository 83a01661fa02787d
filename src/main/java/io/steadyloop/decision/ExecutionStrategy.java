package io.steadyloop.decision;

public enum ExecutionStrategy {
    IMMEDIATE,
    MONITORED,
    REVERSIBLE,
    ASK_FIRST;

    public boolean autonomous() {
        return this != ASK_FIRST;
    }
}
