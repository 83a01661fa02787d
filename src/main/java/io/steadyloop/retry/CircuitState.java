package io.steadyloop.retry;

public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN
}
