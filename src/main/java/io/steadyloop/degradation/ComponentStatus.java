package io.steadyloop.degradation;

public enum ComponentStatus {
    OPERATIONAL,
    DEGRADED,
    FAILED,
    BYPASSED
}
