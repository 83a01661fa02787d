package io.steadyloop.error;

public enum ErrorKind {
    TRANSIENT,
    FATAL,
    CIRCUIT_OPEN,
    BUDGET_EXCEEDED,
    APPROVAL_REQUIRED;

    public boolean retryable() {
        return this == TRANSIENT;
    }
}
