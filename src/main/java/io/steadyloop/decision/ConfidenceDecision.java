package io.steadyloop.decision;

public record ConfidenceDecision(
        String actionId,
        String description,
        double confidence,
        ExecutionStrategy strategy,
        long decidedAtMs,
        String outcome,
        long durationMs,
        String error
) {
    public static final String SUCCEEDED = "succeeded";
    public static final String FAILED = "failed";
    public static final String APPROVAL_REQUIRED = "approval_required";
}
