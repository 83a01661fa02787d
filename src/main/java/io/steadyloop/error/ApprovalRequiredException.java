package io.steadyloop.error;

import io.steadyloop.decision.ExecutionStrategy;

import java.util.Locale;

public final class ApprovalRequiredException extends SteadyLoopException {
    private final String actionId;
    private final double confidence;
    private final ExecutionStrategy strategy;

    public ApprovalRequiredException(String actionId, String description, double confidence, ExecutionStrategy strategy) {
        super(String.format(Locale.ROOT,
                "Action %s needs approval: confidence %.2f is below the autonomous threshold (%s)",
                actionId, confidence, description));
        this.actionId = actionId;
        this.confidence = confidence;
        this.strategy = strategy;
    }

    public String actionId() {
        return actionId;
    }

    public double confidence() {
        return confidence;
    }

    public ExecutionStrategy strategy() {
        return strategy;
    }
}
