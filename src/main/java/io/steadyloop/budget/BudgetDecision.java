package io.steadyloop.budget;

public record BudgetDecision(
        boolean shouldContinue,
        String reason,
        double confidence,
        String recommendation,
        BudgetStatus status,
        String errorType
) {
}
