package io.steadyloop.error;

import io.steadyloop.budget.BudgetDecision;

public final class BudgetExceededException extends SteadyLoopException {
    private final transient BudgetDecision decision;

    public BudgetExceededException(BudgetDecision decision, Throwable cause) {
        super("Error budget exceeded: " + decision.reason(), cause);
        this.decision = decision;
    }

    public BudgetDecision decision() {
        return decision;
    }
}
