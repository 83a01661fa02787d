package io.steadyloop.decision;

import io.steadyloop.model.TaskCategory;

import java.time.Duration;

public record ActionContext(
        Double historicalSuccessRate,
        Double requirementClarity,
        boolean reversible,
        Impact impact,
        boolean approvedSimilar,
        Duration expectedDuration,
        Runnable rollback,
        TaskCategory category
) {
    public static final Duration DEFAULT_EXPECTED_DURATION = Duration.ofSeconds(10);

    public ActionContext {
        impact = impact == null ? Impact.MEDIUM : impact;
        expectedDuration = expectedDuration == null ? DEFAULT_EXPECTED_DURATION : expectedDuration;
        category = category == null ? TaskCategory.DEFAULT : category;
    }

    public static ActionContext defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Double historicalSuccessRate;
        private Double requirementClarity;
        private boolean reversible;
        private Impact impact = Impact.MEDIUM;
        private boolean approvedSimilar;
        private Duration expectedDuration;
        private Runnable rollback;
        private TaskCategory category;

        private Builder() {
        }

        public Builder historicalSuccessRate(Double value) {
            this.historicalSuccessRate = value;
            return this;
        }

        public Builder requirementClarity(Double value) {
            this.requirementClarity = value;
            return this;
        }

        public Builder reversible(boolean value) {
            this.reversible = value;
            return this;
        }

        public Builder impact(Impact value) {
            this.impact = value;
            return this;
        }

        public Builder approvedSimilar(boolean value) {
            this.approvedSimilar = value;
            return this;
        }

        public Builder expectedDuration(Duration value) {
            this.expectedDuration = value;
            return this;
        }

        public Builder rollback(Runnable value) {
            this.rollback = value;
            return this;
        }

        public Builder category(TaskCategory value) {
            this.category = value;
            return this;
        }

        public ActionContext build() {
            return new ActionContext(historicalSuccessRate, requirementClarity, reversible, impact,
                    approvedSimilar, expectedDuration, rollback, category);
        }
    }
}
