package io.steadyloop.decision;

import io.steadyloop.model.TaskCategory;

import java.util.Locale;
import java.util.function.ToDoubleFunction;

public final class ConfidenceScorer {
    private final ToDoubleFunction<TaskCategory> observedSuccessRate;

    public ConfidenceScorer(ToDoubleFunction<TaskCategory> observedSuccessRate) {
        this.observedSuccessRate = observedSuccessRate;
    }

    public double confidence(String description, ActionContext ctx) {
        ActionContext c = ctx == null ? ActionContext.defaults() : ctx;
        double score = 0.5d;

        Double history = c.historicalSuccessRate();
        if (history == null && observedSuccessRate != null) {
            history = observedSuccessRate.applyAsDouble(c.category());
        }
        if (history != null) {
            score += (clamp(history) - 0.5d) * 0.6d;
        }
        if (c.requirementClarity() != null) {
            score += (clamp(c.requirementClarity()) - 0.5d) * 0.4d;
        }
        if (c.reversible()) {
            score += 0.15d;
        }
        score += c.impact().adjustment();
        if (c.approvedSimilar()) {
            score += 0.2d;
        }
        score += lexicalCue(description);
        return clamp(score);
    }

    static double lexicalCue(String description) {
        if (description == null) {
            return 0.0d;
        }
        String text = description.toLowerCase(Locale.ROOT);
        if (text.contains("fix") || text.contains("bug") || text.contains("error")) {
            return 0.1d;
        }
        if (text.contains("delete") || text.contains("remove") || text.contains("drop")) {
            return -0.15d;
        }
        if (text.contains("test") || text.contains("verify") || text.contains("check")) {
            return 0.15d;
        }
        return 0.0d;
    }

    private static double clamp(double v) {
        if (Double.isNaN(v)) {
            return 0.0d;
        }
        return Math.max(0.0d, Math.min(1.0d, v));
    }
}
