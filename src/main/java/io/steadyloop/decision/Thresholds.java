package io.steadyloop.decision;

public record Thresholds(double immediate, double monitored, double reversible) {
    public static final double CEILING = 0.95d;
    public static final double FLOOR = 0.10d;

    public static Thresholds defaults() {
        return new Thresholds(0.9d, 0.7d, 0.5d);
    }

    public ExecutionStrategy strategyFor(double confidence) {
        if (confidence >= immediate) {
            return ExecutionStrategy.IMMEDIATE;
        }
        if (confidence >= monitored) {
            return ExecutionStrategy.MONITORED;
        }
        if (confidence >= reversible) {
            return ExecutionStrategy.REVERSIBLE;
        }
        return ExecutionStrategy.ASK_FIRST;
    }

    Thresholds shifted(double delta) {
        return new Thresholds(bound(immediate + delta), bound(monitored + delta), bound(reversible + delta));
    }

    private static double bound(double v) {
        return Math.round(Math.max(FLOOR, Math.min(CEILING, v)) * 1000.0d) / 1000.0d;
    }
}
