package io.steadyloop.retry;

import io.steadyloop.config.EngineSettings;
import io.steadyloop.model.TaskCategory;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

public record RetryPolicy(
        int maxRetries,
        Duration baseDelay,
        Duration maxDelay,
        double backoffFactor,
        boolean jitter
) {
    static final int ADAPT_MAX_RETRIES_CAP = 10;
    static final Duration ADAPT_MAX_DELAY_CAP = Duration.ofSeconds(300);
    private static final double JITTER_SPREAD = 0.25d;

    public RetryPolicy {
        maxRetries = Math.max(0, maxRetries);
        baseDelay = baseDelay == null || baseDelay.isNegative() ? Duration.ZERO : baseDelay;
        maxDelay = maxDelay == null || maxDelay.isNegative() ? Duration.ZERO : maxDelay;
        backoffFactor = Double.isNaN(backoffFactor) || backoffFactor < 1.0d ? 1.0d : backoffFactor;
    }

    public static RetryPolicy defaultFor(TaskCategory category) {
        return switch (category) {
            case NETWORK -> new RetryPolicy(5, Duration.ofSeconds(1), Duration.ofSeconds(30), 2.0d, true);
            case DATABASE -> new RetryPolicy(3, Duration.ofMillis(500), Duration.ofSeconds(10), 2.0d, true);
            case TIMEOUT -> new RetryPolicy(2, Duration.ofSeconds(2), Duration.ofSeconds(20), 2.0d, true);
            case RESOURCE -> new RetryPolicy(4, Duration.ofSeconds(1), Duration.ofSeconds(60), 2.0d, true);
            case DEFAULT -> new RetryPolicy(3, Duration.ofSeconds(1), Duration.ofSeconds(30), 2.0d, true);
        };
    }

    public static RetryPolicy fromSpec(TaskCategory category, EngineSettings.RetryPolicySpec spec) {
        RetryPolicy base = defaultFor(category);
        if (spec == null) {
            return base;
        }
        return new RetryPolicy(
                spec.maxRetries() == null ? base.maxRetries() : spec.maxRetries(),
                spec.baseDelayMs() == null ? base.baseDelay() : Duration.ofMillis(spec.baseDelayMs()),
                spec.maxDelayMs() == null ? base.maxDelay() : Duration.ofMillis(spec.maxDelayMs()),
                spec.backoffFactor() == null ? base.backoffFactor() : spec.backoffFactor(),
                spec.jitter() == null ? base.jitter() : spec.jitter()
        );
    }

    public Duration delayFor(int attempt) {
        return delayFor(attempt, ThreadLocalRandom.current().nextDouble(-1.0d, 1.0d));
    }

    public Duration delayFor(int attempt, double jitterDraw) {
        long maxMs = maxDelay.toMillis();
        long baseMs = baseDelay.toMillis();
        if (baseMs == 0L || maxMs == 0L) {
            return Duration.ZERO;
        }
        double raw = baseMs * Math.pow(backoffFactor, Math.max(0, attempt));
        double capped = Math.min(raw, maxMs);
        double delayed = capped;
        if (jitter) {
            double u = Math.max(-1.0d, Math.min(1.0d, Double.isNaN(jitterDraw) ? 0.0d : jitterDraw));
            delayed = capped * (1.0d + JITTER_SPREAD * u);
        }
        return Duration.ofMillis(Math.round(Math.max(0.0d, Math.min(delayed, maxMs))));
    }

    public RetryPolicy adapted(double successRate) {
        if (successRate < 0.5d) {
            long stretchedMs = Math.min(ADAPT_MAX_DELAY_CAP.toMillis(), Math.round(maxDelay.toMillis() * 1.5d));
            return new RetryPolicy(
                    Math.min(ADAPT_MAX_RETRIES_CAP, maxRetries + 1),
                    baseDelay,
                    Duration.ofMillis(Math.max(maxDelay.toMillis(), stretchedMs)),
                    backoffFactor,
                    jitter
            );
        }
        if (successRate > 0.95d && maxRetries > 1) {
            return new RetryPolicy(maxRetries - 1, baseDelay, maxDelay, backoffFactor, jitter);
        }
        return this;
    }
}
