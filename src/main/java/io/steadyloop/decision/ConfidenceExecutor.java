package io.steadyloop.decision;

import io.steadyloop.error.ApprovalRequiredException;
import io.steadyloop.error.ErrorClassifier;
import io.steadyloop.observability.EventJournal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Picks an execution strategy from an action's confidence and runs it accordingly. Low
 * confidence never blocks: it raises {@link ApprovalRequiredException} for the caller to handle.
 */
public final class ConfidenceExecutor {
    private static final Logger log = LoggerFactory.getLogger(ConfidenceExecutor.class);
    static final int DECISION_LOG_LIMIT = 1_000;
    private static final int REPORT_RECENT = 10;

    private final ConfidenceScorer scorer;
    private final EventJournal journal;
    private final Clock clock;
    private final int adjustEvery;
    private final Deque<ConfidenceDecision> decisions = new ArrayDeque<>();
    private Thresholds thresholds = Thresholds.defaults();
    private int totalDecisions;
    private int autonomousDecisions;
    private int autonomousSuccesses;
    private int windowOutcomes;
    private int windowSuccesses;

    public ConfidenceExecutor(ConfidenceScorer scorer, EventJournal journal, Clock clock, int adjustEvery) {
        this.scorer = scorer;
        this.journal = journal;
        this.clock = clock;
        this.adjustEvery = Math.max(1, adjustEvery);
    }

    public double confidence(String description, ActionContext ctx) {
        return scorer.confidence(description, ctx);
    }

    public synchronized ExecutionStrategy strategy(double confidence) {
        return thresholds.strategyFor(confidence);
    }

    public <T> T execute(String actionId, String description, Callable<T> work,
                         Double confidence, ActionContext ctx) throws Exception {
        ActionContext c = ctx == null ? ActionContext.defaults() : ctx;
        double score = confidence == null ? scorer.confidence(description, c) : confidence;
        return execute(actionId, description, work, score, strategy(score), c);
    }

    public <T> T execute(String actionId, String description, Callable<T> work,
                         double confidence, ExecutionStrategy strategy, ActionContext ctx) throws Exception {
        ActionContext c = ctx == null ? ActionContext.defaults() : ctx;
        long started = clock.millis();
        if (strategy == ExecutionStrategy.ASK_FIRST) {
            record(new ConfidenceDecision(actionId, description, confidence, strategy, started,
                    ConfidenceDecision.APPROVAL_REQUIRED, 0L, null));
            throw new ApprovalRequiredException(actionId, description, confidence, strategy);
        }
        try {
            T result = work.call();
            long elapsed = clock.millis() - started;
            if (strategy == ExecutionStrategy.MONITORED && elapsed > 2L * c.expectedDuration().toMillis()) {
                log.warn("Monitored action {} took {}ms, more than twice the expected {}ms",
                        actionId, elapsed, c.expectedDuration().toMillis());
            }
            record(new ConfidenceDecision(actionId, description, confidence, strategy, started,
                    ConfidenceDecision.SUCCEEDED, elapsed, null));
            return result;
        } catch (Exception e) {
            if (strategy == ExecutionStrategy.REVERSIBLE && c.rollback() != null) {
                rollback(actionId, c.rollback(), e);
            }
            record(new ConfidenceDecision(actionId, description, confidence, strategy, started,
                    ConfidenceDecision.FAILED, clock.millis() - started, ErrorClassifier.errorType(e)));
            throw e;
        }
    }

    public synchronized Thresholds adjustThresholds(double successRate) {
        Thresholds before = thresholds;
        if (successRate < 0.80d) {
            thresholds = thresholds.shifted(0.05d);
        } else if (successRate > 0.95d) {
            thresholds = thresholds.shifted(-0.05d);
        }
        if (!thresholds.equals(before)) {
            log.info("Confidence thresholds adjusted {} -> {} (successRate={})", before, thresholds, successRate);
        }
        return thresholds;
    }

    public synchronized Thresholds thresholds() {
        return thresholds;
    }

    public synchronized List<ConfidenceDecision> decisionLog() {
        return List.copyOf(decisions);
    }

    public synchronized ConfidenceReport report() {
        List<ConfidenceDecision> all = new ArrayList<>(decisions);
        List<ConfidenceDecision> recent = all.subList(Math.max(0, all.size() - REPORT_RECENT), all.size());
        return new ConfidenceReport(
                totalDecisions,
                totalDecisions == 0 ? 0.0d : autonomousDecisions / (double) totalDecisions,
                autonomousDecisions == 0 ? 1.0d : autonomousSuccesses / (double) autonomousDecisions,
                thresholds,
                List.copyOf(recent)
        );
    }

    private void rollback(String actionId, Runnable rollback, Exception cause) {
        try {
            rollback.run();
            log.info("Rolled back action {}", actionId);
        } catch (RuntimeException re) {
            log.warn("Rollback of action {} failed", actionId, re);
            cause.addSuppressed(re);
        }
    }

    private void record(ConfidenceDecision decision) {
        synchronized (this) {
            decisions.addLast(decision);
            while (decisions.size() > DECISION_LOG_LIMIT) {
                decisions.removeFirst();
            }
            totalDecisions++;
            if (decision.strategy().autonomous()) {
                autonomousDecisions++;
                windowOutcomes++;
                if (ConfidenceDecision.SUCCEEDED.equals(decision.outcome())) {
                    autonomousSuccesses++;
                    windowSuccesses++;
                }
                if (windowOutcomes >= adjustEvery) {
                    adjustThresholds(windowSuccesses / (double) windowOutcomes);
                    windowOutcomes = 0;
                    windowSuccesses = 0;
                }
            }
        }
        if (journal != null) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("confidence", decision.confidence());
            details.put("strategy", decision.strategy().name());
            details.put("duration_ms", decision.durationMs());
            if (decision.error() != null) {
                details.put("error", decision.error());
            }
            journal.log(EventJournal.JournalEvent.of("decision.confidence", "engine", decision.actionId(),
                    decision.outcome(), null, details));
        }
    }
}
