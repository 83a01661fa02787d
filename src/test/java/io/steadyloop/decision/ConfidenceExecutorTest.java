package io.steadyloop.decision;

import io.steadyloop.error.ApprovalRequiredException;
import io.steadyloop.error.TransientTaskException;
import io.steadyloop.model.TaskCategory;
import io.steadyloop.observability.EventJournal;
import io.steadyloop.support.MutableClock;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

final class ConfidenceExecutorTest {

    @Test
    void scoreCombinesContextSignals() {
        ConfidenceScorer scorer = new ConfidenceScorer(null);
        Assertions.assertEquals(0.5d, scorer.confidence("rename module", ActionContext.defaults()), 1e-9);

        ActionContext strong = ActionContext.builder()
                .historicalSuccessRate(1.0d)
                .requirementClarity(1.0d)
                .reversible(true)
                .impact(Impact.LOW)
                .build();
        Assertions.assertEquals(1.0d, scorer.confidence("fix bug", strong), 1e-9);

        ActionContext risky = ActionContext.builder()
                .historicalSuccessRate(0.5d)
                .impact(Impact.CRITICAL)
                .build();
        Assertions.assertEquals(0.05d, scorer.confidence("drop table", risky), 1e-9);
    }

    @Test
    void observedSuccessRateStandsInForMissingHistory() {
        ConfidenceScorer scorer = new ConfidenceScorer(c -> c == TaskCategory.NETWORK ? 0.0d : 1.0d);
        ActionContext network = ActionContext.builder().category(TaskCategory.NETWORK).build();
        ActionContext database = ActionContext.builder().category(TaskCategory.DATABASE).build();
        Assertions.assertEquals(0.2d, scorer.confidence("sync", network), 1e-9);
        Assertions.assertEquals(0.8d, scorer.confidence("sync", database), 1e-9);
    }

    @Test
    void lexicalCuesTakeTheFirstMatchingGroup() {
        Assertions.assertEquals(0.1d, ConfidenceScorer.lexicalCue("Fix the delete path"));
        Assertions.assertEquals(-0.15d, ConfidenceScorer.lexicalCue("remove stale rows"));
        Assertions.assertEquals(0.15d, ConfidenceScorer.lexicalCue("verify output"));
        Assertions.assertEquals(0.0d, ConfidenceScorer.lexicalCue(null));
    }

    @Test
    void strategyFollowsThresholds() {
        Thresholds t = Thresholds.defaults();
        Assertions.assertEquals(ExecutionStrategy.IMMEDIATE, t.strategyFor(0.9d));
        Assertions.assertEquals(ExecutionStrategy.MONITORED, t.strategyFor(0.89d));
        Assertions.assertEquals(ExecutionStrategy.REVERSIBLE, t.strategyFor(0.5d));
        Assertions.assertEquals(ExecutionStrategy.ASK_FIRST, t.strategyFor(0.49d));
    }

    @Test
    void lowConfidenceRaisesApprovalRequiredWithoutRunningTheWork() throws Exception {
        ConfidenceExecutor executor = new ConfidenceExecutor(new ConfidenceScorer(null), null,
                MutableClock.startingAt(0L), 20);
        AtomicInteger runs = new AtomicInteger();

        ApprovalRequiredException ex = Assertions.assertThrows(ApprovalRequiredException.class,
                () -> executor.execute("a1", "drop production table", () -> runs.incrementAndGet(), 0.3d, null));

        Assertions.assertEquals(0, runs.get());
        Assertions.assertEquals(ExecutionStrategy.ASK_FIRST, ex.strategy());
        Assertions.assertEquals(0.3d, ex.confidence());
        ConfidenceDecision logged = executor.decisionLog().get(0);
        Assertions.assertEquals(ConfidenceDecision.APPROVAL_REQUIRED, logged.outcome());
        Assertions.assertEquals(0.0d, executor.report().autonomousRate());
    }

    @Test
    void reversibleFailureRunsRollbackAndRethrows() {
        ConfidenceExecutor executor = new ConfidenceExecutor(new ConfidenceScorer(null), null,
                MutableClock.startingAt(0L), 20);
        AtomicInteger rollbacks = new AtomicInteger();
        ActionContext ctx = ActionContext.builder().rollback(rollbacks::incrementAndGet).build();
        TransientTaskException failure = new TransientTaskException("half written");

        TransientTaskException thrown = Assertions.assertThrows(TransientTaskException.class,
                () -> executor.execute("a2", "write file", () -> {
                    throw failure;
                }, 0.6d, ctx));

        Assertions.assertSame(failure, thrown);
        Assertions.assertEquals(1, rollbacks.get());
        ConfidenceDecision logged = executor.decisionLog().get(0);
        Assertions.assertEquals(ExecutionStrategy.REVERSIBLE, logged.strategy());
        Assertions.assertEquals(ConfidenceDecision.FAILED, logged.outcome());
        Assertions.assertEquals("TransientTaskException", logged.error());
    }

    @Test
    void failingRollbackIsAttachedAsSuppressed() {
        ConfidenceExecutor executor = new ConfidenceExecutor(new ConfidenceScorer(null), null,
                MutableClock.startingAt(0L), 20);
        ActionContext ctx = ActionContext.builder().rollback(() -> {
            throw new IllegalStateException("rollback failed");
        }).build();

        TransientTaskException thrown = Assertions.assertThrows(TransientTaskException.class,
                () -> executor.execute("a3", "write", () -> {
                    throw new TransientTaskException("boom");
                }, 0.55d, ctx));
        Assertions.assertEquals(1, thrown.getSuppressed().length);
    }

    @Test
    void immediateFailureDoesNotRollBack() {
        ConfidenceExecutor executor = new ConfidenceExecutor(new ConfidenceScorer(null), null,
                MutableClock.startingAt(0L), 20);
        AtomicInteger rollbacks = new AtomicInteger();
        ActionContext ctx = ActionContext.builder().rollback(rollbacks::incrementAndGet).build();

        Assertions.assertThrows(TransientTaskException.class,
                () -> executor.execute("a4", "write", () -> {
                    throw new TransientTaskException("boom");
                }, 0.95d, ctx));
        Assertions.assertEquals(0, rollbacks.get());
    }

    @Test
    void thresholdsRiseAfterAPoorWindowAndFallAfterAGoodOne() throws Exception {
        ConfidenceExecutor executor = new ConfidenceExecutor(new ConfidenceScorer(null), null,
                MutableClock.startingAt(0L), 4);
        for (int i = 0; i < 4; i++) {
            Assertions.assertThrows(TransientTaskException.class,
                    () -> executor.execute("bad", "x", () -> {
                        throw new TransientTaskException("no");
                    }, 0.95d, null));
        }
        Assertions.assertEquals(new Thresholds(0.95d, 0.75d, 0.55d), executor.thresholds());

        for (int i = 0; i < 4; i++) {
            Assertions.assertEquals("ok", executor.execute("good", "x", () -> "ok", 0.96d, null));
        }
        Assertions.assertEquals(new Thresholds(0.9d, 0.7d, 0.5d), executor.thresholds());

        ConfidenceReport report = executor.report();
        Assertions.assertEquals(8, report.totalDecisions());
        Assertions.assertEquals(1.0d, report.autonomousRate());
        Assertions.assertEquals(0.5d, report.successRate());
    }

    @Test
    void thresholdsStayWithinBounds() {
        ConfidenceExecutor executor = new ConfidenceExecutor(new ConfidenceScorer(null), null,
                MutableClock.startingAt(0L), 20);
        for (int i = 0; i < 30; i++) {
            executor.adjustThresholds(0.0d);
        }
        Assertions.assertEquals(new Thresholds(0.95d, 0.95d, 0.95d), executor.thresholds());
        for (int i = 0; i < 30; i++) {
            executor.adjustThresholds(1.0d);
        }
        Assertions.assertEquals(new Thresholds(0.1d, 0.1d, 0.1d), executor.thresholds());
        Assertions.assertSame(executor.thresholds(), executor.adjustThresholds(0.9d));
    }

    @Test
    void decisionsAreJournaled() throws Exception {
        Path root = Files.createTempDirectory("steadyloop-test-decision-journal-");
        try {
            MutableClock clock = MutableClock.startingAt(0L);
            EventJournal journal = new EventJournal(root.resolve("journal").resolve("events.log"), clock);
            ConfidenceExecutor executor = new ConfidenceExecutor(new ConfidenceScorer(null), journal, clock, 20);

            executor.execute("j1", "verify build", () -> "ok", null, ActionContext.defaults());

            List<String> rows = journal.tail("decision.", 10);
            Assertions.assertEquals(1, rows.size());
            Assertions.assertTrue(rows.get(0).contains("\"resource\":\"j1\""));
            Assertions.assertTrue(rows.get(0).contains("\"strategy\":\"REVERSIBLE\""));
        } finally {
            deleteRecursively(root);
        }
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
