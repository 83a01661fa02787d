package io.steadyloop.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import io.steadyloop.config.EngineSettings;
import io.steadyloop.config.SteadyLoopConfig;
import io.steadyloop.error.BudgetExceededException;
import io.steadyloop.error.FatalTaskException;
import io.steadyloop.error.TransientTaskException;
import io.steadyloop.model.TaskCategory;
import io.steadyloop.model.TaskPriority;
import io.steadyloop.model.TaskRecord;
import io.steadyloop.model.TaskStatus;
import io.steadyloop.pool.PoolSettings;
import io.steadyloop.storage.Database;
import io.steadyloop.storage.TaskStore;
import io.steadyloop.support.MutableClock;
import io.steadyloop.util.Jsons;
import io.steadyloop.worker.TaskContext;
import io.steadyloop.worker.TaskHandler;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;
import java.util.stream.Stream;

final class SteadyLoopEngineTest {
    private static final String SETTINGS = """
            {
              "budgetPerHour": 2,
              "poolMinSize": 1,
              "pollTimeoutMs": 50,
              "retryPolicies": {
                "default": { "maxRetries": 2, "jitter": false },
                "network": { "maxRetries": 0, "jitter": false }
              }
            }
            """;

    @Test
    void fatalErrorsReachTheCallerUnchanged() throws Exception {
        Path root = Files.createTempDirectory("steadyloop-test-engine-fatal-");
        try (SteadyLoopEngine engine = openEngine(root, SETTINGS)) {
            IllegalStateException boom = new IllegalStateException("broken invariant");
            AtomicInteger calls = new AtomicInteger();
            ProtectedAction<String> action = ProtectedAction.<String>builder("apply change", () -> {
                calls.incrementAndGet();
                throw boom;
            }).confidence(0.95d).build();

            IllegalStateException thrown = Assertions.assertThrows(IllegalStateException.class,
                    () -> engine.executeWithProtection(action));

            Assertions.assertSame(boom, thrown);
            Assertions.assertEquals(1, calls.get());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void transientFailureWithinBudgetIsAbsorbedAfterRetries() throws Exception {
        Path root = Files.createTempDirectory("steadyloop-test-engine-absorb-");
        try (SteadyLoopEngine engine = openEngine(root, SETTINGS)) {
            AtomicInteger calls = new AtomicInteger();
            ProtectedAction<String> action = ProtectedAction.<String>builder("sync mirror", () -> {
                calls.incrementAndGet();
                throw new TransientTaskException("flaky");
            }).confidence(0.95d).build();

            Assertions.assertNull(engine.executeWithProtection(action));
            Assertions.assertEquals(3, calls.get());
            Assertions.assertEquals(1L, engine.stats().actions().absorbedFailures());
            Assertions.assertEquals(1, engine.budget().errorsLastHour());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void workaroundResultIsMappedForTheCaller() throws Exception {
        Path root = Files.createTempDirectory("steadyloop-test-engine-degrade-");
        try (SteadyLoopEngine engine = openEngine(root, SETTINGS)) {
            engine.degradation().registerWorkaround("feed", "cached_copy", 0.3d, "Serve the last good copy",
                    (component, cause) -> Map.of("stale", true));
            ProtectedAction<String> action = ProtectedAction.<String>builder("fetch feed", () -> {
                throw new TransientTaskException("upstream 503");
            }).category(TaskCategory.NETWORK).component("feed").confidence(0.95d)
                    .onDegraded(d -> d.workaroundName() + ":" + d.result())
                    .build();

            Assertions.assertEquals("cached_copy:{stale=true}", engine.executeWithProtection(action));
            Assertions.assertEquals(1L, engine.stats().actions().degradedActions());

            List<String> rows = engine.journal().tail("degradation.", 5);
            Assertions.assertEquals(1, rows.size());
            Assertions.assertTrue(rows.get(0).contains("\"resource\":\"component/feed\""));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void budgetStopOverridesAWorkaround() throws Exception {
        Path root = Files.createTempDirectory("steadyloop-test-engine-budget-");
        try (SteadyLoopEngine engine = openEngine(root, SETTINGS)) {
            engine.degradation().registerWorkaround("feed", "cached_copy", 0.3d, "Serve the last good copy",
                    (component, cause) -> "stale");
            ProtectedAction<Object> action = ProtectedAction.<Object>builder("fetch feed", () -> {
                throw new TransientTaskException("upstream 503");
            }).category(TaskCategory.NETWORK).component("feed").confidence(0.95d).build();

            Assertions.assertNull(engine.executeWithProtection(action), "first failure degrades, no mapper");
            BudgetExceededException stop = Assertions.assertThrows(BudgetExceededException.class,
                    () -> engine.executeWithProtection(action));

            Assertions.assertFalse(stop.decision().shouldContinue());
            Assertions.assertEquals("network", stop.decision().errorType());
            Assertions.assertInstanceOf(TransientTaskException.class, stop.getCause());
            Assertions.assertEquals(1L, engine.stats().actions().budgetStops());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void budgetStopWithoutWorkaroundRaisesTheOriginalError() throws Exception {
        Path root = Files.createTempDirectory("steadyloop-test-engine-budget-raw-");
        try (SteadyLoopEngine engine = openEngine(root, SETTINGS)) {
            ProtectedAction<String> action = ProtectedAction.<String>builder("sync mirror", () -> {
                throw new TransientTaskException("flaky");
            }).category(TaskCategory.NETWORK).confidence(0.95d).build();

            Assertions.assertNull(engine.executeWithProtection(action));
            TransientTaskException thrown = Assertions.assertThrows(TransientTaskException.class,
                    () -> engine.executeWithProtection(action));
            Assertions.assertEquals("flaky", thrown.getMessage());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void cachedResultSkipsTheWork() throws Exception {
        Path root = Files.createTempDirectory("steadyloop-test-engine-cache-");
        try (SteadyLoopEngine engine = openEngine(root, SETTINGS)) {
            AtomicInteger calls = new AtomicInteger();
            ProtectedAction<String> action = ProtectedAction.<String>builder("render report", () -> "report-" + calls.incrementAndGet())
                    .confidence(0.95d)
                    .cache("report:today", null, Set.of("reports"))
                    .build();

            Assertions.assertEquals("report-1", engine.executeWithProtection(action));
            Assertions.assertEquals("report-1", engine.executeWithProtection(action));
            Assertions.assertEquals(1, calls.get());
            Assertions.assertEquals(1L, engine.stats().actions().cacheShortCircuits());

            Assertions.assertEquals(1, engine.cache().invalidateByTag("reports"));
            Assertions.assertEquals("report-2", engine.executeWithProtection(action));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void persistentCacheSurvivesAnEngineRestart() throws Exception {
        Path root = Files.createTempDirectory("steadyloop-test-engine-cache-persist-");
        String settings = "{\"poolMinSize\": 1, \"cachePersistent\": true}";
        AtomicInteger calls = new AtomicInteger();
        ProtectedAction<String> action = ProtectedAction.<String>builder("render report", () -> "report-" + calls.incrementAndGet())
                .confidence(0.95d)
                .cache("report:today", null, Set.of("reports"))
                .build();
        try {
            try (SteadyLoopEngine engine = openEngine(root, settings)) {
                Assertions.assertEquals("report-1", engine.executeWithProtection(action));
            }
            try (SteadyLoopEngine engine = openEngine(root, settings)) {
                Assertions.assertEquals("report-1", engine.executeWithProtection(action));
                Assertions.assertEquals(1L, engine.stats().actions().cacheShortCircuits());
            }
            Assertions.assertEquals(1, calls.get());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void lowConfidenceRunsReversiblyWhileTheSystemCanContinue() throws Exception {
        Path root = Files.createTempDirectory("steadyloop-test-engine-prompt-");
        try (SteadyLoopEngine engine = openEngine(root, SETTINGS)) {
            ProtectedAction<String> action = ProtectedAction.<String>builder("drop stale rows", () -> "done")
                    .confidence(0.2d)
                    .build();

            Assertions.assertEquals("done", engine.executeWithProtection(action));
            Assertions.assertEquals(1L, engine.stats().actions().promptsAvoided());
            Assertions.assertEquals(1L, engine.stats().actions().autonomousActions());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void queuedTaskRunsThroughWorkersToCompletion() throws Exception {
        Path root = Files.createTempDirectory("steadyloop-test-engine-queue-");
        try (SteadyLoopEngine engine = openEngine(root, SETTINGS)) {
            Assertions.assertTrue(engine.submit("q1", "echo payload", TaskCategory.DEFAULT, TaskPriority.HIGH,
                    null, List.of(), "{\"n\":1}"));
            Assertions.assertTrue(engine.submit("q2", "echo after q1", TaskCategory.DEFAULT, null,
                    null, List.of("q1"), null));
            Assertions.assertFalse(engine.submit("q1", "duplicate", TaskCategory.DEFAULT, null, null, List.of(), null));

            engine.startWorkers(1, 2);
            awaitTrue(() -> status(engine, "q2") == TaskStatus.COMPLETED);
            engine.stopWorkers(true);

            TaskRecord q1 = engine.getTask("q1").orElseThrow();
            Assertions.assertEquals(TaskStatus.COMPLETED, q1.status());
            Assertions.assertTrue(q1.result().contains("\"handler\": \"echo\""));
            Assertions.assertEquals(1.0d, q1.progress());
            Assertions.assertTrue(q1.completedAtMs() <= engine.getTask("q2").orElseThrow().completedAtMs());
            Assertions.assertEquals(2L, engine.workerStats().orElseThrow().processed());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void staleLeaseIsJournaledInsteadOfCompleted() throws Exception {
        Path root = Files.createTempDirectory("steadyloop-test-engine-lease-lost-");
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger runs = new AtomicInteger();
        try (SteadyLoopEngine engine = openEngine(root, SETTINGS)) {
            engine.registerHandler(new GatedHandler(TaskCategory.RESOURCE, started, release, runs));
            engine.submit("slow", "compact files", TaskCategory.RESOURCE, null, null, List.of(), null);
            engine.startWorkers(1, 1);
            Assertions.assertTrue(started.await(10, TimeUnit.SECONDS));

            try (Database other = new Database(SteadyLoopConfig.fromRoot(root.toString()),
                    new PoolSettings(1, 1, Duration.ofMinutes(5), Duration.ZERO, Duration.ofSeconds(5)))) {
                other.init();
                Assertions.assertEquals(List.of("slow"), new TaskStore(other, Clock.systemUTC()).resumeInterrupted());
            }
            release.countDown();
            awaitTrue(() -> status(engine, "slow") == TaskStatus.COMPLETED);
            engine.stopWorkers(true);

            List<String> lost = engine.journal().tail("task.lease_lost", 5);
            Assertions.assertEquals(1, lost.size());
            JsonNode row = Jsons.mapper().readTree(lost.get(0));
            Assertions.assertEquals("stale", row.path("result").asText());
            Assertions.assertEquals("completed", row.path("details").path("attempted").asText());
            Assertions.assertEquals(1, engine.journal().tail("task.complete", 5).size());
            Assertions.assertEquals(2, runs.get());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void fatalHandlerFailureFailsTheQueuedTask() throws Exception {
        Path root = Files.createTempDirectory("steadyloop-test-engine-queue-fail-");
        try (SteadyLoopEngine engine = openEngine(root, SETTINGS)) {
            engine.registerHandler(new FailingHandler(TaskCategory.DATABASE, () -> new FatalTaskException("schema mismatch")));
            engine.submit("bad", "migrate", TaskCategory.DATABASE, null, null, List.of(), null);

            engine.startWorkers(1, 1);
            awaitTrue(() -> status(engine, "bad") == TaskStatus.FAILED);
            engine.stopWorkers(true);

            TaskRecord bad = engine.getTask("bad").orElseThrow();
            Assertions.assertTrue(bad.lastError().startsWith("FatalTaskException: schema mismatch"));
            Assertions.assertFalse(engine.isHalted());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void budgetStopHaltsQueuedWorkAndRequeuesTheTask() throws Exception {
        Path root = Files.createTempDirectory("steadyloop-test-engine-halt-");
        try (SteadyLoopEngine engine = openEngine(root, SETTINGS)) {
            engine.registerHandler(new FailingHandler(TaskCategory.RESOURCE, () -> new TransientTaskException("disk busy")));
            engine.submit("r1", "write shard one", TaskCategory.RESOURCE, TaskPriority.HIGH, null, List.of(), null);
            engine.submit("r2", "write shard two", TaskCategory.RESOURCE, TaskPriority.LOW, null, List.of(), null);

            engine.startWorkers(1, 1);
            awaitTrue(engine::isHalted);
            engine.stopWorkers(true);

            Assertions.assertEquals(TaskStatus.FAILED, status(engine, "r1"));
            Assertions.assertEquals(TaskStatus.PENDING, status(engine, "r2"));
            SteadyLoopEngine.HealthReport health = engine.health();
            Assertions.assertTrue(health.halted());
            Assertions.assertTrue(health.issues().stream().anyMatch(i -> i.startsWith("Queued work halted")));

            engine.resumeAfterHalt();
            Assertions.assertFalse(engine.isHalted());
            Assertions.assertEquals(0, engine.budget().errorsLastHour());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void healthTurnsCriticalWhenNothingCanContinue() throws Exception {
        Path root = Files.createTempDirectory("steadyloop-test-engine-health-");
        try (SteadyLoopEngine engine = openEngine(root, SETTINGS)) {
            SteadyLoopEngine.HealthReport fresh = engine.health();
            Assertions.assertEquals("healthy", fresh.status());
            Assertions.assertTrue(fresh.dbOk());
            Assertions.assertEquals(0, fresh.queueDepth());

            ProtectedAction<String> action = ProtectedAction.<String>builder("apply", () -> {
                throw new FatalTaskException("nope");
            }).confidence(0.95d).build();
            Assertions.assertThrows(FatalTaskException.class, () -> engine.executeWithProtection(action));

            SteadyLoopEngine.HealthReport after = engine.health();
            Assertions.assertEquals("critical", after.status());
            Assertions.assertFalse(after.canContinue());
            Assertions.assertEquals(2, engine.journal().tail("engine.health", 10).size());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void optimizeGrowsAHealthyBudgetUpToTwiceTheConfiguredValue() throws Exception {
        Path root = Files.createTempDirectory("steadyloop-test-engine-optimize-");
        try (SteadyLoopEngine engine = openEngine(root, "{\"poolMinSize\": 1}")) {
            Assertions.assertEquals(12, engine.optimize().budgetPerHour());
            Assertions.assertEquals(14, engine.optimize().budgetPerHour());
            SteadyLoopEngine.OptimizeOutcome last = null;
            for (int i = 0; i < 10; i++) {
                last = engine.optimize();
            }
            Assertions.assertEquals(20, last.budgetPerHour());
            Assertions.assertEquals(0, last.purgedTasks());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void resumeIsRefusedWhileWorkersRun() throws Exception {
        Path root = Files.createTempDirectory("steadyloop-test-engine-resume-");
        try (SteadyLoopEngine engine = openEngine(root, SETTINGS)) {
            engine.startWorkers(1, 1);
            Assertions.assertThrows(IllegalStateException.class, engine::resumeInterrupted);
            Assertions.assertThrows(IllegalStateException.class, () -> engine.startWorkers(1, 1));
            engine.stopWorkers(true);
            Assertions.assertEquals(List.of(), engine.resumeInterrupted());
        } finally {
            deleteRecursively(root);
        }
    }

    private static SteadyLoopEngine openEngine(Path root, String settingsJson) throws IOException {
        SteadyLoopConfig config = SteadyLoopConfig.fromRoot(root.toString());
        Files.writeString(config.settingsFile(), settingsJson, StandardCharsets.UTF_8);
        SteadyLoopEngine engine = new SteadyLoopEngine(
                config,
                EngineSettings.load(config.settingsFile()),
                MutableClock.startingAt(1_700_000_000_000L),
                d -> {
                },
                () -> 0.0d
        );
        engine.init();
        return engine;
    }

    private static TaskStatus status(SteadyLoopEngine engine, String taskId) {
        return engine.getTask(taskId).map(TaskRecord::status).orElse(null);
    }

    private static void awaitTrue(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                Assertions.fail("condition not reached within 10s");
            }
            Thread.sleep(10L);
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

    private static final class GatedHandler implements TaskHandler {
        private final TaskCategory category;
        private final CountDownLatch started;
        private final CountDownLatch release;
        private final AtomicInteger runs;

        private GatedHandler(TaskCategory category, CountDownLatch started, CountDownLatch release, AtomicInteger runs) {
            this.category = category;
            this.started = started;
            this.release = release;
            this.runs = runs;
        }

        @Override
        public TaskCategory category() {
            return category;
        }

        @Override
        public String execute(TaskContext context) throws Exception {
            runs.incrementAndGet();
            started.countDown();
            if (!release.await(10, TimeUnit.SECONDS)) {
                throw new IllegalStateException("gate never opened");
            }
            return "{\"run\":" + runs.get() + "}";
        }
    }

    private static final class FailingHandler implements TaskHandler {
        private final TaskCategory category;
        private final Supplier<Exception> failure;

        private FailingHandler(TaskCategory category, Supplier<Exception> failure) {
            this.category = category;
            this.failure = failure;
        }

        @Override
        public TaskCategory category() {
            return category;
        }

        @Override
        public String execute(TaskContext context) throws Exception {
            throw failure.get();
        }
    }
}
