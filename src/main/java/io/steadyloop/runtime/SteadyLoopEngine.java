package io.steadyloop.runtime;

import io.steadyloop.budget.BudgetDecision;
import io.steadyloop.budget.BudgetReport;
import io.steadyloop.budget.BudgetStatus;
import io.steadyloop.budget.ErrorBudget;
import io.steadyloop.cache.CacheStats;
import io.steadyloop.cache.ResultCache;
import io.steadyloop.config.EngineSettings;
import io.steadyloop.config.SteadyLoopConfig;
import io.steadyloop.decision.ActionContext;
import io.steadyloop.decision.ConfidenceExecutor;
import io.steadyloop.decision.ConfidenceReport;
import io.steadyloop.decision.ConfidenceScorer;
import io.steadyloop.decision.ExecutionStrategy;
import io.steadyloop.decision.Thresholds;
import io.steadyloop.degradation.BuiltinWorkarounds;
import io.steadyloop.degradation.DegradationLevel;
import io.steadyloop.degradation.DegradationRegistry;
import io.steadyloop.degradation.DegradationReport;
import io.steadyloop.degradation.DegradedOutcome;
import io.steadyloop.error.BudgetExceededException;
import io.steadyloop.error.ErrorClassifier;
import io.steadyloop.error.ErrorKind;
import io.steadyloop.model.TaskCategory;
import io.steadyloop.model.TaskPriority;
import io.steadyloop.model.TaskRecord;
import io.steadyloop.model.TaskStatus;
import io.steadyloop.observability.EventJournal;
import io.steadyloop.pool.PoolSettings;
import io.steadyloop.pool.PoolStats;
import io.steadyloop.pool.PooledHandle;
import io.steadyloop.retry.CategoryStats;
import io.steadyloop.retry.CircuitState;
import io.steadyloop.retry.RetryEngine;
import io.steadyloop.retry.RetryPolicy;
import io.steadyloop.retry.RetryStats;
import io.steadyloop.retry.Sleeper;
import io.steadyloop.storage.Database;
import io.steadyloop.storage.SqliteCacheBacking;
import io.steadyloop.storage.TaskStore;
import io.steadyloop.storage.WorkQueue;
import io.steadyloop.worker.CpuGauge;
import io.steadyloop.worker.EchoTaskHandler;
import io.steadyloop.worker.HandlerRegistry;
import io.steadyloop.worker.ScriptTaskHandler;
import io.steadyloop.worker.TaskContext;
import io.steadyloop.worker.TaskHandler;
import io.steadyloop.worker.WorkerPool;
import io.steadyloop.worker.WorkerPoolSettings;
import io.steadyloop.worker.WorkerStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Wires the resilience stack together. Inline actions run through
 * {@link #executeWithProtection(ProtectedAction)}; queued tasks run the same stack on the worker
 * pool. Retry, breaker, budget and decision state live in memory only and start fresh with each
 * engine.
 */
public final class SteadyLoopEngine implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(SteadyLoopEngine.class);
    private static final String ACTOR = "engine";
    private static final int BACKLOG_WARNING = 100;
    private static final double RETRY_HEALTH_FLOOR = 0.7d;

    private final SteadyLoopConfig config;
    private final EngineSettings settings;
    private final Clock clock;
    private final CpuGauge cpuGauge;
    private final EventJournal journal;
    private final Database database;
    private final TaskStore taskStore;
    private final WorkQueue workQueue;
    private final ResultCache<Object> cache;
    private final RetryEngine retryEngine;
    private final ErrorBudget budget;
    private final DegradationRegistry degradation;
    private final ConfidenceExecutor confidence;
    private final HandlerRegistry handlers;
    private final AtomicBoolean halted;
    private final AtomicLong totalActions;
    private final AtomicLong autonomousActions;
    private final AtomicLong promptsAvoided;
    private final AtomicLong cacheShortCircuits;
    private final AtomicLong degradedActions;
    private final AtomicLong absorbedFailures;
    private final AtomicLong budgetStops;
    private volatile WorkerPool workerPool;
    private volatile String haltReason;
    private boolean initialized;
    private List<String> resumedAtStartup;

    public SteadyLoopEngine(SteadyLoopConfig config) {
        this(config, EngineSettings.load(config.settingsFile()), Clock.systemUTC(), Sleeper.THREAD, CpuGauge.system());
    }

    public SteadyLoopEngine(SteadyLoopConfig config, EngineSettings settings, Clock clock, Sleeper sleeper, CpuGauge cpuGauge) {
        this.config = config;
        this.settings = settings;
        this.clock = clock;
        this.cpuGauge = cpuGauge;
        this.journal = new EventJournal(config.journalFile(), clock);
        this.database = new Database(config, new PoolSettings(
                settings.poolMinSize(),
                settings.poolMaxSize(),
                Duration.ofMillis(settings.poolMaxIdleMs()),
                Duration.ofMillis(settings.poolMaintenanceIntervalMs()),
                Duration.ofMillis(settings.poolAcquireTimeoutMs())
        ));
        this.taskStore = new TaskStore(database, clock);
        this.workQueue = new WorkQueue(taskStore);
        this.cache = new ResultCache<>(settings.cacheMaxSize(), Duration.ofMillis(settings.cacheDefaultTtlMs()), clock,
                settings.cachePersistent() ? new SqliteCacheBacking<>(database, Object.class, clock) : null);
        this.retryEngine = new RetryEngine(
                retryPolicies(settings),
                settings.breakerFailureThreshold(),
                Duration.ofMillis(settings.breakerRecoveryTimeoutMs()),
                settings.breakerHalfOpenAttempts(),
                clock,
                sleeper,
                (category, from, to) -> journal.log(EventJournal.JournalEvent.of(
                        "circuit.transition", ACTOR, "category/" + category.key(), to.name(), null,
                        Map.of("from", from.name(), "to", to.name())))
        );
        this.budget = new ErrorBudget(settings.budgetPerHour(), settings.budgetWarningThreshold(),
                settings.budgetCriticalThreshold(), clock);
        this.degradation = new DegradationRegistry();
        if (settings.installBuiltinWorkarounds()) {
            BuiltinWorkarounds.install(degradation);
        }
        this.confidence = new ConfidenceExecutor(new ConfidenceScorer(retryEngine::successRate), journal, clock,
                settings.thresholdAdjustEvery());
        this.handlers = new HandlerRegistry();
        this.handlers.register(new EchoTaskHandler());
        this.halted = new AtomicBoolean(false);
        this.totalActions = new AtomicLong(0L);
        this.autonomousActions = new AtomicLong(0L);
        this.promptsAvoided = new AtomicLong(0L);
        this.cacheShortCircuits = new AtomicLong(0L);
        this.degradedActions = new AtomicLong(0L);
        this.absorbedFailures = new AtomicLong(0L);
        this.budgetStops = new AtomicLong(0L);
        this.resumedAtStartup = List.of();
    }

    public synchronized void init() {
        if (initialized) {
            return;
        }
        database.init();
        registerConfiguredScriptHandlers();
        resumedAtStartup = taskStore.resumeInterrupted();
        if (!resumedAtStartup.isEmpty()) {
            log.info("Re-queued {} task(s) interrupted by a previous run", resumedAtStartup.size());
            journal.log(EventJournal.JournalEvent.of("task.resume", ACTOR, "queue", "resumed", null,
                    Map.of("task_ids", resumedAtStartup, "trigger", "startup")));
        }
        initialized = true;
    }

    public synchronized List<String> resumedAtStartup() {
        return resumedAtStartup;
    }

    public boolean submit(String taskId, String description, TaskCategory category, TaskPriority priority,
                          Long deadlineAtMs, List<String> dependencies, String payload) {
        TaskCategory effective = category == null ? TaskCategory.inferFromDescription(description) : category;
        TaskStore.Submission submission = new TaskStore.Submission(
                taskId,
                description,
                effective,
                priority == null ? TaskPriority.NORMAL : priority,
                payload,
                dependencies,
                deadlineAtMs
        );
        boolean accepted = workQueue.submit(submission);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("category", effective.key());
        details.put("priority", submission.priority().name());
        details.put("dependencies", submission.dependencies());
        journal.log(EventJournal.JournalEvent.of("task.submit", ACTOR, "task/" + taskId,
                accepted ? "accepted" : "duplicate", taskId, details));
        return accepted;
    }

    public <T> T executeWithProtection(ProtectedAction<T> action) throws Exception {
        Protected<T> outcome = protect(action);
        switch (outcome.kind()) {
            case SUCCEEDED:
                return outcome.value();
            case DEGRADED:
                return action.onDegraded() == null ? null : action.onDegraded().apply(outcome.degraded());
            case ABSORBED:
                return null;
            default:
                throw outcome.error();
        }
    }

    public boolean updateProgress(String taskId, double progress, String checkpoint) {
        return taskStore.updateProgress(taskId, progress, checkpoint);
    }

    public List<String> resumeInterrupted() {
        WorkerPool pool = workerPool;
        if (pool != null && pool.isRunning()) {
            throw new IllegalStateException("Cannot resume interrupted tasks while workers are running");
        }
        List<String> ids = taskStore.resumeInterrupted();
        if (!ids.isEmpty()) {
            workQueue.signalWork();
            journal.log(EventJournal.JournalEvent.of("task.resume", ACTOR, "queue", "resumed", null,
                    Map.of("task_ids", ids, "trigger", "manual")));
        }
        return ids;
    }

    public TaskStore.CancelResult cancel(String taskId, String reason) {
        TaskStore.CancelResult out = taskStore.cancel(taskId, reason);
        if (out.cancelled()) {
            workQueue.signalWork();
        }
        journal.log(EventJournal.JournalEvent.of("task.cancel", ACTOR, "task/" + taskId,
                out.cancelled() ? "cancelled" : "rejected", taskId, Map.of("message", out.message())));
        return out;
    }

    public Optional<TaskRecord> getTask(String taskId) {
        return taskStore.getTask(taskId);
    }

    public List<TaskRecord> listTasks(TaskStatus status, int limit, int offset) {
        return taskStore.listTasks(status, limit, offset);
    }

    public int cleanup(Duration olderThan) {
        long cutoff = clock.millis() - Math.max(0L, olderThan.toMillis());
        int purged = taskStore.purgeFinishedOlderThan(cutoff);
        if (purged > 0) {
            log.info("Purged {} finished task(s) older than {}", purged, olderThan);
        }
        return purged;
    }

    public synchronized void startWorkers(int minWorkers, int maxWorkers) {
        WorkerPool existing = workerPool;
        if (existing != null && existing.isRunning()) {
            throw new IllegalStateException("Workers already running");
        }
        WorkerPool pool = new WorkerPool(
                workQueue,
                this::processClaimed,
                WorkerPoolSettings.from(settings),
                cpuGauge,
                halted::get,
                retryEngine::adaptAll,
                clock
        );
        pool.start(minWorkers, maxWorkers);
        workerPool = pool;
        journal.log(EventJournal.JournalEvent.of("workers.start", ACTOR, "workers", "started", null,
                Map.of("min", minWorkers, "max", maxWorkers)));
    }

    public void startWorkers() {
        startWorkers(settings.minWorkers(), settings.maxWorkers());
    }

    public void stopWorkers(boolean graceful) {
        WorkerPool pool = workerPool;
        if (pool == null || !pool.isRunning()) {
            return;
        }
        pool.stop(graceful);
        journal.log(EventJournal.JournalEvent.of("workers.stop", ACTOR, "workers", "stopped", null,
                Map.of("graceful", graceful)));
    }

    public Optional<WorkerStats> workerStats() {
        WorkerPool pool = workerPool;
        return pool == null ? Optional.empty() : Optional.of(pool.stats());
    }

    public boolean isHalted() {
        return halted.get();
    }

    public void resumeAfterHalt() {
        if (halted.compareAndSet(true, false)) {
            String reason = haltReason;
            haltReason = null;
            budget.reset();
            workQueue.signalWork();
            log.info("Engine resumed after halt ({})", reason);
            journal.log(EventJournal.JournalEvent.of("engine.resume", ACTOR, "engine", "resumed", null,
                    Map.of("halt_reason", reason == null ? "" : reason)));
        }
    }

    public OptimizeOutcome optimize() {
        Map<String, Integer> maxRetries = new LinkedHashMap<>();
        retryEngine.adaptAll();
        for (Map.Entry<TaskCategory, CategoryStats> e : retryEngine.stats().categories().entrySet()) {
            maxRetries.put(e.getKey().key(), e.getValue().policy().maxRetries());
        }
        int purged = cleanup(Duration.ofMillis(settings.finishedRetentionMs()));
        int expired = cache.cleanupExpired();
        int closed = database.runPoolMaintenance();
        int budgetPerHour = budget.budgetPerHour();
        if (budget.currentStatus() == BudgetStatus.HEALTHY) {
            int ceiling = settings.budgetPerHour() * 2;
            int grown = Math.min(ceiling, Math.max(budgetPerHour + 1, (int) Math.round(budgetPerHour * 1.2d)));
            if (grown > budgetPerHour) {
                budget.adjustBudget(grown);
                budgetPerHour = grown;
            }
        }
        OptimizeOutcome out = new OptimizeOutcome(maxRetries, purged, expired, closed, budgetPerHour, confidence.thresholds());
        journal.log(EventJournal.JournalEvent.of("engine.optimize", ACTOR, "engine", "ok", null,
                Map.of("purged_tasks", purged, "expired_cache_entries", expired, "budget_per_hour", budgetPerHour)));
        return out;
    }

    public HealthReport health() {
        List<String> issues = new ArrayList<>();
        List<String> recommendations = new ArrayList<>();
        boolean dbOk = databaseReachable();
        if (!dbOk) {
            issues.add("Task store unreachable");
        }

        RetryStats retry = retryEngine.stats();
        double retryRate = retry.overallSuccessRate();
        if (retryRate < RETRY_HEALTH_FLOOR) {
            issues.add(String.format("Retry success rate low: %.0f%%", retryRate * 100.0d));
        }
        List<String> openCircuits = new ArrayList<>();
        for (Map.Entry<TaskCategory, CategoryStats> e : retry.categories().entrySet()) {
            if (e.getValue().breaker().state() == CircuitState.OPEN) {
                openCircuits.add(e.getKey().key());
            }
        }
        if (!openCircuits.isEmpty()) {
            issues.add("Open circuits: " + String.join(", ", openCircuits));
            recommendations.add("Check the dependencies behind: " + String.join(", ", openCircuits));
        }

        int depth = dbOk ? taskStore.queueDepth() : -1;
        if (depth > BACKLOG_WARNING) {
            issues.add("Large backlog: " + depth + " pending tasks");
            recommendations.add("Raise maxWorkers or review scale-up settings");
        }

        BudgetStatus budgetStatus = budget.currentStatus();
        if (budgetStatus == BudgetStatus.CRITICAL || budgetStatus == BudgetStatus.EXCEEDED) {
            issues.add("Error budget " + budgetStatus.name().toLowerCase());
            recommendations.addAll(budget.report().recommendations());
        }

        DegradationLevel level = degradation.degradationLevel();
        boolean canContinue = degradation.canContinue();
        if (level.worseThan(DegradationLevel.MODERATE)) {
            issues.add("Degradation level " + level.name().toLowerCase());
            recommendations.add("Restore failed components: " + String.join(", ", degradation.report().failed()));
        }
        if (halted.get()) {
            issues.add("Queued work halted: " + haltReason);
        }

        String status;
        if (!dbOk || !canContinue) {
            status = "critical";
        } else if (!issues.isEmpty()) {
            status = "degraded";
        } else {
            status = "healthy";
        }
        HealthReport report = new HealthReport(
                status,
                List.copyOf(issues),
                List.copyOf(recommendations),
                dbOk,
                depth,
                retryRate,
                List.copyOf(openCircuits),
                budgetStatus,
                level,
                canContinue,
                halted.get(),
                clock.instant().toString()
        );
        journal.log(EventJournal.JournalEvent.of("engine.health", ACTOR, "engine", status, null,
                Map.of("issues", report.issues().size(), "db_ok", dbOk)));
        return report;
    }

    public EngineStats stats() {
        return new EngineStats(
                taskStore.status(),
                workerStats().orElse(null),
                retryEngine.stats(),
                cache.stats(),
                database.poolStats(),
                budget.report(),
                degradation.report(),
                confidence.report(),
                new ActionCounters(
                        totalActions.get(),
                        autonomousActions.get(),
                        promptsAvoided.get(),
                        cacheShortCircuits.get(),
                        degradedActions.get(),
                        absorbedFailures.get(),
                        budgetStops.get()
                ),
                halted.get(),
                haltReason
        );
    }

    public void registerHandler(TaskHandler handler) {
        handlers.register(handler);
    }

    public DegradationRegistry degradation() {
        return degradation;
    }

    public ErrorBudget budget() {
        return budget;
    }

    public RetryEngine retryEngine() {
        return retryEngine;
    }

    public ResultCache<Object> cache() {
        return cache;
    }

    public ConfidenceExecutor confidenceExecutor() {
        return confidence;
    }

    public EventJournal journal() {
        return journal;
    }

    public EngineSettings settings() {
        return settings;
    }

    @Override
    public void close() {
        stopWorkers(true);
        database.close();
    }

    private <T> Protected<T> protect(ProtectedAction<T> action) {
        totalActions.incrementAndGet();
        if (action.cacheKey() != null) {
            Optional<Object> hit = cache.get(action.cacheKey());
            if (hit.isPresent()) {
                cacheShortCircuits.incrementAndGet();
                @SuppressWarnings("unchecked")
                T cached = (T) hit.get();
                return Protected.succeeded(cached);
            }
        }
        ActionContext ctx = action.context() != null
                ? action.context()
                : ActionContext.builder().category(action.category()).build();
        double score = action.confidence() != null
                ? action.confidence()
                : confidence.confidence(action.description(), ctx);
        ExecutionStrategy strategy = confidence.strategy(score);
        if (strategy == ExecutionStrategy.ASK_FIRST && degradation.canContinue()) {
            strategy = ExecutionStrategy.REVERSIBLE;
            promptsAvoided.incrementAndGet();
        }
        if (strategy.autonomous()) {
            autonomousActions.incrementAndGet();
        }
        T result;
        try {
            result = confidence.execute(action.actionId(), action.description(),
                    () -> retryEngine.executeWithRetry(action.category(), action.work()), score, strategy, ctx);
        } catch (Exception error) {
            return onFailure(action, error);
        }
        degradation.restoreComponent(action.component());
        if (action.cacheKey() != null && result != null) {
            Duration ttl = action.cacheTtl() == null ? Duration.ofMillis(settings.cacheDefaultTtlMs()) : action.cacheTtl();
            cache.set(action.cacheKey(), result, ttl, action.cacheTags());
        }
        return Protected.succeeded(result);
    }

    private <T> Protected<T> onFailure(ProtectedAction<T> action, Exception error) {
        ErrorKind kind = ErrorClassifier.classify(error);
        Optional<DegradedOutcome> degraded = degradation.handleFailure(action.component(), error);
        BudgetDecision decision = budget.recordError(error, action.category().key());
        if (!decision.shouldContinue()) {
            budgetStops.incrementAndGet();
            journal.log(EventJournal.JournalEvent.of("budget.stop", ACTOR, "category/" + action.category().key(),
                    decision.status().name(), null,
                    Map.of("reason", decision.reason(), "recommendation", decision.recommendation(),
                            "confidence", decision.confidence())));
        }
        if (degraded.isPresent()) {
            DegradedOutcome d = degraded.get();
            journal.log(EventJournal.JournalEvent.of("degradation.applied", ACTOR, "component/" + action.component(),
                    d.workaroundName(), null,
                    Map.of("quality_loss", d.qualityLoss(), "error", ErrorClassifier.errorType(error))));
            if (!decision.shouldContinue()) {
                return Protected.failed(new BudgetExceededException(decision, error), decision);
            }
            degradedActions.incrementAndGet();
            return Protected.degraded(d, decision);
        }
        if (decision.shouldContinue() && kind == ErrorKind.TRANSIENT) {
            absorbedFailures.incrementAndGet();
            log.warn("Absorbed failure of action {} within error budget: {}", action.actionId(), describe(error));
            return Protected.absorbed(error, decision);
        }
        return Protected.failed(error, decision);
    }

    private boolean processClaimed(TaskStore.ClaimedTask claimed, String workerId) {
        TaskRecord task = claimed.task();
        Optional<TaskHandler> handler = handlers.find(task.category());
        if (handler.isEmpty()) {
            handler = handlers.find(TaskCategory.DEFAULT);
        }
        if (handler.isEmpty()) {
            String error = "no handler registered for category " + task.category().key();
            if (leaseHeld(taskStore.fail(claimed, error), workerId, task, "failed")) {
                journalTask("task.fail", workerId, task, "failed", Map.of("error", error));
            }
            workQueue.signalWork();
            return false;
        }
        TaskHandler h = handler.get();
        TaskContext ctx = new TaskContext(
                task.taskId(),
                task.description(),
                task.category(),
                task.payload(),
                task.checkpoint(),
                task.attempts(),
                (progress, checkpoint) -> taskStore.updateProgress(task.taskId(), progress, checkpoint)
        );
        ProtectedAction<String> action = ProtectedAction.<String>builder(task.description(), () -> h.execute(ctx))
                .actionId(task.taskId())
                .category(task.category())
                .component(task.category().key())
                .context(ActionContext.builder().category(task.category()).build())
                .build();
        Protected<String> outcome = protect(action);
        switch (outcome.kind()) {
            case SUCCEEDED:
                if (!leaseHeld(taskStore.complete(claimed, outcome.value()), workerId, task, "completed")) {
                    return false;
                }
                journalTask("task.complete", workerId, task, "completed", Map.of("attempts", task.attempts()));
                workQueue.signalWork();
                return true;
            case DEGRADED:
                if (!leaseHeld(taskStore.complete(claimed, outcome.degraded().toJson()), workerId, task, "degraded")) {
                    return false;
                }
                journalTask("task.complete", workerId, task, "degraded",
                        Map.of("workaround", outcome.degraded().workaroundName(),
                                "quality_loss", outcome.degraded().qualityLoss()));
                workQueue.signalWork();
                return true;
            case ABSORBED:
                if (leaseHeld(taskStore.fail(claimed, describe(outcome.error())), workerId, task, "failed")) {
                    journalTask("task.fail", workerId, task, "failed", Map.of("error", describe(outcome.error())));
                }
                workQueue.signalWork();
                return false;
            default:
                return onQueuedFailure(claimed, workerId, task, outcome);
        }
    }

    private boolean onQueuedFailure(TaskStore.ClaimedTask claimed, String workerId, TaskRecord task, Protected<String> outcome) {
        Exception error = outcome.error();
        ErrorKind kind = ErrorClassifier.classify(error);
        if (Thread.currentThread().isInterrupted() || error instanceof InterruptedException) {
            if (leaseHeld(taskStore.requeue(claimed, "interrupted: " + describe(error)), workerId, task, "requeued")) {
                journalTask("task.requeue", workerId, task, "interrupted", Map.of("error", describe(error)));
            }
            return false;
        }
        BudgetDecision decision = outcome.decision();
        if (decision != null && !decision.shouldContinue()) {
            halt(decision);
            if (kind != ErrorKind.FATAL) {
                if (leaseHeld(taskStore.requeue(claimed, describe(error)), workerId, task, "requeued")) {
                    journalTask("task.requeue", workerId, task, "halted", Map.of("reason", decision.reason()));
                }
                return false;
            }
        }
        if (leaseHeld(taskStore.fail(claimed, describe(error)), workerId, task, "failed")) {
            journalTask("task.fail", workerId, task, "failed", Map.of("error", describe(error), "kind", kind.name()));
        }
        workQueue.signalWork();
        return false;
    }

    /** A false write means another process re-queued the task under a new lease. */
    private boolean leaseHeld(boolean written, String workerId, TaskRecord task, String attempted) {
        if (!written) {
            log.warn("Lease on task {} was lost before it could be marked {}", task.taskId(), attempted);
            journalTask("task.lease_lost", workerId, task, "stale", Map.of("attempted", attempted));
        }
        return written;
    }

    private void halt(BudgetDecision decision) {
        if (halted.compareAndSet(false, true)) {
            haltReason = decision.reason();
            log.warn("Halting queued work: {} ({})", decision.reason(), decision.recommendation());
            journal.log(EventJournal.JournalEvent.of("engine.halt", ACTOR, "engine", "halted", null,
                    Map.of("reason", decision.reason(), "recommendation", decision.recommendation())));
        }
    }

    private void journalTask(String action, String workerId, TaskRecord task, String result, Map<String, Object> details) {
        journal.log(EventJournal.JournalEvent.of(action, workerId, "task/" + task.taskId(), result, task.taskId(), details));
    }

    private boolean databaseReachable() {
        try (PooledHandle<Connection> h = database.lease()) {
            return h.get().isValid(1);
        } catch (SQLException | RuntimeException e) {
            log.warn("Task store health check failed", e);
            return false;
        }
    }

    private void registerConfiguredScriptHandlers() {
        for (Map.Entry<TaskCategory, List<String>> e : settings.scriptHandlers().entrySet()) {
            handlers.register(new ScriptTaskHandler(e.getKey(), e.getValue(), settings.scriptTimeoutMs()));
            log.info("Registered script handler for {}: {}", e.getKey().key(), e.getValue());
        }
    }

    private static Map<TaskCategory, RetryPolicy> retryPolicies(EngineSettings settings) {
        Map<TaskCategory, RetryPolicy> out = new EnumMap<>(TaskCategory.class);
        for (Map.Entry<TaskCategory, EngineSettings.RetryPolicySpec> e : settings.retryPolicies().entrySet()) {
            out.put(e.getKey(), RetryPolicy.fromSpec(e.getKey(), e.getValue()));
        }
        return out;
    }

    private static String describe(Throwable error) {
        String type = ErrorClassifier.errorType(error);
        String message = error.getMessage();
        return message == null || message.isBlank() ? type : type + ": " + message;
    }

    private enum OutcomeKind {
        SUCCEEDED,
        DEGRADED,
        ABSORBED,
        FAILED
    }

    private record Protected<T>(OutcomeKind kind, T value, DegradedOutcome degraded, Exception error, BudgetDecision decision) {
        static <T> Protected<T> succeeded(T value) {
            return new Protected<>(OutcomeKind.SUCCEEDED, value, null, null, null);
        }

        static <T> Protected<T> degraded(DegradedOutcome outcome, BudgetDecision decision) {
            return new Protected<>(OutcomeKind.DEGRADED, null, outcome, null, decision);
        }

        static <T> Protected<T> absorbed(Exception error, BudgetDecision decision) {
            return new Protected<>(OutcomeKind.ABSORBED, null, null, error, decision);
        }

        static <T> Protected<T> failed(Exception error, BudgetDecision decision) {
            return new Protected<>(OutcomeKind.FAILED, null, null, error, decision);
        }
    }

    public record ActionCounters(
            long totalActions,
            long autonomousActions,
            long promptsAvoided,
            long cacheShortCircuits,
            long degradedActions,
            long absorbedFailures,
            long budgetStops
    ) {
    }

    public record OptimizeOutcome(
            Map<String, Integer> maxRetriesByCategory,
            int purgedTasks,
            int expiredCacheEntries,
            int idleConnectionsClosed,
            int budgetPerHour,
            Thresholds thresholds
    ) {
    }

    public record HealthReport(
            String status,
            List<String> issues,
            List<String> recommendations,
            boolean dbOk,
            int queueDepth,
            double retrySuccessRate,
            List<String> openCircuits,
            BudgetStatus budgetStatus,
            DegradationLevel degradationLevel,
            boolean canContinue,
            boolean halted,
            String checkedAt
    ) {
    }

    public record EngineStats(
            TaskStore.QueueStatus queue,
            WorkerStats workers,
            RetryStats retry,
            CacheStats cache,
            PoolStats connectionPool,
            BudgetReport budget,
            DegradationReport degradation,
            ConfidenceReport confidence,
            ActionCounters actions,
            boolean halted,
            String haltReason
    ) {
    }
}
