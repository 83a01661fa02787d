package io.steadyloop.cli;

import io.steadyloop.config.SteadyLoopConfig;
import io.steadyloop.model.TaskCategory;
import io.steadyloop.model.TaskPriority;
import io.steadyloop.model.TaskRecord;
import io.steadyloop.model.TaskStatus;
import io.steadyloop.runtime.SteadyLoopEngine;
import io.steadyloop.storage.TaskStore;
import io.steadyloop.util.Jsons;
import io.steadyloop.worker.WorkerStats;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicBoolean;

@Command(
        name = "steadyloop",
        mixinStandardHelpOptions = true,
        description = "SteadyLoop durable task queue and resilience engine",
        subcommands = {
                SteadyLoopCommand.InitCommand.class,
                SteadyLoopCommand.SubmitCommand.class,
                SteadyLoopCommand.RunCommand.class,
                SteadyLoopCommand.TaskCommand.class,
                SteadyLoopCommand.TasksCommand.class,
                SteadyLoopCommand.CancelCommand.class,
                SteadyLoopCommand.ResumeCommand.class,
                SteadyLoopCommand.CleanupCommand.class,
                SteadyLoopCommand.OptimizeCommand.class,
                SteadyLoopCommand.StatsCommand.class,
                SteadyLoopCommand.HealthCommand.class,
                SteadyLoopCommand.JournalTailCommand.class
        }
)
public final class SteadyLoopCommand implements Runnable {
    @Option(names = {"--root"}, description = "Data root directory", defaultValue = "data")
    String root;

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        out().println("Use subcommands: init | submit | run | task | tasks | cancel | resume | cleanup | optimize | stats | health | journal-tail");
    }

    PrintWriter out() {
        return spec.commandLine().getOut();
    }

    SteadyLoopEngine engine() {
        return new SteadyLoopEngine(SteadyLoopConfig.fromRoot(root));
    }

    @Command(name = "init", description = "Initialize directories and SQLite schema, re-queue interrupted tasks")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        SteadyLoopCommand parent;

        @Override
        public Integer call() {
            try (SteadyLoopEngine engine = parent.engine()) {
                engine.init();
                Map<String, Object> out = new LinkedHashMap<>();
                out.put("root", SteadyLoopConfig.fromRoot(parent.root).rootDir().toString());
                out.put("resumed", engine.resumedAtStartup());
                parent.out().println(Jsons.toJson(out));
            }
            return 0;
        }
    }

    @Command(name = "submit", description = "Submit a task to the durable queue")
    static final class SubmitCommand implements Callable<Integer> {
        @ParentCommand
        SteadyLoopCommand parent;

        @Option(names = {"--id"}, description = "Task id; generated when omitted")
        String taskId;

        @Option(names = {"--description"}, required = true, description = "What the task does")
        String description;

        @Option(names = {"--category"}, description = "network|database|timeout|resource|default; inferred when omitted")
        String category;

        @Option(names = {"--priority"}, defaultValue = "normal", description = "critical|high|normal|low")
        String priority;

        @Option(names = {"--deadline-ms"}, description = "Absolute deadline, epoch millis")
        Long deadlineAtMs;

        @Option(names = {"--depends-on"}, split = ",", description = "Comma-separated task ids that must complete first")
        List<String> dependsOn;

        @Option(names = {"--payload"}, description = "Opaque payload passed to the handler")
        String payload;

        @Override
        public Integer call() {
            String id = taskId == null || taskId.isBlank() ? "task_" + UUID.randomUUID() : taskId;
            try (SteadyLoopEngine engine = parent.engine()) {
                engine.init();
                boolean accepted = engine.submit(
                        id,
                        description,
                        category == null ? null : TaskCategory.fromString(category),
                        TaskPriority.fromString(priority),
                        deadlineAtMs,
                        dependsOn == null ? List.of() : dependsOn,
                        payload
                );
                Map<String, Object> out = new LinkedHashMap<>();
                out.put("taskId", id);
                out.put("accepted", accepted);
                parent.out().println(Jsons.toJson(out));
                return accepted ? 0 : 1;
            }
        }
    }

    @Command(name = "run", description = "Run the autoscaling worker pool until interrupted")
    static final class RunCommand implements Callable<Integer> {
        @ParentCommand
        SteadyLoopCommand parent;

        @Option(names = {"--min-workers"}, description = "Minimum workers; settings value when omitted")
        Integer minWorkers;

        @Option(names = {"--max-workers"}, description = "Maximum workers; settings value when omitted")
        Integer maxWorkers;

        @Option(names = {"--drain"}, defaultValue = "false", description = "Exit once the queue is empty and workers are idle")
        boolean drain;

        @Option(names = {"--report-interval-ms"}, defaultValue = "5000", description = "Worker stats print interval")
        long reportIntervalMs;

        @Option(names = {"--force"}, defaultValue = "false", description = "Interrupt in-flight tasks on shutdown")
        boolean force;

        @Override
        public Integer call() throws Exception {
            SteadyLoopEngine engine = parent.engine();
            engine.init();
            int min = minWorkers == null ? engine.settings().minWorkers() : minWorkers;
            int max = maxWorkers == null ? Math.max(min, engine.settings().maxWorkers()) : maxWorkers;
            AtomicBoolean running = new AtomicBoolean(true);
            Thread main = Thread.currentThread();
            long joinMs = engine.settings().gracefulShutdownMs() + 1_000L;
            Thread hook = new Thread(() -> {
                if (!running.getAndSet(false)) {
                    return;
                }
                main.interrupt();
                try {
                    main.join(joinMs);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }, "steadyloop-shutdown-hook");
            Runtime.getRuntime().addShutdownHook(hook);

            engine.startWorkers(min, max);
            long interval = Math.max(100L, reportIntervalMs);
            try {
                while (running.get()) {
                    try {
                        Thread.sleep(interval);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        break;
                    }
                    Optional<WorkerStats> stats = engine.workerStats();
                    stats.ifPresent(s -> parent.out().println(Jsons.toCompactJson(s)));
                    if (drain && stats.isPresent() && stats.get().busyWorkers() == 0
                            && engine.stats().queue().byStatus().getOrDefault(TaskStatus.PENDING.name(), 0) == 0) {
                        break;
                    }
                }
            } finally {
                // Clear the flag so the graceful join below is not cut short.
                boolean interrupted = Thread.interrupted();
                engine.stopWorkers(!force);
                parent.out().println(Jsons.toJson(engine.stats()));
                engine.close();
                // Leaving on our own (drain): the hook must not wait on this thread during exit.
                if (running.getAndSet(false)) {
                    Runtime.getRuntime().removeShutdownHook(hook);
                }
                if (interrupted) {
                    Thread.currentThread().interrupt();
                }
            }
            return engine.isHalted() ? 2 : 0;
        }
    }

    @Command(name = "task", description = "Show a task by id")
    static final class TaskCommand implements Callable<Integer> {
        @ParentCommand
        SteadyLoopCommand parent;

        @Parameters(index = "0", description = "Task id")
        String taskId;

        @Override
        public Integer call() {
            try (SteadyLoopEngine engine = parent.engine()) {
                engine.init();
                Optional<TaskRecord> task = engine.getTask(taskId);
                if (task.isEmpty()) {
                    parent.out().println("{\"error\":\"task not found\"}");
                    return 1;
                }
                parent.out().println(Jsons.toJson(task.get()));
                return 0;
            }
        }
    }

    @Command(name = "tasks", description = "List tasks")
    static final class TasksCommand implements Callable<Integer> {
        @ParentCommand
        SteadyLoopCommand parent;

        @Option(names = {"--status"}, description = "Filter by task status")
        String status;

        @Option(names = {"--limit"}, defaultValue = "50", description = "Max number of rows")
        int limit;

        @Option(names = {"--offset"}, defaultValue = "0", description = "Pagination offset")
        int offset;

        @Override
        public Integer call() {
            TaskStatus filter = status == null || status.isBlank() ? null : TaskStatus.valueOf(status.trim().toUpperCase());
            try (SteadyLoopEngine engine = parent.engine()) {
                engine.init();
                parent.out().println(Jsons.toJson(engine.listTasks(filter, limit, offset)));
            }
            return 0;
        }
    }

    @Command(name = "cancel", description = "Cancel a pending or blocked task")
    static final class CancelCommand implements Callable<Integer> {
        @ParentCommand
        SteadyLoopCommand parent;

        @Parameters(index = "0", description = "Task id")
        String taskId;

        @Option(names = {"--reason"}, defaultValue = "cancelled by operator", description = "Recorded as the task error")
        String reason;

        @Override
        public Integer call() {
            try (SteadyLoopEngine engine = parent.engine()) {
                engine.init();
                TaskStore.CancelResult out = engine.cancel(taskId, reason);
                parent.out().println(Jsons.toJson(out));
                return out.cancelled() ? 0 : 1;
            }
        }
    }

    @Command(name = "resume", description = "Re-queue tasks left in progress by a crashed run")
    static final class ResumeCommand implements Callable<Integer> {
        @ParentCommand
        SteadyLoopCommand parent;

        @Override
        public Integer call() {
            try (SteadyLoopEngine engine = parent.engine()) {
                engine.init();
                List<String> resumed = new ArrayList<>(engine.resumedAtStartup());
                resumed.addAll(engine.resumeInterrupted());
                parent.out().println(Jsons.toJson(Map.of("resumed", resumed)));
            }
            return 0;
        }
    }

    @Command(name = "cleanup", description = "Purge finished tasks older than a retention window")
    static final class CleanupCommand implements Callable<Integer> {
        @ParentCommand
        SteadyLoopCommand parent;

        @Option(names = {"--older-than-hours"}, defaultValue = "24", description = "Retention window in hours")
        long olderThanHours;

        @Override
        public Integer call() {
            try (SteadyLoopEngine engine = parent.engine()) {
                engine.init();
                int purged = engine.cleanup(Duration.ofHours(Math.max(0L, olderThanHours)));
                parent.out().println(Jsons.toJson(Map.of("purged", purged)));
            }
            return 0;
        }
    }

    @Command(name = "optimize", description = "Run one self-tuning pass")
    static final class OptimizeCommand implements Callable<Integer> {
        @ParentCommand
        SteadyLoopCommand parent;

        @Override
        public Integer call() {
            try (SteadyLoopEngine engine = parent.engine()) {
                engine.init();
                parent.out().println(Jsons.toJson(engine.optimize()));
            }
            return 0;
        }
    }

    @Command(name = "stats", description = "Show queue, cache, pool and governor statistics")
    static final class StatsCommand implements Callable<Integer> {
        @ParentCommand
        SteadyLoopCommand parent;

        @Override
        public Integer call() {
            try (SteadyLoopEngine engine = parent.engine()) {
                engine.init();
                parent.out().println(Jsons.toJson(engine.stats()));
            }
            return 0;
        }
    }

    @Command(name = "health", description = "Run the health check; exit code 1 when not healthy")
    static final class HealthCommand implements Callable<Integer> {
        @ParentCommand
        SteadyLoopCommand parent;

        @Override
        public Integer call() {
            try (SteadyLoopEngine engine = parent.engine()) {
                engine.init();
                SteadyLoopEngine.HealthReport out = engine.health();
                parent.out().println(Jsons.toJson(out));
                return "healthy".equals(out.status()) ? 0 : 1;
            }
        }
    }

    @Command(name = "journal-tail", description = "Show the most recent journal events")
    static final class JournalTailCommand implements Callable<Integer> {
        @ParentCommand
        SteadyLoopCommand parent;

        @Option(names = {"--action"}, description = "Only events whose action starts with this prefix")
        String action;

        @Option(names = {"--limit"}, defaultValue = "20", description = "Max number of events")
        int limit;

        @Override
        public Integer call() {
            try (SteadyLoopEngine engine = parent.engine()) {
                engine.init();
                for (String line : engine.journal().tail(action, limit)) {
                    parent.out().println(line);
                }
            }
            return 0;
        }
    }
}
