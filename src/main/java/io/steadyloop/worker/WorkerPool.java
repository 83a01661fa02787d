package io.steadyloop.worker;

import io.steadyloop.storage.TaskStore;
import io.steadyloop.storage.WorkQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BooleanSupplier;

public final class WorkerPool {
    private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);
    private static final long SHUTDOWN_POLL_MS = 50L;

    private final WorkQueue queue;
    private final TaskProcessor processor;
    private final CpuGauge cpuGauge;
    private final BooleanSupplier paused;
    private final Runnable monitorHook;
    private final Clock clock;
    private final ConcurrentHashMap<Integer, WorkerSlot> workers = new ConcurrentHashMap<>();
    private final AtomicInteger target = new AtomicInteger(0);
    private final AtomicInteger peak = new AtomicInteger(0);
    private final AtomicBoolean accepting = new AtomicBoolean(false);
    private final AtomicLong processed = new AtomicLong(0L);
    private final AtomicLong failed = new AtomicLong(0L);
    private final AtomicLong scaleUps = new AtomicLong(0L);
    private final AtomicLong scaleDowns = new AtomicLong(0L);
    private volatile WorkerPoolSettings settings;
    private ScheduledExecutorService monitor;
    private boolean running;

    public WorkerPool(WorkQueue queue, TaskProcessor processor, WorkerPoolSettings settings,
                      CpuGauge cpuGauge, BooleanSupplier paused, Runnable monitorHook, Clock clock) {
        this.queue = queue;
        this.processor = processor;
        this.settings = settings;
        this.cpuGauge = cpuGauge == null ? CpuGauge.system() : cpuGauge;
        this.paused = paused == null ? () -> false : paused;
        this.monitorHook = monitorHook;
        this.clock = clock;
    }

    public void start() {
        start(settings.minWorkers(), settings.maxWorkers());
    }

    public synchronized void start(int minWorkers, int maxWorkers) {
        if (running) {
            throw new IllegalStateException("Worker pool already running");
        }
        settings = settings.withBounds(minWorkers, maxWorkers);
        running = true;
        accepting.set(true);
        target.set(minWorkers);
        for (int i = 0; i < minWorkers; i++) {
            spawn(i);
        }
        peak.accumulateAndGet(minWorkers, Math::max);
        monitor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "steadyloop-worker-monitor");
            t.setDaemon(true);
            return t;
        });
        long intervalMs = Math.max(1L, settings.monitorInterval().toMillis());
        monitor.scheduleWithFixedDelay(this::monitorTick, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info("Worker pool started: min={} max={} autoscaling={}", minWorkers, maxWorkers, settings.autoscaling());
    }

    public void stop(boolean graceful) {
        ScheduledExecutorService m;
        synchronized (this) {
            if (!running) {
                return;
            }
            running = false;
            accepting.set(false);
            m = monitor;
            monitor = null;
        }
        queue.signalWork();
        if (graceful) {
            long deadline = System.nanoTime() + settings.gracefulShutdown().toNanos();
            while (busyCount() > 0 && System.nanoTime() < deadline) {
                try {
                    Thread.sleep(SHUTDOWN_POLL_MS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }
        if (m != null) {
            m.shutdownNow();
        }
        List<WorkerSlot> slots = new ArrayList<>(workers.values());
        if (!graceful) {
            for (WorkerSlot slot : slots) {
                slot.thread.interrupt();
            }
        }
        long joinMs = settings.joinTimeout().toMillis();
        for (WorkerSlot slot : slots) {
            try {
                slot.thread.join(joinMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            if (slot.thread.isAlive()) {
                log.warn("Worker {} did not stop within {}ms", slot.thread.getName(), joinMs);
            }
        }
        log.info("Worker pool stopped (graceful={}, processed={}, failed={})", graceful, processed.get(), failed.get());
    }

    public synchronized boolean isRunning() {
        return running;
    }

    public WorkerStats stats() {
        WorkerPoolSettings s = settings;
        boolean isRunning;
        synchronized (this) {
            isRunning = running;
        }
        return new WorkerStats(
                isRunning,
                paused.getAsBoolean(),
                target.get(),
                workers.size(),
                busyCount(),
                peak.get(),
                s.minWorkers(),
                s.maxWorkers(),
                processed.get(),
                failed.get(),
                scaleUps.get(),
                scaleDowns.get()
        );
    }

    public void monitorTick() {
        try {
            WorkerPoolSettings s = settings;
            if (s.autoscaling() && accepting.get()) {
                int depth = queue.depth();
                int current = Math.max(1, target.get());
                double cpu = cpuGauge.cpuPercent();
                if ((double) depth / current > s.scaleUpQueueDepth() && cpu < s.cpuThresholdPercent()) {
                    scaleUp(depth, cpu);
                } else if (depth == 0 && hasIdleWorker(s)) {
                    scaleDown();
                }
            }
            if (monitorHook != null) {
                monitorHook.run();
            }
        } catch (RuntimeException e) {
            log.warn("Worker pool monitor tick failed", e);
        }
    }

    private synchronized void scaleUp(int depth, double cpu) {
        int current = target.get();
        if (!running || current >= settings.maxWorkers()) {
            return;
        }
        target.set(current + 1);
        if (!workers.containsKey(current)) {
            spawn(current);
        }
        scaleUps.incrementAndGet();
        peak.accumulateAndGet(current + 1, Math::max);
        log.info("Scaled workers up {} -> {} (queueDepth={}, cpu={}%)", current, current + 1, depth, Math.round(cpu));
    }

    private synchronized void scaleDown() {
        int current = target.get();
        if (!running || current <= settings.minWorkers()) {
            return;
        }
        target.set(current - 1);
        scaleDowns.incrementAndGet();
        queue.signalWork();
        log.info("Scaled workers down {} -> {}", current, current - 1);
    }

    private boolean hasIdleWorker(WorkerPoolSettings s) {
        long now = clock.millis();
        long idleMs = s.scaleDownIdle().toMillis();
        for (WorkerSlot slot : workers.values()) {
            if (!slot.busy.get() && now - slot.lastActivityMs.get() > idleMs) {
                return true;
            }
        }
        return false;
    }

    private int busyCount() {
        int n = 0;
        for (WorkerSlot slot : workers.values()) {
            if (slot.busy.get()) {
                n++;
            }
        }
        return n;
    }

    // Caller holds the pool monitor.
    private void spawn(int index) {
        WorkerSlot slot = new WorkerSlot(index, clock.millis());
        Thread t = new Thread(() -> workerLoop(slot), "steadyloop-worker-" + index);
        t.setDaemon(false);
        slot.thread = t;
        workers.put(index, slot);
        t.start();
    }

    private synchronized boolean keepRunning(WorkerSlot slot) {
        if (accepting.get() && slot.index < target.get()) {
            return true;
        }
        workers.remove(slot.index, slot);
        return false;
    }

    private void workerLoop(WorkerSlot slot) {
        String workerId = Thread.currentThread().getName();
        log.debug("Worker {} started", workerId);
        try {
            while (keepRunning(slot)) {
                if (paused.getAsBoolean()) {
                    if (!pause()) {
                        break;
                    }
                    continue;
                }
                Optional<TaskStore.ClaimedTask> claimed = queue.poll(workerId, settings.pollTimeout());
                if (claimed.isEmpty()) {
                    if (Thread.currentThread().isInterrupted()) {
                        break;
                    }
                    continue;
                }
                if (!accepting.get() || paused.getAsBoolean()) {
                    queue.store().requeue(claimed.get(), "worker pool stopping or paused");
                    queue.signalWork();
                    continue;
                }
                runClaimed(slot, claimed.get(), workerId);
            }
        } finally {
            workers.remove(slot.index, slot);
            log.debug("Worker {} exited", workerId);
        }
    }

    private void runClaimed(WorkerSlot slot, TaskStore.ClaimedTask task, String workerId) {
        slot.busy.set(true);
        slot.lastActivityMs.set(clock.millis());
        try {
            if (processor.process(task, workerId)) {
                processed.incrementAndGet();
            } else {
                failed.incrementAndGet();
            }
        } catch (RuntimeException e) {
            failed.incrementAndGet();
            log.error("Worker {} failed processing task {}", workerId, task.taskId(), e);
        } finally {
            slot.busy.set(false);
            slot.lastActivityMs.set(clock.millis());
        }
    }

    private boolean pause() {
        try {
            Thread.sleep(Math.max(1L, settings.pollTimeout().toMillis()));
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static final class WorkerSlot {
        private final int index;
        private final AtomicBoolean busy = new AtomicBoolean(false);
        private final AtomicLong lastActivityMs;
        private volatile Thread thread;

        private WorkerSlot(int index, long nowMs) {
            this.index = index;
            this.lastActivityMs = new AtomicLong(nowMs);
        }
    }
}
