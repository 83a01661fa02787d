package io.steadyloop.storage;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Blocking front of the {@link TaskStore}: workers wait a bounded time for new work instead of
 * spinning on the database. Anything that can make a task ready (submit, completion of a
 * dependency, re-queue) should call {@link #signalWork()}.
 */
public final class WorkQueue {
    private final TaskStore store;
    private final ReentrantLock lock;
    private final Condition workAvailable;
    private long generation;

    public WorkQueue(TaskStore store) {
        this.store = store;
        this.lock = new ReentrantLock();
        this.workAvailable = lock.newCondition();
    }

    public TaskStore store() {
        return store;
    }

    public boolean submit(TaskStore.Submission submission) {
        boolean inserted = store.submit(submission);
        if (inserted) {
            signalWork();
        }
        return inserted;
    }

    /**
     * Claims the next ready task, waiting up to {@code wait} for one to appear. Returns empty on
     * timeout or interrupt.
     */
    public Optional<TaskStore.ClaimedTask> poll(String workerId, Duration wait) {
        long seen;
        lock.lock();
        try {
            seen = generation;
        } finally {
            lock.unlock();
        }
        Optional<TaskStore.ClaimedTask> claimed = store.claimNext(workerId);
        if (claimed.isPresent() || wait.isZero() || wait.isNegative()) {
            return claimed;
        }
        lock.lock();
        try {
            long remaining = wait.toNanos();
            while (generation == seen && remaining > 0L) {
                remaining = workAvailable.awaitNanos(remaining);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        } finally {
            lock.unlock();
        }
        return store.claimNext(workerId);
    }

    public void signalWork() {
        lock.lock();
        try {
            generation++;
            workAvailable.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public int depth() {
        return store.queueDepth();
    }
}
