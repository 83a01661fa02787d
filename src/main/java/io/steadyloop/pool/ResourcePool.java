package io.steadyloop.pool;

import io.steadyloop.error.PoolExhaustedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

public final class ResourcePool<H> implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ResourcePool.class);

    private final String name;
    private final HandleFactory<H> factory;
    private final PoolSettings settings;
    private final Clock clock;
    private final ReentrantLock lock;
    private final Condition available;
    private final Deque<PooledHandle<H>> idle;
    private final Set<PooledHandle<H>> leased;
    private final ScheduledExecutorService maintenance;
    private final AtomicLong created;
    private final AtomicLong destroyed;
    private final AtomicLong acquired;
    private final AtomicLong released;
    private final AtomicLong timeouts;
    private final AtomicLong healthCheckFailures;
    private int live;
    private int peakLive;
    private boolean closed;

    public ResourcePool(String name, HandleFactory<H> factory, PoolSettings settings) {
        this(name, factory, settings, Clock.systemUTC());
    }

    public ResourcePool(String name, HandleFactory<H> factory, PoolSettings settings, Clock clock) {
        this.name = name;
        this.factory = factory;
        this.settings = settings;
        this.clock = clock;
        this.lock = new ReentrantLock();
        this.available = lock.newCondition();
        this.idle = new ArrayDeque<>();
        this.leased = Collections.newSetFromMap(new IdentityHashMap<>());
        this.created = new AtomicLong(0L);
        this.destroyed = new AtomicLong(0L);
        this.acquired = new AtomicLong(0L);
        this.released = new AtomicLong(0L);
        this.timeouts = new AtomicLong(0L);
        this.healthCheckFailures = new AtomicLong(0L);
        fillToMinimum(true);
        if (settings.maintenanceInterval().isZero() || settings.maintenanceInterval().isNegative()) {
            this.maintenance = null;
        } else {
            this.maintenance = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "steadyloop-pool-" + name);
                t.setDaemon(true);
                return t;
            });
            long intervalMs = settings.maintenanceInterval().toMillis();
            maintenance.scheduleWithFixedDelay(this::maintenanceTick, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        }
        log.info("Pool {} started: min={} max={} maxIdle={}ms", name, settings.minSize(), settings.maxSize(),
                settings.maxIdleTime().toMillis());
    }

    public String name() {
        return name;
    }

    public Optional<PooledHandle<H>> acquire(Duration timeout) {
        long deadline = System.nanoTime() + Math.max(0L, timeout.toNanos());
        while (true) {
            PooledHandle<H> candidate;
            lock.lock();
            try {
                if (closed) {
                    throw new IllegalStateException("Pool is closed: " + name);
                }
                candidate = idle.pollFirst();
                if (candidate == null) {
                    if (live < settings.maxSize()) {
                        reserveSlot();
                    } else {
                        long remaining = deadline - System.nanoTime();
                        if (remaining <= 0L) {
                            timeouts.incrementAndGet();
                            return Optional.empty();
                        }
                        try {
                            available.awaitNanos(remaining);
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                            timeouts.incrementAndGet();
                            return Optional.empty();
                        }
                        continue;
                    }
                }
            } finally {
                lock.unlock();
            }

            if (candidate != null) {
                if (factory.isHealthy(candidate.get())) {
                    return Optional.of(lease(candidate));
                }
                healthCheckFailures.incrementAndGet();
                log.warn("Pool {} discarded unhealthy handle (uses={})", name, candidate.useCount());
                destroy(candidate);
                continue;
            }
            return Optional.of(lease(createReserved()));
        }
    }

    public PooledHandle<H> lease(Duration timeout) {
        return acquire(timeout).orElseThrow(() -> new PoolExhaustedException(name, timeout));
    }

    public PooledHandle<H> lease() {
        return lease(settings.acquireTimeout());
    }

    public void release(PooledHandle<H> handle) {
        if (handle == null) {
            return;
        }
        if (handle.pool() != this) {
            throw new IllegalArgumentException("Handle does not belong to pool " + name);
        }
        boolean wasLeased;
        lock.lock();
        try {
            wasLeased = leased.remove(handle);
        } finally {
            lock.unlock();
        }
        if (!wasLeased) {
            log.debug("Pool {} ignored release of a handle that is not leased", name);
            return;
        }
        released.incrementAndGet();
        boolean reusable = true;
        try {
            factory.reset(handle.get());
        } catch (Exception e) {
            log.warn("Pool {} failed to reset handle on release, discarding it", name, e);
            reusable = false;
        }
        lock.lock();
        try {
            if (reusable && !closed) {
                handle.markReturned(clock.millis());
                idle.addFirst(handle);
                available.signal();
                return;
            }
        } finally {
            lock.unlock();
        }
        destroy(handle);
    }

    public int runMaintenance() {
        List<PooledHandle<H>> expired = new ArrayList<>();
        long now = clock.millis();
        long maxIdleMs = settings.maxIdleTime().toMillis();
        lock.lock();
        try {
            if (closed) {
                return 0;
            }
            Iterator<PooledHandle<H>> oldestFirst = idle.descendingIterator();
            while (oldestFirst.hasNext() && live - expired.size() > settings.minSize()) {
                PooledHandle<H> h = oldestFirst.next();
                if (now - h.lastUsedAtMs() > maxIdleMs) {
                    oldestFirst.remove();
                    expired.add(h);
                }
            }
        } finally {
            lock.unlock();
        }
        for (PooledHandle<H> h : expired) {
            destroy(h);
        }
        if (!expired.isEmpty()) {
            log.debug("Pool {} closed {} idle handle(s)", name, expired.size());
        }
        fillToMinimum(false);
        return expired.size();
    }

    public int liveCount() {
        lock.lock();
        try {
            return live;
        } finally {
            lock.unlock();
        }
    }

    public int idleCount() {
        lock.lock();
        try {
            return idle.size();
        } finally {
            lock.unlock();
        }
    }

    public int leasedCount() {
        lock.lock();
        try {
            return leased.size();
        } finally {
            lock.unlock();
        }
    }

    public PoolStats stats() {
        lock.lock();
        try {
            return new PoolStats(
                    name,
                    live,
                    idle.size(),
                    leased.size(),
                    settings.minSize(),
                    settings.maxSize(),
                    peakLive,
                    created.get(),
                    destroyed.get(),
                    acquired.get(),
                    released.get(),
                    timeouts.get(),
                    healthCheckFailures.get()
            );
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void close() {
        List<PooledHandle<H>> drained;
        lock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            drained = new ArrayList<>(idle);
            idle.clear();
            available.signalAll();
        } finally {
            lock.unlock();
        }
        if (maintenance != null) {
            maintenance.shutdownNow();
        }
        for (PooledHandle<H> h : drained) {
            destroy(h);
        }
        log.info("Pool {} closed ({} handle(s) still leased)", name, leasedCount());
    }

    private void maintenanceTick() {
        try {
            runMaintenance();
        } catch (RuntimeException e) {
            log.warn("Pool {} maintenance cycle failed", name, e);
        }
    }

    private void fillToMinimum(boolean strict) {
        while (true) {
            lock.lock();
            try {
                if (closed || live >= settings.minSize()) {
                    return;
                }
                reserveSlot();
            } finally {
                lock.unlock();
            }
            PooledHandle<H> handle;
            try {
                handle = createReserved();
            } catch (RuntimeException e) {
                if (strict) {
                    throw e;
                }
                log.warn("Pool {} could not refill to minimum size", name, e);
                return;
            }
            lock.lock();
            try {
                idle.addFirst(handle);
                available.signal();
            } finally {
                lock.unlock();
            }
        }
    }

    // Caller holds the lock.
    private void reserveSlot() {
        live++;
        peakLive = Math.max(peakLive, live);
    }

    private PooledHandle<H> createReserved() {
        try {
            H raw = factory.create();
            created.incrementAndGet();
            return new PooledHandle<>(this, raw, clock.millis());
        } catch (Exception e) {
            lock.lock();
            try {
                live--;
                available.signal();
            } finally {
                lock.unlock();
            }
            throw new RuntimeException("Failed to create pooled handle for " + name, e);
        }
    }

    private PooledHandle<H> lease(PooledHandle<H> handle) {
        lock.lock();
        try {
            leased.add(handle);
        } finally {
            lock.unlock();
        }
        handle.markLeased(clock.millis());
        acquired.incrementAndGet();
        return handle;
    }

    private void destroy(PooledHandle<H> handle) {
        try {
            factory.close(handle.get());
        } catch (Exception e) {
            log.warn("Pool {} failed to close handle", name, e);
        } finally {
            destroyed.incrementAndGet();
            lock.lock();
            try {
                live--;
                available.signal();
            } finally {
                lock.unlock();
            }
        }
    }
}
