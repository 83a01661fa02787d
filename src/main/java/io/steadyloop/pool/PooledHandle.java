package io.steadyloop.pool;

import java.util.concurrent.atomic.AtomicLong;

public final class PooledHandle<H> implements AutoCloseable {
    private final ResourcePool<H> pool;
    private final H handle;
    private final long createdAtMs;
    private final AtomicLong useCount;
    private volatile long lastUsedAtMs;

    PooledHandle(ResourcePool<H> pool, H handle, long createdAtMs) {
        this.pool = pool;
        this.handle = handle;
        this.createdAtMs = createdAtMs;
        this.lastUsedAtMs = createdAtMs;
        this.useCount = new AtomicLong(0L);
    }

    public H get() {
        return handle;
    }

    public long createdAtMs() {
        return createdAtMs;
    }

    public long lastUsedAtMs() {
        return lastUsedAtMs;
    }

    public long useCount() {
        return useCount.get();
    }

    ResourcePool<H> pool() {
        return pool;
    }

    void markLeased(long nowMs) {
        useCount.incrementAndGet();
        lastUsedAtMs = nowMs;
    }

    void markReturned(long nowMs) {
        lastUsedAtMs = nowMs;
    }

    @Override
    public void close() {
        pool.release(this);
    }
}
