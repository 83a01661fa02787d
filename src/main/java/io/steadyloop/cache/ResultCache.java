package io.steadyloop.cache;

import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Bounded LRU cache with per-entry TTL and tag-based invalidation. Every read that hits moves the
 * entry to the most-recently-used position; inserting past {@code maxSize} evicts the
 * least-recently-used entry. Expired entries are removed lazily on access or by
 * {@link #cleanupExpired()}.
 *
 * <p>All state sits behind a single reentrant lock. Null values are rejected so that an empty
 * {@link Optional} always means "absent". With a {@link CacheBacking} every write goes through to
 * the backing and a memory miss falls back to it.
 */
public final class ResultCache<V> {
    private final int maxSize;
    private final Duration defaultTtl;
    private final Clock clock;
    private final ReentrantLock lock;
    private final CacheBacking<V> backing;
    private final LinkedHashMap<String, Entry<V>> entries;
    private final Map<String, Set<String>> keysByTag;
    private long hits;
    private long misses;
    private long sets;
    private long deletes;
    private long evictions;
    private long expirations;

    public ResultCache(int maxSize, Duration defaultTtl) {
        this(maxSize, defaultTtl, Clock.systemUTC());
    }

    public ResultCache(int maxSize, Duration defaultTtl, Clock clock) {
        this(maxSize, defaultTtl, clock, null);
    }

    public ResultCache(int maxSize, Duration defaultTtl, Clock clock, CacheBacking<V> backing) {
        if (maxSize < 1) {
            throw new IllegalArgumentException("maxSize must be >= 1: " + maxSize);
        }
        this.maxSize = maxSize;
        this.defaultTtl = defaultTtl == null ? Duration.ZERO : defaultTtl;
        this.clock = clock;
        this.backing = backing;
        this.lock = new ReentrantLock();
        this.entries = new LinkedHashMap<>(16, 0.75f, true);
        this.keysByTag = new HashMap<>();
    }

    public Optional<V> get(String key) {
        lock.lock();
        try {
            Entry<V> entry = entries.get(key);
            if (entry == null) {
                Optional<V> promoted = promote(key);
                if (promoted.isPresent()) {
                    hits++;
                } else {
                    misses++;
                }
                return promoted;
            }
            if (entry.expiredAt(clock.millis())) {
                removeEntry(key, entry);
                if (backing != null) {
                    backing.delete(key);
                }
                expirations++;
                misses++;
                return Optional.empty();
            }
            entry.accessCount++;
            hits++;
            return Optional.of(entry.value);
        } finally {
            lock.unlock();
        }
    }

    public V get(String key, V defaultValue) {
        return get(key).orElse(defaultValue);
    }

    public void set(String key, V value) {
        set(key, value, defaultTtl, Set.of());
    }

    public void set(String key, V value, Duration ttl) {
        set(key, value, ttl, Set.of());
    }

    public void set(String key, V value, Duration ttl, Set<String> tags) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        long now = clock.millis();
        long expiresAtMs = ttl == null || ttl.isZero() || ttl.isNegative() ? -1L : now + ttl.toMillis();
        Set<String> tagSet = tags == null ? Set.of() : Set.copyOf(tags);
        lock.lock();
        try {
            insert(key, value, expiresAtMs, tagSet);
            sets++;
            if (backing != null) {
                backing.save(key, value, expiresAtMs, tagSet);
            }
        } finally {
            lock.unlock();
        }
    }

    public void warmup(Map<String, V> data, Duration ttl) {
        for (Map.Entry<String, V> e : data.entrySet()) {
            set(e.getKey(), e.getValue(), ttl, Set.of());
        }
    }

    public V getOrCompute(String key, Duration ttl, Set<String> tags, Supplier<V> loader) {
        Optional<V> cached = get(key);
        if (cached.isPresent()) {
            return cached.get();
        }
        V value = loader.get();
        if (value != null) {
            set(key, value, ttl, tags);
        }
        return value;
    }

    public boolean delete(String key) {
        lock.lock();
        try {
            Entry<V> entry = entries.get(key);
            boolean removed = entry != null;
            if (removed) {
                removeEntry(key, entry);
            }
            if (backing != null) {
                removed |= backing.delete(key);
            }
            if (removed) {
                deletes++;
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }

    public int invalidateByTag(String tag) {
        lock.lock();
        try {
            Set<String> keys = keysByTag.remove(tag);
            Set<String> removed = new HashSet<>();
            if (keys != null) {
                for (String key : List.copyOf(keys)) {
                    Entry<V> entry = entries.get(key);
                    if (entry != null) {
                        removeEntry(key, entry);
                        removed.add(key);
                    }
                }
            }
            if (backing != null) {
                removed.addAll(backing.deleteByTag(tag));
            }
            deletes += removed.size();
            return removed.size();
        } finally {
            lock.unlock();
        }
    }

    public int invalidatePattern(String fragment) {
        lock.lock();
        try {
            Set<String> removed = new HashSet<>();
            for (String key : List.copyOf(entries.keySet())) {
                if (key.contains(fragment)) {
                    removeEntry(key, entries.get(key));
                    removed.add(key);
                }
            }
            if (backing != null) {
                removed.addAll(backing.deleteMatching(fragment));
            }
            deletes += removed.size();
            return removed.size();
        } finally {
            lock.unlock();
        }
    }

    public int cleanupExpired() {
        lock.lock();
        try {
            long now = clock.millis();
            int removed = 0;
            Iterator<Map.Entry<String, Entry<V>>> it = entries.entrySet().iterator();
            while (it.hasNext()) {
                Map.Entry<String, Entry<V>> e = it.next();
                if (e.getValue().expiredAt(now)) {
                    it.remove();
                    unindex(e.getKey(), e.getValue().tags);
                    expirations++;
                    removed++;
                }
            }
            if (backing != null) {
                backing.deleteExpired(now);
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }

    public void clear() {
        lock.lock();
        try {
            entries.clear();
            keysByTag.clear();
            if (backing != null) {
                backing.clear();
            }
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    public List<String> keys() {
        lock.lock();
        try {
            return List.copyOf(entries.keySet());
        } finally {
            lock.unlock();
        }
    }

    public long accessCount(String key) {
        lock.lock();
        try {
            for (Map.Entry<String, Entry<V>> e : entries.entrySet()) {
                if (e.getKey().equals(key)) {
                    return e.getValue().accessCount;
                }
            }
            return 0L;
        } finally {
            lock.unlock();
        }
    }

    public CacheStats stats() {
        lock.lock();
        try {
            return new CacheStats(hits, misses, sets, deletes, evictions, expirations, entries.size(), maxSize);
        } finally {
            lock.unlock();
        }
    }

    private Optional<V> promote(String key) {
        if (backing == null) {
            return Optional.empty();
        }
        Optional<CacheBacking.Stored<V>> stored = backing.load(key, clock.millis());
        if (stored.isEmpty()) {
            return Optional.empty();
        }
        CacheBacking.Stored<V> s = stored.get();
        insert(key, s.value(), s.expiresAtMs(), s.tags());
        entries.get(key).accessCount++;
        return Optional.of(s.value());
    }

    private void insert(String key, V value, long expiresAtMs, Set<String> tagSet) {
        Entry<V> previous = entries.remove(key);
        if (previous != null) {
            unindex(key, previous.tags);
        }
        while (entries.size() >= maxSize) {
            Iterator<Map.Entry<String, Entry<V>>> eldest = entries.entrySet().iterator();
            Map.Entry<String, Entry<V>> lru = eldest.next();
            eldest.remove();
            unindex(lru.getKey(), lru.getValue().tags);
            evictions++;
        }
        entries.put(key, new Entry<>(value, expiresAtMs, tagSet));
        for (String tag : tagSet) {
            keysByTag.computeIfAbsent(tag, t -> new HashSet<>()).add(key);
        }
    }

    private void removeEntry(String key, Entry<V> entry) {
        entries.remove(key);
        unindex(key, entry.tags);
    }

    private void unindex(String key, Set<String> tags) {
        for (String tag : tags) {
            Set<String> keys = keysByTag.get(tag);
            if (keys != null) {
                keys.remove(key);
                if (keys.isEmpty()) {
                    keysByTag.remove(tag);
                }
            }
        }
    }

    private static final class Entry<V> {
        private final V value;
        private final long expiresAtMs;
        private final Set<String> tags;
        private long accessCount;

        private Entry(V value, long expiresAtMs, Set<String> tags) {
            this.value = value;
            this.expiresAtMs = expiresAtMs;
            this.tags = tags;
        }

        private boolean expiredAt(long nowMs) {
            return expiresAtMs >= 0L && nowMs >= expiresAtMs;
        }
    }
}
