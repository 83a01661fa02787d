package io.steadyloop.cache;

import io.steadyloop.support.MutableClock;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

final class ResultCacheTest {

    @Test
    void leastRecentlyUsedEntryIsEvictedFirst() {
        ResultCache<String> cache = new ResultCache<>(2, Duration.ZERO, MutableClock.startingAt(0L));
        cache.set("a", "1");
        cache.set("b", "2");
        Assertions.assertEquals(Optional.of("1"), cache.get("a"));

        cache.set("c", "3");

        Assertions.assertTrue(cache.get("b").isEmpty());
        Assertions.assertEquals(List.of("a", "c"), cache.keys());
        Assertions.assertEquals(1L, cache.stats().evictions());
        Assertions.assertEquals(2, cache.size());
    }

    @Test
    void entriesExpireAfterTheirTtl() {
        MutableClock clock = MutableClock.startingAt(10_000L);
        ResultCache<String> cache = new ResultCache<>(10, Duration.ofSeconds(60), clock);
        cache.set("short", "x", Duration.ofSeconds(5));
        cache.set("default", "y");
        cache.set("forever", "z", Duration.ZERO);

        clock.advance(Duration.ofSeconds(5));
        Assertions.assertTrue(cache.get("short").isEmpty());
        Assertions.assertEquals(Optional.of("y"), cache.get("default"));

        clock.advance(Duration.ofMinutes(10));
        Assertions.assertEquals(1, cache.cleanupExpired());
        Assertions.assertEquals(List.of("forever"), cache.keys());
        Assertions.assertEquals(2L, cache.stats().expirations());
    }

    @Test
    void invalidateByTagRemovesOnlyTaggedEntries() {
        ResultCache<String> cache = new ResultCache<>(10, Duration.ZERO, MutableClock.startingAt(0L));
        cache.set("u:1", "alice", null, Set.of("users"));
        cache.set("u:2", "bob", null, Set.of("users", "admins"));
        cache.set("cfg", "on", null, Set.of("config"));

        Assertions.assertEquals(2, cache.invalidateByTag("users"));
        Assertions.assertEquals(0, cache.invalidateByTag("admins"));
        Assertions.assertEquals(0, cache.invalidateByTag("missing"));
        Assertions.assertEquals(List.of("cfg"), cache.keys());
    }

    @Test
    void overwritingAKeyDropsItsOldTags() {
        ResultCache<String> cache = new ResultCache<>(10, Duration.ZERO, MutableClock.startingAt(0L));
        cache.set("k", "v1", null, Set.of("old"));
        cache.set("k", "v2", null, Set.of("new"));

        Assertions.assertEquals(0, cache.invalidateByTag("old"));
        Assertions.assertEquals(Optional.of("v2"), cache.get("k"));
        Assertions.assertEquals(1, cache.invalidateByTag("new"));
    }

    @Test
    void invalidatePatternRemovesKeysContainingTheFragment() {
        ResultCache<String> cache = new ResultCache<>(10, Duration.ZERO, MutableClock.startingAt(0L));
        cache.set("user:1:profile", "alice");
        cache.set("user:2:profile", "bob");
        cache.set("order:7", "pending");

        Assertions.assertEquals(2, cache.invalidatePattern("user:"));
        Assertions.assertEquals(0, cache.invalidatePattern("user:"));
        Assertions.assertEquals(List.of("order:7"), cache.keys());
        Assertions.assertEquals(2L, cache.stats().deletes());
    }

    @Test
    void warmupStoresEveryEntryWithTheSharedTtl() {
        MutableClock clock = MutableClock.startingAt(0L);
        ResultCache<String> cache = new ResultCache<>(10, Duration.ZERO, clock);
        Map<String, String> seed = new LinkedHashMap<>();
        seed.put("region", "eu-west");
        seed.put("tier", "gold");

        cache.warmup(seed, Duration.ofSeconds(30));

        Assertions.assertEquals(List.of("region", "tier"), cache.keys());
        Assertions.assertEquals(2L, cache.stats().sets());
        clock.advance(Duration.ofSeconds(30));
        Assertions.assertTrue(cache.get("region").isEmpty());
        Assertions.assertTrue(cache.get("tier").isEmpty());
    }

    @Test
    void getOrComputeLoadsOnceAndTracksHits() {
        ResultCache<Integer> cache = new ResultCache<>(10, Duration.ZERO, MutableClock.startingAt(0L));
        AtomicInteger loads = new AtomicInteger();

        Integer first = cache.getOrCompute("answer", null, Set.of(), () -> 40 + loads.incrementAndGet() + 1);
        Integer second = cache.getOrCompute("answer", null, Set.of(), () -> loads.incrementAndGet());

        Assertions.assertEquals(42, first);
        Assertions.assertEquals(42, second);
        Assertions.assertEquals(1, loads.get());
        Assertions.assertEquals(1L, cache.accessCount("answer"));

        CacheStats stats = cache.stats();
        Assertions.assertEquals(1L, stats.hits());
        Assertions.assertEquals(1L, stats.misses());
        Assertions.assertEquals(0.5d, stats.hitRate(), 1e-9);
    }

    @Test
    void deleteAndClear() {
        ResultCache<String> cache = new ResultCache<>(10, Duration.ZERO, MutableClock.startingAt(0L));
        cache.set("a", "1");
        cache.set("b", "2");

        Assertions.assertTrue(cache.delete("a"));
        Assertions.assertFalse(cache.delete("a"));
        Assertions.assertEquals("fallback", cache.get("a", "fallback"));

        cache.clear();
        Assertions.assertEquals(0, cache.size());
    }

    @Test
    void rejectsNullValuesAndNonPositiveSize() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> new ResultCache<String>(0, Duration.ZERO));
        ResultCache<String> cache = new ResultCache<>(1, Duration.ZERO);
        Assertions.assertThrows(NullPointerException.class, () -> cache.set("k", null));
    }
}
