package io.steadyloop.cache;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Second tier behind {@link ResultCache}. Entries evicted from memory stay here until they expire
 * or are deleted, and are promoted back on the next miss.
 */
public interface CacheBacking<V> {
    Optional<Stored<V>> load(String key, long nowMs);

    // A negative expiresAtMs never expires.
    void save(String key, V value, long expiresAtMs, Set<String> tags);

    boolean delete(String key);

    List<String> deleteByTag(String tag);

    List<String> deleteMatching(String fragment);

    int deleteExpired(long nowMs);

    int clear();

    record Stored<V>(V value, long expiresAtMs, Set<String> tags) {
        public Stored {
            tags = tags == null ? Set.of() : Set.copyOf(tags);
        }
    }
}
