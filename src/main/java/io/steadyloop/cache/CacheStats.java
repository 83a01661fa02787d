package io.steadyloop.cache;

public record CacheStats(
        long hits,
        long misses,
        long sets,
        long deletes,
        long evictions,
        long expirations,
        int size,
        int maxSize
) {
    public double hitRate() {
        long total = hits + misses;
        return total == 0L ? 0.0d : (double) hits / (double) total;
    }
}
