package fr.lapetina.aimux.cache;

/**
 * Point-in-time cache statistics.
 */
public record CacheStats(
        long hits,
        long misses,
        long evictions,
        long expirations,
        int entries,
        long memoryUsageBytes
) {
    /**
     * Hits divided by lookups, or 0 before the first lookup.
     */
    public double hitRate() {
        long total = hits + misses;
        return total == 0 ? 0.0 : (double) hits / total;
    }

    public long lookups() {
        return hits + misses;
    }
}
