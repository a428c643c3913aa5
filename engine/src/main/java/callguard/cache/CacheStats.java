package callguard.cache;

/**
 * Counters of a cache, read atomically.
 *
 * @param size Entries currently stored
 * @param maxSize Capacity
 * @param hits Lookups that returned a live value
 * @param misses Lookups that found nothing or an expired entry
 * @param hitRate hits / (hits + misses), 0 before the first lookup
 * @param evictions Entries dropped by expiry or LRU pressure
 */
public record CacheStats(
    int size,
    int maxSize,
    long hits,
    long misses,
    double hitRate,
    long evictions
) {
    public static CacheStats of(int size, int maxSize, long hits, long misses, long evictions) {
        long requests = hits + misses;
        double hitRate = requests == 0 ? 0.0 : (double) hits / requests;
        return new CacheStats(size, maxSize, hits, misses, hitRate, evictions);
    }

    public static CacheStats empty() {
        return of(0, 0, 0, 0, 0);
    }

    /**
     * Sums two stats; used to aggregate striped segments.
     */
    public CacheStats plus(CacheStats other) {
        return of(
            size + other.size,
            maxSize + other.maxSize,
            hits + other.hits,
            misses + other.misses,
            evictions + other.evictions
        );
    }

    public long requests() {
        return hits + misses;
    }

    public double hitRatePercent() {
        return Math.round(hitRate * 10_000) / 100.0;
    }
}
