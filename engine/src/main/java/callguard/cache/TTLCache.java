package callguard.cache;

import callguard.core.clock.Clock;
import callguard.core.model.InvalidConfigurationException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.BiConsumer;

/**
 * LRU (Least Recently Used) cache with a per-entry time-to-live.
 *
 * This implementation provides:
 * - O(1) get/set/delete; set also sweeps expired entries, O(size)
 * - Access-order eviction (least recently accessed entry evicted first)
 * - Absolute expiry per entry; an expired entry is never returned, only evicted
 * - Lifetime hit/miss/eviction counters
 * - Eviction listener for expiry and LRU evictions (not for delete/clear)
 *
 * Design:
 * - LinkedHashMap with accessOrder=true keeps recency order, eldest first
 * - Expiry is checked lazily on read and swept on write; there is no background thread
 * - Every public method holds the cache monitor, so the check-expire-evict-insert
 *   sequence is atomic. The eviction listener runs under that monitor and must be cheap.
 *
 * @param <K> Key type
 * @param <V> Value type (null values are rejected; absence is the miss signal)
 */
@Slf4j
public final class TTLCache<K, V> {

    public static final Duration DEFAULT_MAX_TTL = Duration.ofDays(7);
    public static final Duration DEFAULT_TTL = Duration.ofSeconds(300);
    /** Upper bound for {@code maxTtl}; keeps every expiry representable in clock nanos. */
    public static final Duration MAX_TTL_LIMIT = Duration.ofDays(365);

    private final Clock clock;
    private final int maxSize;
    private final Duration defaultTtl;
    private final Duration maxTtl;
    private final long maxTtlNanos;
    private final BiConsumer<K, V> evictionListener;
    private final LinkedHashMap<K, Entry<V>> map;

    private long hits;
    private long misses;
    private long evictions;

    private record Entry<V>(V value, long expiresAtNanos) {
    }

    /**
     * Creates a cache.
     *
     * @param clock Clock for expiry (injected for testability)
     * @param maxSize Maximum number of entries (must be > 0)
     * @param defaultTtl TTL used by {@link #set(Object, Object)}, within [0, maxTtl]
     * @param maxTtl Longest TTL accepted, at most {@link #MAX_TTL_LIMIT}; longer ones are clamped
     * @param evictionListener Callback for evicted entries (can be null)
     * @throws InvalidConfigurationException if a size or TTL is out of range
     */
    public TTLCache(Clock clock, int maxSize, Duration defaultTtl, Duration maxTtl, BiConsumer<K, V> evictionListener) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (maxSize <= 0) {
            throw new InvalidConfigurationException("maxSize must be > 0, got " + maxSize);
        }
        if (maxTtl == null || maxTtl.isNegative() || maxTtl.isZero()) {
            throw new InvalidConfigurationException("maxTtl must be > 0, got " + maxTtl);
        }
        if (maxTtl.compareTo(MAX_TTL_LIMIT) > 0) {
            throw new InvalidConfigurationException("maxTtl " + maxTtl + " exceeds limit " + MAX_TTL_LIMIT);
        }
        if (defaultTtl == null || defaultTtl.isNegative()) {
            throw new InvalidConfigurationException("defaultTtl must be >= 0, got " + defaultTtl);
        }
        if (defaultTtl.compareTo(maxTtl) > 0) {
            throw new InvalidConfigurationException("defaultTtl " + defaultTtl + " exceeds maximum " + maxTtl);
        }

        this.clock = clock;
        this.maxSize = maxSize;
        this.defaultTtl = defaultTtl;
        this.maxTtl = maxTtl;
        this.maxTtlNanos = maxTtl.toNanos();
        this.evictionListener = evictionListener;
        this.map = new LinkedHashMap<>(Math.min(maxSize, 1 << 16), 0.75f, true);
    }

    /**
     * Creates a cache with the default TTLs and no eviction listener.
     */
    public TTLCache(Clock clock, int maxSize) {
        this(clock, maxSize, DEFAULT_TTL, DEFAULT_MAX_TTL, null);
    }

    /**
     * Retrieves a live value and marks it most recently used.
     * An expired entry is removed and counted as both an eviction and a miss.
     */
    public synchronized Optional<V> get(K key) {
        Entry<V> entry = map.get(key);
        if (entry == null) {
            misses++;
            return Optional.empty();
        }

        if (entry.expiresAtNanos() <= clock.nowNanos()) {
            map.remove(key);
            evicted(key, entry);
            misses++;
            return Optional.empty();
        }

        hits++;
        return Optional.of(entry.value());
    }

    /**
     * Stores a value with the default TTL.
     */
    public void set(K key, V value) {
        set(key, value, defaultTtl);
    }

    /**
     * Inserts or replaces a value; the entry becomes most recently used.
     *
     * Before inserting, all expired entries are swept; if the key is new and the cache
     * is full, the least recently used entry is evicted.
     *
     * @param ttl Time to live; clamped to the maximum TTL
     * @throws InvalidConfigurationException if ttl is negative or its expiry cannot be represented
     */
    public synchronized void set(K key, V value, Duration ttl) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
        if (ttl == null) {
            throw new IllegalArgumentException("ttl cannot be null");
        }
        if (ttl.isNegative()) {
            throw new InvalidConfigurationException("ttl must be >= 0, got " + ttl);
        }
        if (ttl.compareTo(maxTtl) > 0) {
            log.warn("TTL {} exceeds maximum {}, capping", ttl, maxTtl);
            ttl = maxTtl;
        }

        long now = clock.nowNanos();
        long ttlNanos = ttl.toNanos();
        long expiresAt;
        try {
            expiresAt = Math.addExact(now, ttlNanos);
        } catch (ArithmeticException e) {
            throw new InvalidConfigurationException("ttl " + ttl + " overflows the clock", e);
        }
        if (expiresAt < now || expiresAt - now > maxTtlNanos) {
            throw new InvalidConfigurationException("ttl " + ttl + " produced an invalid expiry");
        }

        sweepExpired(now);
        if (!map.containsKey(key) && map.size() >= maxSize) {
            evictEldest();
        }

        // put on an access-ordered map moves an existing key to the tail as well
        map.put(key, new Entry<>(value, expiresAt));
    }

    /**
     * Removes an entry. Does NOT count as an eviction.
     *
     * @return true if an entry was present
     */
    public synchronized boolean delete(K key) {
        return map.remove(key) != null;
    }

    /**
     * Drops every entry. Lifetime counters are kept.
     */
    public synchronized void clear() {
        map.clear();
    }

    /**
     * Number of stored entries, including expired ones not yet swept.
     */
    public synchronized int size() {
        return map.size();
    }

    public int maxSize() {
        return maxSize;
    }

    public Duration defaultTtl() {
        return defaultTtl;
    }

    public Duration maxTtl() {
        return maxTtl;
    }

    public synchronized CacheStats getStats() {
        return CacheStats.of(map.size(), maxSize, hits, misses, evictions);
    }

    private void sweepExpired(long now) {
        Iterator<Map.Entry<K, Entry<V>>> it = map.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<K, Entry<V>> e = it.next();
            if (e.getValue().expiresAtNanos() <= now) {
                it.remove();
                evicted(e.getKey(), e.getValue());
            }
        }
    }

    private void evictEldest() {
        Iterator<Map.Entry<K, Entry<V>>> it = map.entrySet().iterator();
        if (!it.hasNext()) return;
        Map.Entry<K, Entry<V>> eldest = it.next();
        it.remove();
        log.debug("LRU eviction: {}", eldest.getKey());
        evicted(eldest.getKey(), eldest.getValue());
    }

    private void evicted(K key, Entry<V> entry) {
        evictions++;
        if (evictionListener != null) {
            evictionListener.accept(key, entry.value());
        }
    }
}
