package callguard.cache;

import callguard.core.clock.Clock;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Cache of provider responses keyed by (endpoint, params).
 *
 * Builds on {@link TTLCache}:
 * - The key is a SHA-256 of the endpoint and canonical params, plus a coarse time
 *   bucket for live endpoints (see {@link TtlPolicy})
 * - The TTL comes from the policy's endpoint table
 * - With more than one stripe, keys are spread over independently locked segments
 *   and LRU order is kept per segment
 *
 * Thread-safety: each segment is internally synchronized; no lock spans segments.
 */
@Slf4j
public final class ResponseCache {

    private final Clock clock;
    private final CacheConfig config;
    private final CacheKeyDeriver keys;
    private final List<TTLCache<String, Object>> segments;

    /**
     * @param clock Clock for expiry and time bucketing
     * @param config Size, striping and TTL policy
     */
    public ResponseCache(Clock clock, CacheConfig config) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }

        this.clock = clock;
        this.config = config;
        this.keys = new CacheKeyDeriver(config.policy());

        int stripes = config.stripes();
        int base = config.maxSize() / stripes;
        int remainder = config.maxSize() % stripes;
        List<TTLCache<String, Object>> created = new ArrayList<>(stripes);
        for (int i = 0; i < stripes; i++) {
            int capacity = base + (i < remainder ? 1 : 0);
            created.add(new TTLCache<>(clock, capacity, config.policy().defaultTtl(), config.maxTtl(),
                (key, value) -> log.debug("Cache eviction: {}...", abbreviate(key))));
        }
        this.segments = Collections.unmodifiableList(created);

        log.info("Response cache initialized: maxSize={}, stripes={}, defaultTtl={}",
            config.maxSize(), stripes, config.policy().defaultTtl());
    }

    public ResponseCache(Clock clock) {
        this(clock, CacheConfig.defaults());
    }

    /**
     * @param params Query parameters, null treated as empty
     * @return The cached response, empty on miss or expiry
     */
    public Optional<Object> get(String endpoint, Map<String, ?> params) {
        String key = keyFor(endpoint, params);
        Optional<Object> value = segmentFor(key).get(key);
        if (value.isPresent()) {
            log.debug("Cache hit: {} ({}...)", endpoint, abbreviate(key));
        }
        return value;
    }

    /**
     * Stores a response with the TTL the policy assigns to its endpoint.
     */
    public void set(String endpoint, Map<String, ?> params, Object value) {
        String key = keyFor(endpoint, params);
        Duration ttl = ttlFor(endpoint);
        segmentFor(key).set(key, value, ttl);
        log.debug("Cache set: {} ({}...) ttl={}", endpoint, abbreviate(key), ttl);
    }

    /**
     * @return true if an entry was removed
     */
    public boolean invalidate(String endpoint, Map<String, ?> params) {
        String key = keyFor(endpoint, params);
        return segmentFor(key).delete(key);
    }

    public void clear() {
        segments.forEach(TTLCache::clear);
        log.info("Response cache cleared");
    }

    /**
     * Counters summed over all segments.
     */
    public CacheStats getStats() {
        CacheStats total = CacheStats.empty();
        for (TTLCache<String, Object> segment : segments) {
            total = total.plus(segment.getStats());
        }
        return total;
    }

    public Duration ttlFor(String endpoint) {
        requireEndpoint(endpoint);
        return config.policy().ttlFor(endpoint);
    }

    /**
     * Cache key for the request at the current clock time.
     */
    public String keyFor(String endpoint, Map<String, ?> params) {
        requireEndpoint(endpoint);
        return keys.keyFor(endpoint, params, clock.nowNanos());
    }

    public TtlPolicy policy() {
        return config.policy();
    }

    public CacheConfig getConfig() {
        return config;
    }

    private TTLCache<String, Object> segmentFor(String key) {
        if (segments.size() == 1) {
            return segments.get(0);
        }
        return segments.get(Math.floorMod(key.hashCode(), segments.size()));
    }

    private static void requireEndpoint(String endpoint) {
        if (endpoint == null) {
            throw new IllegalArgumentException("endpoint cannot be null");
        }
    }

    private static String abbreviate(String key) {
        return key.length() <= 12 ? key : key.substring(0, 12);
    }
}
