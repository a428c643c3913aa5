package callguard.cache;

import callguard.core.model.InvalidConfigurationException;

import java.time.Duration;

/**
 * Configuration for a {@link ResponseCache}.
 *
 * @param maxSize Total entry cap across all stripes
 * @param stripes Independently locked segments; 1 keeps a single global LRU order
 * @param maxTtl Longest TTL any entry may get
 * @param policy TTL table and live-endpoint bucketing
 */
public record CacheConfig(
    int maxSize,
    int stripes,
    Duration maxTtl,
    TtlPolicy policy
) {
    public static final int DEFAULT_MAX_SIZE = 1000;

    public CacheConfig {
        if (maxSize <= 0) {
            throw new InvalidConfigurationException("maxSize must be > 0, got " + maxSize);
        }
        if (stripes <= 0 || stripes > maxSize) {
            throw new InvalidConfigurationException("stripes must be in [1, maxSize], got " + stripes);
        }
        if (maxTtl == null || maxTtl.isNegative() || maxTtl.isZero()) {
            throw new InvalidConfigurationException("maxTtl must be > 0, got " + maxTtl);
        }
        if (maxTtl.compareTo(TTLCache.MAX_TTL_LIMIT) > 0) {
            throw new InvalidConfigurationException("maxTtl " + maxTtl + " exceeds limit " + TTLCache.MAX_TTL_LIMIT);
        }
        if (policy == null) {
            throw new IllegalArgumentException("policy cannot be null");
        }
        if (policy.longestTtl().compareTo(maxTtl) > 0) {
            throw new InvalidConfigurationException(
                "policy TTL " + policy.longestTtl() + " exceeds maximum " + maxTtl);
        }
    }

    public static CacheConfig defaults() {
        return new CacheConfig(DEFAULT_MAX_SIZE, 1, TTLCache.DEFAULT_MAX_TTL, TtlPolicy.defaults());
    }

    public static CacheConfig of(int maxSize, TtlPolicy policy) {
        return new CacheConfig(maxSize, 1, TTLCache.DEFAULT_MAX_TTL, policy);
    }

    public CacheConfig withStripes(int value) {
        return new CacheConfig(maxSize, value, maxTtl, policy);
    }
}
