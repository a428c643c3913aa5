package callguard.cache;

import callguard.core.model.InvalidConfigurationException;

import java.time.Duration;
import java.util.List;

/**
 * How long responses live and which endpoints count as live data.
 *
 * <p>Rules are scanned in declared order and the first whose pattern occurs in the
 * endpoint wins; no match falls back to {@code defaultTtl}. Endpoints containing one
 * of the {@code liveMarkers} get a time bucket of {@code liveBucketWidth} mixed into
 * their cache key, so near-simultaneous requests for volatile data share an entry.
 *
 * @param rules Ordered TTL rules
 * @param defaultTtl TTL when no rule matches
 * @param liveMarkers Substrings marking volatile endpoints
 * @param liveBucketWidth Width of the time bucket for live endpoints
 */
public record TtlPolicy(
    List<TtlRule> rules,
    Duration defaultTtl,
    List<String> liveMarkers,
    Duration liveBucketWidth
) {
    public static final Duration DEFAULT_TTL = Duration.ofSeconds(300);
    public static final Duration DEFAULT_BUCKET_WIDTH = Duration.ofSeconds(60);
    public static final Duration MAX_BUCKET_WIDTH = Duration.ofDays(1);

    public TtlPolicy {
        if (rules == null) throw new IllegalArgumentException("rules cannot be null");
        if (liveMarkers == null) throw new IllegalArgumentException("liveMarkers cannot be null");
        if (defaultTtl == null || defaultTtl.isNegative()) {
            throw new InvalidConfigurationException("defaultTtl must be >= 0, got " + defaultTtl);
        }
        if (liveBucketWidth == null || liveBucketWidth.isNegative() || liveBucketWidth.isZero()) {
            throw new InvalidConfigurationException("liveBucketWidth must be > 0, got " + liveBucketWidth);
        }
        if (liveBucketWidth.compareTo(MAX_BUCKET_WIDTH) > 0) {
            throw new InvalidConfigurationException(
                "liveBucketWidth " + liveBucketWidth + " exceeds maximum " + MAX_BUCKET_WIDTH);
        }
        for (String marker : liveMarkers) {
            if (marker == null || marker.isEmpty()) {
                throw new InvalidConfigurationException("live marker cannot be empty");
            }
        }
        rules = List.copyOf(rules);
        liveMarkers = List.copyOf(liveMarkers);
    }

    /**
     * Spot prices and market lists change by the minute; OHLC and history barely change;
     * coin metadata and global metrics sit in between.
     */
    public static TtlPolicy defaults() {
        return new TtlPolicy(
            List.of(
                TtlRule.of("price", 120),
                TtlRule.of("prices", 120),
                TtlRule.of("markets", 180),
                TtlRule.of("ohlc", 3600),
                TtlRule.of("market_chart", 3600),
                TtlRule.of("history", 7200),
                TtlRule.of("coins", 600),
                TtlRule.of("global", 600)
            ),
            DEFAULT_TTL,
            List.of("price", "markets"),
            DEFAULT_BUCKET_WIDTH
        );
    }

    public Duration ttlFor(String endpoint) {
        for (TtlRule rule : rules) {
            if (rule.matches(endpoint)) {
                return rule.ttl();
            }
        }
        return defaultTtl;
    }

    public boolean isLive(String endpoint) {
        for (String marker : liveMarkers) {
            if (endpoint.contains(marker)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Longest TTL this policy can hand out.
     */
    public Duration longestTtl() {
        Duration longest = defaultTtl;
        for (TtlRule rule : rules) {
            if (rule.ttl().compareTo(longest) > 0) {
                longest = rule.ttl();
            }
        }
        return longest;
    }

    public TtlPolicy withLiveBucketWidth(Duration width) {
        return new TtlPolicy(rules, defaultTtl, liveMarkers, width);
    }
}
