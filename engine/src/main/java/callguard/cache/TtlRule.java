package callguard.cache;

import callguard.core.model.InvalidConfigurationException;

import java.time.Duration;

/**
 * Endpoint pattern and the TTL of responses from matching endpoints.
 *
 * @param pattern Substring matched against the endpoint path
 * @param ttl Time to live of matching responses
 */
public record TtlRule(String pattern, Duration ttl) {

    public TtlRule {
        if (pattern == null || pattern.isEmpty()) {
            throw new InvalidConfigurationException("pattern cannot be empty");
        }
        if (ttl == null || ttl.isNegative()) {
            throw new InvalidConfigurationException("ttl for '" + pattern + "' must be >= 0, got " + ttl);
        }
    }

    public static TtlRule of(String pattern, long ttlSeconds) {
        return new TtlRule(pattern, Duration.ofSeconds(ttlSeconds));
    }

    public boolean matches(String endpoint) {
        return endpoint.contains(pattern);
    }
}
