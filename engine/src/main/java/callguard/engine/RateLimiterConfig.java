package callguard.engine;

import callguard.core.model.InvalidConfigurationException;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration for a {@link RateLimiter}.
 *
 * @param services Limit per service name; the set of services is fixed for the limiter's lifetime
 * @param maxWaitersPerService Callers allowed to block on one service at the same time
 * @param minSleep Floor for each poll sleep, keeps a nearly-full bucket from busy-looping
 * @param maxTimeout Ceiling for acquire timeouts; larger values are clamped
 * @param backoff Exponential backoff applied on throttling signals
 */
public record RateLimiterConfig(
    Map<String, ServiceLimit> services,
    int maxWaitersPerService,
    Duration minSleep,
    Duration maxTimeout,
    BackoffPolicy backoff
) {
    public static final int DEFAULT_MAX_WAITERS = 100;
    public static final Duration DEFAULT_MIN_SLEEP = Duration.ofMillis(10);
    public static final Duration DEFAULT_MAX_TIMEOUT = Duration.ofSeconds(300);
    public static final Duration MAX_DURATION = Duration.ofDays(1);

    public RateLimiterConfig {
        if (services == null) throw new IllegalArgumentException("services cannot be null");
        if (services.isEmpty()) throw new InvalidConfigurationException("at least one service must be configured");
        services.forEach((name, limit) -> {
            if (name == null || name.isBlank()) throw new InvalidConfigurationException("service name cannot be blank");
            if (limit == null) throw new InvalidConfigurationException("limit for " + name + " cannot be null");
        });
        if (maxWaitersPerService <= 0) {
            throw new InvalidConfigurationException("maxWaitersPerService must be > 0, got " + maxWaitersPerService);
        }
        if (minSleep == null || minSleep.isNegative() || minSleep.isZero()) {
            throw new InvalidConfigurationException("minSleep must be > 0, got " + minSleep);
        }
        if (minSleep.compareTo(MAX_DURATION) > 0) {
            throw new InvalidConfigurationException("minSleep " + minSleep + " exceeds maximum " + MAX_DURATION);
        }
        if (maxTimeout == null || maxTimeout.isNegative()) {
            throw new InvalidConfigurationException("maxTimeout must be >= 0, got " + maxTimeout);
        }
        if (maxTimeout.compareTo(MAX_DURATION) > 0) {
            throw new InvalidConfigurationException("maxTimeout " + maxTimeout + " exceeds maximum " + MAX_DURATION);
        }
        if (backoff == null) throw new IllegalArgumentException("backoff cannot be null");

        services = Collections.unmodifiableMap(new LinkedHashMap<>(services));
    }

    /**
     * Limits of the market-data and exchange providers the assistant talks to,
     * kept conservative against each provider's published free-tier limits.
     */
    public static Map<String, ServiceLimit> defaultServices() {
        Map<String, ServiceLimit> services = new LinkedHashMap<>();
        services.put("coingecko", ServiceLimit.perMinute(30));
        services.put("coindesk", ServiceLimit.perMinute(50));
        services.put("kraken", ServiceLimit.perMinute(15));
        services.put("coinbase", ServiceLimit.perMinute(10));
        return services;
    }

    public static RateLimiterConfig defaults() {
        return of(defaultServices());
    }

    public static RateLimiterConfig of(Map<String, ServiceLimit> services) {
        return new RateLimiterConfig(
            services,
            DEFAULT_MAX_WAITERS,
            DEFAULT_MIN_SLEEP,
            DEFAULT_MAX_TIMEOUT,
            BackoffPolicy.defaults()
        );
    }

    public RateLimiterConfig withMaxWaitersPerService(int maxWaiters) {
        return new RateLimiterConfig(services, maxWaiters, minSleep, maxTimeout, backoff);
    }

    public RateLimiterConfig withMinSleep(Duration value) {
        return new RateLimiterConfig(services, maxWaitersPerService, value, maxTimeout, backoff);
    }

    public RateLimiterConfig withMaxTimeout(Duration value) {
        return new RateLimiterConfig(services, maxWaitersPerService, minSleep, value, backoff);
    }

    public RateLimiterConfig withBackoff(BackoffPolicy value) {
        return new RateLimiterConfig(services, maxWaitersPerService, minSleep, maxTimeout, value);
    }
}
