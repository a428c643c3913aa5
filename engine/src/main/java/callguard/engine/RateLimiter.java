package callguard.engine;

import callguard.core.algorithms.token_bucket.BucketSnapshot;
import callguard.core.algorithms.token_bucket.TokenBucket;
import callguard.core.clock.Clock;
import callguard.core.model.AdmissionResult;
import callguard.core.model.InvalidConfigurationException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalLong;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Thread-safe admission control for outbound calls, one token bucket per named service.
 *
 * Features:
 * - Token bucket per service (requests/minute plus burst)
 * - Backoff deadline per service, set from provider throttling signals
 * - Bounded waiter gate per service: callers beyond the cap are refused at once
 * - Blocking {@link #acquire} with a cooperative timeout
 *
 * Thread-safety:
 * - Each bucket serializes its own refill/consume
 * - All backoff transitions go through {@code backoffLock}
 * - Lock order is backoff lock first, then bucket monitors in sorted service order.
 *   Only {@link #getStats()} holds both; acquire never holds the backoff lock while
 *   touching a bucket.
 *
 * Usage example:
 * <pre>
 * RateLimiter limiter = new RateLimiter(SystemClock.instance(), RateLimiterConfig.defaults());
 *
 * if (limiter.acquire("coingecko", Duration.ofSeconds(30))) {
 *     // call the provider; on HTTP 429:
 *     limiter.reportThrottled("coingecko", retryAfter);
 *     // on success:
 *     limiter.resetBackoff("coingecko");
 * }
 * </pre>
 */
@Slf4j
public final class RateLimiter {

    private static final long NO_BACKOFF = Long.MIN_VALUE;

    private final Clock clock;
    private final RateLimiterConfig config;
    private final Map<String, ServiceEntry> services;

    private final ReentrantLock backoffLock = new ReentrantLock();
    private final Map<String, Long> backoffUntil = new HashMap<>();

    /**
     * Creates a limiter for the configured services.
     *
     * @param clock Clock instance for time control (injected for testability)
     * @param config Services and tuning; validated by the record itself
     * @throws IllegalArgumentException if any parameter is invalid
     */
    public RateLimiter(Clock clock, RateLimiterConfig config) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }

        this.clock = clock;
        this.config = config;

        // Sorted, so stats snapshots lock buckets in a stable order
        Map<String, ServiceEntry> entries = new TreeMap<>();
        config.services().forEach((name, limit) -> {
            TokenBucket bucket = new TokenBucket(clock, limit.burstCapacity(), limit.ratePerSecond());
            entries.put(name, new ServiceEntry(name, bucket, config.maxWaitersPerService()));
            backoffUntil.put(name, NO_BACKOFF);
        });
        this.services = Collections.unmodifiableMap(entries);

        log.info("Rate limiter initialized: services={}, maxWaitersPerService={}, maxTimeout={}",
            config.services(), config.maxWaitersPerService(), config.maxTimeout());
    }

    /**
     * Blocks until the call to {@code service} may go out or the timeout runs out.
     *
     * @return true if admitted; false on timeout, waiter saturation or interruption
     * @throws UnknownServiceException if the service is not configured
     * @throws InvalidConfigurationException if the timeout is negative
     */
    public boolean acquire(String service, Duration timeout) {
        return tryAcquire(service, timeout).admitted();
    }

    /**
     * Same as {@link #acquire} but tells the refusal reasons apart.
     *
     * This method:
     * 1. Validates the service and clamps the timeout
     * 2. Takes a waiter slot without blocking (refuses when saturated)
     * 3. Each round, waits out an active backoff unless it outlasts the timeout
     * 4. Polls the bucket, sleeping until the next token or the deadline
     * 5. Releases the waiter slot
     *
     * A backoff reported while this caller is already waiting is honoured on the next round.
     */
    public AdmissionResult tryAcquire(String service, Duration timeout) {
        ServiceEntry entry = requireService(service);
        long timeoutNanos = clampTimeout(service, timeout);

        if (!entry.tryEnter()) {
            log.warn("Too many concurrent waiters for {} (max {}), refusing", service, entry.maxWaiters());
            return AdmissionResult.saturated();
        }

        long start = clock.nowNanos();
        try {
            long deadline = saturatedAdd(start, timeoutNanos);

            TokenBucket bucket = entry.bucket();
            long minSleepNanos = config.minSleep().toNanos();
            while (true) {
                // Re-read every round: a throttling signal may arrive while we wait for a token
                long backoff = backoffDeadline(service);
                long now = clock.nowNanos();
                if (backoff != NO_BACKOFF && backoff > now) {
                    if (backoff > deadline) {
                        log.warn("Service {} in backoff for another {}ms, beyond the {}ms timeout",
                            service, (backoff - now) / 1_000_000, timeoutNanos / 1_000_000);
                        return AdmissionResult.timedOut(now - start);
                    }
                    log.warn("Service {} in backoff, waiting {}ms", service, (backoff - now) / 1_000_000);
                    clock.sleepNanos(backoff - now);
                    continue;
                }

                if (bucket.tryConsume()) {
                    long waited = clock.nowNanos() - start;
                    log.debug("Token acquired for {} after {}ms", service, waited / 1_000_000);
                    return AdmissionResult.admitted(waited);
                }

                long elapsed = clock.nowNanos() - start;
                if (elapsed >= timeoutNanos) {
                    log.warn("Rate limit timeout for {} after {}ms", service, elapsed / 1_000_000);
                    return AdmissionResult.timedOut(elapsed);
                }

                long sleep = Math.max(minSleepNanos, Math.min(bucket.nanosToNextToken(), timeoutNanos - elapsed));
                clock.sleepNanos(sleep);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for {}", service);
            return AdmissionResult.interrupted(clock.nowNanos() - start);
        } finally {
            entry.leave();
        }
    }

    /**
     * Records a throttling signal (e.g. HTTP 429) without a provider cooldown:
     * starts or doubles the exponential backoff.
     */
    public void reportThrottled(String service) {
        reportThrottled(service, null);
    }

    /**
     * Records a throttling signal.
     *
     * @param retryAfter Provider-stated cooldown; null or zero falls back to exponential backoff
     * @throws UnknownServiceException if the service is not configured
     * @throws IllegalArgumentException if retryAfter is negative
     */
    public void reportThrottled(String service, Duration retryAfter) {
        requireService(service);
        if (retryAfter != null && retryAfter.isNegative()) {
            throw new IllegalArgumentException("retryAfter must be >= 0, got " + retryAfter);
        }

        backoffLock.lock();
        try {
            long now = clock.nowNanos();
            long backoffNanos;
            if (retryAfter != null && !retryAfter.isZero()) {
                backoffNanos = toNanosSaturated(retryAfter);
            } else {
                long current = backoffUntil.get(service);
                long remaining = current == NO_BACKOFF ? 0L : current - now;
                backoffNanos = config.backoff().nextBackoffNanos(remaining);
            }
            backoffUntil.put(service, saturatedAdd(now, backoffNanos));
            log.warn("Rate limit hit for {}, backing off for {}ms", service, backoffNanos / 1_000_000);
        } finally {
            backoffLock.unlock();
        }
    }

    /**
     * Clears the backoff of a service. Call after a successful admitted call.
     */
    public void resetBackoff(String service) {
        requireService(service);

        backoffLock.lock();
        try {
            Long previous = backoffUntil.put(service, NO_BACKOFF);
            if (previous != null && previous != NO_BACKOFF) {
                log.debug("Backoff cleared for {}", service);
            }
        } finally {
            backoffLock.unlock();
        }
    }

    /**
     * Snapshot of every service, keyed and ordered by service name.
     */
    public Map<String, ServiceStats> getStats() {
        Map<String, ServiceStats> stats = new LinkedHashMap<>();

        backoffLock.lock();
        try {
            long now = clock.nowNanos();
            for (ServiceEntry entry : services.values()) {
                BucketSnapshot bucket = entry.bucket().snapshot();
                long until = backoffUntil.get(entry.name());
                boolean active = until != NO_BACKOFF && until > now;
                stats.put(entry.name(), new ServiceStats(
                    entry.name(),
                    bucket.tokens(),
                    bucket.capacity(),
                    bucket.ratePerSecond(),
                    Duration.ofNanos(bucket.nanosToNextToken()),
                    until == NO_BACKOFF ? OptionalLong.empty() : OptionalLong.of(until),
                    active ? Duration.ofNanos(until - now) : Duration.ZERO,
                    entry.activeWaiters()
                ));
            }
        } finally {
            backoffLock.unlock();
        }
        return Collections.unmodifiableMap(stats);
    }

    public boolean isKnownService(String service) {
        return service != null && services.containsKey(service);
    }

    /**
     * Configured service names in sorted order.
     */
    public Set<String> services() {
        return services.keySet();
    }

    public RateLimiterConfig getConfig() {
        return config;
    }

    private ServiceEntry requireService(String service) {
        if (service == null) {
            throw new IllegalArgumentException("service cannot be null");
        }
        ServiceEntry entry = services.get(service);
        if (entry == null) {
            throw new UnknownServiceException(service, services.keySet());
        }
        return entry;
    }

    private long clampTimeout(String service, Duration timeout) {
        if (timeout == null) {
            throw new IllegalArgumentException("timeout cannot be null");
        }
        if (timeout.isNegative()) {
            throw new InvalidConfigurationException("timeout must be >= 0, got " + timeout);
        }
        if (timeout.compareTo(config.maxTimeout()) > 0) {
            log.warn("Timeout {} for {} exceeds maximum {}, capping", timeout, service, config.maxTimeout());
            return config.maxTimeout().toNanos();
        }
        return timeout.toNanos();
    }

    private long backoffDeadline(String service) {
        backoffLock.lock();
        try {
            return backoffUntil.get(service);
        } finally {
            backoffLock.unlock();
        }
    }

    private static long toNanosSaturated(Duration duration) {
        try {
            return duration.toNanos();
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }

    private static long saturatedAdd(long a, long b) {
        long sum = a + b;
        // Overflow only when both operands share a sign the result lacks
        if (((a ^ sum) & (b ^ sum)) < 0) {
            return b > 0 ? Long.MAX_VALUE : Long.MIN_VALUE + 1;
        }
        return sum;
    }
}
