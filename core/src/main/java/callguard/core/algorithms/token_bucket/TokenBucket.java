package callguard.core.algorithms.token_bucket;

import callguard.core.clock.Clock;
import callguard.core.model.InvalidConfigurationException;

import java.time.Duration;

/**
 * Token Bucket:
 * - capacity: max tokens (burst size), fractional values allowed
 * - ratePerSecond: continuous refill
 *
 * Starts full. Refill is computed lazily from the elapsed clock time on every access.
 *
 * Thread-safety: synchronized, so refill + consume is one atomic step and concurrent
 * callers never refill from a stale timestamp or spend the same token twice.
 */
public final class TokenBucket {
    private static final double NANOS_PER_SECOND = 1_000_000_000d;

    private final Clock clock;
    private final double capacity;
    private final double ratePerSecond;
    private final double refillPerNanos;

    private double tokens;
    private long lastNanos;

    public TokenBucket(Clock clock, double capacity, double ratePerSecond) {
        if (clock == null) throw new IllegalArgumentException("clock cannot be null");
        if (!(capacity > 0) || Double.isInfinite(capacity)) {
            throw new InvalidConfigurationException("capacity must be > 0 and finite, got " + capacity);
        }
        if (!(ratePerSecond > 0) || Double.isInfinite(ratePerSecond)) {
            throw new InvalidConfigurationException("rate must be > 0 and finite, got " + ratePerSecond);
        }
        this.clock = clock;
        this.capacity = capacity;
        this.ratePerSecond = ratePerSecond;
        this.refillPerNanos = ratePerSecond / NANOS_PER_SECOND;
        this.tokens = capacity;
        this.lastNanos = clock.nowNanos();
    }

    public boolean tryConsume() {
        return tryConsume(1);
    }

    /**
     * Refills, then takes {@code permits} tokens if that many are available.
     *
     * @return true if the tokens were taken; false leaves the level untouched
     */
    public synchronized boolean tryConsume(int permits) {
        if (permits <= 0) throw new IllegalArgumentException("permits <= 0");
        refill();

        if (tokens >= permits) {
            tokens -= permits;
            return true;
        }
        return false;
    }

    /**
     * Nanoseconds until one whole token is available, 0 if one is available now.
     */
    public synchronized long nanosToNextToken() {
        refill();
        return waitForOneToken();
    }

    public Duration timeToNextToken() {
        return Duration.ofNanos(nanosToNextToken());
    }

    public synchronized BucketSnapshot snapshot() {
        refill();
        return new BucketSnapshot(tokens, capacity, ratePerSecond, waitForOneToken());
    }

    public synchronized double availableTokens() {
        refill();
        return tokens;
    }

    public double capacity() {
        return capacity;
    }

    public double ratePerSecond() {
        return ratePerSecond;
    }

    private long waitForOneToken() {
        if (tokens >= 1.0) return 0L;
        return (long) Math.ceil((1.0 - tokens) / refillPerNanos);
    }

    private void refill() {
        long now = clock.nowNanos();
        long elapsed = Math.max(0L, now - lastNanos);
        if (elapsed == 0) return;

        tokens = Math.min(capacity, tokens + elapsed * refillPerNanos);
        lastNanos = now;
    }
}
