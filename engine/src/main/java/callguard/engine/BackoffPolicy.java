package callguard.engine;

import callguard.core.model.InvalidConfigurationException;

import java.time.Duration;

/**
 * Exponential backoff applied when a provider throttles without telling us how long to wait.
 *
 * <pre>
 * Idle        --throttled--> Backoff(base)
 * Backoff(d)  --throttled--> Backoff(min(2d, cap))   d = remaining time
 * Backoff     --reset------> Idle
 * </pre>
 *
 * @param base First backoff when none is active
 * @param cap Ceiling for the doubled backoff
 */
public record BackoffPolicy(
    Duration base,
    Duration cap
) {
    public static final Duration DEFAULT_BASE = Duration.ofSeconds(60);
    public static final Duration DEFAULT_CAP = Duration.ofSeconds(300);
    public static final Duration MAX_CAP = Duration.ofDays(1);

    public BackoffPolicy {
        if (base == null || cap == null) throw new IllegalArgumentException("base and cap cannot be null");
        if (base.isNegative() || base.isZero()) {
            throw new InvalidConfigurationException("backoff base must be > 0, got " + base);
        }
        if (cap.compareTo(base) < 0) {
            throw new InvalidConfigurationException("backoff cap " + cap + " is below base " + base);
        }
        if (cap.compareTo(MAX_CAP) > 0) {
            throw new InvalidConfigurationException("backoff cap " + cap + " exceeds maximum " + MAX_CAP);
        }
    }

    public static BackoffPolicy defaults() {
        return new BackoffPolicy(DEFAULT_BASE, DEFAULT_CAP);
    }

    /**
     * @param remainingNanos Remaining time of the active backoff, {@code <= 0} when idle
     * @return Length of the next backoff in nanoseconds
     */
    public long nextBackoffNanos(long remainingNanos) {
        if (remainingNanos <= 0) {
            return base.toNanos();
        }
        long capNanos = cap.toNanos();
        if (remainingNanos >= capNanos / 2) {
            return capNanos;
        }
        return remainingNanos * 2;
    }
}
