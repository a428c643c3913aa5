package callguard.engine;

import java.time.Duration;
import java.util.OptionalLong;

/**
 * Snapshot of one service, taken by {@link RateLimiter#getStats()}.
 *
 * @param service Service name
 * @param availableTokens Tokens in the bucket after refill
 * @param capacity Bucket capacity
 * @param ratePerSecond Refill rate
 * @param nextTokenWait Wait until a whole token is available
 * @param backoffUntilNanos Backoff deadline on the limiter's clock, empty when idle
 * @param backoffRemaining Time left in backoff, zero when idle
 * @param activeWaiters Callers currently inside acquire for this service
 */
public record ServiceStats(
    String service,
    double availableTokens,
    double capacity,
    double ratePerSecond,
    Duration nextTokenWait,
    OptionalLong backoffUntilNanos,
    Duration backoffRemaining,
    int activeWaiters
) {
    public boolean inBackoff() {
        return !backoffRemaining.isZero();
    }
}
