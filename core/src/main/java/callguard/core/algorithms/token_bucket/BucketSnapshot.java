package callguard.core.algorithms.token_bucket;

/**
 * Point-in-time view of a {@link TokenBucket}, read under the bucket's monitor.
 *
 * @param tokens Tokens available after refill
 * @param capacity Maximum tokens
 * @param ratePerSecond Refill rate
 * @param nanosToNextToken Wait until one whole token is available (0 if available now)
 */
public record BucketSnapshot(
    double tokens,
    double capacity,
    double ratePerSecond,
    long nanosToNextToken
) {
}
