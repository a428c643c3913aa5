package callguard.engine;

import callguard.core.model.InvalidConfigurationException;

/**
 * Rate limit of a single upstream service.
 *
 * @param requestsPerMinute Sustained rate, in (0, 10000]
 * @param burstCapacity Bucket size; at least 1 so a single call can ever be admitted
 */
public record ServiceLimit(
    double requestsPerMinute,
    double burstCapacity
) {
    public static final double MAX_REQUESTS_PER_MINUTE = 10_000;
    static final double MAX_DERIVED_BURST = 5.0;

    public ServiceLimit {
        if (!(requestsPerMinute > 0)) {
            throw new InvalidConfigurationException("requestsPerMinute must be > 0, got " + requestsPerMinute);
        }
        if (requestsPerMinute > MAX_REQUESTS_PER_MINUTE) {
            throw new InvalidConfigurationException("requestsPerMinute unreasonably high: " + requestsPerMinute);
        }
        if (!(burstCapacity >= 1.0) || Double.isInfinite(burstCapacity)) {
            throw new InvalidConfigurationException("burstCapacity must be >= 1 and finite, got " + burstCapacity);
        }
    }

    /**
     * Limit with a burst derived from the rate: one twelfth of the per-minute budget
     * (five seconds' worth), between 1 and 5 tokens.
     */
    public static ServiceLimit perMinute(double requestsPerMinute) {
        double burst = Math.max(1.0, Math.min(MAX_DERIVED_BURST, requestsPerMinute / 12.0));
        return new ServiceLimit(requestsPerMinute, burst);
    }

    public double ratePerSecond() {
        return requestsPerMinute / 60.0;
    }
}
