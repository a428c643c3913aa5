package callguard.engine;

import callguard.core.algorithms.token_bucket.TokenBucket;

import java.util.concurrent.Semaphore;

/**
 * Per-service state held by the {@link RateLimiter}.
 *
 * This class encapsulates:
 * - The token bucket (internally synchronized)
 * - The waiter gate bounding how many callers may block on this service
 *
 * The backoff deadline is not stored here: it lives in the limiter's backoff map
 * so that every backoff transition goes through a single lock.
 */
final class ServiceEntry {

    private final String name;
    private final TokenBucket bucket;
    private final Semaphore waiterGate;
    private final int maxWaiters;

    ServiceEntry(String name, TokenBucket bucket, int maxWaiters) {
        if (bucket == null) {
            throw new IllegalArgumentException("bucket cannot be null");
        }
        this.name = name;
        this.bucket = bucket;
        this.maxWaiters = maxWaiters;
        this.waiterGate = new Semaphore(maxWaiters);
    }

    String name() {
        return name;
    }

    TokenBucket bucket() {
        return bucket;
    }

    /**
     * Takes a waiter slot without blocking.
     *
     * @return false when the gate is saturated
     */
    boolean tryEnter() {
        return waiterGate.tryAcquire();
    }

    void leave() {
        waiterGate.release();
    }

    int activeWaiters() {
        return maxWaiters - waiterGate.availablePermits();
    }

    int maxWaiters() {
        return maxWaiters;
    }
}
