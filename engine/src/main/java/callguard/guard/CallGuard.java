package callguard.guard;

import callguard.cache.CacheStats;
import callguard.cache.ResponseCache;
import callguard.core.model.AdmissionResult;
import callguard.core.model.InvalidConfigurationException;
import callguard.engine.RateLimiter;
import callguard.engine.ServiceStats;
import callguard.engine.UnknownServiceException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * The handle every API client is given: one rate limiter and one response cache,
 * owned explicitly instead of reached through process-wide singletons.
 *
 * <p>Besides exposing both components, {@link #execute} runs the outbound-call flow:
 * <ol>
 *   <li>sanitize the endpoint</li>
 *   <li>serve from cache when possible</li>
 *   <li>ask the rate limiter for admission</li>
 *   <li>perform the call</li>
 *   <li>on success store the response and clear backoff; on throttling report it</li>
 * </ol>
 *
 * <p>Exceptions thrown by the call itself propagate unchanged.
 */
@Slf4j
public final class CallGuard {

    public static final Duration DEFAULT_ADMISSION_TIMEOUT = Duration.ofSeconds(30);

    private final RateLimiter rateLimiter;
    private final ResponseCache cache;
    private final Duration admissionTimeout;

    /**
     * @param rateLimiter Shared limiter
     * @param cache Shared response cache
     * @param admissionTimeout How long {@link #execute} may wait for admission
     */
    public CallGuard(RateLimiter rateLimiter, ResponseCache cache, Duration admissionTimeout) {
        if (rateLimiter == null) {
            throw new IllegalArgumentException("rateLimiter cannot be null");
        }
        if (cache == null) {
            throw new IllegalArgumentException("cache cannot be null");
        }
        if (admissionTimeout == null || admissionTimeout.isNegative()) {
            throw new InvalidConfigurationException("admissionTimeout must be >= 0, got " + admissionTimeout);
        }
        this.rateLimiter = rateLimiter;
        this.cache = cache;
        this.admissionTimeout = admissionTimeout;
    }

    public CallGuard(RateLimiter rateLimiter, ResponseCache cache) {
        this(rateLimiter, cache, DEFAULT_ADMISSION_TIMEOUT);
    }

    /**
     * Runs one guarded call.
     *
     * @param service Rate-limited service the endpoint belongs to
     * @param endpoint Provider endpoint path; sanitized before use
     * @param params Query parameters (null means none)
     * @param call Performs the request for the sanitized endpoint and classifies the outcome
     * @return The call's result, a cached {@link CallResult.Success}, or {@link CallResult.Refused}
     * @throws UnknownServiceException if the service is not configured
     * @throws IllegalArgumentException if the endpoint is unsafe
     */
    @SuppressWarnings("unchecked")
    public <T> CallResult<T> execute(String service, String endpoint, Map<String, ?> params,
                                     Function<String, CallResult<T>> call) {
        if (call == null) {
            throw new IllegalArgumentException("call cannot be null");
        }
        if (!rateLimiter.isKnownService(service)) {
            throw new UnknownServiceException(service, rateLimiter.services());
        }
        String path = Endpoints.sanitize(endpoint);

        Optional<Object> cached = cache.get(path, params);
        if (cached.isPresent()) {
            return new CallResult.Success<>((T) cached.get(), true);
        }

        AdmissionResult admission = rateLimiter.tryAcquire(service, admissionTimeout);
        if (!admission.admitted()) {
            log.warn("Call to {} {} not admitted: {}", service, path, admission.decision());
            return new CallResult.Refused<>(admission.decision());
        }

        CallResult<T> result = call.apply(path);
        if (result == null) {
            throw new IllegalStateException("call for " + service + " " + path + " returned no result");
        }

        if (result instanceof CallResult.Success<T> success) {
            cache.set(path, params, success.value());
            rateLimiter.resetBackoff(service);
        } else if (result instanceof CallResult.Throttled<T> throttled) {
            rateLimiter.reportThrottled(service, throttled.retryAfter());
        } else if (result instanceof CallResult.AuthenticationFailed<T> failed) {
            log.error("Authentication failed for {} {}: {}", service, path, failed.detail());
        } else if (result instanceof CallResult.TransientFailure<T> failed) {
            log.warn("Transient failure for {} {}: {}", service, path, failed.detail(), failed.cause());
        }
        return result;
    }

    public boolean acquire(String service, Duration timeout) {
        return rateLimiter.acquire(service, timeout);
    }

    public void reportThrottled(String service) {
        rateLimiter.reportThrottled(service);
    }

    public void reportThrottled(String service, Duration retryAfter) {
        rateLimiter.reportThrottled(service, retryAfter);
    }

    public void resetBackoff(String service) {
        rateLimiter.resetBackoff(service);
    }

    public Optional<Object> cacheGet(String endpoint, Map<String, ?> params) {
        return cache.get(endpoint, params);
    }

    public void cacheSet(String endpoint, Map<String, ?> params, Object value) {
        cache.set(endpoint, params, value);
    }

    public boolean cacheInvalidate(String endpoint, Map<String, ?> params) {
        return cache.invalidate(endpoint, params);
    }

    public Map<String, ServiceStats> getRateLimiterStats() {
        return rateLimiter.getStats();
    }

    public CacheStats getCacheStats() {
        return cache.getStats();
    }

    public RateLimiter rateLimiter() {
        return rateLimiter;
    }

    public ResponseCache cache() {
        return cache;
    }
}
