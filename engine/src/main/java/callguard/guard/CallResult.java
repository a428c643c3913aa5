package callguard.guard;

import callguard.core.model.Decision;

import java.time.Duration;
import java.util.Optional;

/**
 * Typed outcome of a guarded provider call.
 *
 * <p>The API client classifies its own response into {@link Success}, {@link Throttled},
 * {@link AuthenticationFailed} or {@link TransientFailure}; {@link CallGuard} adds
 * {@link Refused} when the call never went out. Only throttling feeds back into the
 * rate limiter.
 *
 * @param <T> Response type
 */
public sealed interface CallResult<T> permits
    CallResult.Success,
    CallResult.Throttled,
    CallResult.AuthenticationFailed,
    CallResult.TransientFailure,
    CallResult.Refused {

    /**
     * @param value Response, never null
     * @param cached True when served from the response cache
     */
    record Success<T>(T value, boolean cached) implements CallResult<T> {
        public Success {
            if (value == null) throw new IllegalArgumentException("value cannot be null");
        }
    }

    /**
     * Provider rejected the call for rate reasons (HTTP 429 and friends).
     *
     * @param retryAfter Provider-stated cooldown, null when the provider gave none
     */
    record Throttled<T>(Duration retryAfter) implements CallResult<T> {
        public Throttled {
            if (retryAfter != null && retryAfter.isNegative()) {
                throw new IllegalArgumentException("retryAfter must be >= 0, got " + retryAfter);
            }
        }

        public Optional<Duration> retryAfterHint() {
            return Optional.ofNullable(retryAfter);
        }
    }

    /**
     * Credentials were missing or rejected; retrying will not help.
     */
    record AuthenticationFailed<T>(String detail) implements CallResult<T> {
    }

    /**
     * Timeout, connection reset, 5xx or a malformed body; a later retry may succeed.
     */
    record TransientFailure<T>(String detail, Throwable cause) implements CallResult<T> {
    }

    /**
     * The rate limiter did not admit the call.
     */
    record Refused<T>(Decision decision) implements CallResult<T> {
        public Refused {
            if (decision == null || decision == Decision.ADMITTED) {
                throw new IllegalArgumentException("refusal needs a non-admitting decision, got " + decision);
            }
        }
    }

    static <T> CallResult<T> success(T value) {
        return new Success<>(value, false);
    }

    static <T> CallResult<T> throttled() {
        return new Throttled<>(null);
    }

    static <T> CallResult<T> throttled(Duration retryAfter) {
        return new Throttled<>(retryAfter);
    }

    static <T> CallResult<T> authenticationFailed(String detail) {
        return new AuthenticationFailed<>(detail);
    }

    static <T> CallResult<T> transientFailure(String detail, Throwable cause) {
        return new TransientFailure<>(detail, cause);
    }

    default boolean isSuccess() {
        return this instanceof Success;
    }

    default Optional<T> successValue() {
        if (this instanceof Success<T> success) {
            return Optional.of(success.value());
        }
        return Optional.empty();
    }
}
