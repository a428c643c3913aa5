package callguard.core.model;

/**
 * Thrown for values that can never be valid: non-positive rates or capacities,
 * negative timeouts or TTLs, TTLs beyond the allowed maximum.
 *
 * <p>Extends {@link IllegalArgumentException} so callers validating arguments
 * the usual way keep working.
 */
public class InvalidConfigurationException extends IllegalArgumentException {

    public InvalidConfigurationException(String message) {
        super(message);
    }

    public InvalidConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
