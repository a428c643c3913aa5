package callguard.core.model;

/**
 * Outcome of an admission attempt.
 *
 * <p>Only {@link #ADMITTED} lets the caller proceed. The refusals are ordinary
 * return values so hot-path callers can branch without exception handling.
 */
public enum Decision {
    /** A token was consumed; the call may go out. */
    ADMITTED,

    /** The caller's timeout ran out (token starvation or a backoff outlasting it). */
    TIMED_OUT,

    /** Too many callers are already waiting on the same service. */
    SATURATED,

    /** The waiting thread was interrupted; the interrupt flag is restored. */
    INTERRUPTED
}
