package callguard.core.clock;

import java.util.concurrent.TimeUnit;

/**
 * Monotonic time source injected into every time-dependent component.
 *
 * <p>{@link #sleepNanos(long)} is part of the contract so that blocking waits
 * can be driven deterministically in tests (see {@link ManualClock}).
 */
public interface Clock {

    /**
     * @return monotonic timestamp in nanoseconds; only differences are meaningful
     */
    long nowNanos();

    /**
     * Blocks the calling thread for roughly {@code nanos} nanoseconds.
     *
     * @param nanos time to sleep, no-op when {@code <= 0}
     * @throws InterruptedException if the thread is interrupted while sleeping
     */
    default void sleepNanos(long nanos) throws InterruptedException {
        if (nanos <= 0) return;
        TimeUnit.NANOSECONDS.sleep(nanos);
    }
}
