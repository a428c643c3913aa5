package callguard.core.clock;

/**
 * Deterministic clock for tests.
 *
 * <p>Sleeping does not block: it advances the clock by the requested amount and
 * records the total, so a blocking wait can be asserted on without real delays.
 * Intended for single-threaded tests.
 */
public final class ManualClock implements Clock {
    private volatile long now;
    private volatile long sleptNanos;
    private volatile int sleeps;

    public ManualClock(long startNanos) {
        this.now = startNanos;
    }

    @Override
    public long nowNanos() {
        return now;
    }

    @Override
    public void sleepNanos(long nanos) {
        if (nanos <= 0) return;
        now += nanos;
        sleptNanos += nanos;
        sleeps++;
    }

    public void advanceNanos(long delta) {
        if (delta < 0) throw new IllegalArgumentException("delta < 0");
        now += delta;
    }

    public void advanceSeconds(double seconds) {
        advanceNanos((long) (seconds * 1_000_000_000d));
    }

    public void setNanos(long value) {
        now = value;
    }

    /** Total time passed to {@link #sleepNanos(long)} so far. */
    public long sleptNanos() {
        return sleptNanos;
    }

    /** Number of non-trivial sleeps so far. */
    public int sleeps() {
        return sleeps;
    }
}
