package callguard.core.clock;

/**
 * Production clock: {@link System#nanoTime()} for time, and the inherited
 * {@link Clock#sleepNanos(long)} really parks the calling thread.
 *
 * <p>Rate limiters and caches built on it share the one {@link #instance()};
 * tests that need determinism use {@link ManualClock} instead.
 */
public final class SystemClock implements Clock {
    private static final SystemClock INSTANCE = new SystemClock();

    private SystemClock() {
    }

    public static SystemClock instance() {
        return INSTANCE;
    }

    @Override
    public long nowNanos() {
        return System.nanoTime();
    }
}
