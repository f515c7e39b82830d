package throttle.core.clock;

/**
 * Real system clock - uses System.nanoTime().
 * Monotonic, so elapsed time between two readings is never negative.
 */
public final class SystemClock implements Clock {
    private static final SystemClock INSTANCE = new SystemClock();

    public static SystemClock instance() {
        return INSTANCE;
    }

    @Override
    public long nowNanos() {
        return System.nanoTime();
    }
}
