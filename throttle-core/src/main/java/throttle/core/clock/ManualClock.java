package throttle.core.clock;

/**
 * Settable clock for deterministic tests. Not thread-safe for writes;
 * concurrent readers see whatever value was last published.
 */
public final class ManualClock implements Clock {
    private volatile long now;

    public ManualClock(long startNanos) {
        this.now = startNanos;
    }

    @Override
    public long nowNanos() {
        return now;
    }

    public void advanceNanos(long delta) {
        if (delta < 0) throw new IllegalArgumentException("delta < 0");
        now += delta;
    }

    public void advanceMillis(long deltaMillis) {
        advanceNanos(deltaMillis * 1_000_000L);
    }

    /**
     * Sets the clock to an arbitrary value, including one in the past.
     * Useful to simulate a clock regression.
     */
    public void setNanos(long value) {
        now = value;
    }
}
