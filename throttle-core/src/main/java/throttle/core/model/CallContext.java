package throttle.core.model;

/**
 * Per-call context supplied by the host.
 *
 * The limiter never reads a clock of its own: the timestamp of each admission
 * check comes from here, which keeps decisions deterministic for a given
 * sequence of timestamps. Any {@link throttle.core.clock.Clock} adapts with
 * {@code clock::nowNanos}.
 */
@FunctionalInterface
public interface CallContext {

    /**
     * @return the current instant in nanoseconds, on the same timeline for every call
     */
    long nowNanos();

    static CallContext at(long nanos) {
        return () -> nanos;
    }
}
