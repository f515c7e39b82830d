package throttle.core.clock;

/**
 * Source of the current instant in nanoseconds.
 * Only differences between two readings are meaningful.
 */
public interface Clock {
    long nowNanos();
}
