package throttle.engine;

import throttle.core.digest.Digest;
import throttle.core.digest.DigestFunction;
import throttle.core.model.CallContext;
import throttle.core.model.Decision;
import throttle.core.model.RateLimiter;

import java.time.Duration;

/**
 * Thread-safe token bucket limiter over a partitioned store.
 *
 * Features:
 * - One bucket per (key, limit, period), identified by its SHA-256 digest
 * - Fixed number of shards, each with its own lock, picked from the digest
 * - Lazy refill on each check, no background threads
 * - Idle buckets evicted inline every {@code gcInterval} calls per shard
 *
 * Thread-safety:
 * - Digesting happens outside any lock
 * - Exactly one shard lock is held for the rest of the check, time included
 * - Calls routed to different shards never contend
 *
 * Usage example:
 * <pre>
 * ThrottleEngine engine = new ThrottleEngine(ThrottleConfig.defaults());
 * CallContext ctx = SystemClock.instance()::nowNanos;
 *
 * if (engine.isDenied(ctx, "client:10.0.0.1", 10, Duration.ofSeconds(1))) {
 *     // Reply 429
 * }
 * </pre>
 */
public final class ThrottleEngine implements RateLimiter {

    private final PartitionStore store;

    /**
     * Creates an engine owning a fresh store.
     *
     * @param config Store configuration
     */
    public ThrottleEngine(ThrottleConfig config) {
        this(new PartitionStore(config));
    }

    /**
     * Creates an engine over an existing store (shared by {@link ThrottleModule}).
     *
     * @param store Partition store
     * @throws IllegalArgumentException if store is null
     */
    public ThrottleEngine(PartitionStore store) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        this.store = store;
    }

    /**
     * Checks a request against the bucket for (key, limit, period).
     *
     * A null key is denied straight away: no digest, no shard, no state change.
     * Otherwise one token is consumed if available.
     *
     * @param context Host context supplying the current time
     * @param key Key bytes (null is always denied)
     * @param limit Bucket capacity (must be > 0)
     * @param period Full refill period (must be positive)
     * @return true if the request is denied
     * @throws IllegalArgumentException if context, limit or period is invalid
     * @throws ThrottleUnavailableException if the store has been released
     * @throws IllegalStateException on clock regression
     */
    @Override
    public boolean isDenied(CallContext context, byte[] key, long limit, Duration period) {
        if (key == null) {
            return true;
        }
        if (context == null) {
            throw new IllegalArgumentException("context cannot be null");
        }
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be > 0, got: " + limit);
        }
        long periodNanos = toPeriodNanos(period);

        Digest digest = DigestFunction.digest(key, limit, periodNanos);
        Partition partition = store.partitionFor(digest);

        return partition.tryAcquire(digest, limit, periodNanos, context) == Decision.REJECT;
    }

    private static long toPeriodNanos(Duration period) {
        if (period == null) {
            throw new IllegalArgumentException("period cannot be null");
        }
        if (period.isZero() || period.isNegative()) {
            throw new IllegalArgumentException("period must be > 0, got: " + period);
        }
        try {
            return period.toNanos();
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("period too large: " + period, e);
        }
    }

    /**
     * Returns the number of live buckets.
     */
    public int size() {
        return store.size();
    }

    public int partitionCount() {
        return store.partitionCount();
    }

    PartitionStore store() {
        return store;
    }
}
