package throttle.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import throttle.core.bucket.TokenBucket;
import throttle.core.digest.Digest;
import throttle.core.model.CallContext;
import throttle.core.model.Decision;

import java.util.NavigableMap;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One shard of the bucket store.
 *
 * This class encapsulates:
 * - A ReentrantLock guarding everything below
 * - The buckets of this shard, ordered by digest
 * - The call counter that triggers idle sweeps
 *
 * Thread-safety:
 * - Every access to the map or the counter happens with the lock held
 * - No method takes the lock of another partition, so shards never wait on each other
 */
final class Partition {

    private static final Logger log = LoggerFactory.getLogger(Partition.class);

    private final int index;
    private final int gcInterval;
    private final ReentrantLock lock;
    private final NavigableMap<Digest, TokenBucket> buckets;

    private int callsSinceSweep;
    private boolean released;

    Partition(int index, int gcInterval) {
        if (gcInterval <= 0) {
            throw new IllegalArgumentException("gcInterval must be > 0");
        }
        this.index = index;
        this.gcInterval = gcInterval;
        this.lock = new ReentrantLock(); // Non-fair for better throughput
        this.buckets = new TreeMap<>();
    }

    /**
     * Runs one admission check against the bucket for {@code digest}.
     *
     * Under the lock: read the time, get-or-create, refill, consume, then an idle sweep
     * on every {@code gcInterval}-th call. The time is read after the lock is taken so that,
     * with a monotonic context, {@code lastUsed} never moves backwards.
     *
     * @throws ThrottleUnavailableException if the partition has been released
     * @throws IllegalStateException on clock regression
     */
    Decision tryAcquire(Digest digest, long limit, long periodNanos, CallContext context) {
        lock.lock();
        try {
            if (released) {
                throw new ThrottleUnavailableException("partition " + index + " has been released");
            }
            long nowNanos = context.nowNanos();
            TokenBucket bucket = getOrCreate(digest, limit, periodNanos, nowNanos);
            try {
                bucket.refill(nowNanos);
            } catch (IllegalStateException e) {
                log.error("Partition {}: clock regression on bucket {}: {}", index, bucket.digest(), e.getMessage());
                throw e;
            }
            Decision decision = bucket.tryConsume(nowNanos);

            if (++callsSinceSweep >= gcInterval) {
                callsSinceSweep = 0;
                int evicted = IdleBucketCollector.sweepIdle(buckets, nowNanos);
                if (log.isDebugEnabled()) {
                    log.debug("Partition {}: evicted {} idle buckets, {} remain", index, evicted, buckets.size());
                }
            }
            return decision;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the bucket for a digest, inserting a full one stamped with {@code nowNanos} on a miss.
     * MUST be called while holding the lock.
     */
    TokenBucket getOrCreate(Digest digest, long limit, long periodNanos, long nowNanos) {
        requireLockHeld();
        TokenBucket bucket = buckets.get(digest);
        if (bucket == null) {
            bucket = new TokenBucket(digest, limit, periodNanos, nowNanos);
            buckets.put(digest, bucket);
        }
        return bucket;
    }

    /**
     * Looks a bucket up without creating it.
     * MUST be called while holding the lock.
     */
    TokenBucket find(Digest digest) {
        requireLockHeld();
        return buckets.get(digest);
    }

    /**
     * Drops every bucket and refuses any later check. A caller that routed here before the
     * release and is still waiting for the lock sees the flag once it gets in.
     *
     * @return Number of buckets dropped
     */
    int release() {
        lock.lock();
        try {
            released = true;
            callsSinceSweep = 0;
            return IdleBucketCollector.sweepAll(buckets);
        } finally {
            lock.unlock();
        }
    }

    int size() {
        lock.lock();
        try {
            return buckets.size();
        } finally {
            lock.unlock();
        }
    }

    ReentrantLock getLock() {
        return lock;
    }

    private void requireLockHeld() {
        if (!lock.isHeldByCurrentThread()) {
            throw new IllegalStateException("partition " + index + " lock not held");
        }
    }
}
