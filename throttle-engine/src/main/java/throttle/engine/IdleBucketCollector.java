package throttle.engine;

import throttle.core.bucket.TokenBucket;
import throttle.core.digest.Digest;

import java.util.Iterator;
import java.util.Map;

/**
 * Eviction of buckets from a single partition's map.
 *
 * Never runs on its own thread: callers invoke it while holding the
 * partition lock that guards {@code buckets}.
 */
final class IdleBucketCollector {

    private IdleBucketCollector() {
        // Utility class, no instantiation
    }

    /**
     * Removes every bucket unused for longer than its own period.
     *
     * @return Number of buckets evicted
     */
    static int sweepIdle(Map<Digest, TokenBucket> buckets, long nowNanos) {
        int evicted = 0;
        Iterator<TokenBucket> it = buckets.values().iterator();
        while (it.hasNext()) {
            if (it.next().isIdle(nowNanos)) {
                it.remove();
                evicted++;
            }
        }
        return evicted;
    }

    /**
     * Removes every bucket regardless of idleness.
     *
     * @return Number of buckets removed
     */
    static int sweepAll(Map<Digest, TokenBucket> buckets) {
        int removed = buckets.size();
        buckets.clear();
        return removed;
    }
}
