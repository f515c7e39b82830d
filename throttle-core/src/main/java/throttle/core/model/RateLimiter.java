package throttle.core.model;

import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Admission contract: no I/O, no background threads.
 *
 * A key queried with a different limit or period is a separate rate-limit
 * domain with its own bucket.
 */
public interface RateLimiter {

    /**
     * Checks whether the current request must be denied, consuming one token when it is not.
     *
     * @param context host call context supplying the current time
     * @param key opaque key bytes; {@code null} is always denied
     * @param limit bucket capacity, must be > 0
     * @param period time to refill a full bucket, must be positive
     * @return true if denied, false if admitted
     */
    boolean isDenied(CallContext context, byte[] key, long limit, Duration period);

    default boolean isDenied(CallContext context, String key, long limit, Duration period) {
        return isDenied(context, key == null ? null : key.getBytes(StandardCharsets.UTF_8), limit, period);
    }
}
