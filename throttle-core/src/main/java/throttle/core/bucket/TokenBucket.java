package throttle.core.bucket;

import throttle.core.digest.Digest;
import throttle.core.model.Decision;

/**
 * Token Bucket for one digest:
 * - capacity: tokens max, equal to the limit it was created with
 * - periodNanos: time for an empty bucket to refill completely
 *
 * Refill is lazy and linear: tokens are topped up from the elapsed time whenever
 * the bucket is checked, no timer involved. Whole tokens only, so fractional
 * refill between two checks is dropped.
 *
 * Thread-safety: none. The owning shard's lock must be held for every call.
 */
public final class TokenBucket {
    private final Digest digest;
    private final long capacity;
    private final long periodNanos;

    private long tokens;
    private long lastUsedNanos;

    public TokenBucket(Digest digest, long capacity, long periodNanos, long nowNanos) {
        if (digest == null) throw new IllegalArgumentException("digest cannot be null");
        if (capacity <= 0) throw new IllegalArgumentException("capacity <= 0");
        if (periodNanos <= 0) throw new IllegalArgumentException("period <= 0");
        this.digest = digest;
        this.capacity = capacity;
        this.periodNanos = periodNanos;
        this.tokens = capacity;
        this.lastUsedNanos = nowNanos;
    }

    /**
     * Adds the tokens earned since the last successful consumption, capped at capacity.
     * Does not move the refill baseline.
     *
     * @throws IllegalStateException if now is before the last use (clock regression)
     */
    public void refill(long nowNanos) {
        long elapsed = elapsedSince(nowNanos);
        if (elapsed == 0 || tokens == capacity) return;

        double earned = Math.floor(((double) elapsed / periodNanos) * capacity);
        if (earned >= capacity - tokens) {
            tokens = capacity;
        } else {
            tokens += (long) earned;
        }
    }

    /**
     * Takes one token if any is left. A rejection leaves the bucket untouched.
     */
    public Decision tryConsume(long nowNanos) {
        if (tokens > 0) {
            tokens--;
            lastUsedNanos = nowNanos;
            return Decision.ALLOW;
        }
        return Decision.REJECT;
    }

    /**
     * A bucket unused for longer than its period has refilled completely and can be
     * dropped without changing any later decision.
     */
    public boolean isIdle(long nowNanos) {
        return nowNanos - lastUsedNanos > periodNanos;
    }

    private long elapsedSince(long nowNanos) {
        long elapsed = nowNanos - lastUsedNanos;
        if (elapsed < 0) {
            throw new IllegalStateException(
                "clock went backwards: now=" + nowNanos + " < lastUsed=" + lastUsedNanos + " for " + digest);
        }
        return elapsed;
    }

    public Digest digest() {
        return digest;
    }

    public long capacity() {
        return capacity;
    }

    public long periodNanos() {
        return periodNanos;
    }

    public long tokens() {
        return tokens;
    }

    public long lastUsedNanos() {
        return lastUsedNanos;
    }
}
