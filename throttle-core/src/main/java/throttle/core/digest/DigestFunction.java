package throttle.core.digest;

import java.nio.ByteBuffer;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Maps (key, limit, period) to a {@link Digest}.
 *
 * Input order is fixed: key bytes, then limit as 8 big-endian bytes, then period
 * in nanoseconds as 8 big-endian bytes. Because limit and period are hashed in,
 * the same key under a different quota lands on a different bucket.
 *
 * Thread-safety: stateless; each thread reuses its own MessageDigest.
 */
public final class DigestFunction {

    private static final String ALGORITHM = "SHA-256";

    private static final ThreadLocal<MessageDigest> SHA256 = ThreadLocal.withInitial(DigestFunction::newSha256);

    private DigestFunction() {
        // Utility class, no instantiation
    }

    /**
     * Computes the digest of a bucket identity.
     *
     * @param key key bytes, may be empty
     * @param limit configured limit
     * @param periodNanos configured period in nanoseconds
     * @return digest covering all three inputs
     * @throws IllegalArgumentException if key is null
     */
    public static Digest digest(byte[] key, long limit, long periodNanos) {
        if (key == null) throw new IllegalArgumentException("key cannot be null");

        MessageDigest sha = SHA256.get();
        sha.reset();
        sha.update(key);
        sha.update(ByteBuffer.allocate(2 * Long.BYTES)
            .putLong(limit)
            .putLong(periodNanos)
            .array());
        return Digest.wrap(sha.digest());
    }

    private static MessageDigest newSha256() {
        try {
            return MessageDigest.getInstance(ALGORITHM);
        } catch (NoSuchAlgorithmException e) {
            // Every Java platform is required to ship SHA-256
            throw new IllegalStateException(ALGORITHM + " not available", e);
        }
    }
}
