package throttle.core.digest;

import java.util.Arrays;
import java.util.HexFormat;

/**
 * Fixed-length SHA-256 digest identifying one token bucket.
 *
 * Instances are immutable; the backing array is copied on the way in and never handed out.
 * Ordering is unsigned lexicographic so digests can key a sorted map.
 */
public final class Digest implements Comparable<Digest> {

    public static final int LENGTH = 32;

    private final byte[] bytes;
    private final int hash;

    private Digest(byte[] bytes) {
        this.bytes = bytes;
        this.hash = Arrays.hashCode(bytes);
    }

    /**
     * Wraps a copy of the given digest bytes.
     *
     * @throws IllegalArgumentException if bytes is null or not {@value #LENGTH} bytes long
     */
    public static Digest of(byte[] bytes) {
        if (bytes == null) throw new IllegalArgumentException("bytes cannot be null");
        if (bytes.length != LENGTH) {
            throw new IllegalArgumentException("digest must be " + LENGTH + " bytes, got: " + bytes.length);
        }
        return new Digest(bytes.clone());
    }

    static Digest wrap(byte[] bytes) {
        return new Digest(bytes);
    }

    /**
     * Unsigned value of the byte at {@code index}.
     */
    public int byteAt(int index) {
        return bytes[index] & 0xFF;
    }

    public byte[] toByteArray() {
        return bytes.clone();
    }

    @Override
    public int compareTo(Digest other) {
        return Arrays.compareUnsigned(bytes, other.bytes);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Digest)) return false;
        Digest other = (Digest) o;
        return hash == other.hash && Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return HexFormat.of().formatHex(bytes);
    }
}
