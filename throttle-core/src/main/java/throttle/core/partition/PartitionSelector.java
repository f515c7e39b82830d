package throttle.core.partition;

import throttle.core.digest.Digest;

/**
 * Picks a shard for a digest from its first byte.
 *
 * The shard count must be a power of two no larger than 256 so that masking the
 * first byte with {@code count - 1} is uniform over all shards.
 */
public final class PartitionSelector {

    public static final int MAX_PARTITIONS = 256;

    private final int mask;

    public PartitionSelector(int partitions) {
        if (!isValidCount(partitions)) {
            throw new IllegalArgumentException(
                "partitions must be a power of two in [1, " + MAX_PARTITIONS + "], got: " + partitions);
        }
        this.mask = partitions - 1;
    }

    public static boolean isValidCount(int partitions) {
        return partitions > 0 && partitions <= MAX_PARTITIONS && Integer.bitCount(partitions) == 1;
    }

    public int select(Digest digest) {
        return digest.byteAt(0) & mask;
    }

    public int partitions() {
        return mask + 1;
    }
}
