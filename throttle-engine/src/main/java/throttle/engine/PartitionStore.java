package throttle.engine;

import throttle.core.digest.Digest;
import throttle.core.partition.PartitionSelector;

/**
 * Fixed array of independently locked partitions.
 *
 * The store is created empty and lives until {@link #destroy()}; after that any
 * attempt to route a digest fails, since a released store must not hand out state.
 */
public final class PartitionStore {

    private final PartitionSelector selector;
    private final Partition[] partitions;
    private volatile boolean released;

    public PartitionStore(ThrottleConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.selector = new PartitionSelector(config.partitions());
        this.partitions = new Partition[config.partitions()];
        for (int i = 0; i < partitions.length; i++) {
            partitions[i] = new Partition(i, config.gcInterval());
        }
    }

    /**
     * Returns the partition owning a digest.
     *
     * @throws ThrottleUnavailableException if the store has been destroyed
     */
    Partition partitionFor(Digest digest) {
        if (released) {
            throw new ThrottleUnavailableException("partition store has been released");
        }
        return partitions[selector.select(digest)];
    }

    Partition partition(int index) {
        return partitions[index];
    }

    /**
     * Drops every bucket of every partition and marks the store released.
     * Partitions are cleared one at a time, never two locks at once.
     *
     * @return Number of buckets dropped
     */
    public int destroy() {
        released = true;
        int dropped = 0;
        for (Partition partition : partitions) {
            dropped += partition.release();
        }
        return dropped;
    }

    public boolean isReleased() {
        return released;
    }

    /**
     * Returns the number of live buckets across all partitions.
     * Each partition is counted under its own lock, so the total is a snapshot per shard.
     */
    public int size() {
        int total = 0;
        for (Partition partition : partitions) {
            total += partition.size();
        }
        return total;
    }

    public int partitionCount() {
        return partitions.length;
    }
}
