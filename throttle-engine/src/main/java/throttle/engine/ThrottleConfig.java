package throttle.engine;

import throttle.core.partition.PartitionSelector;

import java.util.Properties;

/**
 * Configuration for a partitioned bucket store.
 *
 * @param partitions Number of independently locked shards (power of two, at most 256)
 * @param gcInterval Consumption attempts on a shard between two idle sweeps of that shard
 */
public record ThrottleConfig(
    int partitions,
    int gcInterval
) {
    public static final int DEFAULT_PARTITIONS = 16;
    public static final int DEFAULT_GC_INTERVAL = 1000;

    public static final String PARTITIONS_PROPERTY = "throttle.partitions";
    public static final String GC_INTERVAL_PROPERTY = "throttle.gc-interval";

    public ThrottleConfig {
        if (!PartitionSelector.isValidCount(partitions)) {
            throw new IllegalArgumentException(
                "partitions must be a power of two in [1, " + PartitionSelector.MAX_PARTITIONS + "], got: " + partitions);
        }
        if (gcInterval <= 0) throw new IllegalArgumentException("gcInterval must be > 0");
    }

    /**
     * 16 partitions, sweep every 1000 calls per partition.
     */
    public static ThrottleConfig defaults() {
        return new ThrottleConfig(DEFAULT_PARTITIONS, DEFAULT_GC_INTERVAL);
    }

    /**
     * Reads {@value #PARTITIONS_PROPERTY} and {@value #GC_INTERVAL_PROPERTY}, falling back to
     * the defaults for missing entries.
     *
     * @param properties Source properties (e.g. System.getProperties())
     * @return Validated configuration
     * @throws IllegalArgumentException if a value is present but not a valid integer
     */
    public static ThrottleConfig fromProperties(Properties properties) {
        if (properties == null) throw new IllegalArgumentException("properties cannot be null");

        return new ThrottleConfig(
            intProperty(properties, PARTITIONS_PROPERTY, DEFAULT_PARTITIONS),
            intProperty(properties, GC_INTERVAL_PROPERTY, DEFAULT_GC_INTERVAL)
        );
    }

    private static int intProperty(Properties properties, String name, int defaultValue) {
        String raw = properties.getProperty(name);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be an integer, got: " + raw, e);
        }
    }
}
