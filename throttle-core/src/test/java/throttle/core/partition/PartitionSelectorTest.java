package throttle.core.partition;

import org.junit.jupiter.api.Test;
import throttle.core.digest.Digest;
import throttle.core.digest.DigestFunction;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class PartitionSelectorTest {

    @Test
    void selectsFromFirstByte() {
        byte[] raw = new byte[Digest.LENGTH];
        raw[0] = (byte) 0xAB;
        Digest d = Digest.of(raw);

        assertEquals(0xB, new PartitionSelector(16).select(d));
        assertEquals(0, new PartitionSelector(1).select(d));
        assertEquals(0xAB, new PartitionSelector(256).select(d));
    }

    @Test
    void spreadsKeysOverAllPartitions() {
        PartitionSelector selector = new PartitionSelector(16);
        int[] hits = new int[16];

        for (int i = 0; i < 16_000; i++) {
            Digest d = DigestFunction.digest(("key-" + i).getBytes(StandardCharsets.UTF_8), 10, 1_000_000_000L);
            hits[selector.select(d)]++;
        }

        for (int count : hits) {
            // Expected 1000 per shard
            assertTrue(count > 800 && count < 1200, "uneven distribution: " + count);
        }
    }

    @Test
    void rejectsCountsThatAreNotPowersOfTwo() {
        assertThrows(IllegalArgumentException.class, () -> new PartitionSelector(0));
        assertThrows(IllegalArgumentException.class, () -> new PartitionSelector(12));
        assertThrows(IllegalArgumentException.class, () -> new PartitionSelector(512));
        assertEquals(8, new PartitionSelector(8).partitions());
    }
}
