package throttle.engine;

import org.junit.jupiter.api.Test;
import throttle.core.bucket.TokenBucket;
import throttle.core.clock.ManualClock;
import throttle.core.clock.SystemClock;
import throttle.core.digest.Digest;
import throttle.core.digest.DigestFunction;
import throttle.core.model.CallContext;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Concurrency tests for ThrottleEngine.
 *
 * Focus:
 * - Exact accounting under contention on one bucket
 * - Single insertion when many threads create the same bucket
 * - Shards never waiting on each other
 * - Token bounds with sweeps running under load
 */
class ThrottleEngineConcurrencyTest {

    private static final Duration ONE_HOUR = Duration.ofHours(1);

    @Test
    void testConcurrent_sameKeyAdmitsExactlyLimit() throws InterruptedException {
        ManualClock clock = new ManualClock(0L);
        CallContext ctx = clock::nowNanos;
        ThrottleEngine engine = new ThrottleEngine(ThrottleConfig.defaults());

        int numThreads = 20;
        int callsPerThread = 10;
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(numThreads);
        AtomicInteger admitted = new AtomicInteger(0);

        ExecutorService executor = Executors.newFixedThreadPool(numThreads);
        for (int i = 0; i < numThreads; i++) {
            executor.submit(() -> {
                try {
                    startLatch.await();
                    for (int j = 0; j < callsPerThread; j++) {
                        if (!engine.isDenied(ctx, "hot-key", 100, ONE_HOUR)) {
                            admitted.incrementAndGet();
                        }
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    doneLatch.countDown();
                }
            });
        }

        startLatch.countDown();
        assertTrue(doneLatch.await(5, TimeUnit.SECONDS), "Test timed out");
        executor.shutdown();
        assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));

        assertEquals(100, admitted.get());
        assertEquals(1, engine.size());
    }

    @Test
    void testConcurrent_firstCallsCreateOneBucket() throws InterruptedException {
        ManualClock clock = new ManualClock(0L);
        CallContext ctx = clock::nowNanos;
        ThrottleEngine engine = new ThrottleEngine(ThrottleConfig.defaults());

        int numThreads = 50;
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(numThreads);
        AtomicInteger admitted = new AtomicInteger(0);

        ExecutorService executor = Executors.newFixedThreadPool(numThreads);
        for (int i = 0; i < numThreads; i++) {
            executor.submit(() -> {
                try {
                    startLatch.await();
                    if (!engine.isDenied(ctx, "fresh-key", 1, ONE_HOUR)) {
                        admitted.incrementAndGet();
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    doneLatch.countDown();
                }
            });
        }

        startLatch.countDown();
        assertTrue(doneLatch.await(5, TimeUnit.SECONDS));
        executor.shutdown();
        assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));

        // A second inserted bucket would have admitted a second caller
        assertEquals(1, admitted.get());
        assertEquals(1, engine.size());
    }

    @Test
    void testConcurrent_otherShardsDoNotBlock() throws Exception {
        ThrottleEngine engine = new ThrottleEngine(ThrottleConfig.defaults());
        CallContext ctx = CallContext.at(0L);

        String blockedKey = "blocked";
        Partition blocked = engine.store().partitionFor(digest(blockedKey, 10, ONE_HOUR));
        String freeKey = keyOutsidePartition(engine, blocked);

        ExecutorService executor = Executors.newFixedThreadPool(2);
        blocked.getLock().lock();
        try {
            Future<Boolean> free = executor.submit(() -> engine.isDenied(ctx, freeKey, 10, ONE_HOUR));
            assertFalse(free.get(5, TimeUnit.SECONDS), "call on another shard should complete while this one is held");

            Future<Boolean> waiting = executor.submit(() -> engine.isDenied(ctx, blockedKey, 10, ONE_HOUR));
            assertThrows(TimeoutException.class, () -> waiting.get(200, TimeUnit.MILLISECONDS));

            blocked.getLock().unlock();
            assertFalse(waiting.get(5, TimeUnit.SECONDS));
        } finally {
            if (blocked.getLock().isHeldByCurrentThread()) {
                blocked.getLock().unlock();
            }
            executor.shutdown();
        }
        assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));
    }

    @Test
    void testConcurrent_tokensStayInBoundsWithSweeps() throws InterruptedException {
        ThrottleEngine engine = new ThrottleEngine(new ThrottleConfig(4, 10));
        CallContext ctx = SystemClock.instance()::nowNanos;
        Duration period = Duration.ofMillis(5);

        int numThreads = 16;
        int callsPerThread = 5_000;
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(numThreads);

        ExecutorService executor = Executors.newFixedThreadPool(numThreads);
        for (int i = 0; i < numThreads; i++) {
            final int threadId = i;
            executor.submit(() -> {
                try {
                    startLatch.await();
                    for (int j = 0; j < callsPerThread; j++) {
                        engine.isDenied(ctx, "key-" + ((threadId + j) % 32), 3, period);
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    doneLatch.countDown();
                }
            });
        }

        startLatch.countDown();
        assertTrue(doneLatch.await(30, TimeUnit.SECONDS), "Deadlock or starvation - test timed out");
        executor.shutdown();
        assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));

        assertTrue(engine.size() <= 32);
        for (int k = 0; k < 32; k++) {
            Digest d = digest("key-" + k, 3, period);
            Partition partition = engine.store().partitionFor(d);
            partition.getLock().lock();
            try {
                TokenBucket bucket = partition.find(d);
                if (bucket != null) {
                    assertTrue(bucket.tokens() >= 0 && bucket.tokens() <= 3, "tokens out of range: " + bucket.tokens());
                }
            } finally {
                partition.getLock().unlock();
            }
        }
    }

    private static Digest digest(String key, long limit, Duration period) {
        return DigestFunction.digest(key.getBytes(StandardCharsets.UTF_8), limit, period.toNanos());
    }

    private static String keyOutsidePartition(ThrottleEngine engine, Partition partition) {
        for (int i = 0; ; i++) {
            String candidate = "free-" + i;
            if (engine.store().partitionFor(digest(candidate, 10, ONE_HOUR)) != partition) {
                return candidate;
            }
        }
    }
}
