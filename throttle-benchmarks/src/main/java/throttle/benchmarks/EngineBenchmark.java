package throttle.benchmarks;

import org.openjdk.jmh.annotations.*;
import throttle.core.clock.SystemClock;
import throttle.core.model.CallContext;
import throttle.engine.ThrottleConfig;
import throttle.engine.ThrottleEngine;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

/**
 * JMH Benchmarks for ThrottleEngine.
 *
 * Measures throughput (ops/sec) across 4 scenarios:
 * - singleKey: All requests to same key (one shard)
 * - multiKey: Rotating through 1000 keys (spread over shards)
 * - parallelSingleKey: 8 threads contending on one shard
 * - parallelMultiKey: 8 threads spread over shards
 *
 * Run:
 *   mvn -pl throttle-benchmarks -am package
 *   java -cp "throttle-benchmarks/target/classes:..." org.openjdk.jmh.Main Engine
 */
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.SECONDS)
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
@Fork(1)
@State(Scope.Benchmark)
public class EngineBenchmark {

    private static final Duration PERIOD = Duration.ofSeconds(1);
    private static final long LIMIT = 1_000_000_000L;

    private ThrottleEngine engine;
    private CallContext ctx;
    private byte[][] keys;

    @Setup
    public void setup() {
        engine = new ThrottleEngine(ThrottleConfig.defaults());
        ctx = SystemClock.instance()::nowNanos;
        keys = new byte[1000][];
        for (int i = 0; i < keys.length; i++) {
            keys[i] = ("user:" + i).getBytes(StandardCharsets.UTF_8);
        }
    }

    @Benchmark
    public boolean singleKey() {
        return engine.isDenied(ctx, keys[0], LIMIT, PERIOD);
    }

    @Benchmark
    public boolean multiKey() {
        return engine.isDenied(ctx, keys[ThreadLocalRandom.current().nextInt(keys.length)], LIMIT, PERIOD);
    }

    @Benchmark
    @Threads(8)
    public boolean parallelSingleKey() {
        return engine.isDenied(ctx, keys[0], LIMIT, PERIOD);
    }

    @Benchmark
    @Threads(8)
    public boolean parallelMultiKey() {
        return engine.isDenied(ctx, keys[ThreadLocalRandom.current().nextInt(keys.length)], LIMIT, PERIOD);
    }
}
