package throttle.benchmarks;

import org.openjdk.jmh.annotations.*;
import throttle.core.digest.Digest;
import throttle.core.digest.DigestFunction;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.TimeUnit;

/**
 * JMH Benchmarks for the digest step, which runs outside any lock.
 *
 * - shortKey: typical client address
 * - longKey: 1 KiB key (e.g. a full URL plus headers)
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
@Fork(1)
@State(Scope.Thread)
public class DigestBenchmark {

    private byte[] shortKey;
    private byte[] longKey;

    @Setup
    public void setup() {
        shortKey = "203.0.113.7".getBytes(StandardCharsets.UTF_8);
        longKey = new byte[1024];
    }

    @Benchmark
    public Digest shortKey() {
        return DigestFunction.digest(shortKey, 100, 1_000_000_000L);
    }

    @Benchmark
    public Digest longKey() {
        return DigestFunction.digest(longKey, 100, 1_000_000_000L);
    }
}
