package callguard.benchmarks;

import callguard.core.algorithms.token_bucket.TokenBucket;
import callguard.core.clock.SystemClock;
import org.openjdk.jmh.annotations.*;

import java.util.concurrent.TimeUnit;

/**
 * JMH Benchmarks for TokenBucket.
 *
 * Measures throughput (ops/sec) across 4 scenarios:
 * - allow: Successfully consume tokens (hot path)
 * - reject: Attempt to consume when the bucket is empty
 * - timeToNextToken: Wait computation on an empty bucket
 * - parallel: 8 threads contending on one bucket
 *
 * Run (after mvn -pl benchmarks -am package):
 *   org.openjdk.jmh.Main TokenBucket
 */
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.SECONDS)
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
@Fork(1)
@State(Scope.Benchmark)
public class TokenBucketBenchmark {

    // Allow scenario: refill far above the call rate, should always succeed
    private TokenBucket allow;

    // Reject scenario: drained, refill negligible
    private TokenBucket reject;

    @Setup
    public void setup() {
        SystemClock clock = SystemClock.instance();

        allow = new TokenBucket(clock, 1_000_000, 1_000_000_000.0);
        reject = new TokenBucket(clock, 1, 1e-9);
        reject.tryConsume();
    }

    @Benchmark
    public boolean allow() {
        return allow.tryConsume();
    }

    @Benchmark
    public boolean reject() {
        return reject.tryConsume();
    }

    @Benchmark
    public long timeToNextToken() {
        return reject.nanosToNextToken();
    }

    @Benchmark
    @Threads(8)
    public boolean parallel() {
        return allow.tryConsume();
    }
}
