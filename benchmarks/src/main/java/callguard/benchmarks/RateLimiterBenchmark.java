package callguard.benchmarks;

import callguard.core.clock.SystemClock;
import callguard.engine.RateLimiter;
import callguard.engine.RateLimiterConfig;
import callguard.engine.ServiceLimit;
import org.openjdk.jmh.annotations.*;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

/**
 * JMH Benchmarks for RateLimiter (per-service buckets, backoff, waiter gates).
 *
 * Measures throughput (ops/sec) across 4 scenarios:
 * - singleService: All non-blocking acquires on the same service
 * - rotatingServices: Acquires spread over the four default services
 * - parallel: 8 threads on a single service (bucket monitor contention)
 * - stats: Snapshot of every service
 *
 * Acquires use a zero timeout so the numbers measure the admission decision, not sleeping.
 */
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.SECONDS)
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
@Fork(1)
@State(Scope.Benchmark)
public class RateLimiterBenchmark {

    private static final String[] SERVICES = {"coingecko", "coindesk", "kraken", "coinbase"};

    private RateLimiter limiter;

    @Setup
    public void setup() {
        ServiceLimit wide = new ServiceLimit(ServiceLimit.MAX_REQUESTS_PER_MINUTE, 1_000_000_000);
        RateLimiterConfig config = RateLimiterConfig.of(Map.of(
            "coingecko", wide,
            "coindesk", wide,
            "kraken", wide,
            "coinbase", wide));

        limiter = new RateLimiter(SystemClock.instance(), config);
    }

    @Benchmark
    public boolean singleService() {
        return limiter.acquire("coingecko", Duration.ZERO);
    }

    @Benchmark
    public boolean rotatingServices() {
        String service = SERVICES[ThreadLocalRandom.current().nextInt(SERVICES.length)];
        return limiter.acquire(service, Duration.ZERO);
    }

    @Benchmark
    @Threads(8)
    public boolean parallel() {
        return limiter.acquire("coingecko", Duration.ZERO);
    }

    @Benchmark
    public Object stats() {
        return limiter.getStats();
    }
}
