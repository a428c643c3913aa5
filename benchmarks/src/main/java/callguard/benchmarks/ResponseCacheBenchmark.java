package callguard.benchmarks;

import callguard.cache.CacheConfig;
import callguard.cache.ResponseCache;
import callguard.core.clock.SystemClock;
import org.openjdk.jmh.annotations.*;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

/**
 * JMH Benchmarks for ResponseCache.
 *
 * Measures throughput (ops/sec) across 5 scenarios:
 * - keyDerivation: Canonical JSON plus SHA-256 for one request
 * - hit: Lookup of a warmed entry
 * - miss: Lookup of an absent entry
 * - churn: Sets over 4x the capacity (sweep plus LRU eviction on every insert)
 * - parallel / parallelStriped: 8 threads on one lock vs 8 stripes
 */
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.SECONDS)
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
@Fork(1)
@State(Scope.Benchmark)
public class ResponseCacheBenchmark {

    private static final Map<String, Object> PARAMS = Map.of(
        "vs_currency", "usd",
        "order", "market_cap_desc",
        "per_page", 100,
        "page", 1);

    private ResponseCache cache;
    private ResponseCache striped;

    @Setup
    public void setup() {
        SystemClock clock = SystemClock.instance();
        cache = new ResponseCache(clock, CacheConfig.defaults());
        striped = new ResponseCache(clock, CacheConfig.defaults().withStripes(8));

        for (int i = 0; i < 500; i++) {
            cache.set("/coins/list", Map.of("page", i), i);
            striped.set("/coins/list", Map.of("page", i), i);
        }
    }

    @Benchmark
    public String keyDerivation() {
        return cache.keyFor("/coins/markets", PARAMS);
    }

    @Benchmark
    public Optional<Object> hit() {
        return cache.get("/coins/list", Map.of("page", ThreadLocalRandom.current().nextInt(500)));
    }

    @Benchmark
    public Optional<Object> miss() {
        return cache.get("/coins/list", Map.of("page", -1));
    }

    @Benchmark
    public void churn() {
        int page = ThreadLocalRandom.current().nextInt(4 * CacheConfig.DEFAULT_MAX_SIZE);
        cache.set("/coins/bitcoin/history", Map.of("page", page), page);
    }

    @Benchmark
    @Threads(8)
    public Optional<Object> parallel() {
        return cache.get("/coins/list", Map.of("page", ThreadLocalRandom.current().nextInt(500)));
    }

    @Benchmark
    @Threads(8)
    public Optional<Object> parallelStriped() {
        return striped.get("/coins/list", Map.of("page", ThreadLocalRandom.current().nextInt(500)));
    }
}
