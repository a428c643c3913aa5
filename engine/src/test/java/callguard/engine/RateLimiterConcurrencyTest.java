package callguard.engine;

import callguard.core.clock.SystemClock;
import callguard.core.model.AdmissionResult;
import callguard.core.model.Decision;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Concurrency tests for RateLimiter.
 *
 * Focus:
 * - No double-spending of tokens under contention
 * - Waiter gate saturation
 * - No deadlock between stats snapshots and backoff writers
 * - Blocked callers eventually admitted as tokens refill
 */
class RateLimiterConcurrencyTest {

    @Test
    void testConcurrent_burstIsNeverOverspent() throws InterruptedException {
        RateLimiter limiter = new RateLimiter(SystemClock.instance(),
            RateLimiterConfig.of(Map.of("x", new ServiceLimit(0.01, 5))));

        int numThreads = 20;
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(numThreads);
        AtomicInteger admitted = new AtomicInteger(0);

        ExecutorService executor = Executors.newFixedThreadPool(numThreads);
        for (int i = 0; i < numThreads; i++) {
            executor.submit(() -> {
                try {
                    startLatch.await();
                    if (limiter.acquire("x", Duration.ZERO)) {
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
        assertTrue(doneLatch.await(5, TimeUnit.SECONDS), "Test timed out");

        executor.shutdown();
        assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));

        assertEquals(5, admitted.get());
    }

    @Test
    void testConcurrent_waiterGateSaturation_refusesImmediately() throws Exception {
        RateLimiterConfig config = RateLimiterConfig.of(Map.of("x", new ServiceLimit(0.01, 1)))
            .withMaxWaitersPerService(2);
        RateLimiter limiter = new RateLimiter(SystemClock.instance(), config);
        assertTrue(limiter.acquire("x", Duration.ZERO)); // drain

        ExecutorService executor = Executors.newFixedThreadPool(2);
        Future<AdmissionResult> first = executor.submit(() -> limiter.tryAcquire("x", Duration.ofSeconds(2)));
        Future<AdmissionResult> second = executor.submit(() -> limiter.tryAcquire("x", Duration.ofSeconds(2)));

        long waitUntil = System.nanoTime() + TimeUnit.SECONDS.toNanos(1);
        while (limiter.getStats().get("x").activeWaiters() < 2 && System.nanoTime() < waitUntil) {
            Thread.sleep(5);
        }
        assertEquals(2, limiter.getStats().get("x").activeWaiters());

        long start = System.nanoTime();
        AdmissionResult refused = limiter.tryAcquire("x", Duration.ofSeconds(2));
        long tookMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertEquals(Decision.SATURATED, refused.decision());
        assertTrue(tookMillis < 500, "saturation refusal should not block, took " + tookMillis + "ms");

        assertEquals(Decision.TIMED_OUT, first.get(5, TimeUnit.SECONDS).decision());
        assertEquals(Decision.TIMED_OUT, second.get(5, TimeUnit.SECONDS).decision());
        assertEquals(0, limiter.getStats().get("x").activeWaiters());

        executor.shutdown();
        assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));
    }

    @Test
    void testConcurrent_blockedCallersAdmittedAsTokensRefill() throws InterruptedException {
        // 20 tokens/sec, burst 1
        RateLimiter limiter = new RateLimiter(SystemClock.instance(),
            RateLimiterConfig.of(Map.of("x", new ServiceLimit(1_200, 1))));

        int numThreads = 5;
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(numThreads);
        AtomicInteger admitted = new AtomicInteger(0);

        ExecutorService executor = Executors.newFixedThreadPool(numThreads);
        long start = System.nanoTime();
        for (int i = 0; i < numThreads; i++) {
            executor.submit(() -> {
                try {
                    startLatch.await();
                    if (limiter.acquire("x", Duration.ofSeconds(5))) {
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
        assertTrue(doneLatch.await(10, TimeUnit.SECONDS), "Test timed out");
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        executor.shutdown();
        assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));

        assertEquals(numThreads, admitted.get());
        // 1 from the burst, 4 more at 50ms each
        assertTrue(elapsedMillis >= 150, "admitted too fast: " + elapsedMillis + "ms");
    }

    @Test
    void testConcurrent_noDeadlockBetweenStatsAndBackoffWriters() throws InterruptedException {
        RateLimiter limiter = new RateLimiter(SystemClock.instance(), RateLimiterConfig.defaults());
        String[] services = {"coingecko", "coindesk", "kraken", "coinbase"};

        int numThreads = 16;
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(numThreads);

        ExecutorService executor = Executors.newFixedThreadPool(numThreads);
        for (int i = 0; i < numThreads; i++) {
            final int threadId = i;
            executor.submit(() -> {
                try {
                    startLatch.await();
                    for (int j = 0; j < 500; j++) {
                        String service = services[(threadId + j) % services.length];
                        switch (threadId % 4) {
                            case 0 -> limiter.getStats();
                            case 1 -> limiter.reportThrottled(service, Duration.ofMillis(1));
                            case 2 -> limiter.resetBackoff(service);
                            default -> limiter.acquire(service, Duration.ZERO);
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

        // If there's a deadlock, this will timeout
        assertTrue(doneLatch.await(10, TimeUnit.SECONDS), "Deadlock detected - test timed out");

        executor.shutdown();
        assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));

        limiter.getStats().values().forEach(stats -> {
            assertEquals(0, stats.activeWaiters());
            assertTrue(stats.availableTokens() >= 0 && stats.availableTokens() <= stats.capacity());
        });
    }

    @Test
    void testConcurrent_interruptedWaiterReleasesSlot() throws Exception {
        RateLimiterConfig config = RateLimiterConfig.of(Map.of("x", new ServiceLimit(0.01, 1)))
            .withMaxWaitersPerService(1);
        RateLimiter limiter = new RateLimiter(SystemClock.instance(), config);
        limiter.acquire("x", Duration.ZERO);

        CompletableFuture<AdmissionResult> result = new CompletableFuture<>();
        Thread waiter = new Thread(() -> result.complete(limiter.tryAcquire("x", Duration.ofSeconds(30))));
        waiter.start();

        long waitUntil = System.nanoTime() + TimeUnit.SECONDS.toNanos(1);
        while (limiter.getStats().get("x").activeWaiters() < 1 && System.nanoTime() < waitUntil) {
            Thread.sleep(5);
        }
        waiter.interrupt();

        assertEquals(Decision.INTERRUPTED, result.get(5, TimeUnit.SECONDS).decision());
        waiter.join(5_000);
        assertEquals(0, limiter.getStats().get("x").activeWaiters());
    }
}
