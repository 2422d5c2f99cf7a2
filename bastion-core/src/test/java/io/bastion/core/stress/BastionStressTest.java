package io.bastion.core.stress;

import io.bastion.core.Bastion;
import io.bastion.core.BastionConfig;
import io.bastion.core.guard.InjectionDetectedException;
import io.bastion.core.stats.StatsSnapshot;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Duration;
import java.util.List;
import java.util.Random;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.LongAdder;

import static org.assertj.core.api.Assertions.*;

/**
 * Stress and load tests for Bastion components.
 *
 * <h2>Stability Requirements:</h2>
 * <ul>
 *   <li>Cache: zero errors under 50 threads, byte and entry ceilings never exceeded</li>
 *   <li>Rate limiter: exact admission count under contention</li>
 *   <li>Query guard: every attack rejected, every benign text accepted, from many threads</li>
 * </ul>
 *
 * @author Test Engineer
 */
@DisplayName("Bastion Stress Tests")
class BastionStressTest {

    private static final int HIGH_THREAD_COUNT = 50;
    private static final int STRESS_DURATION_SECONDS = 3;

    // ========================================================================
    // CACHE STRESS TESTS
    // ========================================================================

    @Nested
    @DisplayName("Cache Stress Tests")
    class CacheStress {

        @Test
        @Timeout(30)
        @DisplayName("should remain stable and bounded under sustained high load")
        void stressSustainedHighLoad() throws InterruptedException {
            long capacity = 256 * 1024;
            try (Bastion bastion = Bastion.create(BastionConfig.builder()
                    .name("stress")
                    .capacityBytes(capacity)
                    .maxEntries(500)
                    .maxEntryBytes(4096)
                    .build())) {

                LongAdder totalOps = new LongAdder();
                LongAdder errors = new LongAdder();
                LongAdder boundViolations = new LongAdder();

                ExecutorService executor = Executors.newFixedThreadPool(HIGH_THREAD_COUNT);
                CountDownLatch startLatch = new CountDownLatch(1);
                AtomicInteger runningFlag = new AtomicInteger(1);

                for (int t = 0; t < HIGH_THREAD_COUNT; t++) {
                    final int threadId = t;
                    executor.submit(() -> {
                        try {
                            startLatch.await();
                            Random random = new Random(threadId);

                            while (runningFlag.get() == 1) {
                                try {
                                    List<Object> key = List.of("lesson", random.nextInt(2000));
                                    int op = random.nextInt(100);

                                    if (op < 70) {
                                        bastion.get(key);
                                    } else if (op < 95) {
                                        // Occasionally above the entry ceiling
                                        bastion.set(key, new byte[random.nextInt(5000)]);
                                    } else {
                                        bastion.invalidate(key);
                                    }
                                    if (threadId == 0) {
                                        StatsSnapshot stats = bastion.stats().cache();
                                        if (stats.residentBytes() > capacity || stats.entryCount() > 500) {
                                            boundViolations.increment();
                                        }
                                    }
                                    totalOps.increment();
                                } catch (Exception e) {
                                    errors.increment();
                                }
                            }
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                        }
                    });
                }

                startLatch.countDown();
                Thread.sleep(STRESS_DURATION_SECONDS * 1000L);
                runningFlag.set(0);

                executor.shutdown();
                executor.awaitTermination(5, TimeUnit.SECONDS);

                StatsSnapshot stats = bastion.stats().cache();
                System.out.printf("Cache Stress Test Results:%n");
                System.out.printf("  Threads: %d%n", HIGH_THREAD_COUNT);
                System.out.printf("  Total Operations: %,d%n", totalOps.sum());
                System.out.printf("  Errors: %d%n", errors.sum());
                System.out.printf("  %s%n", stats);

                assertThat(errors.sum()).isZero();
                assertThat(boundViolations.sum()).isZero();
                assertThat(stats.residentBytes()).isLessThanOrEqualTo(capacity);
                assertThat(stats.entryCount()).isLessThanOrEqualTo(500);
                assertThat(stats.evictions()).isGreaterThan(0);
                assertThat(stats.rejections()).isGreaterThan(0);
            }
        }

        @Test
        @Timeout(20)
        @DisplayName("should handle cache thrashing gracefully")
        void stressCacheThrashing() throws InterruptedException {
            try (Bastion bastion = Bastion.create(BastionConfig.builder()
                    .name("thrash")
                    .capacityBytes(10_000)
                    .maxEntryBytes(100)
                    .build())) {

                int keyRange = 10_000;
                ExecutorService executor = Executors.newFixedThreadPool(20);
                CountDownLatch done = new CountDownLatch(20);

                for (int t = 0; t < 20; t++) {
                    final int threadId = t;
                    executor.submit(() -> {
                        try {
                            Random random = new Random(threadId);
                            for (int i = 0; i < 5_000; i++) {
                                bastion.set(List.of(random.nextInt(keyRange)), new byte[100]);
                                bastion.get(List.of(random.nextInt(keyRange)));
                            }
                        } finally {
                            done.countDown();
                        }
                    });
                }

                assertThat(done.await(15, TimeUnit.SECONDS)).isTrue();
                executor.shutdown();

                StatsSnapshot stats = bastion.stats().cache();
                System.out.printf("Cache Thrashing Test: %s%n", stats);

                assertThat(stats.entryCount()).isLessThanOrEqualTo(100);
                assertThat(stats.residentBytes()).isLessThanOrEqualTo(10_000);
                assertThat(stats.evictions()).isGreaterThan(0);
            }
        }
    }

    // ========================================================================
    // RATE LIMITER STRESS TESTS
    // ========================================================================

    @Nested
    @DisplayName("Rate Limiter Stress Tests")
    class RateLimiterStress {

        @Test
        @Timeout(20)
        @DisplayName("should admit exactly the limit per identifier under contention")
        void stressExactAdmission() throws InterruptedException {
            int identifiers = 20;
            int limit = 100;
            try (Bastion bastion = Bastion.create(BastionConfig.builder()
                    .rateLimitCount(limit)
                    .rateLimitWindow(Duration.ofHours(1))
                    .build())) {

                ConcurrentHashMap<String, LongAdder> admitted = new ConcurrentHashMap<>();
                ExecutorService executor = Executors.newFixedThreadPool(HIGH_THREAD_COUNT);
                CountDownLatch startLatch = new CountDownLatch(1);
                CountDownLatch done = new CountDownLatch(HIGH_THREAD_COUNT);

                for (int t = 0; t < HIGH_THREAD_COUNT; t++) {
                    executor.submit(() -> {
                        try {
                            startLatch.await();
                            for (int i = 0; i < 200; i++) {
                                String id = "user-" + (i % identifiers);
                                if (bastion.allow(id).allowed()) {
                                    admitted.computeIfAbsent(id, k -> new LongAdder()).increment();
                                }
                            }
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                        } finally {
                            done.countDown();
                        }
                    });
                }

                startLatch.countDown();
                assertThat(done.await(15, TimeUnit.SECONDS)).isTrue();
                executor.shutdown();

                // 50 threads x 200 calls spread over 20 ids = 500 attempts per id
                assertThat(admitted).hasSize(identifiers);
                admitted.values().forEach(count -> assertThat(count.sum()).isEqualTo(limit));
                assertThat(bastion.stats().deniedCount()).isEqualTo((long) identifiers * (500 - limit));
                assertThat(bastion.stats().trackedWindows()).isEqualTo(identifiers);
            }
        }
    }

    // ========================================================================
    // QUERY GUARD STRESS TESTS
    // ========================================================================

    @Nested
    @DisplayName("Query Guard Stress Tests")
    class QueryGuardStress {

        private final List<String> attacks = List.of(
            "'; DROP TABLE users; --",
            "1 UNION/**/SELECT password FROM users",
            "' OR '1'='1",
            "EXEC xp_cmdshell 'dir'",
            "1 AND SLEEP(5)");

        private final List<String> benign = List.of(
            "fractions",
            "O'Brien's reading list",
            "union of two sets",
            "select the best answer");

        @Test
        @Timeout(20)
        @DisplayName("should give consistent verdicts from many threads")
        void stressConsistentVerdicts() throws InterruptedException {
            try (Bastion bastion = Bastion.create(BastionConfig.defaults())) {
                LongAdder wrongVerdicts = new LongAdder();
                ExecutorService executor = Executors.newFixedThreadPool(20);
                CountDownLatch done = new CountDownLatch(20);

                for (int t = 0; t < 20; t++) {
                    executor.submit(() -> {
                        try {
                            for (int i = 0; i < 500; i++) {
                                for (String attack : attacks) {
                                    try {
                                        bastion.validateQueryText(attack);
                                        wrongVerdicts.increment();
                                    } catch (InjectionDetectedException expected) {
                                        // rejected as it should be
                                    }
                                }
                                for (String text : benign) {
                                    if (bastion.inspectQueryText(text).rejected()) {
                                        wrongVerdicts.increment();
                                    }
                                }
                            }
                        } finally {
                            done.countDown();
                        }
                    });
                }

                assertThat(done.await(15, TimeUnit.SECONDS)).isTrue();
                executor.shutdown();

                assertThat(wrongVerdicts.sum()).isZero();
                assertThat(bastion.stats().rejectedQueries()).isEqualTo(20L * 500 * attacks.size());
            }
        }
    }
}
