package io.bastion.core.lifecycle;

import io.bastion.core.MutableClock;
import io.bastion.core.cache.CacheConfig;
import io.bastion.core.cache.ScoredCache;
import io.bastion.core.ratelimit.FixedWindowRateLimiter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for ResourceSweeper.
 *
 * Verifies:
 * - Resource registration and deregistration
 * - Expired entry and idle window release
 * - Failure isolation between resources
 * - Periodic scheduling and shutdown
 * - Metrics tracking
 *
 * @author Test Engineer
 */
@DisplayName("ResourceSweeper")
class ResourceSweeperTest {

    private ResourceSweeper sweeper;
    private MutableClock clock;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        sweeper = ResourceSweeper.builder()
                .name("test")
                .sweepInterval(Duration.ofHours(1))
                .build();
    }

    @AfterEach
    void tearDown() {
        if (sweeper != null) {
            sweeper.close();
        }
    }

    private ScoredCache cache(String name) {
        return ScoredCache.builder()
                .config(CacheConfig.builder().name(name).capacityBytes(10_000).maxEntryBytes(1_000).build())
                .clock(clock)
                .build();
    }

    /**
     * Resource that releases a fixed number of items per sweep.
     */
    private static class CountingResource implements ManagedResource {
        private final String name;
        private final long perSweep;
        private final AtomicLong sweeps = new AtomicLong();

        CountingResource(String name, long perSweep) {
            this.name = name;
            this.perSweep = perSweep;
        }

        @Override public String name() { return name; }
        @Override public long estimatedMemoryBytes() { return 100; }
        @Override public long itemCount() { return 10; }
        @Override public long releaseAll() { return 10; }
        @Override public long lastAccessTimeMillis() { return 0; }

        @Override
        public long releaseExpired() {
            sweeps.incrementAndGet();
            return perSweep;
        }
    }

    @Nested
    @DisplayName("Resource Registration")
    class ResourceRegistration {

        @Test
        @DisplayName("should list registered resources in snapshots")
        void shouldListRegisteredResources() {
            ScoredCache lessons = cache("lessons");
            lessons.set(List.of("k"), new byte[32]);

            sweeper.register(lessons);

            List<ResourceSweeper.ResourceSnapshot> snapshots = sweeper.getResourceSnapshots();
            assertThat(snapshots)
                    .extracting(ResourceSweeper.ResourceSnapshot::name)
                    .containsExactly("lessons");
            assertThat(snapshots.get(0).itemCount()).isEqualTo(1);
            assertThat(sweeper.totalItemCount()).isEqualTo(1);
            assertThat(sweeper.totalMemoryBytes()).isEqualTo(lessons.estimatedMemoryBytes());
        }

        @Test
        @DisplayName("should stop sweeping a deregistered resource")
        void shouldDeregister() {
            CountingResource resource = new CountingResource("counting", 1);
            sweeper.register(resource);

            assertThat(sweeper.deregister("counting")).isSameAs(resource);
            sweeper.sweepNow();

            assertThat(resource.sweeps.get()).isZero();
            assertThat(sweeper.deregister("counting")).isNull();
        }

        @Test
        @DisplayName("should reject null resources")
        void shouldRejectNull() {
            assertThatThrownBy(() -> sweeper.register(null))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("should reject registration after close")
        void shouldRejectAfterClose() {
            sweeper.close();

            assertThatThrownBy(() -> sweeper.register(new CountingResource("late", 0)))
                    .isInstanceOf(IllegalStateException.class);
        }
    }

    @Nested
    @DisplayName("Sweeping")
    class Sweeping {

        @Test
        @DisplayName("should release expired cache entries and idle rate windows")
        void shouldReleaseExpiredItems() {
            ScoredCache lessons = cache("lessons");
            FixedWindowRateLimiter limiter = FixedWindowRateLimiter.builder()
                    .defaultPolicy(10, Duration.ofSeconds(1))
                    .clock(clock)
                    .build();
            lessons.set(List.of("a"), new byte[10], Duration.ofSeconds(1));
            lessons.set(List.of("b"), new byte[10], Duration.ofSeconds(1));
            lessons.set(List.of("c"), new byte[10], Duration.ofMinutes(1));
            limiter.allow("user-1");
            sweeper.register(lessons);
            sweeper.register(limiter);

            clock.advance(Duration.ofSeconds(5));
            long released = sweeper.sweepNow();

            assertThat(released).isEqualTo(3);
            assertThat(lessons.itemCount()).isEqualTo(1);
            assertThat(limiter.trackedWindows()).isZero();
        }

        @Test
        @DisplayName("should keep sweeping when one resource fails")
        void shouldIsolateFailures() {
            CountingResource healthy = new CountingResource("healthy", 2);
            sweeper.register(new CountingResource("broken", 0) {
                @Override
                public long releaseExpired() {
                    throw new IllegalStateException("boom");
                }
            });
            sweeper.register(healthy);

            long released = sweeper.sweepNow();

            assertThat(released).isEqualTo(2);
            assertThat(healthy.sweeps.get()).isEqualTo(1);
            assertThat(sweeper.getMetrics().failedSweeps()).isEqualTo(1);
        }

        @Test
        @DisplayName("should track sweep metrics")
        void shouldTrackMetrics() {
            sweeper.register(new CountingResource("a", 3));
            sweeper.register(new CountingResource("b", 4));

            sweeper.sweepNow();
            sweeper.sweepNow();

            ResourceSweeper.Metrics metrics = sweeper.getMetrics();
            assertThat(metrics.resourceCount()).isEqualTo(2);
            assertThat(metrics.sweepCount()).isEqualTo(2);
            assertThat(metrics.totalReleasedItems()).isEqualTo(14);
            assertThat(metrics.totalItems()).isEqualTo(20);
            assertThat(metrics.totalMemoryBytes()).isEqualTo(200);
        }
    }

    @Nested
    @DisplayName("Scheduling")
    class Scheduling {

        @Test
        @Timeout(10)
        @DisplayName("should sweep periodically in the background")
        void shouldSweepPeriodically() throws InterruptedException {
            CountingResource resource = new CountingResource("periodic", 1);
            try (ResourceSweeper fast = ResourceSweeper.builder()
                    .name("fast")
                    .sweepInterval(Duration.ofMillis(20))
                    .build()) {
                fast.register(resource);

                while (fast.getMetrics().sweepCount() < 3) {
                    Thread.sleep(10);
                }
                assertThat(resource.sweeps.get()).isGreaterThanOrEqualTo(3);
            }
        }

        @Test
        @DisplayName("should stop running after close")
        void shouldStopAfterClose() {
            assertThat(sweeper.isRunning()).isTrue();

            sweeper.close();
            sweeper.close();

            assertThat(sweeper.isRunning()).isFalse();
            assertThat(sweeper.getResourceSnapshots()).isEmpty();
        }

        @Test
        @DisplayName("should reject non-positive intervals")
        void shouldRejectInvalidInterval() {
            assertThatThrownBy(() -> ResourceSweeper.builder().sweepInterval(Duration.ZERO))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
