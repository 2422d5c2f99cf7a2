package io.bastion.core;

import io.bastion.core.cache.CacheConfig;
import io.bastion.core.guard.QueryGuard;
import io.bastion.core.queue.RequestQueue;
import io.bastion.core.ratelimit.RatePolicy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for BastionConfig.
 *
 * @author Test Engineer
 */
@DisplayName("BastionConfig")
class BastionConfigTest {

    private static InputStream json(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }

    // ========================================================================
    // DEFAULTS
    // ========================================================================

    @Nested
    @DisplayName("Defaults")
    class Defaults {

        @Test
        @DisplayName("should use the documented defaults")
        void shouldUseDocumentedDefaults() {
            BastionConfig config = BastionConfig.defaults();

            assertThat(config.name()).isEqualTo("bastion");
            assertThat(config.capacityBytes()).isEqualTo(64L * 1024 * 1024);
            assertThat(config.maxEntries()).isEqualTo(10_000);
            assertThat(config.maxEntryBytes()).isEqualTo(1024 * 1024);
            assertThat(config.defaultTtl()).isEqualTo(Duration.ofMinutes(5));
            assertThat(config.sweepInterval()).isEqualTo(Duration.ofSeconds(30));
            assertThat(config.recencyWeight()).isEqualTo(1.0);
            assertThat(config.frequencyWeight()).isEqualTo(10.0);
            assertThat(config.rateLimitCount()).isEqualTo(1000);
            assertThat(config.rateLimitWindow()).isEqualTo(Duration.ofSeconds(60));
            assertThat(config.rateLimitOverrides()).isEmpty();
            assertThat(config.idleWindowMultiplier()).isEqualTo(3);
            assertThat(config.maxTrackedWindows()).isEqualTo(100_000);
            assertThat(config.maxQueryTextLength()).isEqualTo(QueryGuard.DEFAULT_MAX_TEXT_LENGTH);
            assertThat(config.injectionPatterns()).isEqualTo(QueryGuard.DEFAULT_RULES_RESOURCE);
            assertThat(config.maxQueryComplexity()).isEqualTo(1000);
            assertThat(config.requestQueueCapacity()).isEqualTo(RequestQueue.DEFAULT_CAPACITY);
        }

        @Test
        @DisplayName("should derive cache and rate settings")
        void shouldDeriveComponentSettings() {
            BastionConfig config = BastionConfig.builder()
                .name("lessons")
                .capacityBytes(4096)
                .maxEntryBytes(1024)
                .recencyWeight(2.0)
                .rateLimitCount(10)
                .rateLimitWindow(Duration.ofSeconds(5))
                .build();

            CacheConfig cacheConfig = config.cacheConfig();
            assertThat(cacheConfig.name()).isEqualTo("lessons");
            assertThat(cacheConfig.capacityBytes()).isEqualTo(4096);
            assertThat(cacheConfig.maxEntryBytes()).isEqualTo(1024);
            assertThat(cacheConfig.weights().recencyWeight()).isEqualTo(2.0);
            assertThat(config.defaultRatePolicy()).isEqualTo(RatePolicy.of(10, Duration.ofSeconds(5)));
        }

        @Test
        @DisplayName("should not expose a mutable override map")
        void shouldCopyOverrides() {
            BastionConfig config = BastionConfig.builder()
                .rateLimitOverride("generate", RatePolicy.of(5, Duration.ofMinutes(1)))
                .build();

            Map<String, RatePolicy> overrides = config.rateLimitOverrides();
            assertThatThrownBy(() -> overrides.put("login", RatePolicy.DEFAULT))
                .isInstanceOf(UnsupportedOperationException.class);
        }
    }

    // ========================================================================
    // VALIDATION
    // ========================================================================

    @Nested
    @DisplayName("Validation")
    class Validation {

        @Test
        @DisplayName("should reject non-positive capacity")
        void shouldRejectNonPositiveCapacity() {
            assertThatThrownBy(() -> BastionConfig.builder().capacityBytes(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("capacityBytes");
        }

        @Test
        @DisplayName("should reject an entry ceiling above capacity")
        void shouldRejectEntryCeilingAboveCapacity() {
            assertThatThrownBy(() -> BastionConfig.builder().capacityBytes(100).maxEntryBytes(101).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("maxEntryBytes");
        }

        @Test
        @DisplayName("should reject invalid rate limits")
        void shouldRejectInvalidRateLimits() {
            assertThatThrownBy(() -> BastionConfig.builder().rateLimitCount(0).build())
                .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> BastionConfig.builder().rateLimitWindow(Duration.ZERO).build())
                .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("should reject invalid sweep and guard settings")
        void shouldRejectInvalidSweepAndGuardSettings() {
            assertThatThrownBy(() -> BastionConfig.builder().sweepInterval(Duration.ofSeconds(-1)).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("sweepInterval");
            assertThatThrownBy(() -> BastionConfig.builder().idleWindowMultiplier(0).build())
                .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> BastionConfig.builder().maxQueryTextLength(0).build())
                .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> BastionConfig.builder().maxQueryComplexity(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("maxQueryComplexity");
        }

        @Test
        @DisplayName("should reject queue capacities outside 1 to 100000")
        void shouldRejectInvalidQueueCapacity() {
            assertThatThrownBy(() -> BastionConfig.builder().requestQueueCapacity(0).build())
                .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> BastionConfig.builder().requestQueueCapacity(100_001).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("requestQueueCapacity");
            assertThat(BastionConfig.builder().requestQueueCapacity(100_000).build().requestQueueCapacity())
                .isEqualTo(100_000);
        }

        @Test
        @DisplayName("should reject all-zero eviction weights")
        void shouldRejectZeroWeights() {
            assertThatThrownBy(() -> BastionConfig.builder().recencyWeight(0).frequencyWeight(0).build())
                .isInstanceOf(IllegalArgumentException.class);
        }
    }

    // ========================================================================
    // JSON LOADING
    // ========================================================================

    @Nested
    @DisplayName("Loading")
    class Loading {

        @Test
        @DisplayName("should load every option from a classpath file")
        void shouldLoadFromFile() throws IOException {
            BastionConfig config;
            try (InputStream in = getClass().getClassLoader().getResourceAsStream("config/bastion-test.json")) {
                assertThat(in).isNotNull();
                config = BastionConfig.load(in);
            }

            assertThat(config.name()).isEqualTo("lessons");
            assertThat(config.capacityBytes()).isEqualTo(2_097_152);
            assertThat(config.maxEntries()).isEqualTo(500);
            assertThat(config.maxEntryBytes()).isEqualTo(65_536);
            assertThat(config.defaultTtl()).isEqualTo(Duration.ofMinutes(10));
            assertThat(config.sweepInterval()).isEqualTo(Duration.ofSeconds(5));
            assertThat(config.recencyWeight()).isEqualTo(2.0);
            assertThat(config.frequencyWeight()).isEqualTo(5.0);
            assertThat(config.defaultRatePolicy()).isEqualTo(RatePolicy.of(100, Duration.ofSeconds(30)));
            assertThat(config.rateLimitOverrides())
                .containsExactly(Map.entry("generate", RatePolicy.of(5, Duration.ofMinutes(1))));
            assertThat(config.maxQueryTextLength()).isEqualTo(512);
            assertThat(config.maxQueryComplexity()).isEqualTo(200);
            assertThat(config.requestQueueCapacity()).isEqualTo(250);
        }

        @Test
        @DisplayName("should keep defaults for absent options")
        void shouldKeepDefaultsForAbsentOptions() {
            BastionConfig config = BastionConfig.load(json("{\"capacityBytes\": 8388608}"));

            assertThat(config.capacityBytes()).isEqualTo(8_388_608);
            assertThat(config.name()).isEqualTo("bastion");
            assertThat(config.defaultTtl()).isEqualTo(Duration.ofMinutes(5));
        }

        @Test
        @DisplayName("should accept durations as numbers of seconds")
        void shouldAcceptNumericDurations() {
            BastionConfig config = BastionConfig.load(json("{\"defaultTtl\": 90}"));

            assertThat(config.defaultTtl()).isEqualTo(Duration.ofSeconds(90));
        }

        @Test
        @DisplayName("should build a working instance from a loaded file")
        void shouldBuildInstanceFromLoadedFile() throws IOException {
            try (InputStream in = getClass().getClassLoader().getResourceAsStream("config/bastion-test.json");
                 Bastion bastion = Bastion.create(BastionConfig.load(in))) {

                assertThat(bastion.name()).isEqualTo("lessons");
                assertThat(bastion.rateLimiter().policyFor("generate").limit()).isEqualTo(5);
                assertThat(bastion.queryGuard().maxTextLength()).isEqualTo(512);
                assertThat(bastion.queryGuard().maxComplexity()).isEqualTo(200);
                assertThat(bastion.newRequestQueue("generation").capacity()).isEqualTo(250);
            }
        }

        @Test
        @DisplayName("should reject malformed JSON")
        void shouldRejectMalformedJson() {
            assertThatThrownBy(() -> BastionConfig.load(json("{\"capacityBytes\": ")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not valid JSON");
        }

        @Test
        @DisplayName("should reject a document that is not an object")
        void shouldRejectNonObject() {
            assertThatThrownBy(() -> BastionConfig.load(json("[1, 2, 3]")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("JSON object");
        }

        @Test
        @DisplayName("should reject out-of-range values")
        void shouldRejectOutOfRangeValues() {
            assertThatThrownBy(() -> BastionConfig.load(json("{\"maxEntries\": -1}")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("maxEntries");
        }

        @Test
        @DisplayName("should reject malformed rate overrides")
        void shouldRejectMalformedOverrides() {
            assertThatThrownBy(() -> BastionConfig.load(json("{\"rateLimitOverrides\": [1]}")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("rateLimitOverrides");
            assertThatThrownBy(() -> BastionConfig.load(
                    json("{\"rateLimitOverrides\": {\"generate\": {\"limit\": 0, \"window\": \"PT1M\"}}}")))
                .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
