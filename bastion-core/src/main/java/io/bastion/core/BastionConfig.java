package io.bastion.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.bastion.core.cache.CacheConfig;
import io.bastion.core.cache.EvictionWeights;
import io.bastion.core.guard.QueryGuard;
import io.bastion.core.queue.RequestQueue;
import io.bastion.core.ratelimit.RatePolicy;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable configuration for a {@link Bastion} instance.
 *
 * <pre>{@code
 * BastionConfig config = BastionConfig.builder()
 *     .capacityBytes(128L * 1024 * 1024)
 *     .defaultTtl(Duration.ofMinutes(10))
 *     .rateLimitOverride("generate", RatePolicy.of(20, Duration.ofMinutes(1)))
 *     .build();
 * }</pre>
 *
 * <p>The same options can be read from JSON with {@link #load(InputStream)}.
 * Durations are ISO-8601 strings ({@code "PT30S"}) or numbers of seconds;
 * unknown properties are ignored.</p>
 *
 * @since 1.0.0
 */
public record BastionConfig(
        String name,
        long capacityBytes,
        int maxEntries,
        int maxEntryBytes,
        Duration defaultTtl,
        Duration sweepInterval,
        int maxSweepRemovals,
        double recencyWeight,
        double frequencyWeight,
        int rateLimitCount,
        Duration rateLimitWindow,
        Map<String, RatePolicy> rateLimitOverrides,
        int idleWindowMultiplier,
        int maxTrackedWindows,
        int maxQueryTextLength,
        int maxQueryComplexity,
        String injectionPatterns,
        int requestQueueCapacity
) {

    public static final Duration DEFAULT_SWEEP_INTERVAL = Duration.ofSeconds(30);
    public static final int DEFAULT_IDLE_WINDOW_MULTIPLIER = 3;
    public static final int DEFAULT_MAX_TRACKED_WINDOWS = 100_000;

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public BastionConfig {
        Objects.requireNonNull(sweepInterval, "sweepInterval must not be null");
        Objects.requireNonNull(injectionPatterns, "injectionPatterns must not be null");
        rateLimitOverrides = Map.copyOf(Objects.requireNonNull(rateLimitOverrides,
                "rateLimitOverrides must not be null"));

        // Both constructors validate their own ranges
        new CacheConfig(name, capacityBytes, maxEntries, maxEntryBytes, defaultTtl,
                new EvictionWeights(recencyWeight, frequencyWeight), maxSweepRemovals);
        RatePolicy.of(rateLimitCount, rateLimitWindow);

        if (sweepInterval.isNegative() || sweepInterval.isZero()) {
            throw new IllegalArgumentException("sweepInterval must be positive");
        }
        if (idleWindowMultiplier < 1) {
            throw new IllegalArgumentException("idleWindowMultiplier must be at least 1");
        }
        if (maxTrackedWindows <= 0) {
            throw new IllegalArgumentException("maxTrackedWindows must be positive");
        }
        if (maxQueryTextLength <= 0) {
            throw new IllegalArgumentException("maxQueryTextLength must be positive");
        }
        if (maxQueryComplexity <= 0) {
            throw new IllegalArgumentException("maxQueryComplexity must be positive");
        }
        if (requestQueueCapacity < 1 || requestQueueCapacity > RequestQueue.MAX_CAPACITY) {
            throw new IllegalArgumentException("requestQueueCapacity must be between 1 and "
                    + RequestQueue.MAX_CAPACITY);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the configuration with every option at its default.
     * @return default configuration
     */
    public static BastionConfig defaults() {
        return builder().build();
    }

    /**
     * Reads a configuration from a JSON object. Absent options keep their defaults.
     *
     * @param in JSON stream, not closed by this method
     * @return the configuration
     * @throws IllegalArgumentException if the document is malformed or a value is out of range
     * @throws UncheckedIOException if the stream cannot be read
     */
    public static BastionConfig load(InputStream in) {
        JsonNode root;
        try {
            root = MAPPER.readTree(in);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Configuration is not valid JSON", e);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read configuration", e);
        }
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Configuration must be a JSON object");
        }

        Builder builder = builder();
        if (root.has("name")) builder.name(root.get("name").asText());
        if (root.has("capacityBytes")) builder.capacityBytes(root.get("capacityBytes").asLong());
        if (root.has("maxEntries")) builder.maxEntries(root.get("maxEntries").asInt());
        if (root.has("maxEntryBytes")) builder.maxEntryBytes(root.get("maxEntryBytes").asInt());
        if (root.has("defaultTtl")) builder.defaultTtl(read(root.get("defaultTtl"), Duration.class));
        if (root.has("sweepInterval")) builder.sweepInterval(read(root.get("sweepInterval"), Duration.class));
        if (root.has("maxSweepRemovals")) builder.maxSweepRemovals(root.get("maxSweepRemovals").asInt());
        if (root.has("recencyWeight")) builder.recencyWeight(root.get("recencyWeight").asDouble());
        if (root.has("frequencyWeight")) builder.frequencyWeight(root.get("frequencyWeight").asDouble());
        if (root.has("rateLimitCount")) builder.rateLimitCount(root.get("rateLimitCount").asInt());
        if (root.has("rateLimitWindow")) builder.rateLimitWindow(read(root.get("rateLimitWindow"), Duration.class));
        if (root.has("idleWindowMultiplier")) builder.idleWindowMultiplier(root.get("idleWindowMultiplier").asInt());
        if (root.has("maxTrackedWindows")) builder.maxTrackedWindows(root.get("maxTrackedWindows").asInt());
        if (root.has("maxQueryTextLength")) builder.maxQueryTextLength(root.get("maxQueryTextLength").asInt());
        if (root.has("maxQueryComplexity")) builder.maxQueryComplexity(root.get("maxQueryComplexity").asInt());
        if (root.has("injectionPatterns")) builder.injectionPatterns(root.get("injectionPatterns").asText());
        if (root.has("requestQueueCapacity")) builder.requestQueueCapacity(root.get("requestQueueCapacity").asInt());

        JsonNode overrides = root.get("rateLimitOverrides");
        if (overrides != null && !overrides.isNull()) {
            if (!overrides.isObject()) {
                throw new IllegalArgumentException("rateLimitOverrides must be an object");
            }
            Iterator<Map.Entry<String, JsonNode>> fields = overrides.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                builder.rateLimitOverride(field.getKey(), read(field.getValue(), RatePolicy.class));
            }
        }
        return builder.build();
    }

    private static <T> T read(JsonNode node, Class<T> type) {
        try {
            return MAPPER.treeToValue(node, type);
        } catch (IOException e) {
            throw new IllegalArgumentException("Invalid " + type.getSimpleName() + " value: " + node, e);
        }
    }

    /**
     * Returns the cache settings of this configuration.
     * @return cache configuration
     */
    public CacheConfig cacheConfig() {
        return new CacheConfig(name, capacityBytes, maxEntries, maxEntryBytes, defaultTtl,
                new EvictionWeights(recencyWeight, frequencyWeight), maxSweepRemovals);
    }

    public RatePolicy defaultRatePolicy() {
        return RatePolicy.of(rateLimitCount, rateLimitWindow);
    }

    /**
     * Builder for BastionConfig.
     */
    public static class Builder {
        private String name = "bastion";
        private long capacityBytes = CacheConfig.DEFAULT_CAPACITY_BYTES;
        private int maxEntries = CacheConfig.DEFAULT_MAX_ENTRIES;
        private int maxEntryBytes = CacheConfig.DEFAULT_MAX_ENTRY_BYTES;
        private Duration defaultTtl = CacheConfig.DEFAULT_TTL;
        private Duration sweepInterval = DEFAULT_SWEEP_INTERVAL;
        private int maxSweepRemovals = CacheConfig.DEFAULT_MAX_SWEEP_REMOVALS;
        private double recencyWeight = EvictionWeights.DEFAULT.recencyWeight();
        private double frequencyWeight = EvictionWeights.DEFAULT.frequencyWeight();
        private int rateLimitCount = RatePolicy.DEFAULT.limit();
        private Duration rateLimitWindow = RatePolicy.DEFAULT.window();
        private final Map<String, RatePolicy> rateLimitOverrides = new HashMap<>();
        private int idleWindowMultiplier = DEFAULT_IDLE_WINDOW_MULTIPLIER;
        private int maxTrackedWindows = DEFAULT_MAX_TRACKED_WINDOWS;
        private int maxQueryTextLength = QueryGuard.DEFAULT_MAX_TEXT_LENGTH;
        private int maxQueryComplexity = QueryGuard.DEFAULT_MAX_COMPLEXITY;
        private String injectionPatterns = QueryGuard.DEFAULT_RULES_RESOURCE;
        private int requestQueueCapacity = RequestQueue.DEFAULT_CAPACITY;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder capacityBytes(long capacityBytes) {
            this.capacityBytes = capacityBytes;
            return this;
        }

        public Builder maxEntries(int maxEntries) {
            this.maxEntries = maxEntries;
            return this;
        }

        public Builder maxEntryBytes(int maxEntryBytes) {
            this.maxEntryBytes = maxEntryBytes;
            return this;
        }

        public Builder defaultTtl(Duration defaultTtl) {
            this.defaultTtl = defaultTtl;
            return this;
        }

        public Builder sweepInterval(Duration sweepInterval) {
            this.sweepInterval = sweepInterval;
            return this;
        }

        public Builder maxSweepRemovals(int maxSweepRemovals) {
            this.maxSweepRemovals = maxSweepRemovals;
            return this;
        }

        public Builder recencyWeight(double recencyWeight) {
            this.recencyWeight = recencyWeight;
            return this;
        }

        public Builder frequencyWeight(double frequencyWeight) {
            this.frequencyWeight = frequencyWeight;
            return this;
        }

        public Builder rateLimitCount(int rateLimitCount) {
            this.rateLimitCount = rateLimitCount;
            return this;
        }

        public Builder rateLimitWindow(Duration rateLimitWindow) {
            this.rateLimitWindow = rateLimitWindow;
            return this;
        }

        /**
         * Overrides the rate policy of one operation class.
         *
         * @param operationClass operation class, e.g. {@code "generate"}
         * @param policy the policy
         * @return this builder
         */
        public Builder rateLimitOverride(String operationClass, RatePolicy policy) {
            Objects.requireNonNull(operationClass, "operationClass must not be null");
            this.rateLimitOverrides.put(operationClass, Objects.requireNonNull(policy, "policy must not be null"));
            return this;
        }

        public Builder idleWindowMultiplier(int idleWindowMultiplier) {
            this.idleWindowMultiplier = idleWindowMultiplier;
            return this;
        }

        public Builder maxTrackedWindows(int maxTrackedWindows) {
            this.maxTrackedWindows = maxTrackedWindows;
            return this;
        }

        public Builder maxQueryTextLength(int maxQueryTextLength) {
            this.maxQueryTextLength = maxQueryTextLength;
            return this;
        }

        /**
         * Sets the complexity ceiling for query text; see {@link QueryGuard#complexity(String, int)}.
         * @param maxQueryComplexity positive ceiling
         * @return this builder
         */
        public Builder maxQueryComplexity(int maxQueryComplexity) {
            this.maxQueryComplexity = maxQueryComplexity;
            return this;
        }

        /**
         * Sets the classpath resource holding the injection rule set.
         * @param resource resource path, without a leading slash
         * @return this builder
         */
        public Builder injectionPatterns(String resource) {
            this.injectionPatterns = resource;
            return this;
        }

        public Builder requestQueueCapacity(int requestQueueCapacity) {
            this.requestQueueCapacity = requestQueueCapacity;
            return this;
        }

        public BastionConfig build() {
            return new BastionConfig(name, capacityBytes, maxEntries, maxEntryBytes, defaultTtl,
                    sweepInterval, maxSweepRemovals, recencyWeight, frequencyWeight,
                    rateLimitCount, rateLimitWindow, rateLimitOverrides, idleWindowMultiplier,
                    maxTrackedWindows, maxQueryTextLength, maxQueryComplexity, injectionPatterns,
                    requestQueueCapacity);
        }
    }
}
