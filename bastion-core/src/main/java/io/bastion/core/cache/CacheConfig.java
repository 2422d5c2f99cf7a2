package io.bastion.core.cache;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable configuration for {@link ScoredCache} instances.
 *
 * <p>Use the builder pattern for fluent configuration:</p>
 * <pre>{@code
 * CacheConfig config = CacheConfig.builder()
 *     .name("lesson-plans")
 *     .capacityBytes(64L * 1024 * 1024)
 *     .maxEntryBytes(1024 * 1024)
 *     .defaultTtl(Duration.ofMinutes(5))
 *     .build();
 * }</pre>
 *
 * @param name cache name used in logs, events and sweeper registration
 * @param capacityBytes hard ceiling on the sum of resident entry sizes
 * @param maxEntries hard ceiling on the number of resident entries
 * @param maxEntryBytes largest value accepted by {@code set}
 * @param defaultTtl TTL applied when {@code set} omits one
 * @param weights eviction score weights
 * @param maxSweepRemovals upper bound on entries removed per background sweep
 *
 * @since 1.0.0
 */
public record CacheConfig(
        String name,
        long capacityBytes,
        int maxEntries,
        int maxEntryBytes,
        Duration defaultTtl,
        EvictionWeights weights,
        int maxSweepRemovals
) {

    /** Default capacity: 64 MiB. */
    public static final long DEFAULT_CAPACITY_BYTES = 64L * 1024 * 1024;

    /** Default max entries: 10 000. */
    public static final int DEFAULT_MAX_ENTRIES = 10_000;

    /** Default per-entry ceiling: 1 MiB. */
    public static final int DEFAULT_MAX_ENTRY_BYTES = 1024 * 1024;

    /** Default TTL: 5 minutes. */
    public static final Duration DEFAULT_TTL = Duration.ofMinutes(5);

    /** Default number of expired entries a single sweep may remove. */
    public static final int DEFAULT_MAX_SWEEP_REMOVALS = 1024;

    public CacheConfig {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(defaultTtl, "defaultTtl must not be null");
        Objects.requireNonNull(weights, "weights must not be null");
        if (capacityBytes <= 0) {
            throw new IllegalArgumentException("capacityBytes must be positive");
        }
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("maxEntries must be positive");
        }
        if (maxEntryBytes <= 0) {
            throw new IllegalArgumentException("maxEntryBytes must be positive");
        }
        if (maxEntryBytes > capacityBytes) {
            throw new IllegalArgumentException("maxEntryBytes must not exceed capacityBytes");
        }
        if (defaultTtl.isNegative() || defaultTtl.isZero()) {
            throw new IllegalArgumentException("defaultTtl must be positive");
        }
        if (maxSweepRemovals <= 0) {
            throw new IllegalArgumentException("maxSweepRemovals must be positive");
        }
    }

    /**
     * Creates a new builder for CacheConfig.
     * @return a new builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a default configuration with the given name.
     * @param name the cache name
     * @return default configuration
     */
    public static CacheConfig defaultConfig(String name) {
        return builder().name(name).build();
    }

    /**
     * Builder for CacheConfig.
     */
    public static class Builder {
        private String name = "cache";
        private long capacityBytes = DEFAULT_CAPACITY_BYTES;
        private int maxEntries = DEFAULT_MAX_ENTRIES;
        private int maxEntryBytes = DEFAULT_MAX_ENTRY_BYTES;
        private Duration defaultTtl = DEFAULT_TTL;
        private EvictionWeights weights = EvictionWeights.DEFAULT;
        private int maxSweepRemovals = DEFAULT_MAX_SWEEP_REMOVALS;

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

        public Builder weights(EvictionWeights weights) {
            this.weights = weights;
            return this;
        }

        public Builder weights(double recencyWeight, double frequencyWeight) {
            this.weights = new EvictionWeights(recencyWeight, frequencyWeight);
            return this;
        }

        public Builder maxSweepRemovals(int maxSweepRemovals) {
            this.maxSweepRemovals = maxSweepRemovals;
            return this;
        }

        public CacheConfig build() {
            return new CacheConfig(name, capacityBytes, maxEntries, maxEntryBytes,
                    defaultTtl, weights, maxSweepRemovals);
        }
    }
}
