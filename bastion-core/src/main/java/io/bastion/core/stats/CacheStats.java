package io.bastion.core.stats;

/**
 * Interface for cache statistics reporting.
 *
 * <p>Implementations use thread-safe counters (LongAdder) so that reading
 * statistics never contends with the cache lock.</p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * StatsSnapshot stats = cache.stats().snapshot();
 * log.info("cache {}: {} entries, {} bytes, hit rate {}",
 *     cache.name(), stats.entryCount(), stats.residentBytes(), stats.hitRate());
 * }</pre>
 *
 * @since 1.0.0
 */
public interface CacheStats {

    /**
     * Returns the number of cache hits.
     * @return total hit count since cache creation or last reset
     */
    long hitCount();

    /**
     * Returns the number of cache misses, expired lookups included.
     * @return total miss count since cache creation or last reset
     */
    long missCount();

    /**
     * Returns the total number of cache lookups (hits + misses).
     * @return total request count
     */
    default long requestCount() {
        return hitCount() + missCount();
    }

    /**
     * Returns the cache hit rate as a ratio between 0.0 and 1.0.
     * @return hit rate, or 0.0 if no requests have been made
     */
    default double hitRate() {
        long requests = requestCount();
        return requests == 0 ? 0.0 : (double) hitCount() / requests;
    }

    /**
     * Returns the current number of entries in the cache.
     * @return entry count
     */
    long entryCount();

    /**
     * Returns the sum of the sizes of all resident entries.
     * @return resident bytes
     */
    long residentBytes();

    /**
     * Returns the configured byte ceiling.
     * @return capacity in bytes
     */
    long capacityBytes();

    /**
     * Returns the number of entries removed to relieve capacity pressure.
     * @return eviction count
     */
    long evictionCount();

    /**
     * Returns the number of entries removed because their TTL elapsed.
     * @return expiration count
     */
    long expirationCount();

    /**
     * Returns the number of values refused because they exceeded the entry size limit.
     * @return rejection count
     */
    long rejectionCount();

    /**
     * Resets the hit/miss/eviction counters. Byte and entry accounting is unaffected.
     */
    void reset();

    /**
     * Returns a snapshot of the current statistics.
     * @return immutable stats snapshot
     */
    default StatsSnapshot snapshot() {
        return new StatsSnapshot(entryCount(), residentBytes(), capacityBytes(),
                hitCount(), missCount(), evictionCount(), expirationCount(), rejectionCount());
    }
}
