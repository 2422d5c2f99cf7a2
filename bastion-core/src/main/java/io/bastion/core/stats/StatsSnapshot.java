package io.bastion.core.stats;

/**
 * Immutable snapshot of cache statistics at a point in time.
 *
 * @param entryCount number of resident entries
 * @param residentBytes sum of resident entry sizes
 * @param capacityBytes configured byte ceiling
 * @param hits lookups served from the cache
 * @param misses lookups that found nothing (or only an expired entry)
 * @param evictions entries removed under capacity pressure
 * @param expirations entries removed because their TTL elapsed
 * @param rejections values refused for exceeding the entry size limit
 *
 * @since 1.0.0
 */
public record StatsSnapshot(
        long entryCount,
        long residentBytes,
        long capacityBytes,
        long hits,
        long misses,
        long evictions,
        long expirations,
        long rejections
) {

    public long requests() {
        return hits + misses;
    }

    public double hitRate() {
        long req = requests();
        return req == 0 ? 0.0 : (double) hits / req;
    }

    /**
     * Fraction of the byte capacity currently in use.
     * @return utilisation between 0.0 and 1.0
     */
    public double utilisation() {
        return capacityBytes == 0 ? 0.0 : (double) residentBytes / capacityBytes;
    }

    @Override
    public String toString() {
        return String.format("CacheStats[entries=%d, bytes=%d/%d, hits=%d, misses=%d, evictions=%d, "
                        + "expirations=%d, rejections=%d, hitRate=%.2f%%]",
                entryCount, residentBytes, capacityBytes, hits, misses, evictions,
                expirations, rejections, hitRate() * 100);
    }
}
