package io.bastion.core.cache;

import io.bastion.core.key.KeyEncodingException;
import io.bastion.core.stats.CacheStats;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Byte-bounded cache keyed by structured key parts.
 *
 * <p>Keys are lists of parts (strings, numbers, enums, collections, records...)
 * that the cache canonicalizes and hashes; callers never build string keys by
 * concatenation. Values are byte arrays, copied on the way in and out.</p>
 *
 * <p>All implementations are thread-safe.</p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * List<Object> key = List.of("lesson_plans_by_subject", subject, gradeLevel, limit);
 *
 * Optional<byte[]> cached = cache.get(key);
 * if (cached.isEmpty()) {
 *     byte[] rendered = render(loadFromDatabase());
 *     cache.set(key, rendered);   // REJECTED_TOO_LARGE is fine, just uncached
 * }
 * }</pre>
 *
 * @since 1.0.0
 */
public interface Cache {

    /**
     * Returns a copy of the value for the key if present and not expired.
     *
     * @param keyParts ordered key parts
     * @return the value, or empty on miss
     * @throws KeyEncodingException if the key cannot be canonicalized
     */
    Optional<byte[]> get(List<?> keyParts);

    /**
     * Returns the cached value, computing and caching it if absent.
     *
     * <p>The loader runs outside the cache lock. A computed value that is too
     * large to cache is still returned.</p>
     *
     * @param keyParts ordered key parts
     * @param loader computes the value on a miss; may return null
     * @return the cached or computed value, or null if the loader returned null
     * @throws KeyEncodingException if the key cannot be canonicalized
     */
    byte[] get(List<?> keyParts, Supplier<byte[]> loader);

    /**
     * Stores a value with the default TTL.
     *
     * @param keyParts ordered key parts
     * @param value the value, copied
     * @return the outcome
     * @throws KeyEncodingException if the key cannot be canonicalized
     */
    SetOutcome set(List<?> keyParts, byte[] value);

    /**
     * Stores a value with an explicit TTL.
     *
     * @param keyParts ordered key parts
     * @param value the value, copied
     * @param ttl positive time-to-live
     * @return the outcome
     * @throws KeyEncodingException if the key cannot be canonicalized
     */
    SetOutcome set(List<?> keyParts, byte[] value, Duration ttl);

    /**
     * Removes the entry for the key if present.
     *
     * @param keyParts ordered key parts
     * @throws KeyEncodingException if the key cannot be canonicalized
     */
    void invalidate(List<?> keyParts);

    /**
     * Removes all entries from the cache.
     */
    void invalidateAll();

    /**
     * Returns metadata of a live entry without counting a hit or miss.
     *
     * @param keyParts ordered key parts
     * @return entry metadata, or empty if absent or expired
     */
    Optional<EntryView> describe(List<?> keyParts);

    /**
     * Returns statistics for this cache.
     *
     * @return cache statistics
     */
    CacheStats stats();

    /**
     * Returns the name of this cache.
     *
     * @return cache name
     */
    String name();
}
