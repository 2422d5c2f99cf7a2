package io.bastion.core.lifecycle;

/**
 * Interface for in-memory structures swept by {@link ResourceSweeper}.
 *
 * <p>Implementors hold state that can go stale without anyone reading it
 * again (expired cache entries, idle rate windows) and release it when asked,
 * so their memory stays bounded under adversarial or one-off traffic.</p>
 *
 * @since 1.0.0
 */
public interface ManagedResource {

    /**
     * Returns the unique name of this resource.
     * @return resource name
     */
    String name();

    /**
     * Returns the estimated memory usage in bytes.
     * <p>This is an approximation used for monitoring.</p>
     * @return estimated bytes used
     */
    long estimatedMemoryBytes();

    /**
     * Returns the number of items currently held.
     * @return item count
     */
    long itemCount();

    /**
     * Releases all items.
     * @return number of items cleared
     */
    long releaseAll();

    /**
     * Releases expired or stale items only, keeping valid data.
     * <p>Implementations bound the work done per call.</p>
     * @return number of items released
     */
    long releaseExpired();

    /**
     * Returns the timestamp of the last access (read or write).
     * @return last access time in milliseconds since epoch
     */
    long lastAccessTimeMillis();

    /**
     * Returns true if this resource is currently empty.
     * @return true if empty
     */
    default boolean isEmpty() {
        return itemCount() == 0;
    }
}
