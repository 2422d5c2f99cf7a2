package io.bastion.core.cache;

import io.bastion.core.event.Event;
import io.bastion.core.key.KeyHash;

import java.time.Instant;

/**
 * Published when an entry leaves a cache for any reason other than an explicit invalidate.
 *
 * @since 1.0.0
 */
public record EntryEvictedEvent(
        String cacheName,
        KeyHash keyHash,
        int sizeBytes,
        Reason reason,
        Instant timestamp
) implements Event {

    /**
     * Why the entry was removed.
     */
    public enum Reason {
        /** Removed by score to satisfy the byte or entry ceiling. */
        CAPACITY,
        /** Removed because its TTL elapsed. */
        EXPIRED
    }
}
