package io.bastion.core.cache;

import io.bastion.core.key.KeyHash;

import java.time.Instant;

/**
 * Read-only metadata of a resident entry, without its value.
 *
 * @since 1.0.0
 */
public record EntryView(
        KeyHash keyHash,
        int sizeBytes,
        long createdAtMillis,
        long expiresAtMillis,
        long accessCount,
        long lastAccessAtMillis
) {

    public Instant createdAt() {
        return Instant.ofEpochMilli(createdAtMillis);
    }

    public Instant expiresAt() {
        return Instant.ofEpochMilli(expiresAtMillis);
    }

    public Instant lastAccessAt() {
        return Instant.ofEpochMilli(lastAccessAtMillis);
    }
}
