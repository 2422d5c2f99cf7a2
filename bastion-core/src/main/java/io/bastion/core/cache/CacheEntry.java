package io.bastion.core.cache;

import io.bastion.core.key.KeyHash;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Resident cache entry. Owned by {@link ScoredCache}; never handed out.
 *
 * <p>Structural fields are final. Access metadata is updated by readers holding
 * only the read lock, hence the atomic/volatile fields.</p>
 */
final class CacheEntry {

    private final KeyHash key;
    private final byte[] value;
    private final long createdAt;
    private final long expiresAt;
    private final AtomicLong accessCount;
    private volatile long lastAccessAt;
    private volatile long accessSequence;
    private final long insertion;
    private volatile EvictionRank rank;

    CacheEntry(KeyHash key, byte[] value, long createdAt, long expiresAt,
               long inheritedAccessCount, long sequence) {
        this.key = key;
        this.value = value;
        this.createdAt = createdAt;
        this.expiresAt = expiresAt;
        this.accessCount = new AtomicLong(inheritedAccessCount);
        this.lastAccessAt = createdAt;
        this.accessSequence = sequence;
        this.insertion = sequence;
    }

    KeyHash key() {
        return key;
    }

    int sizeBytes() {
        return value.length;
    }

    long createdAt() {
        return createdAt;
    }

    long expiresAt() {
        return expiresAt;
    }

    long accessCount() {
        return accessCount.get();
    }

    long lastAccessAt() {
        return lastAccessAt;
    }

    long accessSequence() {
        return accessSequence;
    }

    /** Sequence drawn when the entry was stored; never changes. */
    long insertion() {
        return insertion;
    }

    EvictionRank rank() {
        return rank;
    }

    void rank(EvictionRank rank) {
        this.rank = rank;
    }

    boolean isExpired(long nowMillis) {
        return nowMillis >= expiresAt;
    }

    void recordAccess(long nowMillis, long sequence) {
        accessCount.incrementAndGet();
        lastAccessAt = nowMillis;
        accessSequence = sequence;
    }

    byte[] copyValue() {
        return value.clone();
    }

    EntryView view() {
        return new EntryView(key, value.length, createdAt, expiresAt, accessCount.get(), lastAccessAt);
    }
}
