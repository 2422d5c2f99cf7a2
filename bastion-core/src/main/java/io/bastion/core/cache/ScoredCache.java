package io.bastion.core.cache;

import io.bastion.core.event.EventBus;
import io.bastion.core.key.KeyHash;
import io.bastion.core.key.KeyHasher;
import io.bastion.core.lifecycle.ManagedResource;
import io.bastion.core.stats.CacheStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableSet;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentSkipListSet;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Thread-safe byte-bounded cache with TTL and hybrid recency/frequency eviction.
 *
 * <p>When admitting an entry would exceed the byte capacity or the entry ceiling,
 * expired entries are purged first and then the entries with the highest
 * {@link EvictionWeights#score eviction score} are removed until the new entry
 * fits. Expiration is checked lazily on every access and proactively by a
 * {@link io.bastion.core.lifecycle.ResourceSweeper} through {@link #releaseExpired()}.</p>
 *
 * <p>Two ordered indexes back this: entries by expiry time, and entries by
 * {@link EvictionWeights#retention retention}, which ranks them like the score
 * but does not change as time passes. A hit repositions its entry; purging and
 * evicting take entries from the front, so a {@code set} under pressure costs
 * O(log n) per removed entry rather than a scan of the table.</p>
 *
 * <h2>Features</h2>
 * <ul>
 *   <li>Byte capacity and entry-count ceilings that hold after every mutation</li>
 *   <li>Per-entry size gate: oversized values are refused, not truncated</li>
 *   <li>Collision-resistant keys via {@link KeyHasher}</li>
 *   <li>ReadWriteLock: concurrent readers, exclusive writers</li>
 *   <li>Lock-free statistics with LongAdder</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * ScoredCache cache = ScoredCache.builder()
 *     .config(CacheConfig.builder()
 *         .name("curriculum")
 *         .capacityBytes(16L * 1024 * 1024)
 *         .defaultTtl(Duration.ofMinutes(30))
 *         .build())
 *     .build();
 *
 * byte[] structure = cache.get(List.of("curriculum_structure", countryId, subjectId),
 *     () -> render(loadStructure(countryId, subjectId)));
 * }</pre>
 *
 * @since 1.0.0
 */
public class ScoredCache implements Cache, CacheStats, ManagedResource {

    private static final Logger log = LoggerFactory.getLogger(ScoredCache.class);

    /** Rough per-entry bookkeeping cost used for memory estimates. */
    static final int ENTRY_OVERHEAD_BYTES = 160;

    private final Map<KeyHash, CacheEntry> entries = new HashMap<>();
    // Changed only under the write lock
    private final NavigableSet<CacheEntry> expiryOrder = new TreeSet<>(
            Comparator.comparingLong(CacheEntry::expiresAt).thenComparingLong(CacheEntry::insertion));
    // Hits reposition entries while holding only the read lock
    private final NavigableSet<EvictionRank> evictionOrder = new ConcurrentSkipListSet<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final CacheConfig config;
    private final KeyHasher keyHasher;
    private final Clock clock;
    private final EventBus eventBus;

    // Guarded by lock
    private long residentBytes;

    private final AtomicLong accessSequence = new AtomicLong();
    private final long originMillis;
    private volatile long lastAccessMillis;

    // Statistics
    private final LongAdder hits = new LongAdder();
    private final LongAdder misses = new LongAdder();
    private final LongAdder evictions = new LongAdder();
    private final LongAdder expirations = new LongAdder();
    private final LongAdder rejections = new LongAdder();
    private final LongAdder examined = new LongAdder();

    private ScoredCache(Builder builder) {
        this.config = builder.config;
        this.keyHasher = builder.keyHasher;
        this.clock = builder.clock;
        this.eventBus = builder.eventBus;
        this.originMillis = clock.millis();
        this.lastAccessMillis = originMillis;
    }

    /**
     * Creates a new builder for ScoredCache.
     * @return a new builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    @Override
    public Optional<byte[]> get(List<?> keyParts) {
        KeyHash key = keyHasher.hash(keyParts);
        long now = clock.millis();
        lastAccessMillis = now;

        boolean sawExpired;
        lock.readLock().lock();
        try {
            CacheEntry entry = entries.get(key);
            if (entry != null && !entry.isExpired(now)) {
                touch(entry, now);
                hits.increment();
                return Optional.of(entry.copyValue());
            }
            sawExpired = entry != null;
        } finally {
            lock.readLock().unlock();
        }

        misses.increment();
        if (sawExpired) {
            removeIfExpired(key, now);
        }
        return Optional.empty();
    }

    @Override
    public byte[] get(List<?> keyParts, Supplier<byte[]> loader) {
        Objects.requireNonNull(loader, "loader must not be null");
        Optional<byte[]> cached = get(keyParts);
        if (cached.isPresent()) {
            return cached.get();
        }
        byte[] value = loader.get();
        if (value != null) {
            set(keyParts, value);
        }
        return value;
    }

    @Override
    public SetOutcome set(List<?> keyParts, byte[] value) {
        return set(keyParts, value, config.defaultTtl());
    }

    @Override
    public SetOutcome set(List<?> keyParts, byte[] value, Duration ttl) {
        Objects.requireNonNull(value, "value must not be null");
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
        KeyHash key = keyHasher.hash(keyParts);
        long now = clock.millis();
        lastAccessMillis = now;
        int size = value.length;

        if (size > config.maxEntryBytes()) {
            rejections.increment();
            // A refused overwrite must not leave the previous value readable
            invalidate(key);
            log.debug("[BASTION] Cache '{}' refused {} bytes for key {} (max {})",
                    config.name(), size, key.shortHex(), config.maxEntryBytes());
            return SetOutcome.tooLarge(size);
        }

        byte[] copy = value.clone();
        long expiresAt = saturatedAdd(now, ttl.toMillis());
        List<EntryEvictedEvent> removed = new ArrayList<>();
        int evicted;
        int purged;

        lock.writeLock().lock();
        try {
            long inheritedAccessCount = 0;
            CacheEntry previous = entries.get(key);
            if (previous != null) {
                detach(previous);
                if (!previous.isExpired(now)) {
                    inheritedAccessCount = previous.accessCount();
                }
            }

            purged = 0;
            evicted = 0;
            if (!hasRoomFor(size)) {
                purged = purgeExpired(now, Integer.MAX_VALUE, removed);
            }
            if (!hasRoomFor(size)) {
                evicted = evictByScore(size, now, removed);
            }
            if (!hasRoomFor(size)) {
                throw new IllegalStateException("Cache '" + config.name()
                        + "' could not make room for " + size + " bytes");
            }

            attach(new CacheEntry(key, copy, now, expiresAt,
                    inheritedAccessCount, accessSequence.incrementAndGet()));
        } finally {
            lock.writeLock().unlock();
        }

        if (evicted > 0) {
            log.debug("[BASTION] Cache '{}' evicted {} entries to admit {} bytes",
                    config.name(), evicted, size);
        }
        removed.forEach(eventBus::publish);
        return SetOutcome.stored(size, evicted, purged);
    }

    @Override
    public void invalidate(List<?> keyParts) {
        invalidate(keyHasher.hash(keyParts));
    }

    private void invalidate(KeyHash key) {
        lock.writeLock().lock();
        try {
            CacheEntry entry = entries.get(key);
            if (entry != null) {
                detach(entry);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void invalidateAll() {
        releaseAll();
    }

    @Override
    public Optional<EntryView> describe(List<?> keyParts) {
        KeyHash key = keyHasher.hash(keyParts);
        long now = clock.millis();
        lock.readLock().lock();
        try {
            CacheEntry entry = entries.get(key);
            if (entry == null || entry.isExpired(now)) {
                return Optional.empty();
            }
            return Optional.of(entry.view());
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public CacheStats stats() {
        return this;
    }

    @Override
    public String name() {
        return config.name();
    }

    /**
     * Returns the configuration of this cache.
     * @return cache configuration
     */
    public CacheConfig config() {
        return config;
    }

    // Eviction internals, all called with the write lock held

    private boolean hasRoomFor(int size) {
        return residentBytes + size <= config.capacityBytes()
                && entries.size() < config.maxEntries();
    }

    private void attach(CacheEntry entry) {
        entry.rank(rankOf(entry));
        entries.put(entry.key(), entry);
        expiryOrder.add(entry);
        evictionOrder.add(entry.rank());
        residentBytes += entry.sizeBytes();
    }

    private void detach(CacheEntry entry) {
        entries.remove(entry.key());
        expiryOrder.remove(entry);
        evictionOrder.remove(entry.rank());
        residentBytes -= entry.sizeBytes();
    }

    private EvictionRank rankOf(CacheEntry entry) {
        double retention = config.weights().retention(
                entry.lastAccessAt() - originMillis, entry.accessCount());
        return new EvictionRank(retention, entry.accessSequence(), entry.key());
    }

    /**
     * Records a hit. Called under the read lock, so concurrent hits on the same
     * entry serialize on the entry to keep exactly one rank indexed.
     */
    private void touch(CacheEntry entry, long now) {
        synchronized (entry) {
            EvictionRank previous = entry.rank();
            entry.recordAccess(now, accessSequence.incrementAndGet());
            EvictionRank next = rankOf(entry);
            entry.rank(next);
            evictionOrder.remove(previous);
            evictionOrder.add(next);
        }
    }

    private int purgeExpired(long now, int limit, List<EntryEvictedEvent> removed) {
        int count = 0;
        while (count < limit && !expiryOrder.isEmpty()) {
            CacheEntry oldest = expiryOrder.first();
            examined.increment();
            if (!oldest.isExpired(now)) {
                break;
            }
            detach(oldest);
            expirations.increment();
            removed.add(event(oldest, EntryEvictedEvent.Reason.EXPIRED, now));
            count++;
        }
        return count;
    }

    private int evictByScore(int incomingSize, long now, List<EntryEvictedEvent> removed) {
        int count = 0;
        while (!hasRoomFor(incomingSize) && !evictionOrder.isEmpty()) {
            EvictionRank lowest = evictionOrder.first();
            examined.increment();
            CacheEntry victim = entries.get(lowest.key());
            if (victim == null || !lowest.equals(victim.rank())) {
                throw new IllegalStateException("Cache '" + config.name()
                        + "' eviction order is out of step at key " + lowest.key().shortHex());
            }
            detach(victim);
            evictions.increment();
            removed.add(event(victim, EntryEvictedEvent.Reason.CAPACITY, now));
            count++;
        }
        return count;
    }

    private void removeIfExpired(KeyHash key, long now) {
        EntryEvictedEvent expired = null;
        lock.writeLock().lock();
        try {
            // Re-check: another writer may have replaced the entry meanwhile
            CacheEntry entry = entries.get(key);
            if (entry != null && entry.isExpired(now)) {
                detach(entry);
                expirations.increment();
                expired = event(entry, EntryEvictedEvent.Reason.EXPIRED, now);
            }
        } finally {
            lock.writeLock().unlock();
        }
        if (expired != null) {
            eventBus.publish(expired);
        }
    }

    private EntryEvictedEvent event(CacheEntry entry, EntryEvictedEvent.Reason reason, long now) {
        return new EntryEvictedEvent(config.name(), entry.key(), entry.sizeBytes(), reason,
                Instant.ofEpochMilli(now));
    }

    private static long saturatedAdd(long a, long b) {
        long sum = a + b;
        return ((a ^ sum) & (b ^ sum)) < 0 ? Long.MAX_VALUE : sum;
    }

    // CacheStats implementation

    @Override
    public long hitCount() {
        return hits.sum();
    }

    @Override
    public long missCount() {
        return misses.sum();
    }

    @Override
    public long entryCount() {
        lock.readLock().lock();
        try {
            return entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public long residentBytes() {
        lock.readLock().lock();
        try {
            return residentBytes;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public long capacityBytes() {
        return config.capacityBytes();
    }

    @Override
    public long evictionCount() {
        return evictions.sum();
    }

    @Override
    public long expirationCount() {
        return expirations.sum();
    }

    @Override
    public long rejectionCount() {
        return rejections.sum();
    }

    /**
     * Entries inspected by expiry purges and evictions since creation.
     * @return examined entry count
     */
    long examinedCount() {
        return examined.sum();
    }

    @Override
    public void reset() {
        hits.reset();
        misses.reset();
        evictions.reset();
        expirations.reset();
        rejections.reset();
    }

    // ManagedResource implementation

    @Override
    public long estimatedMemoryBytes() {
        lock.readLock().lock();
        try {
            return residentBytes + (long) entries.size() * ENTRY_OVERHEAD_BYTES;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public long itemCount() {
        return entryCount();
    }

    @Override
    public long releaseAll() {
        lock.writeLock().lock();
        try {
            long count = entries.size();
            entries.clear();
            expiryOrder.clear();
            evictionOrder.clear();
            residentBytes = 0;
            return count;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public long releaseExpired() {
        long now = clock.millis();
        List<EntryEvictedEvent> removed = new ArrayList<>();
        int count;
        lock.writeLock().lock();
        try {
            count = purgeExpired(now, config.maxSweepRemovals(), removed);
        } finally {
            lock.writeLock().unlock();
        }
        removed.forEach(eventBus::publish);
        return count;
    }

    @Override
    public long lastAccessTimeMillis() {
        return lastAccessMillis;
    }

    /**
     * Builder for ScoredCache.
     */
    public static class Builder {
        private CacheConfig config = CacheConfig.defaultConfig("cache");
        private KeyHasher keyHasher;
        private Clock clock = Clock.systemUTC();
        private EventBus eventBus;

        public Builder config(CacheConfig config) {
            this.config = Objects.requireNonNull(config, "config must not be null");
            return this;
        }

        public Builder keyHasher(KeyHasher keyHasher) {
            this.keyHasher = keyHasher;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock must not be null");
            return this;
        }

        public Builder eventBus(EventBus eventBus) {
            this.eventBus = eventBus;
            return this;
        }

        public ScoredCache build() {
            if (keyHasher == null) {
                keyHasher = new KeyHasher();
            }
            if (eventBus == null) {
                eventBus = EventBus.create();
            }
            return new ScoredCache(this);
        }
    }
}
