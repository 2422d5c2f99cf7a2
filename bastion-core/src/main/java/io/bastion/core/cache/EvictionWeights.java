package io.bastion.core.cache;

/**
 * Weights of the hybrid recency/frequency eviction score.
 *
 * <p>{@code score = recencyWeight * idleSeconds - frequencyWeight * ln(1 + accessCount)}.
 * The entry with the highest score is the least valuable and is evicted first.
 * A zero frequency weight degenerates to LRU; a zero recency weight to LFU.</p>
 *
 * @param recencyWeight score added per second since the last access
 * @param frequencyWeight score removed per unit of {@code ln(1 + accessCount)}
 *
 * @since 1.0.0
 */
public record EvictionWeights(double recencyWeight, double frequencyWeight) {

    /** One idle second is worth about a tenth of the first access. */
    public static final EvictionWeights DEFAULT = new EvictionWeights(1.0, 10.0);

    public EvictionWeights {
        if (!Double.isFinite(recencyWeight) || recencyWeight < 0
                || !Double.isFinite(frequencyWeight) || frequencyWeight < 0) {
            throw new IllegalArgumentException("weights must be finite non-negative numbers");
        }
        if (recencyWeight == 0 && frequencyWeight == 0) {
            throw new IllegalArgumentException("at least one weight must be positive");
        }
    }

    /**
     * Scores an entry.
     *
     * @param nowMillis current time
     * @param lastAccessMillis time of the entry's last access (or insertion)
     * @param accessCount number of hits on the entry
     * @return eviction score, higher means evict sooner
     */
    public double score(long nowMillis, long lastAccessMillis, long accessCount) {
        double idleSeconds = Math.max(0L, nowMillis - lastAccessMillis) / 1000.0;
        return recencyWeight * idleSeconds - frequencyWeight * Math.log1p(accessCount);
    }

    /**
     * Scores an entry without the current time. With offsets taken from a common
     * origin, {@code score(now, l, c) == recencyWeight * (now - origin) / 1000 - retention(l - origin, c)},
     * so ascending retention orders entries the same way descending score does, at any instant.
     *
     * @param lastAccessOffsetMillis last access, relative to any fixed origin
     * @param accessCount number of hits on the entry
     * @return retention value, lower means evict sooner
     */
    public double retention(long lastAccessOffsetMillis, long accessCount) {
        return recencyWeight * (lastAccessOffsetMillis / 1000.0) + frequencyWeight * Math.log1p(accessCount);
    }
}
