package io.bastion.core.cache;

import io.bastion.core.key.KeyHash;

/**
 * Position of an entry in the eviction order. Immutable; a touched entry gets a new rank.
 *
 * <p>Lowest retention is evicted first. Sequences are unique, so on equal
 * retention the entry touched longest ago goes first and no two ranks compare equal.</p>
 */
record EvictionRank(double retention, long sequence, KeyHash key) implements Comparable<EvictionRank> {

    @Override
    public int compareTo(EvictionRank other) {
        int byRetention = Double.compare(retention, other.retention);
        return byRetention != 0 ? byRetention : Long.compare(sequence, other.sequence);
    }
}
