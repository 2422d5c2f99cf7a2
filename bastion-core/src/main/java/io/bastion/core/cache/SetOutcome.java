package io.bastion.core.cache;

/**
 * Result of a {@link Cache#set} call.
 *
 * <p>Both statuses are normal outcomes. {@link Status#REJECTED_TOO_LARGE} means
 * the caller should carry on uncached; a non-zero {@link #evicted()} reports
 * that capacity pressure removed other entries to make room.</p>
 *
 * @param status whether the value was stored
 * @param sizeBytes size of the offered value
 * @param evicted entries evicted by score to make room
 * @param expiredPurged expired entries removed while making room
 *
 * @since 1.0.0
 */
public record SetOutcome(Status status, int sizeBytes, int evicted, int expiredPurged) {

    /**
     * Outcome of a set.
     */
    public enum Status {
        /** The value is resident. */
        STORED,
        /** The value exceeded the per-entry ceiling and was not cached. */
        REJECTED_TOO_LARGE
    }

    static SetOutcome stored(int sizeBytes, int evicted, int expiredPurged) {
        return new SetOutcome(Status.STORED, sizeBytes, evicted, expiredPurged);
    }

    static SetOutcome tooLarge(int sizeBytes) {
        return new SetOutcome(Status.REJECTED_TOO_LARGE, sizeBytes, 0, 0);
    }

    public boolean isStored() {
        return status == Status.STORED;
    }

    public boolean isTooLarge() {
        return status == Status.REJECTED_TOO_LARGE;
    }

    public boolean evictionOccurred() {
        return evicted > 0;
    }
}
