package io.bastion.core.queue;

/**
 * Point-in-time view of a {@link RequestQueue}.
 *
 * @param size requests currently queued
 * @param high queued at {@link RequestPriority#HIGH}
 * @param normal queued at {@link RequestPriority#NORMAL}
 * @param low queued at {@link RequestPriority#LOW}
 * @param enqueued requests accepted since creation
 * @param rejectedFull offers refused because the queue was full
 * @param rejectedRateLimited offers refused by the rate limiter
 * @since 1.0.0
 */
public record QueueStats(
        int size,
        int high,
        int normal,
        int low,
        long enqueued,
        long rejectedFull,
        long rejectedRateLimited
) {

    public long rejected() {
        return rejectedFull + rejectedRateLimited;
    }
}
