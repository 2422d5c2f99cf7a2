package io.bastion.core;

import io.bastion.core.stats.StatsSnapshot;

/**
 * Point-in-time statistics across all Bastion components.
 *
 * @param cache cache statistics
 * @param trackedWindows rate windows currently held in memory
 * @param deniedCount requests denied by the rate limiter
 * @param rejectedQueries query texts rejected by the guard
 * @param ruleCount injection rules loaded
 *
 * @since 1.0.0
 */
public record BastionStats(
        StatsSnapshot cache,
        long trackedWindows,
        long deniedCount,
        long rejectedQueries,
        int ruleCount
) {

    @Override
    public String toString() {
        return String.format(
                "BastionStats[%s, windows=%d, denied=%d, rejectedQueries=%d, rules=%d]",
                cache, trackedWindows, deniedCount, rejectedQueries, ruleCount);
    }
}
