package io.bastion.core.ratelimit;

import java.time.Duration;

/**
 * Throttling threshold: at most {@code limit} operations per {@code window}.
 *
 * @since 1.0.0
 */
public record RatePolicy(int limit, Duration window) {

    /** Default policy: 1000 operations per 60-second window. */
    public static final RatePolicy DEFAULT = new RatePolicy(1000, Duration.ofSeconds(60));

    public RatePolicy {
        if (limit <= 0 || limit == Integer.MAX_VALUE) {
            throw new IllegalArgumentException("limit must be between 1 and " + (Integer.MAX_VALUE - 1));
        }
        if (window == null || window.isNegative() || window.isZero()) {
            throw new IllegalArgumentException("window must be positive");
        }
    }

    public static RatePolicy of(int limit, Duration window) {
        return new RatePolicy(limit, window);
    }

    long windowMillis() {
        return Math.max(1L, window.toMillis());
    }
}
